package org.pragmatica.refactor.tree;

import java.nio.charset.StandardCharsets;

/**
 * Value of a bytes literal. Each char of {@code latin1} holds one byte.
 */
public record Bytes(String latin1) {

    public static Bytes of(byte[] data) {
        return new Bytes(new String(data, StandardCharsets.ISO_8859_1));
    }

    public byte[] toArray() {
        return latin1.getBytes(StandardCharsets.ISO_8859_1);
    }

    public int length() {
        return latin1.length();
    }
}
