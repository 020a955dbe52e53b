package org.pragmatica.refactor;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Identity and encoding of a source file.
 *
 * @param path     the file, absent for in-memory sources
 * @param encoding charset of the file's text
 * @param bom      whether the file starts with a UTF-8 byte order mark
 */
public record FileInfo(@Nullable Path path, Charset encoding, boolean bom) {
    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final Pattern CODING_COOKIE = Pattern.compile("^[ \\t\\f]*#.*?coding[:=][ \\t]*([-\\w.]+)");
    private static final Pattern BLANK_OR_COMMENT = Pattern.compile("^[ \\t\\f]*(?:[#\\r\\n]|$)");

    public static FileInfo of(@Nullable Path path) {
        return new FileInfo(path, StandardCharsets.UTF_8, false);
    }

    public Optional<Path> file() {
        return Optional.ofNullable(path);
    }

    /**
     * Detect the encoding of a Python file: a UTF-8 byte order mark, else a coding cookie in one of the first
     * two lines, else UTF-8.
     *
     * @throws IOException when the file can't be read or names an unknown encoding
     */
    public static FileInfo detect(Path path) throws IOException {
        return detect(path, Files.readAllBytes(path));
    }

    static FileInfo detect(@Nullable Path path, byte[] content) throws IOException {
        if (startsWithBom(content)) {
            return new FileInfo(path, StandardCharsets.UTF_8, true);
        }
        var head = new String(content, 0, Math.min(content.length, 1024), StandardCharsets.ISO_8859_1);
        var lines = head.split("\\r\\n|\\r|\\n", 3);
        for (int i = 0; i < Math.min(2, lines.length); i++) {
            var cookie = CODING_COOKIE.matcher(lines[i]);
            if (cookie.find()) {
                return new FileInfo(path, charsetFor(cookie.group(1)), false);
            }
            if (!BLANK_OR_COMMENT.matcher(lines[i]).find()) {
                break;
            }
        }
        return new FileInfo(path, StandardCharsets.UTF_8, false);
    }

    private static boolean startsWithBom(byte[] content) {
        return content.length >= 3 && content[0] == UTF8_BOM[0] && content[1] == UTF8_BOM[1] && content[2] == UTF8_BOM[2];
    }

    private static Charset charsetFor(String name) throws IOException {
        var normalized = name.toLowerCase(Locale.ROOT).replace('_', '-');
        if (normalized.equals("utf-8") || normalized.startsWith("utf-8-") || normalized.equals("utf8")) {
            return StandardCharsets.UTF_8;
        }
        if (normalized.equals("latin-1") || normalized.equals("iso-8859-1") || normalized.equals("iso-latin-1")
            || normalized.startsWith("latin-1-") || normalized.startsWith("iso-8859-1-")) {
            return StandardCharsets.ISO_8859_1;
        }
        try {
            return Charset.forName(normalized);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new IOException("Unknown encoding: " + name, e);
        }
    }

    /**
     * Text of the file, without the byte order mark.
     */
    public String read() throws IOException {
        var content = Files.readAllBytes(requirePath());
        int skip = bom && startsWithBom(content) ? UTF8_BOM.length : 0;
        return new String(content, skip, content.length - skip, encoding);
    }

    /**
     * Replace the file's content, restoring the byte order mark it had.
     */
    public void write(String text) throws IOException {
        var encoded = text.getBytes(encoding);
        if (bom) {
            var withBom = new byte[encoded.length + UTF8_BOM.length];
            System.arraycopy(UTF8_BOM, 0, withBom, 0, UTF8_BOM.length);
            System.arraycopy(encoded, 0, withBom, UTF8_BOM.length, encoded.length);
            encoded = withBom;
        }
        Files.write(requirePath(), encoded);
    }

    private Path requirePath() {
        if (path == null) {
            throw new IllegalStateException("Source is not bound to a file");
        }
        return path;
    }
}
