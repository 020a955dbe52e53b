package org.pragmatica.refactor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FileInfoTest {
    @TempDir
    Path tempDir;

    @Test
    void detect_plainFile_isUtf8() throws IOException {
        var info = FileInfo.detect(null, "x = 1\n".getBytes(StandardCharsets.UTF_8));

        assertThat(info.encoding()).isEqualTo(StandardCharsets.UTF_8);
        assertThat(info.bom()).isFalse();
        assertThat(info.file()).isEmpty();
    }

    @Test
    void detect_codingCookie_inFirstOrSecondLine() throws IOException {
        var first = FileInfo.detect(null, "# -*- coding: latin-1 -*-\nx = 1\n".getBytes(StandardCharsets.ISO_8859_1));
        var second = FileInfo.detect(null, "#!/usr/bin/env python\n# vim: set fileencoding=iso-8859-1 :\n"
            .getBytes(StandardCharsets.ISO_8859_1));
        var tooLate = FileInfo.detect(null, "x = 1\n# coding: latin-1\n".getBytes(StandardCharsets.ISO_8859_1));

        assertThat(first.encoding()).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(second.encoding()).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(tooLate.encoding()).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    void detect_unknownEncoding_fails() {
        assertThrows(IOException.class,
                     () -> FileInfo.detect(null, "# coding: no-such-codec\n".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void readAndWrite_keepByteOrderMark() throws IOException {
        var file = tempDir.resolve("bom.py");
        var bom = new byte[]{(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        var body = "name = 'caf\u00e9'\n".getBytes(StandardCharsets.UTF_8);
        var content = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, content, 0, bom.length);
        System.arraycopy(body, 0, content, bom.length, body.length);
        Files.write(file, content);

        var info = FileInfo.detect(file);
        assertThat(info.bom()).isTrue();
        assertThat(info.read()).isEqualTo("name = 'caf\u00e9'\n");

        info.write("name = 'tea'\n");
        var written = Files.readAllBytes(file);
        assertThat(written).startsWith(bom);
        assertThat(info.read()).isEqualTo("name = 'tea'\n");
    }

    @Test
    void readAndWrite_latin1File_useDeclaredEncoding() throws IOException {
        var file = tempDir.resolve("latin.py");
        var text = "# coding: latin-1\nname = 'caf\u00e9'\n";
        Files.write(file, text.getBytes(StandardCharsets.ISO_8859_1));

        var info = FileInfo.detect(file);
        assertThat(info.read()).isEqualTo(text);

        info.write("# coding: latin-1\nname = '\u00e0'\n");
        assertThat(Files.readAllBytes(file)).endsWith((byte) 0xE0, (byte) '\'', (byte) '\n');
    }

    @Test
    void read_withoutPath_fails() {
        assertThrows(IllegalStateException.class, () -> FileInfo.of(null).read());
    }
}
