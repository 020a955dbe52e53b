package org.pragmatica.refactor.text;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class LinesTest {

    @Test
    void split_keepsTerminatorOnEachLine() {
        var source = """
            1 + 2
            print(foo)
            if not (
                bar
            ):
                print(z)
            """;

        assertThat(Lines.split(source).asList()).containsExactly(
            "1 + 2\n",
            "print(foo)\n",
            "if not (\n",
            "    bar\n",
            "):\n",
            "    print(z)\n");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "", "\n", "\n\n", "\n\n\n", "\t\n \n \n", "x", "x\n", "x\n\n", "x\n\n\n", "x\n\nxx\n\n",
        "x\n\r\nxx\r\n\r\n", "x\n\r\n\nx\r\n\r\n\r\n", "x\n\r\n\nx\r\n\r\r"
    })
    void join_afterSplit_reproducesText(String source) {
        assertThat(Lines.split(source).join()).isEqualTo(source);
    }

    @Test
    void split_withNonAsciiText_keepsLinesIntact() {
        var source = """
            print('🚀 🚀 🚀')
            末 = '天 小 末' * 4
            """;
        var lines = Lines.split(source);

        assertThat(lines.size()).isEqualTo(2);
        assertThat(lines.get(1)).isEqualTo("末 = '天 小 末' * 4\n");
        assertThat(lines.join()).isEqualTo(source);
    }

    @Test
    void newline_followsFirstTerminatedLine() {
        assertThat(Lines.split("a\r\nb\n").newline()).isEqualTo("\r\n");
        assertThat(Lines.split("a\nb\r\n").newline()).isEqualTo("\n");
        assertThat(Lines.split("a").newline()).isEqualTo("\n");
    }

    @Test
    void endsWithNewline_detectsMissingTerminator() {
        assertThat(Lines.split("a\nb").endsWithNewline()).isFalse();
        assertThat(Lines.split("a\nb\n").endsWithNewline()).isTrue();
        assertThat(Lines.split("").endsWithNewline()).isTrue();
    }

    @Test
    void replace_swapsLineRange() {
        var lines = Lines.split("a\nb\nc\n");

        lines.replace(1, 2, Lines.split("x\ny\n"));

        assertThat(lines.join()).isEqualTo("a\nx\ny\nc\n");
    }

    @Test
    void convertTerminators_rewritesEveryTerminator() {
        var lines = Lines.split("a\nb\rc");

        lines.convertTerminators("\r\n");

        assertThat(lines.join()).isEqualTo("a\r\nb\r\nc");
    }

    @Test
    void findIndent_separatesLeadingWhitespace() {
        var indent = Lines.findIndent("    print(");

        assertThat(indent.indentation()).isEqualTo("    ");
        assertThat(indent.remainder()).isEqualTo("print(");
    }

    @Test
    void applyIndentation_leavesStringContinuationLinesAlone() {
        var lines = Lines.split("x = '''a\nb'''\ny = 1");

        lines.applyIndentation("    ", "", "\n");

        assertThat(lines.join()).isEqualTo("    x = '''a\nb'''\n    y = 1\n");
    }

    @Test
    void protectedLines_marksLinesStartingInsideStrings() {
        var protectedLines = Lines.protectedLines("s = '''\nfirst\nsecond'''\nt = 1\n");

        assertThat(protectedLines.get(0)).isFalse();
        assertThat(protectedLines.get(1)).isTrue();
        assertThat(protectedLines.get(2)).isTrue();
        assertThat(protectedLines.get(3)).isFalse();
    }
}
