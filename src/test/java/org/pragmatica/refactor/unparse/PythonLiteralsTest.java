package org.pragmatica.refactor.unparse;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.pragmatica.refactor.tree.Bytes;
import org.pragmatica.refactor.tree.Ellipsis;
import org.pragmatica.refactor.tree.Imaginary;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PythonLiteralsTest {

    @ParameterizedTest
    @CsvSource({
        "0.1, 0.1",
        "2.5, 2.5",
        "1e15, 1000000000000000.0",
        "1e16, 1e+16",
        "0.0001, 0.0001",
        "1e-5, 1e-05",
        "-3.0, -3.0",
        "123.456, 123.456"
    })
    void floatRepr_matchesPythonLayout(double value, String expected) {
        assertThat(PythonLiterals.floatRepr(value)).isEqualTo(expected);
    }

    @Test
    void floatRepr_specialValues_useOverflowingLiterals() {
        assertThat(PythonLiterals.floatRepr(Double.POSITIVE_INFINITY)).isEqualTo("1e309");
        assertThat(PythonLiterals.floatRepr(Double.NEGATIVE_INFINITY)).isEqualTo("-1e309");
        assertThat(PythonLiterals.floatRepr(-0.0)).isEqualTo("-0.0");
        assertThat(PythonLiterals.floatRepr(0.0)).isEqualTo("0.0");
    }

    @Test
    void repr_atomicValues() {
        assertThat(PythonLiterals.repr(null)).isEqualTo("None");
        assertThat(PythonLiterals.repr(true)).isEqualTo("True");
        assertThat(PythonLiterals.repr(42L)).isEqualTo("42");
        assertThat(PythonLiterals.repr(new BigInteger("123456789012345678901234567890")))
            .isEqualTo("123456789012345678901234567890");
        assertThat(PythonLiterals.repr(new Imaginary(2.0))).isEqualTo("2j");
        assertThat(PythonLiterals.repr(new Imaginary(1.5))).isEqualTo("1.5j");
        assertThat(PythonLiterals.repr(Ellipsis.INSTANCE)).isEqualTo("...");
    }

    @Test
    void stringRepr_picksQuoteAndEscapes() {
        assertThat(PythonLiterals.stringRepr("plain")).isEqualTo("'plain'");
        assertThat(PythonLiterals.stringRepr("it's")).isEqualTo("\"it's\"");
        assertThat(PythonLiterals.stringRepr("both ' and \"")).isEqualTo("'both \\' and \"'");
        assertThat(PythonLiterals.stringRepr("a\nb\tc\\")).isEqualTo("'a\\nb\\tc\\\\'");
        assertThat(PythonLiterals.stringRepr("\u0000\u00e9\u200b")).isEqualTo("'\\x00\u00e9\\u200b'");
    }

    @Test
    void bytesRepr_escapesNonPrintable() {
        var bytes = Bytes.of(new byte[]{'a', 0, (byte) 0xff, '\n', '\''});

        assertThat(PythonLiterals.bytesRepr(bytes)).isEqualTo("b\"a\\x00\\xff\\n'\"");
    }

    @Test
    void repr_unknownValue_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> PythonLiterals.repr(new Object()));
    }
}
