package org.pragmatica.refactor.unparse;

import org.jetbrains.annotations.Nullable;
import org.pragmatica.refactor.tree.Bytes;
import org.pragmatica.refactor.tree.Ellipsis;
import org.pragmatica.refactor.tree.Imaginary;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Python {@code repr()} of constant values.
 */
public final class PythonLiterals {
    /** Literal that overflows to infinity when parsed back. */
    public static final String INFINITY = "1e309";

    private PythonLiterals() {}

    public static String repr(@Nullable Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Boolean flag) {
            return flag ? "True" : "False";
        }
        if (value instanceof Long || value instanceof Integer || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Double number) {
            return floatRepr(number);
        }
        if (value instanceof Imaginary imaginary) {
            return imaginaryRepr(imaginary.imag());
        }
        if (value instanceof String text) {
            return stringRepr(text);
        }
        if (value instanceof Bytes bytes) {
            return bytesRepr(bytes);
        }
        if (value instanceof Ellipsis) {
            return "...";
        }
        throw new IllegalArgumentException("Not a constant value: " + value.getClass().getName());
    }

    /**
     * Shortest round-tripping float representation with Python's layout rules, infinities spelled as
     * overflowing literals.
     */
    public static String floatRepr(double value) {
        if (Double.isNaN(value)) {
            return "(" + INFINITY + "-" + INFINITY + ")";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? INFINITY : "-" + INFINITY;
        }
        if (value == 0.0) {
            return 1 / value < 0 ? "-0.0" : "0.0";
        }
        var sign = value < 0 ? "-" : "";
        var decimal = new BigDecimal(Double.toString(Math.abs(value))).stripTrailingZeros();
        var digits = decimal.unscaledValue().toString();
        int pointPosition = digits.length() - decimal.scale();
        if (pointPosition <= -4 || pointPosition > 16) {
            var mantissa = digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
            int exponent = pointPosition - 1;
            var exponentText = String.format("%02d", Math.abs(exponent));
            return sign + mantissa + "e" + (exponent < 0 ? "-" : "+") + exponentText;
        }
        if (pointPosition <= 0) {
            return sign + "0." + "0".repeat(-pointPosition) + digits;
        }
        if (pointPosition >= digits.length()) {
            return sign + digits + "0".repeat(pointPosition - digits.length()) + ".0";
        }
        return sign + digits.substring(0, pointPosition) + "." + digits.substring(pointPosition);
    }

    public static String imaginaryRepr(double imag) {
        var text = floatRepr(imag);
        if (text.endsWith(".0")) {
            text = text.substring(0, text.length() - 2);
        }
        return text + "j";
    }

    public static String stringRepr(String text) {
        char quote = text.indexOf('\'') >= 0 && text.indexOf('"') < 0 ? '"' : '\'';
        var sb = new StringBuilder(text.length() + 2).append(quote);
        text.codePoints().forEach(cp -> {
            if (cp == quote || cp == '\\') {
                sb.append('\\').appendCodePoint(cp);
            } else {
                sb.append(escape(cp, true));
            }
        });
        return sb.append(quote).toString();
    }

    public static String bytesRepr(Bytes bytes) {
        var data = bytes.latin1();
        char quote = data.indexOf('\'') >= 0 && data.indexOf('"') < 0 ? '"' : '\'';
        var sb = new StringBuilder("b").append(quote);
        for (int i = 0; i < data.length(); i++) {
            char c = data.charAt(i);
            if (c == quote || c == '\\') {
                sb.append('\\').append(c);
            } else if (c == '\t') {
                sb.append("\\t");
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c < 0x20 || c >= 0x7f) {
                sb.append(String.format("\\x%02x", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.append(quote).toString();
    }

    /**
     * Escape one code point the way {@code repr} (or, with {@code escapeWhitespace} off, an f-string part)
     * does. Backslashes are left to the caller.
     */
    static String escape(int cp, boolean escapeWhitespace) {
        if (cp == '\n' || cp == '\t') {
            return escapeWhitespace ? (cp == '\n' ? "\\n" : "\\t") : Character.toString(cp);
        }
        if (cp == '\r') {
            return "\\r";
        }
        if (isPrintable(cp)) {
            return Character.toString(cp);
        }
        if (cp < 0x100) {
            return String.format("\\x%02x", cp);
        }
        if (cp < 0x10000) {
            return String.format("\\u%04x", cp);
        }
        return String.format("\\U%08x", cp);
    }

    static boolean isPrintable(int cp) {
        if (cp == ' ') {
            return true;
        }
        return switch (Character.getType(cp)) {
            case Character.CONTROL, Character.FORMAT, Character.SURROGATE, Character.PRIVATE_USE,
                 Character.UNASSIGNED, Character.LINE_SEPARATOR, Character.PARAGRAPH_SEPARATOR,
                 Character.SPACE_SEPARATOR -> false;
            default -> true;
        };
    }
}
