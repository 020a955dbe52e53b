package org.pragmatica.refactor.parser;

import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.Bytes;
import org.pragmatica.refactor.tree.Imaginary;
import org.pragmatica.refactor.tree.Nodes;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns number and string tokens into constant values, f-strings into {@code JoinedStr} trees.
 */
final class LiteralParser {
    private LiteralParser() {}

    /**
     * Parser for the expression part of an f-string replacement field.
     */
    @FunctionalInterface
    interface ExpressionParser {
        AstNode parse(String text);
    }

    /**
     * Decomposed string token.
     */
    record Literal(String prefix, String body) {
        static Literal of(String text) {
            int prefixLength = 0;
            while (Character.isLetter(text.charAt(prefixLength))) {
                prefixLength++;
            }
            var rest = text.substring(prefixLength);
            char quote = rest.charAt(0);
            int quoteLength = rest.length() >= 6 && rest.charAt(1) == quote && rest.charAt(2) == quote ? 3 : 1;
            return new Literal(text.substring(0, prefixLength).toLowerCase(Locale.ROOT),
                               rest.substring(quoteLength, rest.length() - quoteLength));
        }

        boolean raw() {
            return prefix.indexOf('r') >= 0;
        }

        boolean bytes() {
            return prefix.indexOf('b') >= 0;
        }

        boolean formatted() {
            return prefix.indexOf('f') >= 0;
        }

        boolean unicode() {
            return prefix.indexOf('u') >= 0;
        }
    }

    static Object parseNumber(String text) {
        var digits = text.replace("_", "");
        var lower = digits.toLowerCase(Locale.ROOT);
        if (lower.endsWith("j")) {
            return new Imaginary(Double.parseDouble(lower.substring(0, lower.length() - 1)));
        }
        if (lower.startsWith("0x")) {
            return narrow(new BigInteger(lower.substring(2), 16));
        }
        if (lower.startsWith("0o")) {
            return narrow(new BigInteger(lower.substring(2), 8));
        }
        if (lower.startsWith("0b")) {
            return narrow(new BigInteger(lower.substring(2), 2));
        }
        if (lower.indexOf('.') >= 0 || lower.indexOf('e') >= 0) {
            return Double.parseDouble(lower);
        }
        if (lower.length() > 1 && lower.charAt(0) == '0' && !lower.chars().allMatch(c -> c == '0')) {
            throw new IllegalArgumentException("leading zeros in decimal integer literals are not permitted");
        }
        return narrow(new BigInteger(lower));
    }

    private static Object narrow(BigInteger value) {
        return value.bitLength() < 64 ? (Object) value.longValue() : value;
    }

    /**
     * Build the constant (or f-string) node for a run of adjacent string tokens.
     */
    static AstNode parseStrings(List<String> tokens, ExpressionParser parser) {
        var literals = new ArrayList<Literal>();
        for (var token : tokens) {
            literals.add(Literal.of(token));
        }
        long bytesCount = literals.stream().filter(Literal::bytes).count();
        if (bytesCount != 0 && bytesCount != literals.size()) {
            throw new IllegalArgumentException("cannot mix bytes and nonbytes literals");
        }
        if (bytesCount != 0) {
            var sb = new StringBuilder();
            for (var literal : literals) {
                sb.append(literal.raw() ? literal.body() : decode(literal.body(), true));
            }
            return Nodes.constant(new Bytes(sb.toString()));
        }
        if (literals.stream().noneMatch(Literal::formatted)) {
            var sb = new StringBuilder();
            for (var literal : literals) {
                sb.append(literal.raw() ? literal.body() : decode(literal.body(), false));
            }
            return Nodes.constant(sb.toString()).set("kind", literals.get(0).unicode() ? "u" : null);
        }
        var values = new ArrayList<AstNode>();
        var pending = new StringBuilder();
        for (var literal : literals) {
            if (literal.formatted()) {
                new FString(literal.body(), literal.raw(), parser, values, pending).parse();
            } else {
                pending.append(literal.raw() ? literal.body() : decode(literal.body(), false));
            }
        }
        flush(pending, values);
        return Nodes.joinedStr(values);
    }

    private static void flush(StringBuilder pending, List<AstNode> values) {
        if (pending.length() > 0) {
            values.add(Nodes.constant(pending.toString()));
            pending.setLength(0);
        }
    }

    /**
     * Process backslash escapes of a non-raw literal body.
     */
    static String decode(String body, boolean bytes) {
        var sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            i += 2;
            switch (next) {
                case '\n' -> { }
                case '\r' -> {
                    if (i < body.length() && body.charAt(i) == '\n') {
                        i++;
                    }
                }
                case '\\', '\'', '"' -> sb.append(next);
                case 'a' -> sb.append('\u0007');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'v' -> sb.append('\u000b');
                case 'x' -> {
                    sb.append((char) hex(body, i, 2, "\\xXX"));
                    i += 2;
                }
                case 'u', 'U', 'N' -> {
                    if (bytes) {
                        sb.append('\\').append(next);
                    } else if (next == 'N') {
                        int close = body.indexOf('}', i);
                        if (i >= body.length() || body.charAt(i) != '{' || close < 0) {
                            throw new IllegalArgumentException("malformed \\N character escape");
                        }
                        sb.appendCodePoint(Character.codePointOf(body.substring(i + 1, close)));
                        i = close + 1;
                    } else {
                        int length = next == 'u' ? 4 : 8;
                        sb.appendCodePoint(hex(body, i, length, next == 'u' ? "\\uXXXX" : "\\UXXXXXXXX"));
                        i += length;
                    }
                }
                default -> {
                    if (next >= '0' && next <= '7') {
                        int value = next - '0';
                        int digits = 1;
                        while (digits < 3 && i < body.length() && body.charAt(i) >= '0' && body.charAt(i) <= '7') {
                            value = value * 8 + (body.charAt(i) - '0');
                            i++;
                            digits++;
                        }
                        sb.append((char) value);
                    } else {
                        sb.append('\\').append(next);
                    }
                }
            }
        }
        return sb.toString();
    }

    private static int hex(String body, int from, int length, String form) {
        if (from + length > body.length()) {
            throw new IllegalArgumentException("truncated " + form + " escape");
        }
        try {
            return Integer.parseInt(body.substring(from, from + length), 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("truncated " + form + " escape", e);
        }
    }

    /**
     * Parser of one f-string body, appending to the shared value list of a concatenation.
     */
    private static final class FString {
        private final String body;
        private final boolean raw;
        private final ExpressionParser parser;
        private final List<AstNode> values;
        private final StringBuilder pending;
        private int pos;

        FString(String body, boolean raw, ExpressionParser parser, List<AstNode> values, StringBuilder pending) {
            this.body = body;
            this.raw = raw;
            this.parser = parser;
            this.values = values;
            this.pending = pending;
        }

        void parse() {
            while (pos < body.length()) {
                char c = body.charAt(pos);
                if (c == '{' && peekIs(pos + 1, '{')) {
                    pending.append('{');
                    pos += 2;
                } else if (c == '}' && peekIs(pos + 1, '}')) {
                    pending.append('}');
                    pos += 2;
                } else if (c == '{') {
                    replacementField(values, pending);
                } else if (c == '}') {
                    throw new IllegalArgumentException("f-string: single '}' is not allowed");
                } else {
                    literalRun();
                }
            }
        }

        private void literalRun() {
            int start = pos;
            while (pos < body.length() && body.charAt(pos) != '{' && body.charAt(pos) != '}') {
                if (!raw && body.charAt(pos) == '\\' && pos + 1 < body.length()) {
                    if (body.charAt(pos + 1) == 'N' && peekIs(pos + 2, '{')) {
                        int close = body.indexOf('}', pos);
                        pos = close < 0 ? body.length() : close + 1;
                    } else {
                        pos += 2;
                    }
                    continue;
                }
                pos++;
            }
            var text = body.substring(start, pos);
            pending.append(raw ? text : decode(text, false));
        }

        private void replacementField(List<AstNode> target, StringBuilder targetPending) {
            pos++;
            int exprStart = pos;
            int exprEnd = scanExpression();
            var expression = body.substring(exprStart, exprEnd);
            if (expression.isBlank()) {
                throw new IllegalArgumentException("f-string: empty expression not allowed");
            }
            boolean selfDocumenting = false;
            if (peekIs(pos, '=')) {
                pos++;
                while (pos < body.length() && Character.isWhitespace(body.charAt(pos))) {
                    pos++;
                }
                targetPending.append(body, exprStart, pos);
                selfDocumenting = true;
            }
            flush(targetPending, target);
            var value = parser.parse(expression);
            int conversion = -1;
            if (peekIs(pos, '!')) {
                if (pos + 1 >= body.length() || "sra".indexOf(body.charAt(pos + 1)) < 0) {
                    throw new IllegalArgumentException("f-string: invalid conversion character");
                }
                conversion = body.charAt(pos + 1);
                pos += 2;
            }
            AstNode formatSpec = null;
            if (peekIs(pos, ':')) {
                pos++;
                formatSpec = formatSpec();
            }
            if (!peekIs(pos, '}')) {
                throw new IllegalArgumentException("f-string: expecting '}'");
            }
            pos++;
            if (selfDocumenting && conversion == -1 && formatSpec == null) {
                conversion = 'r';
            }
            target.add(Nodes.formattedValue(value).set("conversion", conversion).set("format_spec", formatSpec));
        }

        private AstNode formatSpec() {
            var specValues = new ArrayList<AstNode>();
            var specPending = new StringBuilder();
            while (pos < body.length() && body.charAt(pos) != '}') {
                if (body.charAt(pos) == '{') {
                    replacementField(specValues, specPending);
                } else {
                    specPending.append(body.charAt(pos++));
                }
            }
            flush(specPending, specValues);
            return Nodes.joinedStr(specValues);
        }

        /**
         * Advance over the expression of a replacement field, stopping at a top-level '!', ':', '=' or '}'.
         */
        private int scanExpression() {
            int depth = 0;
            char quote = 0;
            while (pos < body.length()) {
                char c = body.charAt(pos);
                if (quote != 0) {
                    if (c == quote) {
                        quote = 0;
                    }
                } else if (c == '\'' || c == '"') {
                    quote = c;
                } else if (c == '(' || c == '[' || c == '{') {
                    depth++;
                } else if (c == ')' || c == ']' || c == '}') {
                    if (c == '}' && depth == 0) {
                        return pos;
                    }
                    depth--;
                } else if (depth == 0 && c == '!' && !peekIs(pos + 1, '=')) {
                    return pos;
                } else if (depth == 0 && c == ':') {
                    return pos;
                } else if (depth == 0 && c == '=' && isSelfDocumentingEquals()) {
                    return pos;
                }
                pos++;
            }
            throw new IllegalArgumentException("f-string: expecting '}'");
        }

        private boolean isSelfDocumentingEquals() {
            if (peekIs(pos + 1, '=')) {
                return false;
            }
            char previous = pos > 0 ? body.charAt(pos - 1) : ' ';
            return "=!<>".indexOf(previous) < 0;
        }

        private boolean peekIs(int index, char c) {
            return index < body.length() && body.charAt(index) == c;
        }
    }
}
