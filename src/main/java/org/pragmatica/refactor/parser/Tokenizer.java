package org.pragmatica.refactor.parser;

import org.pragmatica.refactor.error.ParseError;
import org.pragmatica.refactor.tree.SourceLocation;
import org.pragmatica.refactor.tree.SourceSpan;
import org.pragmatica.refactor.tree.Trivia;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Tokenizer for Python source text.
 *
 * <p>Strict mode produces the full token stream including NEWLINE, INDENT and DEDENT and ends with an
 * {@link Token.Error} on the first problem. Lenient mode skips layout bookkeeping and silently stops at the
 * first problem; it is used to look inside arbitrary source segments.
 */
public final class Tokenizer {
    private static final int TAB_SIZE = 8;
    private static final Set<String> STRING_PREFIXES = Set.of("r", "u", "b", "f", "br", "rb", "fr", "rf");
    private static final Set<String> THREE_CHAR_OPS = Set.of("**=", "//=", ">>=", "<<=", "...");
    private static final Set<String> TWO_CHAR_OPS = Set.of(
        "**", "//", "<<", ">>", "<=", ">=", "==", "!=", "->", ":=",
        "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=");
    private static final String ONE_CHAR_OPS = "+-*/%@&|^~<>()[]{},:.;=";

    private final String input;
    private final boolean lenient;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Trivia> trivia = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int pos;
    private int line;
    private int column;
    private int parenDepth;
    private boolean atLineStart;
    private boolean failed;

    private Tokenizer(String input, boolean lenient) {
        this.input = input;
        this.lenient = lenient;
        this.line = 1;
        this.column = 0;
        this.atLineStart = true;
        this.indents.push(0);
    }

    /**
     * Result of tokenizing: significant tokens plus collected trivia.
     */
    public record Tokenized(List<Token> tokens, List<Trivia> trivia) {
        public List<Trivia.Comment> comments() {
            var result = new ArrayList<Trivia.Comment>();
            for (var item : trivia) {
                if (item instanceof Trivia.Comment comment) {
                    result.add(comment);
                }
            }
            return result;
        }
    }

    /** Tokenize a complete module. */
    public static Tokenized tokenize(String input) {
        return new Tokenizer(input, false).run();
    }

    /** Tokenize an arbitrary fragment without layout tokens, stopping quietly at the first error. */
    public static Tokenized scan(String input) {
        return new Tokenizer(input, true).run();
    }

    private Tokenized run() {
        while (!failed) {
            if (atLineStart && parenDepth == 0 && !lenient && !handleIndentation()) {
                break;
            }
            if (failed) {
                break;
            }
            skipSpaces();
            if (isAtEnd()) {
                break;
            }
            var start = currentLocation();
            char c = peek();
            if (c == '#') {
                scanComment(start);
            } else if (isNewline(c)) {
                scanNewline(start);
            } else if (c == '\\') {
                scanContinuation(start);
            } else {
                add(nextToken(start));
            }
        }
        finish();
        return new Tokenized(List.copyOf(tokens), List.copyOf(trivia));
    }

    private void add(Token token) {
        if (token instanceof Token.Error) {
            failed = true;
            if (lenient) {
                return;
            }
        }
        tokens.add(token);
        atLineStart = false;
    }

    private void finish() {
        var end = currentLocation();
        if (failed && !lenient) {
            return;
        }
        if (!lenient) {
            if (!atLineStart && parenDepth == 0) {
                tokens.add(new Token.Newline(SourceSpan.at(end)));
            }
            while (indents.peek() > 0) {
                indents.pop();
                tokens.add(new Token.Dedent(SourceSpan.at(end)));
            }
        }
        tokens.add(new Token.EndMarker(SourceSpan.at(end)));
    }

    /**
     * Measure indentation of a new logical line and emit INDENT/DEDENT. Returns false at end of input.
     */
    private boolean handleIndentation() {
        var lineStart = currentLocation();
        int col = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ') {
                col++;
            } else if (c == '\t') {
                col = (col / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                col = 0;
            } else {
                break;
            }
            advance();
        }
        if (isAtEnd()) {
            return false;
        }
        char c = peek();
        if (c == '#' || isNewline(c)) {
            // blank or comment-only line
            return true;
        }
        var location = currentLocation();
        if (col > indents.peek()) {
            indents.push(col);
            tokens.add(new Token.Indent(SourceSpan.of(lineStart, location)));
        } else {
            while (col < indents.peek()) {
                indents.pop();
                tokens.add(new Token.Dedent(SourceSpan.at(location)));
            }
            if (col != indents.peek()) {
                add(new Token.Error(SourceSpan.at(location),
                                    new ParseError.IndentationError(location,
                                                                    "unindent does not match any outer indentation level")));
                return true;
            }
        }
        atLineStart = false;
        return true;
    }

    private void scanComment(SourceLocation start) {
        while (!isAtEnd() && !isNewline(peek())) {
            advance();
        }
        trivia.add(new Trivia.Comment(span(start), input.substring(start.offset(), pos)));
    }

    private void scanNewline(SourceLocation start) {
        consumeNewline();
        if (parenDepth == 0) {
            if (!atLineStart && !lenient) {
                tokens.add(new Token.Newline(span(start)));
            }
            atLineStart = true;
        }
    }

    private void consumeNewline() {
        if (advance() == '\r' && !isAtEnd() && peek() == '\n') {
            advance();
        }
    }

    private void scanContinuation(SourceLocation start) {
        advance();
        if (isAtEnd() || !isNewline(peek())) {
            add(error(start, "unexpected character after line continuation character"));
            return;
        }
        consumeNewline();
        trivia.add(new Trivia.Continuation(span(start), input.substring(start.offset(), pos)));
    }

    private Token nextToken(SourceLocation start) {
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanName(start);
        }
        if (isDigit(c) || (c == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1)))) {
            return scanNumber(start);
        }
        if (c == '\'' || c == '"') {
            return scanString(start, "");
        }
        return scanOperator(start);
    }

    private Token scanName(SourceLocation start) {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        var name = input.substring(start.offset(), pos);
        if (!isAtEnd() && (peek() == '\'' || peek() == '"') && STRING_PREFIXES.contains(name.toLowerCase())) {
            return scanString(start, name);
        }
        return new Token.Name(span(start), name);
    }

    private Token scanNumber(SourceLocation start) {
        if (peek() == '0' && pos + 1 < input.length() && "xXoObB".indexOf(input.charAt(pos + 1)) >= 0) {
            advance();
            advance();
            while (!isAtEnd() && (Character.digit(peek(), 16) >= 0 || peek() == '_')) {
                advance();
            }
            return new Token.Number(span(start), input.substring(start.offset(), pos));
        }
        scanDigits();
        if (!isAtEnd() && peek() == '.') {
            advance();
            scanDigits();
        }
        if (!isAtEnd() && (peek() == 'e' || peek() == 'E') && hasExponentDigits()) {
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            scanDigits();
        }
        if (!isAtEnd() && (peek() == 'j' || peek() == 'J')) {
            advance();
        }
        return new Token.Number(span(start), input.substring(start.offset(), pos));
    }

    private boolean hasExponentDigits() {
        int next = pos + 1;
        if (next < input.length() && (input.charAt(next) == '+' || input.charAt(next) == '-')) {
            next++;
        }
        return next < input.length() && isDigit(input.charAt(next));
    }

    private void scanDigits() {
        while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
            advance();
        }
    }

    private Token scanString(SourceLocation start, String prefix) {
        char quote = peek();
        boolean triple = pos + 2 < input.length() && input.charAt(pos + 1) == quote && input.charAt(pos + 2) == quote;
        advance();
        if (triple) {
            advance();
            advance();
        }
        while (true) {
            if (isAtEnd()) {
                return error(start, "unterminated string literal");
            }
            char c = peek();
            if (c == '\\') {
                advance();
                if (!isAtEnd()) {
                    if (isNewline(peek())) {
                        consumeNewline();
                    } else {
                        advance();
                    }
                }
                continue;
            }
            if (c == quote) {
                if (!triple) {
                    advance();
                    break;
                }
                if (pos + 2 < input.length() && input.charAt(pos + 1) == quote && input.charAt(pos + 2) == quote) {
                    advance();
                    advance();
                    advance();
                    break;
                }
            } else if (!triple && isNewline(c)) {
                return error(start, "unterminated string literal");
            }
            advance();
        }
        return new Token.Str(span(start), input.substring(start.offset(), pos));
    }

    private Token scanOperator(SourceLocation start) {
        for (int length = 3; length >= 1; length--) {
            if (pos + length > input.length()) {
                continue;
            }
            var candidate = input.substring(pos, pos + length);
            boolean known = switch (length) {
                case 3 -> THREE_CHAR_OPS.contains(candidate);
                case 2 -> TWO_CHAR_OPS.contains(candidate);
                default -> ONE_CHAR_OPS.indexOf(candidate.charAt(0)) >= 0;
            };
            if (known) {
                for (int i = 0; i < length; i++) {
                    advance();
                }
                trackBrackets(candidate);
                return new Token.Op(span(start), candidate);
            }
        }
        advance();
        return error(start, "invalid character '" + input.substring(start.offset(), pos) + "'");
    }

    private void trackBrackets(String op) {
        if (op.length() != 1) {
            return;
        }
        char c = op.charAt(0);
        if (c == '(' || c == '[' || c == '{') {
            parenDepth++;
        } else if ((c == ')' || c == ']' || c == '}') && parenDepth > 0) {
            parenDepth--;
        }
    }

    private Token error(SourceLocation start, String reason) {
        return new Token.Error(span(start), new ParseError.InvalidSyntax(start, reason));
    }

    private void skipSpaces() {
        while (!isAtEnd() && (peek() == ' ' || peek() == '\t' || peek() == '\f')) {
            advance();
        }
    }

    private static boolean isNewline(char c) {
        return c == '\n' || c == '\r';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_'
               || (c > 127 && Character.isUnicodeIdentifierStart(c));
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || (c > 127 && Character.isUnicodeIdentifierPart(c));
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n' || (c == '\r' && (pos >= input.length() || input.charAt(pos) != '\n'))) {
            line++;
            column = 0;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }
}
