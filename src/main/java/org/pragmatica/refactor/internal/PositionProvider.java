package org.pragmatica.refactor.internal;

import org.pragmatica.refactor.Common;
import org.pragmatica.refactor.parser.Token;
import org.pragmatica.refactor.parser.Tokenizer;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds where identifiers that have no node of their own are spelled in the source.
 */
public final class PositionProvider {
    private static final Map<NodeType, List<String>> EXPECTED_KEYWORDS = Map.of(
        NodeType.FUNCTION_DEF, List.of("def"),
        NodeType.ASYNC_FUNCTION_DEF, List.of("async", "def"),
        NodeType.CLASS_DEF, List.of("class"));

    private PositionProvider() {}

    /**
     * Position of the name of a function or class definition: the definition's segment must start with the
     * expected keywords followed by {@code identifier}.
     */
    public static Optional<Common.Position> inferIdentifierPosition(AstNode node, String identifier, String source) {
        var keywords = EXPECTED_KEYWORDS.get(node.type());
        var segment = Common.getSourceSegment(source, node);
        if (keywords == null || segment.isEmpty()) {
            return Optional.empty();
        }
        var tokens = significant(Tokenizer.scan(segment.get()).tokens());
        var expected = new ArrayList<>(keywords);
        expected.add(identifier);
        if (tokens.size() < expected.size()) {
            return Optional.empty();
        }
        for (int i = 0; i < expected.size(); i++) {
            var token = tokens.get(i);
            if (!(token instanceof Token.Name) || !token.text().equals(expected.get(i))) {
                return Optional.empty();
            }
        }
        var span = tokens.get(expected.size() - 1).span();
        int line = node.line() - 1 + span.start().line();
        int endLine = node.line() - 1 + span.end().line();
        int column = span.start().line() == 1 ? node.column() + span.start().column() : span.start().column();
        int endColumn = span.end().line() == 1 ? node.column() + span.end().column() : span.end().column();
        return Optional.of(new Common.Position(line, column, endLine, endColumn));
    }

    private static List<Token> significant(List<Token> tokens) {
        var result = new ArrayList<Token>();
        for (var token : tokens) {
            if (!(token instanceof Token.Newline || token instanceof Token.Indent || token instanceof Token.Dedent
                  || token instanceof Token.EndMarker || token instanceof Token.Error)) {
                result.add(token);
            }
        }
        return result;
    }
}
