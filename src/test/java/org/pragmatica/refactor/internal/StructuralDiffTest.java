package org.pragmatica.refactor.internal;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.pragmatica.refactor.error.SyntaxErrorException;
import org.pragmatica.refactor.parser.PythonParser;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.Nodes;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StructuralDiffTest {
    private static final String BASELINE = """
        def full_node_change():
            yield 1

        def nested_full_node():
            print(a)

        def double_nested_full_node():
            if something:
                return x()

        def field_addition():
            raise

        def double_field_addition():
            raise

        def field_removal():
            raise something

        def double_field_removal():
            raise something from something

        def field_change():
            print(a)

        def multiple_field_change():
            unsafe.function(3 + None)

        def sequence_diff():
            a = 1
            b = 2

        def nested_sequence_diff():
            if something:
                a = 1
                b = 2

        def sequence_weird():
            a = {a: b, **b, a: b, a: b, **b, a: b, **b}

        def sequence_str():
            global a, x, c, d, y
        """;

    private static final String CANDIDATE = """
        def full_node_change():
            return 1

        def nested_full_node():
            print(a + b)

        def double_nested_full_node():
            if something:
                return 3 + 5

        def field_addition():
            raise something

        def double_field_addition():
            raise something from something

        def field_removal():
            raise

        def double_field_removal():
            raise

        def field_change():
            print(b)

        def multiple_field_change():
            safe.method(8 + 9)

        def sequence_diff():
            a = 1

        def nested_sequence_diff():
            if something:
                a = 1
                b = 2
                c = 3

        def sequence_weird():
            a = {a: b, **b, **b, a: b, a: b, a: b, **b}

        def sequence_str():
            global a, b, c, d, e
        """;

    private static final Map<String, AstNode[]> PAIRS = new HashMap<>();

    @BeforeAll
    static void parseRevisions() throws SyntaxErrorException {
        var baseline = PythonParser.parse(BASELINE).nodes("body");
        var candidate = PythonParser.parse(CANDIDATE).nodes("body");
        for (int i = 0; i < baseline.size(); i++) {
            PAIRS.put(baseline.get(i).string("name"), new AstNode[]{baseline.get(i), candidate.get(i)});
        }
    }

    @Test
    void diff_differentNodeKind_reportsFullChange() {
        var pair = PAIRS.get("full_node_change");
        var before = statement(pair[0]);
        var after = statement(pair[1]);

        assertThat(StructuralDiff.diff(pair[0], pair[1])).containsExactly(ChangeSet.full(before, after));
    }

    @Test
    void diff_nestedKindChange_reportsInnermostNode() {
        var pair = PAIRS.get("nested_full_node");
        var nested = PAIRS.get("double_nested_full_node");

        assertThat(StructuralDiff.diff(pair[0], pair[1]))
            .containsExactly(ChangeSet.full(firstArg(pair[0]), firstArg(pair[1])));
        assertThat(StructuralDiff.diff(nested[0], nested[1]))
            .containsExactly(ChangeSet.full(statement(statement(nested[0])).node("value"),
                                            statement(statement(nested[1])).node("value")));
    }

    @Test
    void diff_optionalFieldsFilledOrCleared_reportsAdditionsAndRemovals() {
        var addition = PAIRS.get("field_addition");
        var doubleAddition = PAIRS.get("double_field_addition");
        var removal = PAIRS.get("field_removal");
        var doubleRemoval = PAIRS.get("double_field_removal");

        assertThat(StructuralDiff.diff(addition[0], addition[1])).containsExactly(
            ChangeSet.onField(ChangeType.FIELD_ADDITION, statement(addition[0]), statement(addition[1]), "exc"));
        assertThat(StructuralDiff.diff(doubleAddition[0], doubleAddition[1])).containsExactly(
            ChangeSet.onField(ChangeType.FIELD_ADDITION, statement(doubleAddition[0]), statement(doubleAddition[1]), "exc"),
            ChangeSet.onField(ChangeType.FIELD_ADDITION, statement(doubleAddition[0]), statement(doubleAddition[1]), "cause"));
        assertThat(StructuralDiff.diff(removal[0], removal[1])).containsExactly(
            ChangeSet.onField(ChangeType.FIELD_REMOVAL, statement(removal[0]), statement(removal[1]), "exc"));
        assertThat(StructuralDiff.diff(doubleRemoval[0], doubleRemoval[1])).containsExactly(
            ChangeSet.onField(ChangeType.FIELD_REMOVAL, statement(doubleRemoval[0]), statement(doubleRemoval[1]), "exc"),
            ChangeSet.onField(ChangeType.FIELD_REMOVAL, statement(doubleRemoval[0]), statement(doubleRemoval[1]), "cause"));
    }

    @Test
    void diff_atomicFieldChange_reportsFieldValue() {
        var pair = PAIRS.get("field_change");

        assertThat(StructuralDiff.diff(pair[0], pair[1])).containsExactly(
            ChangeSet.onField(ChangeType.FIELD_VALUE, firstArg(pair[0]), firstArg(pair[1]), "id"));
    }

    @Test
    void diff_severalFieldChanges_reportedInFieldOrder() {
        var pair = PAIRS.get("multiple_field_change");
        var before = statement(pair[0]).node("value");
        var after = statement(pair[1]).node("value");

        assertThat(StructuralDiff.diff(pair[0], pair[1])).containsExactly(
            ChangeSet.onField(ChangeType.FIELD_VALUE, before.node("func").node("value"),
                              after.node("func").node("value"), "id"),
            ChangeSet.onField(ChangeType.FIELD_VALUE, before.node("func"), after.node("func"), "attr"),
            ChangeSet.onField(ChangeType.FIELD_VALUE, firstArg(pair[0]).node("left"),
                              firstArg(pair[1]).node("left"), "value"),
            ChangeSet.onField(ChangeType.FIELD_VALUE, firstArg(pair[0]).node("right"),
                              firstArg(pair[1]).node("right"), "value"));
    }

    @Test
    void diff_listLengthChange_reportsFieldSize() {
        var pair = PAIRS.get("sequence_diff");
        var nested = PAIRS.get("nested_sequence_diff");

        assertThat(StructuralDiff.diff(pair[0], pair[1]))
            .containsExactly(ChangeSet.onField(ChangeType.FIELD_SIZE, pair[0], pair[1], "body"));
        assertThat(StructuralDiff.diff(nested[0], nested[1]))
            .containsExactly(ChangeSet.onField(ChangeType.FIELD_SIZE, statement(nested[0]), statement(nested[1]), "body"));
    }

    @Test
    void diff_missingListItems_reportFullChangeAtIndex() {
        var pair = PAIRS.get("sequence_weird");
        var before = statement(pair[0]).node("value");
        var after = statement(pair[1]).node("value");

        assertThat(StructuralDiff.diff(pair[0], pair[1])).containsExactly(
            ChangeSet.onItem(ChangeType.FULL, before, after, "keys", 2),
            ChangeSet.onItem(ChangeType.FULL, before, after, "keys", 4));
    }

    @Test
    void diff_plainListItems_reportItemValue() {
        var pair = PAIRS.get("sequence_str");

        assertThat(StructuralDiff.diff(pair[0], pair[1])).containsExactly(
            ChangeSet.onItem(ChangeType.ITEM_VALUE, statement(pair[0]), statement(pair[1]), "names", 1),
            ChangeSet.onItem(ChangeType.ITEM_VALUE, statement(pair[0]), statement(pair[1]), "names", 4));
    }

    @Test
    void diff_identicalTrees_reportsNothing() throws SyntaxErrorException {
        assertThat(StructuralDiff.diff(PythonParser.parse(BASELINE), PythonParser.parse(BASELINE))).isEmpty();
        assertThat(StructuralDiff.diff(Nodes.constant(null), Nodes.constant(null))).isEmpty();
    }

    @Test
    void diff_nodeAgainstPlainValue_isIncomplete() {
        var before = Nodes.name("a");
        var after = Nodes.name("a").set("id", List.of("a"));

        assertThrows(IncompleteTreeException.class, () -> StructuralDiff.diff(before, after));
    }

    private static AstNode statement(AstNode owner) {
        return owner.nodes("body").get(0);
    }

    private static AstNode firstArg(AstNode function) {
        return statement(function).node("value").nodes("args").get(0);
    }
}
