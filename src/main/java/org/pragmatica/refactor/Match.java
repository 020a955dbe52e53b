package org.pragmatica.refactor;

import org.pragmatica.refactor.action.Action;

import java.util.Arrays;
import java.util.List;

/**
 * What a rule wants done with a matched node: one action, or a chain of actions built against the same
 * snapshot and applied one after another.
 */
public sealed interface Match {
    List<Action> actions();

    record Single(Action action) implements Match {
        @Override
        public List<Action> actions() {
            return List.of(action);
        }
    }

    record Chain(List<Action> actions) implements Match {
        public Chain {
            if (actions.isEmpty()) {
                throw new IllegalArgumentException("A chain needs at least one action");
            }
            actions = List.copyOf(actions);
        }
    }

    static Match of(Action action) {
        return new Single(action);
    }

    static Match chain(List<? extends Action> actions) {
        return new Chain(List.copyOf(actions));
    }

    static Match chain(Action... actions) {
        return chain(Arrays.asList(actions));
    }
}
