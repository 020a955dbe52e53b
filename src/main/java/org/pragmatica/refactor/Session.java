package org.pragmatica.refactor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.pragmatica.refactor.action.Action;
import org.pragmatica.refactor.action.Erase;
import org.pragmatica.refactor.action.EraseOrReplace;
import org.pragmatica.refactor.action.LazyInsertAfter;
import org.pragmatica.refactor.action.LazyInsertBefore;
import org.pragmatica.refactor.context.Configuration;
import org.pragmatica.refactor.context.Context;
import org.pragmatica.refactor.context.Representative;
import org.pragmatica.refactor.error.OverlappingActionsException;
import org.pragmatica.refactor.error.PreconditionFailure;
import org.pragmatica.refactor.error.SyntaxErrorException;
import org.pragmatica.refactor.error.UnparsableOutputException;
import org.pragmatica.refactor.internal.AccessFailure;
import org.pragmatica.refactor.internal.ActionOptimizer;
import org.pragmatica.refactor.internal.GraphPath;
import org.pragmatica.refactor.parser.PythonParser;
import org.pragmatica.refactor.tree.AstNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Applies a set of rules to a source until none of them matches anymore.
 *
 * <p>Each round parses the current source, offers every positioned node (breadth first) to every rule and
 * applies the first match found. The round's output becomes the next round's input. The loop ends when a
 * round finds no match, or produces a source seen before, in which case the round's input is the result.
 *
 * <pre>{@code
 * var session = Session.of(RuleSpec.of("propagate", PropagateConstants::new, Scope.KEY));
 * var result = session.run("a = 1\nb = a\n");
 * }</pre>
 */
public final class Session {
    private static final Logger logger = LogManager.getLogger(Session.class);

    private final List<RuleSpec> rules;
    private final Configuration config;
    private final Set<Representative.Key<?>> providers;

    public Session(List<RuleSpec> rules, Configuration config) {
        this.rules = List.copyOf(rules);
        this.config = config;
        var keys = new ArrayList<Representative.Key<?>>();
        for (var rule : this.rules) {
            keys.addAll(rule.providers());
        }
        this.providers = Representative.resolve(keys);
    }

    public Session(List<RuleSpec> rules) {
        this(rules, Configuration.DEFAULT);
    }

    public static Session of(RuleSpec... rules) {
        return new Session(Arrays.asList(rules));
    }

    public Configuration config() {
        return config;
    }

    /**
     * Refactor an in-memory source.
     *
     * @throws SyntaxErrorException       when the source itself doesn't parse
     * @throws UnparsableOutputException  when an applied action produced text that doesn't parse
     * @throws OverlappingActionsException when a chained action lost track of its node
     */
    public String run(String source) throws SyntaxErrorException {
        var tree = PythonParser.parse(source);
        return refactor(source, tree, null);
    }

    /**
     * Refactor a file, without touching it.
     *
     * @return the change to make, empty when the file doesn't parse, no rule accepts it, or nothing changed
     */
    public Optional<Change> runFile(Path file) throws IOException {
        var info = FileInfo.detect(file);
        var source = info.read();
        AstNode tree;
        try {
            tree = PythonParser.parse(source);
        } catch (SyntaxErrorException e) {
            logger.warn("Skipping {}, it doesn't parse:\n{}", file, e.diagnostic().format(source, file.toString()));
            return Optional.empty();
        }
        var refactored = refactor(source, tree, info);
        if (refactored.equals(source)) {
            return Optional.empty();
        }
        return Optional.of(new Change(info, source, refactored));
    }

    private String refactor(String source, AstNode tree, @Nullable FileInfo file) {
        var known = new HashSet<String>();
        known.add(source);
        var current = source;
        var currentTree = tree;
        while (true) {
            var context = snapshot(current, currentTree, file);
            var next = step(context);
            if (next.isEmpty()) {
                return current;
            }
            var produced = next.get();
            if (!known.add(produced)) {
                logger.info("Source of {} recurred, stopping", describe(file));
                return current;
            }
            currentTree = parseOutput(produced);
            current = produced;
        }
    }

    /**
     * One round: the source after the first applicable match, empty at the fixpoint.
     */
    private Optional<String> step(Context context) {
        var active = activeRules(context);
        if (active.isEmpty()) {
            return Optional.empty();
        }
        for (var node : context.tree().walk()) {
            if (!node.hasPosition()) {
                continue;
            }
            for (var rule : active) {
                var match = tryMatch(rule, node);
                if (match.isPresent()) {
                    logger.debug("{} matched {} at {}:{}", rule, node.type(), node.line(), node.column());
                    return Optional.of(apply(match.get(), context));
                }
            }
        }
        return Optional.empty();
    }

    private List<Rule> activeRules(Context context) {
        var path = context.file().flatMap(FileInfo::file).orElse(null);
        var active = new ArrayList<Rule>();
        for (var spec : rules) {
            var rule = spec.instantiate(context);
            if (rule.checkFile(path)) {
                active.add(rule);
            } else {
                logger.debug("{} skips {}", spec.name(), path);
            }
        }
        return active;
    }

    private static Optional<Match> tryMatch(Rule rule, AstNode node) {
        try {
            return rule.match(node);
        } catch (PreconditionFailure e) {
            return Optional.empty();
        }
    }

    private String apply(Match match, Context context) {
        if (match instanceof Match.Single single) {
            var action = ActionOptimizer.optimize(single.action(), context);
            logger.debug("Applying {}", action);
            return action.apply(context, context.source());
        }
        return applyChain(match.actions(), context);
    }

    /**
     * Apply actions built against one snapshot in order. Each action after the first is relocated in the
     * re-parsed output of its predecessors through its path in the original tree, corrected for the list items
     * inserted or removed so far.
     */
    private String applyChain(List<Action> actions, Context origin) {
        var ancestry = origin.ancestry();
        var paths = new ArrayList<GraphPath>();
        for (var action : actions) {
            paths.add(GraphPath.backtrack(ancestry, action.node()));
        }
        var shifts = new ArrayList<GraphPath.Shift>();
        var source = origin.source();
        var anchorContext = origin;
        for (int i = 0; i < actions.size(); i++) {
            var action = actions.get(i);
            var path = paths.get(i).shifted(shifts);
            AstNode anchor;
            if (i == 0) {
                anchor = action.node();
            } else {
                anchorContext = snapshot(source, parseOutput(source), origin.file().orElse(null));
                try {
                    anchor = path.resolve(anchorContext.tree());
                } catch (AccessFailure e) {
                    throw new OverlappingActionsException("Can't apply " + action + ", its node is no longer at "
                                                          + path + " after the preceding actions", e);
                }
            }
            shiftOf(action, anchor, anchorContext, path).ifPresent(shifts::add);
            logger.debug("Applying chained {} at {}", action, path);
            source = action.splice(anchor, anchorContext, origin, source);
        }
        return source;
    }

    private static Optional<GraphPath.Shift> shiftOf(Action action, AstNode anchor, Context anchorContext,
                                                     GraphPath path) {
        if (path.steps().isEmpty()) {
            return Optional.empty();
        }
        if (action instanceof LazyInsertAfter) {
            return Optional.of(GraphPath.Shift.around(path, 0, 1));
        }
        if (action instanceof LazyInsertBefore) {
            return Optional.of(GraphPath.Shift.around(path, -1, 1));
        }
        if (action instanceof EraseOrReplace eraseOrReplace) {
            return eraseOrReplace.isErasable(anchor, anchorContext)
                   ? Optional.of(GraphPath.Shift.around(path, 0, -1))
                   : Optional.empty();
        }
        if (action instanceof Erase) {
            return Optional.of(GraphPath.Shift.around(path, 0, -1));
        }
        return Optional.empty();
    }

    private Context snapshot(String source, AstNode tree, @Nullable FileInfo file) {
        return Context.create(source, tree, file, config, providers);
    }

    private AstNode parseOutput(String source) {
        try {
            return PythonParser.parse(source);
        } catch (SyntaxErrorException e) {
            var dump = config.debugMode() ? persist(source) : null;
            if (dump != null) {
                logger.warn("Generated source doesn't parse, written to {}", dump);
            }
            throw new UnparsableOutputException(source, dump, e);
        }
    }

    private static @Nullable Path persist(String source) {
        try {
            var dump = Files.createTempFile("pyrefactor-", ".py");
            Files.writeString(dump, source, StandardCharsets.UTF_8);
            return dump;
        } catch (IOException e) {
            logger.warn("Can't persist generated source", e);
            return null;
        }
    }

    private static String describe(@Nullable FileInfo file) {
        return file == null ? "<string>" : file.file().map(Path::toString).orElse("<string>");
    }
}
