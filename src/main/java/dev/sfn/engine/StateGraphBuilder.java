package dev.sfn.engine;

import dev.sfn.exceptions.UnsupportedOperation;
import dev.sfn.graph.EdgeAttrs;
import dev.sfn.graph.StateGraph;
import dev.sfn.graph.StateNode;
import dev.sfn.syntax.Expr;
import dev.sfn.syntax.FunctionDef;
import dev.sfn.syntax.Stmt;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a function body into a raw {@link StateGraph}: one state per statement, wired
 * in source order.
 * <p>
 * The builder tracks a frontier of pending edges. Each statement's entry state receives
 * every pending edge, and the statement's exits become the new frontier. Branches of an
 * {@code if} and handlers of a {@code try} therefore rejoin at the next statement, or end
 * independently when nothing follows.
 */
public final class StateGraphBuilder {

    public static final String TASK = "task";
    public static final String PARALLEL = "parallel";
    public static final String MAP = "map";
    public static final String WAIT = "wait";
    public static final String UPDATE = "update";

    /** An edge whose source exists and whose target is the next state to be built. */
    private record Pending(int from, EdgeAttrs attrs) {}

    private final String dataName;
    private final StateGraph graph;
    private final Deque<List<Integer>> tryScopes = new ArrayDeque<>();

    private StateGraphBuilder(String dataName, Set<String> usedNames) {
        this.dataName = dataName;
        this.graph = new StateGraph(usedNames);
    }

    /**
     * Build the raw graph of a function.
     *
     * @param function the function definition; a leading docstring is skipped
     * @param dataName name of the data object parameter
     * @throws UnsupportedOperation for statements that have no state representation
     */
    public static StateGraph build(FunctionDef function, String dataName) {
        return build(function, dataName, new HashSet<>());
    }

    /**
     * Build the raw graph of a function whose states join a definition that already
     * uses {@code usedNames}.
     */
    public static StateGraph build(FunctionDef function, String dataName, Set<String> usedNames) {
        var builder = new StateGraphBuilder(dataName, usedNames);
        List<Stmt> body = statements(function);
        UnsupportedOperation.check(!body.isEmpty(),
            "Function '%s' has no statements".formatted(function.name()), function.position());

        List<Pending> exits = builder.block(body, List.of());
        builder.terminateChoices(exits);
        return builder.graph;
    }

    /**
     * The function body without its docstring.
     */
    public static List<Stmt> statements(FunctionDef function) {
        List<Stmt> body = function.body();
        if (docstring(function) != null) {
            return body.subList(1, body.size());
        }
        return body;
    }

    /**
     * The docstring of a function, or null.
     */
    public static String docstring(FunctionDef function) {
        if (!function.body().isEmpty()
                && function.body().get(0) instanceof Stmt.ExprStmt expr
                && expr.value() instanceof Expr.Str str) {
            return str.value();
        }
        return null;
    }

    private List<Pending> block(List<Stmt> body, List<Pending> incoming) {
        List<Pending> frontier = incoming;
        boolean first = true;
        for (Stmt stmt : body) {
            if (!first && frontier.isEmpty()) {
                throw new UnsupportedOperation("Unreachable statement: every path before it ends", stmt.position());
            }
            frontier = statement(stmt, frontier);
            first = false;
        }
        return frontier;
    }

    private List<Pending> statement(Stmt stmt, List<Pending> incoming) {
        if (stmt instanceof Stmt.Pass) {
            return next(place(new StateNode.PassState(stmt), incoming));
        }
        if (stmt instanceof Stmt.Assign assign) {
            return assignment(assign, incoming);
        }
        if (stmt instanceof Stmt.AugAssign aug) {
            throw new UnsupportedOperation(
                "Augmented assignment cannot be expressed as a static result; use %s[...] = <value>"
                    .formatted(dataName), aug.position());
        }
        if (stmt instanceof Stmt.ExprStmt expr) {
            return expression(expr, incoming);
        }
        if (stmt instanceof Stmt.If ifStmt) {
            return conditional(ifStmt, incoming);
        }
        if (stmt instanceof Stmt.Try tryStmt) {
            return guarded(tryStmt, incoming);
        }
        if (stmt instanceof Stmt.Return ret) {
            UnsupportedOperation.check(ret.value() == null,
                "Return values are not supported; store results in '%s'".formatted(dataName), ret.position());
            place(new StateNode.SucceedState(ret), incoming);
            return List.of();
        }
        if (stmt instanceof Stmt.Raise raise) {
            place(new StateNode.FailState(raise), incoming);
            return List.of();
        }
        throw new IllegalStateException("Unknown statement " + stmt);
    }

    private List<Pending> assignment(Stmt.Assign assign, List<Pending> incoming) {
        DataPaths.resultPath(assign.target(), dataName);

        if (assign.value() instanceof Expr.Call call && call.funcName() != null) {
            switch (call.funcName()) {
                case TASK -> {
                    return next(placeFailable(new StateNode.TaskState(assign, call, assign.target()), incoming));
                }
                case PARALLEL -> {
                    return next(placeFailable(new StateNode.ParallelState(assign, call, assign.target()), incoming));
                }
                case MAP -> {
                    return next(placeFailable(new StateNode.MapState(assign, call, assign.target()), incoming));
                }
                case WAIT -> throw new UnsupportedOperation("wait() has no result to assign", call.position());
                default -> {
                    // any other call is rejected as a non-literal Pass result
                }
            }
        }
        return next(place(new StateNode.PassState(assign), incoming));
    }

    private List<Pending> expression(Stmt.ExprStmt stmt, List<Pending> incoming) {
        if (!(stmt.value() instanceof Expr.Call call)) {
            throw new UnsupportedOperation("Expression statement has no effect", stmt.position());
        }
        if (call.func() instanceof Expr.Attribute attribute
                && attribute.attr().equals(UPDATE)
                && attribute.value() instanceof Expr.Name name
                && name.id().equals(dataName)) {
            return next(place(new StateNode.PassState(stmt), incoming));
        }
        String func = call.funcName();
        if (TASK.equals(func)) {
            return next(placeFailable(new StateNode.TaskState(stmt, call, null), incoming));
        }
        if (PARALLEL.equals(func)) {
            return next(placeFailable(new StateNode.ParallelState(stmt, call, null), incoming));
        }
        if (MAP.equals(func)) {
            return next(placeFailable(new StateNode.MapState(stmt, call, null), incoming));
        }
        if (WAIT.equals(func)) {
            return next(place(new StateNode.WaitState(stmt, call), incoming));
        }
        throw new UnsupportedOperation(
            "Unsupported call; expected one of %s(), %s(), %s(), %s() or %s.%s()"
                .formatted(TASK, PARALLEL, MAP, WAIT, dataName, UPDATE),
            call.position());
    }

    private List<Pending> conditional(Stmt.If stmt, List<Pending> incoming) {
        int choice = place(new StateNode.ChoiceState(stmt), incoming);
        var exits = new ArrayList<>(block(stmt.body(), List.of(new Pending(choice, new EdgeAttrs.Condition(stmt.test())))));
        var otherwise = new Pending(choice, EdgeAttrs.NEXT);
        if (stmt.orElse().isEmpty()) {
            exits.add(otherwise);
        } else {
            exits.addAll(block(stmt.orElse(), List.of(otherwise)));
        }
        return exits;
    }

    private List<Pending> guarded(Stmt.Try stmt, List<Pending> incoming) {
        List<Integer> scope = new ArrayList<>();
        tryScopes.push(scope);
        var exits = new ArrayList<>(block(stmt.body(), incoming));
        tryScopes.pop();
        UnsupportedOperation.check(!scope.isEmpty(),
            "try block contains no task, parallel or map that can fail", stmt.position());

        for (int i = 0; i < stmt.handlers().size(); i++) {
            Stmt.ExceptHandler handler = stmt.handlers().get(i);
            List<String> errors = errorNames(handler.type());
            UnsupportedOperation.check(!errors.contains(StateNode.ALL_ERRORS) || i == stmt.handlers().size() - 1,
                "A catch-all except clause must be the last one", handler.position());
            String resultPath = handler.name() == null ? null : DataPaths.keyPath(handler.name(), handler.position());

            var catchers = new ArrayList<Pending>();
            for (int source : scope) {
                if (!catchesAll(source)) {
                    catchers.add(new Pending(source, new EdgeAttrs.Catch(errors, resultPath)));
                }
            }
            UnsupportedOperation.check(!catchers.isEmpty(),
                "except clause is unreachable: errors are already caught", handler.position());
            exits.addAll(block(handler.body(), catchers));
        }
        return exits;
    }

    private boolean catchesAll(int source) {
        return graph.outgoing(source).stream()
            .anyMatch(e -> e.attrs() instanceof EdgeAttrs.Catch c && c.catchesAll());
    }

    private List<String> errorNames(Expr type) {
        if (type == null) {
            return List.of(StateNode.ALL_ERRORS);
        }
        if (type instanceof Expr.TupleLit tuple) {
            Set<String> names = new LinkedHashSet<>();
            for (Expr element : tuple.elements()) {
                names.addAll(errorNames(element));
            }
            if (names.contains(StateNode.ALL_ERRORS)) {
                return List.of(StateNode.ALL_ERRORS);
            }
            return List.copyOf(names);
        }
        String name = dottedName(type);
        return List.of(name.equals("Exception") ? StateNode.ALL_ERRORS : name);
    }

    /**
     * Dotted name of a {@code Name} or attribute chain, e.g. {@code States.Timeout}.
     */
    static String dottedName(Expr node) {
        if (node instanceof Expr.Name name) {
            return name.id();
        }
        if (node instanceof Expr.Attribute attribute) {
            return dottedName(attribute.value()) + "." + attribute.attr();
        }
        throw new UnsupportedOperation("Expected an error name", node.position());
    }

    /**
     * A Choice left without a default when the function ends gets a synthetic Succeed state.
     */
    private void terminateChoices(List<Pending> exits) {
        var dangling = exits.stream()
            .filter(p -> graph.node(p.from()) instanceof StateNode.ChoiceState)
            .toList();
        if (dangling.isEmpty()) {
            return;
        }
        var origin = (StateNode.ChoiceState) graph.node(dangling.get(0).from());
        place(new StateNode.SucceedState(origin.origin()), dangling);
    }

    private int place(StateNode node, List<Pending> incoming) {
        int id = graph.add(node);
        for (Pending pending : incoming) {
            graph.connect(pending.from(), id, pending.attrs());
        }
        if (graph.start() == StateGraph.NO_START) {
            graph.setStart(id);
        }
        return id;
    }

    private int placeFailable(StateNode node, List<Pending> incoming) {
        int id = place(node, incoming);
        for (List<Integer> scope : tryScopes) {
            scope.add(id);
        }
        return id;
    }

    private static List<Pending> next(int id) {
        return List.of(new Pending(id, EdgeAttrs.NEXT));
    }
}
