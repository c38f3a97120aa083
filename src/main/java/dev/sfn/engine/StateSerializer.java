package dev.sfn.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.sfn.exceptions.UnsupportedOperation;
import dev.sfn.graph.Edge;
import dev.sfn.graph.EdgeAttrs;
import dev.sfn.graph.StateGraph;
import dev.sfn.graph.StateNode;
import dev.sfn.syntax.Expr;
import dev.sfn.syntax.Keyword;
import dev.sfn.syntax.Stmt;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Serializes a shaped {@link StateGraph} into an ASL definition:
 * {@code {"StartAt": ..., "States": {...}}}.
 * <p>
 * State-specific fields come first, then transitions: {@code Catch} from catcher edges,
 * {@code Choices}/{@code Default} for Choice states, otherwise {@code Next} for the single
 * default edge or {@code End: true} when there is none.
 */
public final class StateSerializer {

    /**
     * Supplies the compiled definition of a function used as a Parallel branch or Map iterator.
     */
    @FunctionalInterface
    public interface BranchResolver {
        ObjectNode definition(Expr.Name function);
    }

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private static final Set<String> TASK_OPTIONS = Set.of("resource", "timeout", "heartbeat", "retry", "parameters");
    private static final Set<String> PARALLEL_OPTIONS = Set.of("retry");
    private static final Set<String> MAP_OPTIONS = Set.of("items", "max_concurrency", "retry");
    private static final Set<String> WAIT_OPTIONS = Set.of("seconds", "timestamp");

    private final String dataName;
    private final BranchResolver branches;

    public StateSerializer(String dataName, BranchResolver branches) {
        this.dataName = dataName;
        this.branches = branches;
    }

    /**
     * Serialize the whole graph.
     *
     * @param comment optional {@code Comment}, may be null
     */
    public ObjectNode serialize(StateGraph graph, String comment) {
        if (graph.start() == StateGraph.NO_START) {
            throw new IllegalStateException("Graph has no start state");
        }
        ObjectNode definition = JSON.objectNode();
        if (comment != null && !comment.isBlank()) {
            definition.put("Comment", comment.strip());
        }
        definition.put("StartAt", graph.name(graph.start()));
        ObjectNode states = definition.putObject("States");
        for (int id : graph.ids()) {
            states.set(graph.name(id), serializeState(graph, id));
        }
        return definition;
    }

    public ObjectNode serializeState(StateGraph graph, int id) {
        StateNode node = graph.node(id);
        ObjectNode data = JSON.objectNode();
        data.put("Type", node.type());

        if (node instanceof StateNode.PassState pass) {
            pass(pass, data);
        } else if (node instanceof StateNode.TaskState task) {
            task(task, data);
        } else if (node instanceof StateNode.ParallelState parallel) {
            parallel(parallel, data);
        } else if (node instanceof StateNode.MapState map) {
            map(map, data);
        } else if (node instanceof StateNode.WaitState wait) {
            waitState(wait, data);
        } else if (node instanceof StateNode.FailState fail) {
            fail(fail, data);
        } else if (!(node instanceof StateNode.ChoiceState) && !(node instanceof StateNode.SucceedState)) {
            throw new IllegalStateException("Unknown state " + node);
        }

        transitions(graph, id, data);
        return data;
    }

    // State-specific fields

    private void pass(StateNode.PassState pass, ObjectNode data) {
        if (pass.isPlaceholder()) {
            return;
        }
        if (pass.origin() instanceof Stmt.Assign assign) {
            data.set("Result", ValueExtractors.json(assign.value()));
            data.put("ResultPath", DataPaths.resultPath(assign.target(), dataName));
            return;
        }
        // data.update({...})
        Expr.Call call = (Expr.Call) ((Stmt.ExprStmt) pass.origin()).value();
        UnsupportedOperation.check(call.args().size() == 1 && call.keywords().isEmpty()
                && call.args().get(0) instanceof Expr.DictLit,
            "%s.update() takes a single dict literal".formatted(dataName), call.position());
        data.set("Result", ValueExtractors.json(call.args().get(0)));
        data.put("ResultPath", "$");
    }

    private void task(StateNode.TaskState task, ObjectNode data) {
        Expr.Call call = task.call();
        Map<String, Expr> options = options(call, TASK_OPTIONS);

        Expr resource = options.get("resource");
        if (!call.args().isEmpty()) {
            UnsupportedOperation.check(call.args().size() == 1 && resource == null,
                "task() takes the resource as its only positional argument", call.position());
            resource = call.args().get(0);
        }
        UnsupportedOperation.check(resource != null, "task() requires a resource", call.position());
        data.put("Resource", ValueExtractors.string(resource));

        if (options.containsKey("parameters")) {
            data.set("Parameters", ValueExtractors.parameters(options.get("parameters"), dataName));
        }
        if (options.containsKey("timeout")) {
            data.put("TimeoutSeconds", positive(options.get("timeout")));
        }
        if (options.containsKey("heartbeat")) {
            data.put("HeartbeatSeconds", positive(options.get("heartbeat")));
        }
        resultPath(task.target(), data);
        retry(options, data);
    }

    private void parallel(StateNode.ParallelState parallel, ObjectNode data) {
        Expr.Call call = parallel.call();
        Map<String, Expr> options = options(call, PARALLEL_OPTIONS);
        UnsupportedOperation.check(!call.args().isEmpty(),
            "parallel() requires at least one branch function", call.position());

        ArrayNode branchList = data.putArray("Branches");
        for (Expr arg : call.args()) {
            branchList.add(branches.definition(functionReference(arg)));
        }
        resultPath(parallel.target(), data);
        retry(options, data);
    }

    private void map(StateNode.MapState map, ObjectNode data) {
        Expr.Call call = map.call();
        Map<String, Expr> options = options(call, MAP_OPTIONS);
        UnsupportedOperation.check(call.args().size() == 1,
            "map() takes the iterator function as its only positional argument", call.position());
        Expr items = options.get("items");
        UnsupportedOperation.check(items != null, "map() requires items=%s[...]".formatted(dataName), call.position());

        data.put("ItemsPath", DataPaths.path(items, dataName));
        if (options.containsKey("max_concurrency")) {
            data.set("MaxConcurrency", ValueExtractors.integerNode(ValueExtractors.integer(options.get("max_concurrency"))));
        }
        data.set("Iterator", branches.definition(functionReference(call.args().get(0))));
        resultPath(map.target(), data);
        retry(options, data);
    }

    private void waitState(StateNode.WaitState wait, ObjectNode data) {
        Expr.Call call = wait.call();
        Map<String, Expr> options = options(call, WAIT_OPTIONS);
        UnsupportedOperation.check(call.args().isEmpty() && options.size() == 1,
            "wait() takes exactly one of seconds= or timestamp=", call.position());

        var option = options.entrySet().iterator().next();
        boolean seconds = option.getKey().equals("seconds");
        Expr value = option.getValue();
        if (DataPaths.isReference(value, dataName)) {
            data.put(seconds ? "SecondsPath" : "TimestampPath", DataPaths.path(value, dataName));
        } else if (seconds) {
            data.set("Seconds", ValueExtractors.integerNode(ValueExtractors.integer(value)));
        } else {
            data.put("Timestamp", ValueExtractors.string(value));
        }
    }

    private void fail(StateNode.FailState fail, ObjectNode data) {
        Expr exception = fail.origin().exception();
        if (exception == null) {
            return;
        }
        if (exception instanceof Expr.Call call) {
            UnsupportedOperation.check(call.keywords().isEmpty() && call.args().size() <= 1,
                "Raised errors take at most one cause string", call.position());
            data.put("Error", StateGraphBuilder.dottedName(call.func()));
            if (!call.args().isEmpty()) {
                data.put("Cause", ValueExtractors.string(call.args().get(0)));
            }
            return;
        }
        data.put("Error", StateGraphBuilder.dottedName(exception));
    }

    // Shared fields

    private void resultPath(Expr target, ObjectNode data) {
        if (target == null) {
            data.putNull("ResultPath");
        } else {
            data.put("ResultPath", DataPaths.resultPath(target, dataName));
        }
    }

    private void retry(Map<String, Expr> options, ObjectNode data) {
        Expr retry = options.get("retry");
        if (retry == null) {
            return;
        }
        JsonNode value = ValueExtractors.json(retry);
        ArrayNode retriers = JSON.arrayNode();
        if (value.isObject()) {
            retriers.add(value);
        } else if (value.isArray()) {
            retriers.addAll((ArrayNode) value);
        }
        UnsupportedOperation.check(!retriers.isEmpty(),
            "retry must be a dict or a list of dicts", retry.position());
        for (JsonNode retrier : retriers) {
            UnsupportedOperation.check(retrier.isObject() && retrier.path("ErrorEquals").isArray(),
                "Each retrier must be a dict with an ErrorEquals list", retry.position());
        }
        data.set("Retry", retriers);
    }

    private static int positive(Expr node) {
        long value = ValueExtractors.integer(node);
        UnsupportedOperation.check(value > 0 && value <= Integer.MAX_VALUE,
            "Expected a positive number of seconds", node.position());
        return (int) value;
    }

    private static Expr.Name functionReference(Expr arg) {
        if (arg instanceof Expr.Name name) {
            return name;
        }
        throw new UnsupportedOperation("Expected the name of a function in this module", arg.position());
    }

    private static Map<String, Expr> options(Expr.Call call, Set<String> allowed) {
        var options = new LinkedHashMap<String, Expr>();
        for (Keyword keyword : call.keywords()) {
            UnsupportedOperation.check(allowed.contains(keyword.name()),
                "Unsupported option '%s' for %s()".formatted(keyword.name(), call.funcName()), keyword.position());
            UnsupportedOperation.check(options.put(keyword.name(), keyword.value()) == null,
                "Option '%s' is repeated".formatted(keyword.name()), keyword.position());
        }
        return options;
    }

    // Transitions

    private void transitions(StateGraph graph, int id, ObjectNode data) {
        StateNode node = graph.node(id);
        List<Edge> outgoing = graph.outgoing(id);

        List<Edge> catchers = outgoing.stream().filter(e -> e.attrs() instanceof EdgeAttrs.Catch).toList();
        if (!catchers.isEmpty()) {
            if (!node.canFail()) {
                throw new IllegalStateException(graph.name(id) + " cannot have catchers");
            }
            ArrayNode list = data.putArray("Catch");
            for (Edge edge : catchers) {
                var attrs = (EdgeAttrs.Catch) edge.attrs();
                ObjectNode catcher = list.addObject();
                ArrayNode errors = catcher.putArray("ErrorEquals");
                attrs.errorEquals().forEach(errors::add);
                if (attrs.resultPath() != null) {
                    catcher.put("ResultPath", attrs.resultPath());
                }
                catcher.put("Next", graph.name(edge.to()));
            }
        }

        List<Edge> next = outgoing.stream().filter(Edge::isNext).toList();
        if (node instanceof StateNode.ChoiceState) {
            ArrayNode choices = data.putArray("Choices");
            for (Edge edge : outgoing) {
                if (edge.attrs() instanceof EdgeAttrs.Condition condition) {
                    ObjectNode rule = ChoiceRules.rule(condition.test(), dataName);
                    rule.put("Next", graph.name(edge.to()));
                    choices.add(rule);
                }
            }
            if (next.size() > 1) {
                throw new IllegalStateException(graph.name(id) + " has " + next.size() + " defaults");
            }
            if (next.size() == 1) {
                data.put("Default", graph.name(next.get(0).to()));
            }
            return;
        }

        if (node instanceof StateNode.SucceedState || node instanceof StateNode.FailState) {
            if (!next.isEmpty()) {
                throw new IllegalStateException(graph.name(id) + " is terminal but has successors");
            }
            return;
        }

        if (next.size() > 1) {
            throw new IllegalStateException(graph.name(id) + " has " + next.size() + " successors");
        }
        if (next.size() == 1) {
            data.put("Next", graph.name(next.get(0).to()));
        } else {
            data.put("End", true);
        }
    }
}
