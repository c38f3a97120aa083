package dev.sfn.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.sfn.exceptions.UnsupportedOperation;
import dev.sfn.graph.StateGraph;
import dev.sfn.model.CompileResult;
import dev.sfn.model.CompiledStateMachine;
import dev.sfn.model.CompilerOptions;
import dev.sfn.model.DecoratorEffect;
import dev.sfn.syntax.Expr;
import dev.sfn.syntax.FunctionDef;
import dev.sfn.syntax.SourceModule;
import dev.sfn.syntax.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Compiles the functions of a source module into state machine definitions.
 * <p>
 * Every top-level function is a state machine, except those used as a Parallel branch
 * or a Map iterator: these are compiled inline wherever they are referenced. Functions
 * compile independently; a failure in one does not stop the others.
 */
public final class StateMachineCompiler {

    private static final Logger log = LoggerFactory.getLogger(StateMachineCompiler.class);

    private final CompilerOptions options;

    public StateMachineCompiler() {
        this(CompilerOptions.defaults());
    }

    public StateMachineCompiler(CompilerOptions options) {
        this.options = options;
    }

    /**
     * Compile every state machine function of {@code module}.
     *
     * @return one result per state machine function, in source order
     */
    public List<CompileResult> compile(SourceModule module) {
        Set<String> branchFunctions = branchFunctions(module);
        var results = new ArrayList<CompileResult>();
        for (FunctionDef function : module.functions()) {
            if (branchFunctions.contains(function.name())) {
                log.debug("Skipping {}.{}: compiled inline as a branch", module.name(), function.name());
                continue;
            }
            results.add(compileFunction(module, function));
        }
        return results;
    }

    /**
     * Compile a single function as a state machine.
     */
    public CompileResult compileFunction(SourceModule module, FunctionDef function) {
        log.debug("Compiling {}.{}", module.name(), function.name());
        try {
            List<DecoratorEffect> effects = DecoratorValidator.validate(function);
            ObjectNode definition = definition(module, function, new ArrayDeque<>(), new HashSet<>());
            log.debug("Compiled {}.{}: {} states, {} decorator effects", module.name(), function.name(),
                definition.get("States").size(), effects.size());
            return new CompileResult.Success(new CompiledStateMachine(function.name(), definition, effects));
        } catch (UnsupportedOperation e) {
            log.debug("Failed to compile {}.{}: {}", module.name(), function.name(), e.getMessage());
            return new CompileResult.Failure(function.name(), e.getMessage(), e.position());
        }
    }

    private ObjectNode definition(SourceModule module, FunctionDef function, Deque<String> stack,
                                  Set<String> stateNames) {
        checkSignature(function);
        stack.push(function.name());

        StateGraph graph = StateGraphBuilder.build(function, options.dataName(), stateNames);
        int built = graph.size();
        int removed = GraphShaper.shape(graph);
        log.debug("Shaped {}: {} states built, {} placeholders removed", function.name(), built, removed);

        var serializer = new StateSerializer(options.dataName(),
            reference -> branch(module, reference, stack, stateNames));
        ObjectNode definition = serializer.serialize(graph, StateGraphBuilder.docstring(function));
        stack.pop();
        return definition;
    }

    private ObjectNode branch(SourceModule module, Expr.Name reference, Deque<String> stack,
                              Set<String> stateNames) {
        FunctionDef function = module.function(reference.id()).orElseThrow(() -> new UnsupportedOperation(
            "Unknown function '%s'".formatted(reference.id()), reference.position()));
        UnsupportedOperation.check(!stack.contains(function.name()),
            "Function '%s' refers to itself through its branches".formatted(function.name()), reference.position());
        UnsupportedOperation.check(function.decorators().isEmpty(),
            "Resource decorators are not supported on branch function '%s'".formatted(function.name()),
            function.decorators().isEmpty() ? function.position() : function.decorators().get(0).position());
        return definition(module, function, stack, stateNames);
    }

    private void checkSignature(FunctionDef function) {
        UnsupportedOperation.check(function.params().equals(List.of(options.dataName())),
            "State machine function '%s' must take a single '%s' parameter"
                .formatted(function.name(), options.dataName()),
            function.position());
    }

    /**
     * Names of the functions referenced by {@code parallel()} or {@code map()} anywhere in the module.
     */
    public static Set<String> branchFunctions(SourceModule module) {
        var names = new LinkedHashSet<String>();
        for (FunctionDef function : module.functions()) {
            collectBranches(function.body(), names);
        }
        return names;
    }

    private static void collectBranches(List<Stmt> body, Set<String> names) {
        for (Stmt stmt : body) {
            Expr value = null;
            if (stmt instanceof Stmt.Assign assign) {
                value = assign.value();
            } else if (stmt instanceof Stmt.ExprStmt expr) {
                value = expr.value();
            } else if (stmt instanceof Stmt.If ifStmt) {
                collectBranches(ifStmt.body(), names);
                collectBranches(ifStmt.orElse(), names);
            } else if (stmt instanceof Stmt.Try tryStmt) {
                collectBranches(tryStmt.body(), names);
                tryStmt.handlers().forEach(h -> collectBranches(h.body(), names));
            }
            if (value instanceof Expr.Call call
                    && (StateGraphBuilder.PARALLEL.equals(call.funcName()) || StateGraphBuilder.MAP.equals(call.funcName()))) {
                for (Expr arg : call.args()) {
                    if (arg instanceof Expr.Name name) {
                        names.add(name.id());
                    }
                }
            }
        }
    }
}
