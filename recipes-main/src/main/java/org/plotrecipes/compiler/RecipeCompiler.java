package org.plotrecipes.compiler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.plotrecipes.FunctionResolutionException;
import org.plotrecipes.RecipeCompileException;
import org.plotrecipes.RecipeDebug;
import org.plotrecipes.RecipeEvaluationException;
import org.plotrecipes.RecipeException;
import org.plotrecipes.UnsupportedAttributeException;
import org.plotrecipes.ast.Node;
import org.plotrecipes.ast.NodeKind;
import org.plotrecipes.runtime.Backend;
import org.plotrecipes.runtime.DispatchKey;
import org.plotrecipes.runtime.FunctionTable;
import org.plotrecipes.runtime.Nothing;
import org.plotrecipes.runtime.Pair;
import org.plotrecipes.runtime.RecipeData;
import org.plotrecipes.runtime.RecipeFunction;
import org.plotrecipes.runtime.Symbol;
import org.plotrecipes.runtime.Tuple;
import org.plotrecipes.transformer.GeneratedNames;
import org.plotrecipes.transformer.GeneratedRecipe;
import org.plotrecipes.transformer.RecipeParameter;

import static org.plotrecipes.runtime.FunctionTable.toAttributeMap;
import static org.plotrecipes.runtime.FunctionTable.toBoolean;
import static org.plotrecipes.runtime.FunctionTable.toSymbol;

/**
 * Compiles a {@link GeneratedRecipe} into a tree of {@link CompiledNode} closures.
 * <p>
 * Variables are resolved to frame slots and function names to {@link FunctionTable} entries at compile time, so a
 * recipe that refers to an unknown name fails here rather than when it is first invoked. The backend consulted for
 * attribute support is fixed per compiler.
 */
public class RecipeCompiler {

    private final FunctionTable functions;
    private final TypeResolver typeResolver;
    private final Backend backend;

    public RecipeCompiler(FunctionTable functions, TypeResolver typeResolver, Backend backend) {
        this.functions = functions;
        this.typeResolver = typeResolver;
        this.backend = backend;
    }

    public CompiledRecipe compile(GeneratedRecipe recipe) {
        LocalSlotTable slots = new LocalSlotTable(GeneratedNames.ATTRIBUTES);
        Scope scope = new Scope(recipe.name(), slots);

        List<RecipeParameter> parameters = recipe.parameters();
        int[] parameterSlots = new int[parameters.size()];
        CompiledNode[] defaults = new CompiledNode[parameters.size()];
        for (int i = 0; i < parameters.size(); i++) {
            RecipeParameter parameter = parameters.get(i);
            // a default may refer to the parameters before it, not to itself
            if (parameter.defaultValue() != null) {
                defaults[i] = compile(scope, parameter.defaultValue());
            }
            parameterSlots[i] = slots.allocate(parameter.name());
        }

        CompiledNode body = compile(scope, recipe.body());
        return new CompiledRecipe(recipe, dispatchKey(recipe), parameterSlots, defaults, body, slots.frameSize());
    }

    public DispatchKey dispatchKey(GeneratedRecipe recipe) {
        List<Class<?>> types = new ArrayList<>();
        for (Node type : recipe.dispatchTypes()) {
            types.add(typeResolver.resolve(type));
        }
        return new DispatchKey(types, recipe.required());
    }

    private record Scope(String recipeName, LocalSlotTable slots) {
    }

    private CompiledNode compile(Scope scope, Node node) {
        return switch (node.kind()) {
            case LITERAL, QUOTE -> constant(node.value());
            case SYMBOL -> variable(scope, node);
            case CALL -> call(scope, node);
            case TUPLE -> tuple(scope, node);
            case PAIR -> pair(scope, node);
            case BLOCK -> block(scope, node);
            case IF -> conditional(scope, node);
            case FOR -> forLoop(scope, node);
            case WHILE -> whileLoop(scope, node);
            case ASSIGN -> assignment(scope, node);
            case LET -> let(scope, node);
            case MAP_GET_OR_INSERT -> mapGetOrInsert(scope, node);
            case MAP_PUT -> mapPut(scope, node);
            case MAP_REMOVE -> mapRemove(scope, node);
            case MAP_COPY -> mapCopy(scope, node);
            case KEY_SUPPORTED -> keySupported(scope, node);
            case FAIL_UNSUPPORTED -> failUnsupported(scope, node);
            case NEW_SERIES_LIST -> frame -> new ArrayList<RecipeData>();
            case EMIT_SERIES -> emitSeries(scope, node);
            case IS_SOMETHING -> isSomething(scope, node);
            case DEBUG_TRACE -> debugTrace(scope, node);
            default -> throw new RecipeCompileException(
                    "'" + node.kind().label() + "' is not valid in a recipe body: " + node, scope.recipeName());
        };
    }

    private static CompiledNode constant(Object value) {
        Object normalized = Nothing.normalize(value);
        return frame -> normalized;
    }

    private CompiledNode variable(Scope scope, Node node) {
        String name = node.name();
        if (!scope.slots().contains(name)) {
            throw new RecipeCompileException("Undefined variable '" + name + "'", scope.recipeName());
        }
        int slot = scope.slots().slot(name);
        return frame -> frame.load(slot, name);
    }

    private CompiledNode call(Scope scope, Node node) {
        if (node.size() == 0) {
            throw new RecipeCompileException("Call without a function: " + node, scope.recipeName());
        }
        Node callee = node.child(0);
        if (!callee.is(NodeKind.SYMBOL)) {
            throw new RecipeCompileException("Only named functions can be called: " + node, scope.recipeName());
        }
        String name = callee.name();
        CompiledNode[] args = compileAll(scope, node.children().subList(1, node.size()));
        RecipeFunction function = functions.lookup(name, args.length);
        if (function == null) {
            throw new FunctionResolutionException(scope.recipeName(), name, args.length);
        }
        return frame -> {
            Object[] values = evalAll(args, frame);
            try {
                return Nothing.normalize(function.call(values));
            } catch (RecipeException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new RecipeEvaluationException("Function '" + name + "' failed: " + e.getMessage(), e);
            }
        };
    }

    private CompiledNode tuple(Scope scope, Node node) {
        CompiledNode[] elements = compileAll(scope, node.children());
        return frame -> Tuple.of(evalAll(elements, frame));
    }

    private CompiledNode pair(Scope scope, Node node) {
        requireOperands(scope, node, 2);
        CompiledNode key = compile(scope, node.child(0));
        CompiledNode value = compile(scope, node.child(1));
        return frame -> new Pair(key.eval(frame), value.eval(frame));
    }

    private CompiledNode block(Scope scope, Node node) {
        CompiledNode[] statements = compileAll(scope, node.children());
        if (statements.length == 0) {
            return constant(Nothing.NOTHING);
        }
        return frame -> {
            Object last = Nothing.NOTHING;
            for (CompiledNode statement : statements) {
                last = statement.eval(frame);
            }
            return last;
        };
    }

    private CompiledNode conditional(Scope scope, Node node) {
        if (node.size() != 2 && node.size() != 3) {
            throw new RecipeCompileException("Malformed if: " + node, scope.recipeName());
        }
        CompiledNode condition = compile(scope, node.child(0));
        CompiledNode then = compile(scope, node.child(1));
        CompiledNode otherwise = node.size() == 3 ? compile(scope, node.child(2)) : constant(Nothing.NOTHING);
        return frame -> toBoolean(condition.eval(frame)) ? then.eval(frame) : otherwise.eval(frame);
    }

    private CompiledNode forLoop(Scope scope, Node node) {
        if (node.size() != 3 || !node.child(0).is(NodeKind.SYMBOL)) {
            throw new RecipeCompileException("Malformed for loop: " + node, scope.recipeName());
        }
        String variable = node.child(0).name();
        CompiledNode iterable = compile(scope, node.child(1));
        scope.slots().pushScope();
        int slot = scope.slots().allocate(variable);
        CompiledNode body = compile(scope, node.child(2));
        int bodyEnd = scope.slots().frameSize();
        scope.slots().popScope();
        return frame -> {
            for (Object element : iterate(iterable.eval(frame))) {
                // each iteration starts with fresh loop locals
                frame.clear(slot + 1, bodyEnd);
                frame.store(slot, element);
                body.eval(frame);
            }
            return Nothing.NOTHING;
        };
    }

    private CompiledNode whileLoop(Scope scope, Node node) {
        requireOperands(scope, node, 2);
        CompiledNode condition = compile(scope, node.child(0));
        CompiledNode body = compile(scope, node.child(1));
        return frame -> {
            while (toBoolean(condition.eval(frame))) {
                body.eval(frame);
            }
            return Nothing.NOTHING;
        };
    }

    private CompiledNode assignment(Scope scope, Node node) {
        if (node.size() != 2 || !node.child(0).is(NodeKind.SYMBOL)) {
            throw new RecipeCompileException("Only plain variables can be assigned: " + node, scope.recipeName());
        }
        CompiledNode value = compile(scope, node.child(1));
        int slot = scope.slots().assignmentSlot(node.child(0).name());
        return frame -> {
            Object result = value.eval(frame);
            frame.store(slot, result);
            return result;
        };
    }

    private CompiledNode let(Scope scope, Node node) {
        if (node.size() != 3 || !node.child(0).is(NodeKind.SYMBOL)) {
            throw new RecipeCompileException("Malformed let: " + node, scope.recipeName());
        }
        CompiledNode init = compile(scope, node.child(1));
        scope.slots().pushScope();
        int slot = scope.slots().allocate(node.child(0).name());
        CompiledNode body = compile(scope, node.child(2));
        scope.slots().popScope();
        return frame -> {
            frame.store(slot, init.eval(frame));
            return body.eval(frame);
        };
    }

    private CompiledNode mapGetOrInsert(Scope scope, Node node) {
        requireOperands(scope, node, 3);
        CompiledNode map = compile(scope, node.child(0));
        CompiledNode key = compile(scope, node.child(1));
        CompiledNode value = compile(scope, node.child(2));
        return frame -> toAttributeMap(map.eval(frame)).getOrInsert(toSymbol(key.eval(frame)), value.eval(frame));
    }

    private CompiledNode mapPut(Scope scope, Node node) {
        requireOperands(scope, node, 3);
        CompiledNode map = compile(scope, node.child(0));
        CompiledNode key = compile(scope, node.child(1));
        CompiledNode value = compile(scope, node.child(2));
        return frame -> toAttributeMap(map.eval(frame)).put(toSymbol(key.eval(frame)), value.eval(frame));
    }

    private CompiledNode mapRemove(Scope scope, Node node) {
        requireOperands(scope, node, 2);
        CompiledNode map = compile(scope, node.child(0));
        CompiledNode key = compile(scope, node.child(1));
        return frame -> {
            toAttributeMap(map.eval(frame)).remove(toSymbol(key.eval(frame)));
            return Nothing.NOTHING;
        };
    }

    private CompiledNode mapCopy(Scope scope, Node node) {
        requireOperands(scope, node, 1);
        CompiledNode map = compile(scope, node.child(0));
        return frame -> toAttributeMap(map.eval(frame)).copy();
    }

    private CompiledNode keySupported(Scope scope, Node node) {
        requireOperands(scope, node, 1);
        CompiledNode key = compile(scope, node.child(0));
        return frame -> backend.isKeySupported(toSymbol(key.eval(frame)));
    }

    private CompiledNode failUnsupported(Scope scope, Node node) {
        requireOperands(scope, node, 1);
        CompiledNode key = compile(scope, node.child(0));
        return frame -> {
            Symbol symbol = toSymbol(key.eval(frame));
            throw new UnsupportedAttributeException(symbol, backend.name());
        };
    }

    @SuppressWarnings("unchecked")
    private CompiledNode emitSeries(Scope scope, Node node) {
        requireOperands(scope, node, 3);
        CompiledNode list = compile(scope, node.child(0));
        CompiledNode map = compile(scope, node.child(1));
        CompiledNode args = compile(scope, node.child(2));
        return frame -> {
            List<RecipeData> series = (List<RecipeData>) list.eval(frame);
            series.add(new RecipeData(toAttributeMap(map.eval(frame)), Tuple.wrap(args.eval(frame))));
            return Nothing.NOTHING;
        };
    }

    private CompiledNode isSomething(Scope scope, Node node) {
        requireOperands(scope, node, 1);
        CompiledNode value = compile(scope, node.child(0));
        return frame -> !Nothing.isNothing(value.eval(frame));
    }

    private CompiledNode debugTrace(Scope scope, Node node) {
        CompiledNode[] args = compileAll(scope, node.children());
        return frame -> {
            if (RecipeDebug.isEnabled()) {
                RecipeDebug.trace("apply_recipe args: " + Tuple.of(evalAll(args, frame)));
            }
            return Nothing.NOTHING;
        };
    }

    private static void requireOperands(Scope scope, Node node, int count) {
        if (node.size() != count) {
            throw new RecipeCompileException("'" + node.kind().label() + "' takes " + count + " operands, got "
                                             + node.size() + ": " + node, scope.recipeName());
        }
    }

    private CompiledNode[] compileAll(Scope scope, List<Node> nodes) {
        CompiledNode[] compiled = new CompiledNode[nodes.size()];
        for (int i = 0; i < nodes.size(); i++) {
            compiled[i] = compile(scope, nodes.get(i));
        }
        return compiled;
    }

    private static Object[] evalAll(CompiledNode[] nodes, Frame frame) {
        Object[] values = new Object[nodes.length];
        for (int i = 0; i < nodes.length; i++) {
            values[i] = nodes[i].eval(frame);
        }
        return values;
    }

    private static Iterable<?> iterate(Object value) {
        if (value instanceof Iterable) {
            return (Iterable<?>) value;
        }
        if (value instanceof Object[]) {
            return Arrays.asList((Object[]) value);
        }
        throw new RecipeEvaluationException("Cannot iterate over " + value);
    }
}
