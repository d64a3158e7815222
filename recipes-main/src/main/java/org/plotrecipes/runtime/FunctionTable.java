package org.plotrecipes.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;

import org.plotrecipes.RecipeEvaluationException;

/**
 * Named host functions that recipe {@code CALL} nodes resolve against at compile time.
 */
public class FunctionTable {

    private record Entry(int minArgs, int maxArgs, RecipeFunction function) {

        boolean accepts(int argCount) {
            return argCount >= minArgs && (maxArgs < 0 || argCount <= maxArgs);
        }
    }

    private final Map<String, List<Entry>> functions = new ConcurrentHashMap<>();

    public static FunctionTable empty() {
        return new FunctionTable();
    }

    public static FunctionTable withBuiltins() {
        FunctionTable table = new FunctionTable();
        table.register("+", 2, args -> arithmetic('+', args[0], args[1]));
        table.register("-", 2, args -> arithmetic('-', args[0], args[1]));
        table.register("-", 1, args -> arithmetic('-', 0L, args[0]));
        table.register("*", 2, args -> arithmetic('*', args[0], args[1]));
        table.register("/", 2, args -> toDouble(args[0]) / toDouble(args[1]));
        table.register("==", 2, args -> valueEquals(args[0], args[1]));
        table.register("!=", 2, args -> !valueEquals(args[0], args[1]));
        table.register("<", 2, args -> compare(args[0], args[1]) < 0);
        table.register("<=", 2, args -> compare(args[0], args[1]) <= 0);
        table.register(">", 2, args -> compare(args[0], args[1]) > 0);
        table.register(">=", 2, args -> compare(args[0], args[1]) >= 0);
        table.register("!", 1, args -> !toBoolean(args[0]));
        table.register("rand", 1, args -> randomValues(toInt(args[0])));
        table.register("rand", 2, args -> {
            List<Object> rows = new ArrayList<>();
            for (int i = 0; i < toInt(args[0]); i++) {
                rows.add(randomValues(toInt(args[1])));
            }
            return rows;
        });
        table.register("range", 2, args -> {
            List<Object> values = new ArrayList<>();
            for (long i = toLong(args[0]); i <= toLong(args[1]); i++) {
                values.add(i);
            }
            return values;
        });
        table.register("length", 1, args -> (long) length(args[0]));
        table.register("dict", 0, -1, args -> {
            AttributeMap map = new AttributeMap();
            for (Object arg : args) {
                if (!(arg instanceof Pair)) {
                    throw new RecipeEvaluationException("dict expects pairs, got " + arg);
                }
                Pair pair = (Pair) arg;
                map.put(toSymbol(pair.key()), pair.value());
            }
            return map;
        });
        table.register("haskey", 2, args -> toAttributeMap(args[0]).containsKey(toSymbol(args[1])));
        table.register("get", 3, args -> {
            AttributeMap map = toAttributeMap(args[0]);
            Symbol key = toSymbol(args[1]);
            return map.containsKey(key) ? map.get(key) : args[2];
        });
        table.register("string", 0, -1, args -> {
            StringBuilder sb = new StringBuilder();
            for (Object arg : args) {
                sb.append(arg instanceof Symbol ? ((Symbol) arg).name() : String.valueOf(arg));
            }
            return sb.toString();
        });
        table.register("isnothing", 1, args -> Nothing.isNothing(args[0]));
        return table;
    }

    public FunctionTable register(String name, RecipeFunction function) {
        return register(name, 0, -1, function);
    }

    public FunctionTable register(String name, int arity, RecipeFunction function) {
        return register(name, arity, arity, function);
    }

    /**
     * @param maxArgs upper bound on the argument count, negative for unbounded
     */
    public FunctionTable register(String name, int minArgs, int maxArgs, RecipeFunction function) {
        functions.computeIfAbsent(name, k -> new CopyOnWriteArrayList<>()).add(0, new Entry(minArgs, maxArgs, function));
        return this;
    }

    /**
     * Finds the most recently registered function named {@code name} that accepts {@code argCount} arguments.
     *
     * @return the function, or null if there is none
     */
    public RecipeFunction lookup(String name, int argCount) {
        List<Entry> candidates = functions.get(name);
        if (candidates == null) {
            return null;
        }
        for (Entry entry : candidates) {
            if (entry.accepts(argCount)) {
                return entry.function();
            }
        }
        return null;
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Collection<String> names() {
        return functions.keySet();
    }

    private static List<Object> randomValues(int n) {
        ThreadLocalRandom rng = ThreadLocalRandom.current();
        List<Object> values = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            values.add(rng.nextDouble());
        }
        return values;
    }

    private static Object arithmetic(char op, Object left, Object right) {
        if (isIntegral(left) && isIntegral(right)) {
            long l = toLong(left);
            long r = toLong(right);
            switch (op) {
                case '+': return l + r;
                case '-': return l - r;
                default: return l * r;
            }
        }
        double l = toDouble(left);
        double r = toDouble(right);
        switch (op) {
            case '+': return l + r;
            case '-': return l - r;
            default: return l * r;
        }
    }

    private static boolean valueEquals(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return compare(left, right) == 0;
        }
        return left == null ? right == null : left.equals(right);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compare(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            if (isIntegral(left) && isIntegral(right)) {
                return Long.compare(toLong(left), toLong(right));
            }
            return Double.compare(toDouble(left), toDouble(right));
        }
        if (left instanceof Comparable && left.getClass() == right.getClass()) {
            return ((Comparable) left).compareTo(right);
        }
        throw new RecipeEvaluationException("Cannot compare " + left + " with " + right);
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    public static long toLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        throw new RecipeEvaluationException("Expected a number, got " + value);
    }

    public static int toInt(Object value) {
        return Math.toIntExact(toLong(value));
    }

    public static double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new RecipeEvaluationException("Expected a number, got " + value);
    }

    public static boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new RecipeEvaluationException("Expected a boolean, got " + value);
    }

    public static Symbol toSymbol(Object value) {
        if (value instanceof Symbol) {
            return (Symbol) value;
        }
        if (value instanceof String) {
            return Symbol.of((String) value);
        }
        throw new RecipeEvaluationException("Expected a symbol, got " + value);
    }

    public static AttributeMap toAttributeMap(Object value) {
        if (value instanceof AttributeMap) {
            return (AttributeMap) value;
        }
        throw new RecipeEvaluationException("Expected an attribute map, got " + value);
    }

    private static int length(Object value) {
        if (value instanceof Collection) {
            return ((Collection<?>) value).size();
        }
        if (value instanceof Tuple) {
            return ((Tuple) value).size();
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length();
        }
        if (value instanceof AttributeMap) {
            return ((AttributeMap) value).size();
        }
        throw new RecipeEvaluationException("length is not defined for " + value);
    }
}
