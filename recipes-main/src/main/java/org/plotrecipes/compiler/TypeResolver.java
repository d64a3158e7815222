package org.plotrecipes.compiler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.plotrecipes.TypeResolutionException;
import org.plotrecipes.ast.Node;
import org.plotrecipes.ast.NodeKind;
import org.plotrecipes.runtime.AttributeMap;
import org.plotrecipes.runtime.Symbol;
import org.plotrecipes.runtime.Tuple;

/**
 * Resolves type expressions of recipe signatures to classes. Parameterized types resolve to their base type.
 */
public class TypeResolver {

    private final Map<String, Class<?>> types = new ConcurrentHashMap<>();
    private final ClassLoader classLoader;

    public TypeResolver() {
        this(Thread.currentThread().getContextClassLoader());
    }

    public TypeResolver(ClassLoader classLoader) {
        this.classLoader = classLoader;
        types.put("Any", Object.class);
        types.put("Int", Long.class);
        types.put("Float", Double.class);
        types.put("Bool", Boolean.class);
        types.put("Symbol", Symbol.class);
        types.put("Tuple", Tuple.class);
        types.put("AttributeMap", AttributeMap.class);
    }

    public TypeResolver register(String name, Class<?> type) {
        types.put(name, type);
        return this;
    }

    public TypeResolver register(Class<?> type) {
        return register(type.getSimpleName(), type);
    }

    public Class<?> resolve(Node type) {
        if (type.is(NodeKind.SYMBOL)) {
            return resolve(type.name());
        }
        if (type.is(NodeKind.CURLY) && type.size() > 0) {
            return resolve(type.child(0));
        }
        throw new TypeResolutionException(type.toString(), null);
    }

    public Class<?> resolve(String name) {
        Class<?> type = types.get(name);
        if (type != null) {
            return type;
        }
        if (name.indexOf('.') < 0) {
            try {
                return Class.forName("java.lang." + name, false, classLoader);
            } catch (ClassNotFoundException e) {
                throw new TypeResolutionException(name, e);
            }
        }
        try {
            return Class.forName(name, false, classLoader);
        } catch (ClassNotFoundException e) {
            throw new TypeResolutionException(name, e);
        }
    }
}
