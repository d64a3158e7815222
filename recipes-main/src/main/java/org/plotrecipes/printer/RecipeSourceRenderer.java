package org.plotrecipes.printer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.VarType;
import org.plotrecipes.RecipeCompileException;
import org.plotrecipes.ast.Node;
import org.plotrecipes.ast.NodeKind;
import org.plotrecipes.runtime.Nothing;
import org.plotrecipes.runtime.Symbol;
import org.plotrecipes.transformer.GeneratedNames;
import org.plotrecipes.transformer.GeneratedRecipe;
import org.plotrecipes.transformer.RecipeParameter;
import org.plotrecipes.transformer.TypeParameter;

/**
 * Renders a {@link GeneratedRecipe} as the Java method it stands for, for inspection.
 * <p>
 * Compound nodes used as values are hoisted into temporaries, and {@code let} rebindings of the attribute map get
 * fresh variable names since Java does not allow shadowing locals.
 */
public class RecipeSourceRenderer {

    static final String METHOD_NAME = "applyRecipe";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Map<String, BinaryExpr.Operator> OPERATOR_MAP = Map.ofEntries(
            Map.entry("==", BinaryExpr.Operator.EQUALS),
            Map.entry("!=", BinaryExpr.Operator.NOT_EQUALS),
            Map.entry("<", BinaryExpr.Operator.LESS),
            Map.entry(">", BinaryExpr.Operator.GREATER),
            Map.entry("<=", BinaryExpr.Operator.LESS_EQUALS),
            Map.entry(">=", BinaryExpr.Operator.GREATER_EQUALS),
            Map.entry("+", BinaryExpr.Operator.PLUS),
            Map.entry("-", BinaryExpr.Operator.MINUS),
            Map.entry("*", BinaryExpr.Operator.MULTIPLY),
            Map.entry("/", BinaryExpr.Operator.DIVIDE)
    );

    private static final Map<String, String> TYPE_NAMES = Map.of(
            "Any", "Object",
            "Int", "Long",
            "Float", "Double",
            "Bool", "Boolean"
    );

    public String render(GeneratedRecipe recipe) {
        return toMethod(recipe).toString();
    }

    public MethodDeclaration toMethod(GeneratedRecipe recipe) {
        MethodDeclaration method = new MethodDeclaration();
        method.setModifiers(Modifier.Keyword.PUBLIC, Modifier.Keyword.STATIC);
        method.setName(METHOD_NAME);
        method.setType(classType("List", classType("RecipeData")));

        NodeList<com.github.javaparser.ast.type.TypeParameter> typeParameters = new NodeList<>();
        for (TypeParameter typeParameter : recipe.typeParameters()) {
            NodeList<ClassOrInterfaceType> bounds = new NodeList<>();
            if (typeParameter.bound() != null) {
                bounds.add(type(typeParameter.bound()));
            }
            typeParameters.add(new com.github.javaparser.ast.type.TypeParameter(typeParameter.name(), bounds));
        }
        method.setTypeParameters(typeParameters);

        Emitter emitter = new Emitter(recipe.name());
        method.addParameter(classType("AttributeMap"), emitter.declare(GeneratedNames.ATTRIBUTES));
        for (RecipeParameter parameter : recipe.parameters()) {
            Type type = parameter.type() == null ? classType("Object") : type(parameter.type());
            method.addParameter(type, emitter.declare(parameter.name()));
        }

        BlockStmt body = new BlockStmt();
        List<Node> statements = recipe.body().children();
        for (int i = 0; i < statements.size() - 1; i++) {
            emitter.statement(statements.get(i), body);
        }
        body.addStatement(new ReturnStmt(emitter.expression(statements.get(statements.size() - 1), body)));
        method.setBody(body);
        return method;
    }

    private static ClassOrInterfaceType type(Node type) {
        if (type.is(NodeKind.SYMBOL)) {
            return classType(TYPE_NAMES.getOrDefault(type.name(), type.name()));
        }
        if (type.is(NodeKind.CURLY) && type.size() > 0) {
            Type[] arguments = new Type[type.size() - 1];
            for (int i = 1; i < type.size(); i++) {
                arguments[i - 1] = type(type.child(i));
            }
            return classType(type(type.child(0)).getNameAsString(), arguments);
        }
        return classType("Object");
    }

    private static ClassOrInterfaceType classType(String name, Type... typeArguments) {
        NodeList<Type> arguments = typeArguments.length == 0 ? null : NodeList.nodeList(typeArguments);
        return new ClassOrInterfaceType(null, new SimpleName(name), arguments);
    }

    private static String javaName(String name) {
        return GeneratedNames.isGenerated(name) ? "$" + name.substring(1) : name;
    }

    private static Expression call(Expression scope, String name, Expression... args) {
        return new MethodCallExpr(scope, name, NodeList.nodeList(args));
    }

    private static Expression nothing() {
        return new FieldAccessExpr(new NameExpr("Nothing"), "NOTHING");
    }

    private static boolean isNothingLiteral(Node node) {
        return node.is(NodeKind.LITERAL) && Nothing.isNothing(node.value());
    }

    private static Expression parenthesized(Expression expression) {
        return expression instanceof BinaryExpr ? new EnclosedExpr(expression) : expression;
    }

    /**
     * Per-method rendering state: visible names and temporaries.
     */
    private static final class Emitter {

        private final String recipeName;
        private final Deque<Map<String, String>> scopes = new ArrayDeque<>();
        private final Set<String> used = new HashSet<>();
        private int temporaries;

        Emitter(String recipeName) {
            this.recipeName = recipeName;
            scopes.push(new HashMap<>());
        }

        String declare(String name) {
            String base = javaName(name);
            String javaName = base;
            for (int n = 1; used.contains(javaName); n++) {
                javaName = base + n;
            }
            used.add(javaName);
            scopes.peek().put(name, javaName);
            return javaName;
        }

        String lookup(String name) {
            for (Map<String, String> scope : scopes) {
                String javaName = scope.get(name);
                if (javaName != null) {
                    return javaName;
                }
            }
            return null;
        }

        String temporary(BlockStmt out) {
            String name = "$t" + (++temporaries);
            used.add(name);
            out.addStatement(new VariableDeclarationExpr(classType("Object"), name));
            return name;
        }

        void statement(Node node, BlockStmt out) {
            switch (node.kind()) {
                case BLOCK:
                    for (Node child : node.children()) {
                        statement(child, out);
                    }
                    break;
                case IF:
                    out.addStatement(ifStatement(node, out, null));
                    break;
                case FOR: {
                    Expression iterable = expression(node.child(1), out);
                    scopes.push(new HashMap<>());
                    String variable = declare(node.child(0).name());
                    BlockStmt body = new BlockStmt();
                    statement(node.child(2), body);
                    scopes.pop();
                    out.addStatement(new ForEachStmt(new VariableDeclarationExpr(new VarType(), variable), iterable, body));
                    break;
                }
                case WHILE: {
                    Expression condition = expression(node.child(0), out);
                    hoistAssignments(node.child(1), out);
                    BlockStmt body = new BlockStmt();
                    statement(node.child(1), body);
                    out.addStatement(new WhileStmt(condition, body));
                    break;
                }
                case ASSIGN:
                    assign(node, out);
                    break;
                case LET:
                    out.addStatement(let(node, out, null));
                    break;
                case FAIL_UNSUPPORTED:
                    out.addStatement(failUnsupported(node, out));
                    break;
                case DEBUG_TRACE:
                    out.addStatement(debugTrace(node, out));
                    break;
                default: {
                    Expression expression = expression(node, out);
                    if (expression instanceof MethodCallExpr || expression instanceof AssignExpr
                            || expression instanceof ObjectCreationExpr) {
                        out.addStatement(new ExpressionStmt(expression));
                    }
                }
            }
        }

        Expression expression(Node node, BlockStmt out) {
            switch (node.kind()) {
                case LITERAL:
                    return literal(node.value());
                case QUOTE:
                    return call(new NameExpr("Symbol"), "of",
                                new StringLiteralExpr().setString(((Symbol) node.value()).name()));
                case SYMBOL: {
                    String name = lookup(node.name());
                    return new NameExpr(name == null ? javaName(node.name()) : name);
                }
                case CALL:
                    return functionCall(node, out);
                case TUPLE:
                    return call(new NameExpr("Tuple"), "of", expressions(node.children(), out));
                case PAIR:
                    return new ObjectCreationExpr(null, classType("Pair"),
                                                  NodeList.nodeList(expressions(node.children(), out)));
                case BLOCK: {
                    if (node.size() == 0) {
                        return nothing();
                    }
                    for (int i = 0; i < node.size() - 1; i++) {
                        statement(node.child(i), out);
                    }
                    return expression(node.child(node.size() - 1), out);
                }
                case IF: {
                    String temporary = temporary(out);
                    out.addStatement(ifStatement(node, out, temporary));
                    return new NameExpr(temporary);
                }
                case ASSIGN:
                    return new NameExpr(assign(node, out));
                case LET: {
                    String temporary = temporary(out);
                    out.addStatement(let(node, out, temporary));
                    return new NameExpr(temporary);
                }
                case FOR:
                case WHILE:
                    statement(node, out);
                    return nothing();
                case FAIL_UNSUPPORTED:
                    out.addStatement(failUnsupported(node, out));
                    return nothing();
                case DEBUG_TRACE:
                    out.addStatement(debugTrace(node, out));
                    return nothing();
                case MAP_GET_OR_INSERT:
                    return call(expression(node.child(0), out), "getOrInsert",
                                expression(node.child(1), out), expression(node.child(2), out));
                case MAP_PUT:
                    return call(expression(node.child(0), out), "put",
                                expression(node.child(1), out), expression(node.child(2), out));
                case MAP_REMOVE:
                    return call(expression(node.child(0), out), "remove", expression(node.child(1), out));
                case MAP_COPY:
                    return call(expression(node.child(0), out), "copy");
                case KEY_SUPPORTED:
                    return call(new NameExpr("backend"), "isKeySupported", expression(node.child(0), out));
                case NEW_SERIES_LIST:
                    return new ObjectCreationExpr(null, new ClassOrInterfaceType(null, new SimpleName("ArrayList"), new NodeList<>()),
                                                  new NodeList<>());
                case EMIT_SERIES: {
                    Expression list = expression(node.child(0), out);
                    Expression data = new ObjectCreationExpr(null, classType("RecipeData"), NodeList.nodeList(
                            expression(node.child(1), out),
                            call(new NameExpr("Tuple"), "wrap", expression(node.child(2), out))));
                    return call(list, "add", data);
                }
                case IS_SOMETHING:
                    return new UnaryExpr(call(new NameExpr("Nothing"), "isNothing", expression(node.child(0), out)),
                                         UnaryExpr.Operator.LOGICAL_COMPLEMENT);
                default:
                    throw new RecipeCompileException("Cannot render '" + node.kind().label() + "': " + node, recipeName);
            }
        }

        private Expression literal(Object value) {
            if (Nothing.isNothing(value)) {
                return nothing();
            }
            if (value instanceof Long || value instanceof Integer) {
                return new LongLiteralExpr(value + "L");
            }
            if (value instanceof Double || value instanceof Float) {
                return new DoubleLiteralExpr(String.valueOf(value));
            }
            if (value instanceof Boolean) {
                return new BooleanLiteralExpr((Boolean) value);
            }
            return new StringLiteralExpr().setString(String.valueOf(value));
        }

        private Expression functionCall(Node node, BlockStmt out) {
            String name = node.child(0).is(NodeKind.SYMBOL) ? node.child(0).name() : node.child(0).toString();
            Expression[] args = expressions(node.children().subList(1, node.size()), out);
            BinaryExpr.Operator operator = OPERATOR_MAP.get(name);
            if (operator != null && args.length == 2) {
                return new BinaryExpr(parenthesized(args[0]), parenthesized(args[1]), operator);
            }
            if ("!".equals(name) && args.length == 1) {
                return new UnaryExpr(parenthesized(args[0]), UnaryExpr.Operator.LOGICAL_COMPLEMENT);
            }
            if ("-".equals(name) && args.length == 1) {
                return new UnaryExpr(parenthesized(args[0]), UnaryExpr.Operator.MINUS);
            }
            if (IDENTIFIER.matcher(name).matches()) {
                return new MethodCallExpr(null, name, NodeList.nodeList(args));
            }
            Expression[] withName = new Expression[args.length + 1];
            withName[0] = new StringLiteralExpr().setString(name);
            System.arraycopy(args, 0, withName, 1, args.length);
            return new MethodCallExpr(null, "call", NodeList.nodeList(withName));
        }

        private Expression[] expressions(List<Node> nodes, BlockStmt out) {
            Expression[] expressions = new Expression[nodes.size()];
            for (int i = 0; i < nodes.size(); i++) {
                expressions[i] = expression(nodes.get(i), out);
            }
            return expressions;
        }

        /**
         * @param target variable receiving the value of the taken branch, or null in statement position
         */
        private Statement ifStatement(Node node, BlockStmt out, String target) {
            Expression condition = expression(node.child(0), out);
            for (Node arm : node.children().subList(1, node.size())) {
                hoistAssignments(arm, out);
            }
            BlockStmt then = branch(node.child(1), target);
            Statement otherwise = null;
            if (node.size() == 3 && (target != null || !isNothingLiteral(node.child(2)))) {
                otherwise = branch(node.child(2), target);
            } else if (target != null) {
                otherwise = new BlockStmt(NodeList.<Statement>nodeList(assignTo(target, nothing())));
            }
            return new IfStmt(condition, then, otherwise);
        }

        /**
         * Declares, in {@code out}, the variables first assigned somewhere in {@code node} that code after the
         * enclosing Java block can still see. Loop and {@code let} bodies keep their own names.
         */
        private void hoistAssignments(Node node, BlockStmt out) {
            if (node.kind().isLeaf()) {
                return;
            }
            switch (node.kind()) {
                case FOR:
                case LET:
                    hoistAssignments(node.child(1), out);
                    return;
                case ASSIGN:
                    if (node.child(0).is(NodeKind.SYMBOL) && lookup(node.child(0).name()) == null) {
                        String javaName = declare(node.child(0).name());
                        out.addStatement(new VariableDeclarationExpr(
                                new VariableDeclarator(classType("Object"), javaName, new NullLiteralExpr())));
                    }
                    break;
                default:
                    break;
            }
            for (Node child : node.children()) {
                hoistAssignments(child, out);
            }
        }

        private BlockStmt branch(Node node, String target) {
            BlockStmt block = new BlockStmt();
            if (target == null) {
                statement(node, block);
            } else {
                Expression value = expression(node, block);
                block.addStatement(assignTo(target, value));
            }
            return block;
        }

        private String assign(Node node, BlockStmt out) {
            String name = node.child(0).name();
            Expression value = expression(node.child(1), out);
            String javaName = lookup(name);
            if (javaName == null) {
                javaName = declare(name);
                out.addStatement(new VariableDeclarationExpr(new VariableDeclarator(new VarType(), javaName, value)));
            } else {
                out.addStatement(assignTo(javaName, value));
            }
            return javaName;
        }

        private Statement let(Node node, BlockStmt out, String target) {
            Expression init = expression(node.child(1), out);
            BlockStmt block = new BlockStmt();
            scopes.push(new HashMap<>());
            String variable = declare(node.child(0).name());
            block.addStatement(new VariableDeclarationExpr(new VariableDeclarator(classType("AttributeMap"), variable, init)));
            if (target == null) {
                statement(node.child(2), block);
            } else {
                block.addStatement(assignTo(target, expression(node.child(2), block)));
            }
            scopes.pop();
            return block;
        }

        private Statement failUnsupported(Node node, BlockStmt out) {
            return new ThrowStmt(new ObjectCreationExpr(null, classType("UnsupportedAttributeException"),
                                                        NodeList.nodeList(expression(node.child(0), out),
                                                                          call(new NameExpr("backend"), "name"))));
        }

        private Statement debugTrace(Node node, BlockStmt out) {
            Expression args = call(new NameExpr("Tuple"), "of", expressions(node.children(), out));
            Expression message = new BinaryExpr(new StringLiteralExpr("apply_recipe args: "), args,
                                                BinaryExpr.Operator.PLUS);
            return new IfStmt(call(new NameExpr("RecipeDebug"), "isEnabled"),
                              new BlockStmt(NodeList.<Statement>nodeList(
                                      new ExpressionStmt(call(new NameExpr("RecipeDebug"), "trace", message)))),
                              null);
        }

        private static Statement assignTo(String name, Expression value) {
            return new ExpressionStmt(new AssignExpr(new NameExpr(name), value, AssignExpr.Operator.ASSIGN));
        }
    }
}
