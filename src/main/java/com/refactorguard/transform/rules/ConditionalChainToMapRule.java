package com.refactorguard.transform.rules;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithParameters;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.YieldStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.refactorguard.detector.DetectorKind;
import com.refactorguard.detector.patterns.ConditionalChainDetector;
import com.refactorguard.parser.Statements;
import com.refactorguard.transform.BranchBodyPolicy;
import com.refactorguard.transform.MismatchReason;
import com.refactorguard.transform.TransformOutcome;
import com.refactorguard.transform.TransformationRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Replaces an equality chain with a map of callables and one lookup:
 * <pre>
 *   if (x == 1) {              Map&lt;Object, Runnable&gt; actions = Map.of(1, () -&gt; a(), 2, () -&gt; b());
 *       a();           --&gt;     actions.getOrDefault(x, () -&gt; c()).run();
 *   } else if (x == 2) {
 *       b();
 *   } else {
 *       c();
 *   }
 * </pre>
 * Without a trailing {@code else} the lookup has no fallback
 * ({@code actions.get(x).run()}).
 * <p>
 * A branch body that is not a single expression statement cannot become an
 * expression lambda; what happens then is decided by the {@link BranchBodyPolicy}.
 * A single expression statement that assigns a variable by simple name is
 * declined under every policy: a lambda cannot write a captured local, and
 * without symbol resolution a local and a field look the same.
 * <p>
 * Map keys box to the type of their literal while the lookup boxes the
 * subject, so the chain is declined when the constants do not share one
 * literal type, or when the subject is declared with a different one
 * ({@code long x} against {@code 1}, say). A subject whose declaration is
 * not found, or whose type is not a primitive, a box or {@code String}, is
 * trusted as is.
 */
public class ConditionalChainToMapRule implements TransformationRule {

    static final String MAP_IMPORT = "java.util.Map";
    static final String MAPPING_NAME = "actions";
    private static final int MAP_OF_LIMIT = 10;
    private static final Set<String> KEY_TYPES =
            Set.of("Integer", "Long", "Character", "Boolean", "Double", "Float", "String", "Short", "Byte");

    private final BranchBodyPolicy policy;

    public ConditionalChainToMapRule() {
        this(BranchBodyPolicy.PLACEHOLDER);
    }

    public ConditionalChainToMapRule(BranchBodyPolicy policy) {
        this.policy = policy;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.CONDITIONAL_CHAIN;
    }

    @Override
    public TransformOutcome apply(Node node) {
        if (!(node instanceof IfStmt head)) {
            return TransformOutcome.unchanged(MismatchReason.UNSUPPORTED_NODE,
                    "Expected an if-statement but got " + node.getClass().getSimpleName() + ".");
        }

        String subject = null;
        List<Expression> keys = new ArrayList<>();
        List<Statement> bodies = new ArrayList<>();
        Statement defaultBody = null;

        IfStmt current = head;
        while (current != null) {
            if (!(current.getCondition() instanceof BinaryExpr comparison)
                    || comparison.getOperator() != BinaryExpr.Operator.EQUALS) {
                return TransformOutcome.unchanged(MismatchReason.NOT_EQUALITY_COMPARISON,
                        "If chain conditions must be equality checks.");
            }
            if (!comparison.getLeft().isNameExpr()) {
                return TransformOutcome.unchanged(MismatchReason.SUBJECT_NOT_IDENTIFIER,
                        "If chain conditions must compare a variable to a constant.");
            }
            String name = comparison.getLeft().asNameExpr().getNameAsString();
            if (subject == null) {
                subject = name;
            } else if (!subject.equals(name)) {
                return TransformOutcome.unchanged(MismatchReason.SUBJECT_NOT_SHARED,
                        "If chain conditions must compare the same variable.");
            }
            Expression key = comparison.getRight();
            if (!ConditionalChainDetector.isConstant(key)) {
                return TransformOutcome.unchanged(MismatchReason.COMPARATOR_NOT_CONSTANT,
                        "If chain conditions must compare against constants.");
            }
            if (keys.contains(key)) {
                return TransformOutcome.unchanged(MismatchReason.DUPLICATE_CONSTANT,
                        "Constant " + key + " is compared twice, a map cannot hold it twice.");
            }
            if (!keys.isEmpty() && !keyType(key).equals(keyType(keys.get(0)))) {
                return TransformOutcome.unchanged(MismatchReason.KEY_TYPE_MISMATCH,
                        "Constants " + keys.get(0) + " and " + key + " have different types.");
            }
            keys.add(key.clone());
            bodies.add(current.getThenStmt());

            Optional<Statement> alternative = current.getElseStmt();
            if (alternative.isPresent() && alternative.get().isIfStmt()) {
                current = alternative.get().asIfStmt();
            } else {
                defaultBody = alternative.orElse(null);
                current = null;
            }
        }
        if (keys.isEmpty()) {
            return TransformOutcome.unchanged(MismatchReason.NO_EQUALITY_BRANCH,
                    "If chain has no equality branch.");
        }

        String keyType = keyType(keys.get(0));
        Optional<String> subjectType = declaredType(head, subject).flatMap(ConditionalChainToMapRule::boxedName);
        if (subjectType.isPresent() && !subjectType.get().equals(keyType)) {
            return TransformOutcome.unchanged(MismatchReason.KEY_TYPE_MISMATCH,
                    "Subject " + subject + " is a " + subjectType.get() + " but the constants are " + keyType + ".");
        }
        for (Statement body : bodies) {
            if (writesLocalInExpression(body)) {
                return writesLocal(body);
            }
        }
        if (defaultBody != null && writesLocalInExpression(defaultBody)) {
            return writesLocal(defaultBody);
        }

        List<String> notes = new ArrayList<>();
        List<Expression> entries = new ArrayList<>();
        for (int i = 0; i < keys.size(); i++) {
            Optional<LambdaExpr> wrapped = wrap(bodies.get(i), notes);
            if (wrapped.isEmpty()) {
                return declined(bodies.get(i));
            }
            entries.add(keys.get(i));
            entries.add(wrapped.get());
        }
        LambdaExpr fallback = null;
        if (defaultBody != null) {
            Optional<LambdaExpr> wrapped = wrap(defaultBody, notes);
            if (wrapped.isEmpty()) {
                return declined(defaultBody);
            }
            fallback = wrapped.get();
        }

        String mappingName = Expressions.freshName(head, MAPPING_NAME);
        Statement declaration = new ExpressionStmt(new VariableDeclarationExpr(
                new VariableDeclarator(mappingType(), mappingName, mapLiteral(entries))));

        MethodCallExpr lookup = fallback == null
                ? new MethodCallExpr(new NameExpr(mappingName), "get",
                        new NodeList<>(new NameExpr(subject)))
                : new MethodCallExpr(new NameExpr(mappingName), "getOrDefault",
                        new NodeList<>(new NameExpr(subject), fallback));
        Statement invocation = new ExpressionStmt(new MethodCallExpr(lookup, "run"));

        return new TransformOutcome.Replaced(List.of(declaration, invocation), Set.of(MAP_IMPORT), notes);
    }

    private Optional<LambdaExpr> wrap(Statement body, List<String> notes) {
        List<Statement> statements = Statements.bodyOf(body);
        if (statements.size() == 1 && statements.get(0).isExpressionStmt()) {
            return Optional.of(Expressions.supplier(statements.get(0).asExpressionStmt().getExpression().clone()));
        }
        switch (policy) {
            case PLACEHOLDER:
                if (!statements.isEmpty()) {
                    notes.add("Branch body at line " + line(body) + " replaced by a no-op, dropped: "
                            + statements.stream().map(s -> s.toString().strip()).collect(Collectors.joining(" ")));
                }
                return Optional.of(Expressions.noOp());
            case CLOSURE:
                if (jumpsOut(statements) || assignsOuterLocal(statements)) {
                    return Optional.empty();
                }
                NodeList<Statement> copies = new NodeList<>();
                statements.forEach(s -> copies.add(s.clone()));
                return Optional.of(Expressions.closure(new BlockStmt(copies)));
            case REJECT:
            default:
                return Optional.empty();
        }
    }

    private TransformOutcome declined(Statement body) {
        return TransformOutcome.unchanged(MismatchReason.BRANCH_BODY_NOT_EXPRESSION,
                "Branch body at line " + line(body) + " cannot be wrapped in a callable under policy " + policy + ".");
    }

    private static TransformOutcome writesLocal(Statement body) {
        return TransformOutcome.unchanged(MismatchReason.BRANCH_BODY_NOT_EXPRESSION,
                "Branch body at line " + line(body) + " assigns a variable, which a lambda cannot capture.");
    }

    private static boolean writesLocalInExpression(Statement body) {
        List<Statement> statements = Statements.bodyOf(body);
        return statements.size() == 1 && statements.get(0).isExpressionStmt() && assignsOuterLocal(statements);
    }

    /** Box type a literal key takes in the map. */
    static String keyType(Expression literal) {
        if (literal instanceof IntegerLiteralExpr) {
            return "Integer";
        }
        if (literal instanceof LongLiteralExpr) {
            return "Long";
        }
        if (literal instanceof CharLiteralExpr) {
            return "Character";
        }
        if (literal instanceof BooleanLiteralExpr) {
            return "Boolean";
        }
        if (literal instanceof DoubleLiteralExpr d) {
            String value = d.getValue();
            return value.endsWith("f") || value.endsWith("F") ? "Float" : "Double";
        }
        return "String";
    }

    private static Optional<String> boxedName(Type type) {
        if (type.isPrimitiveType()) {
            return Optional.of(type.asPrimitiveType().toBoxedType().getNameAsString());
        }
        if (type.isClassOrInterfaceType() && KEY_TYPES.contains(type.asClassOrInterfaceType().getNameAsString())) {
            return Optional.of(type.asClassOrInterfaceType().getNameAsString());
        }
        return Optional.empty();
    }

    /** Nearest parameter, local or field named {@code name} around {@code anchor}. */
    private static Optional<Type> declaredType(Node anchor, String name) {
        Node scope = anchor.getParentNode().orElse(null);
        while (scope != null) {
            if (scope instanceof NodeWithParameters<?> withParameters) {
                for (Parameter parameter : withParameters.getParameters()) {
                    if (parameter.getNameAsString().equals(name)) {
                        return Optional.of(parameter.getType());
                    }
                }
            }
            if (scope instanceof CallableDeclaration || scope instanceof LambdaExpr
                    || scope instanceof InitializerDeclaration) {
                Optional<VariableDeclarator> local = scope.findFirst(VariableDeclarator.class,
                        v -> v.getNameAsString().equals(name));
                if (local.isPresent()) {
                    return Optional.of(local.get().getType());
                }
            }
            if (scope instanceof TypeDeclaration<?> type) {
                for (FieldDeclaration field : type.getFields()) {
                    for (VariableDeclarator variable : field.getVariables()) {
                        if (variable.getNameAsString().equals(name)) {
                            return Optional.of(variable.getType());
                        }
                    }
                }
            }
            scope = scope.getParentNode().orElse(null);
        }
        return Optional.empty();
    }

    private static boolean jumpsOut(List<Statement> statements) {
        return statements.stream().anyMatch(s -> s.findFirst(ReturnStmt.class).isPresent()
                || s.findFirst(BreakStmt.class).isPresent()
                || s.findFirst(ContinueStmt.class).isPresent()
                || s.findFirst(YieldStmt.class).isPresent());
    }

    // Lambdas may only capture effectively final locals.
    private static boolean assignsOuterLocal(List<Statement> statements) {
        Set<String> declaredInside = statements.stream()
                .flatMap(s -> s.findAll(VariableDeclarator.class).stream())
                .map(VariableDeclarator::getNameAsString)
                .collect(Collectors.toSet());
        for (Statement statement : statements) {
            for (AssignExpr assign : statement.findAll(AssignExpr.class)) {
                if (assign.getTarget().isNameExpr()
                        && !declaredInside.contains(assign.getTarget().asNameExpr().getNameAsString())) {
                    return true;
                }
            }
            for (UnaryExpr unary : statement.findAll(UnaryExpr.class)) {
                if (isIncrementOrDecrement(unary) && unary.getExpression().isNameExpr()
                        && !declaredInside.contains(unary.getExpression().asNameExpr().getNameAsString())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isIncrementOrDecrement(UnaryExpr unary) {
        UnaryExpr.Operator op = unary.getOperator();
        return op == UnaryExpr.Operator.PREFIX_INCREMENT || op == UnaryExpr.Operator.PREFIX_DECREMENT
                || op == UnaryExpr.Operator.POSTFIX_INCREMENT || op == UnaryExpr.Operator.POSTFIX_DECREMENT;
    }

    private static ClassOrInterfaceType mappingType() {
        return new ClassOrInterfaceType(null, "Map")
                .setTypeArguments(new ClassOrInterfaceType(null, "Object"), new ClassOrInterfaceType(null, "Runnable"));
    }

    private static MethodCallExpr mapLiteral(List<Expression> keysAndValues) {
        NameExpr map = new NameExpr("Map");
        if (keysAndValues.size() / 2 <= MAP_OF_LIMIT) {
            return new MethodCallExpr(map, "of", new NodeList<>(keysAndValues));
        }
        NodeList<Expression> entries = new NodeList<>();
        for (int i = 0; i < keysAndValues.size(); i += 2) {
            entries.add(new MethodCallExpr(new NameExpr("Map"), "entry",
                    new NodeList<>(keysAndValues.get(i), keysAndValues.get(i + 1))));
        }
        return new MethodCallExpr(map, "ofEntries", entries);
    }

    private static int line(Node node) {
        return node.getBegin().map(p -> p.line).orElse(0);
    }
}
