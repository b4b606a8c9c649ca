package com.github.rewrite.query.java;

import com.github.rewrite.query.convert.ConversionResult;
import com.github.rewrite.query.convert.QueryClause;
import com.github.rewrite.query.convert.QueryExpression;
import com.github.rewrite.query.semantic.SemanticModel;
import com.github.rewrite.query.syntax.Expression;
import com.github.rewrite.query.syntax.Statement;
import com.github.rewrite.query.syntax.SyntaxNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.Nullable;
import org.openrewrite.java.JavaIsoVisitor;
import org.openrewrite.java.tree.J;
import org.openrewrite.java.tree.JavaType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * Renders a query as a {@code java.util.stream} pipeline:
 * <pre>
 * from x in xs         xs.stream()                 or Arrays.stream(xs), Arrays.stream(xs).boxed()
 * from y in x.items    .flatMap(x -&gt; x.items.stream())
 * where c              .filter(v -&gt; c)
 * let z = e            .map(v -&gt; e)
 * </pre>
 * and the terminal as a statement:
 * <pre>
 * COUNT     counter += pipeline.count();
 * TO_LIST   list.addAll(pipeline.map(v -&gt; item).collect(Collectors.toList()));
 * DEFAULT   pipeline.forEach(v -&gt; { statements });
 * </pre>
 * A stream only carries one value, so a clause or terminal that still refers to a range variable
 * replaced by a later {@code from} or {@code let} cannot be rendered. Neither can a source that is
 * not a collection or array, a {@code DEFAULT} terminal that jumps out of the loop, writes a local
 * variable of the enclosing method or has no statements at all.
 */
public class StreamPipelinePrinter {

    private static final Logger logger = LogManager.getLogger(StreamPipelinePrinter.class);

    static final String COLLECTORS = "java.util.stream.Collectors";
    static final String ARRAYS = "java.util.Arrays";

    private final JavaSyntaxAdapter adapter;
    private final SemanticModel semanticModel;

    public StreamPipelinePrinter(JavaSyntaxAdapter adapter, SemanticModel semanticModel) {
        this.adapter = adapter;
        this.semanticModel = semanticModel;
    }

    public Optional<StreamSuggestion> print(ConversionResult result) {
        Pipeline pipeline = new Pipeline();
        if (!pipeline.build(result.getQuery())) {
            return Optional.empty();
        }

        String code;
        switch (result.getStrategyKind()) {
            case COUNT -> code = text(result.getModifyingExpression()) + " += " + pipeline.text + ".count();";
            case TO_LIST -> {
                Expression select = result.getQuery().getSelectClause().getExpression();
                String item = text(select);
                if (pipeline.refersToRetired(item)) {
                    return Optional.empty();
                }
                if (!item.equals(pipeline.current)) {
                    pipeline.text.append(".map(").append(pipeline.current).append(" -> ").append(item).append(')');
                }
                pipeline.requireImport(COLLECTORS);
                code = text(result.getModifyingExpression()) + ".addAll(" + pipeline.text +
                       ".collect(Collectors.toList()));";
            }
            case DEFAULT -> {
                String body = statements(result.getLeftoverStatements(), pipeline.current);
                if (body == null || pipeline.refersToRetired(body)) {
                    return Optional.empty();
                }
                code = pipeline.text + ".forEach(" + pipeline.current + " -> { " + body + " });";
            }
            default -> {
                logger.debug("No stream form for {}", result.getStrategyKind());
                return Optional.empty();
            }
        }

        List<String> missing = new ArrayList<>();
        for (String required : pipeline.imports) {
            if (!semanticModel.isNamespaceInScope(required, result.getForEachStatement())) {
                missing.add(required);
            }
        }
        return Optional.of(new StreamSuggestion(code, missing));
    }

    private String text(SyntaxNode node) {
        return normalize(adapter.print(node));
    }

    /**
     * Leftover statements on one line, or {@code null} if one of them cannot move into a lambda.
     */
    private @Nullable String statements(List<Statement> statements, String rangeVariable) {
        if (statements.isEmpty()) {
            return null;
        }
        List<J> origins = new ArrayList<>();
        for (Statement statement : statements) {
            J origin = adapter.getOrigin(statement);
            if (!(origin instanceof org.openrewrite.java.tree.Statement) || jumps(origin)) {
                return null;
            }
            origins.add(origin);
        }
        if (assignsEnclosingLocal(origins, rangeVariable)) {
            return null;
        }
        List<String> texts = new ArrayList<>();
        for (Statement statement : statements) {
            J origin = adapter.getOrigin(statement);
            String text = text(statement);
            if (JavaSyntaxAdapter.needsSemicolon((org.openrewrite.java.tree.Statement) origin)) {
                text += ";";
            }
            texts.add(text);
        }
        return String.join(" ", texts);
    }

    private static boolean jumps(J statement) {
        AtomicBoolean found = new AtomicBoolean();
        new JavaIsoVisitor<AtomicBoolean>() {
            @Override
            public J.Return visitReturn(J.Return _return, AtomicBoolean f) {
                f.set(true);
                return _return;
            }

            @Override
            public J.Break visitBreak(J.Break breakStatement, AtomicBoolean f) {
                f.set(true);
                return breakStatement;
            }

            @Override
            public J.Continue visitContinue(J.Continue continueStatement, AtomicBoolean f) {
                f.set(true);
                return continueStatement;
            }
        }.visit(statement, found);
        return found.get();
    }

    /**
     * Whether the statements write a local variable of the enclosing method. A lambda may only read those.
     */
    private static boolean assignsEnclosingLocal(List<J> statements, String rangeVariable) {
        Set<String> declared = new HashSet<>();
        declared.add(rangeVariable);
        List<J.Identifier> targets = new ArrayList<>();
        JavaIsoVisitor<Integer> scanner = new JavaIsoVisitor<Integer>() {
            @Override
            public J.VariableDeclarations.NamedVariable visitVariable(J.VariableDeclarations.NamedVariable variable,
                                                                      Integer p) {
                declared.add(variable.getSimpleName());
                return super.visitVariable(variable, p);
            }

            @Override
            public J.Assignment visitAssignment(J.Assignment assignment, Integer p) {
                target(assignment.getVariable());
                return super.visitAssignment(assignment, p);
            }

            @Override
            public J.AssignmentOperation visitAssignmentOperation(J.AssignmentOperation assignment, Integer p) {
                target(assignment.getVariable());
                return super.visitAssignmentOperation(assignment, p);
            }

            @Override
            public J.Unary visitUnary(J.Unary unary, Integer p) {
                J.Unary.Type operator = unary.getOperator();
                if (operator == J.Unary.Type.PreIncrement || operator == J.Unary.Type.PreDecrement ||
                    operator == J.Unary.Type.PostIncrement || operator == J.Unary.Type.PostDecrement) {
                    target(unary.getExpression());
                }
                return super.visitUnary(unary, p);
            }

            private void target(org.openrewrite.java.tree.Expression variable) {
                if (variable instanceof J.Identifier) {
                    targets.add((J.Identifier) variable);
                }
            }
        };
        for (J statement : statements) {
            scanner.visit(statement, 0);
        }
        for (J.Identifier target : targets) {
            if (declared.contains(target.getSimpleName())) {
                continue;
            }
            JavaType.Variable variable = target.getFieldType();
            // Unattributed names are treated as locals
            if (variable == null || variable.getOwner() instanceof JavaType.Method) {
                logger.debug("'{}' is a local of the enclosing method", target.getSimpleName());
                return true;
            }
        }
        return false;
    }

    private static String normalize(String text) {
        return text.replaceAll("\\s*\\R\\s*", " ");
    }

    private class Pipeline {

        final StringBuilder text = new StringBuilder();
        final Set<String> retired = new HashSet<>();
        final Set<String> imports = new TreeSet<>();
        String current = "";

        boolean build(QueryExpression query) {
            QueryClause from = query.getFromClause();
            String source = stream(from.getExpression());
            if (source == null) {
                return false;
            }
            text.append(source);
            current = from.getIdentifier().getText();

            for (QueryClause clause : query.getBodyClauses()) {
                switch (clause.getKind()) {
                    case FROM -> {
                        String nested = stream(clause.getExpression());
                        if (nested == null || refersToRetired(nested)) {
                            return false;
                        }
                        text.append(".flatMap(").append(current).append(" -> ").append(nested).append(')');
                        advance(clause.getIdentifier().getText());
                    }
                    case WHERE -> {
                        String condition = text(clause.getExpression());
                        if (refersToRetired(condition)) {
                            return false;
                        }
                        text.append(".filter(").append(current).append(" -> ").append(condition).append(')');
                    }
                    case LET -> {
                        String value = text(clause.getExpression());
                        if (refersToRetired(value)) {
                            return false;
                        }
                        text.append(".map(").append(current).append(" -> ").append(value).append(')');
                        advance(clause.getIdentifier().getText());
                    }
                    default -> {
                        return false;
                    }
                }
            }
            return true;
        }

        private @Nullable String stream(Expression expression) {
            StreamSource source = adapter.getStreamSource(expression);
            if (source == null) {
                logger.debug("'{}' has no stream form", expression);
                return null;
            }
            if (source != StreamSource.COLLECTION) {
                requireImport(ARRAYS);
                return source.open(text(expression));
            }
            J origin = adapter.getOrigin(expression);
            boolean primary = origin instanceof J.Identifier || origin instanceof J.FieldAccess ||
                              origin instanceof J.MethodInvocation || origin instanceof J.Parentheses ||
                              origin instanceof J.ArrayAccess || origin instanceof J.NewClass;
            return source.open(primary ? text(expression) : "(" + text(expression) + ")");
        }

        private void advance(String identifier) {
            retired.add(current);
            retired.remove(identifier);
            current = identifier;
        }

        void requireImport(String className) {
            imports.add(className);
        }

        boolean refersToRetired(String code) {
            for (String name : retired) {
                if (Pattern.compile("(?<![\\w$.])" + Pattern.quote(name) + "(?![\\w$])").matcher(code).find()) {
                    logger.debug("'{}' still refers to '{}'", code, name);
                    return true;
                }
            }
            return false;
        }
    }
}
