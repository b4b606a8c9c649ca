package com.github.rewrite.query.java;

import com.github.rewrite.query.syntax.*;
import com.github.rewrite.query.syntax.Expression;
import com.github.rewrite.query.syntax.Statement;
import org.jspecify.annotations.Nullable;
import org.openrewrite.Cursor;
import org.openrewrite.java.JavaIsoVisitor;
import org.openrewrite.java.tree.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the language-neutral syntax model for a Java {@code for (T x : xs)} loop.
 * <p>
 * OpenRewrite keeps whitespace and comments in front of each element ({@link Space}), so every
 * {@link Space} becomes the leading trivia of the token that follows it and trailing trivia stays empty.
 * Constructs the conversion does not look into (assignments, returns, lambdas, binary expressions)
 * are kept as a single token holding their printed source.
 * <p>
 * One adapter is used per loop; it remembers which LST element every model node came from.
 */
public class JavaSyntaxAdapter {

    private final Cursor cursor;
    private final Map<SyntaxNode, J> origins = new IdentityHashMap<>();
    private final Map<Expression, StreamSource> streamSources = new IdentityHashMap<>();

    /**
     * @param cursor cursor positioned at or below the compilation unit, used for printing
     */
    public JavaSyntaxAdapter(Cursor cursor) {
        this.cursor = cursor;
    }

    public ForEachStatement adapt(J.ForEachLoop loop) {
        return forEach(loop, TriviaRun.EMPTY);
    }

    /**
     * The LST element a model node was built from, {@code null} for nodes this adapter did not create.
     */
    public @Nullable J getOrigin(SyntaxNode node) {
        return origins.get(node);
    }

    /**
     * How {@code expression} can be streamed, {@code null} when its type is neither an array nor a collection.
     */
    public @Nullable StreamSource getStreamSource(Expression expression) {
        return streamSources.get(expression);
    }

    /**
     * Source text of a model node without its surrounding whitespace and without any comments.
     */
    public String print(SyntaxNode node) {
        J origin = origins.get(node);
        if (origin == null) {
            StringBuilder text = new StringBuilder();
            for (SyntaxToken token : node.descendantTokens()) {
                text.append(token.getText());
            }
            return text.toString();
        }
        return printBare(withoutComments(origin));
    }

    private ForEachStatement forEach(J.ForEachLoop loop, TriviaRun outer) {
        J.ForEachLoop.Control control = loop.getControl();
        J.VariableDeclarations variable = control.getVariable();
        J.VariableDeclarations.NamedVariable named = variable.getVariables().get(0);

        SyntaxToken forKeyword = token("for", outer, loop.getPrefix());
        SyntaxToken openParen = token("(", control.getPrefix());
        SyntaxToken type = token(typeText(variable), variable.getPrefix(), typePrefix(variable));
        SyntaxToken identifier = token(named.getSimpleName(), named.getPrefix(), named.getName().getPrefix());
        SyntaxToken colon = token(":", control.getPadding().getVariable().getAfter());
        Expression iterable = expression(control.getIterable(), TriviaRun.EMPTY);
        SyntaxToken closeParen = token(")", control.getPadding().getIterable().getAfter());
        JRightPadded<org.openrewrite.java.tree.Statement> body = loop.getPadding().getBody();
        Statement statement = statement(body.getElement(), TriviaRun.EMPTY, body.getAfter());

        ForEachStatement forEach = new ForEachStatement(forKeyword, openParen, TypeSyntax.of(type),
                identifier, colon, iterable, closeParen, statement);
        origins.put(forEach, loop);
        return forEach;
    }

    /**
     * @param outer     trivia in front of the statement owned by its parent, such as the space after {@code else}
     * @param semicolon space in front of the statement's terminating semicolon
     */
    private Statement statement(org.openrewrite.java.tree.Statement statement, TriviaRun outer, Space semicolon) {
        Statement adapted;
        if (statement instanceof J.Block) {
            adapted = block((J.Block) statement, outer);
        } else if (statement instanceof J.ForEachLoop) {
            adapted = forEach((J.ForEachLoop) statement, outer);
        } else if (statement instanceof J.If) {
            adapted = ifStatement((J.If) statement, outer);
        } else if (statement instanceof J.VariableDeclarations && isLocalDeclaration((J.VariableDeclarations) statement)) {
            adapted = localDeclaration((J.VariableDeclarations) statement, outer, semicolon);
        } else if (statement instanceof J.Empty) {
            adapted = new EmptyStatement(token(";", outer, statement.getPrefix(), semicolon));
        } else if (isExpressionStatement(statement)) {
            adapted = new ExpressionStatement(
                    expression((org.openrewrite.java.tree.Expression) statement, outer),
                    token(";", semicolon));
        } else {
            List<SyntaxElement> elements = new ArrayList<>();
            elements.add(token(printBare(statement), outer, statement.getPrefix()));
            if (needsSemicolon(statement)) {
                elements.add(token(";", semicolon));
            }
            adapted = new OtherStatement(elements);
        }
        origins.put(adapted, statement);
        return adapted;
    }

    private BlockStatement block(J.Block block, TriviaRun outer) {
        List<Statement> statements = new ArrayList<>();
        for (JRightPadded<org.openrewrite.java.tree.Statement> padded : block.getPadding().getStatements()) {
            statements.add(statement(padded.getElement(), TriviaRun.EMPTY, padded.getAfter()));
        }
        return new BlockStatement(
                token("{", outer, block.getPrefix()),
                statements,
                token("}", block.getEnd()));
    }

    private IfStatement ifStatement(J.If ifStatement, TriviaRun outer) {
        J.ControlParentheses<org.openrewrite.java.tree.Expression> condition = ifStatement.getIfCondition();
        JRightPadded<org.openrewrite.java.tree.Statement> then = ifStatement.getPadding().getThenPart();

        ElseClause elseClause = null;
        J.If.Else elsePart = ifStatement.getElsePart();
        if (elsePart != null) {
            JRightPadded<org.openrewrite.java.tree.Statement> elseBody = elsePart.getPadding().getBody();
            elseClause = new ElseClause(
                    token("else", elsePart.getPrefix()),
                    statement(elseBody.getElement(), TriviaRun.EMPTY, elseBody.getAfter()));
        }

        return new IfStatement(
                token("if", outer, ifStatement.getPrefix()),
                token("(", condition.getPrefix()),
                expression(condition.getTree(), TriviaRun.EMPTY),
                token(")", condition.getPadding().getTree().getAfter()),
                statement(then.getElement(), TriviaRun.EMPTY, then.getAfter()),
                elseClause);
    }

    private LocalDeclarationStatement localDeclaration(J.VariableDeclarations declarations, TriviaRun outer, Space semicolon) {
        SyntaxToken type = token(typeText(declarations), outer, declarations.getPrefix(), typePrefix(declarations));

        List<VariableDeclarator> variables = new ArrayList<>();
        List<SyntaxToken> commas = new ArrayList<>();
        List<JRightPadded<J.VariableDeclarations.NamedVariable>> padded = declarations.getPadding().getVariables();
        for (int i = 0; i < padded.size(); i++) {
            J.VariableDeclarations.NamedVariable named = padded.get(i).getElement();
            EqualsValueClause initializer = null;
            JLeftPadded<org.openrewrite.java.tree.Expression> init = named.getPadding().getInitializer();
            if (init != null) {
                initializer = new EqualsValueClause(token("=", init.getBefore()),
                        expression(init.getElement(), TriviaRun.EMPTY));
            }
            VariableDeclarator declarator = new VariableDeclarator(
                    token(named.getSimpleName(), named.getPrefix(), named.getName().getPrefix()),
                    initializer);
            origins.put(declarator, named);
            variables.add(declarator);
            if (i < padded.size() - 1) {
                commas.add(token(",", padded.get(i).getAfter()));
            }
        }

        Space lastAfter = padded.get(padded.size() - 1).getAfter();
        return new LocalDeclarationStatement(
                new VariableDeclaration(TypeSyntax.of(type), new SeparatedSyntaxList<>(variables, commas)),
                token(";", lastAfter, semicolon));
    }

    /**
     * @param outer trivia owned by the parent and printed in front of the expression's own prefix
     */
    private Expression expression(org.openrewrite.java.tree.Expression expression, TriviaRun outer) {
        Expression adapted;
        if (expression instanceof J.Identifier) {
            J.Identifier identifier = (J.Identifier) expression;
            adapted = new IdentifierName(token(identifier.getSimpleName(), outer, identifier.getPrefix()));
        } else if (expression instanceof J.FieldAccess) {
            J.FieldAccess fieldAccess = (J.FieldAccess) expression;
            JLeftPadded<J.Identifier> name = fieldAccess.getPadding().getName();
            adapted = new MemberAccessExpression(
                    expression(fieldAccess.getTarget(), outer.append(trivia(fieldAccess.getPrefix()))),
                    token(".", name.getBefore()),
                    new IdentifierName(token(name.getElement().getSimpleName(), name.getElement().getPrefix())));
        } else if (expression instanceof J.MethodInvocation && ((J.MethodInvocation) expression).getTypeParameters() == null) {
            adapted = invocation((J.MethodInvocation) expression, outer);
        } else if (expression instanceof J.Unary && isPostfix((J.Unary) expression)) {
            J.Unary unary = (J.Unary) expression;
            String operator = unary.getOperator() == J.Unary.Type.PostIncrement ? "++" : "--";
            adapted = new PostfixUnaryExpression(
                    expression(unary.getExpression(), outer.append(trivia(unary.getPrefix()))),
                    token(operator, unary.getPadding().getOperator().getBefore()));
        } else {
            adapted = new OtherExpression(Collections.singletonList(
                    token(printBare(expression), outer, expression.getPrefix())));
        }
        origins.put(adapted, expression);
        StreamSource source = streamSourceOf(expression.getType());
        if (source != null) {
            streamSources.put(adapted, source);
        }
        return adapted;
    }

    private InvocationExpression invocation(J.MethodInvocation invocation, TriviaRun outer) {
        J.Identifier name = invocation.getName();
        Expression callee;
        JRightPadded<org.openrewrite.java.tree.Expression> select = invocation.getPadding().getSelect();
        if (select == null) {
            callee = new IdentifierName(token(name.getSimpleName(), outer, invocation.getPrefix(), name.getPrefix()));
        } else {
            callee = new MemberAccessExpression(
                    expression(select.getElement(), outer.append(trivia(invocation.getPrefix()))),
                    token(".", select.getAfter()),
                    new IdentifierName(token(name.getSimpleName(), name.getPrefix())));
        }

        JContainer<org.openrewrite.java.tree.Expression> container = invocation.getPadding().getArguments();
        List<JRightPadded<org.openrewrite.java.tree.Expression>> arguments = container.getPadding().getElements();
        List<Expression> nodes = new ArrayList<>();
        List<SyntaxToken> commas = new ArrayList<>();
        SyntaxToken closeParen;
        if (arguments.size() == 1 && arguments.get(0).getElement() instanceof J.Empty) {
            JRightPadded<org.openrewrite.java.tree.Expression> empty = arguments.get(0);
            closeParen = token(")", empty.getElement().getPrefix(), empty.getAfter());
        } else {
            for (int i = 0; i < arguments.size(); i++) {
                nodes.add(expression(arguments.get(i).getElement(), TriviaRun.EMPTY));
                if (i < arguments.size() - 1) {
                    commas.add(token(",", arguments.get(i).getAfter()));
                }
            }
            closeParen = token(")", arguments.get(arguments.size() - 1).getAfter());
        }

        return new InvocationExpression(callee, new ArgumentList(
                token("(", container.getBefore()),
                new SeparatedSyntaxList<>(nodes, commas),
                closeParen));
    }

    private static boolean isExpressionStatement(org.openrewrite.java.tree.Statement statement) {
        return statement instanceof J.MethodInvocation ||
               statement instanceof J.Unary && isPostfix((J.Unary) statement);
    }

    private static boolean isPostfix(J.Unary unary) {
        return unary.getOperator() == J.Unary.Type.PostIncrement ||
               unary.getOperator() == J.Unary.Type.PostDecrement;
    }

    /**
     * Declarations the model can express: a type and plain names, no modifiers, annotations or array brackets.
     */
    private static boolean isLocalDeclaration(J.VariableDeclarations declarations) {
        if (!declarations.getModifiers().isEmpty() || !declarations.getLeadingAnnotations().isEmpty() ||
                declarations.getTypeExpression() == null || declarations.getVarargs() != null) {
            return false;
        }
        for (J.VariableDeclarations.NamedVariable variable : declarations.getVariables()) {
            if (!variable.getDimensionsAfterName().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    static boolean needsSemicolon(org.openrewrite.java.tree.Statement statement) {
        if (statement instanceof J.DoWhileLoop) {
            return true;
        }
        return !(statement instanceof J.Block ||
                 statement instanceof Loop ||
                 statement instanceof J.If ||
                 statement instanceof J.Try ||
                 statement instanceof J.Switch ||
                 statement instanceof J.Synchronized ||
                 statement instanceof J.Label ||
                 statement instanceof J.ClassDeclaration ||
                 statement instanceof J.MethodDeclaration);
    }

    private String typeText(J.VariableDeclarations declarations) {
        StringBuilder text = new StringBuilder();
        for (J.Modifier modifier : declarations.getModifiers()) {
            text.append(printBare(modifier)).append(' ');
        }
        TypeTree type = declarations.getTypeExpression();
        text.append(type == null ? "var" : printBare(type));
        return text.toString();
    }

    private static Space typePrefix(J.VariableDeclarations declarations) {
        TypeTree type = declarations.getTypeExpression();
        return type == null || !declarations.getModifiers().isEmpty() ? Space.EMPTY : type.getPrefix();
    }

    private static @Nullable StreamSource streamSourceOf(@Nullable JavaType type) {
        if (type instanceof JavaType.Array) {
            JavaType element = ((JavaType.Array) type).getElemType();
            if (element instanceof JavaType.Primitive) {
                // Arrays.stream has no overload for the other primitive arrays
                return switch ((JavaType.Primitive) element) {
                    case Int, Long, Double -> StreamSource.PRIMITIVE_ARRAY;
                    default -> null;
                };
            }
            return StreamSource.ARRAY;
        }
        if (type != null && TypeUtils.isAssignableTo("java.util.Collection", type)) {
            return StreamSource.COLLECTION;
        }
        return null;
    }

    private static J withoutComments(J tree) {
        J stripped = new JavaIsoVisitor<Integer>() {
            @Override
            public Space visitSpace(Space space, Space.Location loc, Integer p) {
                if (space.getComments().isEmpty()) {
                    return space;
                }
                StringBuilder whitespace = new StringBuilder(space.getWhitespace());
                for (Comment comment : space.getComments()) {
                    whitespace.append(comment.getSuffix());
                }
                return Space.build(whitespace.length() == 0 ? " " : whitespace.toString(), Collections.emptyList());
            }
        }.visit(tree, 0);
        return stripped == null ? tree : stripped;
    }

    private String printBare(J tree) {
        return tree.withPrefix(Space.EMPTY).printTrimmed(cursor);
    }

    private static SyntaxToken token(String text, Space... spaces) {
        return token(text, TriviaRun.EMPTY, spaces);
    }

    private static SyntaxToken token(String text, TriviaRun outer, Space... spaces) {
        List<TriviaRun> runs = new ArrayList<>();
        runs.add(outer);
        for (Space space : spaces) {
            runs.add(trivia(space));
        }
        return new SyntaxToken(text, TriviaRun.concat(runs), TriviaRun.EMPTY);
    }

    static TriviaRun trivia(Space space) {
        if (space.isEmpty()) {
            return TriviaRun.EMPTY;
        }
        List<Trivia> trivia = new ArrayList<>();
        addWhitespace(trivia, space.getWhitespace());
        for (Comment comment : space.getComments()) {
            if (comment instanceof TextComment) {
                TextComment text = (TextComment) comment;
                trivia.add(text.isMultiline()
                        ? Trivia.multiLineComment("/*" + text.getText() + "*/")
                        : Trivia.singleLineComment("//" + text.getText()));
            }
            addWhitespace(trivia, comment.getSuffix());
        }
        return TriviaRun.of(trivia);
    }

    private static void addWhitespace(List<Trivia> trivia, String whitespace) {
        int start = 0;
        for (int i = 0; i < whitespace.length(); i++) {
            char c = whitespace.charAt(i);
            if (c == '\n') {
                int lineStart = i > 0 && whitespace.charAt(i - 1) == '\r' ? i - 1 : i;
                if (lineStart > start) {
                    trivia.add(Trivia.whitespace(whitespace.substring(start, lineStart)));
                }
                trivia.add(Trivia.endOfLine(whitespace.substring(lineStart, i + 1)));
                start = i + 1;
            }
        }
        if (start < whitespace.length()) {
            trivia.add(Trivia.whitespace(whitespace.substring(start)));
        }
    }
}
