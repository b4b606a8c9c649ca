package com.github.rewrite.query.syntax;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds syntax trees from small C#-style snippets for tests.
 * <p>
 * Understands blocks, {@code foreach}, {@code if}/{@code else}, local declarations, local functions,
 * {@code yield} statements, expression statements and empty statements. Anything else ending in a
 * semicolon becomes an {@link OtherStatement}. Expressions are split into the shapes the converter
 * inspects (names, member access, invocations, postfix increments); the rest is kept as tokens.
 */
public final class SnippetParser {

    private static final Set<String> KEYWORDS = Set.of(
            "foreach", "if", "else", "in", "yield", "return", "break", "new", "while", "for", "do", "throw");

    private final List<SyntaxToken> tokens;
    private int pos;

    private SnippetParser(String source) {
        this.tokens = new SnippetLexer(source).tokenize();
    }

    public static Statement parseStatement(String source) {
        SnippetParser parser = new SnippetParser(source);
        Statement statement = parser.statement();
        parser.expectEnd();
        return statement;
    }

    public static ForEachStatement parseForEach(String source) {
        Statement statement = parseStatement(source);
        if (!(statement instanceof ForEachStatement)) {
            throw new IllegalArgumentException("Not a foreach loop: " + source);
        }
        return (ForEachStatement) statement;
    }

    /**
     * A member such as {@code IEnumerable<int> M() { ... }}.
     */
    public static MemberDeclaration parseMember(String source) {
        SnippetParser parser = new SnippetParser(source);
        MemberDeclaration member = parser.member();
        parser.expectEnd();
        return member;
    }

    /**
     * The {@code index}-th node of {@code type} in pre-order, {@code root} included.
     */
    public static <T extends SyntaxNode> T find(SyntaxNode root, Class<T> type, int index) {
        List<T> found = new ArrayList<>();
        if (type.isInstance(root)) {
            found.add(type.cast(root));
        }
        for (SyntaxNode node : root.descendantNodes()) {
            if (type.isInstance(node)) {
                found.add(type.cast(node));
            }
        }
        if (index >= found.size()) {
            throw new IllegalArgumentException("No " + type.getSimpleName() + " #" + index + " in " + root);
        }
        return found.get(index);
    }

    public static <T extends SyntaxNode> T find(SyntaxNode root, Class<T> type) {
        return find(root, type, 0);
    }

    private MemberDeclaration member() {
        List<SyntaxToken> signature = new ArrayList<>();
        int depth = 0;
        while (depth > 0 || !(at("{") || at(";"))) {
            SyntaxToken token = next();
            depth += nesting(token);
            signature.add(token);
        }
        if (at(";")) {
            signature.add(next());
            return new MemberDeclaration(signature, null);
        }
        return new MemberDeclaration(signature, block());
    }

    private Statement statement() {
        switch (peek().getText()) {
            case "{":
                return block();
            case "foreach":
                return forEach();
            case "if":
                return ifStatement();
            case "yield":
                return yieldStatement();
            case ";":
                return new EmptyStatement(next());
            default:
                break;
        }
        Statement declaration = declarationOrLocalFunction();
        if (declaration != null) {
            return declaration;
        }
        if (KEYWORDS.contains(peek().getText())) {
            List<SyntaxElement> elements = new ArrayList<>(collect(Set.of(";")));
            elements.add(expect(";"));
            return new OtherStatement(elements);
        }
        Expression expression = expression(Set.of(";"));
        return new ExpressionStatement(expression, expect(";"));
    }

    private BlockStatement block() {
        SyntaxToken open = expect("{");
        List<Statement> statements = new ArrayList<>();
        while (!at("}")) {
            statements.add(statement());
        }
        return new BlockStatement(open, statements, expect("}"));
    }

    private ForEachStatement forEach() {
        SyntaxToken keyword = expect("foreach");
        SyntaxToken open = expect("(");
        List<SyntaxToken> type = new ArrayList<>();
        while (!"in".equals(peek(1).getText())) {
            type.add(next());
        }
        SyntaxToken identifier = next();
        SyntaxToken in = expect("in");
        Expression expression = expression(Set.of(")"));
        SyntaxToken close = expect(")");
        return new ForEachStatement(keyword, open, new TypeSyntax(type), identifier, in, expression, close, statement());
    }

    private IfStatement ifStatement() {
        SyntaxToken keyword = expect("if");
        SyntaxToken open = expect("(");
        Expression condition = expression(Set.of(")"));
        SyntaxToken close = expect(")");
        Statement statement = statement();
        ElseClause elseClause = null;
        if (pos < tokens.size() && at("else")) {
            SyntaxToken elseKeyword = next();
            elseClause = new ElseClause(elseKeyword, statement());
        }
        return new IfStatement(keyword, open, condition, close, statement, elseClause);
    }

    private YieldStatement yieldStatement() {
        SyntaxToken yield = expect("yield");
        if (at("break")) {
            SyntaxToken breakKeyword = next();
            return new YieldStatement(StatementKind.YIELD_BREAK, yield, breakKeyword, null, expect(";"));
        }
        SyntaxToken returnKeyword = expect("return");
        Expression expression = expression(Set.of(";"));
        return new YieldStatement(StatementKind.YIELD_RETURN, yield, returnKeyword, expression, expect(";"));
    }

    private @Nullable Statement declarationOrLocalFunction() {
        int typeEnd = scanType(pos);
        if (typeEnd < 0 || typeEnd >= tokens.size() || !isIdentifier(tokens.get(typeEnd))) {
            return null;
        }
        String afterName = typeEnd + 1 < tokens.size() ? tokens.get(typeEnd + 1).getText() : "";
        if ("(".equals(afterName)) {
            return localFunction();
        }
        if (!"=".equals(afterName) && !",".equals(afterName) && !";".equals(afterName)) {
            return null;
        }

        TypeSyntax type = new TypeSyntax(new ArrayList<>(tokens.subList(pos, typeEnd)));
        pos = typeEnd;
        List<VariableDeclarator> variables = new ArrayList<>();
        List<SyntaxToken> separators = new ArrayList<>();
        while (true) {
            SyntaxToken identifier = next();
            EqualsValueClause initializer = null;
            if (at("=")) {
                SyntaxToken equals = next();
                initializer = new EqualsValueClause(equals, expression(Set.of(",", ";")));
            }
            variables.add(new VariableDeclarator(identifier, initializer));
            if (!at(",")) {
                break;
            }
            separators.add(next());
        }
        VariableDeclaration declaration = new VariableDeclaration(type,
                new SeparatedSyntaxList<>(variables, separators));
        return new LocalDeclarationStatement(declaration, expect(";"));
    }

    private LocalFunctionStatement localFunction() {
        List<SyntaxToken> signature = new ArrayList<>();
        int depth = 0;
        while (depth > 0 || !at("{")) {
            SyntaxToken token = next();
            depth += nesting(token);
            signature.add(token);
        }
        return new LocalFunctionStatement(signature, block());
    }

    /**
     * Index after a type starting at {@code start}, or -1 if there is none.
     */
    private int scanType(int start) {
        int i = start;
        if (i >= tokens.size() || !isIdentifier(tokens.get(i))) {
            return -1;
        }
        i++;
        while (i + 1 < tokens.size() && ".".equals(tokens.get(i).getText()) && isIdentifier(tokens.get(i + 1))) {
            i += 2;
        }
        if (i < tokens.size() && "<".equals(tokens.get(i).getText())) {
            int depth = 0;
            do {
                String text = tokens.get(i).getText();
                if ("<".equals(text)) {
                    depth++;
                } else if (">".equals(text)) {
                    depth--;
                } else if (!",".equals(text) && !".".equals(text) && !isIdentifier(tokens.get(i))) {
                    return -1;
                }
                i++;
            } while (depth > 0 && i < tokens.size());
            if (depth > 0) {
                return -1;
            }
        }
        while (i + 1 < tokens.size() && "[".equals(tokens.get(i).getText()) && "]".equals(tokens.get(i + 1).getText())) {
            i += 2;
        }
        if (i < tokens.size() && "?".equals(tokens.get(i).getText())) {
            i++;
        }
        return i;
    }

    private Expression expression(Set<String> terminators) {
        List<SyntaxToken> collected = collect(terminators);
        if (collected.isEmpty()) {
            throw new IllegalArgumentException("Expected an expression before '" + peek().getText() + "'");
        }
        return buildExpression(collected);
    }

    private List<SyntaxToken> collect(Set<String> terminators) {
        List<SyntaxToken> collected = new ArrayList<>();
        int depth = 0;
        while (pos < tokens.size()) {
            SyntaxToken token = peek();
            if (depth == 0 && terminators.contains(token.getText())) {
                break;
            }
            depth += nesting(token);
            collected.add(next());
        }
        return collected;
    }

    private static Expression buildExpression(List<SyntaxToken> parts) {
        int n = parts.size();
        SyntaxToken last = parts.get(n - 1);
        if (n == 1 && isIdentifier(last)) {
            return new IdentifierName(last);
        }
        if (n >= 2 && ("++".equals(last.getText()) || "--".equals(last.getText())) &&
                isPrimaryChain(parts.subList(0, n - 1))) {
            return new PostfixUnaryExpression(buildExpression(parts.subList(0, n - 1)), last);
        }
        if (")".equals(last.getText())) {
            int open = matchingOpen(parts, n - 1);
            if (open > 0 && isPrimaryChain(parts.subList(0, open))) {
                return new InvocationExpression(buildExpression(parts.subList(0, open)),
                        argumentList(parts.subList(open, n)));
            }
        }
        if (n >= 3 && ".".equals(parts.get(n - 2).getText()) && isIdentifier(last) &&
                isPrimaryChain(parts.subList(0, n - 2))) {
            return new MemberAccessExpression(buildExpression(parts.subList(0, n - 2)), parts.get(n - 2),
                    new IdentifierName(last));
        }
        return new OtherExpression(new ArrayList<>(parts));
    }

    private static ArgumentList argumentList(List<SyntaxToken> parts) {
        SyntaxToken open = parts.get(0);
        SyntaxToken close = parts.get(parts.size() - 1);
        List<Expression> arguments = new ArrayList<>();
        List<SyntaxToken> separators = new ArrayList<>();
        List<SyntaxToken> current = new ArrayList<>();
        int depth = 0;
        for (SyntaxToken token : parts.subList(1, parts.size() - 1)) {
            if (depth == 0 && ",".equals(token.getText())) {
                arguments.add(buildExpression(current));
                separators.add(token);
                current = new ArrayList<>();
                continue;
            }
            depth += nesting(token);
            current.add(token);
        }
        if (!current.isEmpty()) {
            arguments.add(buildExpression(current));
        }
        return new ArgumentList(open, new SeparatedSyntaxList<>(arguments, separators), close);
    }

    private static int matchingOpen(List<SyntaxToken> parts, int closeIndex) {
        int depth = 0;
        for (int i = closeIndex; i >= 0; i--) {
            String text = parts.get(i).getText();
            if (")".equals(text)) {
                depth++;
            } else if ("(".equals(text)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    // Names, member access, calls and indexers only: no operators at the top level
    private static boolean isPrimaryChain(List<SyntaxToken> parts) {
        if (parts.isEmpty() || !isIdentifier(parts.get(0))) {
            return false;
        }
        int depth = 0;
        for (SyntaxToken token : parts) {
            String text = token.getText();
            if (depth == 0 && !isIdentifier(token) && !".".equals(text) &&
                    !"(".equals(text) && !"[".equals(text)) {
                return false;
            }
            depth += nesting(token);
            if (depth < 0) {
                return false;
            }
        }
        return depth == 0;
    }

    private static int nesting(SyntaxToken token) {
        switch (token.getText()) {
            case "(":
            case "[":
            case "{":
                return 1;
            case ")":
            case "]":
            case "}":
                return -1;
            default:
                return 0;
        }
    }

    private static boolean isIdentifier(SyntaxToken token) {
        String text = token.getText();
        if (text.isEmpty() || KEYWORDS.contains(text)) {
            return false;
        }
        char first = text.charAt(0);
        return Character.isLetter(first) || first == '_' || first == '@';
    }

    private boolean at(String text) {
        return pos < tokens.size() && tokens.get(pos).getText().equals(text);
    }

    private SyntaxToken peek() {
        return peek(0);
    }

    private SyntaxToken peek(int offset) {
        if (pos + offset >= tokens.size()) {
            throw new IllegalArgumentException("Unexpected end of snippet");
        }
        return tokens.get(pos + offset);
    }

    private SyntaxToken next() {
        SyntaxToken token = peek();
        pos++;
        return token;
    }

    private SyntaxToken expect(String text) {
        SyntaxToken token = peek();
        if (!token.getText().equals(text)) {
            throw new IllegalArgumentException("Expected '" + text + "' but found '" + token.getText() + "'");
        }
        pos++;
        return token;
    }

    private void expectEnd() {
        if (pos < tokens.size()) {
            throw new IllegalArgumentException("Unexpected '" + tokens.get(pos).getText() + "' after snippet");
        }
    }
}
