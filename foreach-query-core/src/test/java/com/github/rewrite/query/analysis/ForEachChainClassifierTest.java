package com.github.rewrite.query.analysis;

import com.github.rewrite.query.config.ConversionOptions;
import com.github.rewrite.query.semantic.FakeSemanticModel;
import com.github.rewrite.query.syntax.ForEachStatement;
import com.github.rewrite.query.syntax.IfStatement;
import com.github.rewrite.query.syntax.Statement;
import com.github.rewrite.query.syntax.StatementKind;
import com.github.rewrite.query.syntax.SyntaxToken;
import com.github.rewrite.query.syntax.Trivia;
import com.github.rewrite.query.syntax.VariableDeclarator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.github.rewrite.query.syntax.SnippetParser.parseForEach;
import static org.assertj.core.api.Assertions.assertThat;

class ForEachChainClassifierTest {

    private final ForEachChainClassifier classifier = new ForEachChainClassifier();
    private final FakeSemanticModel semanticModel = new FakeSemanticModel();

    private ForEachChain classify(String source) {
        return classifier.classify(parseForEach(source), semanticModel);
    }

    private static List<String> texts(List<SyntaxToken> tokens) {
        return tokens.stream().map(SyntaxToken::getText).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Clause collection")
    class ClauseCollection {

        @Test
        void nestedLoopsConditionsAndDeclarationsBecomeNodes() {
            ForEachChain chain = classify("""
                    foreach (var x in xs)
                    {
                        foreach (var y in x.Items)
                        {
                            if (y > 0)
                            {
                                var z = y * 2;
                            }
                        }
                    }
                    """);

            assertThat(chain.getConvertingNodes())
                    .extracting(ExtendedNode::getKind)
                    .containsExactly(ExtendedNode.Kind.NESTED_LOOP, ExtendedNode.Kind.CONDITION,
                            ExtendedNode.Kind.DECLARATOR);
            assertThat(texts(chain.getIdentifiers())).containsExactly("x", "y", "z");
            assertThat(chain.isTerminatedCleanly()).isTrue();
        }

        @Test
        void singleStatementStopsDescent() {
            ForEachChain chain = classify("foreach (var x in xs) { if (x > 0) { ys.Add(x); } }");

            assertThat(chain.getConvertingNodes()).hasSize(1);
            assertThat(chain.getTerminalStatements())
                    .singleElement()
                    .extracting(Statement::getKind)
                    .isEqualTo(StatementKind.EXPRESSION);
        }

        @Test
        void bodyWithoutBlockIsFollowed() {
            ForEachChain chain = classify("foreach (var x in xs) if (x > 0) count++;");

            assertThat(chain.getConvertingNodes()).extracting(ExtendedNode::getKind)
                    .containsExactly(ExtendedNode.Kind.CONDITION);
            assertThat(chain.getLeadingTokens()).isEmpty();
            assertThat(chain.getTrailingTokens()).isEmpty();
        }

        @Test
        @DisplayName("if with else stops descent at the if")
        void ifWithElseIsTerminal() {
            ForEachStatement loop = parseForEach(
                    "foreach (var x in xs) { if (x > 0) { a(); } else { b(); } }");
            ForEachChain chain = classifier.classify(loop, semanticModel);

            assertThat(chain.getConvertingNodes()).isEmpty();
            assertThat(chain.getTerminalStatements()).singleElement().isInstanceOf(IfStatement.class);
        }

        @Test
        void emptyBlockEndsCleanly() {
            ForEachChain chain = classify("foreach (var x in xs) { if (x > 0) { } }");

            assertThat(chain.getConvertingNodes()).hasSize(1);
            assertThat(chain.isTerminatedCleanly()).isTrue();
        }

        @Test
        void emptyStatementEndsCleanly() {
            ForEachChain chain = classify("foreach (var x in xs) ;");

            assertThat(chain.getConvertingNodes()).isEmpty();
            assertThat(chain.isTerminatedCleanly()).isTrue();
        }

        @Test
        void everyDeclaratorBecomesItsOwnNode() {
            ForEachChain chain = classify("foreach (var x in xs) { int a = x, b = a + 1; }");

            assertThat(chain.getConvertingNodes()).extracting(ExtendedNode::getKind)
                    .containsExactly(ExtendedNode.Kind.DECLARATOR, ExtendedNode.Kind.DECLARATOR);
            assertThat(texts(chain.getIdentifiers())).containsExactly("x", "a", "b");
        }
    }

    @Nested
    @DisplayName("Terminal statements")
    class TerminalStatements {

        @Test
        @DisplayName("An uninitialized declaration keeps itself and everything after it")
        void uninitializedDeclarationTakesRemainder() {
            ForEachChain chain = classify("foreach (var x in xs) { var y = x; int z; Foo(y); }");

            assertThat(chain.getConvertingNodes()).hasSize(1);
            assertThat(chain.getTerminalStatements())
                    .extracting(Statement::getKind)
                    .containsExactly(StatementKind.LOCAL_DECLARATION, StatementKind.EXPRESSION);
        }

        @Test
        void uninitializedSiblingsAreBothKept() {
            ForEachChain chain = classify("foreach (var x in xs) { int a; int b = 1; Console.WriteLine(a); }");

            assertThat(chain.getConvertingNodes()).isEmpty();
            assertThat(chain.getTerminalStatements()).hasSize(3);
        }

        @Test
        void lastUninitializedDeclarationIsTerminal() {
            ForEachChain chain = classify("foreach (var x in xs) { int a; }");

            assertThat(chain.getConvertingNodes()).isEmpty();
            assertThat(chain.getTerminalStatements()).singleElement()
                    .extracting(Statement::getKind)
                    .isEqualTo(StatementKind.LOCAL_DECLARATION);
        }

        @Test
        void declarationsStayStatementsWhenDisabled() {
            ForEachChainClassifier keepDeclarations = new ForEachChainClassifier(
                    ConversionOptions.defaults().withConvertLocalDeclarations(false));

            ForEachChain chain = keepDeclarations.classify(
                    parseForEach("foreach (var x in xs) { var y = x; if (y > 0) { count++; } }"), semanticModel);

            assertThat(chain.getConvertingNodes()).isEmpty();
            assertThat(chain.getTerminalStatements()).hasSize(2);
        }
    }

    @Nested
    @DisplayName("Trivia bookkeeping")
    class TriviaBookkeeping {

        @Test
        @DisplayName("Closing braces are re-emitted innermost first")
        void trailingTokensAreReversed() {
            ForEachChain chain = classify("""
                    foreach (var x in xs) {
                        foreach (var y in x.Items) {
                            if (y > 0) {
                                f(y);
                            } // inner
                        } // middle
                    } // outer
                    """);

            assertThat(chain.getTrailingTokens())
                    .extracting(token -> token.getTrailingTrivia().getComments().get(0).getText())
                    .containsExactly("// inner", "// middle", "// outer");
        }

        @Test
        void openBraceTriviaMovesToTheNextClause() {
            ForEachChain chain = classify("""
                    foreach (var x in xs)
                    { // first
                        if (x > 0)
                        { // second
                            f(x);
                        }
                    }
                    """);

            ExtendedNode condition = chain.getConvertingNodes().get(0);
            assertThat(condition.getLeadingTrivia().getComments())
                    .extracting(Trivia::getText)
                    .containsExactly("// first");
            assertThat(chain.getLeadingTrivia().getComments())
                    .extracting(Trivia::getText)
                    .containsExactly("// second");
        }

        @Test
        void declaratorsSplitTriviaAroundCommas() {
            ForEachChain chain = classify("""
                    foreach (var x in xs) { /*t*/ int /*u*/ a = x
                        /*v*/, /*w*/ b = a; /*end*/ }
                    """);

            ExtendedNode first = chain.getConvertingNodes().get(0);
            ExtendedNode second = chain.getConvertingNodes().get(1);

            assertThat(first.getNode()).isInstanceOf(VariableDeclarator.class);
            assertThat(first.getLeadingTrivia().getComments()).extracting(Trivia::getText)
                    .containsExactly("/*t*/", "/*u*/");
            assertThat(first.getTrailingTrivia().getComments()).extracting(Trivia::getText)
                    .containsExactly("/*v*/");
            assertThat(second.getLeadingTrivia().getComments()).extracting(Trivia::getText)
                    .containsExactly("/*w*/");
            assertThat(second.getTrailingTrivia().getComments()).extracting(Trivia::getText)
                    .containsExactly("/*end*/");
        }
    }

    @Test
    void classificationIsIdempotent() {
        ForEachStatement loop = parseForEach("foreach (var x in xs) { var y = x; if (y > 0) { ys.Add(y); } }");

        ForEachChain first = classifier.classify(loop, semanticModel);
        ForEachChain second = classifier.classify(loop, semanticModel);

        assertThat(second).isEqualTo(first);
    }
}
