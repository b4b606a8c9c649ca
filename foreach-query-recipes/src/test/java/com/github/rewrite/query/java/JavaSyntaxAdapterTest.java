package com.github.rewrite.query.java;

import com.github.rewrite.query.syntax.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.openrewrite.Cursor;
import org.openrewrite.InMemoryExecutionContext;
import org.openrewrite.java.JavaIsoVisitor;
import org.openrewrite.java.JavaParser;
import org.openrewrite.java.tree.J;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JavaSyntaxAdapterTest {

    private J.CompilationUnit compilationUnit;
    private JavaSyntaxAdapter adapter;

    private ForEachStatement adaptFirstLoop(String source) {
        compilationUnit = (J.CompilationUnit) JavaParser.fromJavaVersion().build()
                .parse(new InMemoryExecutionContext(Throwable::printStackTrace), source)
                .findFirst()
                .orElseThrow();
        List<J.ForEachLoop> loops = new JavaIsoVisitor<List<J.ForEachLoop>>() {
            @Override
            public J.ForEachLoop visitForEachLoop(J.ForEachLoop forEachLoop, List<J.ForEachLoop> found) {
                found.add(forEachLoop);
                return super.visitForEachLoop(forEachLoop, found);
            }
        }.reduce(compilationUnit, new ArrayList<>());
        adapter = new JavaSyntaxAdapter(new Cursor(new Cursor(null, Cursor.ROOT_VALUE), compilationUnit));
        return adapter.adapt(loops.get(0));
    }

    @Nested
    @DisplayName("Loop structure")
    class Structure {

        @Test
        void loopHeader() {
            ForEachStatement loop = adaptFirstLoop("""
                    import java.util.List;
                    class A {
                        void m(List<Integer> xs) {
                            for (Integer x : xs) {
                                System.out.println(x);
                            }
                        }
                    }
                    """);

            assertThat(loop.getType().getTokens()).extracting(SyntaxToken::getText).containsExactly("Integer");
            assertThat(loop.getIdentifier().getText()).isEqualTo("x");
            assertThat(loop.getInKeyword().getText()).isEqualTo(":");
            assertThat(loop.getExpression().getKind()).isEqualTo(ExpressionKind.IDENTIFIER_NAME);
            assertThat(loop.getStatement().getKind()).isEqualTo(StatementKind.BLOCK);
            assertThat(adapter.getOrigin(loop)).isInstanceOf(J.ForEachLoop.class);
        }

        @Test
        void bodyStatements() {
            ForEachStatement loop = adaptFirstLoop("""
                    import java.util.List;
                    class A {
                        int m(List<Integer> xs, List<Integer> ys) {
                            int c = 0;
                            for (Integer x : xs) {
                                int y = x * 2, z = y;
                                if (y > 0) {
                                    c++;
                                }
                                ys.add(y);
                                c = c + 1;
                                ;
                            }
                            return c;
                        }
                    }
                    """);

            List<Statement> statements = ((BlockStatement) loop.getStatement()).getStatements();
            assertThat(statements).extracting(Statement::getKind).containsExactly(
                    StatementKind.LOCAL_DECLARATION,
                    StatementKind.IF,
                    StatementKind.EXPRESSION,
                    StatementKind.OTHER,
                    StatementKind.EMPTY);

            VariableDeclaration declaration = ((LocalDeclarationStatement) statements.get(0)).getDeclaration();
            assertThat(declaration.getVariables().getNodes())
                    .extracting(variable -> variable.getIdentifier().getText())
                    .containsExactly("y", "z");
            assertThat(declaration.isFullyInitialized()).isTrue();

            IfStatement ifStatement = (IfStatement) statements.get(1);
            assertThat(adapter.print(ifStatement.getCondition())).isEqualTo("y > 0");
            Statement increment = ((BlockStatement) ifStatement.getStatement()).getStatements().get(0);
            assertThat(((ExpressionStatement) increment).getExpression().getKind())
                    .isEqualTo(ExpressionKind.POST_INCREMENT);

            InvocationExpression add = (InvocationExpression) ((ExpressionStatement) statements.get(2)).getExpression();
            assertThat(add.getExpression().getKind()).isEqualTo(ExpressionKind.MEMBER_ACCESS);
            assertThat(add.getArgumentList().getArguments().size()).isEqualTo(1);

            assertThat(adapter.print(statements.get(3))).isEqualTo("c = c + 1");
        }

        @Test
        void elseClause() {
            ForEachStatement loop = adaptFirstLoop("""
                    import java.util.List;
                    class A {
                        void m(List<Integer> xs) {
                            for (Integer x : xs)
                                if (x > 0) System.out.println(x); else System.out.println(-x);
                        }
                    }
                    """);

            IfStatement ifStatement = (IfStatement) loop.getStatement();
            assertThat(ifStatement.getElseClause()).isNotNull();
            assertThat(ifStatement.getStatement().getKind()).isEqualTo(StatementKind.EXPRESSION);
        }

        @Test
        void invocationWithoutArguments() {
            ForEachStatement loop = adaptFirstLoop("""
                    import java.util.List;
                    class A {
                        void m(List<Runnable> tasks) {
                            for (Runnable task : tasks) {
                                task.run();
                            }
                        }
                    }
                    """);

            Statement run = ((BlockStatement) loop.getStatement()).getStatements().get(0);
            InvocationExpression invocation = (InvocationExpression) ((ExpressionStatement) run).getExpression();
            assertThat(invocation.getArgumentList().getArguments().isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("Trivia")
    class TriviaMapping {

        @Test
        void commentsBecomeLeadingTrivia() {
            ForEachStatement loop = adaptFirstLoop("""
                    import java.util.List;
                    class A {
                        void m(List<Integer> xs) {
                            for (Integer x : xs) {
                                // keep positives
                                if (x > 0 /* inline */) {
                                    System.out.println(x);
                                }
                            }
                        }
                    }
                    """);

            IfStatement ifStatement = (IfStatement) ((BlockStatement) loop.getStatement()).getStatements().get(0);
            assertThat(ifStatement.getIfKeyword().getLeadingTrivia().getComments())
                    .extracting(Trivia::getText)
                    .containsExactly("// keep positives");
            assertThat(ifStatement.getCloseParen().getLeadingTrivia().getComments())
                    .extracting(Trivia::getText)
                    .containsExactly("/* inline */");
            assertThat(ifStatement.getIfKeyword().getTrailingTrivia().isEmpty()).isTrue();
        }

        @Test
        void lineBreaksAreSeparateTrivia() {
            TriviaRun run = JavaSyntaxAdapter.trivia(org.openrewrite.java.tree.Space.format("\n    "));

            assertThat(run.getTrivia()).extracting(Trivia::getKind)
                    .containsExactly(TriviaKind.END_OF_LINE, TriviaKind.WHITESPACE);
            assertThat(run.toFullString()).isEqualTo("\n    ");
        }
    }

    @Nested
    @DisplayName("Stream sources")
    class StreamSources {

        @Test
        void collectionAndArray() {
            ForEachStatement loop = adaptFirstLoop("""
                    import java.util.List;
                    class A {
                        void m(List<int[]> rows) {
                            for (int[] row : rows) {
                                for (int cell : row) {
                                    System.out.println(cell);
                                }
                            }
                        }
                    }
                    """);

            ForEachStatement nested = (ForEachStatement) ((BlockStatement) loop.getStatement()).getStatements().get(0);
            assertThat(adapter.getStreamSource(loop.getExpression())).isEqualTo(StreamSource.COLLECTION);
            assertThat(adapter.getStreamSource(nested.getExpression())).isEqualTo(StreamSource.PRIMITIVE_ARRAY);
            assertThat(StreamSource.PRIMITIVE_ARRAY.open("row")).isEqualTo("Arrays.stream(row).boxed()");
        }

        @Test
        void objectAndCharArrays() {
            ForEachStatement loop = adaptFirstLoop("""
                    class A {
                        void m(String[] words) {
                            for (String word : words) {
                                for (char c : word.toCharArray()) {
                                    System.out.println(c);
                                }
                            }
                        }
                    }
                    """);

            ForEachStatement nested = (ForEachStatement) ((BlockStatement) loop.getStatement()).getStatements().get(0);
            assertThat(adapter.getStreamSource(loop.getExpression())).isEqualTo(StreamSource.ARRAY);
            assertThat(adapter.getStreamSource(nested.getExpression())).isNull();
        }

        @Test
        void plainIterable() {
            ForEachStatement loop = adaptFirstLoop("""
                    class A {
                        void m(Iterable<String> items) {
                            for (String item : items) {
                                System.out.println(item);
                            }
                        }
                    }
                    """);

            assertThat(adapter.getStreamSource(loop.getExpression())).isNull();
        }
    }
}
