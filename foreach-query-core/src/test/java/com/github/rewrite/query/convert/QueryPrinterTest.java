package com.github.rewrite.query.convert;

import com.github.rewrite.query.analysis.StrategyKind;
import com.github.rewrite.query.semantic.FakeSemanticModel;
import com.github.rewrite.query.syntax.ForEachStatement;
import com.github.rewrite.query.syntax.MemberDeclaration;
import com.github.rewrite.query.syntax.Statement;
import com.github.rewrite.query.syntax.StatementKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.github.rewrite.query.convert.ConversionFixture.convert;
import static com.github.rewrite.query.syntax.SnippetParser.find;
import static com.github.rewrite.query.syntax.SnippetParser.parseForEach;
import static com.github.rewrite.query.syntax.SnippetParser.parseMember;
import static org.assertj.core.api.Assertions.assertThat;

class QueryPrinterTest {

    private final QueryPrinter printer = new QueryPrinter();

    private String print(String loop, FakeSemanticModel semanticModel) {
        return printer.print(convert(parseForEach(loop), semanticModel));
    }

    @Nested
    @DisplayName("Strategies")
    class Strategies {

        @Test
        void toList() {
            String printed = print("foreach (var x in xs) { if (x > 0) { ys.Add(x * 2); } }",
                    new FakeSemanticModel().withList("ys"));

            assertThat(printed).isEqualTo("(from x in xs where x > 0 select x * 2).ToList()");
        }

        @Test
        void count() {
            String printed = print("foreach (var x in xs) { count++; }", new FakeSemanticModel());

            assertThat(printed).isEqualTo("(from x in xs select x).Count()");
        }

        @Test
        void countWithExplicitType() {
            String printed = print("foreach (int x in xs) { if (x > 0) { count++; } }", new FakeSemanticModel());

            assertThat(printed).isEqualTo("(from int x in xs where x > 0 select x).Count()");
        }

        @Test
        void yieldReturn() {
            MemberDeclaration member = parseMember(
                    "IEnumerable<int> M() { foreach (var x in xs) { yield return x + 1; } }");

            String printed = printer.print(convert(find(member, ForEachStatement.class),
                    new FakeSemanticModel().withMember(member)));

            assertThat(printed).isEqualTo("return from x in xs select x + 1;");
        }

        @Test
        @DisplayName("Default keeps the leftover statements after the query")
        void defaultWithLeftoverStatements() {
            String printed = print("foreach (var x in xs) { if (x > 0) { Console.WriteLine(x); } }",
                    new FakeSemanticModel());

            assertThat(printed).isEqualTo("from x in xs where x > 0 select x Console.WriteLine(x);");
        }
    }

    @Nested
    @DisplayName("Clauses")
    class Clauses {

        @Test
        void nestedLoop() {
            String printed = print("foreach (var x in xs) { foreach (var y in x.Items) { ys.Add(y); } }",
                    new FakeSemanticModel().withList("ys"));

            assertThat(printed).isEqualTo("(from x in xs from y in x.Items select y).ToList()");
        }

        @Test
        @DisplayName("The declared type's trivia stays in front of let")
        void letClause() {
            String printed = print("foreach (var x in xs) { var y = x * 2; if (y > 3) { ys.Add(y); } }",
                    new FakeSemanticModel().withList("ys"));

            assertThat(printed).isEqualTo("(from x in xs  let y = x * 2 where y > 3 select y).ToList()");
        }

        @Test
        void declarationRemainder() {
            String printed = print("foreach (var x in xs) { var y = x; int z; Foo(y); }", new FakeSemanticModel());

            assertThat(printed).isEqualTo("from x in xs  let y = x select y int z; Foo(y);");
        }

        @Test
        @DisplayName("Uninitialized declarations follow the bare query in their original order")
        void uninitializedDeclarationsAfterBareQuery() {
            ConversionResult result = convert(
                    parseForEach("foreach (var x in xs) { int a; int b; Use(a, b); }"), new FakeSemanticModel());

            assertThat(result.getStrategyKind()).isEqualTo(StrategyKind.DEFAULT);
            assertThat(result.getQuery().getBodyClauses()).isEmpty();
            assertThat(result.getLeftoverStatements())
                    .extracting(Statement::getKind)
                    .containsExactly(StatementKind.LOCAL_DECLARATION, StatementKind.LOCAL_DECLARATION,
                            StatementKind.EXPRESSION);
            assertThat(printer.print(result)).isEqualTo("from x in xs select x int a; int b; Use(a, b);");
        }
    }

    @Nested
    @DisplayName("Comments")
    class Comments {

        @Test
        @DisplayName("Every comment survives in source order")
        void commentsSurvive() {
            String printed = print("""
                    foreach (var x in xs)
                    {
                        // keep positives
                        if (x > 0) /* inline */
                        {
                            ys.Add(x); // collect
                        }
                    }
                    """, new FakeSemanticModel().withList("ys"));

            assertThat(printed).isEqualTo("""
                    (from x in xs
                        // keep positives
                        where x > 0 /* inline */ select x).ToList() // collect
                    """);
        }

        @Test
        @DisplayName("A trailing single-line comment never swallows the following code")
        void lineCommentIsFollowedByLineBreak() {
            String printed = print("foreach (var x in xs /* source */ // loop\n) { count++; }",
                    new FakeSemanticModel());

            assertThat(printed).isEqualTo("(from x in xs /* source */ // loop\nselect x).Count()");
        }

        @Test
        void commentsInFrontOfTheLoopAreKept() {
            String printed = print("""
                    // tally
                    foreach (var x in xs) { count++; }""", new FakeSemanticModel());

            assertThat(printed).isEqualTo("// tally\n(from x in xs select x).Count()");
        }

        @Test
        void closingBraceCommentsFollowTheReplacement() {
            String printed = print("foreach (var x in xs) { count++; } /* done */", new FakeSemanticModel());

            assertThat(printed).isEqualTo("(from x in xs select x).Count() /* done */");
        }
    }
}
