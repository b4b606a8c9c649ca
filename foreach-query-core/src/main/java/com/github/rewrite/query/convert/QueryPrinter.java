package com.github.rewrite.query.convert;

import com.github.rewrite.query.syntax.Statement;
import com.github.rewrite.query.syntax.Trivia;
import com.github.rewrite.query.syntax.TriviaKind;
import com.github.rewrite.query.syntax.TriviaRun;
import com.github.rewrite.query.syntax.TypeSyntax;

/**
 * Renders conversion results in query comprehension syntax.
 * <p>
 * Clause trivia is emitted verbatim. Trivia left over from dropped tokens (absorbed clause trivia,
 * brace trivia, the consumed terminal statement) contributes only its comments, each placed after
 * the text it followed. A space is inserted only where two words would fuse, and a single-line
 * comment is always followed by a line break.
 * <pre>
 * foreach (var x in xs) { if (x > 0) { ys.Add(x * 2); } }
 *
 * (from x in xs where x > 0 select x * 2).ToList()
 * </pre>
 */
public class QueryPrinter {

    /**
     * The replacement text for the loop, starting with the loop's leading trivia.
     * Trailing spaces are dropped, line breaks are kept.
     */
    public String print(ConversionResult result) {
        Output out = new Output();
        out.verbatim(result.getLeadingTrivia());
        switch (result.getStrategyKind()) {
            case DEFAULT -> printQuery(out, result.getQuery());
            case COUNT -> {
                out.punctuation("(");
                printQuery(out, result.getQuery());
                out.punctuation(").Count()");
            }
            case TO_LIST -> {
                out.punctuation("(");
                printQuery(out, result.getQuery());
                out.punctuation(").ToList()");
            }
            case YIELD_RETURN -> {
                out.word("return");
                printQuery(out, result.getQuery());
                out.punctuation(";");
            }
        }
        out.comments(result.getChainLeadingTrivia());
        for (Statement statement : result.getLeftoverStatements()) {
            out.statement(statement);
        }
        out.comments(result.getStrategyTrivia());
        out.comments(result.getChainTrailingTrivia());
        return out.finish();
    }

    public String printQuery(QueryExpression query) {
        Output out = new Output();
        printQuery(out, query);
        return out.finish();
    }

    private static void printQuery(Output out, QueryExpression query) {
        for (QueryClause clause : query.getClauses()) {
            out.verbatim(clause.getLeadingTrivia());
            out.word(clause.getKind().getKeyword());
            switch (clause.getKind()) {
                case FROM -> {
                    TypeSyntax type = clause.getType();
                    if (type != null) {
                        out.word(type.toString());
                    }
                    out.word(identifierOf(clause));
                    out.word("in");
                    out.word(clause.getExpression().toString());
                }
                case LET -> {
                    out.word(identifierOf(clause));
                    out.word("=");
                    out.word(clause.getExpression().toString());
                }
                case WHERE, SELECT -> out.word(clause.getExpression().toString());
            }
            out.comments(clause.getAbsorbedTrivia());
            out.verbatim(clause.getTrailingTrivia());
        }
    }

    private static String identifierOf(QueryClause clause) {
        if (clause.getIdentifier() == null) {
            throw new IllegalStateException(clause.getKind().getKeyword() + " clause without range variable");
        }
        return clause.getIdentifier().getText();
    }

    private static final class Output {

        private final StringBuilder sb = new StringBuilder();

        void word(String text) {
            if (needsSeparator(text)) {
                sb.append(' ');
            }
            sb.append(text);
        }

        void punctuation(String text) {
            sb.append(text);
        }

        void verbatim(TriviaRun run) {
            boolean openLineComment = false;
            for (Trivia trivia : run) {
                sb.append(trivia.getText());
                if (trivia.getKind() == TriviaKind.SINGLE_LINE_COMMENT || trivia.getKind() == TriviaKind.DIRECTIVE) {
                    openLineComment = true;
                } else if (trivia.getKind() == TriviaKind.END_OF_LINE || trivia.getKind() == TriviaKind.MULTI_LINE_COMMENT) {
                    openLineComment = false;
                }
            }
            if (openLineComment) {
                sb.append('\n');
            }
        }

        void comments(TriviaRun run) {
            for (Trivia comment : run.getComments()) {
                word(comment.getText());
                if (comment.getKind() == TriviaKind.SINGLE_LINE_COMMENT) {
                    sb.append('\n');
                }
            }
        }

        void statement(Statement statement) {
            String text = statement.toFullString();
            if (needsSeparator(text)) {
                sb.append(' ');
            }
            sb.append(text);
            boolean openLineComment = false;
            for (Trivia trivia : statement.getTrailingTrivia()) {
                if (trivia.getKind() == TriviaKind.SINGLE_LINE_COMMENT) {
                    openLineComment = true;
                } else if (trivia.getKind() == TriviaKind.END_OF_LINE) {
                    openLineComment = false;
                }
            }
            if (openLineComment) {
                sb.append('\n');
            }
        }

        private boolean needsSeparator(String text) {
            if (sb.length() == 0 || text.isEmpty() || Character.isWhitespace(text.charAt(0))) {
                return false;
            }
            char last = sb.charAt(sb.length() - 1);
            return !Character.isWhitespace(last) && last != '(';
        }

        // Line breaks stay, a single-line comment may precede them
        String finish() {
            int end = sb.length();
            while (end > 0 && (sb.charAt(end - 1) == ' ' || sb.charAt(end - 1) == '\t')) {
                end--;
            }
            return sb.substring(0, end);
        }
    }
}
