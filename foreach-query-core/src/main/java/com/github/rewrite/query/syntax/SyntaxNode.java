package com.github.rewrite.query.syntax;

import org.jspecify.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Base class of the immutable syntax tree handed to the converter by a parser.
 * <p>
 * Nodes have no parent pointers and no value equality: two nodes are the same
 * only if they are the same instance. Trivia is owned by tokens.
 */
public abstract class SyntaxNode implements SyntaxElement {

    /**
     * Child nodes and tokens in source order. Optional children that are absent are skipped.
     */
    public abstract List<SyntaxElement> getChildren();

    @Override
    public List<SyntaxToken> descendantTokens() {
        List<SyntaxToken> tokens = new ArrayList<>();
        collectTokens(this, tokens);
        return tokens;
    }

    private static void collectTokens(SyntaxNode node, List<SyntaxToken> tokens) {
        for (SyntaxElement child : node.getChildren()) {
            if (child instanceof SyntaxToken) {
                tokens.add((SyntaxToken) child);
            } else {
                collectTokens((SyntaxNode) child, tokens);
            }
        }
    }

    public List<SyntaxNode> childNodes() {
        List<SyntaxNode> nodes = new ArrayList<>();
        for (SyntaxElement child : getChildren()) {
            if (child instanceof SyntaxNode) {
                nodes.add((SyntaxNode) child);
            }
        }
        return nodes;
    }

    /**
     * All nodes below this one in pre-order, excluding this node.
     */
    public List<SyntaxNode> descendantNodes() {
        List<SyntaxNode> result = new ArrayList<>();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        List<SyntaxNode> children = childNodes();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            result.add(node);
            List<SyntaxNode> nested = node.childNodes();
            for (int i = nested.size() - 1; i >= 0; i--) {
                stack.push(nested.get(i));
            }
        }
        return result;
    }

    public @Nullable SyntaxToken getFirstToken() {
        List<SyntaxToken> tokens = descendantTokens();
        return tokens.isEmpty() ? null : tokens.get(0);
    }

    public @Nullable SyntaxToken getLastToken() {
        List<SyntaxToken> tokens = descendantTokens();
        return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
    }

    public TriviaRun getLeadingTrivia() {
        SyntaxToken first = getFirstToken();
        return first == null ? TriviaRun.EMPTY : first.getLeadingTrivia();
    }

    public TriviaRun getTrailingTrivia() {
        SyntaxToken last = getLastToken();
        return last == null ? TriviaRun.EMPTY : last.getTrailingTrivia();
    }

    public boolean containsDirectives() {
        for (SyntaxToken token : descendantTokens()) {
            if (token.getLeadingTrivia().containsDirectives() || token.getTrailingTrivia().containsDirectives()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Source text without the leading trivia of the first token and the trailing trivia of the last one.
     */
    @Override
    public String toString() {
        List<SyntaxToken> tokens = descendantTokens();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < tokens.size(); i++) {
            SyntaxToken token = tokens.get(i);
            if (i > 0) {
                sb.append(token.getLeadingTrivia().toFullString());
            }
            sb.append(token.getText());
            if (i < tokens.size() - 1) {
                sb.append(token.getTrailingTrivia().toFullString());
            }
        }
        return sb.toString();
    }

    protected static List<SyntaxElement> elements(@Nullable Object... parts) {
        List<SyntaxElement> result = new ArrayList<>();
        for (Object part : parts) {
            if (part == null) {
                continue;
            }
            if (part instanceof SyntaxElement) {
                result.add((SyntaxElement) part);
            } else if (part instanceof SeparatedSyntaxList) {
                result.addAll(((SeparatedSyntaxList<?>) part).getElements());
            } else if (part instanceof List) {
                for (Object item : (List<?>) part) {
                    result.add((SyntaxElement) item);
                }
            } else {
                throw new IllegalArgumentException("Not a syntax element: " + part.getClass().getName());
            }
        }
        return result;
    }
}
