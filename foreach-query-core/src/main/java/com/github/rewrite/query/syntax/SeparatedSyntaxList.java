package com.github.rewrite.query.syntax;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Nodes separated by tokens, such as the declarators of {@code int a = 1, b = 2}.
 * <p>
 * Well-formed lists have exactly one separator less than nodes. Lists recovered
 * from broken code may have fewer; {@link #getSeparator(int)} then returns {@code null}.
 */
public final class SeparatedSyntaxList<T extends SyntaxNode> implements Iterable<T> {

    private final List<T> nodes;
    private final List<SyntaxToken> separators;

    public SeparatedSyntaxList(List<T> nodes, List<SyntaxToken> separators) {
        if (!nodes.isEmpty() && separators.size() >= nodes.size()) {
            throw new IllegalArgumentException("Expected at most " + (nodes.size() - 1) +
                    " separators for " + nodes.size() + " nodes, got " + separators.size());
        }
        this.nodes = List.copyOf(nodes);
        this.separators = List.copyOf(separators);
    }

    public static <T extends SyntaxNode> SeparatedSyntaxList<T> empty() {
        return new SeparatedSyntaxList<>(Collections.emptyList(), Collections.emptyList());
    }

    public static <T extends SyntaxNode> SeparatedSyntaxList<T> single(T node) {
        return new SeparatedSyntaxList<>(Collections.singletonList(node), Collections.emptyList());
    }

    public List<T> getNodes() {
        return nodes;
    }

    public List<SyntaxToken> getSeparators() {
        return separators;
    }

    public @Nullable SyntaxToken getSeparator(int index) {
        return index >= 0 && index < separators.size() ? separators.get(index) : null;
    }

    public T get(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Nodes and separators interleaved in source order.
     */
    public List<SyntaxElement> getElements() {
        List<SyntaxElement> elements = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            elements.add(nodes.get(i));
            if (i < separators.size()) {
                elements.add(separators.get(i));
            }
        }
        return elements;
    }

    @Override
    public Iterator<T> iterator() {
        return nodes.iterator();
    }
}
