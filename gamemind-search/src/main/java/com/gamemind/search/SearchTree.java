package com.gamemind.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Arena-backed search tree. Nodes live in one dense list; parent and child links are indices into it and
 * the root's parent is {@link #NO_PARENT}. A tree belongs to a single search call and is not thread-safe.
 */
public final class SearchTree<S, A> {

    /** Parent index of the root. */
    public static final int NO_PARENT = -1;

    private final List<SearchNode<S, A>> nodes = new ArrayList<>();

    public SearchTree(S rootState) {
        nodes.add(new SearchNode<>(0, rootState, null, NO_PARENT, 0));
    }

    public SearchNode<S, A> root() {
        return nodes.get(0);
    }

    public SearchNode<S, A> node(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    /** All nodes in creation order, root first. */
    public List<SearchNode<S, A>> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /** Parent of the given node, or null for the root. */
    public SearchNode<S, A> parent(SearchNode<S, A> node) {
        return node.isRoot() ? null : nodes.get(node.getParent());
    }

    /** Children of the given node in insertion order. */
    public List<SearchNode<S, A>> children(SearchNode<S, A> node) {
        List<Integer> indices = node.getChildren();
        List<SearchNode<S, A>> out = new ArrayList<>(indices.size());
        for (int i : indices) {
            out.add(nodes.get(i));
        }
        return out;
    }

    /** True if some child of {@code node} was produced by an action equal to {@code action}. */
    public boolean hasChildFor(SearchNode<S, A> node, A action) {
        for (int i : node.getChildren()) {
            if (Objects.equals(nodes.get(i).getAction(), action)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Appends a child of {@code parent} at depth {@code parent.depth + 1}.
     *
     * @throws IllegalArgumentException if {@code parent} does not belong to this tree
     */
    public SearchNode<S, A> addChild(SearchNode<S, A> parent, A action, S state) {
        Objects.requireNonNull(action, "action");
        int parentIndex = parent.getIndex();
        if (parentIndex < 0 || parentIndex >= nodes.size() || nodes.get(parentIndex) != parent) {
            throw new IllegalArgumentException("Node " + parent + " does not belong to this tree");
        }
        SearchNode<S, A> child = new SearchNode<>(nodes.size(), state, action, parentIndex, parent.getDepth() + 1);
        nodes.add(child);
        parent.addChild(child.getIndex());
        return child;
    }

    /** Adds one visit and {@code estimate} to {@code node} and every ancestor up to the root inclusive. */
    public void backpropagate(SearchNode<S, A> node, double estimate) {
        int index = node.getIndex();
        while (index != NO_PARENT) {
            SearchNode<S, A> current = nodes.get(index);
            current.update(estimate);
            index = current.getParent();
        }
    }
}
