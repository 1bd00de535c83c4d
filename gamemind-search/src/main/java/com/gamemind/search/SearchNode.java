package com.gamemind.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One node of a {@link SearchTree}. Parent and children are indices into the owning tree's arena.
 * <p>
 * Statistics are mutated only by {@link SearchTree#backpropagate(SearchNode, double)}; a node is never shared
 * between trees.
 *
 * @param <S> opaque state payload
 * @param <A> action type; compared with {@code equals}
 */
public final class SearchNode<S, A> {

    private final int index;
    private final S state;
    private final A action;
    private final int parent;
    private final int depth;
    private final List<Integer> children = new ArrayList<>();
    private int visits;
    private double value;

    SearchNode(int index, S state, A action, int parent, int depth) {
        this.index = index;
        this.state = state;
        this.action = action;
        this.parent = parent;
        this.depth = depth;
    }

    /** Position of this node in the tree's arena; the root is 0. */
    public int getIndex() {
        return index;
    }

    public S getState() {
        return state;
    }

    /** Action that produced this node, or null for the root. */
    public A getAction() {
        return action;
    }

    /** Arena index of the parent, or {@link SearchTree#NO_PARENT} for the root. */
    public int getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == SearchTree.NO_PARENT;
    }

    public int getDepth() {
        return depth;
    }

    /** Child indices in insertion order. */
    public List<Integer> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public int getVisits() {
        return visits;
    }

    /** Sum of all estimates backpropagated through this node. */
    public double getValue() {
        return value;
    }

    /** Average return, or 0 when unvisited. */
    public double getMeanValue() {
        return visits == 0 ? 0.0 : value / visits;
    }

    void addChild(int childIndex) {
        children.add(childIndex);
    }

    void update(double estimate) {
        visits++;
        value += estimate;
    }

    @Override
    public String toString() {
        return "SearchNode{index=" + index + ", action=" + action + ", depth=" + depth
                + ", visits=" + visits + ", value=" + value + "}";
    }
}
