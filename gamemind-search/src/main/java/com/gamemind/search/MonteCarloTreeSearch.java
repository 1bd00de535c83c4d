package com.gamemind.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.function.UnaryOperator;

/**
 * UCB1 Monte Carlo tree search over a fixed candidate action set.
 * <p>
 * Each simulation selects from the root while the current node has children and every candidate action is
 * represented among them, expands one untried action chosen uniformly at random (only below
 * {@link SearchSettings#getMaxDepth()}), estimates the reached node with the {@link ValueEstimator} and
 * backpropagates the estimate to the root. The plan follows the most-visited child from the root, earliest
 * inserted child on ties.
 * <p>
 * Instances hold no per-search state; concurrent searches are safe when the estimator and state copier are.
 *
 * @param <S> opaque state payload; never interpreted
 * @param <A> action type; candidates are compared with {@code equals}
 */
public final class MonteCarloTreeSearch<S, A> {

    private static final Logger log = LoggerFactory.getLogger(MonteCarloTreeSearch.class);

    private final SearchSettings settings;
    private final ValueEstimator<S, A> estimator;
    private final Random random;
    private final UnaryOperator<S> stateCopier;

    /**
     * @param settings    search budget and shape
     * @param estimator   leaf value estimator
     * @param random      source for choosing the expanded action
     * @param stateCopier applied to the parent's state when a child is created
     */
    public MonteCarloTreeSearch(SearchSettings settings, ValueEstimator<S, A> estimator, Random random,
                                UnaryOperator<S> stateCopier) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.estimator = Objects.requireNonNull(estimator, "estimator");
        this.random = Objects.requireNonNull(random, "random");
        this.stateCopier = Objects.requireNonNull(stateCopier, "stateCopier");
    }

    /** Search whose children share the parent's state object. */
    public MonteCarloTreeSearch(SearchSettings settings, ValueEstimator<S, A> estimator, Random random) {
        this(settings, estimator, random, UnaryOperator.identity());
    }

    /**
     * Runs the search and returns the extracted action sequence, or {@code actions} unchanged when the root
     * never gained a child.
     */
    public List<A> search(S rootState, List<A> actions) {
        SearchTree<S, A> tree = grow(rootState, actions);
        List<A> plan = extract(tree);
        if (plan.isEmpty()) {
            log.debug("Search produced no children at the root; returning the candidate list");
            return List.copyOf(actions);
        }
        return plan;
    }

    /**
     * Builds a fresh tree rooted at {@code rootState} and runs exactly {@link SearchSettings#getSimulations()}
     * simulations over the de-duplicated candidate list.
     */
    public SearchTree<S, A> grow(S rootState, List<A> actions) {
        List<A> candidates = distinct(actions);
        SearchTree<S, A> tree = new SearchTree<>(rootState);
        for (int i = 0; i < settings.getSimulations(); i++) {
            SearchNode<S, A> selected = select(tree, candidates);
            SearchNode<S, A> leaf = expand(tree, selected, candidates);
            double estimate = estimator.estimate(leaf);
            tree.backpropagate(leaf, estimate);
        }
        if (log.isDebugEnabled()) {
            log.debug("Search finished: candidates={} simulations={} nodes={} rootVisits={}",
                    candidates.size(), settings.getSimulations(), tree.size(), tree.root().getVisits());
        }
        return tree;
    }

    /**
     * Descends from the root while the node has at least one child and is fully expanded with respect to
     * {@code actions}, taking the child with the highest UCB1 score.
     */
    public SearchNode<S, A> select(SearchTree<S, A> tree, List<A> actions) {
        SearchNode<S, A> node = tree.root();
        while (node.hasChildren() && isFullyExpanded(tree, node, actions)) {
            node = bestChild(tree, node);
        }
        return node;
    }

    /**
     * Attaches a child for one untried action picked uniformly at random and returns it. Returns {@code node}
     * itself when it is at the depth limit or has nothing left to try.
     */
    public SearchNode<S, A> expand(SearchTree<S, A> tree, SearchNode<S, A> node, List<A> actions) {
        if (node.getDepth() >= settings.getMaxDepth() || actions.isEmpty()) {
            return node;
        }
        List<A> untried = new ArrayList<>();
        for (A action : actions) {
            if (!tree.hasChildFor(node, action)) {
                untried.add(action);
            }
        }
        if (untried.isEmpty()) {
            return node;
        }
        A action = untried.get(random.nextInt(untried.size()));
        return tree.addChild(node, action, stateCopier.apply(node.getState()));
    }

    /** Most-visited path from the root; the first inserted child wins ties. */
    public static <S, A> List<A> extract(SearchTree<S, A> tree) {
        List<A> plan = new ArrayList<>();
        SearchNode<S, A> node = tree.root();
        while (node.hasChildren()) {
            SearchNode<S, A> best = null;
            for (SearchNode<S, A> child : tree.children(node)) {
                if (best == null || child.getVisits() > best.getVisits()) {
                    best = child;
                }
            }
            plan.add(best.getAction());
            node = best;
        }
        return plan;
    }

    /** UCB1 score of {@code child}; unvisited children score positive infinity. */
    static double ucb(SearchNode<?, ?> child, int parentVisits, double explorationConstant) {
        if (child.getVisits() == 0) {
            return Double.POSITIVE_INFINITY;
        }
        double exploitation = child.getValue() / child.getVisits();
        double exploration = Math.sqrt(Math.log(Math.max(parentVisits, 1)) / child.getVisits());
        return exploitation + explorationConstant * exploration;
    }

    private SearchNode<S, A> bestChild(SearchTree<S, A> tree, SearchNode<S, A> node) {
        SearchNode<S, A> best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (SearchNode<S, A> child : tree.children(node)) {
            double score = ucb(child, node.getVisits(), settings.getExplorationConstant());
            if (best == null || score > bestScore) {
                best = child;
                bestScore = score;
            }
        }
        return best;
    }

    private static <S, A> boolean isFullyExpanded(SearchTree<S, A> tree, SearchNode<S, A> node, List<A> actions) {
        for (A action : actions) {
            if (!tree.hasChildFor(node, action)) {
                return false;
            }
        }
        return true;
    }

    private static <A> List<A> distinct(List<A> actions) {
        Objects.requireNonNull(actions, "actions");
        for (A action : actions) {
            Objects.requireNonNull(action, "actions must not contain null");
        }
        return new ArrayList<>(new LinkedHashSet<>(actions));
    }
}
