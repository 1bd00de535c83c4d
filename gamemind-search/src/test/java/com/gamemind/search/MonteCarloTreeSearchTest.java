package com.gamemind.search;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MonteCarloTreeSearchTest {

    private static final List<String> ACTIONS = List.of("find weapon", "approach enemy", "attack");

    private static MonteCarloTreeSearch<String, String> search(int simulations, int maxDepth, long seed) {
        Random random = new Random(seed);
        return new MonteCarloTreeSearch<>(new SearchSettings(simulations, maxDepth, 1.0),
                new RandomRolloutEstimator<>(random), random);
    }

    @Test
    void select_prefersUnvisitedChild() {
        SearchTree<String, String> tree = new SearchTree<>("root");
        SearchNode<String, String> a = tree.addChild(tree.root(), "A", "s");
        for (int i = 0; i < 5; i++) {
            tree.backpropagate(a, 0.6);
        }
        SearchNode<String, String> b = tree.addChild(tree.root(), "B", "s");

        SearchNode<String, String> selected = search(1, 10, 1L).select(tree, List.of("A", "B"));

        assertSame(b, selected);
        assertEquals(5, a.getVisits());
        assertEquals(3.0, a.getValue(), 1e-9);
    }

    @Test
    void select_stopsAtNodeMissingACandidateAction() {
        SearchTree<String, String> tree = new SearchTree<>("root");
        SearchNode<String, String> a = tree.addChild(tree.root(), "A", "s");
        tree.backpropagate(a, 1.0);

        assertSame(tree.root(), search(1, 10, 1L).select(tree, List.of("A", "B")));
    }

    @Test
    void select_breaksUcbTiesByInsertionOrder() {
        SearchTree<String, String> tree = new SearchTree<>("root");
        SearchNode<String, String> a = tree.addChild(tree.root(), "A", "s");
        SearchNode<String, String> b = tree.addChild(tree.root(), "B", "s");
        tree.backpropagate(a, 0.5);
        tree.backpropagate(b, 0.5);

        assertSame(a, search(1, 10, 1L).select(tree, List.of("A", "B")));
    }

    @Test
    void ucb_combinesMeanAndExplorationTerm() {
        SearchTree<String, String> tree = new SearchTree<>("root");
        SearchNode<String, String> a = tree.addChild(tree.root(), "A", "s");
        for (int i = 0; i < 5; i++) {
            tree.backpropagate(a, 0.6);
        }

        double expected = 0.6 + 2.0 * Math.sqrt(Math.log(10) / 5);
        assertEquals(expected, MonteCarloTreeSearch.ucb(a, 10, 2.0), 1e-9);
        assertEquals(0.6, MonteCarloTreeSearch.ucb(a, 10, 0.0), 1e-9);
        assertEquals(Double.POSITIVE_INFINITY,
                MonteCarloTreeSearch.ucb(tree.addChild(tree.root(), "B", "s"), 10, 1.0));
    }

    @Test
    void grow_rootVisitsEqualSimulationCount() {
        SearchTree<String, String> tree = search(50, 3, 7L).grow("obs", ACTIONS);

        assertEquals(50, tree.root().getVisits());
        int childVisits = 0;
        for (SearchNode<String, String> child : tree.children(tree.root())) {
            childVisits += child.getVisits();
        }
        assertEquals(50, childVisits);
    }

    @Test
    void grow_everyNodeSatisfiesDepthInvariant() {
        SearchTree<String, String> tree = search(300, 4, 11L).grow("obs", ACTIONS);

        for (SearchNode<String, String> node : tree.nodes()) {
            SearchNode<String, String> parent = tree.parent(node);
            if (parent == null) {
                assertEquals(0, node.getDepth());
                assertNull(node.getAction());
                assertEquals(SearchTree.NO_PARENT, node.getParent());
            } else {
                assertEquals(parent.getDepth() + 1, node.getDepth());
                assertTrue(parent.getChildren().contains(node.getIndex()));
                assertTrue(node.getDepth() <= 4);
            }
        }
    }

    @Test
    void grow_neverExpandsAtMaxDepth() {
        MonteCarloTreeSearch<String, String> mcts = search(100, 1, 3L);

        SearchTree<String, String> tree = mcts.grow("obs", ACTIONS);

        assertEquals(1 + ACTIONS.size(), tree.size());
        for (SearchNode<String, String> child : tree.children(tree.root())) {
            assertEquals(1, child.getDepth());
            assertTrue(child.getChildren().isEmpty());
        }
        assertEquals(1, mcts.search("obs", ACTIONS).size());
    }

    @Test
    void grow_deduplicatesCandidates() {
        SearchTree<String, String> tree = search(20, 1, 5L).grow("obs", List.of("a", "b", "a", "b"));

        Set<String> seen = new HashSet<>();
        for (SearchNode<String, String> child : tree.children(tree.root())) {
            assertTrue(seen.add(child.getAction()), "duplicate child for " + child.getAction());
        }
        assertEquals(Set.of("a", "b"), seen);
    }

    @Test
    void grow_appliesStateCopierToEachChild() {
        MonteCarloTreeSearch<Integer, String> mcts = new MonteCarloTreeSearch<>(
                new SearchSettings(60, 5, 1.0), node -> 0.0, new Random(2L), depth -> depth + 1);

        SearchTree<Integer, String> tree = mcts.grow(0, ACTIONS);

        for (SearchNode<Integer, String> node : tree.nodes()) {
            assertEquals(node.getDepth(), node.getState());
        }
    }

    @Test
    void extract_followsMostVisitedChildAndPrefersFirstOnTies() {
        SearchTree<String, String> tree = new SearchTree<>("root");
        SearchNode<String, String> a = tree.addChild(tree.root(), "A", "s");
        SearchNode<String, String> b = tree.addChild(tree.root(), "B", "s");
        tree.backpropagate(a, 1.0);
        tree.backpropagate(b, 1.0);

        assertEquals(List.of("A"), MonteCarloTreeSearch.extract(tree));

        SearchNode<String, String> bc = tree.addChild(b, "C", "s");
        tree.backpropagate(bc, -1.0);

        assertEquals(List.of("B", "C"), MonteCarloTreeSearch.extract(tree));
    }

    @Test
    void search_withoutCandidatesReturnsCandidateList() {
        MonteCarloTreeSearch<String, String> mcts = search(10, 3, 1L);

        assertTrue(mcts.search("obs", List.of()).isEmpty());
        SearchTree<String, String> tree = mcts.grow("obs", List.of());
        assertEquals(1, tree.size());
        assertEquals(10, tree.root().getVisits());
    }

    @Test
    void search_planIsDrawnFromCandidatesAndBoundedByDepth() {
        List<String> plan = search(50, 3, 13L).search("obs", ACTIONS);

        assertTrue(!plan.isEmpty() && plan.size() <= 3, "plan: " + plan);
        assertTrue(ACTIONS.containsAll(plan), "plan: " + plan);
    }

    @Test
    void search_isReproducibleWithSameSeed() {
        assertEquals(search(80, 4, 99L).search("obs", ACTIONS), search(80, 4, 99L).search("obs", ACTIONS));
    }

    @Test
    void search_favoursActionWithHigherEstimate() {
        ValueEstimator<String, String> estimator = node -> "attack".equals(node.getAction()) ? 1.0 : -1.0;
        MonteCarloTreeSearch<String, String> mcts = new MonteCarloTreeSearch<>(
                new SearchSettings(100, 1, 1.0), estimator, new Random(4L));

        assertEquals(List.of("attack"), mcts.search("obs", ACTIONS));
    }
}
