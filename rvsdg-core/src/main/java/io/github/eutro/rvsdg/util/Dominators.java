package io.github.eutro.rvsdg.util;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/*
 Keith D. Cooper, Timothy J. Harvey and Ken Kennedy. A Simple, Fast Dominance Algorithm.
 Software Practice and Experience, 4:1-10, 2001.
 */

/**
 * The dominator tree of a rooted graph, over nodes reachable from the root.
 *
 * @param <T> The type of a node in the graph.
 */
public class Dominators<T> {
    private final T root;
    private final Map<T, Integer> rpoIndex = new HashMap<>();
    private final Map<T, T> idom = new HashMap<>();
    private List<T> rpo;

    private Dominators(T root) {
        this.root = root;
    }

    /**
     * Compute the dominators of a graph.
     *
     * @param root        The root of the graph.
     * @param getChildren The successor function of the graph.
     * @param <T>         The type of a node in the graph.
     * @return The dominators.
     */
    public static <T> Dominators<T> compute(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        Dominators<T> doms = new Dominators<>(root);
        List<T> rpo = doms.rpo = new GraphWalker<T>(root, getChildren).reversePostOrder();
        Map<T, List<T>> preds = new HashMap<>();
        for (int i = 0; i < rpo.size(); i++) {
            T node = rpo.get(i);
            doms.rpoIndex.put(node, i);
            preds.computeIfAbsent(node, $ -> new ArrayList<>());
            for (T child : getChildren.apply(node)) {
                preds.computeIfAbsent(child, $ -> new ArrayList<>()).add(node);
            }
        }

        doms.idom.put(root, root);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 1; i < rpo.size(); i++) {
                T node = rpo.get(i);
                T newIdom = null;
                for (T pred : preds.get(node)) {
                    if (!doms.idom.containsKey(pred)) continue;
                    newIdom = newIdom == null ? pred : doms.intersect(pred, newIdom);
                }
                if (newIdom != null && newIdom != doms.idom.get(node)) {
                    doms.idom.put(node, newIdom);
                    changed = true;
                }
            }
        }
        return doms;
    }

    private T intersect(T a, T b) {
        while (a != b) {
            while (rpoIndex.get(a) > rpoIndex.get(b)) a = idom.get(a);
            while (rpoIndex.get(b) > rpoIndex.get(a)) b = idom.get(b);
        }
        return a;
    }

    /**
     * Get the immediate dominator of a node.
     *
     * @param node The node.
     * @return The immediate dominator, or null for the root and unreachable nodes.
     */
    public @Nullable T idom(T node) {
        if (node == root) return null;
        return idom.get(node);
    }

    /**
     * Check whether {@code a} dominates {@code b}. Every node dominates itself.
     *
     * @param a The dominator.
     * @param b The dominated node.
     * @return Whether every path from the root to {@code b} passes through {@code a}.
     */
    public boolean dominates(T a, T b) {
        if (!idom.containsKey(b)) return false;
        T cur = b;
        while (true) {
            if (cur == a) return true;
            if (cur == root) return false;
            cur = idom.get(cur);
        }
    }

    /**
     * Get the nodes reachable from the root, in reverse post-order.
     *
     * @return The nodes.
     */
    public List<T> nodes() {
        return rpo;
    }
}
