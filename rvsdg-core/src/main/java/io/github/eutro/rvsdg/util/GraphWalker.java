package io.github.eutro.rvsdg.util;

import io.github.eutro.rvsdg.cfg.BasicBlock;
import io.github.eutro.rvsdg.cfg.Function;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Walks a graph depth-first, in pre- or post-order.
 * <p>
 * Each node is visited once, even if the graph has cycles.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    final T root;
    final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over the basic blocks of a {@link Function}, following jump targets.
     *
     * @param func The function.
     * @return The graph walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(Function func) {
        return new GraphWalker<>(func.blocks.get(0), $ -> $.getControl().targets);
    }

    /**
     * An order over a graph.
     *
     * @param <T> The type of each node.
     */
    public interface Order<T> extends Iterable<T> {
        /**
         * Collect this order to a list.
         *
         * @return The nodes of the graph, in this order.
         */
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    /**
     * Get the pre-order traversal of the graph.
     *
     * @return The pre-order.
     */
    public Order<T> preOrder() {
        return PreIter::new;
    }

    /**
     * Get the post-order traversal of the graph.
     * <p>
     * Children are visited in the order the successor function yields them.
     *
     * @return The post-order.
     */
    public Order<T> postOrder() {
        return PostIter::new;
    }

    /**
     * Get the reverse post-order of the graph, a topological order if the graph is acyclic.
     *
     * @return The reverse post-order, as a list.
     */
    public List<T> reversePostOrder() {
        List<T> ls = postOrder().toList();
        Collections.reverse(ls);
        return ls;
    }

    private class PreIter implements Iterator<T> {
        private final Deque<T> stack = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.push(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            T top = stack.pop();
            List<T> children = new ArrayList<>();
            for (T child : getChildren.apply(top)) {
                if (seen.add(child)) children.add(child);
            }
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
            return top;
        }
    }

    private class PostIter implements Iterator<T> {
        // each frame is a node and the iterator over its remaining children
        private final Deque<T> nodes = new ArrayDeque<>();
        private final Deque<Iterator<? extends T>> frames = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            enter(root);
        }

        private void enter(T node) {
            seen.add(node);
            nodes.push(node);
            frames.push(getChildren.apply(node).iterator());
        }

        @Override
        public boolean hasNext() {
            return !nodes.isEmpty();
        }

        @Override
        public T next() {
            while (true) {
                Iterator<? extends T> top = frames.peek();
                assert top != null;
                if (top.hasNext()) {
                    T child = top.next();
                    if (!seen.contains(child)) enter(child);
                } else {
                    frames.pop();
                    return nodes.pop();
                }
            }
        }
    }
}
