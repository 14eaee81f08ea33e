package io.github.eutro.rvsdg.test;

import io.github.eutro.rvsdg.ext.Ext;
import io.github.eutro.rvsdg.ext.ExtHolder;
import io.github.eutro.rvsdg.util.Dominators;
import io.github.eutro.rvsdg.util.GraphWalker;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class UtilTest {
    private static final Map<String, List<String>> GRAPH = new HashMap<>();

    static {
        // a -> b -> d, a -> c -> d, d -> e -> d, d -> f
        GRAPH.put("a", Arrays.asList("b", "c"));
        GRAPH.put("b", Collections.singletonList("d"));
        GRAPH.put("c", Collections.singletonList("d"));
        GRAPH.put("d", Arrays.asList("e", "f"));
        GRAPH.put("e", Collections.singletonList("d"));
        GRAPH.put("f", Collections.emptyList());
        GRAPH.put("unreachable", Collections.singletonList("f"));
    }

    @Test
    void dominators() {
        Dominators<String> doms = Dominators.compute("a", GRAPH::get);
        assertNull(doms.idom("a"));
        assertEquals("a", doms.idom("b"));
        assertEquals("a", doms.idom("d"));
        assertEquals("d", doms.idom("e"));
        assertEquals("d", doms.idom("f"));
        assertTrue(doms.dominates("a", "f"));
        assertTrue(doms.dominates("d", "d"));
        assertFalse(doms.dominates("b", "d"));
        assertFalse(doms.dominates("a", "unreachable"));
        assertEquals(6, doms.nodes().size());
        assertEquals("a", doms.nodes().get(0));
    }

    @Test
    void walkerOrders() {
        GraphWalker<String> walker = new GraphWalker<>("a", GRAPH::get);
        List<String> pre = walker.preOrder().toList();
        assertEquals("a", pre.get(0));
        assertEquals(6, pre.size());
        List<String> post = walker.postOrder().toList();
        assertEquals("a", post.get(post.size() - 1));
        List<String> rpo = walker.reversePostOrder();
        assertTrue(rpo.indexOf("d") < rpo.indexOf("e"));
        assertTrue(rpo.indexOf("b") < rpo.indexOf("d"));
    }

    @Test
    void exts() {
        Ext<String> name = Ext.create(String.class, "name");
        ExtHolder holder = new ExtHolder();
        assertFalse(name.getIn(holder).isPresent());
        assertThrows(IllegalStateException.class, () -> holder.getExtOrThrow(name));
        holder.attachExt(name, "x");
        assertEquals("x", holder.getExtOrThrow(name));
        holder.removeExt(name);
        assertNull(holder.getNullable(name));
    }
}
