package io.github.eutro.rvsdg.test;

import io.github.eutro.rvsdg.cfg.BasicBlock;
import io.github.eutro.rvsdg.cfg.Function;
import io.github.eutro.rvsdg.ext.CommonExts;
import io.github.eutro.rvsdg.graph.Operand;
import io.github.eutro.rvsdg.graph.RvsdgFunction;
import io.github.eutro.rvsdg.graph.RvsdgNode;
import io.github.eutro.rvsdg.passes.Passes;
import io.github.eutro.rvsdg.passes.form.ControlTree;
import io.github.eutro.rvsdg.passes.form.LoopInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.eutro.rvsdg.test.Utils.args;
import static io.github.eutro.rvsdg.test.Utils.assertPreserved;
import static io.github.eutro.rvsdg.test.Utils.convert;
import static io.github.eutro.rvsdg.test.Utils.count;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RestructuringTest {
    @Test
    void unstructuredLoopWithTwoEntries() {
        RvsdgFunction rvsdg = convert(Samples.unstructured());
        assertNotNull(rvsdg.result);
        assertTrue(count(rvsdg, RvsdgNode.Loop.class) >= 1, rvsdg::toString);
        assertTrue(count(rvsdg, RvsdgNode.Branch.class) >= 1, rvsdg::toString);
    }

    @Test
    void unstructuredLoopBehaves() {
        // b_cond true would never return
        assertPreserved(Samples.unstructured(),
                args(true, false, 7L),
                args(false, false, 9L));
    }

    @Test
    void irreducibleCounter() {
        assertPreserved(Samples.irreducibleCounter(),
                args(true, 0L), args(false, 0L),
                args(true, 1L), args(false, 1L),
                args(true, 4L), args(false, 4L));
    }

    @Test
    void headControlledLoop() {
        RvsdgFunction rvsdg = assertPreserved(Samples.whileLoop(),
                args(0L), args(1L), args(3L));
        assertEquals(1, count(rvsdg, RvsdgNode.Loop.class), rvsdg::toString);
    }

    @Test
    void loopWithTwoExits() {
        RvsdgFunction rvsdg = assertPreserved(Samples.multiExit(),
                args(0L), args(3L), args(5L), args(6L), args(10L));
        assertEquals(1, count(rvsdg, RvsdgNode.Loop.class), rvsdg::toString);
        // the exits are chosen between after the loop
        RvsdgNode.Branch dispatch = null;
        for (RvsdgNode node : rvsdg.nodes) {
            if (node instanceof RvsdgNode.Branch) dispatch = (RvsdgNode.Branch) node;
        }
        assertNotNull(dispatch, rvsdg::toString);
        assertEquals(2, dispatch.arms.size());
        assertInstanceOf(Operand.Project.class, dispatch.predicate);
        assertInstanceOf(RvsdgNode.Loop.class, rvsdg.node(((Operand.Project) dispatch.predicate).node));
    }

    @Test
    void switchWithFallthrough() {
        RvsdgFunction rvsdg = assertPreserved(Samples.switchFallthrough(),
                args(0L), args(1L), args(2L));
        assertEquals(0, count(rvsdg, RvsdgNode.Loop.class), rvsdg::toString);
        boolean threeWay = false;
        for (RvsdgNode node : rvsdg.nodes) {
            if (node instanceof RvsdgNode.Branch && ((RvsdgNode.Branch) node).arms.size() == 3) threeWay = true;
        }
        assertTrue(threeWay, rvsdg::toString);
    }

    @Test
    void nestedLoops() {
        RvsdgFunction rvsdg = assertPreserved(Samples.nestedLoops(),
                args(0L), args(1L), args(2L), args(4L));
        assertEquals(2, count(rvsdg, RvsdgNode.Loop.class), rvsdg::toString);
    }

    @Test
    void controlTreeOfLoopThenBranch() {
        Function func = Samples.oddBranch();
        Passes.STRUCTURE.run(func);

        List<ControlTree> elements = func.getExtOrThrow(CommonExts.CONTROL_TREE).getElements();
        // $entry, entry, the loop, the tail, its branch, exit, $exit
        assertEquals(7, elements.size(), () -> func.getExtOrThrow(CommonExts.CONTROL_TREE).toString());
        ControlTree.Loop loop = assertInstanceOf(ControlTree.Loop.class, elements.get(2));
        assertEquals("loop", loop.info.head.label);
        assertEquals(loop.info.head, loop.info.tail);
        ControlTree.Branch branch = assertInstanceOf(ControlTree.Branch.class, elements.get(4));
        assertEquals(2, branch.arms.size());
        assertTrue(branch.arms.get(0).getElements().isEmpty());
        assertEquals("exit", branch.cont.label);
    }

    @Test
    void loopsAreTailControlled() {
        Function func = Samples.whileLoop();
        Passes.STRUCTURE.run(func);

        int loops = 0;
        for (BasicBlock block : func.blocks) {
            LoopInfo info = block.getNullable(CommonExts.LOOP);
            if (info == null) continue;
            loops++;
            assertTrue(info.body.contains(info.tail));
            assertEquals(2, info.tail.getControl().targets.size());
            assertEquals(info.head, info.tail.getControl().targets.get(info.repeatIndex));
            assertTrue(!info.body.contains(info.exitTarget()));
        }
        assertEquals(1, loops);
    }
}
