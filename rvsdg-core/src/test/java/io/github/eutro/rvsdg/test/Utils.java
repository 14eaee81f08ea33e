package io.github.eutro.rvsdg.test;

import io.github.eutro.rvsdg.cfg.Function;
import io.github.eutro.rvsdg.graph.RvsdgFunction;
import io.github.eutro.rvsdg.graph.RvsdgNode;
import io.github.eutro.rvsdg.graph.RvsdgVerifier;
import io.github.eutro.rvsdg.graph.StructuralEquality;
import io.github.eutro.rvsdg.passes.Passes;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class Utils {
    static {
        RvsdgVerifier.VERIFY = true;
    }

    public static RvsdgFunction convert(Function func) {
        return Passes.TO_RVSDG.run(func);
    }

    public static void assertGraphEquals(RvsdgFunction expected, RvsdgFunction actual) {
        assertTrue(StructuralEquality.equal(expected, actual),
                () -> "expected:\n" + expected + "\nactual:\n" + actual);
    }

    /**
     * Convert a function, checking that it behaves the same before and after for each set of arguments.
     */
    public static RvsdgFunction assertPreserved(Function func, Object[]... argSets) {
        Interpreters.Outcome[] before = new Interpreters.Outcome[argSets.length];
        for (int i = 0; i < argSets.length; i++) {
            before[i] = Interpreters.runCfg(func, argSets[i]);
        }
        RvsdgFunction rvsdg = convert(func);
        for (int i = 0; i < argSets.length; i++) {
            int finalI = i;
            assertEquals(before[i], Interpreters.runRvsdg(rvsdg, argSets[i]),
                    () -> "with arguments " + Arrays.toString(argSets[finalI]) + " in\n" + rvsdg);
        }
        return rvsdg;
    }

    public static Object[] args(Object... args) {
        return args;
    }

    public static int count(RvsdgFunction func, Class<? extends RvsdgNode> kind) {
        int count = 0;
        for (RvsdgNode node : func.nodes) {
            if (kind.isInstance(node)) count++;
        }
        return count;
    }
}
