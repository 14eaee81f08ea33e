package io.github.eutro.rvsdg.passes.form;

import io.github.eutro.rvsdg.cfg.BasicBlock;
import io.github.eutro.rvsdg.ext.CommonExts;

import java.util.Set;

/**
 * A tail-controlled loop, attached to its head block as {@link CommonExts#LOOP}.
 * <p>
 * The loop is entered only through {@link #head}, and left only through the exit edge of {@link #tail},
 * whose other edge is the only edge back to the head.
 */
public final class LoopInfo {
    public final BasicBlock head;
    public final BasicBlock tail;
    /**
     * Every block of the loop, including the head and the tail.
     */
    public final Set<BasicBlock> body;
    /**
     * The index of the tail's target that leaves the loop.
     */
    public final int exitIndex;
    /**
     * The index of the tail's target that jumps back to the head.
     */
    public final int repeatIndex;

    public LoopInfo(BasicBlock head, BasicBlock tail, Set<BasicBlock> body, int exitIndex, int repeatIndex) {
        this.head = head;
        this.tail = tail;
        this.body = body;
        this.exitIndex = exitIndex;
        this.repeatIndex = repeatIndex;
    }

    /**
     * Get the block control flow continues at when the loop is left.
     *
     * @return The block.
     */
    public BasicBlock exitTarget() {
        return tail.getControl().targets.get(exitIndex);
    }

    @Override
    public String toString() {
        return "loop " + head.toTargetString() + " .. " + tail.toTargetString() + " -> " + exitTarget().toTargetString();
    }
}
