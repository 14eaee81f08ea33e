package io.github.eutro.rvsdg.passes.opts;

import io.github.eutro.rvsdg.cfg.Function;
import io.github.eutro.rvsdg.ext.CommonExts;
import io.github.eutro.rvsdg.ext.MetadataState;
import io.github.eutro.rvsdg.passes.InPlaceIRPass;
import io.github.eutro.rvsdg.util.GraphWalker;

import java.util.HashSet;
import java.util.Set;

/**
 * Removes any blocks unreachable from the entry block.
 * <p>
 * Unreachable blocks never execute, so they would only add spurious
 * predecessors to the blocks they jump to.
 */
public class EliminateDeadBlocks implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final EliminateDeadBlocks INSTANCE = new EliminateDeadBlocks();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.VERIFIED);
        Set<Object> reachable = new HashSet<>(GraphWalker.blockWalker(func).preOrder().toList());
        if (func.blocks.retainAll(reachable)) {
            ms.graphChanged();
        }
    }
}
