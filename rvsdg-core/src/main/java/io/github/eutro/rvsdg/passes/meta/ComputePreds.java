package io.github.eutro.rvsdg.passes.meta;

import io.github.eutro.rvsdg.cfg.BasicBlock;
import io.github.eutro.rvsdg.cfg.Function;
import io.github.eutro.rvsdg.ext.CommonExts;
import io.github.eutro.rvsdg.ext.MetadataState;
import io.github.eutro.rvsdg.passes.InPlaceIRPass;

import java.util.ArrayList;

/**
 * Computes {@link CommonExts#PREDS} for each block.
 * <p>
 * A block appears once in the predecessors of a target for every edge to it,
 * so a {@code switch} with a repeated target contributes several entries.
 */
public class ComputePreds implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(Function func) {
        for (BasicBlock block : func.blocks) {
            block.attachExt(CommonExts.PREDS, new ArrayList<>());
        }
        for (BasicBlock block : func.blocks) {
            for (BasicBlock target : block.getControl().targets) {
                target.getExtOrThrow(CommonExts.PREDS).add(block);
            }
        }

        func.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.PREDS);
    }
}
