package io.github.eutro.rvsdg.passes.meta;

import io.github.eutro.rvsdg.cfg.BasicBlock;
import io.github.eutro.rvsdg.cfg.Effect;
import io.github.eutro.rvsdg.cfg.Function;
import io.github.eutro.rvsdg.cfg.Var;
import io.github.eutro.rvsdg.ext.CommonExts;
import io.github.eutro.rvsdg.ext.CommonExts.LiveData;
import io.github.eutro.rvsdg.ext.MetadataState;
import io.github.eutro.rvsdg.passes.InPlaceIRPass;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.ListIterator;
import java.util.Set;

/**
 * Computes the {@link CommonExts#LIVE_DATA} for each block.
 * <p>
 * A backwards may-analysis: a variable is live at a point if some path from
 * there reads it before assigning it.
 */
public class ComputeLiveVars implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeLiveVars INSTANCE = new ComputeLiveVars();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS);

        for (BasicBlock block : func.blocks) {
            LiveData data = new LiveData();
            block.attachExt(CommonExts.LIVE_DATA, data);

            for (Effect effect : block.getEffects()) {
                for (Var arg : effect.insn().args()) {
                    if (!data.kill.contains(arg)) data.gen.add(arg);
                }
                data.kill.addAll(effect.getAssignsTo());
            }
            for (Var arg : block.getControl().insn().args()) {
                if (!data.kill.contains(arg)) data.gen.add(arg);
            }

            data.liveIn.addAll(data.gen);
        }

        Set<BasicBlock> workQueue = new LinkedHashSet<>();
        for (ListIterator<BasicBlock> li = func.blocks.listIterator(func.blocks.size()); li.hasPrevious(); ) {
            workQueue.add(li.previous());
        }
        while (!workQueue.isEmpty()) {
            Iterator<BasicBlock> iterator = workQueue.iterator();
            BasicBlock next = iterator.next();
            iterator.remove();
            LiveData data = next.getExtOrThrow(CommonExts.LIVE_DATA);
            boolean changed = false;
            for (BasicBlock succ : next.getControl().targets) {
                for (Var varIn : succ.getExtOrThrow(CommonExts.LIVE_DATA).liveIn) {
                    if (data.liveOut.add(varIn) && !data.kill.contains(varIn)) {
                        changed |= data.liveIn.add(varIn);
                    }
                }
            }
            if (changed) {
                workQueue.addAll(next.getExtOrThrow(CommonExts.PREDS));
            }
        }

        ms.validate(MetadataState.LIVE_DATA);
    }
}
