package io.github.eutro.rvsdg.ext;

import io.github.eutro.rvsdg.cfg.BasicBlock;
import io.github.eutro.rvsdg.cfg.Function;
import io.github.eutro.rvsdg.cfg.Insn;
import io.github.eutro.rvsdg.cfg.Var;
import io.github.eutro.rvsdg.ops.Op;
import io.github.eutro.rvsdg.ops.OpKey;
import io.github.eutro.rvsdg.passes.form.ControlTree;
import io.github.eutro.rvsdg.passes.form.LoopInfo;
import io.github.eutro.rvsdg.passes.form.NormalizeExits;
import io.github.eutro.rvsdg.passes.form.RestructureBranches;
import io.github.eutro.rvsdg.passes.form.RestructureLoops;
import io.github.eutro.rvsdg.passes.meta.ComputeLiveVars;
import io.github.eutro.rvsdg.passes.meta.ComputePreds;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The {@link Ext}s attached to the input control flow graph.
 */
public class CommonExts {
    /**
     * Attached to a {@link Function}. Has metadata about the form of the function.
     *
     * @see MetadataState
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * Attached to a {@link BasicBlock}. The predecessors of the block, once per edge.
     * <p>
     * Computed by {@link ComputePreds}.
     */
    public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");

    /**
     * Attached to an {@link Insn}, {@link Op} or {@link OpKey}.
     * Whether the instruction has no observable side effects.
     */
    public static final Ext<Boolean> IS_PURE = Ext.create(Boolean.class, "IS_PURE");

    /**
     * Attached to a {@link BasicBlock}, computed by {@link ComputeLiveVars}. The live variable information of the block.
     */
    public static final Ext<LiveData> LIVE_DATA = Ext.create(LiveData.class, "LIVE_DATA");

    /**
     * Attached to a {@link Function}, computed by {@link NormalizeExits}. The single block that returns.
     */
    public static final Ext<BasicBlock> EXIT_BLOCK = Ext.create(BasicBlock.class, "EXIT_BLOCK");
    /**
     * Attached to a {@link Function}, computed by {@link NormalizeExits}.
     * The variable every return value is copied into, absent for functions returning nothing.
     */
    public static final Ext<Var> RETURN_VAR = Ext.create(Var.class, "RETURN_VAR");

    /**
     * Attached to the head {@link BasicBlock} of every loop, computed by {@link RestructureLoops}.
     */
    public static final Ext<LoopInfo> LOOP = Ext.create(LoopInfo.class, "LOOP");

    /**
     * Attached to a {@link Function}, computed by {@link RestructureBranches}.
     * The properly nested structure of the function's control flow.
     */
    public static final Ext<ControlTree.Seq> CONTROL_TREE = Ext.create(ControlTree.Seq.class, "CONTROL_TREE");

    /**
     * The live variable information of a basic block.
     */
    public static class LiveData {
        /**
         * The set of variables used in the block before assignment.
         */
        public final Set<Var> gen = new HashSet<>();
        /**
         * The set of variables that are assigned to in this block.
         */
        public final Set<Var> kill = new HashSet<>();
        /**
         * The set of variables that are alive at the start of the block.
         */
        public final Set<Var> liveIn = new LinkedHashSet<>();
        /**
         * The set of variables that are alive at the end of the block.
         */
        public final Set<Var> liveOut = new LinkedHashSet<>();
    }
}
