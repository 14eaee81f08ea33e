package io.github.eutro.rvsdg.passes.form;

import io.github.eutro.rvsdg.cfg.BasicBlock;
import io.github.eutro.rvsdg.cfg.Control;
import io.github.eutro.rvsdg.cfg.Function;
import io.github.eutro.rvsdg.cfg.MalformedCfgException;
import io.github.eutro.rvsdg.cfg.Var;
import io.github.eutro.rvsdg.ext.CommonExts;
import io.github.eutro.rvsdg.ext.MetadataState;
import io.github.eutro.rvsdg.ops.CfgOps;
import io.github.eutro.rvsdg.passes.InPlaceIRPass;
import io.github.eutro.rvsdg.util.GraphWalker;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Gives a function a single entry block without predecessors, and a single exit block.
 * <p>
 * Every {@code return} is replaced by a jump to the new exit block, copying the returned value
 * into {@link CommonExts#RETURN_VAR} first. Functions with a block from which no return is
 * reachable are rejected.
 */
public class NormalizeExits implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final NormalizeExits INSTANCE = new NormalizeExits();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.VERIFIED);

        List<BasicBlock> original = new ArrayList<>(func.blocks);
        BasicBlock entry = func.newBb("$entry");
        func.blocks.remove(entry);
        func.blocks.add(0, entry);
        entry.setControl(Control.br(original.get(0)));

        BasicBlock exit = func.newBb("$exit");
        Var retVar = func.returnType == null ? null : func.newVar("$ret", func.returnType);
        for (BasicBlock block : original) {
            Control ctrl = block.getControl();
            if (ctrl.insn().op != CfgOps.RETURN) continue;
            if (retVar != null) {
                block.addEffect(CfgOps.copy(ctrl.insn().args().get(0)).assignTo(retVar));
            }
            block.setControl(Control.br(exit));
        }
        exit.setControl(retVar == null
                ? CfgOps.RETURN.insn().jumpsTo()
                : CfgOps.RETURN.insn(retVar).jumpsTo());

        ms.graphChanged();
        ms.ensureValid(func, MetadataState.PREDS);
        Set<BasicBlock> returning = new HashSet<>(
                new GraphWalker<>(exit, $ -> $.getExtOrThrow(CommonExts.PREDS))
                        .preOrder()
                        .toList());
        for (BasicBlock block : original) {
            if (!returning.contains(block)) {
                throw new MalformedCfgException(func, block, "no return is reachable from block");
            }
        }

        func.attachExt(CommonExts.EXIT_BLOCK, exit);
        if (retVar != null) func.attachExt(CommonExts.RETURN_VAR, retVar);
        ms.validate(MetadataState.EXITS_NORMALIZED);
    }
}
