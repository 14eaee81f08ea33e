package io.github.eutro.rvsdg.passes;

import io.github.eutro.rvsdg.cfg.Function;
import io.github.eutro.rvsdg.graph.RvsdgFunction;
import io.github.eutro.rvsdg.passes.convert.CfgToRvsdg;
import io.github.eutro.rvsdg.passes.form.NormalizeExits;
import io.github.eutro.rvsdg.passes.form.RestructureBranches;
import io.github.eutro.rvsdg.passes.form.RestructureLoops;
import io.github.eutro.rvsdg.passes.meta.VerifyCfg;
import io.github.eutro.rvsdg.passes.opts.EliminateDeadBlocks;

/**
 * Some pre-composed passes.
 */
public class Passes {
    /**
     * Passes that restructure a verified function into properly nested loops and branches.
     */
    public static final IRPass<Function, Function> STRUCTURE =
            EliminateDeadBlocks.INSTANCE
                    .then(NormalizeExits.INSTANCE)
                    .then(RestructureLoops.INSTANCE)
                    .then(RestructureBranches.INSTANCE);

    /**
     * Verify, restructure and convert a single function, without checking its calls against the rest
     * of its program. Use {@link io.github.eutro.rvsdg.passes.convert.ProgramToRvsdg} to also check calls.
     */
    public static final IRPass<Function, RvsdgFunction> TO_RVSDG =
            VerifyCfg.INSTANCE
                    .then(STRUCTURE)
                    .then(CfgToRvsdg.INSTANCE);
}
