package io.github.eutro.rvsdg.passes.convert;

import io.github.eutro.rvsdg.cfg.Function;
import io.github.eutro.rvsdg.cfg.MalformedCfgException;
import io.github.eutro.rvsdg.cfg.Program;
import io.github.eutro.rvsdg.graph.RvsdgFunction;
import io.github.eutro.rvsdg.graph.RvsdgProgram;
import io.github.eutro.rvsdg.passes.IRPass;
import io.github.eutro.rvsdg.passes.Passes;
import io.github.eutro.rvsdg.passes.meta.VerifyCfg;

/**
 * Converts every function of a program to an RVSDG.
 * <p>
 * A function that is not a well-formed control flow graph is recorded in {@link RvsdgProgram#failures}
 * and the rest of the program is still converted. Any other exception is a bug, and is rethrown.
 */
public class ProgramToRvsdg implements IRPass<Program, RvsdgProgram> {
    /**
     * A singleton instance of this pass.
     */
    public static final ProgramToRvsdg INSTANCE = new ProgramToRvsdg();

    @Override
    public RvsdgProgram run(Program program) {
        IRPass<Function, RvsdgFunction> pass = new VerifyCfg(program)
                .then(Passes.STRUCTURE)
                .then(CfgToRvsdg.INSTANCE);
        RvsdgProgram rvsdg = new RvsdgProgram();
        for (Function func : program.functions) {
            try {
                rvsdg.functions.add(pass.run(func));
            } catch (MalformedCfgException e) {
                rvsdg.failures.put(func.name, e);
            }
        }
        return rvsdg;
    }
}
