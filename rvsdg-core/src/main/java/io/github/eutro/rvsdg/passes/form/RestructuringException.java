package io.github.eutro.rvsdg.passes.form;

import io.github.eutro.rvsdg.cfg.BasicBlock;
import io.github.eutro.rvsdg.cfg.Function;

/**
 * Thrown when restructuring fails on a control flow graph that passed verification.
 * This indicates a bug in restructuring, rather than bad input.
 */
public class RestructuringException extends RuntimeException {
    public RestructuringException(Function func, BasicBlock regionEntry, BasicBlock regionExit, String message) {
        super(String.format("%s" +
                        "\n  region entry: %s" +
                        "\n  region exit: %s" +
                        "\n  in function: @%s",
                message,
                regionEntry.toTargetString(),
                regionExit.toTargetString(),
                func.name));
    }
}
