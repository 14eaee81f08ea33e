package io.github.eutro.rvsdg.cfg;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when an input control flow graph cannot be structured because it is not well-formed.
 * <p>
 * This aborts conversion of the offending function only.
 */
public class MalformedCfgException extends RuntimeException {
    /**
     * The name of the function that is malformed.
     */
    public final String function;
    /**
     * The block the problem was found in, if it is local to one.
     */
    @Nullable
    public final BasicBlock block;

    public MalformedCfgException(Function function, @Nullable BasicBlock block, String message) {
        super(format(function, block, message));
        this.function = function.name;
        this.block = block;
    }

    private static String format(Function function, @Nullable BasicBlock block, String message) {
        if (block == null) {
            return String.format("%s\n  in function: @%s", message, function.name);
        }
        return String.format("%s\n  in block: %s\n  in function: @%s", message, block, function.name);
    }
}
