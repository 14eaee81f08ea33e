package io.github.eutro.rvsdg.cfg;

import io.github.eutro.rvsdg.ext.CommonExts;
import io.github.eutro.rvsdg.ext.Ext;
import io.github.eutro.rvsdg.ext.ExtHolder;
import io.github.eutro.rvsdg.ext.MetadataState;
import io.github.eutro.rvsdg.ops.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A function of the input control flow graph, encapsulating a list of {@link BasicBlock basic blocks}.
 */
public final class Function extends ExtHolder {
    /**
     * Whether variable name collisions should be counted. This is useful for debugging,
     * so that variables created by restructuring display differently.
     */
    public static boolean UNIQUE_VAR_NAMES = System.getenv("RVSDG_UNIQUE_VAR_NAMES") != null;

    /**
     * The name of the function.
     */
    public final String name;
    /**
     * The declared return type of the function, or null if it returns nothing.
     */
    @Nullable
    public final Type returnType;
    private final List<Var> params = new ArrayList<>();
    /**
     * The list of basic blocks in this function. The first element is the entry block.
     */
    public final List<BasicBlock> blocks = new ArrayList<>();

    private final Map<String, Integer> varNames = UNIQUE_VAR_NAMES ? new HashMap<>() : null;

    public Function(String name, @Nullable Type returnType) {
        this.name = name;
        this.returnType = returnType;
    }

    /**
     * Create a new variable with the given name.
     *
     * @param name The name.
     * @param type The type of the variable.
     * @return The new variable.
     */
    public Var newVar(String name, Type type) {
        if (!UNIQUE_VAR_NAMES) {
            return new Var(name, 0, type);
        }
        Integer idx = varNames.merge(name, 0, ($, i) -> i + 1);
        return new Var(name, idx, type);
    }

    /**
     * Declare the next parameter of this function.
     *
     * @param name The name of the parameter.
     * @param type The type of the parameter.
     * @return The variable holding the parameter.
     */
    public Var newParam(String name, Type type) {
        Var param = newVar(name, type);
        params.add(param);
        return param;
    }

    /**
     * Get the parameters of this function, in order.
     *
     * @return The parameters.
     */
    public List<Var> getParams() {
        return Collections.unmodifiableList(params);
    }

    /**
     * Creates a new basic block in this function.
     *
     * @return The new basic block.
     */
    public BasicBlock newBb() {
        return newBb(null);
    }

    /**
     * Creates a new labelled basic block in this function.
     *
     * @param label The label.
     * @return The new basic block.
     */
    public BasicBlock newBb(@Nullable String label) {
        BasicBlock bb = new BasicBlock(label);
        blocks.add(bb);
        return bb;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('@').append(name).append('(');
        for (int i = 0; i < params.size(); i++) {
            if (i != 0) sb.append(", ");
            Var param = params.get(i);
            sb.append(param).append(": ").append(param.type);
        }
        sb.append(')');
        if (returnType != null) sb.append(": ").append(returnType);
        sb.append(" {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }

    // exts
    private MetadataState metaState = new MetadataState();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = null;
            return;
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        }
        return super.getNullable(ext);
    }
}
