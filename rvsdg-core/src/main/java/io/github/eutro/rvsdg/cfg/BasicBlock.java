package io.github.eutro.rvsdg.cfg;

import io.github.eutro.rvsdg.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A basic block, encapsulating a list of {@link Effect} instructions,
 * followed by exactly one {@link Control} instruction at the end.
 */
public final class BasicBlock extends ExtHolder {
    private final List<Effect> effects = new ArrayList<>();
    private Control control;
    /**
     * The label of the block in the source program, if it had one.
     */
    @Nullable
    public final String label;

    BasicBlock(@Nullable String label) {
        this.label = label;
    }

    /**
     * Format this block as a jump target, for debugging and error messages.
     *
     * @return The jump target string.
     */
    public String toTargetString() {
        return label != null ? "." + label : String.format("@%08x", System.identityHashCode(this));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append("\n{\n");
        for (Effect effect : getEffects()) {
            sb.append(' ').append(effect).append('\n');
        }
        sb.append(' ').append(getControl());
        sb.append("\n}");
        return sb.toString();
    }

    /**
     * Get the list of {@link Effect effects} in this basic block.
     *
     * @return The list.
     */
    public List<Effect> getEffects() {
        return effects;
    }

    /**
     * Add an {@link Effect effect} to the end of this basic block.
     *
     * @param effect The effect to add.
     */
    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    /**
     * Get the control instruction of this block.
     *
     * @return The control instruction, or null if it has not been set yet.
     */
    public Control getControl() {
        return control;
    }

    /**
     * Set the control instruction of this block.
     *
     * @param control The control instruction.
     */
    public void setControl(Control control) {
        this.control = control;
    }
}
