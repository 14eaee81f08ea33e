package io.github.eutro.rvsdg.passes.form;

import io.github.eutro.rvsdg.cfg.BasicBlock;
import io.github.eutro.rvsdg.cfg.Control;
import io.github.eutro.rvsdg.cfg.Effect;
import io.github.eutro.rvsdg.cfg.Function;

/**
 * An edge of a control flow graph, identified by the position of its target in a control instruction.
 */
final class Edge {
    /**
     * The node the edge leaves. Differs from {@link #owner} for the exit edge of a collapsed loop,
     * which leaves the loop's head.
     */
    final BasicBlock node;
    final BasicBlock owner;
    final int index;

    Edge(BasicBlock node, BasicBlock owner, int index) {
        this.node = node;
        this.owner = owner;
        this.index = index;
    }

    Edge(BasicBlock owner, int index) {
        this(owner, owner, index);
    }

    BasicBlock target() {
        return owner.getControl().targets.get(index);
    }

    /**
     * Insert a new block on this edge, which runs the given effects and jumps to {@code to}.
     *
     * @param func    The function.
     * @param to      The new target of the edge.
     * @param effects The effects of the new block.
     * @return The new block.
     */
    BasicBlock splice(Function func, BasicBlock to, Effect... effects) {
        BasicBlock bb = func.newBb();
        for (Effect effect : effects) {
            bb.addEffect(effect);
        }
        bb.setControl(Control.br(to));
        owner.getControl().targets.set(index, bb);
        return bb;
    }

    @Override
    public String toString() {
        return node.toTargetString() + "#" + index + " -> " + target().toTargetString();
    }
}
