package io.github.eutro.rvsdg.passes.form;

import io.github.eutro.rvsdg.cfg.BasicBlock;
import io.github.eutro.rvsdg.ext.CommonExts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The properly nested control structure of a restructured function, attached to it as
 * {@link CommonExts#CONTROL_TREE}.
 * <p>
 * A {@link Seq} runs its elements one after another. The control instructions of the blocks
 * are not run by a {@link Block} element: they are what the following {@link Branch} or
 * {@link Loop} element, or the end of the sequence, stands for.
 */
public abstract class ControlTree {
    private ControlTree() {
    }

    abstract void render(StringBuilder sb, String indent);

    /**
     * A sequence of elements.
     */
    public static final class Seq {
        private final List<ControlTree> elements = new ArrayList<>();

        void add(ControlTree element) {
            elements.add(element);
        }

        public List<ControlTree> getElements() {
            return Collections.unmodifiableList(elements);
        }

        void render(StringBuilder sb, String indent) {
            for (ControlTree element : elements) {
                element.render(sb, indent);
            }
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            render(sb, "");
            return sb.toString();
        }
    }

    /**
     * The effects of a single block.
     */
    public static final class Block extends ControlTree {
        public final BasicBlock block;

        Block(BasicBlock block) {
            this.block = block;
        }

        @Override
        void render(StringBuilder sb, String indent) {
            sb.append(indent).append(block.toTargetString()).append('\n');
        }
    }

    /**
     * A choice on the argument of the control instruction of {@link #split}, which must be the last
     * block run before this element. Arm {@code i} is run for target {@code i}, and every arm
     * continues at {@link #cont}, which begins the next element.
     */
    public static final class Branch extends ControlTree {
        public final BasicBlock split;
        public final List<Seq> arms;
        public final BasicBlock cont;

        Branch(BasicBlock split, List<Seq> arms, BasicBlock cont) {
            this.split = split;
            this.arms = arms;
            this.cont = cont;
        }

        @Override
        void render(StringBuilder sb, String indent) {
            sb.append(indent).append("branch ").append(split.toTargetString()).append('\n');
            for (int i = 0; i < arms.size(); i++) {
                sb.append(indent).append(' ').append(i).append(":\n");
                arms.get(i).render(sb, indent + "  ");
            }
            sb.append(indent).append("join ").append(cont.toTargetString()).append('\n');
        }
    }

    /**
     * A tail-controlled loop, running {@link #body} until the tail chooses its exit edge.
     */
    public static final class Loop extends ControlTree {
        public final LoopInfo info;
        public final Seq body;

        Loop(LoopInfo info, Seq body) {
            this.info = info;
            this.body = body;
        }

        @Override
        void render(StringBuilder sb, String indent) {
            sb.append(indent).append(info).append('\n');
            body.render(sb, indent + "  ");
        }
    }
}
