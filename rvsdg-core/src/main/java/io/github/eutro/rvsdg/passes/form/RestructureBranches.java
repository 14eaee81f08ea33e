package io.github.eutro.rvsdg.passes.form;

import io.github.eutro.rvsdg.cfg.BasicBlock;
import io.github.eutro.rvsdg.cfg.Control;
import io.github.eutro.rvsdg.cfg.Function;
import io.github.eutro.rvsdg.cfg.Var;
import io.github.eutro.rvsdg.ext.CommonExts;
import io.github.eutro.rvsdg.ext.MetadataState;
import io.github.eutro.rvsdg.ops.CfgOps;
import io.github.eutro.rvsdg.ops.Literal;
import io.github.eutro.rvsdg.ops.Type;
import io.github.eutro.rvsdg.passes.InPlaceIRPass;
import io.github.eutro.rvsdg.util.Dominators;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the {@link ControlTree} of a function whose loops have been restructured.
 * <p>
 * Each region is walked from its entry, with loops collapsed to a single node. At a block with
 * several targets, the arm of a target is every node it dominates, if the block is its only
 * predecessor, and nothing otherwise. The continuations are the targets of empty arms, and every
 * node outside the arms that the arms jump to. If there is exactly one, it is where the branch
 * joins. If there are more, the edges to them are redirected to a new block that switches on
 * which continuation was meant, and the function is analysed again.
 */
public class RestructureBranches implements InPlaceIRPass<Function> {
    /**
     * The most times a function is analysed before giving up.
     */
    public static int MAX_ROUNDS = 1 << 12;

    /**
     * A singleton instance of this pass.
     */
    public static final RestructureBranches INSTANCE = new RestructureBranches();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.LOOPS_RESTRUCTURED);

        BasicBlock entry = func.blocks.get(0);
        BasicBlock exit = func.getExtOrThrow(CommonExts.EXIT_BLOCK);
        for (int round = 0; ; round++) {
            if (round >= MAX_ROUNDS) {
                throw new RestructuringException(func, entry, exit,
                        "branch restructuring did not finish in " + MAX_ROUNDS + " rounds");
            }
            ControlTree.Seq tree = new Runner(func).structure(new Region(null, entry, exit));
            if (tree != null) {
                func.attachExt(CommonExts.CONTROL_TREE, tree);
                break;
            }
            ms.graphChanged();
        }

        ms.validate(MetadataState.STRUCTURED);
    }

    private static final class Region {
        @Nullable
        final LoopInfo loop;
        final BasicBlock entry;
        final BasicBlock cut;
        Dominators<BasicBlock> doms;
        final Map<BasicBlock, List<Edge>> preds = new HashMap<>();

        Region(@Nullable LoopInfo loop, BasicBlock entry, BasicBlock cut) {
            this.loop = loop;
            this.entry = entry;
            this.cut = cut;
        }

        @Nullable
        LoopInfo collapsedLoop(BasicBlock node) {
            LoopInfo info = node.getNullable(CommonExts.LOOP);
            return info == loop ? null : info;
        }

        List<Edge> succEdges(BasicBlock node) {
            if (node == cut) return Collections.emptyList();
            LoopInfo info = collapsedLoop(node);
            if (info != null) {
                return Collections.singletonList(new Edge(node, info.tail, info.exitIndex));
            }
            List<Edge> edges = new ArrayList<>();
            for (int i = 0; i < node.getControl().targets.size(); i++) {
                edges.add(new Edge(node, i));
            }
            return edges;
        }

        List<BasicBlock> succs(BasicBlock node) {
            List<BasicBlock> succs = new ArrayList<>();
            for (Edge edge : succEdges(node)) {
                succs.add(edge.target());
            }
            return succs;
        }

        void analyse() {
            doms = Dominators.compute(entry, this::succs);
            for (BasicBlock node : doms.nodes()) {
                preds.put(node, new ArrayList<>());
            }
            for (BasicBlock node : doms.nodes()) {
                for (Edge edge : succEdges(node)) {
                    preds.get(edge.target()).add(edge);
                }
            }
        }

        void addBlock(BasicBlock block) {
            if (loop != null) loop.body.add(block);
        }
    }

    private static final class Runner {
        private final Function func;

        Runner(Function func) {
            this.func = func;
        }

        /**
         * Structure a region, or return null if the graph had to be changed.
         */
        @Nullable
        ControlTree.Seq structure(Region region) {
            region.analyse();
            return walk(region, region.entry, null);
        }

        @Nullable
        private ControlTree.Seq walk(Region region, BasicBlock start, @Nullable BasicBlock stop) {
            ControlTree.Seq seq = new ControlTree.Seq();
            BasicBlock cur = start;
            while (cur != stop) {
                LoopInfo loop = region.collapsedLoop(cur);
                if (loop != null) {
                    ControlTree.Seq body = structure(new Region(loop, loop.head, loop.tail));
                    if (body == null) return null;
                    seq.add(new ControlTree.Loop(loop, body));
                    cur = step(region, cur, loop.exitTarget(), stop);
                    continue;
                }

                seq.add(new ControlTree.Block(cur));
                if (cur == region.cut) break;
                List<BasicBlock> targets = cur.getControl().targets;
                if (new LinkedHashSet<>(targets).size() == 1) {
                    cur = step(region, cur, targets.get(0), stop);
                    continue;
                }

                ControlTree.Branch branch = split(region, cur);
                if (branch == null) return null;
                seq.add(branch);
                cur = branch.cont;
            }
            return seq;
        }

        private BasicBlock step(Region region, BasicBlock from, BasicBlock to, @Nullable BasicBlock stop) {
            if (to != stop) {
                for (Edge pred : region.preds.get(to)) {
                    if (pred.node != from) {
                        throw new RestructuringException(func, region.entry, region.cut,
                                "unstructured join at " + to.toTargetString() + " from " + pred);
                    }
                }
            }
            return to;
        }

        @Nullable
        private ControlTree.Branch split(Region region, BasicBlock cur) {
            List<BasicBlock> targets = cur.getControl().targets;
            List<Set<BasicBlock>> arms = new ArrayList<>();
            Set<BasicBlock> inArms = new LinkedHashSet<>();
            for (BasicBlock target : targets) {
                Set<BasicBlock> arm = new LinkedHashSet<>();
                if (region.preds.get(target).size() == 1) {
                    for (BasicBlock node : region.doms.nodes()) {
                        if (region.doms.dominates(target, node)) arm.add(node);
                    }
                }
                arms.add(arm);
                inArms.addAll(arm);
            }

            Set<BasicBlock> conts = new LinkedHashSet<>();
            List<Edge> contEdges = new ArrayList<>();
            for (int i = 0; i < targets.size(); i++) {
                if (arms.get(i).isEmpty()) {
                    conts.add(targets.get(i));
                    contEdges.add(new Edge(cur, i));
                    continue;
                }
                for (BasicBlock node : arms.get(i)) {
                    for (Edge edge : region.succEdges(node)) {
                        if (!inArms.contains(edge.target())) {
                            conts.add(edge.target());
                            contEdges.add(edge);
                        }
                    }
                }
            }

            if (conts.size() != 1) {
                if (conts.isEmpty()) {
                    throw new RestructuringException(func, region.entry, region.cut,
                            "branch at " + cur.toTargetString() + " never joins");
                }
                insertDispatch(region, new ArrayList<>(conts), contEdges);
                return null;
            }

            BasicBlock cont = conts.iterator().next();
            List<ControlTree.Seq> armTrees = new ArrayList<>();
            for (int i = 0; i < targets.size(); i++) {
                if (arms.get(i).isEmpty()) {
                    armTrees.add(new ControlTree.Seq());
                } else {
                    ControlTree.Seq arm = walk(region, targets.get(i), cont);
                    if (arm == null) return null;
                    armTrees.add(arm);
                }
            }
            return new ControlTree.Branch(cur, armTrees, cont);
        }

        private void insertDispatch(Region region, List<BasicBlock> conts, List<Edge> contEdges) {
            Var which = func.newVar("$p", Type.INT);
            BasicBlock dispatch = func.newBb();
            dispatch.setControl(Control.switchOn(which, conts));
            region.addBlock(dispatch);
            for (Edge edge : contEdges) {
                int index = conts.indexOf(edge.target());
                region.addBlock(edge.splice(func, dispatch,
                        CfgOps.constant(Literal.ofInt(index)).assignTo(which)));
            }
        }
    }
}
