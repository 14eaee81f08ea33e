package io.github.eutro.rvsdg.passes.form;

import io.github.eutro.rvsdg.cfg.BasicBlock;
import io.github.eutro.rvsdg.cfg.Control;
import io.github.eutro.rvsdg.cfg.Effect;
import io.github.eutro.rvsdg.cfg.Function;
import io.github.eutro.rvsdg.cfg.Var;
import io.github.eutro.rvsdg.ext.CommonExts;
import io.github.eutro.rvsdg.ext.MetadataState;
import io.github.eutro.rvsdg.ops.CfgOps;
import io.github.eutro.rvsdg.ops.Literal;
import io.github.eutro.rvsdg.ops.Type;
import io.github.eutro.rvsdg.passes.InPlaceIRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/*
 Helge Bahmann, Nico Reissmann, Magnus Jahre and Jan Christian Meyer. Perfect Reconstructability of
 Control Flow from Demand Dependence Graphs. ACM Transactions on Architecture and Code Optimization,
 11(4):66:1-66:25, January 2015.
 */

/**
 * Rewrites every cycle of a function into a tail-controlled loop, described by a {@link LoopInfo}
 * attached to its head.
 * <p>
 * Cycles are found as the strongly connected components of each region. A component that is
 * already a tail-controlled loop is kept as is. Otherwise, all entries are routed through one head,
 * which switches on which entry was meant if there is more than one, and every edge back to an entry
 * or out of the component is routed through one new tail, which decides on a boolean whether to repeat.
 * The exits are then separated again after the tail by switching on which exit was taken.
 * <p>
 * The body of each loop, without the edges out of its tail, is then processed the same way.
 */
public class RestructureLoops implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final RestructureLoops INSTANCE = new RestructureLoops();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.EXITS_NORMALIZED);

        for (BasicBlock block : func.blocks) {
            block.removeExt(CommonExts.LOOP);
        }
        BasicBlock exit = func.getExtOrThrow(CommonExts.EXIT_BLOCK);
        if (restructureRegion(func, new LinkedHashSet<>(func.blocks), exit)) {
            ms.graphChanged();
        }

        ms.validate(MetadataState.LOOPS_RESTRUCTURED);
    }

    private static boolean restructureRegion(Function func, Set<BasicBlock> region, BasicBlock cut) {
        List<Set<BasicBlock>> sccs = new SccFinder(region, cut).find();
        List<LoopInfo> loops = new ArrayList<>();
        boolean changed = false;
        for (Set<BasicBlock> scc : sccs) {
            if (!isCyclic(scc, cut)) continue;
            changed |= restructureLoop(func, region, cut, scc, loops);
        }
        for (LoopInfo loop : loops) {
            changed |= restructureRegion(func, loop.body, loop.tail);
        }
        return changed;
    }

    private static boolean isCyclic(Set<BasicBlock> scc, BasicBlock cut) {
        if (scc.size() > 1) return true;
        BasicBlock only = scc.iterator().next();
        return only != cut && only.getControl().targets.contains(only);
    }

    private static boolean restructureLoop(
            Function func,
            Set<BasicBlock> region,
            BasicBlock cut,
            Set<BasicBlock> scc,
            List<LoopInfo> loops
    ) {
        List<Edge> entryEdges = new ArrayList<>();
        List<Edge> exitEdges = new ArrayList<>();
        Set<BasicBlock> entries = new LinkedHashSet<>();
        Set<BasicBlock> exits = new LinkedHashSet<>();
        for (BasicBlock block : region) {
            if (block == cut) continue;
            List<BasicBlock> targets = block.getControl().targets;
            for (int i = 0; i < targets.size(); i++) {
                BasicBlock target = targets.get(i);
                if (!region.contains(target)) continue;
                boolean fromInside = scc.contains(block);
                boolean toInside = scc.contains(target);
                if (!fromInside && toInside) {
                    entryEdges.add(new Edge(block, i));
                    entries.add(target);
                } else if (fromInside && !toInside) {
                    exitEdges.add(new Edge(block, i));
                    exits.add(target);
                }
            }
        }
        List<Edge> repeatEdges = new ArrayList<>();
        for (BasicBlock block : scc) {
            List<BasicBlock> targets = block.getControl().targets;
            for (int i = 0; i < targets.size(); i++) {
                if (entries.contains(targets.get(i))) {
                    repeatEdges.add(new Edge(block, i));
                }
            }
        }
        if (entries.isEmpty() || exits.isEmpty()) {
            BasicBlock some = scc.iterator().next();
            throw new RestructuringException(func, some, cut,
                    entries.isEmpty() ? "cycle has no entry" : "cycle has no exit");
        }

        if (entries.size() == 1 && repeatEdges.size() == 1 && exitEdges.size() == 1) {
            Edge repeat = repeatEdges.get(0);
            Edge exit = exitEdges.get(0);
            if (repeat.owner == exit.owner && repeat.owner.getControl().insn().op == CfgOps.BR_IF) {
                LoopInfo info = new LoopInfo(entries.iterator().next(), repeat.owner, scc, exit.index, repeat.index);
                info.head.attachExt(CommonExts.LOOP, info);
                loops.add(info);
                return false;
            }
        }

        Set<BasicBlock> body = new LinkedHashSet<>(scc);
        List<BasicBlock> entryList = new ArrayList<>(entries);
        List<BasicBlock> exitList = new ArrayList<>(exits);
        Map<Edge, BasicBlock> edgeTargets = new HashMap<>();
        for (Edge edge : entryEdges) edgeTargets.put(edge, edge.target());
        for (Edge edge : repeatEdges) edgeTargets.put(edge, edge.target());
        for (Edge edge : exitEdges) edgeTargets.put(edge, edge.target());

        Var entryVar = null;
        BasicBlock head;
        if (entryList.size() == 1) {
            head = entryList.get(0);
        } else {
            entryVar = func.newVar("$q", Type.INT);
            head = func.newBb();
            head.setControl(Control.switchOn(entryVar, entryList));
            body.add(head);
            for (Edge edge : entryEdges) {
                region.add(edge.splice(func, head, setInt(entryVar, entryList.indexOf(edgeTargets.get(edge)))));
            }
        }

        Var exitVar = null;
        BasicBlock exitTarget;
        if (exitList.size() == 1) {
            exitTarget = exitList.get(0);
        } else {
            exitVar = func.newVar("$x", Type.INT);
            exitTarget = func.newBb();
            exitTarget.setControl(Control.switchOn(exitVar, exitList));
            region.add(exitTarget);
        }

        Var repeatVar = func.newVar("$r", Type.BOOL);
        BasicBlock tail = func.newBb();
        tail.setControl(Control.brIf(repeatVar, head, exitTarget));
        body.add(tail);

        for (Edge edge : repeatEdges) {
            Effect again = CfgOps.constant(Literal.ofBool(true)).assignTo(repeatVar);
            BasicBlock spliced = entryVar == null
                    ? edge.splice(func, tail, again)
                    : edge.splice(func, tail, setInt(entryVar, entryList.indexOf(edgeTargets.get(edge))), again);
            body.add(spliced);
        }
        for (Edge edge : exitEdges) {
            Effect leave = CfgOps.constant(Literal.ofBool(false)).assignTo(repeatVar);
            BasicBlock spliced = exitVar == null
                    ? edge.splice(func, tail, leave)
                    : edge.splice(func, tail, leave, setInt(exitVar, exitList.indexOf(edgeTargets.get(edge))));
            body.add(spliced);
        }
        region.addAll(body);

        // br_if targets are [ifFalse, ifTrue]
        LoopInfo info = new LoopInfo(head, tail, body, 0, 1);
        head.attachExt(CommonExts.LOOP, info);
        loops.add(info);
        return true;
    }

    private static Effect setInt(Var var, int value) {
        return CfgOps.constant(Literal.ofInt(value)).assignTo(var);
    }

    /*
     Robert Tarjan. Depth-First Search and Linear Graph Algorithms.
     SIAM Journal on Computing, 1(2):146-160, 1972.
     */
    private static class SccFinder {
        private final Set<BasicBlock> region;
        private final BasicBlock cut;
        private final Map<BasicBlock, Integer> index = new HashMap<>();
        private final Map<BasicBlock, Integer> lowLink = new HashMap<>();
        private final List<BasicBlock> stack = new ArrayList<>();
        private final Set<BasicBlock> onStack = new LinkedHashSet<>();
        private final List<Set<BasicBlock>> sccs = new ArrayList<>();

        SccFinder(Set<BasicBlock> region, BasicBlock cut) {
            this.region = region;
            this.cut = cut;
        }

        List<Set<BasicBlock>> find() {
            for (BasicBlock block : new ArrayList<>(region)) {
                if (!index.containsKey(block)) connect(block);
            }
            // Tarjan yields components in reverse topological order
            Collections.reverse(sccs);
            return sccs;
        }

        private void connect(BasicBlock v) {
            int idx = index.size();
            index.put(v, idx);
            lowLink.put(v, idx);
            stack.add(v);
            onStack.add(v);

            if (v != cut) {
                for (BasicBlock w : v.getControl().targets) {
                    if (!region.contains(w)) continue;
                    if (!index.containsKey(w)) {
                        connect(w);
                        lowLink.put(v, Math.min(lowLink.get(v), lowLink.get(w)));
                    } else if (onStack.contains(w)) {
                        lowLink.put(v, Math.min(lowLink.get(v), index.get(w)));
                    }
                }
            }

            if (lowLink.get(v).equals(index.get(v))) {
                Set<BasicBlock> scc = new LinkedHashSet<>();
                BasicBlock w;
                do {
                    w = stack.remove(stack.size() - 1);
                    onStack.remove(w);
                    scc.add(w);
                } while (w != v);
                sccs.add(scc);
            }
        }
    }
}
