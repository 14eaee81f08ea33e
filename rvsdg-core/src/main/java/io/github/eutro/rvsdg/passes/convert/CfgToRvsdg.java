package io.github.eutro.rvsdg.passes.convert;

import io.github.eutro.rvsdg.cfg.BasicBlock;
import io.github.eutro.rvsdg.cfg.Effect;
import io.github.eutro.rvsdg.cfg.Function;
import io.github.eutro.rvsdg.cfg.Insn;
import io.github.eutro.rvsdg.cfg.Var;
import io.github.eutro.rvsdg.ext.CommonExts;
import io.github.eutro.rvsdg.ext.MetadataState;
import io.github.eutro.rvsdg.graph.Operand;
import io.github.eutro.rvsdg.graph.RvsdgBuilder;
import io.github.eutro.rvsdg.graph.RvsdgFunction;
import io.github.eutro.rvsdg.graph.RvsdgNode;
import io.github.eutro.rvsdg.graph.RvsdgVerifier;
import io.github.eutro.rvsdg.graph.StateChain;
import io.github.eutro.rvsdg.ops.CallTarget;
import io.github.eutro.rvsdg.ops.CfgOps;
import io.github.eutro.rvsdg.ops.Literal;
import io.github.eutro.rvsdg.ops.Type;
import io.github.eutro.rvsdg.ops.TypedOp;
import io.github.eutro.rvsdg.ops.ValueOp;
import io.github.eutro.rvsdg.passes.IRPass;
import io.github.eutro.rvsdg.passes.form.ControlTree;
import io.github.eutro.rvsdg.passes.form.LoopInfo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts a function to an {@link RvsdgFunction}, by evaluating its {@link ControlTree} symbolically.
 * <p>
 * Each variable is mapped to the operand holding its current value, and copies only rename.
 * A branch or loop takes the state, followed by the variables live on entry to it, and produces
 * the state, followed by the variables live after it. Variables are always ordered by their first
 * appearance in the function. A variable live somewhere but never assigned on the way there is
 * given a zero constant, whose value is never observed.
 */
public class CfgToRvsdg implements IRPass<Function, RvsdgFunction> {
    /**
     * A singleton instance of this pass.
     */
    public static final CfgToRvsdg INSTANCE = new CfgToRvsdg();

    @Override
    public RvsdgFunction run(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.STRUCTURED, MetadataState.LIVE_DATA);

        Runner runner = new Runner(func);
        Env env = new Env(runner.builder, Operand.arg(func.getParams().size()));
        List<Var> params = func.getParams();
        for (int i = 0; i < params.size(); i++) {
            env.vars.put(params.get(i), Operand.arg(i));
        }
        runner.evalSeq(func.getExtOrThrow(CommonExts.CONTROL_TREE), env);

        Operand result = func.returnType == null ? null : env.get(func.getExtOrThrow(CommonExts.RETURN_VAR));
        RvsdgFunction rvsdg = runner.builder.build(func.name, params.size(), result, env.state);
        if (RvsdgVerifier.VERIFY) {
            RvsdgVerifier.verify(rvsdg);
        }
        return rvsdg;
    }

    private static final class Env {
        final RvsdgBuilder builder;
        final Map<Var, Operand> vars = new HashMap<>();
        Operand state;

        Env(RvsdgBuilder builder, Operand state) {
            this.builder = builder;
            this.state = state;
        }

        /**
         * The environment of a region whose inputs are the state, then the given variables.
         */
        static Env ofRegion(RvsdgBuilder builder, List<Var> inputs) {
            Env env = new Env(builder, Operand.arg(StateChain.STATE_SLOT));
            for (int i = 0; i < inputs.size(); i++) {
                env.vars.put(inputs.get(i), Operand.arg(i + 1));
            }
            return env;
        }

        Operand get(Var var) {
            Operand operand = vars.get(var);
            if (operand == null) {
                operand = builder.constant(Literal.zero(var.type));
                vars.put(var, operand);
            }
            return operand;
        }

        List<Operand> regionValues(List<Var> regionVars) {
            List<Operand> values = new ArrayList<>();
            values.add(state);
            for (Var var : regionVars) {
                values.add(get(var));
            }
            return values;
        }

        void bindOutputs(int node, List<Var> regionVars) {
            state = Operand.project(StateChain.STATE_SLOT, node);
            for (int i = 0; i < regionVars.size(); i++) {
                vars.put(regionVars.get(i), Operand.project(i + 1, node));
            }
        }
    }

    private static final class Runner {
        final RvsdgBuilder builder = new RvsdgBuilder();
        final Map<Var, Integer> varOrder = new HashMap<>();

        Runner(Function func) {
            for (BasicBlock block : func.blocks) {
                for (Effect effect : block.getEffects()) {
                    for (Var arg : effect.insn().args()) {
                        varOrder.putIfAbsent(arg, varOrder.size());
                    }
                    for (Var var : effect.getAssignsTo()) {
                        varOrder.putIfAbsent(var, varOrder.size());
                    }
                }
                for (Var arg : block.getControl().insn().args()) {
                    varOrder.putIfAbsent(arg, varOrder.size());
                }
            }
        }

        List<Var> ordered(Collection<Var> vars) {
            List<Var> list = new ArrayList<>(vars);
            list.sort((a, b) -> Integer.compare(
                    varOrder.getOrDefault(a, Integer.MAX_VALUE),
                    varOrder.getOrDefault(b, Integer.MAX_VALUE)));
            return list;
        }

        void evalSeq(ControlTree.Seq seq, Env env) {
            for (ControlTree element : seq.getElements()) {
                if (element instanceof ControlTree.Block) {
                    evalBlock(((ControlTree.Block) element).block, env);
                } else if (element instanceof ControlTree.Branch) {
                    evalBranch((ControlTree.Branch) element, env);
                } else {
                    evalLoop((ControlTree.Loop) element, env);
                }
            }
        }

        void evalBlock(BasicBlock block, Env env) {
            for (Effect effect : block.getEffects()) {
                Insn insn = effect.insn();
                List<Operand> args = new ArrayList<>();
                for (Var arg : insn.args()) {
                    args.add(env.get(arg));
                }
                if (!CfgOps.isPure(insn)) {
                    args.add(env.state);
                }

                if (insn.op.key == CfgOps.CONST) {
                    env.vars.put(effect.getAssignsTo().get(0), builder.constant(CfgOps.CONST.cast(insn.op).arg));
                } else if (insn.op.key == CfgOps.VALUE) {
                    TypedOp op = CfgOps.VALUE.cast(insn.op).arg;
                    Var dest = effect.getAssignsTo().get(0);
                    env.vars.put(dest, op.op == ValueOp.ID ? args.get(0) : builder.op(op.op, op.type, args));
                } else if (insn.op.key == CfgOps.CALL) {
                    CallTarget target = CfgOps.CALL.cast(insn.op).arg;
                    int node = builder.call(target.name, args, target.returnType);
                    if (target.returnType != null) {
                        env.vars.put(effect.getAssignsTo().get(0), Operand.project(0, node));
                    }
                    env.state = StateChain.stateOutput(node, ((RvsdgNode.BasicOp) builder.get(node)).expr);
                } else if (insn.op == CfgOps.PRINT) {
                    env.state = builder.print(args);
                } else {
                    throw new IllegalArgumentException("unknown effect: " + effect);
                }
            }
        }

        Set<Var> liveIn(BasicBlock block) {
            return block.getExtOrThrow(CommonExts.LIVE_DATA).liveIn;
        }

        void evalBranch(ControlTree.Branch branch, Env env) {
            Var predVar = branch.split.getControl().insn().args().get(0);
            Operand predicate = env.get(predVar);

            Set<Var> inVars = new LinkedHashSet<>();
            for (BasicBlock target : branch.split.getControl().targets) {
                inVars.addAll(liveIn(target));
            }
            inVars.addAll(liveIn(branch.cont));
            List<Var> inputs = ordered(inVars);
            List<Var> outputs = ordered(liveIn(branch.cont));

            List<Operand> inputValues = env.regionValues(inputs);
            List<List<Operand>> arms = new ArrayList<>();
            for (ControlTree.Seq arm : branch.arms) {
                Env armEnv = Env.ofRegion(builder, inputs);
                evalSeq(arm, armEnv);
                arms.add(armEnv.regionValues(outputs));
            }
            int node = builder.branch(predicate, inputValues, arms);
            env.bindOutputs(node, outputs);
        }

        void evalLoop(ControlTree.Loop loop, Env env) {
            LoopInfo info = loop.info;
            List<Var> carried = ordered(info.tail.getExtOrThrow(CommonExts.LIVE_DATA).liveOut);

            List<Operand> inputValues = env.regionValues(carried);
            Env bodyEnv = Env.ofRegion(builder, carried);
            evalSeq(loop.body, bodyEnv);

            Operand predicate = bodyEnv.get(info.tail.getControl().insn().args().get(0));
            if (info.repeatIndex == 0) {
                predicate = builder.op(ValueOp.NOT, Type.BOOL, predicate);
            }
            int node = builder.loop(predicate, inputValues, bodyEnv.regionValues(carried));
            env.bindOutputs(node, carried);
        }
    }
}
