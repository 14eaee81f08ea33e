package io.github.eutro.rvsdg.passes.meta;

import io.github.eutro.rvsdg.cfg.BasicBlock;
import io.github.eutro.rvsdg.cfg.Control;
import io.github.eutro.rvsdg.cfg.Effect;
import io.github.eutro.rvsdg.cfg.Function;
import io.github.eutro.rvsdg.cfg.Insn;
import io.github.eutro.rvsdg.cfg.MalformedCfgException;
import io.github.eutro.rvsdg.cfg.Program;
import io.github.eutro.rvsdg.cfg.Var;
import io.github.eutro.rvsdg.ext.CommonExts;
import io.github.eutro.rvsdg.ext.MetadataState;
import io.github.eutro.rvsdg.ops.CallTarget;
import io.github.eutro.rvsdg.ops.CfgOps;
import io.github.eutro.rvsdg.ops.Literal;
import io.github.eutro.rvsdg.ops.Type;
import io.github.eutro.rvsdg.ops.TypedOp;
import io.github.eutro.rvsdg.passes.InPlaceIRPass;
import org.jetbrains.annotations.Nullable;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks that a function is a well-formed control flow graph, throwing a
 * {@link MalformedCfgException} otherwise.
 * <p>
 * If constructed with the enclosing {@link Program}, calls are also checked against the
 * declaration of the function they call.
 */
public class VerifyCfg implements InPlaceIRPass<Function> {
    /**
     * An instance of this pass, which does not check calls.
     */
    public static final VerifyCfg INSTANCE = new VerifyCfg(null);

    @Nullable
    private final Program program;

    public VerifyCfg(@Nullable Program program) {
        this.program = program;
    }

    @Override
    public void runInPlace(Function func) {
        if (func.blocks.isEmpty()) {
            throw new MalformedCfgException(func, null, "function has no blocks");
        }
        Set<BasicBlock> blockSet = new HashSet<>(func.blocks);
        if (blockSet.size() != func.blocks.size()) {
            throw new MalformedCfgException(func, null, "function contains duplicate blocks");
        }

        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                verifyEffect(func, block, effect);
            }
            Control ctrl = block.getControl();
            if (ctrl == null) {
                throw new MalformedCfgException(func, block, "block has no control instruction");
            }
            verifyControl(func, block, ctrl);
            for (BasicBlock target : ctrl.targets) {
                if (!blockSet.contains(target)) {
                    throw new MalformedCfgException(func, block, String.format(
                            "instruction references block not in function" +
                                    "\n  referenced: %s" +
                                    "\n  instruction: %s",
                            target.toTargetString(),
                            ctrl));
                }
            }
        }

        func.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.VERIFIED);
    }

    private void verifyControl(Function func, BasicBlock block, Control ctrl) {
        Insn insn = ctrl.insn();
        List<Var> args = insn.args();
        int targets = ctrl.targets.size();
        if (insn.op == CfgOps.BR) {
            expect(func, block, ctrl, args.isEmpty() && targets == 1, "br takes no arguments and one target");
        } else if (insn.op == CfgOps.BR_IF) {
            expect(func, block, ctrl, args.size() == 1 && targets == 2, "br_if takes one argument and two targets");
            expect(func, block, ctrl, args.get(0).type == Type.BOOL, "br_if condition must be a bool");
        } else if (insn.op == CfgOps.SWITCH) {
            expect(func, block, ctrl, args.size() == 1 && targets >= 1, "switch takes one argument and at least one target");
            expect(func, block, ctrl, args.get(0).type == Type.INT, "switch discriminant must be an int");
        } else if (insn.op == CfgOps.RETURN) {
            expect(func, block, ctrl, targets == 0 && args.size() <= 1, "return takes at most one argument and no targets");
            if (func.returnType == null) {
                expect(func, block, ctrl, args.isEmpty(), "value returned from function returning nothing");
            } else {
                expect(func, block, ctrl, args.size() == 1, "no value returned from function returning " + func.returnType);
                expect(func, block, ctrl, args.get(0).type == func.returnType, "returned value has the wrong type");
            }
        } else {
            throw new MalformedCfgException(func, block, "not a control instruction: " + insn);
        }
    }

    private void verifyEffect(Function func, BasicBlock block, Effect effect) {
        Insn insn = effect.insn();
        List<Var> assigns = effect.getAssignsTo();
        if (insn.op.key == CfgOps.CONST) {
            Literal lit = CfgOps.CONST.cast(insn.op).arg;
            expect(func, block, effect, insn.args().isEmpty() && assigns.size() == 1, "const takes no arguments and assigns one variable");
            expect(func, block, effect, assigns.get(0).type == lit.type, "constant has the wrong type");
        } else if (insn.op.key == CfgOps.VALUE) {
            TypedOp op = CfgOps.VALUE.cast(insn.op).arg;
            expect(func, block, effect, insn.args().size() == op.op.arity, op.op + " takes " + op.op.arity + " argument(s)");
            expect(func, block, effect, assigns.size() == 1, "operation assigns one variable");
            expect(func, block, effect, assigns.get(0).type == op.type, "operation result has the wrong type");
        } else if (insn.op.key == CfgOps.CALL) {
            CallTarget target = CfgOps.CALL.cast(insn.op).arg;
            expect(func, block, effect, assigns.size() == (target.returnType == null ? 0 : 1),
                    "call must assign a variable iff it returns a value");
            if (program != null) verifyCall(func, block, effect, target);
        } else if (insn.op == CfgOps.PRINT) {
            expect(func, block, effect, assigns.isEmpty(), "print assigns no variables");
        } else {
            throw new MalformedCfgException(func, block, "not an effect instruction: " + insn);
        }
    }

    private void verifyCall(Function func, BasicBlock block, Effect effect, CallTarget target) {
        assert program != null;
        Function callee = program.getFunction(target.name);
        if (callee == null) {
            throw new MalformedCfgException(func, block, "call to undeclared function @" + target.name);
        }
        expect(func, block, effect, callee.getParams().size() == effect.insn().args().size(), String.format(
                "call passes %d argument(s) to @%s, which takes %d",
                effect.insn().args().size(),
                callee.name,
                callee.getParams().size()));
        expect(func, block, effect, callee.returnType == target.returnType, String.format(
                "call expects @%s to return %s, but it returns %s",
                callee.name,
                target.returnType == null ? "nothing" : target.returnType,
                callee.returnType == null ? "nothing" : callee.returnType));
    }

    private static void expect(Function func, BasicBlock block, Object insn, boolean cond, String message) {
        if (!cond) {
            throw new MalformedCfgException(func, block, message + "\n  instruction: " + insn);
        }
    }
}
