package io.github.eutro.rvsdg.test;

import io.github.eutro.rvsdg.cfg.BasicBlock;
import io.github.eutro.rvsdg.cfg.Control;
import io.github.eutro.rvsdg.cfg.Function;
import io.github.eutro.rvsdg.cfg.IRBuilder;
import io.github.eutro.rvsdg.cfg.MalformedCfgException;
import io.github.eutro.rvsdg.cfg.Program;
import io.github.eutro.rvsdg.cfg.Var;
import io.github.eutro.rvsdg.graph.RvsdgFunction;
import io.github.eutro.rvsdg.graph.RvsdgProgram;
import io.github.eutro.rvsdg.ops.CallTarget;
import io.github.eutro.rvsdg.ops.CfgOps;
import io.github.eutro.rvsdg.ops.Literal;
import io.github.eutro.rvsdg.ops.Type;
import io.github.eutro.rvsdg.ops.ValueOp;
import io.github.eutro.rvsdg.passes.Passes;
import io.github.eutro.rvsdg.passes.convert.ProgramToRvsdg;
import io.github.eutro.rvsdg.passes.meta.VerifyCfg;
import io.github.eutro.rvsdg.passes.misc.ChainedPass;
import io.github.eutro.rvsdg.passes.opts.EliminateDeadBlocks;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static io.github.eutro.rvsdg.test.Utils.convert;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PipelineTest {
    @Test
    void noReturnIsRejected() {
        MalformedCfgException e = assertThrows(MalformedCfgException.class, () -> convert(Samples.spin()));
        assertEquals("spin", e.function);
        assertTrue(e.getMessage().contains("no return"), e::getMessage);
    }

    @Test
    void failedPassIsNamed() {
        MalformedCfgException e = assertThrows(MalformedCfgException.class, () -> convert(Samples.spin()));
        boolean named = false;
        for (Throwable suppressed : e.getSuppressed()) {
            if (suppressed.getMessage().startsWith("running pass")) named = true;
        }
        assertTrue(named);
    }

    @Test
    void chainsFlatten() {
        assertInstanceOf(ChainedPass.class, Passes.TO_RVSDG);
        // verify, eliminate, normalize, loops, branches, convert
        assertEquals(6, ((ChainedPass<?, ?, ?>) Passes.TO_RVSDG).getPasses().size());
        assertFalse(Passes.TO_RVSDG.isInPlace());
        assertTrue(Passes.STRUCTURE.isInPlace());
    }

    @Test
    void badConditionType() {
        Function f = new Function("f", null);
        Var n = f.newParam("n", Type.INT);
        BasicBlock entry = f.newBb("entry");
        BasicBlock exit = f.newBb("exit");
        entry.setControl(Control.brIf(n, exit, exit));
        new IRBuilder(f, exit).ret(null);

        MalformedCfgException e = assertThrows(MalformedCfgException.class, () -> VerifyCfg.INSTANCE.run(f));
        assertSame(entry, e.block);
    }

    @Test
    void missingControl() {
        Function f = new Function("f", null);
        f.newBb("entry");
        assertThrows(MalformedCfgException.class, () -> VerifyCfg.INSTANCE.run(f));
    }

    @Test
    void wrongReturn() {
        Function f = new Function("f", Type.INT);
        new IRBuilder(f, f.newBb("entry")).ret(null);
        assertThrows(MalformedCfgException.class, () -> VerifyCfg.INSTANCE.run(f));
    }

    @Test
    void programRecordsFailures() {
        Program program = new Program();
        Function ok = program.newFunction("ok", null);
        IRBuilder ib = new IRBuilder(ok, ok.newBb("entry"));
        Var x = ib.constant(ok.newVar("x", Type.INT), Literal.ofInt(1));
        ib.call(null, "helper", x);
        ib.ret(null);

        Function helper = program.newFunction("helper", null);
        helper.newParam("a", Type.INT);
        new IRBuilder(helper, helper.newBb("entry")).ret(null);

        Function undeclared = program.newFunction("undeclared", null);
        ib = new IRBuilder(undeclared, undeclared.newBb("entry"));
        ib.call(null, "nowhere");
        ib.ret(null);

        Function arity = program.newFunction("arity", null);
        ib = new IRBuilder(arity, arity.newBb("entry"));
        ib.call(null, "helper");
        ib.ret(null);

        Function spin = Samples.spin();
        program.functions.add(spin);

        RvsdgProgram rvsdg = ProgramToRvsdg.INSTANCE.run(program);
        assertNotNull(rvsdg.getFunction("ok"));
        assertNotNull(rvsdg.getFunction("helper"));
        assertNull(rvsdg.getFunction("spin"));
        assertEquals(Arrays.asList("undeclared", "arity", "spin"), Arrays.asList(rvsdg.failures.keySet().toArray()));
        assertInstanceOf(MalformedCfgException.class, rvsdg.failures.get("undeclared"));
    }

    @Test
    void deadBlocksAreRemoved() {
        Function f = Samples.sub();
        BasicBlock dead = f.newBb("dead");
        dead.setControl(Control.br(f.blocks.get(0)));
        EliminateDeadBlocks.INSTANCE.run(f);
        assertFalse(f.blocks.contains(dead));

        RvsdgFunction rvsdg = convert(f);
        assertNotNull(rvsdg.result);
    }

    @Test
    void onlyEffectsTakeTheState() {
        Var x = new Function("f", null).newVar("x", Type.INT);
        assertTrue(CfgOps.isPure(CfgOps.constant(Literal.ofInt(1))));
        assertTrue(CfgOps.isPure(CfgOps.value(ValueOp.ADD, Type.INT, x, x)));
        assertFalse(CfgOps.isPure(CfgOps.CALL.create(new CallTarget("g", null)).insn(x)));
        assertFalse(CfgOps.isPure(CfgOps.PRINT.insn(x)));
    }
}
