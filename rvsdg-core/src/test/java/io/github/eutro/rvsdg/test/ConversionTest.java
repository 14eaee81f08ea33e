package io.github.eutro.rvsdg.test;

import io.github.eutro.rvsdg.cfg.Function;
import io.github.eutro.rvsdg.cfg.IRBuilder;
import io.github.eutro.rvsdg.cfg.Var;
import io.github.eutro.rvsdg.graph.Operand;
import io.github.eutro.rvsdg.graph.RvsdgBuilder;
import io.github.eutro.rvsdg.graph.RvsdgFunction;
import io.github.eutro.rvsdg.graph.StateChain;
import io.github.eutro.rvsdg.ops.Literal;
import io.github.eutro.rvsdg.ops.Type;
import io.github.eutro.rvsdg.ops.ValueOp;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.rvsdg.graph.Operand.arg;
import static io.github.eutro.rvsdg.graph.Operand.id;
import static io.github.eutro.rvsdg.graph.Operand.project;
import static io.github.eutro.rvsdg.test.Utils.args;
import static io.github.eutro.rvsdg.test.Utils.assertGraphEquals;
import static io.github.eutro.rvsdg.test.Utils.convert;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class ConversionTest {
    @Test
    void straightLine() {
        RvsdgBuilder e = new RvsdgBuilder();
        Operand one = e.constant(Literal.ofInt(1));
        Operand two = e.constant(Literal.ofInt(2));
        Operand sum = e.op(ValueOp.ADD, Type.INT, one, two);
        // no arguments, so the state enters as Arg(0)
        RvsdgFunction expected = e.build("sub", 0, sum, arg(0));

        assertGraphEquals(expected, convert(Samples.sub()));
    }

    @Test
    void printsAreChained() {
        RvsdgBuilder e = new RvsdgBuilder();
        Operand v0 = e.constant(Literal.ofInt(1));
        Operand v1 = e.constant(Literal.ofInt(2));
        Operand v2 = e.op(ValueOp.ADD, Type.INT, v0, v1);
        Operand first = e.print(Arrays.asList(v2, arg(0)));
        Operand second = e.print(Arrays.asList(v1, first));
        RvsdgFunction expected = e.build("main", 0, null, second);

        RvsdgFunction actual = convert(Samples.printChain());
        assertGraphEquals(expected, actual);
        assertNull(actual.result);
        assertEquals(2, StateChain.trace(actual).size());
        assertEquals(Arrays.asList("3", "2"), Interpreters.runRvsdg(actual).log);
    }

    @Test
    void branchThreadsState() {
        RvsdgBuilder e = new RvsdgBuilder();
        Operand c = e.constant(Literal.ofBool(true));
        int other = e.call("other_func", Collections.singletonList(arg(0)), null);
        int some = e.call("some_func", Collections.singletonList(arg(0)), null);
        List<List<Operand>> arms = Arrays.asList(
                Collections.singletonList(id(other)),
                Collections.singletonList(id(some)));
        int gamma = e.branch(c, Collections.singletonList(arg(0)), arms);
        RvsdgFunction expected = e.build("main", 0, null, project(0, gamma));

        assertGraphEquals(expected, convert(Samples.stateGamma()));
    }

    @Test
    void loopThenBranch() {
        RvsdgBuilder e = new RvsdgBuilder();
        Operand zeroRes = e.constant(Literal.ofInt(0));
        Operand zeroI = e.constant(Literal.ofInt(0));
        Operand one = e.constant(Literal.ofInt(1));
        Operand res = e.op(ValueOp.ADD, Type.INT, arg(1), arg(2));
        Operand i = e.op(ValueOp.ADD, Type.INT, arg(2), one);
        Operand loopCond = e.op(ValueOp.LT, Type.BOOL, i, arg(3));
        int theta = e.loop(loopCond,
                Arrays.asList(arg(1), zeroRes, zeroI, arg(0)),
                Arrays.asList(arg(0), res, i, arg(3)));
        Operand five = e.constant(Literal.ofInt(5));
        Operand cond = e.op(ValueOp.LT, Type.BOOL, project(1, theta), five);
        Operand two = e.constant(Literal.ofInt(2));
        Operand doubled = e.op(ValueOp.MUL, Type.INT, arg(1), two);
        int gamma = e.branch(cond,
                Arrays.asList(project(0, theta), project(1, theta)),
                Arrays.asList(Arrays.asList(arg(0), arg(1)), Arrays.asList(arg(0), doubled)));
        RvsdgFunction expected = e.build("main", 1, project(1, gamma), project(0, gamma));

        assertGraphEquals(expected, convert(Samples.oddBranch()));
    }

    @Test
    void loopThenBranchBehaves() {
        Utils.assertPreserved(Samples.oddBranch(),
                args(0L), args(1L), args(2L), args(3L), args(4L), args(7L));
    }

    @Test
    void callResultIsFirstOutput() {
        Function f = new Function("caller", Type.INT);
        IRBuilder ib = new IRBuilder(f, f.newBb("entry"));
        Var x = f.newParam("x", Type.INT);
        Var r = f.newVar("r", Type.INT);
        ib.call(r, "callee", x);
        ib.print(r);
        ib.ret(r);

        RvsdgBuilder e = new RvsdgBuilder();
        int call = e.call("callee", Arrays.asList(arg(0), arg(1)), Type.INT);
        Operand printed = e.print(Arrays.asList(project(0, call), project(1, call)));
        RvsdgFunction expected = e.build("caller", 1, project(0, call), printed);

        RvsdgFunction actual = convert(f);
        assertGraphEquals(expected, actual);
        assertEquals(Arrays.asList("call callee 4", "0"), Interpreters.runRvsdg(actual, 4L).log);
    }
}
