package io.github.eutro.rvsdg.test;

import io.github.eutro.rvsdg.cfg.BasicBlock;
import io.github.eutro.rvsdg.cfg.Control;
import io.github.eutro.rvsdg.cfg.Function;
import io.github.eutro.rvsdg.cfg.IRBuilder;
import io.github.eutro.rvsdg.cfg.Var;
import io.github.eutro.rvsdg.ops.Literal;
import io.github.eutro.rvsdg.ops.ValueOp;

import java.util.Arrays;

import static io.github.eutro.rvsdg.ops.Type.BOOL;
import static io.github.eutro.rvsdg.ops.Type.INT;

/**
 * Control flow graphs used across tests. Each call builds a fresh function.
 */
public class Samples {
    private static Var constant(IRBuilder ib, String name, long value) {
        return ib.constant(ib.func.newVar(name, INT), Literal.ofInt(value));
    }

    /**
     * <pre>
     * &#64;sub(): int { v0 = 1; v1 = 2; v2 = add v0 v1; ret v2 }
     * </pre>
     */
    public static Function sub() {
        Function f = new Function("sub", INT);
        IRBuilder ib = new IRBuilder(f, f.newBb("entry"));
        Var v0 = constant(ib, "v0", 1);
        Var v1 = constant(ib, "v1", 2);
        Var v2 = ib.op(f.newVar("v2", INT), ValueOp.ADD, v0, v1);
        ib.ret(v2);
        return f;
    }

    /**
     * <pre>
     * &#64;main() { v0 = 1; v1 = 2; v2 = add v0 v1; print v2; print v1; ret }
     * </pre>
     */
    public static Function printChain() {
        Function f = new Function("main", null);
        IRBuilder ib = new IRBuilder(f, f.newBb("entry"));
        Var v0 = constant(ib, "v0", 1);
        Var v1 = constant(ib, "v1", 2);
        Var v2 = ib.op(f.newVar("v2", INT), ValueOp.ADD, v0, v1);
        ib.print(v2);
        ib.print(v1);
        ib.ret(null);
        return f;
    }

    /**
     * <pre>
     * &#64;main() {
     *   c = true; br c .B .C
     *   .B: call @some_func; jmp .end
     *   .C: call @other_func; jmp .end
     *   .end: ret
     * }
     * </pre>
     */
    public static Function stateGamma() {
        Function f = new Function("main", null);
        BasicBlock entry = f.newBb("entry");
        BasicBlock b = f.newBb("B");
        BasicBlock c = f.newBb("C");
        BasicBlock end = f.newBb("end");
        IRBuilder ib = new IRBuilder(f, entry);
        Var cond = ib.constant(f.newVar("c", BOOL), Literal.ofBool(true));
        ib.insertCtrl(Control.brIf(cond, b, c));
        ib.setBlock(b);
        ib.call(null, "some_func");
        ib.insertCtrl(Control.br(end));
        ib.setBlock(c);
        ib.call(null, "other_func");
        ib.insertCtrl(Control.br(end));
        ib.setBlock(end);
        ib.ret(null);
        return f;
    }

    /**
     * <pre>
     * &#64;main(n: int): int {
     *   res = 0; i = 0; jmp .loop
     *   .loop: one = 1; res = add res i; i = add i one; loop_cond = lt i n; br loop_cond .loop .tail
     *   .tail: five = 5; cond = lt res five; br cond .rescale .exit
     *   .rescale: two = 2; res = mul res two; jmp .exit
     *   .exit: ret res
     * }
     * </pre>
     */
    public static Function oddBranch() {
        Function f = new Function("main", INT);
        Var n = f.newParam("n", INT);
        BasicBlock entry = f.newBb("entry");
        BasicBlock loop = f.newBb("loop");
        BasicBlock tail = f.newBb("tail");
        BasicBlock rescale = f.newBb("rescale");
        BasicBlock exit = f.newBb("exit");
        IRBuilder ib = new IRBuilder(f, entry);
        Var res = constant(ib, "res", 0);
        Var i = ib.constant(f.newVar("i", INT), Literal.ofInt(0));
        ib.insertCtrl(Control.br(loop));

        ib.setBlock(loop);
        Var one = constant(ib, "one", 1);
        ib.op(res, ValueOp.ADD, res, i);
        ib.op(i, ValueOp.ADD, i, one);
        Var loopCond = ib.op(f.newVar("loop_cond", BOOL), ValueOp.LT, i, n);
        ib.insertCtrl(Control.brIf(loopCond, loop, tail));

        ib.setBlock(tail);
        Var five = constant(ib, "five", 5);
        Var cond = ib.op(f.newVar("cond", BOOL), ValueOp.LT, res, five);
        ib.insertCtrl(Control.brIf(cond, rescale, exit));

        ib.setBlock(rescale);
        Var two = constant(ib, "two", 2);
        ib.op(res, ValueOp.MUL, res, two);
        ib.insertCtrl(Control.br(exit));

        ib.setBlock(exit);
        ib.ret(res);
        return f;
    }

    /**
     * A loop entered at two blocks.
     * <pre>
     * &#64;f(a_cond: bool, b_cond: bool, x: int): int {
     *   br a_cond .B .C
     *   .B: br b_cond .C .D
     *   .C: jmp .B
     *   .D: ret x
     * }
     * </pre>
     */
    public static Function unstructured() {
        Function f = new Function("f", INT);
        Var aCond = f.newParam("a_cond", BOOL);
        Var bCond = f.newParam("b_cond", BOOL);
        Var x = f.newParam("x", INT);
        BasicBlock entry = f.newBb("entry");
        BasicBlock b = f.newBb("B");
        BasicBlock c = f.newBb("C");
        BasicBlock d = f.newBb("D");
        entry.setControl(Control.brIf(aCond, b, c));
        b.setControl(Control.brIf(bCond, c, d));
        c.setControl(Control.br(b));
        new IRBuilder(f, d).ret(x);
        return f;
    }

    /**
     * A counting loop entered at two blocks, which prints as it goes.
     * <pre>
     * &#64;f(a: bool, n: int): int {
     *   i = 0; one = 1; br a .A .B
     *   .A: print i; i = add i one; jmp .B
     *   .B: c = lt i n; br c .A .done
     *   .done: ret i
     * }
     * </pre>
     */
    public static Function irreducibleCounter() {
        Function f = new Function("f", INT);
        Var a = f.newParam("a", BOOL);
        Var n = f.newParam("n", INT);
        BasicBlock entry = f.newBb("entry");
        BasicBlock blockA = f.newBb("A");
        BasicBlock blockB = f.newBb("B");
        BasicBlock done = f.newBb("done");
        IRBuilder ib = new IRBuilder(f, entry);
        Var i = constant(ib, "i", 0);
        Var one = constant(ib, "one", 1);
        ib.insertCtrl(Control.brIf(a, blockA, blockB));

        ib.setBlock(blockA);
        ib.print(i);
        ib.op(i, ValueOp.ADD, i, one);
        ib.insertCtrl(Control.br(blockB));

        ib.setBlock(blockB);
        Var c = ib.op(f.newVar("c", BOOL), ValueOp.LT, i, n);
        ib.insertCtrl(Control.brIf(c, blockA, done));

        ib.setBlock(done);
        ib.ret(i);
        return f;
    }

    /**
     * A head-controlled loop.
     * <pre>
     * &#64;f(n: int): int {
     *   i = 0; one = 1; jmp .head
     *   .head: c = lt i n; br c .body .done
     *   .body: print i; i = add i one; jmp .head
     *   .done: ret i
     * }
     * </pre>
     */
    public static Function whileLoop() {
        Function f = new Function("f", INT);
        Var n = f.newParam("n", INT);
        BasicBlock entry = f.newBb("entry");
        BasicBlock head = f.newBb("head");
        BasicBlock body = f.newBb("body");
        BasicBlock done = f.newBb("done");
        IRBuilder ib = new IRBuilder(f, entry);
        Var i = constant(ib, "i", 0);
        Var one = constant(ib, "one", 1);
        ib.insertCtrl(Control.br(head));

        ib.setBlock(head);
        Var c = ib.op(f.newVar("c", BOOL), ValueOp.LT, i, n);
        ib.insertCtrl(Control.brIf(c, body, done));

        ib.setBlock(body);
        ib.print(i);
        ib.op(i, ValueOp.ADD, i, one);
        ib.insertCtrl(Control.br(head));

        ib.setBlock(done);
        ib.ret(i);
        return f;
    }

    /**
     * A loop with two exits.
     * <pre>
     * &#64;f(n: int): int {
     *   i = 0; one = 1; five = 5; jmp .head
     *   .head: i = add i one; c1 = lt i n; br c1 .body .exitA
     *   .body: c2 = eq i five; br c2 .exitB .head
     *   .exitA: ret i
     *   .exitB: r = 100; ret r
     * }
     * </pre>
     */
    public static Function multiExit() {
        Function f = new Function("f", INT);
        Var n = f.newParam("n", INT);
        BasicBlock entry = f.newBb("entry");
        BasicBlock head = f.newBb("head");
        BasicBlock body = f.newBb("body");
        BasicBlock exitA = f.newBb("exitA");
        BasicBlock exitB = f.newBb("exitB");
        IRBuilder ib = new IRBuilder(f, entry);
        Var i = constant(ib, "i", 0);
        Var one = constant(ib, "one", 1);
        Var five = constant(ib, "five", 5);
        ib.insertCtrl(Control.br(head));

        ib.setBlock(head);
        ib.op(i, ValueOp.ADD, i, one);
        Var c1 = ib.op(f.newVar("c1", BOOL), ValueOp.LT, i, n);
        ib.insertCtrl(Control.brIf(c1, body, exitA));

        ib.setBlock(body);
        Var c2 = ib.op(f.newVar("c2", BOOL), ValueOp.EQ, i, five);
        ib.insertCtrl(Control.brIf(c2, exitB, head));

        ib.setBlock(exitA);
        ib.ret(i);

        ib.setBlock(exitB);
        ib.ret(constant(ib, "r", 100));
        return f;
    }

    /**
     * A switch, one of whose cases falls into another.
     * <pre>
     * &#64;f(k: int): int {
     *   switch k [.c0 .c1 .c2]
     *   .c0: r = 10; jmp .join
     *   .c1: r = 20; print r; jmp .join
     *   .c2: print k; jmp .c0
     *   .join: ret r
     * }
     * </pre>
     */
    public static Function switchFallthrough() {
        Function f = new Function("f", INT);
        Var k = f.newParam("k", INT);
        BasicBlock entry = f.newBb("entry");
        BasicBlock c0 = f.newBb("c0");
        BasicBlock c1 = f.newBb("c1");
        BasicBlock c2 = f.newBb("c2");
        BasicBlock join = f.newBb("join");
        entry.setControl(Control.switchOn(k, Arrays.asList(c0, c1, c2)));
        Var r = f.newVar("r", INT);

        IRBuilder ib = new IRBuilder(f, c0);
        ib.constant(r, Literal.ofInt(10));
        ib.insertCtrl(Control.br(join));

        ib.setBlock(c1);
        ib.constant(r, Literal.ofInt(20));
        ib.print(r);
        ib.insertCtrl(Control.br(join));

        ib.setBlock(c2);
        ib.print(k);
        ib.insertCtrl(Control.br(c0));

        ib.setBlock(join);
        ib.ret(r);
        return f;
    }

    /**
     * <pre>
     * &#64;f(n: int): int {
     *   i = 0; s = 0; one = 1; jmp .outer
     *   .outer: j = 0; jmp .inner
     *   .inner: t = mul i j; s = add s t; j = add j one; c = lt j n; br c .inner .outerTail
     *   .outerTail: i = add i one; d = lt i n; br d .outer .done
     *   .done: ret s
     * }
     * </pre>
     */
    public static Function nestedLoops() {
        Function f = new Function("f", INT);
        Var n = f.newParam("n", INT);
        BasicBlock entry = f.newBb("entry");
        BasicBlock outer = f.newBb("outer");
        BasicBlock inner = f.newBb("inner");
        BasicBlock outerTail = f.newBb("outerTail");
        BasicBlock done = f.newBb("done");
        IRBuilder ib = new IRBuilder(f, entry);
        Var i = constant(ib, "i", 0);
        Var s = constant(ib, "s", 0);
        Var one = constant(ib, "one", 1);
        ib.insertCtrl(Control.br(outer));

        ib.setBlock(outer);
        Var j = constant(ib, "j", 0);
        ib.insertCtrl(Control.br(inner));

        ib.setBlock(inner);
        Var t = ib.op(f.newVar("t", INT), ValueOp.MUL, i, j);
        ib.op(s, ValueOp.ADD, s, t);
        ib.op(j, ValueOp.ADD, j, one);
        Var c = ib.op(f.newVar("c", BOOL), ValueOp.LT, j, n);
        ib.insertCtrl(Control.brIf(c, inner, outerTail));

        ib.setBlock(outerTail);
        ib.op(i, ValueOp.ADD, i, one);
        Var d = ib.op(f.newVar("d", BOOL), ValueOp.LT, i, n);
        ib.insertCtrl(Control.brIf(d, outer, done));

        ib.setBlock(done);
        ib.ret(s);
        return f;
    }

    /**
     * <pre>
     * &#64;spin() { .entry: jmp .entry }
     * </pre>
     */
    public static Function spin() {
        Function f = new Function("spin", null);
        BasicBlock entry = f.newBb("entry");
        entry.setControl(Control.br(entry));
        return f;
    }
}
