package io.github.eutro.rvsdg.test;

import io.github.eutro.rvsdg.graph.Expr;
import io.github.eutro.rvsdg.graph.Operand;
import io.github.eutro.rvsdg.graph.RvsdgBuilder;
import io.github.eutro.rvsdg.graph.RvsdgFunction;
import io.github.eutro.rvsdg.graph.RvsdgNode;
import io.github.eutro.rvsdg.graph.RvsdgVerifier;
import io.github.eutro.rvsdg.graph.StateChain;
import io.github.eutro.rvsdg.graph.StructuralEquality;
import io.github.eutro.rvsdg.ops.ConstOp;
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
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GraphTest {
    @Test
    void idIsFirstProjection() {
        RvsdgBuilder b1 = new RvsdgBuilder();
        Operand k1 = b1.constant(Literal.ofInt(3));
        RvsdgFunction f1 = b1.build("f", 0, b1.op(ValueOp.ADD, Type.INT, k1, k1), arg(0));

        RvsdgBuilder b2 = new RvsdgBuilder();
        int k2 = b2.add(new RvsdgNode.BasicOp(new Expr.Const(ConstOp.CONST, Literal.ofInt(3), Type.INT)));
        RvsdgFunction f2 = b2.build("g", 0, b2.op(ValueOp.ADD, Type.INT, project(0, k2), id(k2)), arg(0));

        assertTrue(StructuralEquality.equal(f1, f2));
    }

    @Test
    void arenaOrderIsIgnored() {
        RvsdgBuilder b1 = new RvsdgBuilder();
        Operand x1 = b1.constant(Literal.ofInt(1));
        Operand y1 = b1.constant(Literal.ofInt(2));
        RvsdgFunction f1 = b1.build("f", 0, b1.op(ValueOp.SUB, Type.INT, x1, y1), arg(0));

        RvsdgBuilder b2 = new RvsdgBuilder();
        Operand y2 = b2.constant(Literal.ofInt(2));
        Operand x2 = b2.constant(Literal.ofInt(1));
        RvsdgFunction f2 = b2.build("f", 0, b2.op(ValueOp.SUB, Type.INT, x2, y2), arg(0));

        assertTrue(StructuralEquality.equal(f1, f2));

        RvsdgBuilder b3 = new RvsdgBuilder();
        Operand x3 = b3.constant(Literal.ofInt(1));
        Operand y3 = b3.constant(Literal.ofInt(2));
        RvsdgFunction f3 = b3.build("f", 0, b3.op(ValueOp.SUB, Type.INT, y3, x3), arg(0));

        assertFalse(StructuralEquality.equal(f1, f3));
    }

    @Test
    void constantsCompareByTypeAndValue() {
        RvsdgBuilder b1 = new RvsdgBuilder();
        RvsdgFunction f1 = b1.build("f", 0, b1.constant(Literal.ofInt(0)), arg(0));
        RvsdgBuilder b2 = new RvsdgBuilder();
        RvsdgFunction f2 = b2.build("f", 0, b2.constant(Literal.ofBool(false)), arg(0));
        assertFalse(StructuralEquality.equal(f1, f2));
    }

    @Test
    void wellFormedPasses() {
        RvsdgBuilder b = new RvsdgBuilder();
        Operand p = b.print(Arrays.asList(arg(0), arg(1)));
        int theta = b.loop(b.constant(Literal.ofBool(false)),
                Arrays.asList(p, arg(0)),
                Arrays.asList(b.print(Arrays.asList(arg(1), arg(0))), arg(1)));
        RvsdgFunction f = b.build("f", 1, project(1, theta), project(0, theta));
        assertDoesNotThrow(() -> RvsdgVerifier.verify(f));
        assertEquals(Arrays.asList(0, 3), StateChain.trace(f));
    }

    @Test
    void forwardReference() {
        RvsdgBuilder b = new RvsdgBuilder();
        b.op(ValueOp.ADD, Type.INT, id(1), id(1));
        b.constant(Literal.ofInt(1));
        RvsdgFunction f = b.build("f", 0, id(0), arg(0));
        assertThrows(IllegalStateException.class, () -> RvsdgVerifier.verify(f));
    }

    @Test
    void wrongArity() {
        RvsdgBuilder b = new RvsdgBuilder();
        Operand k = b.constant(Literal.ofInt(1));
        RvsdgFunction f = b.build("f", 0, b.op(ValueOp.NOT, Type.BOOL, k, k), arg(0));
        assertThrows(IllegalStateException.class, () -> RvsdgVerifier.verify(f));
    }

    @Test
    void argumentOutOfRange() {
        RvsdgBuilder b = new RvsdgBuilder();
        RvsdgFunction f = b.build("f", 1, arg(2), arg(1));
        assertThrows(IllegalStateException.class, () -> RvsdgVerifier.verify(f));
    }

    @Test
    void armsDisagree() {
        RvsdgBuilder b = new RvsdgBuilder();
        Operand c = b.constant(Literal.ofBool(true));
        List<List<Operand>> arms = Arrays.asList(
                Collections.singletonList(arg(0)),
                Arrays.asList(arg(0), arg(0)));
        int gamma = b.branch(c, Collections.singletonList(arg(0)), arms);
        RvsdgFunction f = b.build("f", 0, null, project(0, gamma));
        assertThrows(IllegalStateException.class, () -> RvsdgVerifier.verify(f));
    }

    @Test
    void stateMustBeThreaded() {
        RvsdgBuilder b = new RvsdgBuilder();
        // prints with the argument instead of the state
        Operand p = b.print(Arrays.asList(arg(1), arg(0)));
        RvsdgFunction f = b.build("f", 1, null, p);
        assertThrows(IllegalStateException.class, () -> RvsdgVerifier.verify(f));
        assertThrows(IllegalStateException.class, () -> StateChain.trace(f));
    }

    @Test
    void stateFromValueOutput() {
        RvsdgBuilder b = new RvsdgBuilder();
        int call = b.call("f", Collections.singletonList(arg(0)), Type.INT);
        RvsdgFunction f = b.build("g", 0, null, project(0, call));
        assertThrows(IllegalStateException.class, () -> RvsdgVerifier.verify(f));
    }
}
