package io.github.eutro.rvsdg.graph;

import io.github.eutro.rvsdg.ops.ConstOp;
import io.github.eutro.rvsdg.ops.Literal;
import io.github.eutro.rvsdg.ops.Type;
import io.github.eutro.rvsdg.ops.ValueOp;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Appends nodes to the arena of a function under construction.
 */
public class RvsdgBuilder {
    private final List<RvsdgNode> nodes = new ArrayList<>();

    /**
     * Append a node to the arena.
     *
     * @param node The node.
     * @return Its index.
     */
    public int add(RvsdgNode node) {
        nodes.add(node);
        return nodes.size() - 1;
    }

    /**
     * Get the number of nodes in the arena so far.
     *
     * @return The number of nodes.
     */
    public int size() {
        return nodes.size();
    }

    /**
     * Get a node that was added.
     *
     * @param index The index of the node.
     * @return The node.
     */
    public RvsdgNode get(int index) {
        return nodes.get(index);
    }

    public Operand constant(Literal literal) {
        return Operand.id(add(new RvsdgNode.BasicOp(new Expr.Const(ConstOp.CONST, literal, literal.type))));
    }

    public Operand op(ValueOp op, Type type, Operand... args) {
        return op(op, type, Arrays.asList(args));
    }

    public Operand op(ValueOp op, Type type, List<Operand> args) {
        return Operand.id(add(new RvsdgNode.BasicOp(new Expr.Op(op, args, type))));
    }

    /**
     * Add a call node.
     *
     * @param target     The name of the called function.
     * @param args       The arguments, the last of which is the state.
     * @param returnType The type of the returned value, or null if there is none.
     * @return The index of the node.
     */
    public int call(String target, List<Operand> args, @Nullable Type returnType) {
        return add(new RvsdgNode.BasicOp(new Expr.Call(target, args, returnType == null ? 1 : 2, returnType)));
    }

    /**
     * Add a print node.
     *
     * @param args The printed values, followed by the state.
     * @return The new state.
     */
    public Operand print(List<Operand> args) {
        return Operand.id(add(new RvsdgNode.BasicOp(new Expr.Print(args))));
    }

    public int branch(Operand predicate, List<Operand> inputs, List<List<Operand>> arms) {
        return add(new RvsdgNode.Branch(predicate, inputs, arms));
    }

    public int loop(Operand predicate, List<Operand> inputs, List<Operand> outputs) {
        return add(new RvsdgNode.Loop(predicate, inputs, outputs));
    }

    /**
     * Finish the function.
     *
     * @param name   The name of the function.
     * @param nArgs  The number of arguments, excluding the state.
     * @param result The returned value, or null if it returns nothing.
     * @param state  The final state.
     * @return The function.
     */
    public RvsdgFunction build(String name, int nArgs, @Nullable Operand result, Operand state) {
        return new RvsdgFunction(name, nArgs, nodes, result, state);
    }
}
