package io.github.eutro.rvsdg.term;

import io.github.eutro.rvsdg.graph.Expr;
import io.github.eutro.rvsdg.graph.Operand;
import io.github.eutro.rvsdg.graph.RvsdgBuilder;
import io.github.eutro.rvsdg.graph.RvsdgFunction;
import io.github.eutro.rvsdg.graph.RvsdgNode;
import io.github.eutro.rvsdg.ops.ConstOp;
import io.github.eutro.rvsdg.ops.Literal;
import io.github.eutro.rvsdg.ops.Type;
import io.github.eutro.rvsdg.ops.ValueOp;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts {@link RvsdgFunction}s to and from {@link Term}s.
 * <p>
 * The grammar is:
 * <pre>
 * operand ::= (Arg i) | (Project k node) | node
 * node    ::= (Node (PureOp (Const type (const) literal)))
 *           | (Node (PureOp (op type operand...)))
 *           | (Node (Call "name" (vec-of operand...) outputs [type]))
 *           | (Node (Print (vec-of operand...)))
 *           | (Node (Gamma operand (vec-of operand...) (vec-of (VO (vec-of operand...))...)))
 *           | (Node (Theta operand (vec-of operand...) (vec-of operand...)))
 * type    ::= (IntT) | (BoolT) | (FloatT)
 * literal ::= (Num i) | (Bool true) | (Bool false) | (Float x)
 * </pre>
 * A bare node operand is its only output.
 */
public final class TermCodec {
    private TermCodec() {
    }

    /**
     * Encode the roots of a function as terms.
     *
     * @param func The function.
     * @return The terms of its state and result.
     */
    public static TermResult toTerm(RvsdgFunction func) {
        Encoder encoder = new Encoder(func);
        Term state = encoder.operand(func.state);
        return func.result == null
                ? TermResult.stateOnly(state)
                : TermResult.stateAndValue(state, encoder.operand(func.result));
    }

    /**
     * Decode a function from the terms of its roots.
     *
     * @param result The terms.
     * @param nArgs  The number of arguments of the function, excluding the state.
     * @return The function.
     * @throws TermFormatException If the terms do not follow the grammar.
     */
    public static RvsdgFunction fromTerm(TermResult result, int nArgs) {
        return fromTerm("anonymous", result, nArgs);
    }

    public static RvsdgFunction fromTerm(String name, TermResult result, int nArgs) {
        Decoder decoder = new Decoder();
        Operand state = decoder.operand(result.state);
        @Nullable Term valueTerm = result.value();
        @Nullable Operand value = valueTerm == null ? null : decoder.operand(valueTerm);
        return decoder.builder.build(name, nArgs, value, state);
    }

    static Term encodeType(Type type) {
        switch (type) {
            case INT:
                return Term.app("IntT");
            case BOOL:
                return Term.app("BoolT");
            case FLOAT:
                return Term.app("FloatT");
            default:
                throw new IllegalArgumentException(type.toString());
        }
    }

    static Term encodeLiteral(Literal literal) {
        switch (literal.type) {
            case INT:
                return Term.app("Num", Term.num(literal.asInt()));
            case BOOL:
                return Term.app("Bool", Term.sym(Boolean.toString(literal.asBool())));
            case FLOAT:
                return Term.app("Float", Term.flt(literal.asFloat()));
            default:
                throw new IllegalArgumentException(literal.type.toString());
        }
    }

    private static class Encoder {
        private final RvsdgFunction func;
        private final Map<Integer, Term> nodeTerms = new HashMap<>();

        Encoder(RvsdgFunction func) {
            this.func = func;
        }

        Term operand(Operand operand) {
            if (operand instanceof Operand.Arg) {
                return Term.app("Arg", Term.num(((Operand.Arg) operand).index));
            } else if (operand instanceof Operand.Id) {
                return node(((Operand.Id) operand).node);
            } else {
                Operand.Project project = (Operand.Project) operand;
                return Term.app("Project", Term.num(project.output), node(project.node));
            }
        }

        Term vec(List<Operand> operands) {
            List<Term> terms = new ArrayList<>();
            for (Operand operand : operands) {
                terms.add(operand(operand));
            }
            return Term.app("vec-of", terms);
        }

        Term node(int index) {
            Term term = nodeTerms.get(index);
            if (term != null) return term;
            RvsdgNode node = func.node(index);
            Term body;
            if (node instanceof RvsdgNode.BasicOp) {
                body = expr(((RvsdgNode.BasicOp) node).expr);
            } else if (node instanceof RvsdgNode.Branch) {
                RvsdgNode.Branch branch = (RvsdgNode.Branch) node;
                List<Term> arms = new ArrayList<>();
                for (List<Operand> arm : branch.arms) {
                    arms.add(Term.app("VO", vec(arm)));
                }
                body = Term.app("Gamma", operand(branch.predicate), vec(branch.inputs), Term.app("vec-of", arms));
            } else {
                RvsdgNode.Loop loop = (RvsdgNode.Loop) node;
                body = Term.app("Theta", operand(loop.predicate), vec(loop.inputs), vec(loop.outputs));
            }
            term = Term.app("Node", body);
            nodeTerms.put(index, term);
            return term;
        }

        Term expr(Expr expr) {
            if (expr instanceof Expr.Const) {
                Expr.Const c = (Expr.Const) expr;
                return Term.app("PureOp", Term.app("Const",
                        encodeType(c.type),
                        Term.app(c.op.mnemonic),
                        encodeLiteral(c.literal)));
            } else if (expr instanceof Expr.Op) {
                Expr.Op op = (Expr.Op) expr;
                List<Term> args = new ArrayList<>();
                args.add(encodeType(op.type));
                for (Operand arg : op.args) {
                    args.add(operand(arg));
                }
                return Term.app("PureOp", Term.app(op.op.mnemonic, args));
            } else if (expr instanceof Expr.Call) {
                Expr.Call call = (Expr.Call) expr;
                Term target = Term.str(call.target);
                Term outputs = Term.num(call.outputs);
                return call.returnType == null
                        ? Term.app("Call", target, vec(call.args), outputs)
                        : Term.app("Call", target, vec(call.args), outputs, encodeType(call.returnType));
            } else {
                return Term.app("Print", vec(((Expr.Print) expr).args));
            }
        }
    }

    private static class Decoder {
        final RvsdgBuilder builder = new RvsdgBuilder();
        private final Map<Term, Integer> nodeIndices = new HashMap<>();

        Operand operand(Term term) {
            Term.App app = app(term, "an operand");
            switch (app.head) {
                case "Arg":
                    arity(app, 1);
                    return Operand.arg(toInt(app.args.get(0)));
                case "Project":
                    arity(app, 2);
                    int output = toInt(app.args.get(0));
                    return Operand.project(output, nodeWithOutput(app.args.get(1), output));
                case "Node":
                    return Operand.id(nodeWithOutput(app, 0));
                default:
                    throw new TermFormatException("Expected an operand", term);
            }
        }

        int nodeWithOutput(Term nodeTerm, int output) {
            int index = node(nodeTerm);
            int outputs = builder.get(index).outputCount();
            if (output >= outputs) {
                throw new TermFormatException(String.format(
                        "Output %d of a node with %d outputs", output, outputs), nodeTerm);
            }
            return index;
        }

        List<Operand> vec(Term term) {
            Term.App app = app(term, "a vector");
            if (!"vec-of".equals(app.head)) throw new TermFormatException("Expected a vector", term);
            List<Operand> operands = new ArrayList<>();
            for (Term arg : app.args) {
                operands.add(operand(arg));
            }
            return operands;
        }

        int node(Term term) {
            Integer index = nodeIndices.get(term);
            if (index != null) return index;
            Term.App app = app(term, "a node");
            if (!"Node".equals(app.head)) throw new TermFormatException("Expected a node", term);
            arity(app, 1);
            Term.App body = app(app.args.get(0), "a node body");
            int added;
            switch (body.head) {
                case "PureOp":
                    arity(body, 1);
                    added = builder.add(new RvsdgNode.BasicOp(pureOp(app(body.args.get(0), "an operation"))));
                    break;
                case "Call": {
                    if (body.args.size() != 3 && body.args.size() != 4) {
                        throw new TermFormatException("Wrong number of arguments to Call", body);
                    }
                    Term target = body.args.get(0);
                    if (!(target instanceof Term.Str)) throw new TermFormatException("Expected a string", target);
                    List<Operand> args = vec(body.args.get(1));
                    int outputs = toInt(body.args.get(2));
                    Type returnType = body.args.size() == 4 ? type(body.args.get(3)) : null;
                    if (outputs != (returnType == null ? 1 : 2)) {
                        throw new TermFormatException("Call has " + outputs + " outputs, expected "
                                + (returnType == null ? 1 : 2), body);
                    }
                    added = builder.add(new RvsdgNode.BasicOp(
                            new Expr.Call(((Term.Str) target).value, args, outputs, returnType)));
                    break;
                }
                case "Print":
                    arity(body, 1);
                    added = builder.add(new RvsdgNode.BasicOp(new Expr.Print(vec(body.args.get(0)))));
                    break;
                case "Gamma": {
                    arity(body, 3);
                    Operand predicate = operand(body.args.get(0));
                    List<Operand> inputs = vec(body.args.get(1));
                    Term.App armsVec = app(body.args.get(2), "a vector of arms");
                    if (!"vec-of".equals(armsVec.head)) throw new TermFormatException("Expected a vector", armsVec);
                    List<List<Operand>> arms = new ArrayList<>();
                    for (Term armTerm : armsVec.args) {
                        Term.App arm = app(armTerm, "an arm");
                        if (!"VO".equals(arm.head)) throw new TermFormatException("Expected an arm", arm);
                        arity(arm, 1);
                        List<Operand> armOutputs = vec(arm.args.get(0));
                        if (!arms.isEmpty() && arms.get(0).size() != armOutputs.size()) {
                            throw new TermFormatException(String.format(
                                    "Arm %d has %d outputs, arm 0 has %d",
                                    arms.size(), armOutputs.size(), arms.get(0).size()), body);
                        }
                        arms.add(armOutputs);
                    }
                    added = builder.branch(predicate, inputs, arms);
                    break;
                }
                case "Theta": {
                    arity(body, 3);
                    Operand predicate = operand(body.args.get(0));
                    List<Operand> inputs = vec(body.args.get(1));
                    List<Operand> outputs = vec(body.args.get(2));
                    if (inputs.size() != outputs.size()) {
                        throw new TermFormatException(String.format(
                                "Loop has %d inputs but %d outputs", inputs.size(), outputs.size()), body);
                    }
                    added = builder.loop(predicate, inputs, outputs);
                    break;
                }
                default:
                    throw new TermFormatException("Unknown node kind: " + body.head, body);
            }
            nodeIndices.put(term, added);
            return added;
        }

        Expr pureOp(Term.App op) {
            if ("Const".equals(op.head)) {
                arity(op, 3);
                Type type = type(op.args.get(0));
                Term.App constOp = app(op.args.get(1), "a constant operation");
                ConstOp kind = null;
                for (ConstOp candidate : ConstOp.values()) {
                    if (candidate.mnemonic.equals(constOp.head)) kind = candidate;
                }
                if (kind == null) throw new TermFormatException("Unknown constant operation", constOp);
                Literal literal = literal(op.args.get(2));
                if (literal.type != type) throw new TermFormatException("Literal does not match its type", op);
                return new Expr.Const(kind, literal, type);
            }
            ValueOp valueOp = ValueOp.byMnemonic(op.head);
            if (valueOp == null) throw new TermFormatException("Unknown operation: " + op.head, op);
            arity(op, valueOp.arity + 1);
            Type type = type(op.args.get(0));
            List<Operand> args = new ArrayList<>();
            for (Term arg : op.args.subList(1, op.args.size())) {
                args.add(operand(arg));
            }
            return new Expr.Op(valueOp, args, type);
        }

        static Type type(Term term) {
            Term.App app = app(term, "a type");
            if (app.args.isEmpty()) {
                switch (app.head) {
                    case "IntT":
                        return Type.INT;
                    case "BoolT":
                        return Type.BOOL;
                    case "FloatT":
                        return Type.FLOAT;
                }
            }
            throw new TermFormatException("Expected a type", term);
        }

        static Literal literal(Term term) {
            Term.App app = app(term, "a literal");
            arity(app, 1);
            Term value = app.args.get(0);
            switch (app.head) {
                case "Num":
                    if (value instanceof Term.Int) return Literal.ofInt(((Term.Int) value).value);
                    break;
                case "Bool":
                    if (value instanceof Term.Sym) {
                        String name = ((Term.Sym) value).name;
                        if ("true".equals(name)) return Literal.ofBool(true);
                        if ("false".equals(name)) return Literal.ofBool(false);
                    }
                    break;
                case "Float":
                    if (value instanceof Term.Flt) return Literal.ofFloat(((Term.Flt) value).value);
                    if (value instanceof Term.Int) return Literal.ofFloat(((Term.Int) value).value);
                    break;
            }
            throw new TermFormatException("Expected a literal", term);
        }

        static Term.App app(Term term, String what) {
            if (!(term instanceof Term.App)) throw new TermFormatException("Expected " + what, term);
            return (Term.App) term;
        }

        static void arity(Term.App app, int expected) {
            if (app.args.size() != expected) {
                throw new TermFormatException(String.format("Expected %d arguments to %s, got %d",
                        expected, app.head, app.args.size()), app);
            }
        }

        static int toInt(Term term) {
            if (term instanceof Term.Int) {
                long value = ((Term.Int) term).value;
                if (value >= 0 && value <= Integer.MAX_VALUE) return (int) value;
            }
            throw new TermFormatException("Expected an index", term);
        }
    }
}
