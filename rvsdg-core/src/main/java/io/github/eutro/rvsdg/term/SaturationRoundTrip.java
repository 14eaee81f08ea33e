package io.github.eutro.rvsdg.term;

import io.github.eutro.rvsdg.graph.RvsdgFunction;
import io.github.eutro.rvsdg.graph.RvsdgProgram;
import io.github.eutro.rvsdg.graph.RvsdgVerifier;
import io.github.eutro.rvsdg.passes.IRPass;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encodes every function of a program as terms, runs them through a {@link SaturationEngine},
 * and decodes the result into a new program.
 * <p>
 * The roots of function {@code f} are bound to {@code f__state} and, if it returns a value, {@code f__value}.
 * Failures of the input program are carried over.
 */
public class SaturationRoundTrip implements IRPass<RvsdgProgram, RvsdgProgram> {
    private final SaturationEngine engine;

    public SaturationRoundTrip(SaturationEngine engine) {
        this.engine = engine;
    }

    public static String stateName(String function) {
        return function + "__state";
    }

    public static String valueName(String function) {
        return function + "__value";
    }

    @Override
    public RvsdgProgram run(RvsdgProgram program) {
        Map<String, Term> bindings = new LinkedHashMap<>();
        for (RvsdgFunction func : program.functions) {
            TermResult result = TermCodec.toTerm(func);
            bindings.put(stateName(func.name), result.state);
            Term value = result.value();
            if (value != null) bindings.put(valueName(func.name), value);
        }

        Map<String, Term> saturated = engine.saturate(bindings);

        RvsdgProgram out = new RvsdgProgram();
        for (RvsdgFunction func : program.functions) {
            Term state = lookup(saturated, stateName(func.name));
            TermResult result = func.result == null
                    ? TermResult.stateOnly(state)
                    : TermResult.stateAndValue(state, lookup(saturated, valueName(func.name)));
            RvsdgFunction decoded = TermCodec.fromTerm(func.name, result, func.nArgs);
            if (RvsdgVerifier.VERIFY) RvsdgVerifier.verify(decoded);
            out.functions.add(decoded);
        }
        out.failures.putAll(program.failures);
        return out;
    }

    private static Term lookup(Map<String, Term> saturated, String name) {
        Term term = saturated.get(name);
        if (term == null) throw new TermFormatException("Saturation result has no binding for " + name);
        return term;
    }
}
