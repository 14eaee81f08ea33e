package io.github.eutro.rvsdg.term;

import io.github.eutro.rvsdg.util.F;

import java.util.Map;

/**
 * Rewrites named terms into equivalent, hopefully better, terms, such as by equality saturation.
 * <p>
 * The result must contain every name of the input.
 */
@FunctionalInterface
public interface SaturationEngine {
    /**
     * Rewrite the terms.
     *
     * @param bindings The terms, by name.
     * @return The rewritten terms, by name.
     */
    Map<String, Term> saturate(Map<String, Term> bindings);

    /**
     * An engine that rewrites nothing.
     *
     * @return The engine.
     */
    static SaturationEngine identity() {
        return bindings -> bindings;
    }

    /**
     * An engine that talks to an external tool in text: the bindings are printed by {@link TermPrinter},
     * and the reply is read by {@link TermParser}.
     *
     * @param exchange Sends the printed program to the tool, and returns its reply.
     * @return The engine.
     */
    static SaturationEngine textual(F<String, String> exchange) {
        return bindings -> TermParser.parse(exchange.apply(TermPrinter.print(bindings)));
    }
}
