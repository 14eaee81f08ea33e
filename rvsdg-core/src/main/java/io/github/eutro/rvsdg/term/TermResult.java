package io.github.eutro.rvsdg.term;

import org.jetbrains.annotations.Nullable;

/**
 * The encoding of a function's roots: its final state, and its result if it has one.
 */
public abstract class TermResult {
    public final Term state;

    private TermResult(Term state) {
        this.state = state;
    }

    /**
     * Get the term of the function's result.
     *
     * @return The term, or null if the function returns nothing.
     */
    public abstract @Nullable Term value();

    public static TermResult stateOnly(Term state) {
        return new StateOnly(state);
    }

    public static TermResult stateAndValue(Term state, Term value) {
        return new StateAndValue(state, value);
    }

    /**
     * The roots of a function that returns nothing.
     */
    public static final class StateOnly extends TermResult {
        private StateOnly(Term state) {
            super(state);
        }

        @Override
        public @Nullable Term value() {
            return null;
        }
    }

    /**
     * The roots of a function that returns a value.
     */
    public static final class StateAndValue extends TermResult {
        public final Term value;

        private StateAndValue(Term state, Term value) {
            super(state);
            this.value = value;
        }

        @Override
        public Term value() {
            return value;
        }
    }
}
