package io.github.eutro.rvsdg.term;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a term, or its text, does not follow the term grammar.
 */
public class TermFormatException extends RuntimeException {
    public TermFormatException(String message, @Nullable Term term) {
        super(term == null ? message : message + "\n  in term: " + term);
    }

    public TermFormatException(String message) {
        this(message, null);
    }
}
