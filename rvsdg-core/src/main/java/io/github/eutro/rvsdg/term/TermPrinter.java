package io.github.eutro.rvsdg.term;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Renders named terms as a sequence of {@code (let name term)} forms, which {@link TermParser} reads back.
 * <p>
 * A compound subterm that occurs more than once is bound to its own {@code __tN} name before its first use,
 * so the text grows with the number of distinct subterms rather than the size of the unfolded tree.
 */
public final class TermPrinter {
    /**
     * The prefix of the names given to shared subterms.
     */
    public static final String SHARED_PREFIX = "__t";

    private final StringBuilder sb = new StringBuilder();
    private final Map<Term, Integer> uses = new IdentityHashMap<>();
    private final Map<Term, String> names = new IdentityHashMap<>();

    private TermPrinter() {
    }

    /**
     * Print the bindings.
     *
     * @param bindings The terms, by name, in the order they should be printed.
     * @return The text.
     */
    public static String print(Map<String, Term> bindings) {
        TermPrinter printer = new TermPrinter();
        for (Term term : bindings.values()) {
            printer.count(term);
        }
        for (Map.Entry<String, Term> binding : bindings.entrySet()) {
            if (binding.getKey().startsWith(SHARED_PREFIX)) {
                throw new IllegalArgumentException("Reserved binding name: " + binding.getKey());
            }
            printer.hoist(binding.getValue());
            printer.let(binding.getKey(), binding.getValue());
        }
        return printer.sb.toString();
    }

    private static boolean isCompound(Term term) {
        return term instanceof Term.App && !((Term.App) term).args.isEmpty();
    }

    private void count(Term term) {
        if (!isCompound(term)) return;
        Integer seen = uses.put(term, uses.getOrDefault(term, 0) + 1);
        if (seen == null) {
            for (Term arg : ((Term.App) term).args) {
                count(arg);
            }
        }
    }

    private void hoist(Term term) {
        if (!isCompound(term) || names.containsKey(term)) return;
        for (Term arg : ((Term.App) term).args) {
            hoist(arg);
        }
        if (uses.get(term) > 1) {
            String name = SHARED_PREFIX + names.size();
            let(name, term);
            names.put(term, name);
        }
    }

    private void let(String name, Term term) {
        sb.append("(let ").append(name).append(' ');
        render(term);
        sb.append(")\n");
    }

    private void render(Term term) {
        String name = names.get(term);
        if (name != null) {
            sb.append(name);
        } else if (term instanceof Term.App) {
            Term.App app = (Term.App) term;
            sb.append('(').append(app.head);
            for (Term arg : app.args) {
                sb.append(' ');
                render(arg);
            }
            sb.append(')');
        } else {
            sb.append(term);
        }
    }
}
