package io.github.eutro.rvsdg.term;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.WeakHashMap;

/**
 * An immutable S-expression, the unit of exchange with a {@link SaturationEngine}.
 * <p>
 * Terms are hash-consed: the factory methods return the same object for structurally equal terms,
 * so a shared subterm is stored once, and can be compared by identity.
 */
public abstract class Term {
    private static final Map<Term, WeakReference<Term>> INTERNED = new WeakHashMap<>();

    private final int hash;

    private Term(int hash) {
        this.hash = hash;
    }

    @SuppressWarnings("unchecked")
    private static <T extends Term> T intern(T term) {
        synchronized (INTERNED) {
            WeakReference<Term> ref = INTERNED.get(term);
            Term existing = ref == null ? null : ref.get();
            if (existing != null) return (T) existing;
            INTERNED.put(term, new WeakReference<>(term));
            return term;
        }
    }

    /**
     * Construct an application of a constructor.
     *
     * @param head The name of the constructor.
     * @param args The arguments.
     * @return The term.
     */
    public static App app(String head, Term... args) {
        return app(head, Arrays.asList(args));
    }

    public static App app(String head, List<? extends Term> args) {
        return intern(new App(head, Collections.unmodifiableList(new ArrayList<>(args))));
    }

    public static Int num(long value) {
        return intern(new Int(value));
    }

    public static Flt flt(double value) {
        return intern(new Flt(value));
    }

    public static Str str(String value) {
        return intern(new Str(value));
    }

    public static Sym sym(String name) {
        return intern(new Sym(name));
    }

    @Override
    public final int hashCode() {
        return hash;
    }

    /**
     * {@code (head args...)}
     */
    public static final class App extends Term {
        public final String head;
        public final List<Term> args;

        private App(String head, List<Term> args) {
            super(31 * head.hashCode() + args.hashCode());
            this.head = head;
            this.args = args;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof App)) return false;
            App that = (App) o;
            if (hashCode() != that.hashCode() || !head.equals(that.head) || args.size() != that.args.size()) {
                return false;
            }
            for (int i = 0; i < args.size(); i++) {
                // arguments are interned
                if (args.get(i) != that.args.get(i)) return false;
            }
            return true;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(").append(head);
            for (Term arg : args) {
                sb.append(' ').append(arg);
            }
            return sb.append(')').toString();
        }
    }

    /**
     * An integer literal.
     */
    public static final class Int extends Term {
        public final long value;

        private Int(long value) {
            super(Long.hashCode(value));
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Int && ((Int) o).value == value;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /**
     * A floating point literal.
     */
    public static final class Flt extends Term {
        public final double value;

        private Flt(double value) {
            super(Double.hashCode(value) * 7);
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Flt && Double.doubleToLongBits(((Flt) o).value) == Double.doubleToLongBits(value);
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    /**
     * A string literal.
     */
    public static final class Str extends Term {
        public final String value;

        private Str(String value) {
            super(value.hashCode() * 11);
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Str && ((Str) o).value.equals(value);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("\"");
            for (char c : value.toCharArray()) {
                if (c == '"' || c == '\\') sb.append('\\');
                sb.append(c);
            }
            return sb.append('"').toString();
        }
    }

    /**
     * A bare symbol, such as {@code true}.
     */
    public static final class Sym extends Term {
        public final String name;

        private Sym(String name) {
            super(name.hashCode() * 13);
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Sym && ((Sym) o).name.equals(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
