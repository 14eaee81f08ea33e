package io.github.eutro.rvsdg.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A key for operations carrying exactly one intermediate of type {@code T}.
 *
 * @param <T> The type of the intermediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;

    public UnaryOpKey(String mnemonic, Function<T, String> printer) {
        super(mnemonic);
        this.printer = printer;
    }

    public UnaryOpKey(String mnemonic) {
        this(mnemonic, Objects::toString);
    }

    public class UnaryOp extends Op {
        public final T arg;

        public UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    public @Nullable UnaryOp checkNullable(Op val) {
        if (val.key == this) {
            @SuppressWarnings("unchecked")
            UnaryOp ret = (UnaryOp) val;
            return ret;
        } else {
            return null;
        }
    }

    public Optional<UnaryOp> check(Op val) {
        return Optional.ofNullable(checkNullable(val));
    }

    public UnaryOp cast(Op val) {
        return check(val).orElseThrow(ClassCastException::new);
    }

    public UnaryOp create(T arg) {
        if (arg == null) {
            throw new IllegalArgumentException("Argument is null");
        }
        return new UnaryOp(arg);
    }
}
