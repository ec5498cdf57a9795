package fol.term;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of fresh Skolem constants and function symbols.
 * <p>
 * All names come from one counter, so no two calls on the same instance return the same name.
 * Generated names start with {@value #PREFIX}, which user symbols never do. Separate instances
 * may hand out the same names; share an instance for as long as names have to stay unique.
 */
public final class SkolemSymbols {

    public static final String PREFIX = "$";

    private final long first;
    private final AtomicLong counter;

    public SkolemSymbols() {
        this(1);
    }

    public SkolemSymbols(long first) {
        this.first = first;
        this.counter = new AtomicLong(first);
    }

    /**
     * @return a constant whose name was never returned by this instance
     */
    public Constant nextConstant() {
        return new Constant(PREFIX + "c" + counter.getAndIncrement());
    }

    /**
     * @param args arguments of the application, kept in the given order
     * @return a fresh function symbol applied to {@code args}
     */
    public Function nextFunction(List<Term> args) {
        return new Function(PREFIX + "f" + counter.getAndIncrement(), args);
    }

    /**
     * @return how many names this instance handed out so far
     */
    public long issued() {
        return counter.get() - first;
    }

    public static boolean isSkolemSymbol(String name) {
        return name.startsWith(PREFIX);
    }
}
