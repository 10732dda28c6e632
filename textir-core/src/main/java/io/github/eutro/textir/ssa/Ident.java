package io.github.eutro.textir.ssa;

import org.jetbrains.annotations.NotNull;

/**
 * A local identifier, {@code n<index>}, bound once in a procedure.
 */
public final class Ident implements Comparable<Ident> {
    private static final Ident[] CACHE = new Ident[64];

    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new Ident(i);
        }
    }

    public final int index;

    private Ident(int index) {
        this.index = index;
    }

    /**
     * Get the identifier with the given index.
     *
     * @param index The index, non-negative.
     * @return The identifier.
     */
    public static Ident of(int index) {
        if (index < 0) throw new IllegalArgumentException("negative identifier index " + index);
        return index < CACHE.length ? CACHE[index] : new Ident(index);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof Ident && ((Ident) o).index == index;
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public int compareTo(@NotNull Ident o) {
        return Integer.compare(index, o.index);
    }

    @Override
    public String toString() {
        return "n" + index;
    }
}
