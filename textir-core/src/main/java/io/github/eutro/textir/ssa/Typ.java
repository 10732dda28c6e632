package io.github.eutro.textir.ssa;

/**
 * A type annotation, as found on formals, block parameters, loads and stores.
 * Types are compared by their rendering.
 */
public final class Typ {
    public static final Typ INT = new Typ("int");
    public static final Typ FLOAT = new Typ("float");
    public static final Typ NULL = new Typ("null");
    public static final Typ VOID = new Typ("void");

    private final String name;

    private Typ(String name) {
        this.name = name;
    }

    /**
     * Get the pointer type {@code *pointee}.
     *
     * @param pointee The type pointed to.
     * @return The pointer type.
     */
    public static Typ ptr(Typ pointee) {
        return new Typ("*" + pointee.name);
    }

    /**
     * Get a named struct type.
     *
     * @param name The struct name.
     * @return The type.
     */
    public static Typ struct(String name) {
        return new Typ(name);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof Typ && ((Typ) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
