package io.github.eutro.textir.ssa;

/**
 * A top-level declaration of a {@link Module}.
 */
public interface Decl {
    /**
     * Get the name of the procedure this declares or defines.
     *
     * @return The name.
     */
    String getName();
}
