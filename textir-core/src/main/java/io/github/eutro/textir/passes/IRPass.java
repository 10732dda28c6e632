package io.github.eutro.textir.passes;

import io.github.eutro.textir.passes.misc.ChainedPass;
import io.github.eutro.textir.ssa.Module;
import io.github.eutro.textir.ssa.Procedure;

/**
 * A pass to run on some part of the IR (e.g. {@link Module}, {@link Procedure}),
 * which converts it to a new IR, or computes something from it.
 * <p>
 * The IR is immutable, so a pass never modifies its input. Passes which rewrite
 * a procedure return a new procedure, sharing whatever parts were left unchanged.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 * @see io.github.eutro.textir.ssa
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The IR to run it on.
     * @return The result.
     * @throws MalformedIRException If the IR breaks an invariant the pass relies on.
     */
    B run(A a);

    /**
     * Compose this pass with another.
     *
     * @param next The pass to run after this.
     * @param <C>  The result type.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
