package io.github.eutro.textir.passes;

import io.github.eutro.textir.passes.form.EliminateShortCircuits;
import io.github.eutro.textir.passes.form.FlattenCalls;
import io.github.eutro.textir.passes.form.LowerBlockParams;
import io.github.eutro.textir.passes.misc.ForPass;
import io.github.eutro.textir.passes.opts.PropagateLets;
import io.github.eutro.textir.ssa.Module;
import io.github.eutro.textir.ssa.Procedure;

/**
 * Some pre-composed passes.
 * <p>
 * The normalisation pipelines produce IR in the shape the analysis backend accepts:
 * no nested calls, no conditional terminators and no block parameters.
 */
public class Passes {
    /**
     * Removes conditional terminators. Calls are flattened first, so that an atom left out of a
     * leaf does not take a call with it, and once more afterwards, which changes nothing on
     * input that was already flat.
     */
    public static final IRPass<Procedure, Procedure> FLATTEN_CONTROL =
            FlattenCalls.INSTANCE
                    .then(EliminateShortCircuits.INSTANCE)
                    .then(FlattenCalls.INSTANCE);

    /**
     * Normalises a procedure. SSA destruction comes last, once no more blocks or
     * jumps are being added.
     */
    public static final IRPass<Procedure, Procedure> NORMALIZE_PROCEDURE =
            FLATTEN_CONTROL
                    .then(LowerBlockParams.INSTANCE);

    /**
     * Normalises a procedure, substituting pure assignments into their uses before leaving SSA form.
     */
    public static final IRPass<Procedure, Procedure> NORMALIZE_PROPAGATE_PROCEDURE =
            FLATTEN_CONTROL
                    .then(PropagateLets.INSTANCE)
                    .then(LowerBlockParams.INSTANCE);

    /**
     * {@link #NORMALIZE_PROCEDURE} over every procedure of a module.
     */
    public static final IRPass<Module, Module> NORMALIZE =
            ForPass.liftProcedures(NORMALIZE_PROCEDURE);

    /**
     * {@link #NORMALIZE_PROPAGATE_PROCEDURE} over every procedure of a module.
     */
    public static final IRPass<Module, Module> NORMALIZE_PROPAGATE =
            ForPass.liftProcedures(NORMALIZE_PROPAGATE_PROCEDURE);

    /**
     * Get the normalisation pipeline for modules.
     *
     * @param propagate Whether pure assignments should be propagated.
     * @return The pipeline.
     */
    public static IRPass<Module, Module> normalize(boolean propagate) {
        return propagate ? NORMALIZE_PROPAGATE : NORMALIZE;
    }
}
