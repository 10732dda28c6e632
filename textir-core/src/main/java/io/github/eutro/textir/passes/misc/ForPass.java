package io.github.eutro.textir.passes.misc;

import io.github.eutro.textir.passes.IRPass;
import io.github.eutro.textir.passes.ModuleTransformException;
import io.github.eutro.textir.ssa.Decl;
import io.github.eutro.textir.ssa.Module;
import io.github.eutro.textir.ssa.Procedure;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A pass which lifts passes which operate on smaller IR parts into ones that operate on bigger parts.
 */
public class ForPass {
    private static final Logger LOGGER = Logger.getLogger(ForPass.class.getName());

    /**
     * Whether the rendered result of each lifted pass should be logged, for debugging.
     */
    public static boolean TRACE_PASSES = System.getenv("TEXTIR_TRACE_PASSES") != null;

    /**
     * Lift a procedure pass to operate on a full module.
     *
     * @param pass The procedure pass.
     * @return The module pass.
     */
    public static Procedures liftProcedures(IRPass<Procedure, Procedure> pass) {
        return new Procedures(pass);
    }

    /**
     * A procedure pass lifted to operate on a full module.
     * <p>
     * Procedures are transformed independently, and a failure in one does not stop the others:
     * all of them are attempted before a {@link ModuleTransformException} reports the failures.
     * External declarations are kept as they are.
     */
    public static class Procedures implements IRPass<Module, Module> {
        private final IRPass<Procedure, Procedure> pass;

        private Procedures(IRPass<Procedure, Procedure> pass) {
            this.pass = pass;
        }

        @Override
        public Module run(Module module) {
            List<Decl> decls = new ArrayList<>();
            Map<String, RuntimeException> failures = new LinkedHashMap<>();
            for (Decl decl : module.getDecls()) {
                if (!(decl instanceof Procedure)) {
                    decls.add(decl);
                    continue;
                }
                Procedure proc = (Procedure) decl;
                LOGGER.log(Level.FINE, "Running {0} on {1}", new Object[]{pass, proc.getName()});
                try {
                    Procedure result = pass.run(proc);
                    if (TRACE_PASSES) {
                        LOGGER.info(pass + " produced:\n" + result);
                    }
                    decls.add(result);
                } catch (RuntimeException e) {
                    LOGGER.log(Level.WARNING, "Failed to transform procedure " + proc.getName(), e);
                    failures.put(proc.getName(), e);
                    decls.add(proc);
                }
            }
            Module result = new Module(decls);
            if (!failures.isEmpty()) {
                throw new ModuleTransformException(result, failures);
            }
            return result;
        }

        @Override
        public String toString() {
            return "for procedures: " + pass;
        }
    }
}
