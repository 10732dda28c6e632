package io.github.eutro.textir.passes.opts;

import io.github.eutro.textir.passes.IRPass;
import io.github.eutro.textir.passes.MalformedIRException;
import io.github.eutro.textir.ssa.*;
import io.github.eutro.textir.util.IRUtils;

import java.util.*;

/**
 * A pass which substitutes pure assignments into their uses, and deletes pure assignments
 * that are left unused.
 * <p>
 * An assignment is pure if its expression contains no loads and no calls. Substitution is
 * transitive and crosses blocks, since identifiers are procedure-wide; a definition used
 * several times is copied to each use. Assignments from loads and calls are always kept,
 * used or not.
 */
public class PropagateLets implements IRPass<Procedure, Procedure> {
    /**
     * An instance of this pass.
     */
    public static final PropagateLets INSTANCE = new PropagateLets();

    @Override
    public Procedure run(Procedure proc) {
        Map<Ident, Expr> definitions = new HashMap<>();
        Set<Ident> bound = new HashSet<>();
        for (Block block : proc.getBlocks()) {
            for (Block.Param param : block.getParams()) {
                if (!bound.add(param.id)) {
                    throw new MalformedIRException(proc.getName(), block.headerString(),
                            param.id + " is bound more than once");
                }
            }
            for (Insn insn : block.getInsns()) {
                if (!(insn instanceof Insn.Assign)) continue;
                Insn.Assign assign = (Insn.Assign) insn;
                if (!bound.add(assign.id)) {
                    throw new MalformedIRException(proc.getName(), insn, assign.id + " is bound more than once");
                }
                if (assign.expr.isPure()) {
                    definitions.put(assign.id, assign.expr);
                }
            }
        }

        Substitution substitution = new Substitution(proc.getName(), definitions);
        List<Block> blocks = new ArrayList<>();
        for (Block block : proc.getBlocks()) {
            List<Insn> insns = new ArrayList<>();
            for (Insn insn : block.getInsns()) {
                insns.add(insn.mapExprs(substitution::transform));
            }
            Terminator terminator = block.getTerminator().mapExprs(substitution::transform);
            blocks.add(new Block(block.getLabel(), block.getParams(), insns, terminator));
        }
        Procedure substituted = proc.withBlocks(blocks);
        return EliminateDeadLets.INSTANCE.run(substituted);
    }

    @Override
    public String toString() {
        return "PropagateLets";
    }

    private static class Substitution extends Expr.Transformer {
        private final String procName;
        private final Map<Ident, Expr> definitions;
        private final Map<Ident, Expr> expanded = new HashMap<>();
        private final Set<Ident> expanding = new HashSet<>();

        Substitution(String procName, Map<Ident, Expr> definitions) {
            this.procName = procName;
            this.definitions = definitions;
        }

        @Override
        public Expr visitVar(Expr.Var expr) {
            Expr definition = definitions.get(expr.id);
            if (definition == null) return expr;
            Expr done = expanded.get(expr.id);
            if (done != null) return done;
            if (!expanding.add(expr.id)) {
                throw new MalformedIRException(procName, expr.id + " = " + definition,
                        "definition of " + expr.id + " depends on itself");
            }
            Expr result = transform(definition);
            expanding.remove(expr.id);
            expanded.put(expr.id, result);
            return result;
        }
    }
}
