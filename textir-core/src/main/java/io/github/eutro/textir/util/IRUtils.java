package io.github.eutro.textir.util;

import io.github.eutro.textir.ssa.*;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A set of utilities for walking the textual IR.
 */
public class IRUtils {
    /**
     * Call the consumer on every top-level expression of a procedure: instruction operands,
     * jump arguments, returned and thrown values, and the atoms of conditions.
     *
     * @param proc     The procedure.
     * @param consumer The consumer.
     */
    public static void forEachExpr(Procedure proc, Consumer<Expr> consumer) {
        for (Block block : proc.getBlocks()) {
            for (Insn insn : block.getInsns()) {
                insn.forEachExpr(consumer);
            }
            block.getTerminator().forEachExpr(consumer);
        }
    }

    /**
     * Call the consumer on an expression and all of its subexpressions, parents first.
     *
     * @param expr     The expression.
     * @param consumer The consumer.
     */
    public static void walk(Expr expr, Consumer<Expr> consumer) {
        consumer.accept(expr);
        for (Expr child : expr.children()) {
            walk(child, consumer);
        }
    }

    /**
     * Count the references to each identifier in a procedure. Identifiers that are bound but
     * never referenced are mapped to zero.
     *
     * @param proc The procedure.
     * @return The reference counts.
     */
    public static Map<Ident, Integer> countReferences(Procedure proc) {
        Map<Ident, Integer> counts = new HashMap<>();
        for (Block block : proc.getBlocks()) {
            for (Block.Param param : block.getParams()) {
                counts.putIfAbsent(param.id, 0);
            }
            for (Insn insn : block.getInsns()) {
                if (insn instanceof Insn.Assign) {
                    counts.putIfAbsent(((Insn.Assign) insn).id, 0);
                }
            }
        }
        forEachExpr(proc, top -> walk(top, e -> {
            if (e instanceof Expr.Var) {
                counts.merge(((Expr.Var) e).id, 1, Integer::sum);
            }
        }));
        return counts;
    }

    /**
     * Find the greatest identifier index bound or referenced anywhere in a procedure.
     *
     * @param proc The procedure.
     * @return The index, or -1 if the procedure mentions no identifiers.
     */
    public static int maxIdentIndex(Procedure proc) {
        int max = -1;
        for (Ident id : countReferences(proc).keySet()) {
            max = Math.max(max, id.index);
        }
        return max;
    }

    /**
     * Collect the names of program variables used by a procedure: its formals and every
     * variable whose address is taken.
     *
     * @param proc The procedure.
     * @return The variable names.
     */
    public static Set<String> variableNames(Procedure proc) {
        Set<String> names = new HashSet<>();
        for (Procedure.Formal formal : proc.getFormals()) {
            names.add(formal.name);
        }
        forEachExpr(proc, top -> walk(top, e -> {
            if (e instanceof Expr.LVar) {
                names.add(((Expr.LVar) e).name);
            }
        }));
        return names;
    }
}
