package io.github.eutro.textir.passes.opts;

import io.github.eutro.textir.passes.IRPass;
import io.github.eutro.textir.ssa.*;
import io.github.eutro.textir.util.IRUtils;

import java.util.*;

/**
 * A pass which deletes pure assignments whose identifier is never referenced, including those
 * only referenced by other dead assignments.
 */
public class EliminateDeadLets implements IRPass<Procedure, Procedure> {
    /**
     * An instance of this pass.
     */
    public static final EliminateDeadLets INSTANCE = new EliminateDeadLets();

    @Override
    public Procedure run(Procedure proc) {
        Map<Ident, Integer> usageCount = IRUtils.countReferences(proc);
        Map<Ident, Insn.Assign> pureAssigns = new HashMap<>();
        for (Block block : proc.getBlocks()) {
            for (Insn insn : block.getInsns()) {
                if (insn instanceof Insn.Assign && ((Insn.Assign) insn).expr.isPure()) {
                    pureAssigns.put(((Insn.Assign) insn).id, (Insn.Assign) insn);
                }
            }
        }

        Set<Ident> dead = new HashSet<>();
        List<Ident> stack = new ArrayList<>();
        usageCount.forEach((id, count) -> {
            if (count == 0 && pureAssigns.containsKey(id)) {
                stack.add(id);
                dead.add(id);
            }
        });

        while (!stack.isEmpty()) {
            Ident deadId = stack.remove(stack.size() - 1);
            IRUtils.walk(pureAssigns.get(deadId).expr, e -> {
                if (!(e instanceof Expr.Var)) return;
                Ident used = ((Expr.Var) e).id;
                int n = usageCount.merge(used, -1, Integer::sum);
                if (n == 0 && pureAssigns.containsKey(used) && dead.add(used)) {
                    stack.add(used);
                }
            });
        }

        if (dead.isEmpty()) return proc;
        List<Block> blocks = new ArrayList<>();
        for (Block block : proc.getBlocks()) {
            List<Insn> insns = new ArrayList<>();
            for (Insn insn : block.getInsns()) {
                if (insn instanceof Insn.Assign && dead.contains(((Insn.Assign) insn).id)) continue;
                insns.add(insn);
            }
            blocks.add(block.withInsns(insns));
        }
        return proc.withBlocks(blocks);
    }

    @Override
    public String toString() {
        return "EliminateDeadLets";
    }
}
