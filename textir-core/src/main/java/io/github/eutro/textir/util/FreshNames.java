package io.github.eutro.textir.util;

import io.github.eutro.textir.ssa.Block;
import io.github.eutro.textir.ssa.Ident;
import io.github.eutro.textir.ssa.Procedure;

import java.util.HashSet;
import java.util.Set;

/**
 * The naming state of one procedure rewrite: a counter of fresh identifiers, and the set
 * of labels in use.
 * <p>
 * An instance is created for a single run of a pass over a single procedure, and discarded
 * afterwards. Existing identifiers and labels are never renamed.
 */
public final class FreshNames {
    private final Set<String> usedLabels;
    private int nextIdent;
    private int nextLabel;

    FreshNames(Set<String> usedLabels, int nextIdent, int nextLabel) {
        this.usedLabels = usedLabels;
        this.nextIdent = nextIdent;
        this.nextLabel = nextLabel;
    }

    /**
     * Create the naming state for a procedure, with the identifier counter seeded above every
     * identifier the procedure mentions.
     *
     * @param proc The procedure.
     * @return The naming state.
     */
    public static FreshNames forProcedure(Procedure proc) {
        Set<String> labels = new HashSet<>();
        for (Block block : proc.getBlocks()) {
            labels.add(block.getLabel());
        }
        int max = IRUtils.maxIdentIndex(proc);
        // Integer.MAX_VALUE is never handed out, so a procedure using it has none left
        return new FreshNames(labels, max == Integer.MAX_VALUE ? max : max + 1, 0);
    }

    /**
     * Allocate a fresh identifier.
     *
     * @return The identifier.
     */
    public Ident freshIdent() {
        if (nextIdent == Integer.MAX_VALUE) {
            throw new IllegalStateException("out of fresh identifiers");
        }
        return Ident.of(nextIdent++);
    }

    /**
     * Allocate a fresh label of the form {@code prefix<N>}, skipping any already in use.
     *
     * @param prefix The label prefix.
     * @return The label, which is now in use.
     */
    public String freshLabel(String prefix) {
        while (true) {
            if (nextLabel == Integer.MAX_VALUE) {
                throw new IllegalStateException("out of fresh labels with prefix " + prefix);
            }
            String label = prefix + nextLabel++;
            if (usedLabels.add(label)) return label;
        }
    }
}
