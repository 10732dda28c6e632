package io.github.eutro.textir.passes.meta;

import io.github.eutro.textir.passes.IRPass;
import io.github.eutro.textir.ssa.Block;
import io.github.eutro.textir.ssa.Procedure;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the predecessors of each block of a procedure, keyed by label.
 * <p>
 * A predecessor is listed once per edge, so a block jumping to the same target twice
 * (e.g. from both branches of a conditional) appears twice. Edges nested in conditional
 * terminators count. Labels that are jumped to but not defined are present too.
 */
public class ComputePreds implements IRPass<Procedure, Map<String, List<String>>> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public Map<String, List<String>> run(Procedure proc) {
        Map<String, List<String>> preds = new LinkedHashMap<>();
        for (Block block : proc.getBlocks()) {
            preds.put(block.getLabel(), new ArrayList<>());
        }
        for (Block block : proc.getBlocks()) {
            block.getTerminator().forEachTarget(target ->
                    preds.computeIfAbsent(target.label, $ -> new ArrayList<>())
                            .add(block.getLabel()));
        }
        return preds;
    }

    @Override
    public String toString() {
        return "ComputePreds";
    }
}
