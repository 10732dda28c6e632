package io.github.eutro.textir.passes.form;

import io.github.eutro.textir.passes.IRPass;
import io.github.eutro.textir.passes.meta.ComputePreds;
import io.github.eutro.textir.ssa.*;
import io.github.eutro.textir.util.FreshNames;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A pass which replaces conditional terminators with nondeterministic jumps into blocks
 * that {@link Insn.Prune prune} on the outcome of each atom of the condition.
 * <p>
 * Each way the condition can come out true (or false) under short-circuit evaluation is a
 * {@link Leaves leaf}: the atoms tested along the way, each with the value it had. Every
 * leaf becomes a block pruning on those atoms, ending in the branch that outcome takes.
 * The conditional then becomes a jump to all the leaf blocks, true leaves first.
 * <p>
 * When a branch is a plain jump to a block that nothing else jumps to, and the condition has
 * only one leaf for that branch, the prunes are put at the start of that block instead.
 * Branches that are conditionals themselves are expanded the same way, recursively.
 */
public class EliminateShortCircuits implements IRPass<Procedure, Procedure> {
    /**
     * An instance of this pass, labelling new blocks {@code if0}, {@code if1}, ...
     */
    public static final EliminateShortCircuits INSTANCE = new EliminateShortCircuits("if");

    private final String labelPrefix;

    /**
     * Construct an instance of this pass.
     *
     * @param labelPrefix The prefix of generated block labels.
     */
    public EliminateShortCircuits(String labelPrefix) {
        this.labelPrefix = labelPrefix;
    }

    @Override
    public Procedure run(Procedure proc) {
        Expansion expansion = new Expansion(proc);
        List<Block> homes = new ArrayList<>();
        List<List<Block>> generated = new ArrayList<>();
        for (Block block : proc.getBlocks()) {
            List<Block> out = new ArrayList<>();
            homes.add(block.withTerminator(expansion.expand(block.getTerminator(), out)));
            generated.add(out);
        }

        // prunes can be moved into blocks before or after their condition, so fill them in last
        List<Block> blocks = new ArrayList<>();
        for (int i = 0; i < homes.size(); i++) {
            Block home = homes.get(i);
            List<Insn> prunes = expansion.prepended.get(home.getLabel());
            if (prunes != null) {
                List<Insn> insns = new ArrayList<>(prunes);
                insns.addAll(home.getInsns());
                home = home.withInsns(insns);
            }
            blocks.add(home);
            blocks.addAll(generated.get(i));
        }
        return proc.withBlocks(blocks);
    }

    @Override
    public String toString() {
        return "EliminateShortCircuits";
    }

    private class Expansion {
        final FreshNames names;
        final Map<String, List<String>> preds;
        final String entry;
        final Map<String, List<Insn>> prepended = new HashMap<>();

        Expansion(Procedure proc) {
            names = FreshNames.forProcedure(proc);
            preds = ComputePreds.INSTANCE.run(proc);
            entry = proc.getEntry().getLabel();
        }

        Terminator expand(Terminator terminator, List<Block> out) {
            if (!(terminator instanceof Terminator.If)) return terminator;
            Terminator.If anIf = (Terminator.If) terminator;
            Leaves leaves = Leaves.of(anIf.condition);

            List<Block> elseNested = new ArrayList<>();
            Terminator elseBranch = expand(anIf.elseBranch, elseNested);
            List<String> falseTargets = new ArrayList<>();
            List<Block> falseBlocks = new ArrayList<>();
            branch(leaves.falses, elseBranch, falseTargets, falseBlocks);

            List<Block> thenNested = new ArrayList<>();
            Terminator thenBranch = expand(anIf.thenBranch, thenNested);
            List<String> trueTargets = new ArrayList<>();
            List<Block> trueBlocks = new ArrayList<>();
            branch(leaves.trues, thenBranch, trueTargets, trueBlocks);

            out.addAll(trueBlocks);
            out.addAll(falseBlocks);
            out.addAll(thenNested);
            out.addAll(elseNested);

            List<String> targets = new ArrayList<>(trueTargets);
            targets.addAll(falseTargets);
            return Terminator.jumpTo(targets.toArray(new String[0]));
        }

        private void branch(List<List<Leaves.Test>> paths,
                            Terminator branch,
                            List<String> targets,
                            List<Block> blocks) {
            if (paths.size() == 1) {
                String label = soleIncomingJump(branch);
                if (label != null) {
                    prepended.put(label, prunes(paths.get(0)));
                    targets.add(label);
                    return;
                }
            }
            for (List<Leaves.Test> path : paths) {
                String label = names.freshLabel(labelPrefix);
                blocks.add(new Block(label, Collections.emptyList(), prunes(path), branch));
                targets.add(label);
            }
        }

        // the label of the block branch jumps to, if it takes no arguments and nothing else enters it
        @Nullable
        private String soleIncomingJump(Terminator branch) {
            if (!(branch instanceof Terminator.Jump)) return null;
            List<NodeCall> jumpTargets = ((Terminator.Jump) branch).targets;
            if (jumpTargets.size() != 1) return null;
            NodeCall target = jumpTargets.get(0);
            if (!target.args.isEmpty() || target.label.equals(entry)) return null;
            List<String> incoming = preds.get(target.label);
            if (incoming == null || incoming.size() != 1) return null;
            return target.label;
        }

        private List<Insn> prunes(List<Leaves.Test> path) {
            List<Insn> insns = new ArrayList<>(path.size());
            for (Leaves.Test test : path) {
                insns.add(Insn.prune(test.holds ? test.atom : Expr.not(test.atom)));
            }
            return insns;
        }
    }
}
