package io.github.eutro.textir.passes.form;

import io.github.eutro.textir.passes.IRPass;
import io.github.eutro.textir.passes.MalformedIRException;
import io.github.eutro.textir.ssa.*;
import io.github.eutro.textir.util.IRUtils;

import java.util.*;

/**
 * A pass which takes a procedure out of SSA form, replacing block parameters with memory slots.
 * <p>
 * Each parameter {@code nK} gets a slot variable {@code <prefix>K}, shared by every jump into its
 * block. A jump stores its arguments into the slots of its target and drops them; the target
 * loads its parameters back from the slots on entry. All the stores of a jump happen before the
 * jump, and the loads after it, so arguments that swap parameters around cannot clobber
 * each other.
 * <p>
 * A jump may name a parameterised block only once, since both sets of arguments would share
 * the same slots.
 * <p>
 * This must run after conditional terminators are gone, since a store cannot be placed on
 * just one branch of a conditional.
 */
public class LowerBlockParams implements IRPass<Procedure, Procedure> {
    /**
     * An instance of this pass, naming slots {@code __SSA<K>}.
     */
    public static final LowerBlockParams INSTANCE = new LowerBlockParams("__SSA");

    private final String slotPrefix;

    /**
     * Construct an instance of this pass.
     *
     * @param slotPrefix The prefix of slot variable names.
     */
    public LowerBlockParams(String slotPrefix) {
        this.slotPrefix = slotPrefix;
    }

    @Override
    public Procedure run(Procedure proc) {
        Set<String> variables = IRUtils.variableNames(proc);
        Map<String, Block> byLabel = new HashMap<>();
        for (Block block : proc.getBlocks()) {
            for (Block.Param param : block.getParams()) {
                String slot = slotName(param);
                if (variables.contains(slot)) {
                    throw new MalformedIRException(proc.getName(), block.headerString(),
                            "slot variable " + slot + " is already in use");
                }
            }
            byLabel.put(block.getLabel(), block);
        }

        List<Block> blocks = new ArrayList<>();
        for (Block block : proc.getBlocks()) {
            List<Insn> insns = new ArrayList<>();
            for (Block.Param param : block.getParams()) {
                insns.add(Insn.assign(param.id, param.typ, Expr.load(Expr.lvar(slotName(param)))));
            }
            insns.addAll(block.getInsns());
            Terminator terminator = block.getTerminator();
            if (terminator instanceof Terminator.Jump) {
                List<NodeCall> targets = new ArrayList<>();
                Set<String> stored = new HashSet<>();
                for (NodeCall call : ((Terminator.Jump) terminator).targets) {
                    Block target = checkTarget(proc, byLabel, terminator, call);
                    List<Block.Param> params = target.getParams();
                    if (!params.isEmpty() && !stored.add(call.label)) {
                        // the second set of stores would overwrite the first
                        throw new MalformedIRException(proc.getName(), terminator,
                                "jump passes arguments to " + call.label + " more than once");
                    }
                    for (int i = 0; i < params.size(); i++) {
                        Block.Param param = params.get(i);
                        insns.add(Insn.store(Expr.lvar(slotName(param)), call.args.get(i), param.typ));
                    }
                    targets.add(new NodeCall(call.label, Collections.emptyList()));
                }
                terminator = Terminator.jump(targets);
            } else {
                Terminator finalTerminator = terminator;
                terminator.forEachTarget(call -> {
                    if (!call.args.isEmpty()) {
                        throw new MalformedIRException(proc.getName(), finalTerminator,
                                "conditional jump passes arguments to " + call.label);
                    }
                    checkTarget(proc, byLabel, finalTerminator, call);
                });
            }
            blocks.add(new Block(block.getLabel(), Collections.emptyList(), insns, terminator));
        }
        return proc.withBlocks(blocks);
    }

    private String slotName(Block.Param param) {
        return slotPrefix + param.id.index;
    }

    private static Block checkTarget(Procedure proc,
                                     Map<String, Block> byLabel,
                                     Terminator terminator,
                                     NodeCall call) {
        Block target = byLabel.get(call.label);
        if (target == null) {
            throw new MalformedIRException(proc.getName(), terminator, "jump to undefined block " + call.label);
        }
        if (target.getParams().size() != call.args.size()) {
            throw new MalformedIRException(proc.getName(), terminator,
                    "block " + call.label + " takes " + target.getParams().size()
                            + " argument(s), but is passed " + call.args.size());
        }
        return target;
    }

    @Override
    public String toString() {
        return "LowerBlockParams";
    }
}
