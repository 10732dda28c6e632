package io.github.eutro.textir.passes.form;

import io.github.eutro.textir.passes.IRPass;
import io.github.eutro.textir.ssa.*;
import io.github.eutro.textir.util.FreshNames;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which hoists calls out of other expressions, so that every call is the whole
 * right-hand side of its own assignment (or evaluation) and is referred to by identifier
 * afterwards.
 * <p>
 * Calls are hoisted depth-first and left to right, so they run in exactly the order they
 * did before. The hoisted assignments are inserted just before the instruction or terminator
 * they were taken from.
 * <p>
 * Conditional terminators are flattened too: calls in the atoms of the condition are hoisted
 * left to right, followed by those in the then branch and then the else branch. Every atom of
 * a condition then names a plain value, so {@link EliminateShortCircuits} can drop atoms from
 * a path without dropping the calls they made.
 */
public class FlattenCalls implements IRPass<Procedure, Procedure> {
    /**
     * An instance of this pass.
     */
    public static final FlattenCalls INSTANCE = new FlattenCalls();

    @Override
    public Procedure run(Procedure proc) {
        FreshNames names = FreshNames.forProcedure(proc);
        List<Block> blocks = new ArrayList<>();
        for (Block block : proc.getBlocks()) {
            List<Insn> insns = new ArrayList<>();
            Hoister hoister = new Hoister(names, insns);
            for (Insn insn : block.getInsns()) {
                Insn flat = insn.accept(hoister.insnFlattener);
                insns.add(flat);
            }
            Terminator terminator = block.getTerminator().accept(hoister.terminatorFlattener);
            blocks.add(new Block(block.getLabel(), block.getParams(), insns, terminator));
        }
        return proc.withBlocks(blocks);
    }

    @Override
    public String toString() {
        return "FlattenCalls";
    }

    private static class Hoister extends Expr.Transformer {
        private final FreshNames names;
        private final List<Insn> out;

        Hoister(FreshNames names, List<Insn> out) {
            this.names = names;
            this.out = out;
        }

        @Override
        public Expr visitCall(Expr.Call expr) {
            List<Expr> args = transformAll(expr.args);
            Ident id = names.freshIdent();
            out.add(Insn.assign(id, Expr.call(expr.callee, args)));
            return Expr.var(id);
        }

        // a call at the top is left where it is, only its arguments are flattened
        Expr transformExceptTop(Expr expr) {
            if (expr instanceof Expr.Call) {
                Expr.Call call = (Expr.Call) expr;
                return Expr.call(call.callee, transformAll(call.args));
            }
            return transform(expr);
        }

        final Insn.Visitor<Insn> insnFlattener = new Insn.Visitor<Insn>() {
            @Override
            public Insn visitAssign(Insn.Assign insn) {
                return Insn.assign(insn.id, insn.typ, transformExceptTop(insn.expr));
            }

            @Override
            public Insn visitStore(Insn.Store insn) {
                return insn.mapExprs(Hoister.this::transform);
            }

            @Override
            public Insn visitPrune(Insn.Prune insn) {
                return insn.mapExprs(Hoister.this::transform);
            }

            @Override
            public Insn visitEval(Insn.Eval insn) {
                return Insn.eval(transformExceptTop(insn.expr));
            }
        };

        final Terminator.Visitor<Terminator> terminatorFlattener = new Terminator.Visitor<Terminator>() {
            @Override
            public Terminator visitJump(Terminator.Jump jump) {
                return jump.mapExprs(Hoister.this::transform);
            }

            @Override
            public Terminator visitIf(Terminator.If anIf) {
                return anIf.mapExprs(Hoister.this::transform);
            }

            @Override
            public Terminator visitRet(Terminator.Ret ret) {
                return ret.mapExprs(Hoister.this::transform);
            }

            @Override
            public Terminator visitThrow(Terminator.Throw aThrow) {
                return aThrow.mapExprs(Hoister.this::transform);
            }

            @Override
            public Terminator visitUnreachable(Terminator.Unreachable unreachable) {
                return unreachable;
            }
        };
    }
}
