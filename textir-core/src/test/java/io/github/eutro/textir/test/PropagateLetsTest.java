package io.github.eutro.textir.test;

import io.github.eutro.textir.passes.MalformedIRException;
import io.github.eutro.textir.passes.opts.EliminateDeadLets;
import io.github.eutro.textir.passes.opts.PropagateLets;
import io.github.eutro.textir.ssa.*;
import io.github.eutro.textir.util.IRUtils;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Map;

import static io.github.eutro.textir.ssa.Expr.*;
import static io.github.eutro.textir.ssa.IRBuilder.param;
import static io.github.eutro.textir.ssa.Terminator.*;
import static io.github.eutro.textir.test.Utils.lines;
import static org.junit.jupiter.api.Assertions.*;

public class PropagateLetsTest {
    static Procedure letChains() {
        return new IRBuilder("f", Typ.INT)
                .formal("x", Typ.INT).formal("y", Typ.INT)
                .block("entry")
                .load(0, Typ.INT, "x")
                .load(1, Typ.INT, "y")
                .assign(3, builtin("__sil_mult_int", var(0), var(1)))
                .assign(4, builtin("__sil_minusa", var(3), var(0)))
                .insertTerminator(jump(NodeCall.of("lab", var(4))))
                .block("lab", param(5, Typ.INT))
                .assign(6, builtin("__sil_neg", var(1)))
                .assign(7, builtin("__sil_plusa", var(6), var(3)))
                .assign(8, intConst(42))
                .insertTerminator(ret(var(7)))
                .build();
    }

    @Test
    void pureAssignmentsAreSubstituted() {
        Procedure proc = PropagateLets.INSTANCE.run(letChains());
        assertEquals(Arrays.asList(
                "#entry:",
                "n0:int = load &x",
                "n1:int = load &y",
                "jmp lab(__sil_minusa(__sil_mult_int(n0, n1), n0))",
                "#lab(n5: int):",
                "ret __sil_plusa(__sil_neg(n1), __sil_mult_int(n0, n1))"
        ), lines(proc));
        for (long x = -2; x <= 2; x++) {
            assertEquals(Interpreter.run(letChains(), x, 5), Interpreter.run(proc, x, 5));
        }
    }

    @Test
    void constantExpressionsFold() {
        Procedure proc = new IRBuilder("p", Typ.INT)
                .block("entry")
                .assign(0, intConst(1))
                .assign(1, intConst(2))
                .assign(2, builtin("__sil_plusa", var(0), var(1)))
                .assign(3, builtin("__sil_mult_int", var(2), intConst(3)))
                .insertTerminator(ret(var(3)))
                .build();
        assertEquals(Arrays.asList(
                "#entry:",
                "ret __sil_mult_int(__sil_plusa(1, 2), 3)"
        ), lines(PropagateLets.INSTANCE.run(proc)));
    }

    @Test
    void loadsAndCallsAreKept() {
        Procedure proc = new IRBuilder("p", Typ.INT)
                .formal("x", Typ.INT)
                .block("entry")
                .load(0, Typ.INT, "x")
                .assign(1, call("f", var(0)))
                .assign(2, builtin("__sil_plusa", var(0), intConst(1)))
                .assign(3, call("g", var(2)))
                .insertTerminator(ret(intConst(0)))
                .build();
        assertEquals(Arrays.asList(
                "#entry:",
                "n0:int = load &x",
                "n1 = f(n0)",
                "n3 = g(__sil_plusa(n0, 1))",
                "ret 0"
        ), lines(PropagateLets.INSTANCE.run(proc)));
    }

    @Test
    void guardsAreSubstituted() {
        Procedure proc = new IRBuilder("p", Typ.INT)
                .formal("x", Typ.INT)
                .block("entry")
                .load(0, Typ.INT, "x")
                .assign(1, not(var(0)))
                .insert(Insn.prune(var(1)))
                .assign(2, builtin("__sil_neg", var(0)))
                .insertTerminator(ifThenElse(BoolExpr.atom(var(2)), ret(var(1)), jumpTo("other")))
                .block("other")
                .insertTerminator(ret(intConst(0)))
                .build();
        assertEquals(Arrays.asList(
                "#entry:",
                "n0:int = load &x",
                "prune __sil_lnot(n0)",
                "if __sil_neg(n0) then ret __sil_lnot(n0) else jmp other",
                "#other:",
                "ret 0"
        ), lines(PropagateLets.INSTANCE.run(proc)));
    }

    @Test
    void noUnusedPureAssignmentRemains() {
        Procedure proc = PropagateLets.INSTANCE.run(letChains());
        Map<Ident, Integer> references = IRUtils.countReferences(proc);
        for (Block block : proc.getBlocks()) {
            for (Insn insn : block.getInsns()) {
                if (insn instanceof Insn.Assign && ((Insn.Assign) insn).expr.isPure()) {
                    assertTrue(references.get(((Insn.Assign) insn).id) > 0, insn::toString);
                }
            }
        }
    }

    @Test
    void circularDefinitionsAreRejected() {
        Procedure proc = new IRBuilder("p", Typ.INT)
                .block("entry")
                .assign(1, builtin("__sil_plusa", var(2), intConst(1)))
                .assign(2, builtin("__sil_plusa", var(1), intConst(1)))
                .insertTerminator(ret(var(1)))
                .build();
        MalformedIRException e = assertThrows(MalformedIRException.class, () -> PropagateLets.INSTANCE.run(proc));
        assertEquals("p", e.getProcedure());
    }

    @Test
    void duplicateBindingsAreRejected() {
        Procedure proc = new IRBuilder("p", Typ.INT)
                .block("entry")
                .assign(1, intConst(1))
                .insertTerminator(jump(NodeCall.of("next", intConst(2))))
                .block("next", param(1, Typ.INT))
                .insertTerminator(ret(var(1)))
                .build();
        MalformedIRException e = assertThrows(MalformedIRException.class, () -> PropagateLets.INSTANCE.run(proc));
        assertEquals("#next(n1: int):", e.getElement());
    }

    @Test
    void deadChainsAreRemovedWhole() {
        Procedure dead = new IRBuilder("p", Typ.INT)
                .block("entry")
                .assign(1, intConst(1))
                .assign(2, builtin("__sil_plusa", var(1), intConst(1)))
                .assign(3, builtin("__sil_plusa", var(2), intConst(1)))
                .insertTerminator(ret(intConst(0)))
                .build();
        assertEquals(Arrays.asList("#entry:", "ret 0"), lines(EliminateDeadLets.INSTANCE.run(dead)));

        Procedure used = new IRBuilder("p", Typ.INT)
                .block("entry")
                .assign(1, intConst(1))
                .assign(2, builtin("__sil_plusa", var(1), intConst(1)))
                .assign(3, call("g", var(2)))
                .insertTerminator(ret(intConst(0)))
                .build();
        assertEquals(used.toString(), EliminateDeadLets.INSTANCE.run(used).toString());
    }
}
