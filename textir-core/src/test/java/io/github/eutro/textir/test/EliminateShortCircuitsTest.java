package io.github.eutro.textir.test;

import io.github.eutro.textir.passes.form.EliminateShortCircuits;
import io.github.eutro.textir.passes.form.Leaves;
import io.github.eutro.textir.ssa.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.eutro.textir.ssa.Expr.*;
import static io.github.eutro.textir.ssa.Terminator.*;
import static io.github.eutro.textir.test.Utils.atom;
import static io.github.eutro.textir.test.Utils.lines;
import static org.junit.jupiter.api.Assertions.*;

public class EliminateShortCircuitsTest {
    private static IRBuilder loading(String name, int count) {
        IRBuilder ib = new IRBuilder(name, Typ.INT);
        for (int i = 1; i <= count; i++) {
            ib.formal("b" + i, Typ.INT);
        }
        ib.block("entry");
        for (int i = 1; i <= count; i++) {
            ib.load(i, Typ.INT, "b" + i);
        }
        return ib;
    }

    static Procedure f() {
        return loading("f", 5)
                .insertTerminator(ifThenElse(
                        BoolExpr.and(BoolExpr.and(atom(1), atom(2)), atom(3)),
                        jumpTo("lab1"),
                        jumpTo("lab2")))
                .block("lab1")
                .insertTerminator(ret(intConst(1)))
                .block("lab2")
                .insertTerminator(ifThenElse(
                        BoolExpr.or(atom(2), BoolExpr.and(atom(1), atom(3))),
                        jumpTo("lab3"),
                        jumpTo("lab4")))
                .block("lab3")
                .insertTerminator(ifThenElse(
                        BoolExpr.and(atom(1), BoolExpr.or(atom(2), BoolExpr.and(atom(3), BoolExpr.or(atom(4), atom(5))))),
                        jumpTo("lab4"),
                        jumpTo("lab5")))
                .block("lab4")
                .insertTerminator(ret(intConst(2)))
                .block("lab5")
                .insertTerminator(ret(intConst(3)))
                .build();
    }

    static Procedure g() {
        return loading("g", 3)
                .insertTerminator(ifThenElse(
                        BoolExpr.and(BoolExpr.or(atom(1), atom(2)), atom(3)),
                        jumpTo("lab1"),
                        jumpTo("if2")))
                .block("lab1")
                .insertTerminator(ret(intConst(1)))
                .block("if2")
                .insertTerminator(ret(intConst(2)))
                .build();
    }

    static Procedure h() {
        return loading("h", 3)
                .insertTerminator(ifThenElse(
                        BoolExpr.and(BoolExpr.and(atom(1), atom(2)), atom(3)),
                        ret(intConst(1)),
                        ifThenElse(
                                BoolExpr.or(atom(2), BoolExpr.and(atom(1), atom(3))),
                                ret(intConst(2)),
                                ret(intConst(3)))))
                .build();
    }

    @Test
    void conditionalJumps() {
        assertEquals(Arrays.asList(
                "#entry:",
                "n1:int = load &b1",
                "n2:int = load &b2",
                "n3:int = load &b3",
                "n4:int = load &b4",
                "n5:int = load &b5",
                "jmp lab1, if0, if1, if2",
                "#if0:",
                "prune __sil_lnot(n1)",
                "jmp lab2",
                "#if1:",
                "prune __sil_lnot(n2)",
                "jmp lab2",
                "#if2:",
                "prune __sil_lnot(n3)",
                "jmp lab2",
                "#lab1:",
                "prune n1",
                "prune n2",
                "prune n3",
                "ret 1",
                "#lab2:",
                "jmp if5, if6, if3, if4",
                "#if5:",
                "prune n2",
                "jmp lab3",
                "#if6:",
                "prune n1",
                "prune n3",
                "jmp lab3",
                "#if3:",
                "prune __sil_lnot(n2)",
                "prune __sil_lnot(n1)",
                "jmp lab4",
                "#if4:",
                "prune __sil_lnot(n2)",
                "prune __sil_lnot(n3)",
                "jmp lab4",
                "#lab3:",
                "jmp if10, if11, if12, if7, if8, if9",
                "#if10:",
                "prune n1",
                "prune n2",
                "jmp lab4",
                "#if11:",
                "prune n1",
                "prune n3",
                "prune n4",
                "jmp lab4",
                "#if12:",
                "prune n1",
                "prune n3",
                "prune n5",
                "jmp lab4",
                "#if7:",
                "prune __sil_lnot(n1)",
                "jmp lab5",
                "#if8:",
                "prune __sil_lnot(n2)",
                "prune __sil_lnot(n3)",
                "jmp lab5",
                "#if9:",
                "prune __sil_lnot(n2)",
                "prune __sil_lnot(n4)",
                "prune __sil_lnot(n5)",
                "jmp lab5",
                "#lab4:",
                "ret 2",
                "#lab5:",
                "ret 3"
        ), lines(EliminateShortCircuits.INSTANCE.run(f())));
    }

    @Test
    void existingLabelsAreSkipped() {
        assertEquals(Arrays.asList(
                "#entry:",
                "n1:int = load &b1",
                "n2:int = load &b2",
                "n3:int = load &b3",
                "jmp if3, if4, if0, if1",
                "#if3:",
                "prune n1",
                "prune n3",
                "jmp lab1",
                "#if4:",
                "prune n2",
                "prune n3",
                "jmp lab1",
                "#if0:",
                "prune __sil_lnot(n1)",
                "prune __sil_lnot(n2)",
                "jmp if2",
                "#if1:",
                "prune __sil_lnot(n3)",
                "jmp if2",
                "#lab1:",
                "ret 1",
                "#if2:",
                "ret 2"
        ), lines(EliminateShortCircuits.INSTANCE.run(g())));
    }

    @Test
    void nestedConditionals() {
        assertEquals(Arrays.asList(
                "#entry:",
                "n1:int = load &b1",
                "n2:int = load &b2",
                "n3:int = load &b3",
                "jmp if7, if4, if5, if6",
                "#if7:",
                "prune n1",
                "prune n2",
                "prune n3",
                "ret 1",
                "#if4:",
                "prune __sil_lnot(n1)",
                "jmp if2, if3, if0, if1",
                "#if5:",
                "prune __sil_lnot(n2)",
                "jmp if2, if3, if0, if1",
                "#if6:",
                "prune __sil_lnot(n3)",
                "jmp if2, if3, if0, if1",
                "#if2:",
                "prune n2",
                "ret 2",
                "#if3:",
                "prune n1",
                "prune n3",
                "ret 2",
                "#if0:",
                "prune __sil_lnot(n2)",
                "prune __sil_lnot(n1)",
                "ret 3",
                "#if1:",
                "prune __sil_lnot(n2)",
                "prune __sil_lnot(n3)",
                "ret 3"
        ), lines(EliminateShortCircuits.INSTANCE.run(h())));
    }

    @Test
    void pythonInspired() {
        assertEquals(Arrays.asList(
                "#b0:",
                "n0:int = load &x",
                "jmp b1, if0",
                "#if0:",
                "prune __sil_lnot(n0)",
                "jmp b2",
                "#b1:",
                "prune n0",
                "n2:int = load &y",
                "jmp if2, if1",
                "#if2:",
                "prune n2",
                "jmp b4(n2)",
                "#if1:",
                "prune __sil_lnot(n2)",
                "jmp b2",
                "#b2:",
                "n5:int = load &z",
                "jmp b5, if3",
                "#if3:",
                "prune __sil_lnot(n5)",
                "jmp b4(n5)",
                "#b5:",
                "prune n5",
                "n8:int = load &t",
                "jmp b4(n8)",
                "#b4(n9: int):",
                "ret n9"
        ), lines(EliminateShortCircuits.INSTANCE.run(Utils.pythonInspired())));
    }

    @Test
    void negatedConditions() {
        Procedure proc = loading("neg", 2)
                .insertTerminator(ifThenElse(
                        BoolExpr.not(BoolExpr.and(atom(1), atom(2))),
                        jumpTo("a"),
                        jumpTo("b")))
                .block("a")
                .insertTerminator(ret(intConst(1)))
                .block("b")
                .insertTerminator(ret(intConst(2)))
                .build();
        Procedure eliminated = EliminateShortCircuits.INSTANCE.run(proc);
        assertEquals(Arrays.asList(
                "#entry:",
                "n1:int = load &b1",
                "n2:int = load &b2",
                "jmp if0, if1, b",
                "#if0:",
                "prune __sil_lnot(n1)",
                "jmp a",
                "#if1:",
                "prune __sil_lnot(n2)",
                "jmp a",
                "#a:",
                "ret 1",
                "#b:",
                "prune n1",
                "prune n2",
                "ret 2"
        ), lines(eliminated));
        assertSameResults(proc, eliminated, 2);
    }

    @Test
    void entryIsNeverInlinedInto() {
        Procedure proc = new IRBuilder("loop", Typ.INT)
                .formal("x", Typ.INT)
                .block("entry")
                .load(0, Typ.INT, "x")
                .insertTerminator(jumpTo("head"))
                .block("head")
                .insertTerminator(ifThenElse(atom(0), jumpTo("exit"), jumpTo("entry")))
                .block("exit")
                .insertTerminator(ret(var(0)))
                .build();
        assertEquals(Arrays.asList(
                "#entry:",
                "n0:int = load &x",
                "jmp head",
                "#head:",
                "jmp exit, if0",
                "#if0:",
                "prune __sil_lnot(n0)",
                "jmp entry",
                "#exit:",
                "prune n0",
                "ret n0"
        ), lines(EliminateShortCircuits.INSTANCE.run(proc)));
    }

    @Test
    void customLabelPrefix() {
        Procedure proc = new EliminateShortCircuits("cond").run(g());
        assertEquals("jmp cond2, cond3, cond0, cond1", proc.getEntry().getTerminator().toString());
        assertNotNull(proc.getBlock("if2"));
        assertNull(proc.getBlock("if0"));
    }

    @Test
    void proceduresWithoutConditionalsAreUnchanged() {
        Procedure proc = FlattenCallsTest.internalCalls().getProcedure("f");
        assertEquals(proc.toString(), EliminateShortCircuits.INSTANCE.run(proc).toString());
    }

    @Test
    void everyOutcomeIsCovered() {
        List<BoolExpr> conditions = Arrays.asList(
                atom(0),
                BoolExpr.not(atom(0)),
                BoolExpr.and(atom(0), atom(1)),
                BoolExpr.or(atom(0), atom(1)),
                BoolExpr.and(BoolExpr.or(atom(0), atom(1)), atom(2)),
                BoolExpr.or(atom(0), BoolExpr.and(atom(1), atom(2))),
                BoolExpr.and(atom(0), BoolExpr.or(atom(1), BoolExpr.and(atom(2), BoolExpr.or(atom(3), atom(0))))),
                BoolExpr.not(BoolExpr.or(BoolExpr.not(atom(0)), BoolExpr.and(atom(1), BoolExpr.not(atom(2))))),
                BoolExpr.or(BoolExpr.and(atom(0), atom(1)), BoolExpr.and(atom(2), atom(3)))
        );
        for (BoolExpr condition : conditions) {
            Leaves leaves = Leaves.of(condition);
            for (int bits = 0; bits < 16; bits++) {
                Map<Ident, Boolean> env = new HashMap<>();
                for (int i = 0; i < 4; i++) {
                    env.put(Ident.of(i), (bits & (1 << i)) != 0);
                }
                boolean outcome = evaluate(condition, env);
                List<List<Leaves.Test>> right = outcome ? leaves.trues : leaves.falses;
                List<List<Leaves.Test>> wrong = outcome ? leaves.falses : leaves.trues;
                String message = condition + " with " + bits;
                assertTrue(right.stream().anyMatch(path -> consistent(path, env)), message);
                assertTrue(wrong.stream().noneMatch(path -> consistent(path, env)), message);
            }
        }
    }

    @Test
    void executionIsPreserved() {
        assertSameResults(f(), EliminateShortCircuits.INSTANCE.run(f()), 5);
        assertSameResults(g(), EliminateShortCircuits.INSTANCE.run(g()), 3);
        assertSameResults(h(), EliminateShortCircuits.INSTANCE.run(h()), 3);
        Procedure python = Utils.pythonInspired();
        assertSameResults(python, EliminateShortCircuits.INSTANCE.run(python), 4);
    }

    static void assertSameResults(Procedure before, Procedure after, int arity) {
        for (int bits = 0; bits < 1 << arity; bits++) {
            long[] args = new long[arity];
            for (int i = 0; i < arity; i++) {
                args[i] = (bits & (1 << i)) != 0 ? i + 1 : 0;
            }
            assertEquals(Interpreter.run(before, args), Interpreter.run(after, args),
                    () -> "with " + Arrays.toString(args));
        }
    }

    private static boolean consistent(List<Leaves.Test> path, Map<Ident, Boolean> env) {
        for (Leaves.Test test : path) {
            if (env.get(((Expr.Var) test.atom).id) != test.holds) return false;
        }
        return true;
    }

    private static boolean evaluate(BoolExpr condition, Map<Ident, Boolean> env) {
        return condition.accept(new BoolExpr.Visitor<Boolean>() {
            @Override
            public Boolean visitAtom(BoolExpr.Atom atom) {
                return env.get(((Expr.Var) atom.expr).id);
            }

            @Override
            public Boolean visitNot(BoolExpr.Not not) {
                return !evaluate(not.operand, env);
            }

            @Override
            public Boolean visitAnd(BoolExpr.And and) {
                return evaluate(and.lhs, env) && evaluate(and.rhs, env);
            }

            @Override
            public Boolean visitOr(BoolExpr.Or or) {
                return evaluate(or.lhs, env) || evaluate(or.rhs, env);
            }
        });
    }
}
