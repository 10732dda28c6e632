package io.github.eutro.textir.passes.form;

import io.github.eutro.textir.ssa.BoolExpr;
import io.github.eutro.textir.ssa.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The outcomes of a short-circuiting condition, as lists of atom tests in evaluation order.
 * <p>
 * For {@code a && b}, the true leaves test {@code a} and then {@code b}. A false leaf of {@code b}
 * does not repeat the tests of {@code a} that led there, and likewise for the true leaves of
 * {@code b} in {@code a || b}. Leaving those tests out makes for fewer, shorter leaves; the atoms
 * dropped are only left unconstrained, never contradicted.
 */
public final class Leaves {
    /**
     * The ways the condition can be true.
     */
    public final List<List<Test>> trues;
    /**
     * The ways the condition can be false.
     */
    public final List<List<Test>> falses;

    private Leaves(List<List<Test>> trues, List<List<Test>> falses) {
        this.trues = Collections.unmodifiableList(trues);
        this.falses = Collections.unmodifiableList(falses);
    }

    /**
     * Compute the leaves of a condition.
     *
     * @param condition The condition.
     * @return The leaves.
     */
    public static Leaves of(BoolExpr condition) {
        return condition.accept(new BoolExpr.Visitor<Leaves>() {
            @Override
            public Leaves visitAtom(BoolExpr.Atom atom) {
                return new Leaves(
                        singlePath(new Test(atom.expr, true)),
                        singlePath(new Test(atom.expr, false)));
            }

            @Override
            public Leaves visitNot(BoolExpr.Not not) {
                Leaves operand = of(not.operand);
                return new Leaves(new ArrayList<>(operand.falses), new ArrayList<>(operand.trues));
            }

            @Override
            public Leaves visitAnd(BoolExpr.And and) {
                Leaves lhs = of(and.lhs);
                Leaves rhs = of(and.rhs);
                return new Leaves(product(lhs.trues, rhs.trues), concat(lhs.falses, rhs.falses));
            }

            @Override
            public Leaves visitOr(BoolExpr.Or or) {
                Leaves lhs = of(or.lhs);
                Leaves rhs = of(or.rhs);
                return new Leaves(concat(lhs.trues, rhs.trues), product(lhs.falses, rhs.falses));
            }
        });
    }

    private static List<List<Test>> singlePath(Test test) {
        List<List<Test>> paths = new ArrayList<>();
        paths.add(Collections.singletonList(test));
        return paths;
    }

    private static List<List<Test>> concat(List<List<Test>> xs, List<List<Test>> ys) {
        List<List<Test>> paths = new ArrayList<>(xs);
        paths.addAll(ys);
        return paths;
    }

    private static List<List<Test>> product(List<List<Test>> xs, List<List<Test>> ys) {
        List<List<Test>> paths = new ArrayList<>();
        for (List<Test> x : xs) {
            for (List<Test> y : ys) {
                List<Test> path = new ArrayList<>(x);
                path.addAll(y);
                paths.add(Collections.unmodifiableList(path));
            }
        }
        return paths;
    }

    /**
     * A test of one atom: the atom, and whether it holds on this path.
     */
    public static final class Test {
        public final Expr atom;
        public final boolean holds;

        public Test(Expr atom, boolean holds) {
            this.atom = Objects.requireNonNull(atom);
            this.holds = holds;
        }

        @Override
        public String toString() {
            return holds ? atom.toString() : "!" + atom;
        }
    }
}
