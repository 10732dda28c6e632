package io.github.eutro.textir.ssa;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * The guard of a conditional terminator, evaluated with short-circuiting.
 */
public abstract class BoolExpr {
    BoolExpr() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Rebuild this condition with each atom mapped by the given function, left to right.
     *
     * @param f The function.
     * @return The new condition.
     */
    public abstract BoolExpr mapAtoms(UnaryOperator<Expr> f);

    /**
     * Call the consumer on each atom of this condition, left to right.
     *
     * @param consumer The consumer.
     */
    public abstract void forEachAtom(Consumer<Expr> consumer);

    public static Atom atom(Expr expr) {
        return new Atom(expr);
    }

    public static Not not(BoolExpr operand) {
        return new Not(operand);
    }

    public static And and(BoolExpr lhs, BoolExpr rhs) {
        return new And(lhs, rhs);
    }

    public static Or or(BoolExpr lhs, BoolExpr rhs) {
        return new Or(lhs, rhs);
    }

    public interface Visitor<R> {
        R visitAtom(Atom atom);

        R visitNot(Not not);

        R visitAnd(And and);

        R visitOr(Or or);
    }

    public static final class Atom extends BoolExpr {
        public final Expr expr;

        Atom(Expr expr) {
            this.expr = Objects.requireNonNull(expr);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAtom(this);
        }

        @Override
        public BoolExpr mapAtoms(UnaryOperator<Expr> f) {
            return new Atom(f.apply(expr));
        }

        @Override
        public void forEachAtom(Consumer<Expr> consumer) {
            consumer.accept(expr);
        }

        @Override
        public String toString() {
            return expr.toString();
        }
    }

    public static final class Not extends BoolExpr {
        public final BoolExpr operand;

        Not(BoolExpr operand) {
            this.operand = Objects.requireNonNull(operand);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNot(this);
        }

        @Override
        public BoolExpr mapAtoms(UnaryOperator<Expr> f) {
            return new Not(operand.mapAtoms(f));
        }

        @Override
        public void forEachAtom(Consumer<Expr> consumer) {
            operand.forEachAtom(consumer);
        }

        @Override
        public String toString() {
            return operand instanceof Atom ? "!" + operand : "!(" + operand + ")";
        }
    }

    public static final class And extends BoolExpr {
        public final BoolExpr lhs;
        public final BoolExpr rhs;

        And(BoolExpr lhs, BoolExpr rhs) {
            this.lhs = Objects.requireNonNull(lhs);
            this.rhs = Objects.requireNonNull(rhs);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnd(this);
        }

        @Override
        public BoolExpr mapAtoms(UnaryOperator<Expr> f) {
            BoolExpr newLhs = lhs.mapAtoms(f);
            return new And(newLhs, rhs.mapAtoms(f));
        }

        @Override
        public void forEachAtom(Consumer<Expr> consumer) {
            lhs.forEachAtom(consumer);
            rhs.forEachAtom(consumer);
        }

        @Override
        public String toString() {
            return operand(lhs) + " && " + operand(rhs);
        }

        private static String operand(BoolExpr e) {
            return e instanceof Or ? "(" + e + ")" : e.toString();
        }
    }

    public static final class Or extends BoolExpr {
        public final BoolExpr lhs;
        public final BoolExpr rhs;

        Or(BoolExpr lhs, BoolExpr rhs) {
            this.lhs = Objects.requireNonNull(lhs);
            this.rhs = Objects.requireNonNull(rhs);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOr(this);
        }

        @Override
        public BoolExpr mapAtoms(UnaryOperator<Expr> f) {
            BoolExpr newLhs = lhs.mapAtoms(f);
            return new Or(newLhs, rhs.mapAtoms(f));
        }

        @Override
        public void forEachAtom(Consumer<Expr> consumer) {
            lhs.forEachAtom(consumer);
            rhs.forEachAtom(consumer);
        }

        @Override
        public String toString() {
            return lhs + " || " + rhs;
        }
    }
}
