package io.github.eutro.textir.ssa;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A non-terminating instruction of a {@link Block}.
 */
public abstract class Insn {
    Insn() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Rebuild this instruction with each top-level expression mapped by the given function,
     * in evaluation order.
     *
     * @param f The function.
     * @return The new instruction.
     */
    public abstract Insn mapExprs(UnaryOperator<Expr> f);

    /**
     * Call the consumer on each top-level expression of this instruction, in evaluation order.
     *
     * @param consumer The consumer.
     */
    public abstract void forEachExpr(Consumer<Expr> consumer);

    public static Assign assign(Ident id, @Nullable Typ typ, Expr expr) {
        return new Assign(id, typ, expr);
    }

    public static Assign assign(Ident id, Expr expr) {
        return new Assign(id, null, expr);
    }

    public static Store store(Expr address, Expr value, @Nullable Typ typ) {
        return new Store(address, value, typ);
    }

    public static Prune prune(Expr condition) {
        return new Prune(condition);
    }

    public static Eval eval(Expr expr) {
        return new Eval(expr);
    }

    public interface Visitor<R> {
        R visitAssign(Assign insn);

        R visitStore(Store insn);

        R visitPrune(Prune insn);

        R visitEval(Eval insn);
    }

    /**
     * Binds a fresh identifier to the value of an expression, {@code id[:typ] = expr}.
     */
    public static final class Assign extends Insn {
        public final Ident id;
        @Nullable
        public final Typ typ;
        public final Expr expr;

        Assign(Ident id, @Nullable Typ typ, Expr expr) {
            this.id = Objects.requireNonNull(id);
            this.typ = typ;
            this.expr = Objects.requireNonNull(expr);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssign(this);
        }

        @Override
        public Insn mapExprs(UnaryOperator<Expr> f) {
            return new Assign(id, typ, f.apply(expr));
        }

        @Override
        public void forEachExpr(Consumer<Expr> consumer) {
            consumer.accept(expr);
        }

        @Override
        public String toString() {
            return id + (typ == null ? "" : ":" + typ) + " = " + expr;
        }
    }

    /**
     * Writes a value to memory, {@code store address <- value[:typ]}.
     */
    public static final class Store extends Insn {
        public final Expr address;
        public final Expr value;
        @Nullable
        public final Typ typ;

        Store(Expr address, Expr value, @Nullable Typ typ) {
            this.address = Objects.requireNonNull(address);
            this.value = Objects.requireNonNull(value);
            this.typ = typ;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStore(this);
        }

        @Override
        public Insn mapExprs(UnaryOperator<Expr> f) {
            Expr newAddress = f.apply(address);
            return new Store(newAddress, f.apply(value), typ);
        }

        @Override
        public void forEachExpr(Consumer<Expr> consumer) {
            consumer.accept(address);
            consumer.accept(value);
        }

        @Override
        public String toString() {
            return "store " + address + " <- " + value + (typ == null ? "" : ":" + typ);
        }
    }

    /**
     * Asserts that a condition holds on this path; has no other effect.
     */
    public static final class Prune extends Insn {
        public final Expr condition;

        Prune(Expr condition) {
            this.condition = Objects.requireNonNull(condition);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPrune(this);
        }

        @Override
        public Insn mapExprs(UnaryOperator<Expr> f) {
            return new Prune(f.apply(condition));
        }

        @Override
        public void forEachExpr(Consumer<Expr> consumer) {
            consumer.accept(condition);
        }

        @Override
        public String toString() {
            return "prune " + condition;
        }
    }

    /**
     * Evaluates an expression, usually a call, only for its effects.
     */
    public static final class Eval extends Insn {
        public final Expr expr;

        Eval(Expr expr) {
            this.expr = Objects.requireNonNull(expr);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEval(this);
        }

        @Override
        public Insn mapExprs(UnaryOperator<Expr> f) {
            return new Eval(f.apply(expr));
        }

        @Override
        public void forEachExpr(Consumer<Expr> consumer) {
            consumer.accept(expr);
        }

        @Override
        public String toString() {
            return "_ = " + expr;
        }
    }
}
