package io.github.eutro.textir.ssa;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * The instruction ending a {@link Block}.
 */
public abstract class Terminator {
    Terminator() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Rebuild this terminator with each top-level expression mapped by the given function,
     * in textual order. Conditions of nested {@link If ifs} have their atoms mapped.
     *
     * @param f The function.
     * @return The new terminator.
     */
    public abstract Terminator mapExprs(UnaryOperator<Expr> f);

    /**
     * Call the consumer on each top-level expression of this terminator, in the same order
     * as {@link #mapExprs(UnaryOperator)}.
     *
     * @param consumer The consumer.
     */
    public abstract void forEachExpr(Consumer<Expr> consumer);

    /**
     * Call the consumer on every jump target of this terminator, including those nested in
     * {@link If} branches, in textual order.
     *
     * @param consumer The consumer.
     */
    public void forEachTarget(Consumer<NodeCall> consumer) {
    }

    public static Jump jump(NodeCall... targets) {
        return new Jump(Arrays.asList(targets));
    }

    public static Jump jump(List<NodeCall> targets) {
        return new Jump(targets);
    }

    /**
     * Construct a jump to the given labels, none of which take arguments.
     *
     * @param labels The labels.
     * @return The jump.
     */
    public static Jump jumpTo(String... labels) {
        List<NodeCall> targets = new ArrayList<>();
        for (String label : labels) {
            targets.add(new NodeCall(label, Collections.emptyList()));
        }
        return new Jump(targets);
    }

    public static If ifThenElse(BoolExpr condition, Terminator thenBranch, Terminator elseBranch) {
        return new If(condition, thenBranch, elseBranch);
    }

    public static Ret ret(Expr expr) {
        return new Ret(expr);
    }

    public static Throw throwing(Expr expr) {
        return new Throw(expr);
    }

    public static Unreachable unreachable() {
        return Unreachable.INSTANCE;
    }

    public interface Visitor<R> {
        R visitJump(Jump jump);

        R visitIf(If anIf);

        R visitRet(Ret ret);

        R visitThrow(Throw aThrow);

        R visitUnreachable(Unreachable unreachable);
    }

    /**
     * An unconditional jump. With several targets, any one of them may be taken.
     */
    public static final class Jump extends Terminator {
        public final List<NodeCall> targets;

        Jump(List<NodeCall> targets) {
            if (targets.isEmpty()) throw new IllegalArgumentException("jump with no targets");
            this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitJump(this);
        }

        @Override
        public Terminator mapExprs(UnaryOperator<Expr> f) {
            List<NodeCall> newTargets = new ArrayList<>(targets.size());
            for (NodeCall target : targets) {
                List<Expr> args = new ArrayList<>(target.args.size());
                for (Expr arg : target.args) {
                    args.add(f.apply(arg));
                }
                newTargets.add(new NodeCall(target.label, args));
            }
            return new Jump(newTargets);
        }

        @Override
        public void forEachExpr(Consumer<Expr> consumer) {
            for (NodeCall target : targets) {
                target.args.forEach(consumer);
            }
        }

        @Override
        public void forEachTarget(Consumer<NodeCall> consumer) {
            targets.forEach(consumer);
        }

        @Override
        public String toString() {
            return targets.stream()
                    .map(Objects::toString)
                    .collect(Collectors.joining(", ", "jmp ", ""));
        }
    }

    /**
     * A conditional, {@code if condition then thenBranch else elseBranch}.
     * Both branches are terminators themselves, so chains of conditions nest.
     */
    public static final class If extends Terminator {
        public final BoolExpr condition;
        public final Terminator thenBranch;
        public final Terminator elseBranch;

        If(BoolExpr condition, Terminator thenBranch, Terminator elseBranch) {
            this.condition = Objects.requireNonNull(condition);
            this.thenBranch = Objects.requireNonNull(thenBranch);
            this.elseBranch = Objects.requireNonNull(elseBranch);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public Terminator mapExprs(UnaryOperator<Expr> f) {
            BoolExpr newCondition = condition.mapAtoms(f);
            Terminator newThen = thenBranch.mapExprs(f);
            return new If(newCondition, newThen, elseBranch.mapExprs(f));
        }

        @Override
        public void forEachExpr(Consumer<Expr> consumer) {
            condition.forEachAtom(consumer);
            thenBranch.forEachExpr(consumer);
            elseBranch.forEachExpr(consumer);
        }

        @Override
        public void forEachTarget(Consumer<NodeCall> consumer) {
            thenBranch.forEachTarget(consumer);
            elseBranch.forEachTarget(consumer);
        }

        @Override
        public String toString() {
            return "if " + condition + " then " + thenBranch + " else " + elseBranch;
        }
    }

    public static final class Ret extends Terminator {
        public final Expr expr;

        Ret(Expr expr) {
            this.expr = Objects.requireNonNull(expr);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRet(this);
        }

        @Override
        public Terminator mapExprs(UnaryOperator<Expr> f) {
            return new Ret(f.apply(expr));
        }

        @Override
        public void forEachExpr(Consumer<Expr> consumer) {
            consumer.accept(expr);
        }

        @Override
        public String toString() {
            return "ret " + expr;
        }
    }

    public static final class Throw extends Terminator {
        public final Expr expr;

        Throw(Expr expr) {
            this.expr = Objects.requireNonNull(expr);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitThrow(this);
        }

        @Override
        public Terminator mapExprs(UnaryOperator<Expr> f) {
            return new Throw(f.apply(expr));
        }

        @Override
        public void forEachExpr(Consumer<Expr> consumer) {
            consumer.accept(expr);
        }

        @Override
        public String toString() {
            return "throw " + expr;
        }
    }

    public static final class Unreachable extends Terminator {
        static final Unreachable INSTANCE = new Unreachable();

        private Unreachable() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnreachable(this);
        }

        @Override
        public Terminator mapExprs(UnaryOperator<Expr> f) {
            return this;
        }

        @Override
        public void forEachExpr(Consumer<Expr> consumer) {
        }

        @Override
        public String toString() {
            return "unreachable";
        }
    }
}
