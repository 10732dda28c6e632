package io.github.eutro.textir.ssa;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An expression tree.
 * <p>
 * Expressions are values: they hold no reference to the instruction or block they appear in,
 * and the same tree may be shared by several instructions.
 * <p>
 * Identifier references, addresses, literals, field and index accesses and {@link Builtin builtins}
 * are pure. {@link Load Loads} read memory and {@link Call calls} may do anything, so neither may be
 * duplicated, reordered or dropped.
 */
public abstract class Expr {
    /**
     * The logical negation builtin, used to prune the false side of a condition.
     */
    public static final String LNOT = "__sil_lnot";

    Expr() {
    }

    /**
     * Visit this expression.
     *
     * @param visitor The visitor.
     * @param <R>     The result type.
     * @return The result of the visitor.
     */
    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Get the direct subexpressions of this expression, in evaluation order.
     *
     * @return The subexpressions.
     */
    public abstract List<Expr> children();

    /**
     * Get whether this expression is pure, i.e. whether it contains no loads and no calls.
     *
     * @return Whether this is pure.
     */
    public boolean isPure() {
        for (Expr child : children()) {
            if (!child.isPure()) return false;
        }
        return true;
    }

    /**
     * Get whether this expression contains a call anywhere, including at the top.
     *
     * @return Whether a call is present.
     */
    public boolean containsCall() {
        for (Expr child : children()) {
            if (child.containsCall()) return true;
        }
        return false;
    }

    public static Var var(Ident id) {
        return new Var(id);
    }

    public static Var var(int index) {
        return new Var(Ident.of(index));
    }

    public static LVar lvar(String name) {
        return new LVar(name);
    }

    public static Const intConst(long value) {
        return new Const(Const.Kind.INT, value);
    }

    public static Const floatConst(double value) {
        return new Const(Const.Kind.FLOAT, value);
    }

    public static Const strConst(String value) {
        return new Const(Const.Kind.STRING, value);
    }

    public static Const nullConst() {
        return Const.NULL;
    }

    public static Load load(Expr address) {
        return new Load(address);
    }

    public static Field field(Expr base, String name) {
        return new Field(base, name);
    }

    public static Index index(Expr base, Expr offset) {
        return new Index(base, offset);
    }

    public static Builtin builtin(String name, Expr... args) {
        return new Builtin(name, Arrays.asList(args));
    }

    public static Builtin builtin(String name, List<Expr> args) {
        return new Builtin(name, args);
    }

    public static Builtin not(Expr operand) {
        return new Builtin(LNOT, Collections.singletonList(operand));
    }

    public static Call call(String callee, Expr... args) {
        return new Call(callee, Arrays.asList(args));
    }

    public static Call call(String callee, List<Expr> args) {
        return new Call(callee, args);
    }

    /**
     * A visitor over the kinds of expression.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        R visitVar(Var expr);

        R visitLVar(LVar expr);

        R visitConst(Const expr);

        R visitLoad(Load expr);

        R visitField(Field expr);

        R visitIndex(Index expr);

        R visitBuiltin(Builtin expr);

        R visitCall(Call expr);
    }

    /**
     * A visitor which rebuilds an expression bottom-up, left to right.
     * <p>
     * Subclasses override the cases they want to rewrite, and call {@link #transform(Expr)}
     * to rewrite children.
     */
    public static class Transformer implements Visitor<Expr> {
        public Expr transform(Expr expr) {
            return expr.accept(this);
        }

        public List<Expr> transformAll(List<Expr> exprs) {
            List<Expr> out = new ArrayList<>(exprs.size());
            for (Expr expr : exprs) {
                out.add(transform(expr));
            }
            return out;
        }

        @Override
        public Expr visitVar(Var expr) {
            return expr;
        }

        @Override
        public Expr visitLVar(LVar expr) {
            return expr;
        }

        @Override
        public Expr visitConst(Const expr) {
            return expr;
        }

        @Override
        public Expr visitLoad(Load expr) {
            return new Load(transform(expr.address));
        }

        @Override
        public Expr visitField(Field expr) {
            return new Field(transform(expr.base), expr.name);
        }

        @Override
        public Expr visitIndex(Index expr) {
            Expr base = transform(expr.base);
            return new Index(base, transform(expr.offset));
        }

        @Override
        public Expr visitBuiltin(Builtin expr) {
            return new Builtin(expr.name, transformAll(expr.args));
        }

        @Override
        public Expr visitCall(Call expr) {
            return new Call(expr.callee, transformAll(expr.args));
        }
    }

    /**
     * A reference to a local identifier.
     */
    public static final class Var extends Expr {
        public final Ident id;

        Var(Ident id) {
            this.id = Objects.requireNonNull(id);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVar(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.emptyList();
        }

        @Override
        public String toString() {
            return id.toString();
        }
    }

    /**
     * The address of a named program variable, {@code &x}.
     */
    public static final class LVar extends Expr {
        public final String name;

        LVar(String name) {
            this.name = Objects.requireNonNull(name);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLVar(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.emptyList();
        }

        @Override
        public String toString() {
            return "&" + name;
        }
    }

    /**
     * A literal.
     */
    public static final class Const extends Expr {
        static final Const NULL = new Const(Kind.NULL, null);

        public enum Kind {
            INT,
            FLOAT,
            STRING,
            NULL,
        }

        public final Kind kind;
        public final Object value;

        Const(Kind kind, Object value) {
            this.kind = kind;
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConst(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.emptyList();
        }

        @Override
        public String toString() {
            switch (kind) {
                case STRING:
                    return '"' + ((String) value).replace("\\", "\\\\").replace("\"", "\\\"") + '"';
                case NULL:
                    return "null";
                default:
                    return String.valueOf(value);
            }
        }
    }

    /**
     * A read from memory.
     */
    public static final class Load extends Expr {
        public final Expr address;

        Load(Expr address) {
            this.address = Objects.requireNonNull(address);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLoad(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.singletonList(address);
        }

        @Override
        public boolean isPure() {
            return false;
        }

        @Override
        public String toString() {
            return "load " + address;
        }
    }

    /**
     * The address of a field, {@code base.name}.
     */
    public static final class Field extends Expr {
        public final Expr base;
        public final String name;

        Field(Expr base, String name) {
            this.base = Objects.requireNonNull(base);
            this.name = Objects.requireNonNull(name);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitField(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.singletonList(base);
        }

        @Override
        public String toString() {
            return base + "." + name;
        }
    }

    /**
     * The address of an array element, {@code base[offset]}.
     */
    public static final class Index extends Expr {
        public final Expr base;
        public final Expr offset;

        Index(Expr base, Expr offset) {
            this.base = Objects.requireNonNull(base);
            this.offset = Objects.requireNonNull(offset);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIndex(this);
        }

        @Override
        public List<Expr> children() {
            return Arrays.asList(base, offset);
        }

        @Override
        public String toString() {
            return base + "[" + offset + "]";
        }
    }

    /**
     * A primitive operation, such as arithmetic or logical negation.
     */
    public static final class Builtin extends Expr {
        public final String name;
        public final List<Expr> args;

        Builtin(String name, List<Expr> args) {
            this.name = Objects.requireNonNull(name);
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBuiltin(this);
        }

        @Override
        public List<Expr> children() {
            return args;
        }

        @Override
        public String toString() {
            return applicationString(name, args);
        }
    }

    /**
     * A call to a procedure, declared or defined.
     */
    public static final class Call extends Expr {
        public final String callee;
        public final List<Expr> args;

        Call(String callee, List<Expr> args) {
            this.callee = Objects.requireNonNull(callee);
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public List<Expr> children() {
            return args;
        }

        @Override
        public boolean isPure() {
            return false;
        }

        @Override
        public boolean containsCall() {
            return true;
        }

        @Override
        public String toString() {
            return applicationString(callee, args);
        }
    }

    @NotNull
    private static String applicationString(String name, List<Expr> args) {
        return args.stream()
                .map(Objects::toString)
                .collect(Collectors.joining(", ", name + "(", ")"));
    }
}
