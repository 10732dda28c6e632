package io.github.eutro.textir.ssa;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An IR builder, which assembles a {@link Procedure} one block at a time.
 * <p>
 * A block is opened with {@link #block(String, Block.Param...)}, filled with
 * {@link #insert(Insn)}, and closed by {@link #insertTerminator(Terminator)}.
 * The first block opened is the entry.
 */
public class IRBuilder {
    private final String name;
    private final Typ result;
    private final List<Procedure.Formal> formals = new ArrayList<>();
    private final List<Block> blocks = new ArrayList<>();

    @Nullable
    private String label;
    private List<Block.Param> params;
    private List<Insn> insns;

    /**
     * Construct a builder for a procedure.
     *
     * @param name   The procedure name.
     * @param result The result type.
     */
    public IRBuilder(String name, Typ result) {
        this.name = name;
        this.result = result;
    }

    /**
     * Create a block parameter.
     *
     * @param index The identifier index.
     * @param typ   The type.
     * @return The parameter.
     */
    public static Block.Param param(int index, Typ typ) {
        return new Block.Param(Ident.of(index), typ);
    }

    /**
     * Add a formal parameter to the procedure.
     *
     * @param name The variable name.
     * @param typ  The type.
     * @return This builder.
     */
    public IRBuilder formal(String name, Typ typ) {
        formals.add(new Procedure.Formal(name, typ));
        return this;
    }

    /**
     * Start a new block.
     *
     * @param label  The label of the block.
     * @param params The block parameters.
     * @return This builder.
     */
    public IRBuilder block(String label, Block.Param... params) {
        if (this.label != null) {
            throw new IllegalStateException("block " + this.label + " has no terminator");
        }
        this.label = label;
        this.params = new ArrayList<>(Arrays.asList(params));
        this.insns = new ArrayList<>();
        return this;
    }

    /**
     * Insert an instruction at the end of the current block.
     *
     * @param insn The instruction.
     * @return This builder.
     */
    public IRBuilder insert(Insn insn) {
        checkOpen();
        insns.add(insn);
        return this;
    }

    /**
     * Assign the result of an expression to an identifier, and insert the assignment.
     *
     * @param index The identifier index.
     * @param typ   The type annotation, or null.
     * @param expr  The expression.
     * @return This builder.
     */
    public IRBuilder assign(int index, @Nullable Typ typ, Expr expr) {
        return insert(Insn.assign(Ident.of(index), typ, expr));
    }

    /**
     * Assign the result of an expression to an identifier without a type annotation.
     *
     * @param index The identifier index.
     * @param expr  The expression.
     * @return This builder.
     */
    public IRBuilder assign(int index, Expr expr) {
        return assign(index, null, expr);
    }

    /**
     * Insert {@code n<index>:typ = load &var}.
     *
     * @param index The identifier index.
     * @param typ   The type loaded.
     * @param var   The variable to load from.
     * @return This builder.
     */
    public IRBuilder load(int index, Typ typ, String var) {
        return assign(index, typ, Expr.load(Expr.lvar(var)));
    }

    /**
     * Set the terminator of the current block, closing it.
     *
     * @param terminator The terminator.
     * @return This builder.
     */
    public IRBuilder insertTerminator(Terminator terminator) {
        checkOpen();
        blocks.add(new Block(label, params, insns, terminator));
        label = null;
        return this;
    }

    /**
     * Finish the procedure.
     *
     * @return The procedure.
     */
    public Procedure build() {
        if (label != null) {
            throw new IllegalStateException("block " + label + " has no terminator");
        }
        return new Procedure(name, formals, result, blocks);
    }

    private void checkOpen() {
        if (label == null) throw new IllegalStateException("no open block");
    }
}
