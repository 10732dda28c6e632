package io.github.eutro.textir.ssa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A basic block, encapsulating a list of {@link Insn instructions},
 * followed by exactly one {@link Terminator} at the end.
 * <p>
 * Parameters are how SSA form merges values: every jump to this block passes one argument
 * per parameter.
 */
public final class Block {
    private final String label;
    private final List<Param> params;
    private final List<Insn> insns;
    private final Terminator terminator;

    public Block(String label, List<Param> params, List<Insn> insns, Terminator terminator) {
        this.label = Objects.requireNonNull(label);
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.insns = Collections.unmodifiableList(new ArrayList<>(insns));
        this.terminator = Objects.requireNonNull(terminator);
    }

    public String getLabel() {
        return label;
    }

    public List<Param> getParams() {
        return params;
    }

    public List<Insn> getInsns() {
        return insns;
    }

    public Terminator getTerminator() {
        return terminator;
    }

    public Block withInsns(List<Insn> insns) {
        return new Block(label, params, insns, terminator);
    }

    public Block withTerminator(Terminator terminator) {
        return new Block(label, params, insns, terminator);
    }

    /**
     * Format the label line of this block, as used in listings.
     *
     * @return The header, e.g. {@code #lab(n1: int):}.
     */
    public String headerString() {
        StringBuilder sb = new StringBuilder("#").append(label);
        if (!params.isEmpty()) {
            sb.append('(');
            for (int i = 0; i < params.size(); i++) {
                if (i != 0) sb.append(", ");
                sb.append(params.get(i));
            }
            sb.append(')');
        }
        return sb.append(':').toString();
    }

    void appendTo(StringBuilder sb, String indent) {
        sb.append(indent).append(headerString()).append('\n');
        for (Insn insn : insns) {
            sb.append(indent).append("    ").append(insn).append('\n');
        }
        sb.append(indent).append("    ").append(terminator).append('\n');
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb, "");
        return sb.toString();
    }

    /**
     * A formal parameter of a block, {@code id: typ}.
     */
    public static final class Param {
        public final Ident id;
        public final Typ typ;

        public Param(Ident id, Typ typ) {
            this.id = Objects.requireNonNull(id);
            this.typ = Objects.requireNonNull(typ);
        }

        @Override
        public String toString() {
            return id + ": " + typ;
        }
    }
}
