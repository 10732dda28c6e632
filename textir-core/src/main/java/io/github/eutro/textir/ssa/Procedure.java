package io.github.eutro.textir.ssa;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A defined procedure, encapsulating a list of {@link Block blocks}.
 * The first block is the entry.
 */
public final class Procedure implements Decl {
    private final String name;
    private final List<Formal> formals;
    private final Typ result;
    private final List<Block> blocks;

    public Procedure(String name, List<Formal> formals, Typ result, List<Block> blocks) {
        if (blocks.isEmpty()) throw new IllegalArgumentException("procedure " + name + " has no blocks");
        this.name = Objects.requireNonNull(name);
        this.formals = Collections.unmodifiableList(new ArrayList<>(formals));
        this.result = Objects.requireNonNull(result);
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
    }

    @Override
    public String getName() {
        return name;
    }

    public List<Formal> getFormals() {
        return formals;
    }

    public Typ getResult() {
        return result;
    }

    public List<Block> getBlocks() {
        return blocks;
    }

    public Block getEntry() {
        return blocks.get(0);
    }

    /**
     * Find a block by its label.
     *
     * @param label The label.
     * @return The block, or null if there is none.
     */
    @Nullable
    public Block getBlock(String label) {
        for (Block block : blocks) {
            if (block.getLabel().equals(label)) return block;
        }
        return null;
    }

    /**
     * Get a copy of this procedure with a different body.
     *
     * @param blocks The new blocks, entry first.
     * @return The new procedure.
     */
    public Procedure withBlocks(List<Block> blocks) {
        return new Procedure(name, formals, result, blocks);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("define ").append(name).append('(');
        for (int i = 0; i < formals.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(formals.get(i));
        }
        sb.append(") : ").append(result).append(" {\n");
        for (Block block : blocks) {
            block.appendTo(sb, "  ");
            sb.append('\n');
        }
        sb.append('}');
        return sb.toString();
    }

    /**
     * A formal parameter of a procedure: a named program variable, addressed with {@code &name}.
     */
    public static final class Formal {
        public final String name;
        public final Typ typ;

        public Formal(String name, Typ typ) {
            this.name = Objects.requireNonNull(name);
            this.typ = Objects.requireNonNull(typ);
        }

        @Override
        public String toString() {
            return name + ": " + typ;
        }
    }
}
