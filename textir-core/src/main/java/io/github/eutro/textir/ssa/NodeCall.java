package io.github.eutro.textir.ssa;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A jump target: a block label and the arguments passed to the block's parameters.
 */
public final class NodeCall {
    public final String label;
    public final List<Expr> args;

    public NodeCall(String label, List<Expr> args) {
        this.label = Objects.requireNonNull(label);
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static NodeCall of(String label, Expr... args) {
        return new NodeCall(label, Arrays.asList(args));
    }

    @Override
    public String toString() {
        if (args.isEmpty()) return label;
        return args.stream()
                .map(Objects::toString)
                .collect(Collectors.joining(", ", label + "(", ")"));
    }
}
