package io.github.eutro.textir.ssa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The signature of an external procedure, {@code declare name(types) : result}.
 */
public final class ProcDecl implements Decl {
    private final String name;
    private final List<Typ> formals;
    private final Typ result;

    public ProcDecl(String name, List<Typ> formals, Typ result) {
        this.name = Objects.requireNonNull(name);
        this.formals = Collections.unmodifiableList(new ArrayList<>(formals));
        this.result = Objects.requireNonNull(result);
    }

    @Override
    public String getName() {
        return name;
    }

    public List<Typ> getFormals() {
        return formals;
    }

    public Typ getResult() {
        return result;
    }

    @Override
    public String toString() {
        return formals.stream()
                .map(Objects::toString)
                .collect(Collectors.joining(", ", "declare " + name + "(", ") : " + result));
    }
}
