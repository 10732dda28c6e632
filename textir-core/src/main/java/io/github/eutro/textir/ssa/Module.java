package io.github.eutro.textir.ssa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Represents a whole unit of the textual IR: external declarations and defined procedures, in order.
 */
public final class Module {
    private final List<Decl> decls;

    public Module(List<Decl> decls) {
        Set<String> names = new HashSet<>();
        for (Decl decl : decls) {
            if (!names.add(decl.getName())) {
                throw new IllegalArgumentException("duplicate declaration of " + decl.getName());
            }
        }
        this.decls = Collections.unmodifiableList(new ArrayList<>(decls));
    }

    public List<Decl> getDecls() {
        return decls;
    }

    /**
     * Get the defined procedures of this module, in order.
     *
     * @return The procedures.
     */
    public List<Procedure> getProcedures() {
        List<Procedure> procs = new ArrayList<>();
        for (Decl decl : decls) {
            if (decl instanceof Procedure) procs.add((Procedure) decl);
        }
        return procs;
    }

    /**
     * Find a defined procedure by name.
     *
     * @param name The name.
     * @return The procedure.
     * @throws IllegalArgumentException If there is no such procedure.
     */
    public Procedure getProcedure(String name) {
        for (Decl decl : decls) {
            if (decl instanceof Procedure && decl.getName().equals(name)) return (Procedure) decl;
        }
        throw new IllegalArgumentException("no procedure named " + name);
    }

    @Override
    public String toString() {
        return decls.stream()
                .map(Objects::toString)
                .collect(Collectors.joining("\n\n"));
    }
}
