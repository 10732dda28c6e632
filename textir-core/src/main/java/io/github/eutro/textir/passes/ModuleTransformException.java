package io.github.eutro.textir.passes;

import io.github.eutro.textir.ssa.Module;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown by a module pass when transforming one or more of its procedures failed.
 * <p>
 * Every procedure is attempted. The failure of each is attached as a suppressed exception,
 * and the {@link #getPartialResult() partial result} holds the transformed procedures
 * alongside the failed ones, unchanged.
 */
public class ModuleTransformException extends RuntimeException {
    private final transient Module partialResult;
    private final transient Map<String, RuntimeException> failures;

    public ModuleTransformException(Module partialResult, Map<String, RuntimeException> failures) {
        super("failed to transform " + failures.size() + " procedure(s): " + String.join(", ", failures.keySet()));
        this.partialResult = partialResult;
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        for (RuntimeException failure : failures.values()) {
            addSuppressed(failure);
        }
    }

    public Module getPartialResult() {
        return partialResult;
    }

    /**
     * Get the failures, keyed by procedure name, in module order.
     *
     * @return The failures.
     */
    public Map<String, RuntimeException> getFailures() {
        return failures;
    }
}
