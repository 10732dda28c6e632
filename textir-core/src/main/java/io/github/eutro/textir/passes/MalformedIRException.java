package io.github.eutro.textir.passes;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a pass finds IR that breaks a contract it relies on, such as an identifier
 * bound twice, or a jump whose arguments do not match the target block.
 * <p>
 * This always indicates a bug upstream of the pass, in whatever produced the IR.
 */
public class MalformedIRException extends RuntimeException {
    private final String procedure;
    @Nullable
    private final String element;

    /**
     * Construct an exception.
     *
     * @param procedure The name of the procedure being transformed.
     * @param element   The offending instruction, terminator or block, or null.
     * @param message   What is wrong with it.
     */
    public MalformedIRException(String procedure, @Nullable Object element, String message) {
        super("in procedure " + procedure
                + (element == null ? "" : ", at `" + element + "`")
                + ": " + message);
        this.procedure = procedure;
        this.element = element == null ? null : element.toString();
    }

    /**
     * Get the name of the procedure the malformed IR was found in.
     *
     * @return The procedure name.
     */
    public String getProcedure() {
        return procedure;
    }

    /**
     * Get the rendering of the offending IR element, if any.
     *
     * @return The element, or null.
     */
    @Nullable
    public String getElement() {
        return element;
    }
}
