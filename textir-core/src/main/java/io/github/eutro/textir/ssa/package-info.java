/**
 * This package defines the textual intermediate representation (IR) that the
 * normalisation passes operate on.
 * <p>
 * A {@link io.github.eutro.textir.ssa.Module} is a list of
 * {@link io.github.eutro.textir.ssa.Decl declarations}: external
 * {@link io.github.eutro.textir.ssa.ProcDecl signatures} and defined
 * {@link io.github.eutro.textir.ssa.Procedure procedures}. A procedure is a list of
 * labelled {@link io.github.eutro.textir.ssa.Block blocks}, the first of which is the entry.
 * Each block holds {@link io.github.eutro.textir.ssa.Insn instructions} followed by exactly one
 * {@link io.github.eutro.textir.ssa.Terminator terminator}.
 * <p>
 * Freshly parsed IR is in static single assignment form (SSA): every
 * {@link io.github.eutro.textir.ssa.Ident identifier} is bound exactly once, either by an
 * assignment or as a block parameter, and control-flow merges pass values through
 * block parameters. Identifiers are not block-scoped; the namespace is shared by
 * every block of the procedure.
 * <p>
 * Everything here is immutable. Passes never modify
 * a procedure, they build a new one, copying what they keep.
 */
package io.github.eutro.textir.ssa;
