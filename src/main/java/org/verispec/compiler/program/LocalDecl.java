package org.verispec.compiler.program;

import org.verispec.compiler.api.SourceSpan;

/**
 * Declaration of a local variable inside an element body.
 *
 * @param slot The slot the variable occupies.
 * @param type The declared type.
 * @param span The source range of the declaration.
 */
public record LocalDecl(LocalSlot slot, TypeRef type, SourceSpan span) {}
