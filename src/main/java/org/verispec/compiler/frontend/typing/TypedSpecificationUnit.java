package org.verispec.compiler.frontend.typing;

import org.verispec.compiler.specs.typed.ExternSpecificationMap;
import org.verispec.compiler.specs.typed.SpecificationMap;

/**
 * Result of typing one compilation unit, consumed by the encoder and by diagnostics.
 *
 * @param specifications Every typed top-level assertion keyed by specification id.
 * @param externs        External specifications of the unit.
 */
public record TypedSpecificationUnit(SpecificationMap specifications, ExternSpecificationMap externs) {}
