package org.verispec.compiler.frontend.typing;

import org.verispec.compiler.specs.common.Assertion;
import org.verispec.compiler.specs.common.SpecificationId;
import org.verispec.compiler.specs.structural.StructuralExpression;
import org.verispec.compiler.specs.structural.StructuralForAllVars;
import org.verispec.compiler.specs.typed.ExternSpecificationMap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The structural specifications of one compilation unit, as handed over by the attribute collector.
 *
 * @param specifications Top-level structural assertions keyed by specification id.
 * @param externs        External specifications collected from the unit.
 */
public record StructuralSpecificationUnit(
        Map<SpecificationId, Assertion<StructuralExpression, StructuralForAllVars>> specifications,
        ExternSpecificationMap externs) {

    public StructuralSpecificationUnit {
        specifications = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(specifications, "specifications")));
        Objects.requireNonNull(externs, "externs");
    }

    /**
     * Creates a unit without external specifications.
     * @param specifications Top-level structural assertions keyed by specification id.
     * @return The unit.
     */
    public static StructuralSpecificationUnit of(
            Map<SpecificationId, Assertion<StructuralExpression, StructuralForAllVars>> specifications) {
        return new StructuralSpecificationUnit(specifications, ExternSpecificationMap.empty());
    }
}
