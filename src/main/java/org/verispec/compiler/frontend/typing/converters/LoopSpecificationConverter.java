package org.verispec.compiler.frontend.typing.converters;

import org.verispec.compiler.frontend.typing.IStructuralToTypedConverter;
import org.verispec.compiler.frontend.typing.TypingContext;
import org.verispec.compiler.specs.common.LoopSpecification;
import org.verispec.compiler.specs.structural.StructuralExpression;
import org.verispec.compiler.specs.structural.StructuralForAllVars;
import org.verispec.compiler.specs.typed.Expression;
import org.verispec.compiler.specs.typed.ForAllVars;

/**
 * Types the invariants of a loop in source order.
 */
public final class LoopSpecificationConverter implements IStructuralToTypedConverter<
        LoopSpecification<StructuralExpression, StructuralForAllVars>, LoopSpecification<Expression, ForAllVars>> {

    @Override
    public LoopSpecification<Expression, ForAllVars> convert(
            LoopSpecification<StructuralExpression, StructuralForAllVars> node, TypingContext ctx) {
        return new LoopSpecification<>(ProcedureSpecificationConverter.typeAll(node.invariants(), ctx));
    }
}
