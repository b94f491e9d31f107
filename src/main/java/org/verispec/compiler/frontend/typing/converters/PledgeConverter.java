package org.verispec.compiler.frontend.typing.converters;

import org.verispec.compiler.frontend.typing.IStructuralToTypedConverter;
import org.verispec.compiler.frontend.typing.TypingContext;
import org.verispec.compiler.specs.common.Assertion;
import org.verispec.compiler.specs.common.Pledge;
import org.verispec.compiler.specs.structural.StructuralExpression;
import org.verispec.compiler.specs.structural.StructuralForAllVars;
import org.verispec.compiler.specs.typed.Expression;
import org.verispec.compiler.specs.typed.ForAllVars;

import java.util.Optional;

/**
 * Types a pledge: the reference expression first, then the assertions before and after expiry.
 */
public final class PledgeConverter implements IStructuralToTypedConverter<
        Pledge<StructuralExpression, StructuralForAllVars>, Pledge<Expression, ForAllVars>> {

    @Override
    public Pledge<Expression, ForAllVars> convert(Pledge<StructuralExpression, StructuralForAllVars> node,
                                                  TypingContext ctx) {
        Optional<Expression> reference = node.reference().map(ctx::typeExpression);
        Assertion<Expression, ForAllVars> lhs = ctx.typeAssertion(node.lhs());
        Assertion<Expression, ForAllVars> rhs = ctx.typeAssertion(node.rhs());
        return new Pledge<>(reference, lhs, rhs);
    }
}
