package org.verispec.compiler.frontend.typing.converters;

import org.verispec.compiler.frontend.typing.IStructuralToTypedConverter;
import org.verispec.compiler.frontend.typing.TypingContext;
import org.verispec.compiler.specs.common.Assertion;
import org.verispec.compiler.specs.structural.StructuralExpression;
import org.verispec.compiler.specs.structural.StructuralForAllVars;
import org.verispec.compiler.specs.typed.Expression;
import org.verispec.compiler.specs.typed.ForAllVars;

/**
 * Wraps the typed kind of an assertion; the assertion node has no identity of its own.
 */
public final class AssertionConverter implements IStructuralToTypedConverter<
        Assertion<StructuralExpression, StructuralForAllVars>, Assertion<Expression, ForAllVars>> {

    @Override
    public Assertion<Expression, ForAllVars> convert(Assertion<StructuralExpression, StructuralForAllVars> node,
                                                     TypingContext ctx) {
        return new Assertion<>(ctx.typeAssertionKind(node.kind()));
    }
}
