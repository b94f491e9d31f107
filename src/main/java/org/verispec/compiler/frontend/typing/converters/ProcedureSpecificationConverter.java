package org.verispec.compiler.frontend.typing.converters;

import org.verispec.compiler.frontend.typing.IStructuralToTypedConverter;
import org.verispec.compiler.frontend.typing.TypingContext;
import org.verispec.compiler.specs.common.Assertion;
import org.verispec.compiler.specs.common.Pledge;
import org.verispec.compiler.specs.common.ProcedureSpecification;
import org.verispec.compiler.specs.structural.StructuralExpression;
import org.verispec.compiler.specs.structural.StructuralForAllVars;
import org.verispec.compiler.specs.typed.Expression;
import org.verispec.compiler.specs.typed.ForAllVars;

import java.util.ArrayList;
import java.util.List;

/**
 * Types every role of a procedure contract, keeping the order within each role.
 */
public final class ProcedureSpecificationConverter implements IStructuralToTypedConverter<
        ProcedureSpecification<StructuralExpression, StructuralForAllVars>,
        ProcedureSpecification<Expression, ForAllVars>> {

    @Override
    public ProcedureSpecification<Expression, ForAllVars> convert(
            ProcedureSpecification<StructuralExpression, StructuralForAllVars> node, TypingContext ctx) {
        List<Assertion<Expression, ForAllVars>> pres = typeAll(node.pres(), ctx);
        List<Assertion<Expression, ForAllVars>> posts = typeAll(node.posts(), ctx);
        List<Pledge<Expression, ForAllVars>> pledges = new ArrayList<>(node.pledges().size());
        for (Pledge<StructuralExpression, StructuralForAllVars> pledge : node.pledges()) {
            pledges.add(ctx.typePledge(pledge));
        }
        return new ProcedureSpecification<>(pres, posts, pledges);
    }

    static List<Assertion<Expression, ForAllVars>> typeAll(
            List<Assertion<StructuralExpression, StructuralForAllVars>> assertions, TypingContext ctx) {
        List<Assertion<Expression, ForAllVars>> typed = new ArrayList<>(assertions.size());
        for (Assertion<StructuralExpression, StructuralForAllVars> assertion : assertions) {
            typed.add(ctx.typeAssertion(assertion));
        }
        return typed;
    }
}
