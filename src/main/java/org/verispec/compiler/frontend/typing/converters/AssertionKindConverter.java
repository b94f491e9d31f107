package org.verispec.compiler.frontend.typing.converters;

import org.verispec.compiler.frontend.typing.IStructuralToTypedConverter;
import org.verispec.compiler.frontend.typing.TypingContext;
import org.verispec.compiler.specs.common.Assertion;
import org.verispec.compiler.specs.common.AssertionKind;
import org.verispec.compiler.specs.common.TriggerSet;
import org.verispec.compiler.specs.structural.StructuralExpression;
import org.verispec.compiler.specs.structural.StructuralForAllVars;
import org.verispec.compiler.specs.typed.Expression;
import org.verispec.compiler.specs.typed.ForAllVars;

import java.util.ArrayList;
import java.util.List;

/**
 * Dispatches on the five assertion kinds. Operands are converted in their field order,
 * for a quantifier: variables, triggers, body.
 */
public final class AssertionKindConverter implements IStructuralToTypedConverter<
        AssertionKind<StructuralExpression, StructuralForAllVars>, AssertionKind<Expression, ForAllVars>> {

    @Override
    public AssertionKind<Expression, ForAllVars> convert(AssertionKind<StructuralExpression, StructuralForAllVars> node,
                                                         TypingContext ctx) {
        if (node instanceof AssertionKind.Expr<StructuralExpression, StructuralForAllVars> expr) {
            return new AssertionKind.Expr<>(ctx.typeExpression(expr.expression()));
        }
        if (node instanceof AssertionKind.And<StructuralExpression, StructuralForAllVars> and) {
            List<Assertion<Expression, ForAllVars>> conjuncts = new ArrayList<>(and.assertions().size());
            for (Assertion<StructuralExpression, StructuralForAllVars> conjunct : and.assertions()) {
                conjuncts.add(ctx.typeAssertion(conjunct));
            }
            return new AssertionKind.And<>(conjuncts);
        }
        if (node instanceof AssertionKind.Implies<StructuralExpression, StructuralForAllVars> implies) {
            Assertion<Expression, ForAllVars> lhs = ctx.typeAssertion(implies.lhs());
            Assertion<Expression, ForAllVars> rhs = ctx.typeAssertion(implies.rhs());
            return new AssertionKind.Implies<>(lhs, rhs);
        }
        if (node instanceof AssertionKind.ForAll<StructuralExpression, StructuralForAllVars> forAll) {
            ForAllVars vars = ctx.typeForAllVars(forAll.vars());
            TriggerSet<Expression> triggers = ctx.typeTriggerSet(forAll.triggers());
            Assertion<Expression, ForAllVars> body = ctx.typeAssertion(forAll.body());
            return new AssertionKind.ForAll<>(vars, triggers, body);
        }
        if (node instanceof AssertionKind.TypeCond<StructuralExpression, StructuralForAllVars> typeCond) {
            ForAllVars vars = ctx.typeForAllVars(typeCond.vars());
            Assertion<Expression, ForAllVars> body = ctx.typeAssertion(typeCond.body());
            return new AssertionKind.TypeCond<>(vars, body);
        }
        throw new IllegalStateException("Unhandled assertion kind: " + node.getClass().getName());
    }
}
