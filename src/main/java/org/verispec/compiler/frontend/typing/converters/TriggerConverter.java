package org.verispec.compiler.frontend.typing.converters;

import org.verispec.compiler.frontend.typing.IStructuralToTypedConverter;
import org.verispec.compiler.frontend.typing.TypingContext;
import org.verispec.compiler.specs.common.Trigger;
import org.verispec.compiler.specs.structural.StructuralExpression;
import org.verispec.compiler.specs.typed.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Types every term of a trigger, keeping order and multiplicity.
 */
public final class TriggerConverter
        implements IStructuralToTypedConverter<Trigger<StructuralExpression>, Trigger<Expression>> {

    @Override
    public Trigger<Expression> convert(Trigger<StructuralExpression> node, TypingContext ctx) {
        List<Expression> terms = new ArrayList<>(node.terms().size());
        for (StructuralExpression term : node.terms()) {
            terms.add(ctx.typeExpression(term));
        }
        return new Trigger<>(terms);
    }
}
