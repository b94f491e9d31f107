package org.verispec.compiler.frontend.typing.converters;

import org.verispec.compiler.frontend.typing.IStructuralToTypedConverter;
import org.verispec.compiler.frontend.typing.TypingContext;
import org.verispec.compiler.specs.common.Trigger;
import org.verispec.compiler.specs.common.TriggerSet;
import org.verispec.compiler.specs.structural.StructuralExpression;
import org.verispec.compiler.specs.typed.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Types every trigger of a trigger set, keeping order and multiplicity.
 */
public final class TriggerSetConverter
        implements IStructuralToTypedConverter<TriggerSet<StructuralExpression>, TriggerSet<Expression>> {

    @Override
    public TriggerSet<Expression> convert(TriggerSet<StructuralExpression> node, TypingContext ctx) {
        List<Trigger<Expression>> triggers = new ArrayList<>(node.triggers().size());
        for (Trigger<StructuralExpression> trigger : node.triggers()) {
            triggers.add(ctx.typeTrigger(trigger));
        }
        return new TriggerSet<>(triggers);
    }
}
