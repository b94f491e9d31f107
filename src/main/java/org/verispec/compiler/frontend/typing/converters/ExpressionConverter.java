package org.verispec.compiler.frontend.typing.converters;

import org.verispec.compiler.frontend.typing.IStructuralToTypedConverter;
import org.verispec.compiler.frontend.typing.TypingContext;
import org.verispec.compiler.program.ProgramElementRef;
import org.verispec.compiler.specs.structural.StructuralExpression;
import org.verispec.compiler.specs.typed.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds a structural expression to the program element registered for its key.
 * With {@code verispec.typing.trace-resolutions} set, every binding is logged at INFO.
 */
public final class ExpressionConverter implements IStructuralToTypedConverter<StructuralExpression, Expression> {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionConverter.class);

    @Override
    public Expression convert(StructuralExpression node, TypingContext ctx) {
        ProgramElementRef binding = ctx.environment().resolve(node.specId(), node.exprId());
        if (ctx.options().traceResolutions()) {
            LOG.info("Expression {}_{} bound to {}", node.specId(), node.exprId(), binding);
        }
        return new Expression(node.specId(), node.exprId(), binding);
    }
}
