package org.verispec.compiler.frontend.typing;

import org.verispec.compiler.program.ProgramElements;
import org.verispec.compiler.specs.common.Assertion;
import org.verispec.compiler.specs.common.LoopSpecification;
import org.verispec.compiler.specs.common.Pledge;
import org.verispec.compiler.specs.common.ProcedureSpecification;
import org.verispec.compiler.specs.common.Specification;
import org.verispec.compiler.specs.common.SpecificationSet;
import org.verispec.compiler.specs.structural.StructuralExpression;
import org.verispec.compiler.specs.structural.StructuralForAllVars;
import org.verispec.compiler.specs.typed.Expression;
import org.verispec.compiler.specs.typed.ForAllVars;

/**
 * Converts structural specifications into typed specifications bound to program elements.
 * <p>
 * Typing is a pure structural homomorphism: every node keeps its kind, its child count and its
 * child order, and typing the same input twice yields equal output. There are no partial
 * results; a node either converts completely or a
 * {@link org.verispec.compiler.api.SpecificationConsistencyException} aborts the conversion.
 */
public final class SpecificationTyper {

    private final TypingContext ctx;

    /**
     * Creates a typer with the default converters and options.
     *
     * @param environment Bindings of all expression keys of the unit.
     * @param elements    Introspection into the program elements of the unit.
     */
    public SpecificationTyper(TypedExpressionEnvironment environment, ProgramElements elements) {
        this(environment, elements, TypingConverterRegistry.initializeWithDefaults(), TypingOptions.defaults());
    }

    /**
     * @param environment Bindings of all expression keys of the unit.
     * @param elements    Introspection into the program elements of the unit.
     * @param registry    The converters to use.
     * @param options     The typing options.
     */
    public SpecificationTyper(TypedExpressionEnvironment environment, ProgramElements elements,
                              TypingConverterRegistry registry, TypingOptions options) {
        this.ctx = new TypingContext(environment, elements, registry, options);
    }

    public Assertion<Expression, ForAllVars> type(Assertion<StructuralExpression, StructuralForAllVars> assertion) {
        return ctx.typeAssertion(assertion);
    }

    public Specification<Expression, ForAllVars> type(
            Specification<StructuralExpression, StructuralForAllVars> specification) {
        return new Specification<>(specification.type(), ctx.typeAssertion(specification.assertion()));
    }

    public Pledge<Expression, ForAllVars> type(Pledge<StructuralExpression, StructuralForAllVars> pledge) {
        return ctx.typePledge(pledge);
    }

    public ProcedureSpecification<Expression, ForAllVars> type(
            ProcedureSpecification<StructuralExpression, StructuralForAllVars> specification) {
        return ctx.typeProcedureSpecification(specification);
    }

    public LoopSpecification<Expression, ForAllVars> type(
            LoopSpecification<StructuralExpression, StructuralForAllVars> specification) {
        return ctx.typeLoopSpecification(specification);
    }

    public SpecificationSet<Expression, ForAllVars> type(
            SpecificationSet<StructuralExpression, StructuralForAllVars> set) {
        if (set instanceof SpecificationSet.Procedure<StructuralExpression, StructuralForAllVars> procedure) {
            return new SpecificationSet.Procedure<>(ctx.typeProcedureSpecification(procedure.specification()));
        }
        if (set instanceof SpecificationSet.Loop<StructuralExpression, StructuralForAllVars> loop) {
            return new SpecificationSet.Loop<>(ctx.typeLoopSpecification(loop.specification()));
        }
        throw new IllegalStateException("Unhandled specification set: " + set.getClass().getName());
    }
}
