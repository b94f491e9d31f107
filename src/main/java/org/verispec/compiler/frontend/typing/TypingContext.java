package org.verispec.compiler.frontend.typing;

import org.verispec.compiler.program.ProgramElements;
import org.verispec.compiler.specs.common.Assertion;
import org.verispec.compiler.specs.common.AssertionKind;
import org.verispec.compiler.specs.common.LoopSpecification;
import org.verispec.compiler.specs.common.Pledge;
import org.verispec.compiler.specs.common.ProcedureSpecification;
import org.verispec.compiler.specs.common.Trigger;
import org.verispec.compiler.specs.common.TriggerSet;
import org.verispec.compiler.specs.structural.StructuralExpression;
import org.verispec.compiler.specs.structural.StructuralForAllVars;
import org.verispec.compiler.specs.typed.Expression;
import org.verispec.compiler.specs.typed.ForAllVars;

/**
 * Context passed to converters while typing one compilation unit.
 * Gives access to the read-only inputs and converts child nodes through the registry.
 * Holds no mutable state, so a context may be reused for any number of nodes.
 */
public final class TypingContext {

    private final TypedExpressionEnvironment environment;
    private final ProgramElements elements;
    private final TypingConverterRegistry registry;
    private final TypingOptions options;

    /**
     * @param environment Bindings of all expression keys of the unit.
     * @param elements    Introspection into the program elements of the unit.
     * @param registry    The converters to use.
     * @param options     The typing options.
     */
    public TypingContext(TypedExpressionEnvironment environment, ProgramElements elements,
                         TypingConverterRegistry registry, TypingOptions options) {
        this.environment = environment;
        this.elements = elements;
        this.registry = registry;
        this.options = options;
    }

    public TypedExpressionEnvironment environment() {
        return environment;
    }

    public ProgramElements elements() {
        return elements;
    }

    public TypingOptions options() {
        return options;
    }

    public Expression typeExpression(StructuralExpression node) {
        return registry.expression().convert(node, this);
    }

    public ForAllVars typeForAllVars(StructuralForAllVars node) {
        return registry.forAllVars().convert(node, this);
    }

    public Trigger<Expression> typeTrigger(Trigger<StructuralExpression> node) {
        return registry.trigger().convert(node, this);
    }

    public TriggerSet<Expression> typeTriggerSet(TriggerSet<StructuralExpression> node) {
        return registry.triggerSet().convert(node, this);
    }

    public AssertionKind<Expression, ForAllVars> typeAssertionKind(
            AssertionKind<StructuralExpression, StructuralForAllVars> node) {
        return registry.assertionKind().convert(node, this);
    }

    public Assertion<Expression, ForAllVars> typeAssertion(Assertion<StructuralExpression, StructuralForAllVars> node) {
        return registry.assertion().convert(node, this);
    }

    public Pledge<Expression, ForAllVars> typePledge(Pledge<StructuralExpression, StructuralForAllVars> node) {
        return registry.pledge().convert(node, this);
    }

    public ProcedureSpecification<Expression, ForAllVars> typeProcedureSpecification(
            ProcedureSpecification<StructuralExpression, StructuralForAllVars> node) {
        return registry.procedureSpecification().convert(node, this);
    }

    public LoopSpecification<Expression, ForAllVars> typeLoopSpecification(
            LoopSpecification<StructuralExpression, StructuralForAllVars> node) {
        return registry.loopSpecification().convert(node, this);
    }
}
