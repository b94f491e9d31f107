package org.verispec.compiler.frontend.typing;

import org.verispec.compiler.frontend.typing.converters.AssertionConverter;
import org.verispec.compiler.frontend.typing.converters.AssertionKindConverter;
import org.verispec.compiler.frontend.typing.converters.ExpressionConverter;
import org.verispec.compiler.frontend.typing.converters.ForAllVarsConverter;
import org.verispec.compiler.frontend.typing.converters.LoopSpecificationConverter;
import org.verispec.compiler.frontend.typing.converters.PledgeConverter;
import org.verispec.compiler.frontend.typing.converters.ProcedureSpecificationConverter;
import org.verispec.compiler.frontend.typing.converters.TriggerConverter;
import org.verispec.compiler.frontend.typing.converters.TriggerSetConverter;
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

import java.util.Objects;

/**
 * Holds the converter for every node kind of the specification tree.
 * <p>
 * {@link #initializeWithDefaults()} installs the built-in converters; callers may replace
 * single converters afterwards, e.g. to decorate one node kind in tests.
 */
public final class TypingConverterRegistry {

    private IStructuralToTypedConverter<StructuralExpression, Expression> expression;
    private IStructuralToTypedConverter<StructuralForAllVars, ForAllVars> forAllVars;
    private IStructuralToTypedConverter<Trigger<StructuralExpression>, Trigger<Expression>> trigger;
    private IStructuralToTypedConverter<TriggerSet<StructuralExpression>, TriggerSet<Expression>> triggerSet;
    private IStructuralToTypedConverter<AssertionKind<StructuralExpression, StructuralForAllVars>,
            AssertionKind<Expression, ForAllVars>> assertionKind;
    private IStructuralToTypedConverter<Assertion<StructuralExpression, StructuralForAllVars>,
            Assertion<Expression, ForAllVars>> assertion;
    private IStructuralToTypedConverter<Pledge<StructuralExpression, StructuralForAllVars>,
            Pledge<Expression, ForAllVars>> pledge;
    private IStructuralToTypedConverter<ProcedureSpecification<StructuralExpression, StructuralForAllVars>,
            ProcedureSpecification<Expression, ForAllVars>> procedureSpecification;
    private IStructuralToTypedConverter<LoopSpecification<StructuralExpression, StructuralForAllVars>,
            LoopSpecification<Expression, ForAllVars>> loopSpecification;

    private TypingConverterRegistry() {}

    /**
     * Creates a registry with the built-in converter for every node kind.
     * @return A fully initialized registry.
     */
    public static TypingConverterRegistry initializeWithDefaults() {
        TypingConverterRegistry reg = new TypingConverterRegistry();
        reg.registerExpression(new ExpressionConverter());
        reg.registerForAllVars(new ForAllVarsConverter());
        reg.registerTrigger(new TriggerConverter());
        reg.registerTriggerSet(new TriggerSetConverter());
        reg.registerAssertionKind(new AssertionKindConverter());
        reg.registerAssertion(new AssertionConverter());
        reg.registerPledge(new PledgeConverter());
        reg.registerProcedureSpecification(new ProcedureSpecificationConverter());
        reg.registerLoopSpecification(new LoopSpecificationConverter());
        return reg;
    }

    // --- registration ---

    public void registerExpression(IStructuralToTypedConverter<StructuralExpression, Expression> converter) {
        this.expression = Objects.requireNonNull(converter);
    }

    public void registerForAllVars(IStructuralToTypedConverter<StructuralForAllVars, ForAllVars> converter) {
        this.forAllVars = Objects.requireNonNull(converter);
    }

    public void registerTrigger(
            IStructuralToTypedConverter<Trigger<StructuralExpression>, Trigger<Expression>> converter) {
        this.trigger = Objects.requireNonNull(converter);
    }

    public void registerTriggerSet(
            IStructuralToTypedConverter<TriggerSet<StructuralExpression>, TriggerSet<Expression>> converter) {
        this.triggerSet = Objects.requireNonNull(converter);
    }

    public void registerAssertionKind(
            IStructuralToTypedConverter<AssertionKind<StructuralExpression, StructuralForAllVars>,
                    AssertionKind<Expression, ForAllVars>> converter) {
        this.assertionKind = Objects.requireNonNull(converter);
    }

    public void registerAssertion(
            IStructuralToTypedConverter<Assertion<StructuralExpression, StructuralForAllVars>,
                    Assertion<Expression, ForAllVars>> converter) {
        this.assertion = Objects.requireNonNull(converter);
    }

    public void registerPledge(
            IStructuralToTypedConverter<Pledge<StructuralExpression, StructuralForAllVars>,
                    Pledge<Expression, ForAllVars>> converter) {
        this.pledge = Objects.requireNonNull(converter);
    }

    public void registerProcedureSpecification(
            IStructuralToTypedConverter<ProcedureSpecification<StructuralExpression, StructuralForAllVars>,
                    ProcedureSpecification<Expression, ForAllVars>> converter) {
        this.procedureSpecification = Objects.requireNonNull(converter);
    }

    public void registerLoopSpecification(
            IStructuralToTypedConverter<LoopSpecification<StructuralExpression, StructuralForAllVars>,
                    LoopSpecification<Expression, ForAllVars>> converter) {
        this.loopSpecification = Objects.requireNonNull(converter);
    }

    // --- lookup ---

    IStructuralToTypedConverter<StructuralExpression, Expression> expression() {
        return expression;
    }

    IStructuralToTypedConverter<StructuralForAllVars, ForAllVars> forAllVars() {
        return forAllVars;
    }

    IStructuralToTypedConverter<Trigger<StructuralExpression>, Trigger<Expression>> trigger() {
        return trigger;
    }

    IStructuralToTypedConverter<TriggerSet<StructuralExpression>, TriggerSet<Expression>> triggerSet() {
        return triggerSet;
    }

    IStructuralToTypedConverter<AssertionKind<StructuralExpression, StructuralForAllVars>,
            AssertionKind<Expression, ForAllVars>> assertionKind() {
        return assertionKind;
    }

    IStructuralToTypedConverter<Assertion<StructuralExpression, StructuralForAllVars>,
            Assertion<Expression, ForAllVars>> assertion() {
        return assertion;
    }

    IStructuralToTypedConverter<Pledge<StructuralExpression, StructuralForAllVars>,
            Pledge<Expression, ForAllVars>> pledge() {
        return pledge;
    }

    IStructuralToTypedConverter<ProcedureSpecification<StructuralExpression, StructuralForAllVars>,
            ProcedureSpecification<Expression, ForAllVars>> procedureSpecification() {
        return procedureSpecification;
    }

    IStructuralToTypedConverter<LoopSpecification<StructuralExpression, StructuralForAllVars>,
            LoopSpecification<Expression, ForAllVars>> loopSpecification() {
        return loopSpecification;
    }
}
