package org.verispec.compiler.specs.typed;

import org.verispec.compiler.api.SourceSpan;
import org.verispec.compiler.program.ElementBody;
import org.verispec.compiler.program.LocalSlot;
import org.verispec.compiler.program.ProgramElementRef;
import org.verispec.compiler.program.ProgramElements;
import org.verispec.compiler.program.TypeRef;
import org.verispec.compiler.specs.common.Assertion;
import org.verispec.compiler.specs.common.ExpressionId;
import org.verispec.compiler.specs.common.Pledge;
import org.verispec.compiler.specs.common.ProcedureSpecification;
import org.verispec.compiler.specs.common.SpecificationId;
import org.verispec.compiler.specs.common.Trigger;
import org.verispec.compiler.specs.common.TriggerSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.verispec.test.utils.SpecFixtures.line;
import static org.verispec.test.utils.SpecFixtures.specId;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class SpanResolverTest {

    private static final SpecificationId SPEC = specId(1);
    private static final TypeRef USIZE = new TypeRef("usize");

    @Mock
    private ProgramElements elements;

    private SpanResolver resolver;
    private ElementBody closure;

    @BeforeEach
    void setUp() {
        resolver = new SpanResolver(elements);
        closure = ElementBody.builder()
                .arg(new TypeRef("&Closure"), line(1))
                .arg(USIZE, line(2))
                .arg(USIZE, line(3))
                .build();
    }

    private Assertion<Expression, ForAllVars> leaf(int id, int declLine) {
        ProgramElementRef ref = new ProgramElementRef(id, "e" + id);
        when(elements.declarationSpan(ref)).thenReturn(line(declLine));
        return Assertion.expr(new Expression(SPEC, new ExpressionId(id), ref));
    }

    private static ForAllVars vars(int... slots) {
        List<QuantifiedVar> vars = new ArrayList<>();
        for (int slot : slots) {
            vars.add(new QuantifiedVar(new LocalSlot(slot), USIZE));
        }
        return new ForAllVars(SPEC, new ExpressionId(99), vars);
    }

    @Test
    void expressionSpanIsDeclarationOfItsBinding() {
        assertThat(resolver.getSpans(leaf(1, 10), closure)).containsExactly(line(10));
    }

    @Test
    void conjunctionConcatenatesChildSpansInOrder() {
        Assertion<Expression, ForAllVars> and = Assertion.and(List.of(leaf(1, 10), leaf(2, 11), leaf(3, 12)));

        List<SourceSpan> spans = resolver.getSpans(and, closure);

        assertThat(spans).containsExactly(line(10), line(11), line(12));
    }

    @Test
    void emptyConjunctionHasNoSpans() {
        assertThat(resolver.getSpans(Assertion.<Expression, ForAllVars>and(List.of()), closure)).isEmpty();
    }

    @Test
    void implicationListsPremiseBeforeConclusion() {
        Assertion<Expression, ForAllVars> implies = Assertion.implies(leaf(1, 20), leaf(2, 10));

        assertThat(resolver.getSpans(implies, closure)).containsExactly(line(20), line(10));
    }

    @Test
    void repeatedLeavesAreNotDeduplicated() {
        Assertion<Expression, ForAllVars> e = leaf(1, 10);

        assertThat(resolver.getSpans(Assertion.and(List.of(e, e)), closure)).containsExactly(line(10), line(10));
    }

    @Test
    void quantifierListsVariablesThenTriggersThenBody() {
        ProgramElementRef triggerRef = new ProgramElementRef(5, "t");
        when(elements.declarationSpan(triggerRef)).thenReturn(line(30));
        Expression trigger = new Expression(SPEC, new ExpressionId(5), triggerRef);
        Assertion<Expression, ForAllVars> forAll = Assertion.forAll(vars(1, 2),
                new TriggerSet<>(List.of(new Trigger<>(List.of(trigger)))), leaf(1, 10));

        assertThat(resolver.getSpans(forAll, closure)).containsExactly(line(2), line(3), line(30), line(10));
    }

    @Test
    void variableWithoutDeclarationIsSkipped() {
        Assertion<Expression, ForAllVars> forAll = Assertion.forAll(vars(1, 7, 2), TriggerSet.empty(), leaf(1, 10));

        assertThat(resolver.getSpans(forAll, closure)).containsExactly(line(2), line(3), line(10));
    }

    @Test
    void variablesAreResolvedAgainstTheSuppliedBody() {
        ElementBody unrelated = ElementBody.builder().arg(USIZE, line(40)).build();

        assertThat(resolver.getSpans(vars(1, 2), unrelated)).isEmpty();
        assertThat(resolver.getSpans(vars(0), unrelated)).containsExactly(line(40));
    }

    @Test
    void typeConditionListsVariablesThenBody() {
        Assertion<Expression, ForAllVars> typeCond = Assertion.typeCond(vars(2), leaf(1, 10));

        assertThat(resolver.getSpans(typeCond, closure)).containsExactly(line(3), line(10));
    }

    @Test
    void resolvingTwiceGivesTheSameResult() {
        Assertion<Expression, ForAllVars> tree = Assertion.implies(
                Assertion.and(List.of(leaf(1, 10), leaf(2, 11))),
                Assertion.forAll(vars(1), TriggerSet.empty(), leaf(3, 12)));

        assertThat(resolver.getSpans(tree, closure)).isEqualTo(resolver.getSpans(tree, closure));
    }

    @Test
    void pledgeListsReferenceThenBothSides() {
        ProgramElementRef ref = new ProgramElementRef(9, "result");
        when(elements.declarationSpan(ref)).thenReturn(line(50));
        Pledge<Expression, ForAllVars> pledge = new Pledge<>(
                Optional.of(new Expression(SPEC, new ExpressionId(9), ref)), leaf(1, 10), leaf(2, 11));

        assertThat(resolver.getSpans(pledge, closure)).containsExactly(line(50), line(10), line(11));
    }

    @Test
    void pledgeWithoutReference() {
        Pledge<Expression, ForAllVars> pledge = new Pledge<>(Optional.empty(), leaf(1, 10), leaf(2, 11));

        assertThat(resolver.getSpans(pledge, closure)).containsExactly(line(10), line(11));
    }

    @Test
    void procedureContractListsPreconditionsPostconditionsPledges() {
        ProcedureSpecification<Expression, ForAllVars> contract = new ProcedureSpecification<>(
                List.of(leaf(1, 10)),
                List.of(leaf(2, 11), leaf(3, 12)),
                List.of(new Pledge<>(Optional.empty(), leaf(4, 13), leaf(5, 14))));

        assertThat(resolver.getSpans(contract, closure))
                .containsExactly(line(10), line(11), line(12), line(13), line(14));
    }

    @Test
    void unknownDeclarationYieldsUnknownSpan() {
        ProgramElementRef ref = new ProgramElementRef(8, "synthetic");
        when(elements.declarationSpan(ref)).thenReturn(SourceSpan.UNKNOWN);

        assertThat(resolver.getSpans(new Expression(SPEC, new ExpressionId(8), ref), closure))
                .containsExactly(SourceSpan.UNKNOWN);
    }

    @Test
    void bodiesAreNeverLookedUp() {
        resolver.getSpans(Assertion.forAll(vars(1), TriggerSet.empty(), leaf(1, 10)), closure);

        verify(elements, never()).bodyOf(any());
    }
}
