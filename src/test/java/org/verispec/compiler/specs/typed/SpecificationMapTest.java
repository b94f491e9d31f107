package org.verispec.compiler.specs.typed;

import org.verispec.compiler.api.SpecErrorCode;
import org.verispec.compiler.api.SpecificationConsistencyException;
import org.verispec.compiler.program.ProgramElementRef;
import org.verispec.compiler.specs.common.Assertion;
import org.verispec.compiler.specs.common.ExpressionId;
import org.verispec.compiler.specs.common.SpecificationId;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.verispec.test.utils.SpecFixtures.specId;

@Tag("unit")
class SpecificationMapTest {

    private static Assertion<Expression, ForAllVars> leaf(SpecificationId spec, int id) {
        return Assertion.expr(new Expression(spec, new ExpressionId(id), new ProgramElementRef(id, "e" + id)));
    }

    @Test
    void lookupByIdAndInsertionOrder() {
        SpecificationMap map = SpecificationMap.builder()
                .put(specId(3), leaf(specId(3), 1))
                .put(specId(1), leaf(specId(1), 1))
                .build();

        assertThat(map.size()).isEqualTo(2);
        assertThat(map.ids()).containsExactly(specId(3), specId(1));
        assertThat(map.get(specId(1))).contains(leaf(specId(1), 1));
        assertThat(map.get(specId(2))).isEmpty();
        assertThat(map.contains(specId(2))).isFalse();
    }

    @Test
    void duplicateIdIsRejected() {
        SpecificationMap.Builder builder = SpecificationMap.builder().put(specId(1), leaf(specId(1), 1));

        assertThatThrownBy(() -> builder.put(specId(1), leaf(specId(1), 2)))
                .isInstanceOfSatisfying(SpecificationConsistencyException.class,
                        e -> assertThat(e.code()).isEqualTo(SpecErrorCode.DUPLICATE_SPECIFICATION));
    }

    @Test
    void builtMapIsReadOnly() {
        SpecificationMap.Builder builder = SpecificationMap.builder().put(specId(1), leaf(specId(1), 1));
        SpecificationMap map = builder.build();
        builder.put(specId(2), leaf(specId(2), 1));

        assertThat(map.size()).isEqualTo(1);
        assertThatThrownBy(() -> map.asMap().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
