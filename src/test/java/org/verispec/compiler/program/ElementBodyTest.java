package org.verispec.compiler.program;

import org.verispec.compiler.api.SourceSpan;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.verispec.test.utils.SpecFixtures.line;

@Tag("unit")
class ElementBodyTest {

    private static final TypeRef USIZE = new TypeRef("usize");

    @Test
    void argumentsTakeTheFirstSlots() {
        ElementBody body = ElementBody.builder()
                .arg(new TypeRef("&Closure"), line(1))
                .arg(USIZE, line(2))
                .local(USIZE, line(5))
                .build();

        assertThat(body.args()).containsExactly(new LocalSlot(0), new LocalSlot(1));
        assertThat(body.argCount()).isEqualTo(2);
        assertThat(body.localDecl(new LocalSlot(2))).map(LocalDecl::span).contains(line(5));
        assertThat(body.localDecls().keySet()).containsExactly(new LocalSlot(0), new LocalSlot(1), new LocalSlot(2));
    }

    @Test
    void undeclaredArgumentHasSlotButNoDeclaration() {
        ElementBody body = ElementBody.builder().undeclaredArg().arg(USIZE, line(2)).build();

        assertThat(body.argCount()).isEqualTo(2);
        assertThat(body.localDecl(new LocalSlot(0))).isEmpty();
        assertThat(body.localDecl(new LocalSlot(1))).isPresent();
    }

    @Test
    void negativeSlotIsRejected() {
        assertThatThrownBy(() -> new LocalSlot(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tableDefaultsToUnknownDeclaration() {
        ProgramElementRef declared = new ProgramElementRef(1, "f");
        ProgramElementRef withBody = new ProgramElementRef(2, "closure");
        ProgramElementTable table = ProgramElementTable.builder()
                .declare(declared, line(3))
                .declare(withBody, line(4), ElementBody.builder().build())
                .build();

        assertThat(table.declarationSpan(declared)).isEqualTo(line(3));
        assertThat(table.declarationSpan(new ProgramElementRef(9, "ghost")))
                .isEqualTo(SourceSpan.UNKNOWN);
        assertThat(table.bodyOf(declared)).isEmpty();
        assertThat(table.bodyOf(withBody)).isPresent();
        assertThat(table.size()).isEqualTo(2);
    }
}
