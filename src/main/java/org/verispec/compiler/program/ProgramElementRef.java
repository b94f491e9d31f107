package org.verispec.compiler.program;

/**
 * Resolved reference to a program element, typically the closure or function whose body
 * computes the value of one specification expression.
 * Only produced by resolving an expression key against the typed expression environment.
 *
 * @param index The host compiler's index of the element.
 * @param name  Human-readable path of the element, used in messages only.
 */
public record ProgramElementRef(int index, String name) {

    @Override
    public String toString() {
        return name + "#" + index;
    }
}
