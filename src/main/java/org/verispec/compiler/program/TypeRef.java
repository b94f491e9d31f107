package org.verispec.compiler.program;

/**
 * Declared type of a local variable as reported by the host compiler.
 *
 * @param name The rendered type name, e.g. {@code usize}.
 */
public record TypeRef(String name) {

    @Override
    public String toString() {
        return name;
    }
}
