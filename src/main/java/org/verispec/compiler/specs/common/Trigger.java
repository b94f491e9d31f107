package org.verispec.compiler.specs.common;

import java.util.List;

/**
 * An ordered sequence of terms guiding quantifier instantiation. May be empty.
 *
 * @param terms The trigger terms.
 * @param <E>   Expression payload type.
 */
public record Trigger<E>(List<E> terms) {

    public Trigger {
        terms = List.copyOf(terms);
    }
}
