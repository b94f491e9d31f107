package org.verispec.compiler.frontend.typing;

/**
 * Converts one kind of structural specification node into its typed counterpart.
 * <p>
 * Implementations are stateless and pure: the result depends only on the node and the
 * read-only data reachable from the context. Children are converted through the context so
 * that every node kind is handled by its registered converter.
 *
 * @param <S> The structural node type.
 * @param <T> The typed node type.
 */
@FunctionalInterface
public interface IStructuralToTypedConverter<S, T> {

    /**
     * Converts the given node.
     *
     * @param node The structural node.
     * @param ctx  The typing context.
     * @return The typed node.
     * @throws org.verispec.compiler.api.SpecificationConsistencyException if the node cannot be typed.
     */
    T convert(S node, TypingContext ctx);
}
