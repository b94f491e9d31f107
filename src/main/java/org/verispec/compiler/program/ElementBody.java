package org.verispec.compiler.program;

import org.verispec.compiler.api.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read-only view of an element body: its ordered argument slots and its table of local
 * declarations. For closures, the first argument is the closure environment.
 */
public final class ElementBody {

    private final List<LocalSlot> args;
    private final Map<LocalSlot, LocalDecl> localDecls;

    private ElementBody(List<LocalSlot> args, Map<LocalSlot, LocalDecl> localDecls) {
        this.args = List.copyOf(args);
        this.localDecls = Collections.unmodifiableMap(new TreeMap<>(localDecls));
    }

    /**
     * @return The argument slots in declaration order.
     */
    public List<LocalSlot> args() {
        return args;
    }

    /**
     * @return The number of arguments, including the closure environment argument.
     */
    public int argCount() {
        return args.size();
    }

    /**
     * Looks up the declaration of a local slot.
     * @param slot The slot to look up.
     * @return The declaration, or empty if the slot is not part of this body.
     */
    public Optional<LocalDecl> localDecl(LocalSlot slot) {
        return Optional.ofNullable(localDecls.get(slot));
    }

    /**
     * @return All local declarations ordered by slot index.
     */
    public Map<LocalSlot, LocalDecl> localDecls() {
        return localDecls;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds an {@link ElementBody}. Arguments receive consecutive slots starting at 0,
     * other locals continue after the last argument.
     */
    public static final class Builder {

        private final List<LocalSlot> args = new ArrayList<>();
        private final Map<LocalSlot, LocalDecl> localDecls = new TreeMap<>();
        private int nextSlot = 0;

        private Builder() {}

        /**
         * Adds an argument with its declaration.
         * @param type The declared type.
         * @param span The declaration span.
         * @return This builder.
         */
        public Builder arg(TypeRef type, SourceSpan span) {
            LocalSlot slot = new LocalSlot(nextSlot++);
            args.add(slot);
            localDecls.put(slot, new LocalDecl(slot, type, span));
            return this;
        }

        /**
         * Adds an argument whose declaration is not known to the host compiler.
         * @return This builder.
         */
        public Builder undeclaredArg() {
            args.add(new LocalSlot(nextSlot++));
            return this;
        }

        /**
         * Adds a non-argument local.
         * @param type The declared type.
         * @param span The declaration span.
         * @return This builder.
         */
        public Builder local(TypeRef type, SourceSpan span) {
            LocalSlot slot = new LocalSlot(nextSlot++);
            localDecls.put(slot, new LocalDecl(slot, type, span));
            return this;
        }

        public ElementBody build() {
            return new ElementBody(args, localDecls);
        }
    }
}
