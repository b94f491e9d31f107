package org.verispec.compiler.frontend.typing;

import com.typesafe.config.Config;
import org.verispec.compiler.program.ProgramElements;
import org.verispec.compiler.specs.common.Assertion;
import org.verispec.compiler.specs.common.SpecificationId;
import org.verispec.compiler.specs.structural.StructuralExpression;
import org.verispec.compiler.specs.structural.StructuralForAllVars;
import org.verispec.compiler.specs.typed.SpecificationMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Phase: types all structural specifications of a compilation unit.
 * <p>
 * Runs single-threaded and synchronously. The environment and the program elements are only
 * read. A consistency failure in any specification aborts the whole phase; no partially typed
 * unit is ever returned.
 */
public final class SpecificationTypingPhase {

    private static final Logger LOG = LoggerFactory.getLogger(SpecificationTypingPhase.class);

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
    public SpecificationTypingPhase(TypedExpressionEnvironment environment, ProgramElements elements,
                                    TypingConverterRegistry registry, TypingOptions options) {
        this.environment = environment;
        this.elements = elements;
        this.registry = registry;
        this.options = options;
    }

    /**
     * Creates a phase with the default converters.
     *
     * @param environment Bindings of all expression keys of the unit.
     * @param elements    Introspection into the program elements of the unit.
     * @param options     The typing options.
     */
    public SpecificationTypingPhase(TypedExpressionEnvironment environment, ProgramElements elements,
                                    TypingOptions options) {
        this(environment, elements, TypingConverterRegistry.initializeWithDefaults(), options);
    }

    /**
     * Creates a phase with the default converters and the options of {@code verispec.typing}.
     *
     * @param config      The application configuration.
     * @param environment Bindings of all expression keys of the unit.
     * @param elements    Introspection into the program elements of the unit.
     * @return The phase.
     */
    public static SpecificationTypingPhase fromConfig(Config config, TypedExpressionEnvironment environment,
                                                      ProgramElements elements) {
        return new SpecificationTypingPhase(environment, elements, TypingOptions.fromConfig(config));
    }

    /**
     * Types every specification of the unit.
     *
     * @param unit The structural specifications.
     * @return The typed specifications together with the unit's external specifications.
     * @throws org.verispec.compiler.api.SpecificationConsistencyException if any specification cannot be typed.
     */
    public TypedSpecificationUnit run(StructuralSpecificationUnit unit) {
        SpecificationTyper typer = new SpecificationTyper(environment, elements, registry, options);
        SpecificationMap.Builder specs = SpecificationMap.builder();

        for (Map.Entry<SpecificationId, Assertion<StructuralExpression, StructuralForAllVars>> entry
                : unit.specifications().entrySet()) {
            LOG.debug("Typing specification {}", entry.getKey());
            specs.put(entry.getKey(), typer.type(entry.getValue()));
        }

        SpecificationMap typed = specs.build();
        LOG.info("Typed {} specifications ({} external) using {} expression bindings",
                typed.size(), unit.externs().size(), environment.size());
        return new TypedSpecificationUnit(typed, unit.externs());
    }
}
