package org.verispec.compiler.frontend.typing.converters;

import org.verispec.compiler.api.SpecErrorCode;
import org.verispec.compiler.api.SpecificationConsistencyException;
import org.verispec.compiler.frontend.typing.IStructuralToTypedConverter;
import org.verispec.compiler.frontend.typing.TypingContext;
import org.verispec.compiler.program.ElementBody;
import org.verispec.compiler.program.LocalDecl;
import org.verispec.compiler.program.LocalSlot;
import org.verispec.compiler.program.ProgramElementRef;
import org.verispec.compiler.specs.structural.StructuralForAllVars;
import org.verispec.compiler.specs.typed.ForAllVars;
import org.verispec.compiler.specs.typed.QuantifiedVar;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the quantified variables from the body of the closure that implements the quantifier.
 * <p>
 * The first argument of that body is the closure environment, the remaining arguments are the
 * quantified variables in declaration order. Their number must equal the declared arity;
 * the result is never truncated or padded.
 */
public final class ForAllVarsConverter implements IStructuralToTypedConverter<StructuralForAllVars, ForAllVars> {

    @Override
    public ForAllVars convert(StructuralForAllVars node, TypingContext ctx) {
        ProgramElementRef owner = ctx.environment().resolve(node.specId(), node.exprId());
        ElementBody body = ctx.elements().bodyOf(owner).orElseThrow(() ->
                new SpecificationConsistencyException(SpecErrorCode.MISSING_ELEMENT_BODY,
                        "Quantifier " + node.specId() + "_" + node.exprId() + " is bound to " + owner
                                + " which has no body"));

        List<QuantifiedVar> vars = new ArrayList<>();
        List<LocalSlot> args = body.args();
        for (int i = 1; i < args.size(); i++) {
            LocalSlot slot = args.get(i);
            LocalDecl decl = body.localDecl(slot).orElseThrow(() ->
                    new SpecificationConsistencyException(SpecErrorCode.MISSING_ARGUMENT_DECLARATION,
                            "Argument " + slot + " of " + owner + " has no local declaration"));
            vars.add(new QuantifiedVar(slot, decl.type()));
        }

        if (body.argCount() - 1 != node.count()) {
            throw new SpecificationConsistencyException(SpecErrorCode.QUANTIFIER_ARITY_MISMATCH,
                    "Quantifier " + node.specId() + "_" + node.exprId() + " declares " + node.count()
                            + " variables but " + owner + " takes " + body.argCount() + " arguments");
        }
        if (vars.size() != node.count()) {
            throw new SpecificationConsistencyException(SpecErrorCode.QUANTIFIER_VARIABLE_COUNT_MISMATCH,
                    "Quantifier " + node.specId() + "_" + node.exprId() + " declares " + node.count()
                            + " variables but " + vars.size() + " were collected");
        }
        return new ForAllVars(node.specId(), node.exprId(), vars);
    }
}
