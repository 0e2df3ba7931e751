package org.stencilir.compiler.lowering;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stencilir.compiler.api.LookupFailureException;
import org.stencilir.compiler.api.LoweringException;
import org.stencilir.compiler.ast.BlockStmt;
import org.stencilir.compiler.ast.BoundaryConditionDeclStmt;
import org.stencilir.compiler.ast.Field;
import org.stencilir.compiler.ast.StencilCall;
import org.stencilir.compiler.ast.StencilCallDeclStmt;
import org.stencilir.compiler.ast.Stmt;
import org.stencilir.compiler.ast.VerticalRegion;
import org.stencilir.compiler.ast.VerticalRegionDeclStmt;
import org.stencilir.compiler.diagnostics.DiagnosticsEngine;
import org.stencilir.compiler.iir.DoMethod;
import org.stencilir.compiler.iir.MultiStage;
import org.stencilir.compiler.iir.Stage;
import org.stencilir.compiler.iir.Stencil;
import org.stencilir.compiler.iir.StencilAttributes;
import org.stencilir.compiler.iir.StencilInstantiation;
import org.stencilir.compiler.iir.metadata.LegalDimensions;
import org.stencilir.compiler.iir.metadata.StencilDescStatement;
import org.stencilir.compiler.iir.metadata.StencilMetaInfo;
import org.stencilir.compiler.sir.Sir;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lowers one stencil of the high-level IR into a {@link StencilInstantiation}.
 * <p>
 * Each maximal run of consecutive vertical regions in the stencil's body becomes one IIR
 * {@link Stencil}, with one multi-stage, stage and do-method per region. In the stencil's control
 * flow the run is replaced by a call of the generated stencil. Boundary conditions are registered
 * per field; all other top-level statements are kept as they are.
 */
public class StencilLowering {

    /** The callee prefix of the calls that replace lowered vertical regions. */
    public static final String DEFAULT_CODE_GEN_PREFIX = "__code_gen_";

    private static final Logger LOG = LoggerFactory.getLogger(StencilLowering.class);

    private final String codeGenPrefix;

    public StencilLowering() {
        this(DEFAULT_CODE_GEN_PREFIX);
    }

    /**
     * @param codeGenPrefix The callee prefix of the generated stencil calls.
     */
    public StencilLowering(String codeGenPrefix) {
        this.codeGenPrefix = Objects.requireNonNull(codeGenPrefix, "codeGenPrefix");
    }

    /**
     * Lowers a stencil.
     *
     * @param sir The high-level IR.
     * @param stencilName The stencil to lower.
     * @return The new instantiation.
     * @throws LookupFailureException if the file has no stencil of that name.
     * @throws LoweringException if the stencil's body cannot be lowered, e.g. it accesses an undeclared field.
     */
    public StencilInstantiation lower(Sir sir, String stencilName) throws LoweringException {
        org.stencilir.compiler.sir.Stencil source = sir.getStencil(stencilName);
        StencilInstantiation instantiation = new StencilInstantiation();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        LoweringContext context = new LoweringContext(instantiation, sir, diagnostics);

        StencilMetaInfo metadata = instantiation.getMetadata();
        metadata.setStencilName(source.name());
        metadata.setStencilLocation(source.loc());
        metadata.setFileName(sir.fileName());
        registerFields(source.fields(), metadata);
        sir.globalVariables().forEach((name, global) -> metadata.setGlobalValue(name, global.value()));

        List<VerticalRegionDeclStmt> run = new ArrayList<>();
        for (Stmt statement : topLevelStatements(source.body())) {
            if (statement instanceof VerticalRegionDeclStmt region) {
                run.add(region);
                continue;
            }
            flushRun(run, context);
            if (statement instanceof BoundaryConditionDeclStmt condition) {
                condition.fields().forEach(field -> metadata.addBoundaryCondition(field.name(), condition));
            } else {
                metadata.addStencilDescStatement(new StencilDescStatement(statement));
            }
        }
        flushRun(run, context);

        if (diagnostics.hasErrors()) {
            LOG.debug("Lowering of stencil '{}' failed:\n{}", stencilName, diagnostics.summary());
            throw new LoweringException("Cannot lower stencil '" + stencilName + "':\n" + diagnostics.summary());
        }
        LOG.info("Lowered stencil '{}' into {} IIR stencil(s) with {} AccessIDs",
                stencilName, instantiation.getIir().size(), metadata.getAccessIdToName().size());
        return instantiation;
    }

    private void registerFields(List<Field> fields, StencilMetaInfo metadata) {
        for (Field field : fields) {
            int id = field.isTemporary()
                    ? metadata.registerTemporaryField(field.name())
                    : metadata.registerApiField(field.name());
            metadata.setLegalDimensions(id, LegalDimensions.fromFlags(field.fieldDimensions()));
        }
    }

    private void flushRun(List<VerticalRegionDeclStmt> run, LoweringContext context) {
        if (run.isEmpty()) {
            return;
        }
        StencilInstantiation instantiation = context.instantiation();
        Stencil stencil = instantiation.newStencil(StencilAttributes.NONE);
        for (VerticalRegionDeclStmt decl : run) {
            stencil.append(lowerRegion(decl.region(), context));
        }
        instantiation.getIir().append(stencil);

        StencilCallDeclStmt call = new StencilCallDeclStmt(
                new StencilCall(run.get(0).loc(), codeGenPrefix + stencil.getId(), List.of()), run.get(0).loc());
        instantiation.getMetadata().addStencilCall(stencil.getId(), call);
        instantiation.getMetadata().addStencilDescStatement(new StencilDescStatement(call));
        LOG.debug("Lowered {} vertical region(s) into {}", run.size(), stencil);
        run.clear();
    }

    private MultiStage lowerRegion(VerticalRegion region, LoweringContext context) {
        StencilInstantiation instantiation = context.instantiation();
        MultiStage multiStage = instantiation.newMultiStage(region.loopOrder());
        Stage stage = instantiation.newStage();
        DoMethod doMethod = instantiation.newDoMethod(region.interval());
        context.enterScope();
        try {
            for (Stmt statement : topLevelStatements(region.body())) {
                doMethod.append(AccessCollector.collect(statement, context));
            }
        } finally {
            context.leaveScope();
        }
        stage.append(doMethod);
        multiStage.append(stage);
        return multiStage;
    }

    private static List<Stmt> topLevelStatements(Stmt body) {
        return body instanceof BlockStmt block ? block.statements() : List.of(body);
    }
}
