package org.stencilir.compiler.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stencilir.compiler.api.InvariantViolationException;
import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.ast.AstNode;
import org.stencilir.compiler.ast.Interval;
import org.stencilir.compiler.ast.TreeWalker;
import org.stencilir.compiler.ast.VerticalRegionDeclStmt;
import org.stencilir.compiler.diagnostics.DiagnosticsEngine;
import org.stencilir.compiler.iir.DoMethod;
import org.stencilir.compiler.iir.MultiStage;
import org.stencilir.compiler.iir.Stage;
import org.stencilir.compiler.iir.StatementAccessPair;
import org.stencilir.compiler.iir.Stencil;
import org.stencilir.compiler.iir.StencilInstantiation;
import org.stencilir.compiler.iir.access.Accesses;
import org.stencilir.compiler.iir.metadata.StencilDescStatement;
import org.stencilir.compiler.iir.metadata.StencilMetaInfo;
import org.stencilir.compiler.sir.Sir;
import org.stencilir.compiler.sir.StencilFunction;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the invariants of decoded or hand-built IR that the constructors cannot check locally.
 * <p>
 * All violations are collected before failing, so one run reports every problem.
 */
public class IrValidator {

    private static final Logger LOG = LoggerFactory.getLogger(IrValidator.class);

    /**
     * Validates a stencil instantiation.
     * @param instantiation The instantiation.
     * @throws InvariantViolationException listing all violations, if there are any.
     */
    public void validate(StencilInstantiation instantiation) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        check(instantiation, diagnostics);
        failOnErrors(diagnostics, "stencil instantiation '" + instantiation.getMetadata().getStencilName() + "'");
    }

    /**
     * Validates the high-level IR: the intervals of stencil functions and vertical regions.
     * @param sir The high-level IR.
     * @throws InvariantViolationException listing all violations, if there are any.
     */
    public void validate(Sir sir) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        for (StencilFunction function : sir.stencilFunctions()) {
            for (Interval interval : function.intervals()) {
                checkInterval(interval, "stencil function '" + function.name() + "'", diagnostics);
            }
            checkRegions(function.bodies(), diagnostics);
        }
        for (org.stencilir.compiler.sir.Stencil stencil : sir.stencils()) {
            checkRegions(List.of(stencil.body()), diagnostics);
        }
        failOnErrors(diagnostics, "file '" + sir.fileName() + "'");
    }

    /**
     * Runs every check on an instantiation, reporting into the given engine.
     * @param instantiation The instantiation.
     * @param diagnostics Receives the violations.
     */
    public void check(StencilInstantiation instantiation, DiagnosticsEngine diagnostics) {
        StencilMetaInfo metadata = instantiation.getMetadata();
        checkTree(instantiation, diagnostics);
        checkClassification(metadata, diagnostics);
        metadata.getVariableVersions().validate(diagnostics);
        for (int version : metadata.getVariableVersions().getVersionIds()) {
            checkNamed(metadata, version, "version", diagnostics);
        }
        for (StencilDescStatement statement : metadata.getStencilDescStatements()) {
            checkRegions(List.of(statement.statement()), diagnostics);
        }
    }

    private void checkTree(StencilInstantiation instantiation, DiagnosticsEngine diagnostics) {
        StencilMetaInfo metadata = instantiation.getMetadata();
        Set<Integer> stencilIds = new HashSet<>();
        for (Stencil stencil : instantiation.getIir().getChildren()) {
            if (!stencilIds.add(stencil.getId())) {
                diagnostics.reportError(IrErrorCode.DUPLICATE_NODE_ID, "Stencil ID " + stencil.getId() + " is used twice");
            }
            Set<Integer> multiStageIds = new HashSet<>();
            Set<Integer> stageIds = new HashSet<>();
            Set<Integer> doMethodIds = new HashSet<>();
            for (MultiStage multiStage : stencil.getChildren()) {
                unique(multiStageIds, multiStage.getId(), "multi-stage", stencil, diagnostics);
                for (Stage stage : multiStage.getChildren()) {
                    unique(stageIds, stage.getId(), "stage", stencil, diagnostics);
                    for (DoMethod doMethod : stage.getChildren()) {
                        unique(doMethodIds, doMethod.getId(), "do-method", stencil, diagnostics);
                        checkInterval(doMethod.getInterval(), doMethod.toString(), diagnostics);
                        for (StatementAccessPair pair : doMethod.getChildren()) {
                            checkAccesses(metadata, pair.getCallerAccesses(), doMethod, diagnostics);
                            checkAccesses(metadata, pair.getCalleeAccesses(), doMethod, diagnostics);
                        }
                    }
                }
            }
        }
    }

    private void unique(Set<Integer> seen, int id, String kind, Stencil stencil, DiagnosticsEngine diagnostics) {
        if (!seen.add(id)) {
            diagnostics.reportError(IrErrorCode.DUPLICATE_NODE_ID,
                    "The " + kind + " ID " + id + " is used twice in " + stencil);
        }
    }

    private void checkAccesses(StencilMetaInfo metadata, Accesses accesses, DoMethod owner, DiagnosticsEngine diagnostics) {
        Set<Integer> ids = new HashSet<>(accesses.getWrites().keySet());
        ids.addAll(accesses.getReads().keySet());
        for (int id : ids) {
            if (metadata.findNameFromAccessId(id).isEmpty()) {
                diagnostics.reportError(IrErrorCode.UNKNOWN_ACCESS_ID,
                        "AccessID " + id + " accessed in " + owner + " is not registered");
            }
        }
    }

    private void checkClassification(StencilMetaInfo metadata, DiagnosticsEngine diagnostics) {
        for (int id : metadata.getApiFieldIds()) {
            if (!metadata.isField(id)) {
                diagnostics.reportError(IrErrorCode.OVERLAPPING_CLASSIFICATION, "API field " + id + " is not a field");
            }
            if (metadata.isTemporaryField(id)) {
                diagnostics.reportError(IrErrorCode.OVERLAPPING_CLASSIFICATION, "AccessID " + id + " is both API field and temporary");
            }
        }
        for (int id : metadata.getTemporaryFieldIds()) {
            if (!metadata.isField(id)) {
                diagnostics.reportError(IrErrorCode.OVERLAPPING_CLASSIFICATION, "Temporary " + id + " is not a field");
            }
        }
        for (int id : metadata.getGlobalVariableIds()) {
            if (metadata.isField(id)) {
                diagnostics.reportError(IrErrorCode.OVERLAPPING_CLASSIFICATION, "AccessID " + id + " is both field and global");
            }
            checkNamed(metadata, id, "global variable", diagnostics);
        }
        for (int id : metadata.getFieldIds()) {
            checkNamed(metadata, id, "field", diagnostics);
        }
        metadata.getNameClashes().forEach((name, ids) -> diagnostics.reportError(IrErrorCode.DUPLICATE_NAME,
                "Name '" + name + "' is bound to AccessIDs " + ids));
        for (int id : metadata.getLiteralIdToName().keySet()) {
            if (metadata.isField(id) || metadata.isGlobalVariable(id)) {
                diagnostics.reportError(IrErrorCode.OVERLAPPING_CLASSIFICATION, "Literal " + id + " is also classified as field or global");
            }
        }
    }

    private void checkNamed(StencilMetaInfo metadata, int id, String kind, DiagnosticsEngine diagnostics) {
        if (id <= 0 || !metadata.getAccessIdToName().containsKey(id)) {
            diagnostics.reportError(IrErrorCode.UNNAMED_ACCESS_ID, "The " + kind + " " + id + " has no name");
        }
    }

    private void checkRegions(List<? extends AstNode> roots, DiagnosticsEngine diagnostics) {
        TreeWalker walker = TreeWalker.forType(VerticalRegionDeclStmt.class, decl -> checkInterval(
                decl.region().interval(), "vertical region at " + decl.region().loc(), diagnostics));
        walker.walk(roots);
    }

    private void checkInterval(Interval interval, String owner, DiagnosticsEngine diagnostics) {
        if (!interval.isValid()) {
            diagnostics.reportError(IrErrorCode.INVALID_INTERVAL, "Inverted interval " + interval + " in " + owner);
        }
    }

    private void failOnErrors(DiagnosticsEngine diagnostics, String subject) {
        if (diagnostics.hasErrors()) {
            LOG.debug("Validation of {} failed:\n{}", subject, diagnostics.summary());
            throw new InvariantViolationException(diagnostics.getErrors());
        }
        LOG.debug("Validated {}", subject);
    }
}
