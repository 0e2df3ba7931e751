package org.stencilir.compiler.validation;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.stencilir.compiler.IrFixtures;
import org.stencilir.compiler.api.InvariantViolationException;
import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.api.SourceLocation;
import org.stencilir.compiler.ast.BlockStmt;
import org.stencilir.compiler.ast.FieldAccessExpr;
import org.stencilir.compiler.ast.Interval;
import org.stencilir.compiler.ast.Level;
import org.stencilir.compiler.ast.LoopOrder;
import org.stencilir.compiler.diagnostics.Diagnostic;
import org.stencilir.compiler.diagnostics.DiagnosticsEngine;
import org.stencilir.compiler.iir.DoMethod;
import org.stencilir.compiler.iir.MultiStage;
import org.stencilir.compiler.iir.Stage;
import org.stencilir.compiler.iir.StatementAccessPair;
import org.stencilir.compiler.iir.Stencil;
import org.stencilir.compiler.iir.StencilAttributes;
import org.stencilir.compiler.iir.StencilInstantiation;
import org.stencilir.compiler.iir.access.Accesses;
import org.stencilir.compiler.iir.access.Extents;
import org.stencilir.compiler.iir.metadata.StencilDescStatement;
import org.stencilir.compiler.iir.metadata.StencilMetaInfo;
import org.stencilir.compiler.iir.metadata.VariableVersions;
import org.stencilir.compiler.sir.Sir;
import org.stencilir.compiler.sir.StencilFunction;
import org.stencilir.junit.extensions.logging.AllowLog;
import org.stencilir.junit.extensions.logging.LogLevel;
import org.stencilir.junit.extensions.logging.LogWatchExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class IrValidatorTest {

    private final IrValidator validator = new IrValidator();

    private static StencilInstantiation singleStatement(Accesses accesses) {
        StencilInstantiation instantiation = new StencilInstantiation();
        Stencil stencil = instantiation.newStencil(StencilAttributes.NONE);
        MultiStage multiStage = instantiation.newMultiStage(LoopOrder.FORWARD);
        Stage stage = instantiation.newStage();
        DoMethod doMethod = instantiation.newDoMethod(Interval.full());
        doMethod.append(new StatementAccessPair(
                IrFixtures.assign(FieldAccessExpr.of("out"), FieldAccessExpr.of("in")), accesses, null));
        stage.append(doMethod);
        multiStage.append(stage);
        stencil.append(multiStage);
        instantiation.getIir().append(stencil);
        return instantiation;
    }

    private static List<IrErrorCode> codes(StencilInstantiation instantiation) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        new IrValidator().check(instantiation, diagnostics);
        return diagnostics.getErrors().stream().map(Diagnostic::code).toList();
    }

    @Test
    void validate_acceptsAConsistentInstantiation() {
        StencilInstantiation instantiation = singleStatement(new Accesses());
        StencilMetaInfo metadata = instantiation.getMetadata();
        int in = metadata.registerApiField("in");
        int out = metadata.registerApiField("out");
        Accesses accesses = instantiation.getIir().get(0).get(0).get(0).get(0).get(0).getCallerAccesses();
        accesses.addWrite(out, Extents.ZERO);
        accesses.addRead(in, Extents.ZERO);
        metadata.createVersion(in);

        assertThatCode(() -> validator.validate(instantiation)).doesNotThrowAnyException();
    }

    @Test
    void check_reportsUnregisteredAccessIds() {
        Accesses accesses = new Accesses();
        accesses.addRead(17, Extents.ZERO);

        assertThat(codes(singleStatement(accesses))).containsExactly(IrErrorCode.UNKNOWN_ACCESS_ID);
    }

    @Test
    void check_reportsOverlappingClassification() {
        StencilInstantiation instantiation = singleStatement(new Accesses());
        StencilMetaInfo metadata = instantiation.getMetadata();
        int id = metadata.registerApiField("in");
        metadata.addTemporaryFieldId(id);
        metadata.addGlobalVariableId(id);

        assertThat(codes(instantiation)).containsOnly(IrErrorCode.OVERLAPPING_CLASSIFICATION);
    }

    @Test
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*StencilMetaInfo")
    void check_reportsNamesBoundToSeveralIds() {
        StencilInstantiation instantiation = singleStatement(new Accesses());
        StencilMetaInfo metadata = instantiation.getMetadata();
        metadata.restoreAccessIdName(1, "in");
        metadata.restoreAccessIdName(2, "in");
        metadata.addFieldId(1);
        metadata.addFieldId(2);

        assertThat(codes(instantiation)).containsExactly(IrErrorCode.DUPLICATE_NAME);
    }

    @Test
    void check_reportsUnnamedIds() {
        StencilInstantiation instantiation = singleStatement(new Accesses());
        instantiation.getMetadata().addFieldId(5);

        assertThat(codes(instantiation)).containsExactly(IrErrorCode.UNNAMED_ACCESS_ID);
    }

    @Test
    void check_reportsInconsistentVersionTables() {
        StencilInstantiation instantiation = singleStatement(new Accesses());
        instantiation.getMetadata().registerApiField("in");
        instantiation.getMetadata().setVariableVersions(
                VariableVersions.fromRaw(Map.of(1, List.of(2)), List.of(2), Map.of()));

        assertThat(codes(instantiation)).contains(IrErrorCode.INCONSISTENT_VERSIONS, IrErrorCode.UNNAMED_ACCESS_ID);
    }

    @Test
    void check_reportsInvertedRegionsInDescriptionStatements() {
        StencilInstantiation instantiation = singleStatement(new Accesses());
        Interval inverted = new Interval(Level.end(), 1, Level.start(), 0);
        instantiation.getMetadata().addStencilDescStatement(new StencilDescStatement(
                IrFixtures.region(BlockStmt.of(), inverted, LoopOrder.FORWARD)));

        assertThat(codes(instantiation)).containsExactly(IrErrorCode.INVALID_INTERVAL);
    }

    @Test
    void validate_listsEveryViolation() {
        Accesses accesses = new Accesses();
        accesses.addRead(17, Extents.ZERO);
        accesses.addWrite(18, Extents.ZERO);

        assertThatThrownBy(() -> validator.validate(singleStatement(accesses)))
                .isInstanceOfSatisfying(InvariantViolationException.class,
                        e -> assertThat(e.violations()).hasSize(2));
    }

    @Test
    void validateSir_checksFunctionIntervalsAndRegions() {
        Interval inverted = Interval.between(5, 1);
        StencilFunction function = new StencilFunction("f", SourceLocation.UNKNOWN,
                List.of(BlockStmt.of()), List.of(inverted), List.of());
        org.stencilir.compiler.sir.Stencil stencil = new org.stencilir.compiler.sir.Stencil("s", SourceLocation.UNKNOWN,
                BlockStmt.of(IrFixtures.region(BlockStmt.of(), inverted, LoopOrder.BACKWARD)), List.of());
        Sir sir = new Sir("f.cpp", List.of(stencil), List.of(function), Map.of());

        assertThatThrownBy(() -> validator.validate(sir))
                .isInstanceOfSatisfying(InvariantViolationException.class, e -> assertThat(e.violations())
                        .extracting(Diagnostic::code)
                        .containsExactly(IrErrorCode.INVALID_INTERVAL, IrErrorCode.INVALID_INTERVAL));
    }

    @Test
    void validateSir_acceptsTheFixture() {
        assertThatCode(() -> validator.validate(IrFixtures.horizontalDiffusion())).doesNotThrowAnyException();
    }
}
