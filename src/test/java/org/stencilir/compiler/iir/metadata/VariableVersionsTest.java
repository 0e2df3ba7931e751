package org.stencilir.compiler.iir.metadata;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stencilir.compiler.api.InvariantViolationException;
import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.api.LookupFailureException;
import org.stencilir.compiler.diagnostics.Diagnostic;
import org.stencilir.compiler.diagnostics.DiagnosticsEngine;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class VariableVersionsTest {

    private VariableVersions versions;

    @BeforeEach
    void setUp() {
        versions = new VariableVersions();
        versions.addVersion(3, 103);
        versions.addVersion(3, 203);
    }

    @Test
    void addVersion_recordsLineageInBothDirections() {
        assertThat(versions.originalOf(103)).isEqualTo(3);
        assertThat(versions.originalOf(203)).isEqualTo(3);
        assertThat(versions.versionsOf(3)).containsExactly(103, 203);
        assertThat(versions.getVersionIds()).containsExactly(103, 203);
        assertThat(versions.isVersioned(3)).isTrue();
        assertThat(versions.isVersion(3)).isFalse();
        assertThat(versions.isVersion(103)).isTrue();
    }

    @Test
    void addVersion_rejectsReparenting() {
        assertThatThrownBy(() -> versions.addVersion(9, 103))
                .isInstanceOfSatisfying(InvariantViolationException.class,
                        e -> assertThat(e.code()).isEqualTo(IrErrorCode.VERSION_REPARENTED));
        assertThat(versions.originalOf(103)).isEqualTo(3);
    }

    @Test
    void addVersion_rejectsSelfVersioning() {
        assertThatThrownBy(() -> versions.addVersion(5, 5))
                .isInstanceOfSatisfying(InvariantViolationException.class,
                        e -> assertThat(e.code()).isEqualTo(IrErrorCode.SELF_VERSION));
        assertThatThrownBy(() -> versions.addVersion(103, 3))
                .isInstanceOfSatisfying(InvariantViolationException.class,
                        e -> assertThat(e.code()).isEqualTo(IrErrorCode.SELF_VERSION));
    }

    @Test
    void addVersion_rejectsTurningAnOriginalIntoAVersion() {
        assertThatThrownBy(() -> versions.addVersion(9, 3))
                .isInstanceOfSatisfying(InvariantViolationException.class,
                        e -> assertThat(e.code()).isEqualTo(IrErrorCode.VERSION_REPARENTED));
    }

    @Test
    void addVersion_attachesVersionsOfVersionsToTheRoot() {
        versions.addVersion(103, 303);

        assertThat(versions.originalOf(303)).isEqualTo(3);
        assertThat(versions.versionsOf(103)).containsExactly(103, 203, 303);
        assertThat(versions.getVersionsByOriginal()).containsOnlyKeys(3);
    }

    @Test
    void addVersion_isIdempotentForTheSamePair() {
        versions.addVersion(3, 103);

        assertThat(versions.versionsOf(3)).containsExactly(103, 203);
    }

    @Test
    void lookups_failForUnknownIds() {
        assertThatThrownBy(() -> versions.originalOf(3)).isInstanceOf(LookupFailureException.class);
        assertThatThrownBy(() -> versions.versionsOf(42)).isInstanceOf(LookupFailureException.class);
        assertThat(versions.findOriginalOf(42)).isEmpty();
    }

    @Test
    void validate_acceptsTablesBuiltThroughAddVersion() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        versions.validate(diagnostics);

        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void validate_reportsInconsistentRawTables() {
        VariableVersions raw = VariableVersions.fromRaw(
                Map.of(3, List.of(103, 3)), List.of(103), Map.of(103, 9));
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        raw.validate(diagnostics);

        assertThat(diagnostics.getErrors()).extracting(Diagnostic::code)
                .contains(IrErrorCode.SELF_VERSION, IrErrorCode.INCONSISTENT_VERSIONS);
    }
}
