package org.stencilir.compiler.iir.metadata;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.stencilir.compiler.api.GlobalValue;
import org.stencilir.compiler.api.InvariantViolationException;
import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.api.LookupFailureException;
import org.stencilir.compiler.api.SourceLocation;
import org.stencilir.compiler.ast.StencilCall;
import org.stencilir.compiler.ast.StencilCallDeclStmt;
import org.stencilir.junit.extensions.logging.ExpectLog;
import org.stencilir.junit.extensions.logging.LogLevel;
import org.stencilir.junit.extensions.logging.LogWatchExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class StencilMetaInfoTest {

    private StencilMetaInfo metadata;
    private int in;
    private int out;
    private int tmp;

    @BeforeEach
    void setUp() {
        metadata = new StencilMetaInfo();
        in = metadata.registerApiField("in");
        out = metadata.registerApiField("out");
        tmp = metadata.registerTemporaryField("tmp");
    }

    @Test
    void register_assignsFreshPositiveIdsAndClassifies() {
        int local = metadata.registerVariable("a");
        int global = metadata.registerGlobalVariable("dt");

        assertThat(List.of(in, out, tmp, local, global)).containsExactly(1, 2, 3, 4, 5);
        assertThat(metadata.getApiFieldIds()).containsExactly(in, out);
        assertThat(metadata.getFieldIds()).containsExactlyInAnyOrder(in, out, tmp);
        assertThat(metadata.isTemporaryField(tmp)).isTrue();
        assertThat(metadata.isApiField(tmp)).isFalse();
        assertThat(metadata.isVariable(local)).isTrue();
        assertThat(metadata.isVariable(global)).isFalse();
        assertThat(metadata.isGlobalVariable(global)).isTrue();
    }

    @Test
    void registerLiteral_usesNegativeIdsPerOccurrence() {
        int first = metadata.registerLiteral("1.0");
        int second = metadata.registerLiteral("1.0");

        assertThat(first).isEqualTo(-1);
        assertThat(second).isEqualTo(-2);
        assertThat(metadata.isLiteral(first)).isTrue();
        assertThat(metadata.getNameFromAccessId(second)).isEqualTo("1.0");
        assertThat(metadata.hasName("1.0")).isFalse();
    }

    @Test
    void namesAndIds_areBijective() {
        assertThat(metadata.getNameFromAccessId(out)).isEqualTo("out");
        assertThat(metadata.getAccessIdFromName("out")).isEqualTo(out);
        assertThatThrownBy(() -> metadata.registerVariable("out"))
                .isInstanceOfSatisfying(InvariantViolationException.class,
                        e -> assertThat(e.code()).isEqualTo(IrErrorCode.DUPLICATE_NAME));
        assertThatThrownBy(() -> metadata.addAccessIdName(in, "other"))
                .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void lookups_throwOrReturnEmptyForUnknownEntries() {
        assertThatThrownBy(() -> metadata.getNameFromAccessId(99))
                .isInstanceOfSatisfying(LookupFailureException.class,
                        e -> assertThat(e.code()).isEqualTo(IrErrorCode.UNKNOWN_ACCESS_ID));
        assertThatThrownBy(() -> metadata.getAccessIdFromName("nope")).isInstanceOf(LookupFailureException.class);
        assertThatThrownBy(() -> metadata.getStencilCall(7))
                .isInstanceOfSatisfying(LookupFailureException.class,
                        e -> assertThat(e.code()).isEqualTo(IrErrorCode.UNKNOWN_STENCIL));
        assertThatThrownBy(() -> metadata.getLegalDimensions(in))
                .isInstanceOfSatisfying(LookupFailureException.class,
                        e -> assertThat(e.code()).isEqualTo(IrErrorCode.UNKNOWN_FIELD));
        assertThat(metadata.findNameFromAccessId(99)).isEmpty();
        assertThat(metadata.findAccessIdFromName("nope")).isEmpty();
    }

    @Test
    void createVersion_ofAField_registersANamedTemporary() {
        int first = metadata.createVersion(in);
        int second = metadata.createVersion(first);

        assertThat(metadata.getNameFromAccessId(first)).isEqualTo("in_1");
        assertThat(metadata.getNameFromAccessId(second)).isEqualTo("in_2");
        assertThat(metadata.isTemporaryField(first)).isTrue();
        assertThat(metadata.getVariableVersions().originalOf(second)).isEqualTo(in);
        assertThat(metadata.getVariableVersions().versionsOf(in)).containsExactly(first, second);
    }

    @Test
    void createVersion_ofAVariable_registersAVariable() {
        int local = metadata.registerVariable("a");

        int version = metadata.createVersion(local);

        assertThat(metadata.isVariable(version)).isTrue();
        assertThat(metadata.isField(version)).isFalse();
        assertThat(metadata.getNameFromAccessId(version)).isEqualTo("a_1");
    }

    @Test
    void createVersion_skipsNamesAlreadyTaken() {
        metadata.registerVariable("out_1");

        int version = metadata.createVersion(out);

        assertThat(metadata.getNameFromAccessId(version)).isEqualTo("out_2");
    }

    @Test
    void globals_distinguishUnsetFromZero() {
        metadata.setGlobalValue("eps", GlobalValue.unset(GlobalValue.Kind.DOUBLE));
        metadata.setGlobalValue("dt", GlobalValue.ofDouble(0.0));

        assertThat(metadata.isGlobalSet("eps")).isFalse();
        assertThat(metadata.isGlobalSet("dt")).isTrue();
        assertThat(metadata.getGlobalValue("dt").asDouble()).isZero();
        assertThatThrownBy(() -> metadata.getGlobalValue("nope"))
                .isInstanceOfSatisfying(LookupFailureException.class,
                        e -> assertThat(e.code()).isEqualTo(IrErrorCode.UNKNOWN_GLOBAL));
    }

    @Test
    void restoringIds_advancesTheAllocator() {
        StencilMetaInfo restored = new StencilMetaInfo();
        restored.addAccessIdName(10, "in");
        restored.addFieldId(10);
        restored.addLiteral(-4, "3");

        assertThat(restored.registerVariable("a")).isEqualTo(11);
        assertThat(restored.registerLiteral("5")).isEqualTo(-5);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Name 'a' is bound to both AccessID 1 and AccessID 3")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Name 'b' is bound to both AccessID 2 and AccessID 4")
    void restoringClashingNames_keepsEveryBinding() {
        StencilMetaInfo restored = new StencilMetaInfo();
        restored.restoreAccessIdName(3, "a");
        restored.restoreAccessIdName(1, "a");
        restored.restoreAccessIdName(2, "b");
        restored.restoreAccessIdName(4, "b");
        restored.restoreAccessIdName(5, "c");

        assertThat(restored.getAccessIdToName()).hasSize(5);
        assertThat(restored.getAccessIdFromName("a")).isEqualTo(1);
        assertThat(restored.getNameClashes()).containsExactly(entry("a", List.of(1, 3)), entry("b", List.of(2, 4)));
        assertThat(restored.registerVariable("d")).isEqualTo(6);
        assertThat(metadata.getNameClashes()).isEmpty();
    }

    @Test
    void equals_ignoresStencilLocation() {
        StencilMetaInfo other = new StencilMetaInfo();
        other.registerApiField("in");
        other.registerApiField("out");
        other.registerTemporaryField("tmp");
        other.setStencilLocation(SourceLocation.of(10, 2));

        assertThat(other).isEqualTo(metadata);
    }

    @Test
    void stencilCalls_andDescStatements_keepInsertionOrder() {
        StencilCallDeclStmt call = new StencilCallDeclStmt(new StencilCall("__code_gen_1", List.of()));
        metadata.addStencilCall(1, call);
        metadata.addStencilDescStatement(new StencilDescStatement(call));
        metadata.insertStencilDescStatement(0, new StencilDescStatement(call, List.of(new StencilCall("outer", List.of()))));

        assertThat(metadata.getStencilCall(1)).isEqualTo(call);
        assertThat(metadata.getStencilDescStatements()).hasSize(2);
        assertThat(metadata.getStencilDescStatements().get(0).stackTrace()).hasSize(1);
        assertThat(metadata.removeStencilDescStatement(0).stackTrace()).extracting(StencilCall::callee).containsExactly("outer");
    }
}
