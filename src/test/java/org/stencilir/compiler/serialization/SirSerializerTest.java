package org.stencilir.compiler.serialization;

import com.google.protobuf.ByteString;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.stencilir.compiler.IrFixtures;
import org.stencilir.compiler.api.GlobalValue;
import org.stencilir.compiler.api.InvariantViolationException;
import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.api.MalformedEncodingException;
import org.stencilir.compiler.api.SourceLocation;
import org.stencilir.compiler.api.UnknownVariantException;
import org.stencilir.compiler.ast.AstComparison;
import org.stencilir.compiler.ast.BlockStmt;
import org.stencilir.compiler.ast.Field;
import org.stencilir.compiler.ast.FieldAccessExpr;
import org.stencilir.compiler.ast.Interval;
import org.stencilir.compiler.ast.Level;
import org.stencilir.compiler.ast.LoopOrder;
import org.stencilir.compiler.ast.Stmt;
import org.stencilir.compiler.proto.hir.HirProto;
import org.stencilir.compiler.sir.GlobalVariable;
import org.stencilir.compiler.sir.Sir;
import org.stencilir.compiler.sir.Stencil;
import org.stencilir.config.IrSettings;
import org.stencilir.junit.extensions.logging.LogWatchExtension;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class SirSerializerTest {

    private final SirSerializer serializer = new SirSerializer();

    private static HirProto.GlobalVariableValue.Builder global() {
        return HirProto.GlobalVariableValue.newBuilder();
    }

    @ParameterizedTest
    @EnumSource(SerializationFormat.class)
    void roundTrip_yieldsAnEqualFile(SerializationFormat format) throws Exception {
        Sir original = IrFixtures.horizontalDiffusion();

        Sir decoded = serializer.deserialize(serializer.serialize(original, format), format);

        assertThat(decoded).isEqualTo(original);
        assertThat(decoded.getStencil("hori_diff").loc()).isEqualTo(SourceLocation.of(3, 1));
        assertThat(AstComparison.equalsWithLocations(decoded.getStencil("hori_diff").body(),
                original.getStencil("hori_diff").body())).isTrue();
    }

    @Test
    void globals_keepTheirTypesAndConstness() throws Exception {
        Map<String, GlobalVariable> globals = new LinkedHashMap<>(IrFixtures.globals());
        globals.put("steps", new GlobalVariable(GlobalValue.ofInteger(4), true));
        globals.put("flag", new GlobalVariable(GlobalValue.ofBoolean(false), false));
        Sir sir = new Sir("globals.cpp", List.of(), List.of(), globals);

        Sir decoded = serializer.deserialize(serializer.serialize(sir, SerializationFormat.BYTE), SerializationFormat.BYTE);

        assertEquals(GlobalValue.ofInteger(4), decoded.globalVariables().get("steps").value());
        assertThat(decoded.globalVariables().get("steps").isConstexpr()).isTrue();
        assertThat(decoded.globalVariables().get("flag").value()).isEqualTo(GlobalValue.ofBoolean(false));
        assertThat(decoded.globalVariables().get("dt").value().isSet()).isTrue();
        assertThat(decoded.globalVariables().get("eps").value().isSet()).isFalse();
    }

    @Test
    void unsetGlobal_decodesAsUnsetDouble() throws Exception {
        Sir sir = new Sir("globals.cpp", List.of(), List.of(),
                Map.of("n", new GlobalVariable(GlobalValue.unset(GlobalValue.Kind.INTEGER), false)));

        HirProto.HIR proto = serializer.toProto(sir);
        Sir decoded = serializer.fromProto(proto);

        assertThat(proto.getGlobalVariables().getMapMap().get("n").getValueCase())
                .isEqualTo(HirProto.GlobalVariableValue.ValueCase.VALUE_NOT_SET);
        assertThat(decoded.globalVariables().get("n").value()).isEqualTo(GlobalValue.unset(GlobalValue.Kind.DOUBLE));
    }

    @Test
    void stringGlobal_isMalformed() {
        HirProto.HIR proto = HirProto.HIR.newBuilder()
                .setFilename("globals.cpp")
                .setGlobalVariables(HirProto.GlobalVariableMap.newBuilder()
                        .putMap("name", global().setStringValue("hori").build()))
                .build();

        assertThatThrownBy(() -> serializer.deserialize(proto.toByteArray(), SerializationFormat.BYTE))
                .isInstanceOfSatisfying(MalformedEncodingException.class, e -> {
                    assertThat(e.code()).isEqualTo(IrErrorCode.MALFORMED_ENCODING);
                    assertThat(e).hasMessageContaining("name");
                });
    }

    @Test
    void globalWithTwoValues_isRejected() throws Exception {
        ByteString value = global().setBooleanValue(true).build().toByteString()
                .concat(global().setIntegerValue(3).build().toByteString());
        ByteString entry = AstSerializerTest.field(1, ByteString.copyFromUtf8("n"))
                .concat(AstSerializerTest.field(2, value));
        ByteString globals = AstSerializerTest.field(1, entry);
        byte[] bytes = serializer.toProto(IrFixtures.horizontalDiffusion()).toByteString()
                .concat(AstSerializerTest.field(3, globals)).toByteArray();

        assertThatThrownBy(() -> serializer.deserialize(bytes, SerializationFormat.BYTE))
                .isInstanceOfSatisfying(UnknownVariantException.class,
                        e -> assertThat(e.unionName()).isEqualTo("GlobalVariableValue.value"));
    }

    @Test
    void stencilWithoutBody_isMissingAField() {
        HirProto.HIR proto = HirProto.HIR.newBuilder()
                .addStencils(HirProto.Stencil.newBuilder().setName("empty"))
                .build();

        assertThatThrownBy(() -> serializer.deserialize(proto.toByteArray(), SerializationFormat.BYTE))
                .isInstanceOfSatisfying(MalformedEncodingException.class,
                        e -> assertThat(e.code()).isEqualTo(IrErrorCode.MISSING_FIELD));
    }

    @Test
    void invertedRegions_areOnlyRejectedWhenValidatingOnRead() throws Exception {
        Stmt body = BlockStmt.of(IrFixtures.region(IrFixtures.assign(FieldAccessExpr.of("out"), FieldAccessExpr.of("out")),
                new Interval(Level.of(10), 0, Level.of(2), 0), LoopOrder.FORWARD));
        Sir sir = new Sir("inverted.cpp", List.of(new Stencil("inverted", SourceLocation.UNKNOWN, body,
                List.of(new Field("out")))), List.of(), Map.of());
        byte[] bytes = serializer.serialize(sir, SerializationFormat.JSON);

        assertThat(serializer.deserialize(bytes, SerializationFormat.JSON)).isEqualTo(sir);

        SirSerializer validating = new SirSerializer(new IrSettings(SerializationFormat.JSON, true, "__code_gen_"));
        assertThatThrownBy(() -> validating.deserialize(bytes, SerializationFormat.JSON))
                .isInstanceOfSatisfying(InvariantViolationException.class,
                        e -> assertThat(e.code()).isEqualTo(IrErrorCode.INVALID_INTERVAL));
    }

    @Test
    void unknownJsonField_isMalformed() {
        byte[] bytes = "{\"filename\": \"a.cpp\", \"unknownField\": 1}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> serializer.deserialize(bytes, SerializationFormat.JSON))
                .isInstanceOf(MalformedEncodingException.class);
    }
}
