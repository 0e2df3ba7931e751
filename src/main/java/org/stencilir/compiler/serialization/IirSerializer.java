package org.stencilir.compiler.serialization;

import org.stencilir.compiler.api.GlobalValue;
import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.api.MalformedEncodingException;
import org.stencilir.compiler.ast.BoundaryConditionDeclStmt;
import org.stencilir.compiler.ast.LoopOrder;
import org.stencilir.compiler.ast.StencilCall;
import org.stencilir.compiler.ast.StencilCallDeclStmt;
import org.stencilir.compiler.ast.Stmt;
import org.stencilir.compiler.iir.DoMethod;
import org.stencilir.compiler.iir.Iir;
import org.stencilir.compiler.iir.MultiStage;
import org.stencilir.compiler.iir.Stage;
import org.stencilir.compiler.iir.StatementAccessPair;
import org.stencilir.compiler.iir.Stencil;
import org.stencilir.compiler.iir.StencilAttributes;
import org.stencilir.compiler.iir.StencilInstantiation;
import org.stencilir.compiler.iir.access.Accesses;
import org.stencilir.compiler.iir.access.Extent;
import org.stencilir.compiler.iir.access.Extents;
import org.stencilir.compiler.iir.metadata.LegalDimensions;
import org.stencilir.compiler.iir.metadata.StencilDescStatement;
import org.stencilir.compiler.iir.metadata.StencilMetaInfo;
import org.stencilir.compiler.iir.metadata.VariableVersions;
import org.stencilir.compiler.proto.iir.IirProto;
import org.stencilir.compiler.proto.statements.StatementsProto;
import org.stencilir.config.IrSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serializes a {@link StencilInstantiation} as the {@code StencilInstantiation} message.
 * <p>
 * The node ID counter of the instantiation is not written; the decoded instantiation restarts it
 * after the largest ID it contains. Reserved fields of the metadata message are never produced.
 */
public class IirSerializer extends ProtoSerializer<StencilInstantiation, IirProto.StencilInstantiation> {

    public IirSerializer(SerializationFormat defaultFormat, boolean validateOnRead) {
        super(IirProto.StencilInstantiation.getDefaultInstance(), IirProto.StencilInstantiation.class, defaultFormat, validateOnRead);
    }

    public IirSerializer(boolean validateOnRead) {
        this(SerializationFormat.BYTE, validateOnRead);
    }

    public IirSerializer() {
        this(false);
    }

    public IirSerializer(IrSettings settings) {
        this(settings.format(), settings.validateOnRead());
    }

    @Override
    protected void validate(StencilInstantiation instantiation) {
        instantiation.validate();
    }

    // region Encoding

    @Override
    public IirProto.StencilInstantiation toProto(StencilInstantiation instantiation) {
        return IirProto.StencilInstantiation.newBuilder()
                .setMetadata(encodeMetadata(instantiation.getMetadata()))
                .setInternalIR(encodeIir(instantiation.getIir()))
                .build();
    }

    private static IirProto.IIR encodeIir(Iir iir) {
        IirProto.IIR.Builder builder = IirProto.IIR.newBuilder();
        for (Stencil stencil : iir.getChildren()) {
            IirProto.Stencil.Builder s = IirProto.Stencil.newBuilder()
                    .setStencilID(stencil.getId())
                    .setAttr(IirProto.Attributes.newBuilder().setAttrBits(stencil.getAttributes().bits()));
            for (MultiStage multiStage : stencil.getChildren()) {
                IirProto.MultiStage.Builder ms = IirProto.MultiStage.newBuilder()
                        .setMulitStageID(multiStage.getId())
                        .setLooporderValue(multiStage.getLoopOrder().code());
                for (Stage stage : multiStage.getChildren()) {
                    IirProto.Stage.Builder st = IirProto.Stage.newBuilder().setStageID(stage.getId());
                    for (DoMethod doMethod : stage.getChildren()) {
                        IirProto.DoMethod.Builder dm = IirProto.DoMethod.newBuilder()
                                .setDoMethodID(doMethod.getId())
                                .setInterval(AstProtoCodec.encodeInterval(doMethod.getInterval()));
                        doMethod.getChildren().forEach(pair -> dm.addStmtaccesspairs(encodePair(pair)));
                        st.addDomethods(dm);
                    }
                    ms.addStages(st);
                }
                s.addMultistages(ms);
            }
            builder.addStencils(s);
        }
        return builder.build();
    }

    private static IirProto.StatementAccessPair encodePair(StatementAccessPair pair) {
        return IirProto.StatementAccessPair.newBuilder()
                .setStatement(IirProto.Statement.newBuilder().setASTStmt(AstProtoCodec.encode(pair.getStatement())))
                .setCallerAccesses(encodeAccesses(pair.getCallerAccesses()))
                .setCalleeAccesses(encodeAccesses(pair.getCalleeAccesses()))
                .build();
    }

    private static IirProto.Accesses encodeAccesses(Accesses accesses) {
        IirProto.Accesses.Builder builder = IirProto.Accesses.newBuilder();
        accesses.getWrites().forEach((id, extents) -> builder.putWriteAccess(id, encodeExtents(extents)));
        accesses.getReads().forEach((id, extents) -> builder.putReadAccess(id, encodeExtents(extents)));
        return builder.build();
    }

    private static IirProto.Extents encodeExtents(Extents extents) {
        IirProto.Extents.Builder builder = IirProto.Extents.newBuilder();
        for (Extent extent : extents.toList()) {
            builder.addExtents(IirProto.Extent.newBuilder().setMinus(extent.minus()).setPlus(extent.plus()));
        }
        return builder.build();
    }

    private static IirProto.StencilMetaInfo encodeMetadata(StencilMetaInfo metadata) {
        IirProto.StencilMetaInfo.Builder builder = IirProto.StencilMetaInfo.newBuilder()
                .putAllAccessIDToName(metadata.getAccessIdToName())
                .putAllLiteralIDToName(metadata.getLiteralIdToName())
                .addAllFieldAccessIDs(metadata.getFieldIds())
                .addAllAPIFieldIDs(metadata.getApiFieldIds())
                .addAllTemporaryFieldIDs(metadata.getTemporaryFieldIds())
                .addAllGlobalVariableIDs(metadata.getGlobalVariableIds())
                .setVersionedFields(encodeVersions(metadata.getVariableVersions()))
                .setStencilLocation(AstProtoCodec.encodeLocation(metadata.getStencilLocation()))
                .setStencilName(metadata.getStencilName())
                .setFileName(metadata.getFileName());

        for (StencilDescStatement statement : metadata.getStencilDescStatements()) {
            IirProto.StencilDescStatement.Builder s = IirProto.StencilDescStatement.newBuilder()
                    .setStmt(AstProtoCodec.encode(statement.statement()));
            statement.stackTrace().forEach(call -> s.addStacktrace(AstProtoCodec.encodeStencilCall(call)));
            builder.addStencilDescStatements(s);
        }
        metadata.getStencilCalls().forEach((id, call) -> builder.putIDToStencilCall(id, AstProtoCodec.encode(call)));
        metadata.getBoundaryConditions().forEach((name, bc) -> builder.putFieldnameToBoundaryCondition(name, AstProtoCodec.encode(bc)));
        metadata.getLegalDimensions().forEach((id, dims) -> builder.putFieldIDtoLegalDimensions(id,
                IirProto.Array3i.newBuilder().setInt1(dims.i() ? 1 : 0).setInt2(dims.j() ? 1 : 0).setInt3(dims.k() ? 1 : 0).build()));
        metadata.getGlobalValues().forEach((name, value) -> builder.putGlobalVariableToValue(name, encodeGlobal(value)));
        return builder.build();
    }

    private static IirProto.VariableVersions encodeVersions(VariableVersions versions) {
        IirProto.VariableVersions.Builder builder = IirProto.VariableVersions.newBuilder()
                .addAllVersionIDs(versions.getVersionIds())
                .putAllVersionIDToOriginalID(versions.getOriginalByVersion());
        versions.getVersionsByOriginal().forEach((original, list) -> builder.putVariableVersionMap(original,
                IirProto.AllVersionedFields.newBuilder().addAllAllIDs(list).build()));
        return builder.build();
    }

    private static IirProto.GlobalValueAndType encodeGlobal(GlobalValue value) {
        return IirProto.GlobalValueAndType.newBuilder()
                .setTypeValue(value.kind().code())
                .setValue(value.asDouble())
                .setValueIsSet(value.isSet())
                .build();
    }

    // endregion

    // region Decoding

    @Override
    public StencilInstantiation fromProto(IirProto.StencilInstantiation proto) throws MalformedEncodingException {
        return new StencilInstantiation(decodeMetadata(proto.getMetadata()), decodeIir(proto.getInternalIR()));
    }

    private static Iir decodeIir(IirProto.IIR proto) throws MalformedEncodingException {
        Iir iir = new Iir();
        for (IirProto.Stencil s : proto.getStencilsList()) {
            Stencil stencil = new Stencil(s.getStencilID(), new StencilAttributes(s.getAttr().getAttrBits()), List.of());
            for (IirProto.MultiStage ms : s.getMultistagesList()) {
                LoopOrder order = AstProtoCodec.enumValue("MultiStage.LoopOrder", ms.getLooporderValue(), LoopOrder::fromCode);
                MultiStage multiStage = new MultiStage(ms.getMulitStageID(), order);
                for (IirProto.Stage st : ms.getStagesList()) {
                    Stage stage = new Stage(st.getStageID());
                    for (IirProto.DoMethod dm : st.getDomethodsList()) {
                        AstProtoCodec.require(dm.hasInterval(), "DoMethod.interval");
                        DoMethod doMethod = new DoMethod(dm.getDoMethodID(), AstProtoCodec.decodeInterval(dm.getInterval()));
                        for (IirProto.StatementAccessPair pair : dm.getStmtaccesspairsList()) {
                            doMethod.append(decodePair(pair));
                        }
                        stage.append(doMethod);
                    }
                    multiStage.append(stage);
                }
                stencil.append(multiStage);
            }
            iir.append(stencil);
        }
        return iir;
    }

    private static StatementAccessPair decodePair(IirProto.StatementAccessPair proto) throws MalformedEncodingException {
        AstProtoCodec.require(proto.hasStatement() && proto.getStatement().hasASTStmt(), "StatementAccessPair.statement");
        return new StatementAccessPair(AstProtoCodec.decode(proto.getStatement().getASTStmt()),
                decodeAccesses(proto.getCallerAccesses()), decodeAccesses(proto.getCalleeAccesses()));
    }

    private static Accesses decodeAccesses(IirProto.Accesses proto) throws MalformedEncodingException {
        Accesses accesses = new Accesses();
        for (Map.Entry<Integer, IirProto.Extents> entry : proto.getWriteAccessMap().entrySet()) {
            accesses.addWrite(entry.getKey(), decodeExtents(entry.getValue()));
        }
        for (Map.Entry<Integer, IirProto.Extents> entry : proto.getReadAccessMap().entrySet()) {
            accesses.addRead(entry.getKey(), decodeExtents(entry.getValue()));
        }
        return accesses;
    }

    private static Extents decodeExtents(IirProto.Extents proto) throws MalformedEncodingException {
        if (proto.getExtentsCount() != 3) {
            throw new MalformedEncodingException(IrErrorCode.MALFORMED_ENCODING,
                    "Extents have " + proto.getExtentsCount() + " dimensions instead of 3");
        }
        List<Extent> extents = new ArrayList<>(3);
        for (IirProto.Extent e : proto.getExtentsList()) {
            extents.add(new Extent(e.getMinus(), e.getPlus()));
        }
        return new Extents(extents.get(0), extents.get(1), extents.get(2));
    }

    private static StencilMetaInfo decodeMetadata(IirProto.StencilMetaInfo proto) throws MalformedEncodingException {
        StencilMetaInfo metadata = new StencilMetaInfo();
        proto.getAccessIDToNameMap().forEach(metadata::restoreAccessIdName);
        proto.getLiteralIDToNameMap().forEach(metadata::addLiteral);
        proto.getFieldAccessIDsList().forEach(metadata::addFieldId);
        proto.getAPIFieldIDsList().forEach(metadata::addApiFieldId);
        proto.getTemporaryFieldIDsList().forEach(metadata::addTemporaryFieldId);
        proto.getGlobalVariableIDsList().forEach(metadata::addGlobalVariableId);
        metadata.setVariableVersions(decodeVersions(proto.getVersionedFields()));

        for (IirProto.StencilDescStatement s : proto.getStencilDescStatementsList()) {
            AstProtoCodec.require(s.hasStmt(), "StencilDescStatement.stmt");
            List<StencilCall> stackTrace = new ArrayList<>(s.getStacktraceCount());
            for (StatementsProto.StencilCall call : s.getStacktraceList()) {
                stackTrace.add(AstProtoCodec.decodeStencilCall(call));
            }
            metadata.addStencilDescStatement(new StencilDescStatement(AstProtoCodec.decode(s.getStmt()), stackTrace));
        }
        for (Map.Entry<Integer, StatementsProto.Stmt> entry : proto.getIDToStencilCallMap().entrySet()) {
            Stmt stmt = AstProtoCodec.decode(entry.getValue());
            if (!(stmt instanceof StencilCallDeclStmt call)) {
                throw new MalformedEncodingException(IrErrorCode.MALFORMED_ENCODING,
                        "Stencil " + entry.getKey() + " maps to a statement that is not a stencil call");
            }
            metadata.addStencilCall(entry.getKey(), call);
        }
        for (Map.Entry<String, StatementsProto.Stmt> entry : proto.getFieldnameToBoundaryConditionMap().entrySet()) {
            Stmt stmt = AstProtoCodec.decode(entry.getValue());
            if (!(stmt instanceof BoundaryConditionDeclStmt condition)) {
                throw new MalformedEncodingException(IrErrorCode.MALFORMED_ENCODING,
                        "Field '" + entry.getKey() + "' maps to a statement that is not a boundary condition");
            }
            metadata.addBoundaryCondition(entry.getKey(), condition);
        }
        proto.getFieldIDtoLegalDimensionsMap().forEach((id, dims) -> metadata.setLegalDimensions(id,
                new LegalDimensions(dims.getInt1() != 0, dims.getInt2() != 0, dims.getInt3() != 0)));
        for (Map.Entry<String, IirProto.GlobalValueAndType> entry : proto.getGlobalVariableToValueMap().entrySet()) {
            metadata.setGlobalValue(entry.getKey(), decodeGlobal(entry.getValue()));
        }

        metadata.setStencilLocation(AstProtoCodec.decodeLocation(proto.hasStencilLocation(), proto.getStencilLocation()));
        metadata.setStencilName(proto.getStencilName());
        metadata.setFileName(proto.getFileName());
        return metadata;
    }

    private static VariableVersions decodeVersions(IirProto.VariableVersions proto) {
        Map<Integer, List<Integer>> versionsByOriginal = new TreeMap<>();
        proto.getVariableVersionMapMap().forEach((original, all) -> versionsByOriginal.put(original, all.getAllIDsList()));
        return VariableVersions.fromRaw(versionsByOriginal, proto.getVersionIDsList(), proto.getVersionIDToOriginalIDMap());
    }

    private static GlobalValue decodeGlobal(IirProto.GlobalValueAndType proto) throws MalformedEncodingException {
        GlobalValue.Kind kind = AstProtoCodec.enumValue("GlobalValueAndType.TypeKind", proto.getTypeValue(), GlobalValue.Kind::fromCode);
        if (!proto.getValueIsSet()) {
            return GlobalValue.unset(kind);
        }
        double value = proto.getValue();
        return switch (kind) {
            case BOOLEAN -> GlobalValue.ofBoolean(value != 0.0);
            case INTEGER -> GlobalValue.ofInteger(toInt(value));
            case DOUBLE -> GlobalValue.ofDouble(value);
        };
    }

    private static int toInt(double value) throws MalformedEncodingException {
        if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new MalformedEncodingException(IrErrorCode.MALFORMED_ENCODING,
                    "Integer global holds " + value + ", which is not a 32-bit integer");
        }
        return (int) value;
    }

    // endregion
}
