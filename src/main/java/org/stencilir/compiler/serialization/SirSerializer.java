package org.stencilir.compiler.serialization;

import org.stencilir.compiler.api.GlobalValue;
import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.api.MalformedEncodingException;
import org.stencilir.compiler.ast.Interval;
import org.stencilir.compiler.ast.StencilFunctionArg;
import org.stencilir.compiler.ast.Stmt;
import org.stencilir.compiler.proto.hir.HirProto;
import org.stencilir.compiler.proto.statements.StatementsProto;
import org.stencilir.compiler.sir.GlobalVariable;
import org.stencilir.compiler.sir.Sir;
import org.stencilir.compiler.sir.Stencil;
import org.stencilir.compiler.sir.StencilFunction;
import org.stencilir.compiler.validation.IrValidator;
import org.stencilir.config.IrSettings;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes the high-level IR as the {@code HIR} message.
 * <p>
 * A global declared without a value is written without a value branch. Since the message has no
 * other place for the type of such a global, it is read back as an unset double.
 */
public class SirSerializer extends ProtoSerializer<Sir, HirProto.HIR> {

    public SirSerializer(SerializationFormat defaultFormat, boolean validateOnRead) {
        super(HirProto.HIR.getDefaultInstance(), HirProto.HIR.class, defaultFormat, validateOnRead);
    }

    public SirSerializer(boolean validateOnRead) {
        this(SerializationFormat.BYTE, validateOnRead);
    }

    public SirSerializer() {
        this(false);
    }

    public SirSerializer(IrSettings settings) {
        this(settings.format(), settings.validateOnRead());
    }

    @Override
    protected void validate(Sir sir) {
        new IrValidator().validate(sir);
    }

    @Override
    public HirProto.HIR toProto(Sir sir) {
        HirProto.HIR.Builder builder = HirProto.HIR.newBuilder().setFilename(sir.fileName());
        for (Stencil stencil : sir.stencils()) {
            HirProto.Stencil.Builder s = HirProto.Stencil.newBuilder()
                    .setName(stencil.name())
                    .setLoc(AstProtoCodec.encodeLocation(stencil.loc()))
                    .setAst(AstProtoCodec.encodeAst(stencil.body()));
            stencil.fields().forEach(f -> s.addFields(AstProtoCodec.encodeField(f)));
            builder.addStencils(s);
        }
        for (StencilFunction function : sir.stencilFunctions()) {
            HirProto.StencilFunction.Builder f = HirProto.StencilFunction.newBuilder()
                    .setName(function.name())
                    .setLoc(AstProtoCodec.encodeLocation(function.loc()));
            function.bodies().forEach(body -> f.addAsts(AstProtoCodec.encodeAst(body)));
            function.intervals().forEach(interval -> f.addIntervals(AstProtoCodec.encodeInterval(interval)));
            function.arguments().forEach(argument -> f.addArguments(AstProtoCodec.encodeArgument(argument)));
            builder.addStencilFunctions(f);
        }
        HirProto.GlobalVariableMap.Builder globals = HirProto.GlobalVariableMap.newBuilder();
        sir.globalVariables().forEach((name, global) -> globals.putMap(name, encodeGlobal(global)));
        return builder.setGlobalVariables(globals).build();
    }

    @Override
    public Sir fromProto(HirProto.HIR proto) throws MalformedEncodingException {
        List<Stencil> stencils = new ArrayList<>(proto.getStencilsCount());
        for (HirProto.Stencil s : proto.getStencilsList()) {
            AstProtoCodec.require(s.hasAst(), "Stencil.ast");
            stencils.add(new Stencil(s.getName(), AstProtoCodec.decodeLocation(s.hasLoc(), s.getLoc()),
                    AstProtoCodec.decodeAst(s.getAst()), AstProtoCodec.decodeFields(s.getFieldsList())));
        }

        List<StencilFunction> functions = new ArrayList<>(proto.getStencilFunctionsCount());
        for (HirProto.StencilFunction f : proto.getStencilFunctionsList()) {
            List<Stmt> bodies = new ArrayList<>(f.getAstsCount());
            for (StatementsProto.AST ast : f.getAstsList()) {
                bodies.add(AstProtoCodec.decodeAst(ast));
            }
            List<Interval> intervals = new ArrayList<>(f.getIntervalsCount());
            for (StatementsProto.Interval interval : f.getIntervalsList()) {
                intervals.add(AstProtoCodec.decodeInterval(interval));
            }
            List<StencilFunctionArg> arguments = new ArrayList<>(f.getArgumentsCount());
            for (StatementsProto.StencilFunctionArg argument : f.getArgumentsList()) {
                arguments.add(AstProtoCodec.decodeArgument(argument));
            }
            functions.add(new StencilFunction(f.getName(), AstProtoCodec.decodeLocation(f.hasLoc(), f.getLoc()),
                    bodies, intervals, arguments));
        }

        Map<String, GlobalVariable> globals = new LinkedHashMap<>();
        for (Map.Entry<String, HirProto.GlobalVariableValue> entry : proto.getGlobalVariables().getMapMap().entrySet()) {
            globals.put(entry.getKey(), decodeGlobal(entry.getKey(), entry.getValue()));
        }
        return new Sir(proto.getFilename(), stencils, functions, globals);
    }

    private static HirProto.GlobalVariableValue encodeGlobal(GlobalVariable global) {
        HirProto.GlobalVariableValue.Builder builder = HirProto.GlobalVariableValue.newBuilder()
                .setIsConstexpr(global.isConstexpr());
        GlobalValue value = global.value();
        if (!value.isSet()) {
            return builder.build();
        }
        if (value instanceof GlobalValue.BoolValue b) {
            builder.setBooleanValue(b.value());
        } else if (value instanceof GlobalValue.IntValue i) {
            builder.setIntegerValue(i.value());
        } else {
            builder.setDoubleValue(((GlobalValue.DoubleValue) value).value());
        }
        return builder.build();
    }

    private static GlobalVariable decodeGlobal(String name, HirProto.GlobalVariableValue proto) throws MalformedEncodingException {
        GlobalValue value;
        switch (proto.getValueCase()) {
            case BOOLEAN_VALUE:
                value = GlobalValue.ofBoolean(proto.getBooleanValue());
                break;
            case INTEGER_VALUE:
                value = GlobalValue.ofInteger(proto.getIntegerValue());
                break;
            case DOUBLE_VALUE:
                value = GlobalValue.ofDouble(proto.getDoubleValue());
                break;
            case STRING_VALUE:
                throw new MalformedEncodingException(IrErrorCode.MALFORMED_ENCODING,
                        "Global '" + name + "' has a string value; only boolean, integer and double globals are supported");
            default:
                value = GlobalValue.unset(GlobalValue.Kind.DOUBLE);
                break;
        }
        return new GlobalVariable(value, proto.getIsConstexpr());
    }
}
