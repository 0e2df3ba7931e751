package org.stencilir.compiler.serialization;

import com.google.protobuf.Message;
import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.api.MalformedEncodingException;
import org.stencilir.compiler.api.SourceLocation;
import org.stencilir.compiler.api.UnknownVariantException;
import org.stencilir.compiler.ast.AssignmentExpr;
import org.stencilir.compiler.ast.AstVisitor;
import org.stencilir.compiler.ast.BinaryOperator;
import org.stencilir.compiler.ast.BlockStmt;
import org.stencilir.compiler.ast.BoundaryConditionDeclStmt;
import org.stencilir.compiler.ast.BuiltinType;
import org.stencilir.compiler.ast.Dimension;
import org.stencilir.compiler.ast.Direction;
import org.stencilir.compiler.ast.Expr;
import org.stencilir.compiler.ast.ExprStmt;
import org.stencilir.compiler.ast.Field;
import org.stencilir.compiler.ast.FieldAccessExpr;
import org.stencilir.compiler.ast.FieldOffset;
import org.stencilir.compiler.ast.FunCallExpr;
import org.stencilir.compiler.ast.IfStmt;
import org.stencilir.compiler.ast.Interval;
import org.stencilir.compiler.ast.Level;
import org.stencilir.compiler.ast.LiteralAccessExpr;
import org.stencilir.compiler.ast.LoopOrder;
import org.stencilir.compiler.ast.Offset;
import org.stencilir.compiler.ast.ReturnStmt;
import org.stencilir.compiler.ast.StencilCall;
import org.stencilir.compiler.ast.StencilCallDeclStmt;
import org.stencilir.compiler.ast.StencilFunArgExpr;
import org.stencilir.compiler.ast.StencilFunCallExpr;
import org.stencilir.compiler.ast.StencilFunctionArg;
import org.stencilir.compiler.ast.Stmt;
import org.stencilir.compiler.ast.TernaryOperator;
import org.stencilir.compiler.ast.Type;
import org.stencilir.compiler.ast.UnaryOperator;
import org.stencilir.compiler.ast.VarAccessExpr;
import org.stencilir.compiler.ast.VarDeclStmt;
import org.stencilir.compiler.ast.VerticalRegion;
import org.stencilir.compiler.ast.VerticalRegionDeclStmt;
import org.stencilir.compiler.proto.statements.StatementsProto;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Maps the AST and the declarations shared by both IR levels to and from their protobuf messages.
 * <p>
 * Decoding is strict: a union without a branch, an unknown enum code or a missing required
 * sub-message is an error, never a default.
 */
final class AstProtoCodec {

    private static final Encoder ENCODER = new Encoder();

    private AstProtoCodec() {
        throw new IllegalStateException("Utility class");
    }

    // region Encoding

    static StatementsProto.Stmt encode(Stmt stmt) {
        return (StatementsProto.Stmt) stmt.accept(ENCODER);
    }

    static StatementsProto.Expr encode(Expr expr) {
        return (StatementsProto.Expr) expr.accept(ENCODER);
    }

    static StatementsProto.AST encodeAst(Stmt root) {
        return StatementsProto.AST.newBuilder().setRoot(encode(root)).build();
    }

    static StatementsProto.SourceLocation encodeLocation(SourceLocation loc) {
        return StatementsProto.SourceLocation.newBuilder().setLine(loc.line()).setColumn(loc.column()).build();
    }

    static StatementsProto.Field encodeField(Field field) {
        return StatementsProto.Field.newBuilder()
                .setName(field.name())
                .setLoc(encodeLocation(field.loc()))
                .setIsTemporary(field.isTemporary())
                .addAllFieldDimensions(field.fieldDimensions())
                .build();
    }

    static StatementsProto.StencilCall encodeStencilCall(StencilCall call) {
        StatementsProto.StencilCall.Builder builder = StatementsProto.StencilCall.newBuilder()
                .setLoc(encodeLocation(call.loc()))
                .setCallee(call.callee());
        call.arguments().forEach(f -> builder.addArguments(encodeField(f)));
        return builder.build();
    }

    static StatementsProto.Interval encodeInterval(Interval interval) {
        StatementsProto.Interval.Builder builder = StatementsProto.Interval.newBuilder()
                .setLowerOffset(interval.lowerOffset())
                .setUpperOffset(interval.upperOffset());
        if (interval.lowerLevel() instanceof Level.Special special) {
            builder.setSpecialLowerLevelValue(special.code());
        } else {
            builder.setLowerLevel(((Level.Exact) interval.lowerLevel()).value());
        }
        if (interval.upperLevel() instanceof Level.Special special) {
            builder.setSpecialUpperLevelValue(special.code());
        } else {
            builder.setUpperLevel(((Level.Exact) interval.upperLevel()).value());
        }
        return builder.build();
    }

    static StatementsProto.StencilFunctionArg encodeArgument(StencilFunctionArg argument) {
        StatementsProto.StencilFunctionArg.Builder builder = StatementsProto.StencilFunctionArg.newBuilder();
        if (argument instanceof Field field) {
            builder.setFieldValue(encodeField(field));
        } else if (argument instanceof Direction direction) {
            builder.setDirectionValue(StatementsProto.Direction.newBuilder()
                    .setName(direction.name())
                    .setLoc(encodeLocation(direction.loc())));
        } else {
            Offset offset = (Offset) argument;
            builder.setOffsetValue(StatementsProto.Offset.newBuilder()
                    .setName(offset.name())
                    .setLoc(encodeLocation(offset.loc())));
        }
        return builder.build();
    }

    private static StatementsProto.Type encodeType(Type type) {
        StatementsProto.Type.Builder builder = StatementsProto.Type.newBuilder()
                .setIsConst(type.isConst())
                .setIsVolatile(type.isVolatile());
        if (type.isBuiltin()) {
            builder.setBuiltinType(encodeBuiltin(type.builtin()));
        } else {
            builder.setName(type.name());
        }
        return builder.build();
    }

    private static StatementsProto.BuiltinType encodeBuiltin(BuiltinType type) {
        return StatementsProto.BuiltinType.newBuilder().setTypeIdValue(type.code()).build();
    }

    private static StatementsProto.VerticalRegion encodeRegion(VerticalRegion region) {
        return StatementsProto.VerticalRegion.newBuilder()
                .setLoc(encodeLocation(region.loc()))
                .setAst(encodeAst(region.body()))
                .setInterval(encodeInterval(region.interval()))
                .setLoopOrderValue(region.loopOrder().code())
                .build();
    }

    /**
     * Statements map to {@link StatementsProto.Stmt}, expressions to {@link StatementsProto.Expr}.
     */
    private static final class Encoder implements AstVisitor<Message> {

        private static StatementsProto.Stmt stmt(StatementsProto.Stmt.Builder builder) {
            return builder.build();
        }

        private static StatementsProto.Expr expr(StatementsProto.Expr.Builder builder) {
            return builder.build();
        }

        private List<StatementsProto.Expr> all(List<Expr> exprs) {
            List<StatementsProto.Expr> out = new ArrayList<>(exprs.size());
            exprs.forEach(e -> out.add(encode(e)));
            return out;
        }

        @Override
        public Message visitBlockStmt(BlockStmt s) {
            StatementsProto.BlockStmt.Builder block = StatementsProto.BlockStmt.newBuilder().setLoc(encodeLocation(s.loc()));
            s.statements().forEach(child -> block.addStatements(encode(child)));
            return stmt(StatementsProto.Stmt.newBuilder().setBlockStmt(block));
        }

        @Override
        public Message visitExprStmt(ExprStmt s) {
            return stmt(StatementsProto.Stmt.newBuilder().setExprStmt(StatementsProto.ExprStmt.newBuilder()
                    .setExpr(encode(s.expr()))
                    .setLoc(encodeLocation(s.loc()))));
        }

        @Override
        public Message visitReturnStmt(ReturnStmt s) {
            return stmt(StatementsProto.Stmt.newBuilder().setReturnStmt(StatementsProto.ReturnStmt.newBuilder()
                    .setExpr(encode(s.expr()))
                    .setLoc(encodeLocation(s.loc()))));
        }

        @Override
        public Message visitVarDeclStmt(VarDeclStmt s) {
            return stmt(StatementsProto.Stmt.newBuilder().setVarDeclStmt(StatementsProto.VarDeclStmt.newBuilder()
                    .setType(encodeType(s.type()))
                    .setName(s.name())
                    .setDimension(s.dimension())
                    .setOp(s.op())
                    .addAllInitList(all(s.initList()))
                    .setLoc(encodeLocation(s.loc()))));
        }

        @Override
        public Message visitStencilCallDeclStmt(StencilCallDeclStmt s) {
            return stmt(StatementsProto.Stmt.newBuilder().setStencilCallDeclStmt(StatementsProto.StencilCallDeclStmt.newBuilder()
                    .setStencilCall(encodeStencilCall(s.call()))
                    .setLoc(encodeLocation(s.loc()))));
        }

        @Override
        public Message visitVerticalRegionDeclStmt(VerticalRegionDeclStmt s) {
            return stmt(StatementsProto.Stmt.newBuilder().setVerticalRegionDeclStmt(StatementsProto.VerticalRegionDeclStmt.newBuilder()
                    .setVerticalRegion(encodeRegion(s.region()))
                    .setLoc(encodeLocation(s.loc()))));
        }

        @Override
        public Message visitBoundaryConditionDeclStmt(BoundaryConditionDeclStmt s) {
            StatementsProto.BoundaryConditionDeclStmt.Builder bc = StatementsProto.BoundaryConditionDeclStmt.newBuilder()
                    .setFunctor(s.functor())
                    .setLoc(encodeLocation(s.loc()));
            s.fields().forEach(f -> bc.addFields(encodeField(f)));
            return stmt(StatementsProto.Stmt.newBuilder().setBoundaryConditionDeclStmt(bc));
        }

        @Override
        public Message visitIfStmt(IfStmt s) {
            StatementsProto.IfStmt.Builder builder = StatementsProto.IfStmt.newBuilder()
                    .setCondPart(encode(s.condStmt()))
                    .setThenPart(encode(s.thenStmt()))
                    .setLoc(encodeLocation(s.loc()));
            s.elsePart().ifPresent(e -> builder.setElsePart(encode(e)));
            return stmt(StatementsProto.Stmt.newBuilder().setIfStmt(builder));
        }

        @Override
        public Message visitUnaryOperator(UnaryOperator e) {
            return expr(StatementsProto.Expr.newBuilder().setUnaryOperator(StatementsProto.UnaryOperator.newBuilder()
                    .setOp(e.op())
                    .setOperand(encode(e.operand()))
                    .setLoc(encodeLocation(e.loc()))));
        }

        @Override
        public Message visitBinaryOperator(BinaryOperator e) {
            return expr(StatementsProto.Expr.newBuilder().setBinaryOperator(StatementsProto.BinaryOperator.newBuilder()
                    .setLeft(encode(e.left()))
                    .setOp(e.op())
                    .setRight(encode(e.right()))
                    .setLoc(encodeLocation(e.loc()))));
        }

        @Override
        public Message visitAssignmentExpr(AssignmentExpr e) {
            return expr(StatementsProto.Expr.newBuilder().setAssignmentExpr(StatementsProto.AssignmentExpr.newBuilder()
                    .setLeft(encode(e.left()))
                    .setOp(e.op())
                    .setRight(encode(e.right()))
                    .setLoc(encodeLocation(e.loc()))));
        }

        @Override
        public Message visitTernaryOperator(TernaryOperator e) {
            return expr(StatementsProto.Expr.newBuilder().setTernaryOperator(StatementsProto.TernaryOperator.newBuilder()
                    .setCond(encode(e.cond()))
                    .setLeft(encode(e.left()))
                    .setRight(encode(e.right()))
                    .setLoc(encodeLocation(e.loc()))));
        }

        @Override
        public Message visitFunCallExpr(FunCallExpr e) {
            return expr(StatementsProto.Expr.newBuilder().setFunCallExpr(StatementsProto.FunCallExpr.newBuilder()
                    .setCallee(e.callee())
                    .addAllArguments(all(e.arguments()))
                    .setLoc(encodeLocation(e.loc()))));
        }

        @Override
        public Message visitStencilFunCallExpr(StencilFunCallExpr e) {
            return expr(StatementsProto.Expr.newBuilder().setStencilFunCallExpr(StatementsProto.StencilFunCallExpr.newBuilder()
                    .setCallee(e.callee())
                    .addAllArguments(all(e.arguments()))
                    .setLoc(encodeLocation(e.loc()))));
        }

        @Override
        public Message visitStencilFunArgExpr(StencilFunArgExpr e) {
            return expr(StatementsProto.Expr.newBuilder().setStencilFunArgExpr(StatementsProto.StencilFunArgExpr.newBuilder()
                    .setDimension(StatementsProto.Dimension.newBuilder().setDirectionValue(e.dimension().code()))
                    .setOffset(e.offset())
                    .setArgumentIndex(e.argumentIndex())
                    .setLoc(encodeLocation(e.loc()))));
        }

        @Override
        public Message visitVarAccessExpr(VarAccessExpr e) {
            StatementsProto.VarAccessExpr.Builder builder = StatementsProto.VarAccessExpr.newBuilder()
                    .setName(e.name())
                    .setIsExternal(e.isExternal())
                    .setLoc(encodeLocation(e.loc()));
            e.arrayIndex().ifPresent(i -> builder.setIndex(encode(i)));
            return expr(StatementsProto.Expr.newBuilder().setVarAccessExpr(builder));
        }

        @Override
        public Message visitFieldAccessExpr(FieldAccessExpr e) {
            StatementsProto.FieldAccessExpr.Builder builder = StatementsProto.FieldAccessExpr.newBuilder()
                    .setName(e.name())
                    .addAllOffset(e.offset().offset())
                    .setNegateOffset(e.negateOffset())
                    .setLoc(encodeLocation(e.loc()));
            if (e.offset() instanceof FieldOffset.Deferred deferred) {
                builder.addAllArgumentMap(deferred.argumentMap()).addAllArgumentOffset(deferred.argumentOffset());
            }
            return expr(StatementsProto.Expr.newBuilder().setFieldAccessExpr(builder));
        }

        @Override
        public Message visitLiteralAccessExpr(LiteralAccessExpr e) {
            return expr(StatementsProto.Expr.newBuilder().setLiteralAccessExpr(StatementsProto.LiteralAccessExpr.newBuilder()
                    .setValue(e.value())
                    .setType(encodeBuiltin(e.type()))
                    .setLoc(encodeLocation(e.loc()))));
        }
    }

    // endregion

    // region Decoding

    static Stmt decode(StatementsProto.Stmt proto) throws MalformedEncodingException {
        switch (proto.getStmtCase()) {
            case BLOCK_STMT: {
                StatementsProto.BlockStmt p = proto.getBlockStmt();
                List<Stmt> statements = new ArrayList<>(p.getStatementsCount());
                for (StatementsProto.Stmt child : p.getStatementsList()) {
                    statements.add(decode(child));
                }
                return new BlockStmt(statements, decodeLocation(p.hasLoc(), p.getLoc()));
            }
            case EXPR_STMT: {
                StatementsProto.ExprStmt p = proto.getExprStmt();
                require(p.hasExpr(), "ExprStmt.expr");
                return new ExprStmt(decode(p.getExpr()), decodeLocation(p.hasLoc(), p.getLoc()));
            }
            case RETURN_STMT: {
                StatementsProto.ReturnStmt p = proto.getReturnStmt();
                require(p.hasExpr(), "ReturnStmt.expr");
                return new ReturnStmt(decode(p.getExpr()), decodeLocation(p.hasLoc(), p.getLoc()));
            }
            case VAR_DECL_STMT: {
                StatementsProto.VarDeclStmt p = proto.getVarDeclStmt();
                require(p.hasType(), "VarDeclStmt.type");
                return new VarDeclStmt(decodeType(p.getType()), p.getName(), p.getDimension(), p.getOp(),
                        decodeAll(p.getInitListList()), decodeLocation(p.hasLoc(), p.getLoc()));
            }
            case STENCIL_CALL_DECL_STMT: {
                StatementsProto.StencilCallDeclStmt p = proto.getStencilCallDeclStmt();
                require(p.hasStencilCall(), "StencilCallDeclStmt.stencil_call");
                return new StencilCallDeclStmt(decodeStencilCall(p.getStencilCall()), decodeLocation(p.hasLoc(), p.getLoc()));
            }
            case VERTICAL_REGION_DECL_STMT: {
                StatementsProto.VerticalRegionDeclStmt p = proto.getVerticalRegionDeclStmt();
                require(p.hasVerticalRegion(), "VerticalRegionDeclStmt.vertical_region");
                return new VerticalRegionDeclStmt(decodeRegion(p.getVerticalRegion()), decodeLocation(p.hasLoc(), p.getLoc()));
            }
            case BOUNDARY_CONDITION_DECL_STMT: {
                StatementsProto.BoundaryConditionDeclStmt p = proto.getBoundaryConditionDeclStmt();
                return new BoundaryConditionDeclStmt(p.getFunctor(), decodeFields(p.getFieldsList()),
                        decodeLocation(p.hasLoc(), p.getLoc()));
            }
            case IF_STMT: {
                StatementsProto.IfStmt p = proto.getIfStmt();
                require(p.hasCondPart(), "IfStmt.cond_part");
                require(p.hasThenPart(), "IfStmt.then_part");
                Stmt cond = decode(p.getCondPart());
                if (!(cond instanceof ExprStmt)) {
                    throw new MalformedEncodingException(IrErrorCode.MALFORMED_ENCODING,
                            "The condition of an if statement must be an expression statement");
                }
                return new IfStmt(cond, decode(p.getThenPart()), p.hasElsePart() ? decode(p.getElsePart()) : null,
                        decodeLocation(p.hasLoc(), p.getLoc()));
            }
            default:
                throw new UnknownVariantException("Stmt", "no statement branch is set");
        }
    }

    static Expr decode(StatementsProto.Expr proto) throws MalformedEncodingException {
        switch (proto.getExprCase()) {
            case UNARY_OPERATOR: {
                StatementsProto.UnaryOperator p = proto.getUnaryOperator();
                require(p.hasOperand(), "UnaryOperator.operand");
                return new UnaryOperator(p.getOp(), decode(p.getOperand()), decodeLocation(p.hasLoc(), p.getLoc()));
            }
            case BINARY_OPERATOR: {
                StatementsProto.BinaryOperator p = proto.getBinaryOperator();
                require(p.hasLeft() && p.hasRight(), "BinaryOperator operands");
                return new BinaryOperator(decode(p.getLeft()), p.getOp(), decode(p.getRight()),
                        decodeLocation(p.hasLoc(), p.getLoc()));
            }
            case ASSIGNMENT_EXPR: {
                StatementsProto.AssignmentExpr p = proto.getAssignmentExpr();
                require(p.hasLeft() && p.hasRight(), "AssignmentExpr operands");
                return new AssignmentExpr(decode(p.getLeft()), p.getOp(), decode(p.getRight()),
                        decodeLocation(p.hasLoc(), p.getLoc()));
            }
            case TERNARY_OPERATOR: {
                StatementsProto.TernaryOperator p = proto.getTernaryOperator();
                require(p.hasCond() && p.hasLeft() && p.hasRight(), "TernaryOperator operands");
                return new TernaryOperator(decode(p.getCond()), decode(p.getLeft()), decode(p.getRight()),
                        decodeLocation(p.hasLoc(), p.getLoc()));
            }
            case FUN_CALL_EXPR: {
                StatementsProto.FunCallExpr p = proto.getFunCallExpr();
                return new FunCallExpr(p.getCallee(), decodeAll(p.getArgumentsList()), decodeLocation(p.hasLoc(), p.getLoc()));
            }
            case STENCIL_FUN_CALL_EXPR: {
                StatementsProto.StencilFunCallExpr p = proto.getStencilFunCallExpr();
                return new StencilFunCallExpr(p.getCallee(), decodeAll(p.getArgumentsList()),
                        decodeLocation(p.hasLoc(), p.getLoc()));
            }
            case STENCIL_FUN_ARG_EXPR: {
                StatementsProto.StencilFunArgExpr p = proto.getStencilFunArgExpr();
                Dimension dimension = enumValue("Dimension.Direction", p.getDimension().getDirectionValue(), Dimension::fromCode);
                return new StencilFunArgExpr(dimension, p.getOffset(), p.getArgumentIndex(), decodeLocation(p.hasLoc(), p.getLoc()));
            }
            case VAR_ACCESS_EXPR: {
                StatementsProto.VarAccessExpr p = proto.getVarAccessExpr();
                return new VarAccessExpr(p.getName(), p.hasIndex() ? decode(p.getIndex()) : null, p.getIsExternal(),
                        decodeLocation(p.hasLoc(), p.getLoc()));
            }
            case FIELD_ACCESS_EXPR: {
                StatementsProto.FieldAccessExpr p = proto.getFieldAccessExpr();
                return new FieldAccessExpr(p.getName(), decodeOffset(p), p.getNegateOffset(), decodeLocation(p.hasLoc(), p.getLoc()));
            }
            case LITERAL_ACCESS_EXPR: {
                StatementsProto.LiteralAccessExpr p = proto.getLiteralAccessExpr();
                return new LiteralAccessExpr(p.getValue(), decodeBuiltin(p.getType()), decodeLocation(p.hasLoc(), p.getLoc()));
            }
            default:
                throw new UnknownVariantException("Expr", "no expression branch is set");
        }
    }

    static Stmt decodeAst(StatementsProto.AST proto) throws MalformedEncodingException {
        require(proto.hasRoot(), "AST.root");
        return decode(proto.getRoot());
    }

    /**
     * @param present Whether the location sub-message is set.
     * @param proto The location message.
     * @return The location, {@link SourceLocation#UNKNOWN} if absent.
     */
    static SourceLocation decodeLocation(boolean present, StatementsProto.SourceLocation proto) {
        return present ? new SourceLocation(proto.getLine(), proto.getColumn()) : SourceLocation.UNKNOWN;
    }

    static Field decodeField(StatementsProto.Field proto) {
        return new Field(proto.getName(), decodeLocation(proto.hasLoc(), proto.getLoc()), proto.getIsTemporary(),
                proto.getFieldDimensionsList());
    }

    static List<Field> decodeFields(List<StatementsProto.Field> protos) {
        List<Field> fields = new ArrayList<>(protos.size());
        protos.forEach(p -> fields.add(decodeField(p)));
        return fields;
    }

    static StencilCall decodeStencilCall(StatementsProto.StencilCall proto) {
        return new StencilCall(decodeLocation(proto.hasLoc(), proto.getLoc()), proto.getCallee(),
                decodeFields(proto.getArgumentsList()));
    }

    static Interval decodeInterval(StatementsProto.Interval proto) throws MalformedEncodingException {
        Level lower;
        switch (proto.getLowerBoundCase()) {
            case SPECIAL_LOWER_LEVEL:
                lower = enumValue("Interval.SpecialLevel", proto.getSpecialLowerLevelValue(), Level.Special::fromCode);
                break;
            case LOWER_LEVEL:
                lower = Level.of(proto.getLowerLevel());
                break;
            default:
                throw new UnknownVariantException("Interval.lower_bound", "no lower level is set");
        }
        Level upper;
        switch (proto.getUpperBoundCase()) {
            case SPECIAL_UPPER_LEVEL:
                upper = enumValue("Interval.SpecialLevel", proto.getSpecialUpperLevelValue(), Level.Special::fromCode);
                break;
            case UPPER_LEVEL:
                upper = Level.of(proto.getUpperLevel());
                break;
            default:
                throw new UnknownVariantException("Interval.upper_bound", "no upper level is set");
        }
        return new Interval(lower, proto.getLowerOffset(), upper, proto.getUpperOffset());
    }

    static StencilFunctionArg decodeArgument(StatementsProto.StencilFunctionArg proto) throws MalformedEncodingException {
        switch (proto.getArgCase()) {
            case FIELD_VALUE:
                return decodeField(proto.getFieldValue());
            case DIRECTION_VALUE: {
                StatementsProto.Direction p = proto.getDirectionValue();
                return new Direction(p.getName(), decodeLocation(p.hasLoc(), p.getLoc()));
            }
            case OFFSET_VALUE: {
                StatementsProto.Offset p = proto.getOffsetValue();
                return new Offset(p.getName(), decodeLocation(p.hasLoc(), p.getLoc()));
            }
            default:
                throw new UnknownVariantException("StencilFunctionArg", "no argument branch is set");
        }
    }

    private static VerticalRegion decodeRegion(StatementsProto.VerticalRegion proto) throws MalformedEncodingException {
        require(proto.hasAst(), "VerticalRegion.ast");
        require(proto.hasInterval(), "VerticalRegion.interval");
        LoopOrder order = enumValue("VerticalRegion.LoopOrder", proto.getLoopOrderValue(), LoopOrder::fromCode);
        if (order == LoopOrder.PARALLEL) {
            throw new UnknownVariantException("VerticalRegion.LoopOrder", "unknown code " + proto.getLoopOrderValue());
        }
        return new VerticalRegion(decodeLocation(proto.hasLoc(), proto.getLoc()), decodeAst(proto.getAst()),
                decodeInterval(proto.getInterval()), order);
    }

    private static Type decodeType(StatementsProto.Type proto) throws MalformedEncodingException {
        switch (proto.getTypeCase()) {
            case NAME:
                return new Type(proto.getName(), null, proto.getIsConst(), proto.getIsVolatile());
            case BUILTIN_TYPE:
                return new Type(null, decodeBuiltin(proto.getBuiltinType()), proto.getIsConst(), proto.getIsVolatile());
            default:
                throw new UnknownVariantException("Type", "neither a custom nor a builtin type is set");
        }
    }

    private static BuiltinType decodeBuiltin(StatementsProto.BuiltinType proto) throws MalformedEncodingException {
        return enumValue("BuiltinType.TypeID", proto.getTypeIdValue(), BuiltinType::fromCode);
    }

    private static FieldOffset decodeOffset(StatementsProto.FieldAccessExpr proto) throws MalformedEncodingException {
        List<Integer> offset = triple(proto.getOffsetList(), "offset", 0);
        List<Integer> argumentMap = triple(proto.getArgumentMapList(), "argument_map", FieldOffset.UNUSED);
        if (argumentMap.stream().allMatch(index -> index == FieldOffset.UNUSED)) {
            return new FieldOffset.Resolved(offset);
        }
        return new FieldOffset.Deferred(offset, argumentMap, triple(proto.getArgumentOffsetList(), "argument_offset", 0));
    }

    private static List<Integer> triple(List<Integer> values, String name, int absent) throws MalformedEncodingException {
        if (values.isEmpty()) {
            return List.of(absent, absent, absent);
        }
        if (values.size() != 3) {
            throw new MalformedEncodingException(IrErrorCode.MALFORMED_ENCODING,
                    "FieldAccessExpr." + name + " has " + values.size() + " entries instead of 3");
        }
        return values;
    }

    private static List<Expr> decodeAll(List<StatementsProto.Expr> protos) throws MalformedEncodingException {
        List<Expr> exprs = new ArrayList<>(protos.size());
        for (StatementsProto.Expr p : protos) {
            exprs.add(decode(p));
        }
        return exprs;
    }

    /**
     * Maps an open-enum code to its model constant.
     * @throws UnknownVariantException if the code is not known to the model
     */
    static <E> E enumValue(String enumName, int code, IntFunction<E> fromCode) throws UnknownVariantException {
        try {
            return fromCode.apply(code);
        } catch (IllegalArgumentException e) {
            throw new UnknownVariantException(enumName, "unknown code " + code);
        }
    }

    static void require(boolean present, String what) throws MalformedEncodingException {
        if (!present) {
            throw new MalformedEncodingException(IrErrorCode.MISSING_FIELD, "Missing required " + what);
        }
    }

    // endregion
}
