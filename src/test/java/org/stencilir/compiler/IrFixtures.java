package org.stencilir.compiler;

import org.stencilir.compiler.api.GlobalValue;
import org.stencilir.compiler.api.SourceLocation;
import org.stencilir.compiler.ast.AssignmentExpr;
import org.stencilir.compiler.ast.BinaryOperator;
import org.stencilir.compiler.ast.BlockStmt;
import org.stencilir.compiler.ast.BuiltinType;
import org.stencilir.compiler.ast.Dimension;
import org.stencilir.compiler.ast.FieldOffset;
import org.stencilir.compiler.ast.FunCallExpr;
import org.stencilir.compiler.ast.IfStmt;
import org.stencilir.compiler.ast.Level;
import org.stencilir.compiler.ast.LiteralAccessExpr;
import org.stencilir.compiler.ast.StencilCall;
import org.stencilir.compiler.ast.StencilCallDeclStmt;
import org.stencilir.compiler.ast.StencilFunArgExpr;
import org.stencilir.compiler.ast.TernaryOperator;
import org.stencilir.compiler.ast.Type;
import org.stencilir.compiler.ast.UnaryOperator;
import org.stencilir.compiler.ast.VarDeclStmt;
import org.stencilir.compiler.ast.BoundaryConditionDeclStmt;
import org.stencilir.compiler.ast.Expr;
import org.stencilir.compiler.ast.ExprStmt;
import org.stencilir.compiler.ast.Field;
import org.stencilir.compiler.ast.FieldAccessExpr;
import org.stencilir.compiler.ast.Interval;
import org.stencilir.compiler.ast.LoopOrder;
import org.stencilir.compiler.ast.ReturnStmt;
import org.stencilir.compiler.ast.Stmt;
import org.stencilir.compiler.ast.StencilFunCallExpr;
import org.stencilir.compiler.ast.VarAccessExpr;
import org.stencilir.compiler.ast.VerticalRegion;
import org.stencilir.compiler.ast.VerticalRegionDeclStmt;
import org.stencilir.compiler.sir.GlobalVariable;
import org.stencilir.compiler.sir.Sir;
import org.stencilir.compiler.sir.Stencil;
import org.stencilir.compiler.sir.StencilFunction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small, hand-built IR used across the tests.
 */
public final class IrFixtures {

    private IrFixtures() {
    }

    /**
     * A horizontal diffusion stencil over {@code in}, {@code out} and the temporary {@code lap}:
     * <pre>
     * vertical_region(start, end) forward  { lap = in(i+1) + in(i-1); }
     * vertical_region(start, end) backward { out = lap(j+1) * dt; }
     * boundary_condition(zero_gradient, out);
     * </pre>
     * plus the globals {@code dt = 0.0} and an unset {@code eps}.
     */
    public static Sir horizontalDiffusion() {
        Stmt first = assign(FieldAccessExpr.of("lap"),
                new BinaryOperator(FieldAccessExpr.at("in", 1, 0, 0), "+", FieldAccessExpr.at("in", -1, 0, 0)));
        Stmt second = assign(FieldAccessExpr.of("out"),
                new BinaryOperator(FieldAccessExpr.at("lap", 0, 1, 0), "*", VarAccessExpr.global("dt")));
        Stmt body = BlockStmt.of(
                region(first, Interval.full(), LoopOrder.FORWARD),
                region(second, Interval.full(), LoopOrder.BACKWARD),
                new BoundaryConditionDeclStmt("zero_gradient", List.of(new Field("out"))));
        Stencil stencil = new Stencil("hori_diff", SourceLocation.of(3, 1), body,
                List.of(new Field("in"), new Field("out"), Field.temporary("lap")));
        return new Sir("hori_diff.cpp", List.of(stencil), List.of(averageFunction()), globals());
    }

    /**
     * {@code avg(storage a) { return a(i+1) + a(i-1); }}
     */
    public static StencilFunction averageFunction() {
        Stmt body = new ReturnStmt(new BinaryOperator(
                FieldAccessExpr.at("a", 1, 0, 0), "+", FieldAccessExpr.at("a", -1, 0, 0)));
        return new StencilFunction("avg", SourceLocation.UNKNOWN, List.of(body), List.of(), List.of(new Field("a")));
    }

    public static Map<String, GlobalVariable> globals() {
        Map<String, GlobalVariable> globals = new LinkedHashMap<>();
        globals.put("dt", new GlobalVariable(GlobalValue.ofDouble(0.0), false));
        globals.put("eps", new GlobalVariable(GlobalValue.unset(GlobalValue.Kind.DOUBLE), false));
        return globals;
    }

    /**
     * A file with a single stencil {@code name} whose body is one forward vertical region over the given statements.
     */
    public static Sir singleRegion(String name, List<Field> fields, Stmt... statements) {
        Stencil stencil = new Stencil(name, SourceLocation.UNKNOWN,
                BlockStmt.of(region(BlockStmt.of(statements), Interval.full(), LoopOrder.FORWARD)), fields);
        return new Sir(name + ".cpp", List.of(stencil), List.of(averageFunction()), globals());
    }

    /**
     * A statement using every statement and expression variant, with source locations.
     */
    public static Stmt everyVariant() {
        FieldOffset deferred = new FieldOffset.Deferred(List.of(0, 0, 1), List.of(-1, 1, -1), List.of(0, 2, 0));
        Expr x = new VarAccessExpr("x", new LiteralAccessExpr("1", BuiltinType.INTEGER), false, SourceLocation.of(2, 9));
        return new BlockStmt(List.of(
                new VarDeclStmt(Type.builtin(BuiltinType.FLOAT).asConst(), "x", 2, "=",
                        List.of(new LiteralAccessExpr("1.5", BuiltinType.FLOAT), new LiteralAccessExpr("2", BuiltinType.FLOAT)),
                        SourceLocation.of(1, 3)),
                new IfStmt(new BinaryOperator(x, "<", new LiteralAccessExpr("0", BuiltinType.FLOAT)),
                        new ExprStmt(new UnaryOperator("-", VarAccessExpr.global("dt"), SourceLocation.of(3, 5))),
                        new ReturnStmt(new TernaryOperator(new LiteralAccessExpr("true", BuiltinType.BOOLEAN),
                                new FunCallExpr("sqrt", List.of(x)), x))),
                new ExprStmt(new StencilFunCallExpr("avg", List.of(
                        new FieldAccessExpr("in", deferred, true, SourceLocation.of(5, 7)),
                        new StencilFunArgExpr(Dimension.INVALID, 1, 0, SourceLocation.of(5, 12)),
                        StencilFunArgExpr.of(Dimension.K, -1)))),
                new VarDeclStmt(Type.custom("my_type"), "y", FieldAccessExpr.at("in", 0, -1, 0)),
                new StencilCallDeclStmt(new StencilCall(SourceLocation.of(7, 1), "inner", List.of(new Field("in"), Field.temporary("tmp")))),
                new BoundaryConditionDeclStmt("zero_gradient", List.of(new Field("out", SourceLocation.of(8, 30), false, List.of(1, 1, 0)))),
                new VerticalRegionDeclStmt(new VerticalRegion(SourceLocation.of(9, 1),
                        assign(FieldAccessExpr.of("out"), FieldAccessExpr.at("in", 0, 0, -1)),
                        new Interval(Level.start(), 1, Level.of(20), -2), LoopOrder.BACKWARD))),
                SourceLocation.of(1, 1));
    }

    public static VerticalRegionDeclStmt region(Stmt body, Interval interval, LoopOrder order) {
        return new VerticalRegionDeclStmt(new VerticalRegion(SourceLocation.UNKNOWN, body, interval, order));
    }

    public static Stmt assign(FieldAccessExpr target, Expr value) {
        return new ExprStmt(new AssignmentExpr(target, value));
    }

    public static StencilFunCallExpr avg(FieldAccessExpr argument) {
        return new StencilFunCallExpr("avg", List.of(argument));
    }
}
