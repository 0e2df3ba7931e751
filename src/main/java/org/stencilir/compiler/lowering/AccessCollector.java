package org.stencilir.compiler.lowering;

import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.ast.AssignmentExpr;
import org.stencilir.compiler.ast.AstVisitor;
import org.stencilir.compiler.ast.BinaryOperator;
import org.stencilir.compiler.ast.BlockStmt;
import org.stencilir.compiler.ast.BoundaryConditionDeclStmt;
import org.stencilir.compiler.ast.Expr;
import org.stencilir.compiler.ast.ExprStmt;
import org.stencilir.compiler.ast.Field;
import org.stencilir.compiler.ast.FieldAccessExpr;
import org.stencilir.compiler.ast.FunCallExpr;
import org.stencilir.compiler.ast.IfStmt;
import org.stencilir.compiler.ast.LiteralAccessExpr;
import org.stencilir.compiler.ast.ReturnStmt;
import org.stencilir.compiler.ast.StencilCallDeclStmt;
import org.stencilir.compiler.ast.StencilFunArgExpr;
import org.stencilir.compiler.ast.StencilFunCallExpr;
import org.stencilir.compiler.ast.StencilFunctionArg;
import org.stencilir.compiler.ast.Stmt;
import org.stencilir.compiler.ast.TernaryOperator;
import org.stencilir.compiler.ast.TreeWalker;
import org.stencilir.compiler.ast.UnaryOperator;
import org.stencilir.compiler.ast.VarAccessExpr;
import org.stencilir.compiler.ast.VarDeclStmt;
import org.stencilir.compiler.ast.VerticalRegionDeclStmt;
import org.stencilir.compiler.iir.StatementAccessPair;
import org.stencilir.compiler.iir.access.Accesses;
import org.stencilir.compiler.iir.access.Extents;
import org.stencilir.compiler.sir.StencilFunction;

import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Computes the data-access footprint of one statement of a vertical region.
 * <p>
 * Assignment targets are writes; compound assignments and increments also read their target.
 * Every other field, variable and literal access is a read. A field accessed at offset {@code o}
 * reaches {@code (o, o)} in each dimension. Field arguments of stencil-function calls are also
 * recorded from the callee's perspective, with the extents the function reads its parameter at.
 */
final class AccessCollector implements AstVisitor<Void> {

    private static final Set<String> INCREMENTS = Set.of("++", "--");

    private final LoweringContext context;
    private final Accesses caller = new Accesses();
    private final Accesses callee = new Accesses();

    private AccessCollector(LoweringContext context) {
        this.context = context;
    }

    /**
     * @param statement A statement of a vertical region body.
     * @param context The lowering context; locals declared by the statement are added to its innermost scope.
     * @return The statement with its caller and callee accesses.
     */
    static StatementAccessPair collect(Stmt statement, LoweringContext context) {
        AccessCollector collector = new AccessCollector(context);
        statement.accept(collector);
        return new StatementAccessPair(statement, collector.caller, collector.callee);
    }

    // region Statements

    @Override
    public Void visitBlockStmt(BlockStmt stmt) {
        context.enterScope();
        try {
            stmt.statements().forEach(s -> s.accept(this));
        } finally {
            context.leaveScope();
        }
        return null;
    }

    @Override
    public Void visitExprStmt(ExprStmt stmt) {
        return stmt.expr().accept(this);
    }

    @Override
    public Void visitReturnStmt(ReturnStmt stmt) {
        return stmt.expr().accept(this);
    }

    @Override
    public Void visitVarDeclStmt(VarDeclStmt stmt) {
        stmt.initList().forEach(e -> e.accept(this));
        int id = context.declareLocal(stmt.name());
        if (!stmt.initList().isEmpty()) {
            caller.addWrite(id, Extents.ZERO);
        }
        return null;
    }

    @Override
    public Void visitStencilCallDeclStmt(StencilCallDeclStmt stmt) {
        return unsupported("stencil call", stmt);
    }

    @Override
    public Void visitVerticalRegionDeclStmt(VerticalRegionDeclStmt stmt) {
        return unsupported("nested vertical region", stmt);
    }

    @Override
    public Void visitBoundaryConditionDeclStmt(BoundaryConditionDeclStmt stmt) {
        return unsupported("boundary condition", stmt);
    }

    @Override
    public Void visitIfStmt(IfStmt stmt) {
        stmt.condition().accept(this);
        stmt.thenStmt().accept(this);
        stmt.elsePart().ifPresent(s -> s.accept(this));
        return null;
    }

    private Void unsupported(String what, Stmt stmt) {
        context.diagnostics().reportError(IrErrorCode.UNSUPPORTED_CONSTRUCT,
                "A " + what + " cannot appear inside a vertical region", stmt.loc());
        return null;
    }

    // endregion

    // region Expressions

    @Override
    public Void visitUnaryOperator(UnaryOperator expr) {
        if (INCREMENTS.contains(expr.op())) {
            recordTarget(expr.operand(), true);
            return null;
        }
        return expr.operand().accept(this);
    }

    @Override
    public Void visitBinaryOperator(BinaryOperator expr) {
        expr.left().accept(this);
        return expr.right().accept(this);
    }

    @Override
    public Void visitAssignmentExpr(AssignmentExpr expr) {
        expr.right().accept(this);
        recordTarget(expr.left(), expr.isCompound());
        return null;
    }

    @Override
    public Void visitTernaryOperator(TernaryOperator expr) {
        expr.cond().accept(this);
        expr.left().accept(this);
        return expr.right().accept(this);
    }

    @Override
    public Void visitFunCallExpr(FunCallExpr expr) {
        expr.arguments().forEach(a -> a.accept(this));
        return null;
    }

    @Override
    public Void visitStencilFunCallExpr(StencilFunCallExpr expr) {
        expr.arguments().forEach(a -> a.accept(this));
        StencilFunction function = context.findStencilFunction(expr.callee()).orElse(null);
        List<Expr> arguments = expr.arguments();
        for (int index = 0; index < arguments.size(); index++) {
            if (!(arguments.get(index) instanceof FieldAccessExpr field)) {
                continue;
            }
            OptionalInt id = context.resolveField(field.name(), field.loc());
            if (id.isPresent()) {
                Extents inCallee = function == null ? Extents.ZERO : parameterExtents(function, index);
                callee.addRead(id.getAsInt(), inCallee.shift(effectiveOffset(field)));
            }
        }
        return null;
    }

    @Override
    public Void visitStencilFunArgExpr(StencilFunArgExpr expr) {
        return null;
    }

    @Override
    public Void visitVarAccessExpr(VarAccessExpr expr) {
        expr.arrayIndex().ifPresent(i -> i.accept(this));
        resolveVariable(expr).ifPresent(id -> caller.addRead(id, Extents.ZERO));
        return null;
    }

    @Override
    public Void visitFieldAccessExpr(FieldAccessExpr expr) {
        context.resolveField(expr.name(), expr.loc())
                .ifPresent(id -> caller.addRead(id, Extents.at(effectiveOffset(expr))));
        return null;
    }

    @Override
    public Void visitLiteralAccessExpr(LiteralAccessExpr expr) {
        caller.addRead(context.metadata().registerLiteral(expr.value()), Extents.ZERO);
        return null;
    }

    // endregion

    private void recordTarget(Expr target, boolean alsoRead) {
        if (target instanceof FieldAccessExpr field) {
            OptionalInt id = context.resolveField(field.name(), field.loc());
            if (id.isPresent()) {
                Extents extents = Extents.at(effectiveOffset(field));
                caller.addWrite(id.getAsInt(), extents);
                if (alsoRead) {
                    caller.addRead(id.getAsInt(), extents);
                }
            }
        } else if (target instanceof VarAccessExpr variable) {
            variable.arrayIndex().ifPresent(i -> i.accept(this));
            OptionalInt id = resolveVariable(variable);
            if (id.isPresent()) {
                caller.addWrite(id.getAsInt(), Extents.ZERO);
                if (alsoRead) {
                    caller.addRead(id.getAsInt(), Extents.ZERO);
                }
            }
        } else {
            context.diagnostics().reportError(IrErrorCode.UNSUPPORTED_CONSTRUCT,
                    "Cannot assign to " + target.getClass().getSimpleName(), target.loc());
        }
    }

    private OptionalInt resolveVariable(VarAccessExpr expr) {
        return expr.isExternal()
                ? context.resolveGlobal(expr.name(), expr.loc())
                : context.resolveLocal(expr.name(), expr.loc());
    }

    private static List<Integer> effectiveOffset(FieldAccessExpr expr) {
        List<Integer> offset = expr.offset().offset();
        if (!expr.negateOffset()) {
            return offset;
        }
        return List.of(-offset.get(0), -offset.get(1), -offset.get(2));
    }

    /**
     * @return The union of the extents the function reads its field parameter at, zero if unused.
     */
    private static Extents parameterExtents(StencilFunction function, int argumentIndex) {
        List<StencilFunctionArg> parameters = function.arguments();
        if (argumentIndex >= parameters.size() || !(parameters.get(argumentIndex) instanceof Field parameter)) {
            return Extents.ZERO;
        }
        Extents[] extents = {Extents.ZERO};
        TreeWalker walker = TreeWalker.forType(FieldAccessExpr.class, access -> {
            if (access.name().equals(parameter.name())) {
                extents[0] = extents[0].merge(Extents.at(effectiveOffset(access)));
            }
        });
        walker.walk(function.bodies());
        return extents[0];
    }
}
