package org.stencilir.compiler.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves deferred field offsets once a stencil function is instantiated with concrete
 * directional and offset arguments.
 * <p>
 * Resolution is a pure transformation: the input nodes are left untouched and new nodes are
 * returned. Given {@code avg(storage in, direction dir) { return (in(dir+2) + in) / 2.0; }} called
 * as {@code avg(u, j)}, the access {@code in(dir+2)} (argument map {@code {1,-1,-1}}, argument
 * offset {@code {2,0,0}}) resolves to the offset {@code {0,2,0}}.
 */
public final class FieldOffsetResolver {

    private FieldOffsetResolver() {
        throw new IllegalStateException("Utility class");
    }

    /**
     * Resolves the offset of a single field access.
     *
     * @param access The access, resolved or deferred.
     * @param callArguments The arguments of the stencil function call, in parameter order.
     * @return An access with a {@link FieldOffset.Resolved} offset; {@code access} itself if already resolved.
     * @throws IllegalArgumentException if a referenced argument is missing or not a concrete
     *         directional or offset argument.
     */
    public static FieldAccessExpr resolve(FieldAccessExpr access, List<Expr> callArguments) {
        if (!(access.offset() instanceof FieldOffset.Deferred deferred)) {
            return access;
        }
        int[] resolved = new int[3];
        int[] shift = new int[3];
        for (int dim = 0; dim < 3; dim++) {
            resolved[dim] = deferred.offset().get(dim);
            int argumentIndex = deferred.argumentMap().get(dim);
            if (argumentIndex == FieldOffset.UNUSED) {
                continue;
            }
            StencilFunArgExpr argument = concreteArgument(access, callArguments, argumentIndex);
            shift[argument.dimension().index()] += argument.offset() + deferred.argumentOffset().get(dim);
        }
        int sign = access.negateOffset() ? -1 : 1;
        List<Integer> offset = new ArrayList<>(3);
        for (int dim = 0; dim < 3; dim++) {
            offset.add(resolved[dim] + sign * shift[dim]);
        }
        return new FieldAccessExpr(access.name(), new FieldOffset.Resolved(offset), false, access.loc());
    }

    /**
     * Resolves every deferred field access in a stencil function body.
     *
     * @param body The body.
     * @param callArguments The arguments of the stencil function call, in parameter order.
     * @return The body with all field offsets resolved.
     */
    public static Stmt resolve(Stmt body, List<Expr> callArguments) {
        return (Stmt) body.accept(new ResolvingRewriter(callArguments));
    }

    private static StencilFunArgExpr concreteArgument(FieldAccessExpr access, List<Expr> callArguments, int index) {
        if (index >= callArguments.size()) {
            throw new IllegalArgumentException("Access to '" + access.name() + "' refers to parameter " + index
                    + " but the call has " + callArguments.size() + " arguments");
        }
        if (!(callArguments.get(index) instanceof StencilFunArgExpr argument)
                || argument.isDeferred()
                || argument.dimension() == Dimension.INVALID) {
            throw new IllegalArgumentException("Argument " + index + " for access to '" + access.name()
                    + "' is not a concrete directional or offset argument: " + callArguments.get(index));
        }
        return argument;
    }

    /**
     * Rebuilds a tree bottom-up, resolving field accesses on the way.
     */
    private static final class ResolvingRewriter implements AstVisitor<AstNode> {

        private final List<Expr> callArguments;

        ResolvingRewriter(List<Expr> callArguments) {
            this.callArguments = callArguments;
        }

        private Expr expr(Expr expr) {
            return (Expr) expr.accept(this);
        }

        private Stmt stmt(Stmt stmt) {
            return stmt == null ? null : (Stmt) stmt.accept(this);
        }

        private List<Expr> exprs(List<Expr> exprs) {
            return exprs.stream().map(this::expr).toList();
        }

        @Override
        public AstNode visitBlockStmt(BlockStmt stmt) {
            return new BlockStmt(stmt.statements().stream().map(this::stmt).toList(), stmt.loc());
        }

        @Override
        public AstNode visitExprStmt(ExprStmt stmt) {
            return new ExprStmt(expr(stmt.expr()), stmt.loc());
        }

        @Override
        public AstNode visitReturnStmt(ReturnStmt stmt) {
            return new ReturnStmt(expr(stmt.expr()), stmt.loc());
        }

        @Override
        public AstNode visitVarDeclStmt(VarDeclStmt stmt) {
            return new VarDeclStmt(stmt.type(), stmt.name(), stmt.dimension(), stmt.op(), exprs(stmt.initList()), stmt.loc());
        }

        @Override
        public AstNode visitStencilCallDeclStmt(StencilCallDeclStmt stmt) {
            return stmt;
        }

        @Override
        public AstNode visitVerticalRegionDeclStmt(VerticalRegionDeclStmt stmt) {
            VerticalRegion region = stmt.region();
            return new VerticalRegionDeclStmt(
                    new VerticalRegion(region.loc(), stmt(region.body()), region.interval(), region.loopOrder()),
                    stmt.loc());
        }

        @Override
        public AstNode visitBoundaryConditionDeclStmt(BoundaryConditionDeclStmt stmt) {
            return stmt;
        }

        @Override
        public AstNode visitIfStmt(IfStmt stmt) {
            return new IfStmt(stmt(stmt.condStmt()), stmt(stmt.thenStmt()), stmt(stmt.elseStmt()), stmt.loc());
        }

        @Override
        public AstNode visitUnaryOperator(UnaryOperator expr) {
            return new UnaryOperator(expr.op(), expr(expr.operand()), expr.loc());
        }

        @Override
        public AstNode visitBinaryOperator(BinaryOperator expr) {
            return new BinaryOperator(expr(expr.left()), expr.op(), expr(expr.right()), expr.loc());
        }

        @Override
        public AstNode visitAssignmentExpr(AssignmentExpr expr) {
            return new AssignmentExpr(expr(expr.left()), expr.op(), expr(expr.right()), expr.loc());
        }

        @Override
        public AstNode visitTernaryOperator(TernaryOperator expr) {
            return new TernaryOperator(expr(expr.cond()), expr(expr.left()), expr(expr.right()), expr.loc());
        }

        @Override
        public AstNode visitFunCallExpr(FunCallExpr expr) {
            return new FunCallExpr(expr.callee(), exprs(expr.arguments()), expr.loc());
        }

        @Override
        public AstNode visitStencilFunCallExpr(StencilFunCallExpr expr) {
            // Nested calls keep their own deferred arguments until they are instantiated.
            return expr;
        }

        @Override
        public AstNode visitStencilFunArgExpr(StencilFunArgExpr expr) {
            return expr;
        }

        @Override
        public AstNode visitVarAccessExpr(VarAccessExpr expr) {
            Expr index = expr.index() == null ? null : expr(expr.index());
            return new VarAccessExpr(expr.name(), index, expr.isExternal(), expr.loc());
        }

        @Override
        public AstNode visitFieldAccessExpr(FieldAccessExpr expr) {
            return FieldOffsetResolver.resolve(expr, callArguments);
        }

        @Override
        public AstNode visitLiteralAccessExpr(LiteralAccessExpr expr) {
            return expr;
        }
    }
}
