package org.stencilir.compiler.ast;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stencilir.compiler.api.SourceLocation;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class FieldOffsetResolverTest {

    /** {@code in(dir+2)} inside {@code avg(storage in, direction dir)}. */
    private static FieldAccessExpr deferredAccess(boolean negate) {
        FieldOffset offset = new FieldOffset.Deferred(List.of(0, 0, 0), List.of(1, -1, -1), List.of(2, 0, 0));
        return new FieldAccessExpr("in", offset, negate, SourceLocation.of(4, 12));
    }

    private static List<Expr> callWithDirection(Dimension dimension) {
        return List.of(FieldAccessExpr.of("u"), StencilFunArgExpr.of(dimension, 0));
    }

    @Test
    void resolve_movesTheParameterOffsetIntoTheCallersDimension() {
        FieldAccessExpr resolved = FieldOffsetResolver.resolve(deferredAccess(false), callWithDirection(Dimension.J));

        assertThat(resolved.isResolved()).isTrue();
        assertThat(resolved.offset().offset()).containsExactly(0, 2, 0);
        assertThat(resolved.loc()).isEqualTo(SourceLocation.of(4, 12));
    }

    @Test
    void resolve_foldsNegationIntoTheOffset() {
        FieldAccessExpr resolved = FieldOffsetResolver.resolve(deferredAccess(true), callWithDirection(Dimension.I));

        assertThat(resolved.offset().offset()).containsExactly(-2, 0, 0);
        assertThat(resolved.negateOffset()).isFalse();
    }

    @Test
    void resolve_addsTheArgumentsOwnOffset() {
        List<Expr> call = List.of(FieldAccessExpr.of("u"), StencilFunArgExpr.of(Dimension.K, -1));

        FieldAccessExpr resolved = FieldOffsetResolver.resolve(deferredAccess(false), call);

        assertThat(resolved.offset().offset()).containsExactly(0, 0, 1);
    }

    @Test
    void resolve_returnsResolvedAccessesAsIs() {
        FieldAccessExpr access = FieldAccessExpr.at("in", 1, 0, 0);

        assertThat(FieldOffsetResolver.resolve(access, List.of())).isSameAs(access);
    }

    @Test
    void resolve_rejectsNonDirectionalArguments() {
        List<Expr> call = List.of(FieldAccessExpr.of("u"), FieldAccessExpr.of("v"));

        assertThatThrownBy(() -> FieldOffsetResolver.resolve(deferredAccess(false), call))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a concrete directional");
    }

    @Test
    void resolve_rejectsMissingArguments() {
        assertThatThrownBy(() -> FieldOffsetResolver.resolve(deferredAccess(false), List.of(FieldAccessExpr.of("u"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("refers to parameter 1");
    }

    @Test
    void resolveBody_rewritesNestedAccessesWithoutTouchingTheInput() {
        Stmt body = new ReturnStmt(new BinaryOperator(deferredAccess(false), "+", FieldAccessExpr.of("in")));

        Stmt resolved = FieldOffsetResolver.resolve(body, callWithDirection(Dimension.J));

        assertThat(resolved).isEqualTo(new ReturnStmt(new BinaryOperator(
                FieldAccessExpr.at("in", 0, 2, 0), "+", FieldAccessExpr.of("in"))));
        assertThat(((BinaryOperator) ((ReturnStmt) body).expr()).left()).isEqualTo(deferredAccess(false));
    }

    @Test
    void deferredOffset_needsAtLeastOneParameter() {
        assertThatThrownBy(() -> new FieldOffset.Deferred(List.of(0, 0, 0), List.of(-1, -1, -1), List.of(0, 0, 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
