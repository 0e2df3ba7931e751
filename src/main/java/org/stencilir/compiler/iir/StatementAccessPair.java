package org.stencilir.compiler.iir;

import org.stencilir.compiler.ast.Stmt;
import org.stencilir.compiler.iir.access.Accesses;

import java.util.Objects;

/**
 * A statement of a {@link DoMethod} together with its data-access footprint, seen from the caller
 * and, where the statement calls a stencil function, from the callee.
 */
public final class StatementAccessPair {

    private Stmt statement;
    private final Accesses callerAccesses;
    private final Accesses calleeAccesses;

    public StatementAccessPair(Stmt statement, Accesses callerAccesses, Accesses calleeAccesses) {
        this.statement = Objects.requireNonNull(statement, "statement");
        this.callerAccesses = callerAccesses == null ? new Accesses() : callerAccesses;
        this.calleeAccesses = calleeAccesses == null ? new Accesses() : calleeAccesses;
    }

    public StatementAccessPair(Stmt statement) {
        this(statement, new Accesses(), new Accesses());
    }

    public Stmt getStatement() {
        return statement;
    }

    /**
     * Swaps the statement, keeping the access footprints.
     * @param statement The new statement.
     */
    public void setStatement(Stmt statement) {
        this.statement = Objects.requireNonNull(statement, "statement");
    }

    public Accesses getCallerAccesses() {
        return callerAccesses;
    }

    public Accesses getCalleeAccesses() {
        return calleeAccesses;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatementAccessPair that)) return false;
        return statement.equals(that.statement)
                && callerAccesses.equals(that.callerAccesses)
                && calleeAccesses.equals(that.calleeAccesses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(statement, callerAccesses, calleeAccesses);
    }

    @Override
    public String toString() {
        return "StatementAccessPair{" + statement + ", caller=" + callerAccesses + ", callee=" + calleeAccesses + '}';
    }
}
