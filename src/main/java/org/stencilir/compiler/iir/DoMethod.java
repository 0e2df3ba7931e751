package org.stencilir.compiler.iir;

import org.stencilir.compiler.ast.Interval;

import java.util.List;
import java.util.Objects;

/**
 * The statements of a {@link Stage} that run over one vertical interval.
 */
public final class DoMethod extends IirContainer<StatementAccessPair> {

    private final int id;
    private Interval interval;

    public DoMethod(int id, Interval interval, List<StatementAccessPair> statements) {
        super(statements);
        this.id = id;
        this.interval = Objects.requireNonNull(interval, "interval");
    }

    public DoMethod(int id, Interval interval) {
        this(id, interval, List.of());
    }

    public int getId() {
        return id;
    }

    public Interval getInterval() {
        return interval;
    }

    public void setInterval(Interval interval) {
        this.interval = Objects.requireNonNull(interval, "interval");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DoMethod that)) return false;
        return id == that.id && interval.equals(that.interval) && sameChildren(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, interval, childrenHash());
    }

    @Override
    public String toString() {
        return "DoMethod#" + id + interval;
    }
}
