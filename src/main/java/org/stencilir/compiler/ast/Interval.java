package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.InvariantViolationException;
import org.stencilir.compiler.api.IrErrorCode;

import java.util.Comparator;
import java.util.Objects;

/**
 * A vertical range {@code [lowerLevel + lowerOffset, upperLevel + upperOffset]}.
 * <p>
 * An interval is valid when its lower bound does not lie above its upper bound, comparing
 * bounds by level first ({@code START < exact levels < END}) and offset second. Invalid intervals
 * can be constructed, so that serialized IR can be decoded and inspected; {@link #validate()}
 * reports them.
 *
 * @param lowerLevel The lower level.
 * @param lowerOffset The offset added to the lower level.
 * @param upperLevel The upper level.
 * @param upperOffset The offset added to the upper level.
 */
public record Interval(Level lowerLevel, int lowerOffset, Level upperLevel, int upperOffset) {

    private static final Comparator<Level> LEVEL_ORDER = Comparator
            .comparingInt(Interval::rank)
            .thenComparingInt(level -> level instanceof Level.Exact exact ? exact.value() : 0);

    public Interval {
        Objects.requireNonNull(lowerLevel, "lowerLevel");
        Objects.requireNonNull(upperLevel, "upperLevel");
    }

    /**
     * @return The interval {@code [START, END]} covering every level.
     */
    public static Interval full() {
        return new Interval(Level.start(), 0, Level.end(), 0);
    }

    /**
     * Creates an interval between two exact levels.
     * @param lower The lower level.
     * @param upper The upper level.
     * @return The interval.
     */
    public static Interval between(int lower, int upper) {
        return new Interval(Level.of(lower), 0, Level.of(upper), 0);
    }

    /**
     * @return {@code true} if the lower bound does not lie above the upper bound.
     */
    public boolean isValid() {
        int byLevel = LEVEL_ORDER.compare(lowerLevel, upperLevel);
        return byLevel < 0 || (byLevel == 0 && lowerOffset <= upperOffset);
    }

    /**
     * Checks the bound ordering.
     * @throws InvariantViolationException if the interval is inverted.
     */
    public void validate() {
        if (!isValid()) {
            throw new InvariantViolationException(IrErrorCode.INVALID_INTERVAL, "Inverted interval " + this);
        }
    }

    private static int rank(Level level) {
        if (level == Level.Special.START) {
            return 0;
        }
        return level == Level.Special.END ? 2 : 1;
    }

    private static String bound(Level level, int offset) {
        String name = level instanceof Level.Special special ? special.name().toLowerCase() : level.toString();
        if (offset == 0) {
            return name;
        }
        return name + (offset > 0 ? "+" : "") + offset;
    }

    @Override
    public String toString() {
        return "[" + bound(lowerLevel, lowerOffset) + ", " + bound(upperLevel, upperOffset) + "]";
    }
}
