package org.stencilir.compiler.api;

/**
 * A position in the user's source code, attached to AST nodes for diagnostics only.
 * <p>
 * Both components are at least 1, or the location is {@link #UNKNOWN} ({@code (-1,-1)}).
 *
 * @param line   The 1-based source line.
 * @param column The 1-based column in {@code line}.
 */
public record SourceLocation(int line, int column) {

    /** The sentinel for nodes without a known origin. */
    public static final SourceLocation UNKNOWN = new SourceLocation(-1, -1);

    /**
     * Compact constructor rejecting anything but a real position or the sentinel.
     */
    public SourceLocation {
        boolean unknown = line == -1 && column == -1;
        if (!unknown && (line < 1 || column < 1)) {
            throw new IllegalArgumentException("Invalid source location (" + line + "," + column + ")");
        }
    }

    /**
     * Creates a location.
     * @param line The line.
     * @param column The column.
     * @return The location.
     */
    public static SourceLocation of(int line, int column) {
        return new SourceLocation(line, column);
    }

    /**
     * @return {@code true} unless this is the {@link #UNKNOWN} sentinel.
     */
    public boolean isKnown() {
        return line != -1;
    }

    @Override
    public String toString() {
        return isKnown() ? line + ":" + column : "<unknown>";
    }
}
