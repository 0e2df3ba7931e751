package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structural comparison of ASTs that, unlike {@code equals}, also compares source locations.
 */
public final class AstComparison {

    private AstComparison() {
        throw new IllegalStateException("Utility class");
    }

    /**
     * Compares two trees including the source location of every node, field, call and region.
     *
     * @param a The first tree.
     * @param b The second tree.
     * @return {@code true} if both trees are equal and carry the same locations.
     */
    public static boolean equalsWithLocations(AstNode a, AstNode b) {
        if (!Objects.equals(a, b)) {
            return false;
        }
        if (a == null) {
            return true;
        }
        if (!locationsOf(a).equals(locationsOf(b))) {
            return false;
        }
        // Equal nodes have the same shape, so their children pair up.
        List<AstNode> left = a.getChildren();
        List<AstNode> right = b.getChildren();
        for (int i = 0; i < left.size(); i++) {
            if (!equalsWithLocations(left.get(i), right.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static List<SourceLocation> locationsOf(AstNode node) {
        List<SourceLocation> locations = new ArrayList<>();
        locations.add(node.loc());
        if (node instanceof StencilCallDeclStmt s) {
            locations.add(s.call().loc());
            s.call().arguments().forEach(f -> locations.add(f.loc()));
        } else if (node instanceof BoundaryConditionDeclStmt s) {
            s.fields().forEach(f -> locations.add(f.loc()));
        } else if (node instanceof VerticalRegionDeclStmt s) {
            locations.add(s.region().loc());
        }
        return locations;
    }
}
