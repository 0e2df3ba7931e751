package org.stencilir.compiler.iir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class of the nodes of the internal IR tree that own an ordered list of children.
 * <p>
 * Children are edited in place; a node never holds the same child twice. Structure is only ever
 * changed by the owner of the tree, so no synchronization is done.
 *
 * @param <C> The child type.
 */
public abstract class IirContainer<C> {

    private final List<C> children = new ArrayList<>();

    protected IirContainer(List<? extends C> initial) {
        if (initial != null) {
            initial.forEach(this::append);
        }
    }

    /**
     * @return An unmodifiable view of the children in execution order.
     */
    public List<C> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int size() {
        return children.size();
    }

    public C get(int index) {
        return children.get(index);
    }

    /**
     * Appends a child.
     * @param child The child.
     */
    public void append(C child) {
        children.add(checkNew(child));
    }

    /**
     * Inserts a child at a position.
     * @param index The position, {@code 0..size()}.
     * @param child The child.
     */
    public void insert(int index, C child) {
        children.add(index, checkNew(child));
    }

    /**
     * Replaces the child at a position.
     * @param index The position.
     * @param child The new child.
     * @return The replaced child.
     */
    public C replace(int index, C child) {
        C old = children.get(index);
        if (old != child) {
            checkNew(child);
        }
        return children.set(index, child);
    }

    /**
     * Replaces a child by another one.
     * @param oldChild The child to replace.
     * @param newChild The replacement.
     * @return {@code true} if {@code oldChild} was found.
     */
    public boolean replace(C oldChild, C newChild) {
        int index = indexOf(oldChild);
        if (index < 0) {
            return false;
        }
        replace(index, newChild);
        return true;
    }

    /**
     * Removes a child.
     * @param child The child.
     * @return {@code true} if it was present.
     */
    public boolean remove(C child) {
        int index = indexOf(child);
        if (index < 0) {
            return false;
        }
        children.remove(index);
        return true;
    }

    public C remove(int index) {
        return children.remove(index);
    }

    private int indexOf(C child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    private C checkNew(C child) {
        Objects.requireNonNull(child, "child");
        if (indexOf(child) >= 0) {
            throw new IllegalArgumentException("Node is already a child of this " + getClass().getSimpleName());
        }
        return child;
    }

    protected boolean sameChildren(IirContainer<?> other) {
        return children.equals(other.children);
    }

    protected int childrenHash() {
        return children.hashCode();
    }
}
