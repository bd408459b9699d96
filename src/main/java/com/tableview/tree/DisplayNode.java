package com.tableview.tree;

import org.eclipse.collections.api.list.primitive.IntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.factory.primitive.IntLists;

/**
 * One row of the tree view. A node is either a leaf carrying a value or a branch carrying
 * children; {@code id} is its index in the owning {@link DisplayTree}.
 */
public final class DisplayNode {
    public static final int NO_PARENT = -1;

    private final int id;
    private final int parentId;
    private final String label;
    private final String value;
    private final MutableIntList children = IntLists.mutable.empty();
    private boolean expanded;

    DisplayNode(int id, int parentId, String label, String value) {
        this.id = id;
        this.parentId = parentId;
        this.label = label;
        this.value = value;
    }

    public int id() {
        return id;
    }

    public int parentId() {
        return parentId;
    }

    public String label() {
        return label;
    }

    /** The leaf value, or {@code null} for a branch. */
    public String value() {
        return value;
    }

    public boolean isLeaf() {
        return value != null;
    }

    public IntList children() {
        return children.asUnmodifiable();
    }

    public boolean isExpanded() {
        return expanded;
    }

    void addChild(int childId) {
        if (value != null) {
            throw new IllegalStateException("Leaf node " + id + " cannot have children");
        }
        children.add(childId);
    }

    void setExpanded(boolean expanded) {
        this.expanded = expanded;
    }

    @Override
    public String toString() {
        return value == null ? label : label + " = " + value;
    }
}
