package com.tableview.tree;

import com.tableview.data.DataValue;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.IntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.eclipse.collections.impl.list.primitive.IntInterval;

/**
 * Arena of {@link DisplayNode}s. Ids are allocated in order and double as indexes, so a node
 * handle stays valid until the tree is cleared.
 */
public class DisplayTree {
    private final MutableList<DisplayNode> nodes = Lists.mutable.empty();
    private final MutableIntList roots = IntLists.mutable.empty();
    private DataValue source;

    int addBranch(int parentId, String label) {
        return add(parentId, label, null);
    }

    int addLeaf(int parentId, String label, String value) {
        return add(parentId, label, value);
    }

    private int add(int parentId, String label, String value) {
        int id = nodes.size();
        DisplayNode node = new DisplayNode(id, parentId, label, value);
        if (parentId == DisplayNode.NO_PARENT) {
            roots.add(id);
        } else {
            nodes.get(parentId).addChild(id);
        }
        nodes.add(node);
        return id;
    }

    void setSource(DataValue source) {
        this.source = source;
    }

    /** The value this tree was rendered from, as a copy taken at render time. */
    public DataValue source() {
        return source;
    }

    public DisplayNode node(int id) {
        return nodes.get(id);
    }

    public IntList roots() {
        return roots.asUnmodifiable();
    }

    public MutableList<DisplayNode> children(int id) {
        MutableList<DisplayNode> result = Lists.mutable.empty();
        node(id).children().forEach(child -> result.add(nodes.get(child)));
        return result;
    }

    /** Flat registry of every node id, in creation order. */
    public IntList nodeIds() {
        return nodes.isEmpty() ? IntLists.immutable.empty() : IntInterval.zeroTo(nodes.size() - 1);
    }

    public int size() {
        return nodes.size();
    }

    public int leafCount() {
        return nodes.count(DisplayNode::isLeaf);
    }

    public void expandAll() {
        nodes.forEach(node -> node.setExpanded(!node.isLeaf()));
    }

    public void collapseAll() {
        nodes.forEach(node -> node.setExpanded(false));
    }

    public void clear() {
        nodes.clear();
        roots.clear();
        source = null;
    }
}
