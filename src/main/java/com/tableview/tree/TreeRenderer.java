package com.tableview.tree;

import com.tableview.data.DataValue;
import com.tableview.data.DataValues;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.tuple.Tuples;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flattens a nested value into a {@link DisplayTree}.
 *
 * <p>Mappings become branches labeled with their entry count, sequences and multi-line texts
 * become branches of index-keyed children, and everything else becomes a leaf holding its
 * display string. Sequences are always walked in index order; only mapping keys are sorted.
 */
public class TreeRenderer {
    private static final Logger log = LoggerFactory.getLogger(TreeRenderer.class);

    static final String EMPTY_MARKER = "(empty)";

    private final boolean sortKeys;
    private final boolean showUnits;

    public TreeRenderer() {
        this(true, false);
    }

    public TreeRenderer(boolean sortKeys, boolean showUnits) {
        this.sortKeys = sortKeys;
        this.showUnits = showUnits;
    }

    public DisplayTree render(Object value) {
        DisplayTree tree = new DisplayTree();
        load(tree, DataValues.of(value));
        return tree;
    }

    /**
     * Replaces the contents of {@code tree} with a rendering of {@code value}.
     */
    public void load(DisplayTree tree, DataValue value) {
        tree.clear();
        DataValue root = value instanceof DataValue.Null
            ? DataValue.Mapping.empty().with("data", new DataValue.Text("no data"))
            : value;
        renderEntries(tree, DisplayNode.NO_PARENT, topLevelEntries(root));
        tree.setSource(DataValues.deepCopy(root));
    }

    private MutableList<Pair<String, DataValue>> topLevelEntries(DataValue root) {
        if (root instanceof DataValue.Mapping mapping) {
            return entriesOf(mapping);
        }
        if (root instanceof DataValue.Sequence sequence) {
            return indexed(sequence.elements());
        }
        if (root instanceof DataValue.Text text && text.isMultiline()) {
            return indexed(lines(text));
        }
        return Lists.mutable.with(Tuples.pair("value", root));
    }

    private void renderEntries(DisplayTree tree, int parentId, MutableList<Pair<String, DataValue>> entries) {
        for (Pair<String, DataValue> entry : entries) {
            String key = entry.getOne();
            try {
                renderEntry(tree, parentId, key, entry.getTwo());
            } catch (RuntimeException e) {
                log.warn("failed to insert value for key: {}, error: {}", key, e.toString());
            }
        }
    }

    private void renderEntry(DisplayTree tree, int parentId, String key, DataValue value) {
        if (value instanceof DataValue.Mapping mapping) {
            String label = showUnits
                ? String.format("%s [dict] (%d keys)", key, mapping.size())
                : String.format("%s (%d)", key, mapping.size());
            int id = tree.addBranch(parentId, label);
            renderEntries(tree, id, entriesOf(mapping));
        } else if (value instanceof DataValue.Sequence sequence) {
            renderSequence(tree, parentId, key, sequence.elements(), "list", "items");
        } else if (value instanceof DataValue.Text text && text.isMultiline()) {
            renderSequence(tree, parentId, key, lines(text), "text", "lines");
        } else {
            tree.addLeaf(parentId, key, leafText(value));
        }
    }

    private void renderSequence(DisplayTree tree, int parentId, String key, MutableList<DataValue> elements,
                                String kind, String unit) {
        String label = showUnits
            ? String.format("%s [%s] (%d %s):", key, kind, elements.size(), unit)
            : String.format("%s (%d):", key, elements.size());
        if (elements.isEmpty()) {
            tree.addLeaf(parentId, label, EMPTY_MARKER);
            return;
        }
        int id = tree.addBranch(parentId, label);
        renderEntries(tree, id, indexed(elements));
    }

    /**
     * Display string of a scalar leaf.
     */
    protected String leafText(DataValue value) {
        return DataValues.display(value);
    }

    private MutableList<Pair<String, DataValue>> entriesOf(DataValue.Mapping mapping) {
        MutableList<Pair<String, DataValue>> entries = mapping.entries().keyValuesView().toList();
        return sortKeys ? entries.sortThisBy(Pair::getOne) : entries;
    }

    private static MutableList<Pair<String, DataValue>> indexed(MutableList<DataValue> elements) {
        MutableList<Pair<String, DataValue>> entries = Lists.mutable.withInitialCapacity(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            entries.add(Tuples.pair(Integer.toString(i), elements.get(i)));
        }
        return entries;
    }

    private static MutableList<DataValue> lines(DataValue.Text text) {
        MutableList<DataValue> lines = Lists.mutable.empty();
        text.value().lines().forEach(line -> lines.add(new DataValue.Text(line)));
        return lines;
    }
}
