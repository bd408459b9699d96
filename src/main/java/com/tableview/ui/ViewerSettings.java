package com.tableview.ui;

import javax.swing.BorderFactory;
import javax.swing.JComponent;
import java.awt.Color;
import java.awt.Font;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Presentation settings handed to every window and panel.
 *
 * @param debugElements widget kinds to outline with a colored border, e.g. {@code table}, {@code tree}
 */
public record ViewerSettings(boolean sortKeys,
                             boolean showUnits,
                             Set<String> debugElements,
                             Font font,
                             int padding) {

    public static final List<String> DEBUG_ELEMENT_KINDS =
        List.of("frame", "label", "button", "table", "tree", "filter", "textentry", "combobox");

    private static final Color[] DEBUG_COLORS = {Color.RED, Color.YELLOW, Color.BLUE, Color.PINK, Color.GREEN};

    public ViewerSettings {
        debugElements = Set.copyOf(debugElements);
    }

    public static ViewerSettings defaults() {
        return new ViewerSettings(true, false, Set.of(), new Font("Arial", Font.PLAIN, 12), 5);
    }

    public ViewerSettings withTree(boolean sortKeys, boolean showUnits) {
        return new ViewerSettings(sortKeys, showUnits, debugElements, font, padding);
    }

    public ViewerSettings withDebugElements(Set<String> kinds) {
        Set<String> normalized = kinds.stream()
            .map(kind -> kind.trim().toLowerCase(Locale.ROOT))
            .filter(kind -> !kind.isEmpty())
            .collect(Collectors.toSet());
        return new ViewerSettings(sortKeys, showUnits, normalized, font, padding);
    }

    public Font largeFont() {
        return font.deriveFont(font.getSize2D() * 2);
    }

    /**
     * Outlines {@code component} when {@code kind} is one of the debug elements.
     */
    public <T extends JComponent> T decorate(T component, String kind) {
        if (debugElements.contains(kind)) {
            int index = Math.max(DEBUG_ELEMENT_KINDS.indexOf(kind), 0);
            component.setBorder(BorderFactory.createCompoundBorder(
                BorderFactory.createLineBorder(DEBUG_COLORS[index % DEBUG_COLORS.length]),
                component.getBorder()));
        }
        return component;
    }
}
