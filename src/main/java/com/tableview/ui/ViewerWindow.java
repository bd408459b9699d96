package com.tableview.ui;

import com.tableview.io.DataLoader;
import com.tableview.io.LoadedData;
import com.tableview.table.DataTable;
import com.tableview.table.FilterClause;
import com.tableview.table.TableSnapshot;
import com.tableview.tree.DisplayTree;
import com.tableview.tree.TreeRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.BorderFactory;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JMenu;
import javax.swing.JMenuBar;
import javax.swing.JMenuItem;
import javax.swing.JOptionPane;
import javax.swing.JPanel;
import javax.swing.JTabbedPane;
import javax.swing.WindowConstants;
import java.awt.BorderLayout;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Top-level window: a summary line naming the source, then one tab per dataset.
 * Must be built and used on the event dispatch thread.
 */
public class ViewerWindow {
    private static final Logger log = LoggerFactory.getLogger(ViewerWindow.class);

    static final String TITLE = "TableView";

    private final ViewerSettings settings;
    private final JFrame frame = new JFrame(TITLE);
    private final JLabel summary = new JLabel();
    private final JTabbedPane tabs = new JTabbedPane();

    public ViewerWindow(ViewerSettings settings, Runnable onClose) {
        this.settings = settings;

        summary.setFont(settings.largeFont());
        summary.setBorder(BorderFactory.createEmptyBorder(
            settings.padding(), settings.padding(), settings.padding(), settings.padding()));

        JPanel content = settings.decorate(new JPanel(new BorderLayout()), "frame");
        content.add(settings.decorate(summary, "label"), BorderLayout.NORTH);
        content.add(tabs, BorderLayout.CENTER);

        frame.setContentPane(content);
        frame.setJMenuBar(menuBar());
        frame.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
        frame.addWindowListener(new WindowAdapter() {
            @Override
            public void windowClosed(WindowEvent e) {
                onClose.run();
            }
        });
        frame.setSize(800, 500);
        frame.setLocationByPlatform(true);
    }

    private JMenuBar menuBar() {
        JMenuItem open = new JMenuItem("Open...");
        open.addActionListener(e -> new FilePicker().choose(frame).ifPresent(this::open));
        JMenuItem close = new JMenuItem("Close");
        close.addActionListener(e -> frame.dispose());

        JMenu file = new JMenu("File");
        file.add(open);
        file.addSeparator();
        file.add(close);
        JMenuBar bar = new JMenuBar();
        bar.add(file);
        return bar;
    }

    /**
     * Replaces the current content with the tables of {@code snapshot}, seeding every filter
     * bar with the given query.
     */
    public void showTables(TableSnapshot snapshot, String expression, List<FilterClause> clauses) {
        tabs.removeAll();
        summary.setText("File: " + snapshot.source());
        for (DataTable table : snapshot.tables()) {
            TablePanel panel = new TablePanel(table, settings);
            if ((expression != null && !expression.isBlank()) || !clauses.isEmpty()) {
                panel.applyQuery(expression, clauses);
            }
            tabs.addTab(table.name(), panel);
        }
    }

    public void showTree(String source, DisplayTree tree) {
        tabs.removeAll();
        summary.setText("File: " + source);
        tabs.addTab("tree", new TreePanel(tree, settings));
    }

    public void show(LoadedData data) {
        if (data instanceof LoadedData.Tables tables) {
            showTables(tables.snapshot(), null, List.of());
        } else if (data instanceof LoadedData.Document document) {
            TreeRenderer renderer = new TreeRenderer(settings.sortKeys(), settings.showUnits());
            showTree(document.source(), renderer.render(document.value()));
        }
    }

    public void setVisible(boolean visible) {
        frame.setVisible(visible);
    }

    private void open(Path path) {
        try {
            show(new DataLoader().load(path, null));
        } catch (IOException e) {
            log.warn("could not open {}: {}", path, e.getMessage());
            JOptionPane.showMessageDialog(frame, e.getMessage(), TITLE, JOptionPane.ERROR_MESSAGE);
        }
    }
}
