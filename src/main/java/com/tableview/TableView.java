package com.tableview;

import com.tableview.data.DataValue;
import com.tableview.data.DataValues;
import com.tableview.io.DataLoader;
import com.tableview.io.LoadedData;
import com.tableview.output.TextRenderer;
import com.tableview.table.DataTable;
import com.tableview.table.FilterClause;
import com.tableview.table.RowFilterEvaluator;
import com.tableview.table.TableSnapshot;
import com.tableview.tree.DisplayTree;
import com.tableview.tree.TreeRenderer;
import com.tableview.ui.FilePicker;
import com.tableview.ui.Relauncher;
import com.tableview.ui.ViewerSettings;
import com.tableview.ui.ViewerWindow;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.PropertiesDefaultProvider;
import picocli.CommandLine.Spec;

import javax.swing.SwingUtilities;
import java.awt.GraphicsEnvironment;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(name = "tableview", mixinStandardHelpOptions = true, version = "1.0",
         description = "View CSV, TSV, Excel, JSON or SQLite data as a table or a tree",
         defaultValueProvider = PropertiesDefaultProvider.class)
public class TableView implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(TableView.class);

    private static final int STDIN_POLLS = 5;
    private static final long STDIN_POLL_MILLIS = 50;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Data file (default: stdin, or a file chooser)")
    private File inputFile;

    @Parameters(index = "1", arity = "0..1", description = "Sheet or table to show, by name or zero-based index")
    private String subitem;

    @Option(names = {"-p", "--print"}, description = "Print to stdout instead of opening a window")
    private boolean print = false;

    @Option(names = {"-t", "--tree"}, description = "Show tabular data as a tree")
    private boolean tree = false;

    @Option(names = "--no-sort-keys", description = "Keep mapping keys of the tree in document order")
    private boolean noSortKeys = false;

    @Option(names = {"-u", "--show-units"}, description = "Label tree branches with their kind, e.g. [dict]")
    private boolean showUnits = false;

    @Option(names = {"-q", "--query"}, description = "Row filter expression, e.g. \"age > 30 and city == 'Oslo'\"")
    private String query;

    @Option(names = {"-f", "--filter"}, paramLabel = "COLUMN:OPERATOR:VALUE[:CONNECTIVE]",
            description = "Filter clause, repeatable; connective is AND, OR or NOT")
    private List<String> filters = new ArrayList<>();

    @Option(names = {"-r", "--reverse"}, description = "Show rows bottom-up")
    private boolean reverse = false;

    @Option(names = "--debug-borders", split = ",", paramLabel = "KIND",
            description = "Outline widgets of these kinds: ${COMPLETION-CANDIDATES}",
            completionCandidates = DebugKinds.class)
    private List<String> debugBorders = new ArrayList<>();

    @Option(names = "--stacktrace", description = "Print the stack trace of a failure")
    private boolean stacktrace = false;

    private final InputStream stdin;
    private final PrintStream out;
    private final PrintStream err;

    public TableView() {
        this(System.in, System.out, System.err);
    }

    TableView(InputStream stdin, PrintStream out, PrintStream err) {
        this.stdin = stdin;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TableView()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            boolean printMode = print || GraphicsEnvironment.isHeadless();
            List<FilterClause> clauses = new ArrayList<>();
            filters.forEach(f -> clauses.add(FilterClause.parse(f)));

            Optional<LoadedData> loaded = load();
            if (loaded.isEmpty()) {
                if (printMode) {
                    throw new ParameterException(spec.commandLine(),
                        "No input: give a data file or pipe data on stdin");
                }
                return pickAndRelaunch();
            }

            LoadedData data = loaded.get();
            ViewerSettings settings = ViewerSettings.defaults()
                .withTree(!noSortKeys, showUnits)
                .withDebugElements(new HashSet<>(debugBorders));

            if (data instanceof LoadedData.Tables tables) {
                TableSnapshot snapshot = reverse ? tables.snapshot().reversed() : tables.snapshot();
                filterAll(snapshot, clauses);
                if (tree) {
                    return showTree(snapshot.source(), asValue(snapshot), settings, printMode);
                }
                return showTables(snapshot, clauses, settings, printMode);
            }

            LoadedData.Document document = (LoadedData.Document) data;
            if (query != null || !clauses.isEmpty()) {
                log.warn("row filters do not apply to a tree document, ignoring them");
            }
            return showTree(document.source(), document.value(), settings, printMode);
        } catch (ParameterException e) {
            throw e;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            if (stacktrace) {
                e.printStackTrace(err);
            }
            log.debug("command failed", e);
            return 1;
        }
    }

    private Optional<LoadedData> load() throws IOException, InterruptedException {
        DataLoader loader = new DataLoader();
        if (inputFile != null) {
            return Optional.of(loader.load(inputFile.toPath(), subitem));
        }
        if (stdinMayHaveData()) {
            return loader.loadStdin(stdin);
        }
        return Optional.empty();
    }

    /**
     * Java cannot ask whether stdin is a terminal, so the real stdin counts as piped once it has
     * bytes ready, polled briefly to let a slow producer start writing.
     */
    private boolean stdinMayHaveData() throws IOException, InterruptedException {
        if (stdin != System.in) {
            return true;
        }
        for (int poll = 0; poll < STDIN_POLLS; poll++) {
            if (stdin.available() > 0) {
                return true;
            }
            Thread.sleep(STDIN_POLL_MILLIS);
        }
        return false;
    }

    private void filterAll(TableSnapshot snapshot, List<FilterClause> clauses) {
        if ((query == null || query.isBlank()) && clauses.isEmpty()) {
            return;
        }
        RowFilterEvaluator evaluator = new RowFilterEvaluator();
        for (DataTable table : snapshot.tables()) {
            evaluator.apply(table, query, clauses);
        }
    }

    private int showTables(TableSnapshot snapshot, List<FilterClause> clauses,
                           ViewerSettings settings, boolean printMode) throws Exception {
        if (printMode) {
            out.print(new TextRenderer().renderSnapshot(snapshot));
            return 0;
        }
        return openWindow(window -> window.showTables(snapshot, query, clauses), settings);
    }

    private int showTree(String source, DataValue value, ViewerSettings settings, boolean printMode)
            throws Exception {
        DisplayTree displayTree = new TreeRenderer(settings.sortKeys(), settings.showUnits()).render(value);
        if (printMode) {
            out.print(new TextRenderer().renderTree(displayTree));
            return 0;
        }
        return openWindow(window -> window.showTree(source, displayTree), settings);
    }

    private int openWindow(WindowContent content, ViewerSettings settings) throws Exception {
        CountDownLatch closed = new CountDownLatch(1);
        SwingUtilities.invokeAndWait(() -> {
            ViewerWindow window = new ViewerWindow(settings, closed::countDown);
            content.fill(window);
            window.setVisible(true);
        });
        closed.await();
        return 0;
    }

    private int pickAndRelaunch() throws Exception {
        Path[] chosen = new Path[1];
        SwingUtilities.invokeAndWait(() -> chosen[0] = new FilePicker().choose(null).orElse(null));
        if (chosen[0] == null) {
            log.info("no file chosen");
            return 0;
        }
        return new Relauncher(TableView.class.getName()).run(passThroughOptions(), chosen[0]);
    }

    List<String> passThroughOptions() {
        MutableList<String> options = Lists.mutable.empty();
        if (tree) {
            options.add("--tree");
        }
        if (noSortKeys) {
            options.add("--no-sort-keys");
        }
        if (showUnits) {
            options.add("--show-units");
        }
        if (query != null) {
            options.add("--query=" + query);
        }
        filters.forEach(f -> options.add("--filter=" + f));
        if (reverse) {
            options.add("--reverse");
        }
        if (!debugBorders.isEmpty()) {
            options.add("--debug-borders=" + String.join(",", debugBorders));
        }
        if (stacktrace) {
            options.add("--stacktrace");
        }
        return options;
    }

    /** Visible rows as records: a list for one table, else a mapping of table name to list. */
    static DataValue asValue(TableSnapshot snapshot) {
        Map<String, List<Map<String, Object>>> byTable = new LinkedHashMap<>();
        for (DataTable table : snapshot.tables()) {
            List<Map<String, Object>> records = new ArrayList<>();
            for (int row = 0; row < table.rowCount(); row++) {
                records.add(table.record(row));
            }
            byTable.put(table.name(), records);
        }
        if (byTable.size() == 1) {
            return DataValues.of(byTable.values().iterator().next());
        }
        return DataValues.of(byTable);
    }

    private interface WindowContent {
        void fill(ViewerWindow window);
    }

    public static class DebugKinds extends ArrayList<String> {
        public DebugKinds() {
            super(ViewerSettings.DEBUG_ELEMENT_KINDS);
        }
    }
}
