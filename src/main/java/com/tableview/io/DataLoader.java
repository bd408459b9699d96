package com.tableview.io;

import com.tableview.data.DataValue;
import com.tableview.data.JsonDataParser;
import com.tableview.table.DataTable;
import com.tableview.table.TableSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Entry point for reading a file or standard input into {@link LoadedData}.
 */
public class DataLoader {
    private static final Logger log = LoggerFactory.getLogger(DataLoader.class);

    public static final String STDIN_SOURCE = "(from stdin)";

    /**
     * @throws InputNotFoundException if {@code path} is not a regular file
     * @throws UnsupportedFormatException if the extension is not readable
     */
    public LoadedData load(Path path, String subitem) throws IOException {
        Path resolved = path.toAbsolutePath().normalize();
        if (!Files.isRegularFile(resolved)) {
            throw new InputNotFoundException(resolved);
        }
        DataFormat format = DataFormat.of(resolved);
        log.info("reading {} data from file: {}", format, resolved);
        LoadedData data = format.loader().load(resolved, subitem);
        logLoaded(data);
        return data;
    }

    /**
     * Drains {@code input} completely. JSON (text starting with an object or array) is parsed
     * directly; anything else is buffered to a temporary CSV file and read from there.
     *
     * @return empty when the input holds nothing but whitespace
     */
    public Optional<LoadedData> loadStdin(InputStream input) throws IOException {
        byte[] bytes = input.readAllBytes();
        String text = new String(bytes, StandardCharsets.UTF_8);
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        LoadedData data;
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            DataValue value = new JsonDataParser().parse(trimmed);
            data = new JsonTableLoader().fromValue(STDIN_SOURCE, "stdin", value);
        } else {
            Path buffer = Files.createTempFile("tableview-stdin-", ".csv");
            buffer.toFile().deleteOnExit();
            Files.write(buffer, bytes);
            log.debug("buffered {} bytes of stdin in {}", bytes.length, buffer);
            DataTable table;
            try (Reader reader = Files.newBufferedReader(buffer, StandardCharsets.UTF_8)) {
                table = new CsvTableLoader(',').read("stdin", reader);
            }
            data = new LoadedData.Tables(TableSnapshot.of(STDIN_SOURCE, table));
        }
        log.info("loaded data from stdin");
        logLoaded(data);
        return Optional.of(data);
    }

    private static void logLoaded(LoadedData data) {
        if (data instanceof LoadedData.Tables tables) {
            tables.snapshot().tables().forEach(t -> log.info("loaded {}", t));
        } else {
            log.info("loaded a document from {}", data.source());
        }
    }
}
