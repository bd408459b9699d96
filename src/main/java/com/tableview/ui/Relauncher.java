package com.tableview.ui;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Starts a fresh viewer process for a file picked interactively. The child shares this
 * process's console and its exit code becomes ours.
 */
public class Relauncher {
    private static final Logger log = LoggerFactory.getLogger(Relauncher.class);

    private final String mainClass;

    public Relauncher(String mainClass) {
        this.mainClass = mainClass;
    }

    /**
     * @param options command-line options to pass through, placed before the file
     */
    public List<String> command(List<String> options, Path file) {
        MutableList<String> command = Lists.mutable.of(
            javaExecutable(),
            "-cp",
            System.getProperty("java.class.path"),
            mainClass);
        command.addAll(options);
        command.add(file.toAbsolutePath().toString());
        return command;
    }

    public int run(List<String> options, Path file) throws IOException, InterruptedException {
        List<String> command = command(options, file);
        log.info("relaunching viewer for {}", file);
        log.debug("child command: {}", command);
        Process child = new ProcessBuilder(command).inheritIO().start();
        int code = child.waitFor();
        log.debug("child exited with {}", code);
        return code;
    }

    static String javaExecutable() {
        return Paths.get(System.getProperty("java.home"), "bin", "java").toString();
    }
}
