package com.caprouter;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Router log: timestamped {@code [time] [LEVEL] message} lines appended to a log file and,
 * in dev mode, echoed to the console.
 * <p>
 * There is one instance per process, created by {@link #initialize}. Until then
 * {@link #get()} returns null and callers skip logging, which is how the router runs when
 * embedded or under test. Dev mode also lowers the threshold to {@link Level#DEBUG}, which
 * adds the per-attempt JsonGuard rejections to the log.
 */
public class AppLogger {

    public enum Level {
        DEBUG,
        INFO,
        WARN,
        ERROR
    }

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static AppLogger instance;

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean consoleEnabled;
    private final Level threshold;

    AppLogger(Path logFile, boolean devMode, PrintStream consoleOutput) throws IOException {
        this.consoleOutput = consoleOutput;
        this.consoleEnabled = devMode;
        this.threshold = devMode ? Level.DEBUG : Level.INFO;

        Path parent = logFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.fileOutput = new PrintStream(new FileOutputStream(logFile.toFile(), true), true, StandardCharsets.UTF_8);

        String separator = "=".repeat(60);
        fileOutput.println();
        fileOutput.println(separator);
        fileOutput.println("Capability Router started at " + LocalDateTime.now().format(TIME_FORMAT)
            + " (log level " + threshold + ")");
        fileOutput.println(separator);
    }

    public static synchronized void initialize(Path logFile, boolean devMode) throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, devMode, System.out);
        }
    }

    public static AppLogger get() {
        return instance;
    }

    public boolean isDebugEnabled() {
        return threshold == Level.DEBUG;
    }

    public void debug(String message) {
        log(Level.DEBUG, message);
    }

    public void info(String message) {
        log(Level.INFO, message);
    }

    public void warn(String message) {
        log(Level.WARN, message);
    }

    public void error(String message) {
        log(Level.ERROR, message);
    }

    public synchronized void error(String message, Throwable t) {
        log(Level.ERROR, message);
        t.printStackTrace(fileOutput);
        if (consoleEnabled) {
            t.printStackTrace(consoleOutput);
        }
    }

    // Concurrent route() calls share this logger; one line per call, never interleaved.
    private synchronized void log(Level level, String message) {
        if (level.compareTo(threshold) < 0) {
            return;
        }
        String line = String.format("[%s] [%s] %s", LocalDateTime.now().format(TIME_FORMAT), level, message);
        fileOutput.println(line);
        if (consoleEnabled) {
            consoleOutput.println(line);
        }
    }

    /**
     * Startup banner lines: always printed to the console, and copied to the file.
     */
    public synchronized void console(String message) {
        consoleOutput.println(message);
        fileOutput.println(message);
    }

    public synchronized void close() {
        fileOutput.close();
    }
}
