package com.yamlguard.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.*;

/**
 * Configures java.util.logging for yamlguard and hands out loggers.
 * <p>
 * Settings come from {@code /logging.properties} on the classpath. Without it,
 * WARNING and above go to the console, and everything goes to the file named
 * by the {@code yamlguard.log.file} system property when that is set.
 */
public class LoggerUtil {
    static final String LOG_CONFIG_RESOURCE = "/logging.properties";
    static final String LOG_FILE_PROPERTY = "yamlguard.log.file";
    private static final String LINE_FORMAT = "[%4$s] %3$s: %5$s%6$s%n";

    private static final Logger rootLogger = Logger.getLogger("");
    private static boolean initialized = false;

    private LoggerUtil() {
    }

    static synchronized void initialize() {
        if (initialized) {
            return;
        }
        initialized = true;

        try (InputStream is = LoggerUtil.class.getResourceAsStream(LOG_CONFIG_RESOURCE)) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
                return;
            }
            configureFallbackHandlers();
        } catch (IOException | SecurityException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
        }
    }

    private static void configureFallbackHandlers() throws IOException {
        if (System.getProperty("java.util.logging.SimpleFormatter.format") == null) {
            System.setProperty("java.util.logging.SimpleFormatter.format", LINE_FORMAT);
        }
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(Level.WARNING);
        console.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(console);

        String logFile = System.getProperty(LOG_FILE_PROPERTY);
        if (logFile != null && !logFile.isBlank()) {
            FileHandler file = new FileHandler(logFile, true);
            file.setLevel(Level.ALL);
            file.setFormatter(new SimpleFormatter());
            rootLogger.addHandler(file);
        }
    }

    /**
     * Lets {@code level} through to the console; {@code --verbose} passes FINE.
     * Levels are only ever lowered, so handlers configured for more detail keep it.
     */
    public static synchronized void setConsoleLevel(Level level) {
        initialize();
        Logger yamlguard = Logger.getLogger("com.yamlguard");
        if (yamlguard.getLevel() == null || yamlguard.getLevel().intValue() > level.intValue()) {
            yamlguard.setLevel(level);
        }
        if (rootLogger.getLevel() == null || rootLogger.getLevel().intValue() > level.intValue()) {
            rootLogger.setLevel(level);
        }
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler && handler.getLevel().intValue() > level.intValue()) {
                handler.setLevel(level);
            }
        }
    }

    public static Logger getLogger(Class<?> clazz) {
        initialize();
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Flushes and closes the root handlers. Called once by the command line before exiting.
     */
    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.close();
        }
    }
}
