package org.pgcore.log;

import java.sql.SQLException;

/**
 * Entry point for obtaining {@link Log} instances.
 */
public class Logger {

    static final String JDK_LOGGER = "JdkLogger";
    static final String SLF4J_LOGGER = "Slf4JLogger";

    private static volatile String loggerName;

    private Logger() {
    }

    public static Log getLogger(String name) {
        String backend = loggerName;
        if (backend == null || backend.isEmpty()) {
            return new JdkLogger(name);
        }
        try {
            return LogFactory.getLogger(backend, name);
        } catch (SQLException e) {
            // the JDK backend is always available
            System.err.println("ERROR: cannot create logger backend '" + backend
                    + "', falling back to " + JDK_LOGGER + ": " + e.getMessage()
                    + " (SQLState " + e.getSQLState() + ")");
            return new JdkLogger(name);
        }
    }

    public static String getLoggerName() {
        return loggerName == null ? JDK_LOGGER : loggerName;
    }

    public static boolean isUsingJdkLogger() {
        String backend = loggerName;
        if (backend == null || backend.isEmpty()) {
            return true;
        }
        int dot = backend.lastIndexOf('.');
        return JDK_LOGGER.equals(dot >= 0 ? backend.substring(dot + 1) : backend);
    }

    /**
     * Selects the backend for loggers created from now on. Accepts a short name
     * ({@code JdkLogger}, {@code Slf4JLogger}) or a fully qualified class name of a
     * {@link Log} implementation with a {@code (String)} constructor.
     *
     * @param logger backend name, null or empty for the JDK backend
     */
    public static synchronized void setLoggerName(String logger) {
        loggerName = logger;
    }
}
