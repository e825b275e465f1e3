package org.pgcore.log;

/**
 * Logging facade used throughout the protocol core. Backends are chosen by
 * {@link Logger#setLoggerName(String)}.
 */
public interface Log {
    boolean isTraceEnabled();

    boolean isDebugEnabled();

    boolean isInfoEnabled();

    boolean isWarnEnabled();

    boolean isErrorEnabled();

    void trace(Object msg);

    void trace(Object msg, Throwable throwable);

    void debug(Object msg);

    void debug(Object msg, Throwable throwable);

    void info(Object msg);

    void info(Object msg, Throwable throwable);

    void warn(Object msg);

    void warn(Object msg, Throwable throwable);

    void error(Object msg);

    void error(Object msg, Throwable throwable);
}
