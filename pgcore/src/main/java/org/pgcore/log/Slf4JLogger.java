package org.pgcore.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Log} backed by SLF4J. Selected with {@code logger=Slf4JLogger}.
 */
public class Slf4JLogger implements Log {
    private final Logger delegate;

    public Slf4JLogger(String name) {
        this.delegate = LoggerFactory.getLogger(name);
    }

    @Override
    public boolean isTraceEnabled() {
        return delegate.isTraceEnabled();
    }

    @Override
    public boolean isDebugEnabled() {
        return delegate.isDebugEnabled();
    }

    @Override
    public boolean isInfoEnabled() {
        return delegate.isInfoEnabled();
    }

    @Override
    public boolean isWarnEnabled() {
        return delegate.isWarnEnabled();
    }

    @Override
    public boolean isErrorEnabled() {
        return delegate.isErrorEnabled();
    }

    @Override
    public void trace(Object msg) {
        delegate.trace(String.valueOf(msg));
    }

    @Override
    public void trace(Object msg, Throwable throwable) {
        delegate.trace(String.valueOf(msg), throwable);
    }

    @Override
    public void debug(Object msg) {
        delegate.debug(String.valueOf(msg));
    }

    @Override
    public void debug(Object msg, Throwable throwable) {
        delegate.debug(String.valueOf(msg), throwable);
    }

    @Override
    public void info(Object msg) {
        delegate.info(String.valueOf(msg));
    }

    @Override
    public void info(Object msg, Throwable throwable) {
        delegate.info(String.valueOf(msg), throwable);
    }

    @Override
    public void warn(Object msg) {
        delegate.warn(String.valueOf(msg));
    }

    @Override
    public void warn(Object msg, Throwable throwable) {
        delegate.warn(String.valueOf(msg), throwable);
    }

    @Override
    public void error(Object msg) {
        delegate.error(String.valueOf(msg));
    }

    @Override
    public void error(Object msg, Throwable throwable) {
        delegate.error(String.valueOf(msg), throwable);
    }
}
