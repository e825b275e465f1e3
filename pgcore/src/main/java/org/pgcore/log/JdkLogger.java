package org.pgcore.log;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Log} backed by java.util.logging. Records carry the class and method of
 * the first caller outside this package.
 */
public class JdkLogger implements Log {
    private final Logger delegate;

    public JdkLogger(String name) {
        this.delegate = Logger.getLogger(name);
    }

    @Override
    public boolean isTraceEnabled() {
        return delegate.isLoggable(Level.FINEST);
    }

    @Override
    public boolean isDebugEnabled() {
        return delegate.isLoggable(Level.FINE);
    }

    @Override
    public boolean isInfoEnabled() {
        return delegate.isLoggable(Level.INFO);
    }

    @Override
    public boolean isWarnEnabled() {
        return delegate.isLoggable(Level.WARNING);
    }

    @Override
    public boolean isErrorEnabled() {
        return delegate.isLoggable(Level.SEVERE);
    }

    @Override
    public void trace(Object msg) {
        log(Level.FINEST, msg, null);
    }

    @Override
    public void trace(Object msg, Throwable throwable) {
        log(Level.FINEST, msg, throwable);
    }

    @Override
    public void debug(Object msg) {
        log(Level.FINE, msg, null);
    }

    @Override
    public void debug(Object msg, Throwable throwable) {
        log(Level.FINE, msg, throwable);
    }

    @Override
    public void info(Object msg) {
        log(Level.INFO, msg, null);
    }

    @Override
    public void info(Object msg, Throwable throwable) {
        log(Level.INFO, msg, throwable);
    }

    @Override
    public void warn(Object msg) {
        log(Level.WARNING, msg, null);
    }

    @Override
    public void warn(Object msg, Throwable throwable) {
        log(Level.WARNING, msg, throwable);
    }

    @Override
    public void error(Object msg) {
        log(Level.SEVERE, msg, null);
    }

    @Override
    public void error(Object msg, Throwable throwable) {
        log(Level.SEVERE, msg, throwable);
    }

    private void log(Level level, Object msg, Throwable throwable) {
        if (!delegate.isLoggable(level)) {
            return;
        }
        String sourceClass = null;
        String sourceMethod = null;
        String ownPackage = LogFactory.packageOf(Log.class) + ".";
        for (StackTraceElement frame : new Throwable().getStackTrace()) {
            if (!frame.getClassName().startsWith(ownPackage)) {
                sourceClass = frame.getClassName();
                sourceMethod = frame.getMethodName();
                break;
            }
        }
        if (throwable == null) {
            delegate.logp(level, sourceClass, sourceMethod, String.valueOf(msg));
        } else {
            delegate.logp(level, sourceClass, sourceMethod, String.valueOf(msg), throwable);
        }
    }
}
