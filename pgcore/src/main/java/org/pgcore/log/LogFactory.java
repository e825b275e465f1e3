package org.pgcore.log;

import org.pgcore.util.GT;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

public class LogFactory {

    private LogFactory() {
    }

    /**
     * Instantiates a logging backend reflectively.
     *
     * @param className short name of a backend in this package or a fully qualified class name
     * @param instanceName name of the logger to create
     * @return a new logger
     * @throws PSQLException if the backend cannot be loaded or is not a {@link Log}
     */
    public static Log getLogger(String className, String instanceName) throws PSQLException {
        if (className == null) {
            throw new PSQLException(GT.tr("Logger class name is null"), PSQLState.INVALID_PARAMETER_VALUE);
        }
        if (instanceName == null) {
            throw new PSQLException(GT.tr("Logger instance name is null"), PSQLState.INVALID_PARAMETER_VALUE);
        }
        Class<?> loggerClass = loadClass(className);
        if (!Log.class.isAssignableFrom(loggerClass)) {
            throw new PSQLException(GT.tr("Class {0} does not implement {1}", className, Log.class.getName()),
                    PSQLState.INVALID_PARAMETER_VALUE);
        }
        try {
            Constructor<?> constructor = loggerClass.getConstructor(String.class);
            return (Log) constructor.newInstance(instanceName);
        } catch (NoSuchMethodException e) {
            throw new PSQLException(GT.tr("Logger class {0} has no (String) constructor", className),
                    PSQLState.INVALID_PARAMETER_VALUE, e);
        } catch (InstantiationException | IllegalAccessException e) {
            throw new PSQLException(GT.tr("Cannot instantiate logger class {0}", className),
                    PSQLState.INVALID_PARAMETER_VALUE, e);
        } catch (InvocationTargetException e) {
            throw new PSQLException(GT.tr("Logger class {0} failed to initialize", className),
                    PSQLState.INVALID_PARAMETER_VALUE, e.getCause());
        } catch (LinkageError e) {
            // the slf4j backend without slf4j-api on the classpath ends up here
            throw new PSQLException(GT.tr("Logger class {0} cannot be linked", className),
                    PSQLState.INVALID_PARAMETER_VALUE, e);
        }
    }

    private static Class<?> loadClass(String className) throws PSQLException {
        try {
            return Class.forName(className);
        } catch (ClassNotFoundException e) {
            try {
                return Class.forName(packageOf(Log.class) + "." + className);
            } catch (ClassNotFoundException e2) {
                throw new PSQLException(GT.tr("Cannot find logger class {0}", className),
                        PSQLState.INVALID_PARAMETER_VALUE, e2);
            }
        }
    }

    static String packageOf(Class<?> clazz) {
        String name = clazz.getName();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : "";
    }
}
