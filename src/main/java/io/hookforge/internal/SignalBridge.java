package io.hookforge.internal;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;

/**
 * Reflection bridge for the JDK's {@code sun.misc.Signal} API.
 *
 * <p>This keeps hookforge free from a compile-time dependency on {@code jdk.unsupported}.
 */
public final class SignalBridge {

    private static final String SIGNAL_CLASS = "sun.misc.Signal";
    private static final String HANDLER_CLASS = "sun.misc.SignalHandler";

    private SignalBridge() {
    }

    /**
     * Callback receiving the bare signal name (for example {@code TERM}).
     */
    public interface Callback {

        void handle(String signalName);
    }

    public static boolean isAvailable() {
        return load(SIGNAL_CLASS) != null && load(HANDLER_CLASS) != null;
    }

    /**
     * Installs {@code callback} for the named signal.
     *
     * @return the handler that was installed before, to be passed back to {@link #restore(String, Object)}
     * @throws IllegalArgumentException when the signal is unknown or reserved by the VM
     * @throws UnsupportedOperationException when the signal API is not present
     */
    public static Object install(String signalName, final Callback callback) {
        Class<?> signalClass = require(SIGNAL_CLASS);
        final Class<?> handlerClass = require(HANDLER_CLASS);
        Object handler = Proxy.newProxyInstance(
            SignalBridge.class.getClassLoader(),
            new Class<?>[]{handlerClass},
            new InvocationHandler() {
                @Override
                public Object invoke(Object proxy, Method method, Object[] args) {
                    if ("handle".equals(method.getName()) && args != null && args.length == 1) {
                        callback.handle(nameOf(args[0]));
                        return null;
                    }
                    if ("equals".equals(method.getName())) {
                        return proxy == args[0];
                    }
                    if ("hashCode".equals(method.getName())) {
                        return System.identityHashCode(proxy);
                    }
                    if ("toString".equals(method.getName())) {
                        return "hookforge-signal-handler";
                    }
                    return null;
                }
            }
        );
        return handle(signalClass, handlerClass, signalName, handler);
    }

    /**
     * Puts back a handler returned by {@link #install(String, Callback)}.
     */
    public static void restore(String signalName, Object previous) {
        if (previous == null) {
            return;
        }
        handle(require(SIGNAL_CLASS), require(HANDLER_CLASS), signalName, previous);
    }

    private static Object handle(Class<?> signalClass, Class<?> handlerClass, String signalName, Object handler) {
        try {
            Constructor<?> constructor = signalClass.getConstructor(String.class);
            Object signal = constructor.newInstance(signalName);
            Method handle = signalClass.getMethod("handle", signalClass, handlerClass);
            return handle.invoke(null, signal, handler);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Cannot handle signal " + signalName, cause);
        } catch (NoSuchMethodException e) {
            throw new UnsupportedOperationException("Signal API not usable", e);
        } catch (InstantiationException e) {
            throw new UnsupportedOperationException("Signal API not usable", e);
        } catch (IllegalAccessException e) {
            throw new UnsupportedOperationException("Signal API not usable", e);
        }
    }

    private static String nameOf(Object signal) {
        try {
            Object name = signal.getClass().getMethod("getName").invoke(signal);
            return name == null ? "" : name.toString();
        } catch (NoSuchMethodException e) {
            return "";
        } catch (IllegalAccessException e) {
            return "";
        } catch (InvocationTargetException e) {
            return "";
        }
    }

    private static Class<?> require(String className) {
        Class<?> type = load(className);
        if (type == null) {
            throw new UnsupportedOperationException(className + " is not available");
        }
        return type;
    }

    private static Class<?> load(String className) {
        try {
            return Class.forName(className);
        } catch (ClassNotFoundException e) {
            return null;
        } catch (LinkageError e) {
            return null;
        }
    }
}
