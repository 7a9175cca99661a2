package org.oldskooler.computedhash.util;

import org.oldskooler.computedhash.functions.SFunction;

import java.lang.invoke.SerializedLambda;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

public final class LambdaUtils {
    private LambdaUtils() {}

    /**
     * Property name behind a getter reference, e.g. {@code Document::getContentHash} -> {@code contentHash}.
     */
    public static <T> String propertyName(SFunction<T, ?> getter) {
        SerializedLambda s = serialized(getter);
        String impl = s.getImplMethodName();
        if (impl.startsWith("lambda$")) {
            throw new IllegalArgumentException("Expected a getter method reference, got a lambda body: " + impl);
        }
        if (impl.startsWith("get") && impl.length() > 3) {
            return decap(impl.substring(3));
        } else if (impl.startsWith("is") && impl.length() > 2) {
            return decap(impl.substring(2));
        }
        return impl;
    }

    private static SerializedLambda serialized(SFunction<?, ?> getter) {
        try {
            Method m = getter.getClass().getDeclaredMethod("writeReplace");
            m.setAccessible(true);
            Object sl = m.invoke(getter);
            if (!(sl instanceof SerializedLambda)) {
                throw new IllegalStateException("Not a SerializedLambda");
            }
            return (SerializedLambda) sl;
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException e) {
            throw new IllegalArgumentException("Unable to resolve property from " + getter, e);
        }
    }

    private static String decap(String s) {
        if (s.isEmpty()) return s;
        return Character.toLowerCase(s.charAt(0)) + s.substring(1);
    }
}
