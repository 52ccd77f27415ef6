/* (C)2026 */
package com.ammann.updatetracker.support;

import java.lang.reflect.Field;

/** Sets {@code @Inject} fields of beans constructed directly in unit tests. */
public final class Injection {

    private Injection() {}

    public static void injectField(Object target, String fieldName, Object value) {
        try {
            Field field = target.getClass().getDeclaredField(fieldName);
            field.setAccessible(true);
            field.set(target, value);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot inject " + fieldName, e);
        }
    }
}
