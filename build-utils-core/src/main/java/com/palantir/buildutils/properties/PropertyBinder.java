/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.palantir.buildutils.properties;

import com.google.common.collect.ImmutableMap;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Reads and writes the {@code String} members of an object by name, through public setters/getters or fields.
 * <p>
 * The target is either an instance, whose instance members are used, or a {@link Class}, whose static members are
 * used. This lets build scripts keep their constants in a holder object or class.
 */
public final class PropertyBinder {
    private final Object instance;
    private final Class<?> type;

    private PropertyBinder(Object target) {
        if (target instanceof Class<?> targetClass) {
            this.instance = null;
            this.type = targetClass;
        } else {
            this.instance = target;
            this.type = target.getClass();
        }
    }

    public static PropertyBinder of(Object target) {
        return new PropertyBinder(target);
    }

    private boolean isStaticTarget() {
        return instance == null;
    }

    /**
     * Assigns {@code value} to the writable member called {@code name}.
     *
     * @return false when there is no such member
     */
    public boolean assign(String name, String value) {
        Optional<Method> setter = findSetter(setterName(name));
        if (setter.isPresent()) {
            invoke(setter.get(), value);
            return true;
        }

        Optional<Field> field = findField(name);
        if (field.isPresent() && !Modifier.isFinal(field.get().getModifiers())) {
            try {
                field.get().set(instance, value);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot assign " + describe(name), e);
            }
            return true;
        }
        return false;
    }

    /**
     * Every readable {@code String} member of the target, keyed by property name. Null values are skipped. For an
     * instance the static members of its class are read too, after the instance members, since constants such as a
     * Kotlin {@code const val} in an {@code object} compile to static fields.
     */
    public Map<String, String> readableValues() {
        Map<String, String> values = new TreeMap<>();
        readMembers(false, values);
        readMembers(true, values);
        return ImmutableMap.copyOf(values);
    }

    private void readMembers(boolean statics, Map<String, String> values) {
        if (!statics && isStaticTarget()) {
            return;
        }
        for (Field field : type.getFields()) {
            if (field.getType() == String.class && Modifier.isStatic(field.getModifiers()) == statics) {
                try {
                    Object value = field.get(statics ? null : instance);
                    if (value != null) {
                        values.putIfAbsent(field.getName(), (String) value);
                    }
                } catch (IllegalAccessException e) {
                    throw new IllegalStateException("Cannot read " + describe(field.getName()), e);
                }
            }
        }
        for (Method method : type.getMethods()) {
            String name = method.getName();
            if (name.length() > 3
                    && name.startsWith("get")
                    && method.getParameterCount() == 0
                    && method.getReturnType() == String.class
                    && Modifier.isStatic(method.getModifiers()) == statics
                    && method.getDeclaringClass() != Object.class) {
                Object value = invoke(method);
                if (value != null) {
                    values.putIfAbsent(decapitalize(name.substring(3)), (String) value);
                }
            }
        }
    }

    // setters taking Object, like Project.setVersion, accept a String too
    private Optional<Method> findSetter(String name) {
        return Arrays.stream(type.getMethods())
                .filter(method -> method.getName().equals(name))
                .filter(method -> method.getParameterCount() == 1)
                .filter(method -> method.getParameterTypes()[0].isAssignableFrom(String.class))
                .filter(method -> Modifier.isStatic(method.getModifiers()) == isStaticTarget())
                .min(Comparator.comparing(method -> method.getParameterTypes()[0] == String.class ? 0 : 1));
    }

    private Optional<Field> findField(String name) {
        try {
            Field field = type.getField(name);
            boolean matches = field.getType() == String.class
                    && Modifier.isStatic(field.getModifiers()) == isStaticTarget();
            return matches ? Optional.of(field) : Optional.empty();
        } catch (NoSuchFieldException e) {
            return Optional.empty();
        }
    }

    private Object invoke(Method method, Object... args) {
        try {
            return method.invoke(instance, args);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot call " + type.getName() + "." + method.getName(), e);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException(
                    "Calling " + type.getName() + "." + method.getName() + " failed", e.getCause());
        }
    }

    private String describe(String name) {
        return type.getName() + "." + name;
    }

    /** {@code version} becomes {@code setVersion}. */
    public static String setterName(String propertyName) {
        if (propertyName.isEmpty()) {
            return "set";
        }
        return "set" + propertyName.substring(0, 1).toUpperCase(Locale.ROOT) + propertyName.substring(1);
    }

    private static String decapitalize(String name) {
        return name.substring(0, 1).toLowerCase(Locale.ROOT) + name.substring(1);
    }
}
