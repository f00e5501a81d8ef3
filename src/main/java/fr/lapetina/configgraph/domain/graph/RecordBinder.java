package fr.lapetina.configgraph.domain.graph;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binds a mapping onto the public canonical constructor of a record type.
 *
 * Values that already have the component's type are passed through, nested
 * mappings are bound recursively onto record components, and anything else
 * is coerced with Jackson.
 */
public final class RecordBinder {

    private final ObjectMapper mapper;

    public RecordBinder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Creates a record from the given values.
     *
     * @throws IllegalArgumentException if a component is missing, a key has no
     *                                  matching component, or a value can not be coerced
     */
    public <R extends Record> R bind(Class<R> type, Map<String, ?> values) {
        RecordComponent[] components = type.getRecordComponents();
        Set<String> unknown = new HashSet<>(values.keySet());
        Object[] args = new Object[components.length];
        Class<?>[] parameterTypes = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            RecordComponent component = components[i];
            String name = component.getName();
            parameterTypes[i] = component.getType();
            if (!values.containsKey(name)) {
                throw new IllegalArgumentException("Missing required field '" + name
                        + "' for " + type.getSimpleName());
            }
            unknown.remove(name);
            args[i] = convert(type, name, values.get(name), component.getType(), component.getGenericType());
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown fields " + unknown + " for " + type.getSimpleName());
        }
        try {
            Constructor<R> constructor = type.getConstructor(parameterTypes);
            return constructor.newInstance(args);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("Record " + type.getName()
                    + " must be public to be bound from configuration", e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Constructor of " + type.getSimpleName() + " failed", cause);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Can not construct " + type.getSimpleName(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private Object convert(Class<?> owner, String field, Object value, Class<?> target, Type genericType) {
        if (value == null) {
            if (target.isPrimitive()) {
                throw new IllegalArgumentException("Field '" + field + "' of " + owner.getSimpleName()
                        + " can not be None");
            }
            return null;
        }
        if (target.isRecord() && value instanceof Map<?, ?> map) {
            return bind((Class<? extends Record>) target, (Map<String, ?>) map);
        }
        if (List.class.isAssignableFrom(target) && value instanceof List<?> list
                && genericType instanceof ParameterizedType pt
                && pt.getActualTypeArguments()[0] instanceof Class<?> element) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(convert(owner, field, item, element, element));
            }
            return out;
        }
        if (wrap(target).isInstance(value)) {
            return value;
        }
        try {
            JavaType javaType = mapper.constructType(genericType);
            return mapper.convertValue(value, javaType);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Field '" + field + "' of " + owner.getSimpleName()
                    + " can not take value '" + value + "'", e);
        }
    }

    private static Class<?> wrap(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == boolean.class) return Boolean.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        return Character.class;
    }
}
