package structview;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.time.temporal.TemporalAccessor;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Reflection helpers for {@link DocumentValue.Opaque} values (plain Java objects handed to the viewer).
 */
final class ValueInspector {

    /** A publicly readable member; reading it may fail. */
    record Member(String name, Callable<Object> reader) {}

    private ValueInspector() {}

    static boolean isScalar(Object value) {
        return value instanceof Boolean
                || value instanceof java.lang.Number
                || value instanceof Character
                || value instanceof CharSequence
                || value instanceof Enum<?>
                || value instanceof TemporalAccessor
                || value instanceof Date
                || value instanceof java.time.Duration
                || value instanceof UUID
                || value instanceof byte[];
    }

    static boolean isSequenceLike(Object value) {
        if (value instanceof Iterable<?>) return true;
        return value != null && value.getClass().isArray() && !(value instanceof byte[]);
    }

    static List<Object> elements(Object value) {
        List<Object> out = new ArrayList<>();
        if (value instanceof Iterable<?> iterable) {
            for (Object item : iterable) {
                out.add(item);
            }
            return out;
        }
        int n = Array.getLength(value);
        int i = 0;
        while (i < n) {
            out.add(Array.get(value, i));
            i = i + 1;
        }
        return out;
    }

    /** Map entries ordered lexicographically by the key's string form. */
    static List<Map.Entry<String, Object>> sortedEntries(Map<?, ?> map) {
        List<Map.Entry<String, Object>> out = new ArrayList<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            out.add(new AbstractMap.SimpleImmutableEntry<>(String.valueOf(e.getKey()), e.getValue()));
        }
        out.sort(Map.Entry.comparingByKey());
        return out;
    }

    static String friendlyTypeName(Class<?> type) {
        if (type.isArray()) {
            return friendlyTypeName(type.getComponentType()) + "[]";
        }
        String simple = type.getSimpleName();
        return simple.isEmpty() ? type.getName() : simple;
    }

    /**
     * Record components, public no-arg getters and public fields, ordered by name.
     * The first member found under a name wins.
     */
    static List<Member> readableMembers(Object target) {
        Class<?> type = target.getClass();
        Map<String, Member> byName = new LinkedHashMap<>();

        if (type.isRecord()) {
            for (RecordComponent rc : type.getRecordComponents()) {
                Method accessor = rc.getAccessor();
                accessor.trySetAccessible();
                byName.putIfAbsent(rc.getName(), new Member(rc.getName(), () -> accessor.invoke(target)));
            }
        } else {
            for (Method m : type.getMethods()) {
                String property = propertyName(m);
                if (property == null) continue;
                m.trySetAccessible();
                byName.putIfAbsent(property, new Member(property, () -> m.invoke(target)));
            }
        }

        for (Field f : type.getFields()) {
            if (Modifier.isStatic(f.getModifiers())) continue;
            f.trySetAccessible();
            byName.putIfAbsent(f.getName(), new Member(f.getName(), () -> f.get(target)));
        }

        List<Member> members = new ArrayList<>(byName.values());
        members.sort(Comparator.comparing(Member::name));
        return members;
    }

    static DocumentValue wrap(Object value) {
        if (value == null) return new DocumentValue.Null();
        if (value instanceof DocumentValue dv) return dv;
        return new DocumentValue.Opaque(value);
    }

    static String describe(Throwable t) {
        Throwable cause = t;
        if (t instanceof java.lang.reflect.InvocationTargetException ite && ite.getCause() != null) {
            cause = ite.getCause();
        }
        String msg = cause.getMessage();
        return "<error: " + (msg != null ? msg : cause.getClass().getSimpleName()) + ">";
    }

    private static String propertyName(Method m) {
        if (Modifier.isStatic(m.getModifiers()) || m.getParameterCount() != 0) return null;
        if (m.getDeclaringClass() == Object.class) return null;
        String name = m.getName();
        if (name.startsWith("get") && name.length() > 3 && m.getReturnType() != void.class) {
            return decapitalize(name.substring(3));
        }
        if (name.startsWith("is") && name.length() > 2
                && (m.getReturnType() == boolean.class || m.getReturnType() == Boolean.class)) {
            return decapitalize(name.substring(2));
        }
        return null;
    }

    private static String decapitalize(String s) {
        if (s.length() > 1 && Character.isUpperCase(s.charAt(1)) && Character.isUpperCase(s.charAt(0))) {
            return s;
        }
        return Character.toLowerCase(s.charAt(0)) + s.substring(1);
    }
}
