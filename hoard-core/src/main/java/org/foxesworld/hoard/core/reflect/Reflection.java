package org.foxesworld.hoard.core.reflect;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide type tags.
 *
 * <p>Ids are handed out on first use from a counter, so they depend on the order in which
 * types are first touched. They are stable for the lifetime of the process and never
 * reused, but must not be hard-coded: resolve them through {@link #typeId(Class)} or by
 * name through the registry.</p>
 *
 * <p>Names are derived from the type alone ({@link TypeName} or the binary class name),
 * so they do not depend on call order.</p>
 */
public final class Reflection {

    /** "No type". Never issued. */
    public static final int INVALID_TYPE_ID = 0;

    private static final AtomicInteger nextId = new AtomicInteger(INVALID_TYPE_ID + 1);

    // computeIfAbsent runs the mapping once per key, concurrent first use included
    private static final Map<Class<?>, TypeTag> tags = new ConcurrentHashMap<>();

    private Reflection() {}

    public static TypeTag tag(Class<?> type) {
        Objects.requireNonNull(type, "type");
        TypeTag t = tags.get(type);
        if (t != null) return t;
        return tags.computeIfAbsent(type, k -> new TypeTag(nextId.getAndIncrement(), nameOf(k)));
    }

    public static int typeId(Class<?> type) {
        return tag(type).id();
    }

    public static String typeName(Class<?> type) {
        Objects.requireNonNull(type, "type");
        TypeTag t = tags.get(type);
        return t != null ? t.name() : nameOf(type);
    }

    public static boolean isValid(int typeId) {
        return typeId > INVALID_TYPE_ID;
    }

    private static String nameOf(Class<?> type) {
        TypeName declared = type.getAnnotation(TypeName.class);
        if (declared != null && !declared.value().isBlank()) {
            return declared.value().trim();
        }
        return type.getName();
    }
}
