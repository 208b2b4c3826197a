package org.foxesworld.hoard.engine.resource;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hoard.core.property.Property;
import org.foxesworld.hoard.core.reflect.Reflection;
import org.foxesworld.hoard.core.reflect.TypeTag;
import org.foxesworld.hoard.core.resource.Resource;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Type-erased constructor for one resource type: build, initialize, hand back or drop.
 */
public final class ResourceFactory<T extends Resource> {

    private static final Logger log = LogManager.getLogger(ResourceFactory.class);

    private final Class<T> type;
    private final TypeTag tag;
    private final Supplier<? extends T> constructor;

    ResourceFactory(Class<T> type, Supplier<? extends T> constructor) {
        this.type = Objects.requireNonNull(type, "type");
        this.constructor = Objects.requireNonNull(constructor, "constructor");
        this.tag = Reflection.tag(type);
    }

    /**
     * Factory over the public no-arg constructor.
     *
     * @throws IllegalArgumentException if T is abstract or has no public no-arg constructor
     */
    static <T extends Resource> ResourceFactory<T> reflective(Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new IllegalArgumentException("Resource type is abstract: " + type.getName());
        }
        final Constructor<T> ctor;
        try {
            ctor = type.getConstructor();
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("Resource type has no public no-arg constructor: " + type.getName(), e);
        }
        return new ResourceFactory<>(type, () -> {
            try {
                return ctor.newInstance();
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw new IllegalStateException("Constructor of " + type.getName() + " failed", cause);
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Cannot instantiate " + type.getName(), e);
            }
        });
    }

    public Class<T> type() { return type; }
    public TypeTag tag() { return tag; }

    /**
     * Build a fresh instance and initialize it.
     *
     * @param name target name, for diagnostics only
     * @return the initialized instance, or null if construction or initialization failed
     */
    T construct(String name, List<Property> properties) {
        final T res;
        try {
            res = constructor.get();
        } catch (RuntimeException e) {
            log.error("Resource construction failed: name='{}' type={}", name, tag, e);
            return null;
        }
        if (res == null) {
            log.error("Resource constructor returned null: name='{}' type={}", name, tag);
            return null;
        }
        if (!type.isInstance(res)) {
            log.error("Resource constructor for {} produced {}", tag, res.getClass().getName());
            return null;
        }

        try {
            if (!res.initialize(properties)) {
                log.debug("Resource initialize returned false: name='{}' type={}", name, tag);
                return null;
            }
        } catch (RuntimeException e) {
            log.warn("Resource initialize threw: name='{}' type={}", name, tag, e);
            return null;
        }
        return res;
    }

    @Override
    public String toString() {
        return "ResourceFactory{" + tag + '}';
    }
}
