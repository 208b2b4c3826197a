package org.foxesworld.hoard.engine.resource;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hoard.core.property.Property;
import org.foxesworld.hoard.core.reflect.Reflection;
import org.foxesworld.hoard.core.reflect.TypeTag;
import org.foxesworld.hoard.core.resource.Resource;

import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Named-instance store plus the factory table that feeds it.
 *
 * <p>One instance is built by the boot sequence and passed to whoever needs it; it is
 * closed at shutdown. Every published resource is held strongly until it is removed,
 * replaced or the system is closed.</p>
 *
 * <p>Failures (unknown type, failed initialization, type mismatch) come back as
 * {@code null} and are logged. Creating an existing name returns the existing instance,
 * whatever properties are passed. Removing an absent name does nothing.</p>
 *
 * <p>Thread-safe. Both maps sit behind one read/write lock. Construction and
 * {@link Resource#initialize(List)} run outside the lock; publishing re-checks the name,
 * and a caller that loses the race gets the winner's instance.</p>
 */
public final class ResourceSystem implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(ResourceSystem.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<Integer, ResourceFactory<?>> factories = new HashMap<>();
    private final Map<String, Integer> idsByName = new HashMap<>();
    private final Map<String, Resource> instances = new HashMap<>();

    private boolean closed;

    // ---------------- factory table ----------------

    /**
     * Register T through its public no-arg constructor. Registering twice is a no-op.
     *
     * @throws IllegalArgumentException if T cannot be constructed that way
     * @throws IllegalStateException if another type already uses T's name
     */
    public <T extends Resource> void register(Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (isRegistered(Reflection.typeId(type))) {
            log.debug("Resource type already registered: {}", Reflection.tag(type));
            return;
        }
        install(ResourceFactory.reflective(type));
    }

    /**
     * Register T with an explicit constructor, for types that need collaborators.
     * Registering the same T again is a no-op and keeps the first constructor.
     */
    public <T extends Resource> void register(Class<T> type, Supplier<? extends T> constructor) {
        install(new ResourceFactory<>(type, constructor));
    }

    private void install(ResourceFactory<?> factory) {
        TypeTag tag = factory.tag();
        lock.writeLock().lock();
        try {
            ensureOpen();
            if (factories.containsKey(tag.id())) {
                log.debug("Resource type already registered: {}", tag);
                return;
            }
            Integer clash = idsByName.get(tag.name());
            if (clash != null) {
                throw new IllegalStateException("Duplicate resource type name '" + tag.name() + "': "
                        + factories.get(clash).type().getName() + " and " + factory.type().getName());
            }
            factories.put(tag.id(), factory);
            idsByName.put(tag.name(), tag.id());
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Resource type registered: {}", tag);
    }

    /**
     * @return id of the registered type with that name, or {@link Reflection#INVALID_TYPE_ID}
     */
    public int typeIdFromName(String typeName) {
        if (typeName == null) return Reflection.INVALID_TYPE_ID;
        lock.readLock().lock();
        try {
            Integer id = idsByName.get(typeName);
            return id != null ? id : Reflection.INVALID_TYPE_ID;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isRegistered(int typeId) {
        lock.readLock().lock();
        try {
            return factories.containsKey(typeId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Snapshot of registered tags, ordered by id. */
    public List<TypeTag> registeredTypes() {
        lock.readLock().lock();
        try {
            List<TypeTag> out = new ArrayList<>(factories.size());
            for (ResourceFactory<?> f : factories.values()) out.add(f.tag());
            out.sort(Comparator.comparingInt(TypeTag::id));
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---------------- create ----------------

    /**
     * Create (or fetch) {@code name} as a T.
     *
     * <p>Uses T's registered factory when there is one, else its public no-arg constructor.</p>
     *
     * @return the published instance; null if initialization failed or an existing entry
     *         under {@code name} is not a T
     */
    public <T extends Resource> T create(Class<T> type, String name, List<Property> properties) {
        Objects.requireNonNull(type, "type");
        checkName(name);

        Resource existing = get(name);
        if (existing != null) {
            return cast(type, name, existing);
        }

        ResourceFactory<T> factory = factoryFor(type);
        T fresh = factory.construct(name, propsOrEmpty(properties));
        if (fresh == null) {
            log.warn("Resource '{}' ({}) was not created", name, factory.tag());
            return null;
        }
        return cast(type, name, publish(name, fresh));
    }

    /**
     * Create (or fetch) {@code name} through the factory registered under {@code typeId}.
     * An unknown id fails before anything is allocated.
     *
     * @return the published instance, or null
     */
    public Resource create(int typeId, String name, List<Property> properties) {
        checkName(name);

        final ResourceFactory<?> factory;
        final Resource existing;
        lock.readLock().lock();
        try {
            factory = factories.get(typeId);
            existing = instances.get(name);
        } finally {
            lock.readLock().unlock();
        }

        if (factory == null) {
            log.warn("Resource '{}' not created: unknown type id {}", name, typeId);
            return null;
        }
        if (existing != null) {
            log.debug("Resource '{}' already exists, returning it", name);
            return existing;
        }

        Resource fresh = factory.construct(name, propsOrEmpty(properties));
        if (fresh == null) {
            log.warn("Resource '{}' ({}) was not created", name, factory.tag());
            return null;
        }
        return publish(name, fresh);
    }

    /** Runtime path by declared type name. */
    public Resource create(String typeName, String name, List<Property> properties) {
        return create(typeIdFromName(typeName), name, properties);
    }

    private Resource publish(String name, Resource fresh) {
        lock.writeLock().lock();
        try {
            ensureOpen();
            Resource winner = instances.putIfAbsent(name, fresh);
            if (winner != null) {
                log.debug("Resource '{}' was published concurrently, dropping duplicate", name);
                return winner;
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Resource published: '{}' ({})", name, fresh.getClass().getSimpleName());
        return fresh;
    }

    @SuppressWarnings("unchecked")
    private <T extends Resource> ResourceFactory<T> factoryFor(Class<T> type) {
        lock.readLock().lock();
        try {
            ResourceFactory<?> f = factories.get(Reflection.typeId(type));
            if (f != null) return (ResourceFactory<T>) f;
        } finally {
            lock.readLock().unlock();
        }
        return ResourceFactory.reflective(type);
    }

    // ---------------- add / get / exists / remove ----------------

    /**
     * Publish an already initialized resource. The registry shares it with the caller.
     * An existing entry under {@code name} is replaced and released.
     *
     * @return the replaced resource, or null
     */
    public Resource add(String name, Resource resource) {
        checkName(name);
        Objects.requireNonNull(resource, "resource");

        final Resource previous;
        lock.writeLock().lock();
        try {
            ensureOpen();
            previous = instances.put(name, resource);
        } finally {
            lock.writeLock().unlock();
        }

        if (previous != null && previous != resource) {
            log.info("Resource '{}' replaced ({} -> {})", name,
                    previous.getClass().getSimpleName(), resource.getClass().getSimpleName());
        } else {
            log.debug("Resource added: '{}' ({})", name, resource.getClass().getSimpleName());
        }
        return previous == resource ? null : previous;
    }

    /** @return the instance as T, or null if absent or not a T */
    public <T extends Resource> T get(Class<T> type, String name) {
        Objects.requireNonNull(type, "type");
        Resource r = get(name);
        return r == null ? null : cast(type, name, r);
    }

    public Resource get(String name) {
        if (name == null) return null;
        lock.readLock().lock();
        try {
            return instances.get(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean exists(String name) {
        if (name == null) return false;
        lock.readLock().lock();
        try {
            return instances.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drop the registry's reference. Absent names are ignored.
     *
     * @return true if something was removed
     */
    public boolean remove(String name) {
        if (name == null) return false;
        final Resource removed;
        lock.writeLock().lock();
        try {
            removed = instances.remove(name);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) log.debug("Resource removed: '{}'", name);
        return removed != null;
    }

    /** Sorted snapshot of published names. */
    public List<String> names() {
        lock.readLock().lock();
        try {
            List<String> out = new ArrayList<>(instances.keySet());
            Collections.sort(out);
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return instances.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Release every instance and factory. Further registrations and publications throw
     * {@link IllegalStateException}; reads see an empty registry.
     */
    @Override
    public void close() {
        final int released;
        lock.writeLock().lock();
        try {
            if (closed) return;
            closed = true;
            released = instances.size();
            instances.clear();
            factories.clear();
            idsByName.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("ResourceSystem closed, released {} resource(s)", released);
    }

    // ---------------- internals ----------------

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("ResourceSystem is closed");
    }

    private static void checkName(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("resource name is blank");
    }

    private static List<Property> propsOrEmpty(List<Property> properties) {
        return properties == null ? List.of() : List.copyOf(properties);
    }

    private static <T extends Resource> T cast(Class<T> type, String name, Resource r) {
        if (type.isInstance(r)) return type.cast(r);
        log.warn("Resource '{}' is {}, not {}", name, r.getClass().getName(), type.getName());
        return null;
    }
}
