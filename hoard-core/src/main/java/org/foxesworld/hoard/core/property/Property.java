package org.foxesworld.hoard.core.property;

import java.util.Objects;

/**
 * Named, typed creation-time value handed to {@code Resource.initialize}.
 * Immutable; the value is one of the {@link PropertyKind} primitives.
 */
public final class Property {

    private final String name;
    private final PropertyKind kind;
    private final Object value;

    private Property(String name, PropertyKind kind, Object value) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("property name is blank");
        this.name = name;
        this.kind = kind;
        this.value = value;
    }

    public static Property of(String name, boolean value) {
        return new Property(name, PropertyKind.BOOLEAN, value);
    }

    public static Property of(String name, long value) {
        return new Property(name, PropertyKind.INTEGER, value);
    }

    public static Property of(String name, double value) {
        return new Property(name, PropertyKind.FLOAT, value);
    }

    public static Property of(String name, String value) {
        if (value == null) throw new IllegalArgumentException("property '" + name + "' has null value");
        return new Property(name, PropertyKind.STRING, value);
    }

    public String name() { return name; }
    public PropertyKind kind() { return kind; }

    /** Raw boxed value (Boolean, Long, Double or String). */
    public Object value() { return value; }

    public boolean is(PropertyKind k) {
        return kind == k;
    }

    public boolean asBoolean() {
        expect(PropertyKind.BOOLEAN);
        return (Boolean) value;
    }

    public long asLong() {
        expect(PropertyKind.INTEGER);
        return (Long) value;
    }

    public int asInt() {
        return Math.toIntExact(asLong());
    }

    /** FLOAT as is, INTEGER widened. */
    public double asDouble() {
        if (kind == PropertyKind.INTEGER) return ((Long) value).doubleValue();
        expect(PropertyKind.FLOAT);
        return (Double) value;
    }

    public String asString() {
        expect(PropertyKind.STRING);
        return (String) value;
    }

    private void expect(PropertyKind k) {
        if (kind != k) {
            throw new IllegalStateException("Property '" + name + "' is " + kind + ", not " + k);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Property)) return false;
        Property that = (Property) o;
        return name.equals(that.name) && kind == that.kind && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, value);
    }

    @Override
    public String toString() {
        return kind == PropertyKind.STRING
                ? name + "='" + value + "'"
                : name + "=" + value;
    }
}
