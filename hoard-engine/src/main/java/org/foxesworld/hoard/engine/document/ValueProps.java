package org.foxesworld.hoard.engine.document;

import org.foxesworld.hoard.core.property.Property;
import org.graalvm.polyglot.Value;

/**
 * Reads guest values (parsed documents) into host values and properties.
 * Only valid while the owning context is open.
 */
final class ValueProps {
    private ValueProps() {}

    static Value member(Value obj, String key) {
        if (obj == null || obj.isNull() || !obj.hasMembers() || !obj.hasMember(key)) return null;
        Value v = obj.getMember(key);
        return (v == null || v.isNull()) ? null : v;
    }

    static String str(Value obj, String key, String def) {
        Value v = member(obj, key);
        if (v == null || !v.isString()) return def;
        return v.asString();
    }

    static int i32(Value obj, String key, int def) {
        Value v = member(obj, key);
        if (v == null || !v.isNumber() || !v.fitsInInt()) return def;
        return v.asInt();
    }

    /**
     * boolean → BOOLEAN, integral number → INTEGER, other number → FLOAT, string → STRING.
     *
     * @return the property, or null for null/object/array values
     */
    static Property toProperty(String key, Value v) {
        if (v == null || v.isNull()) return null;
        if (v.isBoolean()) return Property.of(key, v.asBoolean());
        if (v.isNumber()) {
            if (v.fitsInLong()) return Property.of(key, v.asLong());
            return Property.of(key, v.asDouble());
        }
        if (v.isString()) return Property.of(key, v.asString());
        return null;
    }

    static String describe(Value v) {
        if (v == null || v.isNull()) return "null";
        if (v.hasArrayElements()) return "array";
        if (v.hasMembers()) return "object";
        return v.toString();
    }
}
