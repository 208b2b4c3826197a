package org.foxesworld.hoard.core.property;

import java.util.List;

/**
 * Lookups over a property list. Missing keys and kind mismatches fall back to the default.
 * The first property with a given name wins.
 */
public final class PropertyCfg {
    private PropertyCfg() {}

    public static Property find(List<Property> props, String key) {
        if (props == null || key == null) return null;
        for (Property p : props) {
            if (p != null && key.equals(p.name())) return p;
        }
        return null;
    }

    public static boolean has(List<Property> props, String key) {
        return find(props, key) != null;
    }

    public static String str(List<Property> props, String key, String def) {
        Property p = find(props, key);
        if (p == null || !p.is(PropertyKind.STRING)) return def;
        return p.asString();
    }

    public static boolean bool(List<Property> props, String key, boolean def) {
        Property p = find(props, key);
        if (p == null || !p.is(PropertyKind.BOOLEAN)) return def;
        return p.asBoolean();
    }

    public static long i64(List<Property> props, String key, long def) {
        Property p = find(props, key);
        if (p == null || !p.is(PropertyKind.INTEGER)) return def;
        return p.asLong();
    }

    public static double f64(List<Property> props, String key, double def) {
        Property p = find(props, key);
        if (p == null) return def;
        if (p.is(PropertyKind.FLOAT) || p.is(PropertyKind.INTEGER)) return p.asDouble();
        return def;
    }
}
