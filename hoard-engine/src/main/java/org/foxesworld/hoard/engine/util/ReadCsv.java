package org.foxesworld.hoard.engine.util;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public final class ReadCsv {

    private ReadCsv() {}

    /** Comma separated system property as an ordered set; blank or missing yields {@code defaults}. */
    public static Set<String> readCsvProperty(String key, Set<String> defaults) {
        return parse(System.getProperty(key), defaults);
    }

    public static Set<String> parse(String raw, Set<String> defaults) {
        if (raw == null || raw.isBlank()) return defaults;

        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String s : raw.split(",")) {
            String v = s.trim();
            if (!v.isEmpty()) out.add(v);
        }
        return out.isEmpty() ? defaults : Collections.unmodifiableSet(out);
    }
}
