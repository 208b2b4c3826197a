package org.foxesworld.hoard.core.reflect;

/**
 * Runtime identity of a type: process-local id plus its declared name.
 */
public record TypeTag(int id, String name) {

    public TypeTag {
        if (id <= Reflection.INVALID_TYPE_ID) throw new IllegalArgumentException("id must be > 0");
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name is blank");
    }

    @Override
    public String toString() {
        return name + "#" + id;
    }
}
