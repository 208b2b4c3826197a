package org.foxesworld.hoard.core.property;

public enum PropertyKind {
    BOOLEAN,
    INTEGER,
    FLOAT,
    STRING
}
