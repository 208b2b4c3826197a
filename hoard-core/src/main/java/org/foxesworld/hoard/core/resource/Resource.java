package org.foxesworld.hoard.core.resource;

import org.foxesworld.hoard.core.property.Property;

import java.util.List;

/**
 * Anything the registry can create, name and hand out.
 *
 * <p>Implementations are constructed empty and initialized exactly once before use.
 * An instance whose {@link #initialize(List)} returned {@code false} is unusable and is
 * never published.</p>
 */
public interface Resource {

    /**
     * Initialize from creation-time properties.
     *
     * @param properties ordered properties, never null (may be empty)
     * @return true when the resource is ready for use
     */
    boolean initialize(List<Property> properties);
}
