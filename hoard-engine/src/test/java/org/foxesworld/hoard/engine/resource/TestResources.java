package org.foxesworld.hoard.engine.resource;

import org.foxesworld.hoard.core.property.Property;
import org.foxesworld.hoard.core.property.PropertyCfg;
import org.foxesworld.hoard.core.reflect.TypeName;
import org.foxesworld.hoard.core.resource.Resource;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class TestResources {

    private TestResources() {}

    /** Succeeds unless {@code ok=false}; remembers its label. */
    @TypeName("test.Counter")
    public static final class Counter implements Resource {
        static final AtomicInteger constructed = new AtomicInteger();

        String label;

        public Counter() {
            constructed.incrementAndGet();
        }

        @Override
        public boolean initialize(List<Property> properties) {
            label = PropertyCfg.str(properties, "label", "");
            return PropertyCfg.bool(properties, "ok", true);
        }
    }

    @TypeName("test.Other")
    public static final class Other implements Resource {
        @Override
        public boolean initialize(List<Property> properties) {
            return true;
        }
    }

    /** Same declared name as {@link Counter}. */
    @TypeName("test.Counter")
    public static final class Impostor implements Resource {
        @Override
        public boolean initialize(List<Property> properties) {
            return true;
        }
    }

    @TypeName("test.Throwing")
    public static final class Throwing implements Resource {
        @Override
        public boolean initialize(List<Property> properties) {
            throw new IllegalStateException("boom");
        }
    }

    @TypeName("test.NoDefault")
    public static final class NoDefault implements Resource {
        final String tag;

        public NoDefault(String tag) {
            this.tag = tag;
        }

        @Override
        public boolean initialize(List<Property> properties) {
            return true;
        }
    }

    /** Blocks in initialize until released, to line up racing creators. */
    @TypeName("test.Gated")
    public static final class Gated implements Resource {
        static volatile CountDownLatch gate = new CountDownLatch(0);
        static final AtomicInteger initialized = new AtomicInteger();

        @Override
        public boolean initialize(List<Property> properties) {
            initialized.incrementAndGet();
            try {
                return gate.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }
}
