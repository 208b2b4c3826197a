package org.foxesworld.hoard.engine.resource;

import org.foxesworld.hoard.core.reflect.Reflection;
import org.foxesworld.hoard.core.resource.Resource;
import org.foxesworld.hoard.engine.resource.TestResources.Counter;
import org.foxesworld.hoard.engine.resource.TestResources.Gated;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceSystemConcurrencyTest {

    private static final int THREADS = 8;

    private final ResourceSystem resources = new ResourceSystem();
    private final ExecutorService pool = Executors.newFixedThreadPool(THREADS);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
        resources.close();
        Gated.gate = new CountDownLatch(0);
    }

    @Test
    void racingCreatorsShareOneInstance() throws Exception {
        resources.register(Gated.class);
        CountDownLatch gate = new CountDownLatch(1);
        Gated.gate = gate;
        int base = Gated.initialized.get();

        List<Future<Resource>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            boolean runtimePath = (i % 2) == 0;
            futures.add(pool.submit(() -> runtimePath
                    ? resources.create(Reflection.typeId(Gated.class), "shared", List.of())
                    : resources.create(Gated.class, "shared", List.of())));
        }

        // every caller is past the existence check and blocked in initialize
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (Gated.initialized.get() < base + THREADS && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertThat(Gated.initialized.get() - base).isEqualTo(THREADS);
        gate.countDown();

        Set<Resource> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Future<Resource> f : futures) {
            Resource r = f.get(10, TimeUnit.SECONDS);
            assertThat(r).isNotNull();
            distinct.add(r);
        }

        assertThat(distinct).hasSize(1);
        assertThat(resources.get("shared")).isSameAs(distinct.iterator().next());
        assertThat(resources.size()).isEqualTo(1);
    }

    @Test
    void concurrentDistinctNamesAllPublish() throws Exception {
        resources.register(Counter.class);
        int perThread = 50;
        CountDownLatch start = new CountDownLatch(1);

        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
            int thread = t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    String name = "r-" + thread + "-" + i;
                    assertThat(resources.create(Counter.class, name, List.of())).isNotNull();
                    assertThat(resources.exists(name)).isTrue();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);

        assertThat(resources.size()).isEqualTo(THREADS * perThread);
    }

    @Test
    void createAndRemoveInterleaveWithoutLeaks() throws Exception {
        resources.register(Counter.class);
        CountDownLatch start = new CountDownLatch(1);

        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    resources.create(Counter.class, "churn", List.of());
                    resources.remove("churn");
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);

        resources.remove("churn");
        assertThat(resources.exists("churn")).isFalse();
        assertThat(resources.size()).isZero();
    }
}
