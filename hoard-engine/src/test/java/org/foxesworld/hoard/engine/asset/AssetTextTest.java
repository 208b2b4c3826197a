package org.foxesworld.hoard.engine.asset;

import com.jme3.asset.AssetInfo;
import com.jme3.asset.AssetManager;
import com.jme3.asset.DesktopAssetManager;
import com.jme3.asset.plugins.FileLocator;
import org.foxesworld.hoard.core.property.Property;
import org.foxesworld.hoard.core.reflect.Reflection;
import org.foxesworld.hoard.engine.resource.ResourceSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssetTextTest {

    @TempDir
    Path dir;

    private AssetManager assets;

    @BeforeEach
    void setUp() throws IOException {
        Path root = dir.toRealPath();
        Files.createDirectories(root.resolve("Text"));
        Files.writeString(root.resolve("Text/intro.txt"), "Once upon a time");

        assets = new DesktopAssetManager(false);
        assets.registerLocator(root.toString(), FileLocator.class);
    }

    @Test
    void shouldReadThroughAssetManager() {
        AssetText text = new AssetText(assets);

        assertThat(text.initialize(List.of(Property.of(AssetText.ASSET, "Text/intro.txt")))).isTrue();
        assertThat(text.getText()).isEqualTo("Once upon a time");
        assertThat(text.getAssetName()).isEqualTo("Text/intro.txt");
    }

    @Test
    void shouldFailForMissingAssetOrProperty() {
        assertThat(new AssetText(assets).initialize(List.of(Property.of(AssetText.ASSET, "Text/missing.txt")))).isFalse();
        assertThat(new AssetText(assets).initialize(List.of())).isFalse();
    }

    @Test
    void shouldBeCreatableThroughRegisteredSupplier() {
        try (ResourceSystem resources = new ResourceSystem()) {
            resources.register(AssetText.class, () -> new AssetText(assets));

            int id = resources.typeIdFromName("AssetText");
            assertThat(id).isEqualTo(Reflection.typeId(AssetText.class));
            assertThat(resources.create(id, "intro", List.of(Property.of(AssetText.ASSET, "Text/intro.txt"))))
                    .isInstanceOf(AssetText.class);
            assertThat(resources.get(AssetText.class, "intro").getText()).startsWith("Once");
        }
    }

    @Test
    void assetIoReportsMissingAssets() {
        AssetInfo info = AssetIO.open(assets, "Text/intro.txt");
        assertThat(info).isNotNull();
        assertThat(AssetIO.readText(info, null)).isEqualTo("Once upon a time");
        assertThat(AssetIO.open(assets, "Text/none.txt")).isNull();
        assertThatThrownBy(() -> AssetIO.open(assets, " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AssetIO.readBytes(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldInitializeOnlyOnceUnderContention() throws Exception {
        AssetText text = new AssetText(assets);
        List<Property> props = List.of(Property.of(AssetText.ASSET, "Text/intro.txt"));
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return text.initialize(props);
                }));
            }
            start.countDown();

            int succeeded = 0;
            for (Future<Boolean> r : results) {
                if (r.get(10, TimeUnit.SECONDS)) succeeded++;
            }
            assertThat(succeeded).isEqualTo(1);
            assertThat(text.getText()).isEqualTo("Once upon a time");
        } finally {
            pool.shutdownNow();
        }
    }
}
