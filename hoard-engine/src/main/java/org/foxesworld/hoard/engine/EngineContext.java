package org.foxesworld.hoard.engine;

import com.jme3.asset.AssetManager;
import com.jme3.asset.DesktopAssetManager;
import com.jme3.asset.plugins.ClasspathLocator;
import com.jme3.asset.plugins.FileLocator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hoard.core.resource.Resource;
import org.foxesworld.hoard.engine.asset.AssetText;
import org.foxesworld.hoard.engine.document.ResourceDocumentLoader;
import org.foxesworld.hoard.engine.resource.ResourceSystem;
import org.foxesworld.hoard.engine.resource.TextFile;
import org.foxesworld.hoard.script.GraalScriptService;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * Owns the engine-wide services for one run: assets, the resource registry and the
 * document loader. Built once at start-up, handed to subsystems, closed at shutdown.
 */
public final class EngineContext implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(EngineContext.class);

    private final Path assetsDir;
    private final AssetManager assetManager;
    private final ResourceSystem resources;
    private final ResourceDocumentLoader documents;

    public EngineContext(Path assetsDir) {
        this(assetsDir, Set.of());
    }

    /**
     * @param assetsDir root for file assets and relative {@code TextFile} names
     * @param preload binary names of extra {@link Resource} classes to register
     */
    public EngineContext(Path assetsDir, Set<String> preload) {
        this.assetsDir = Objects.requireNonNull(assetsDir, "assetsDir").toAbsolutePath().normalize();

        this.assetManager = new DesktopAssetManager(false);
        if (Files.isDirectory(this.assetsDir)) {
            // FileLocator rejects assets whose canonical path differs from the requested one
            assetManager.registerLocator(realPath(this.assetsDir).toString(), FileLocator.class);
        } else {
            log.warn("Assets dir not found: {} (file assets disabled)", this.assetsDir);
        }
        assetManager.registerLocator("/", ClasspathLocator.class);

        this.resources = new ResourceSystem();
        registerBuiltins();
        if (preload != null) {
            for (String className : preload) preload(className);
        }

        this.documents = new ResourceDocumentLoader(resources, new GraalScriptService());
        log.info("EngineContext ready: assets={} types={}", this.assetsDir, resources.registeredTypes());
    }

    private void registerBuiltins() {
        resources.register(TextFile.class, () -> new TextFile(assetsDir));
        resources.register(AssetText.class, () -> new AssetText(assetManager));
    }

    private void preload(String className) {
        try {
            Class<?> raw = Class.forName(className, true, EngineContext.class.getClassLoader());
            if (!Resource.class.isAssignableFrom(raw)) {
                log.error("Preload skipped, not a Resource: {}", className);
                return;
            }
            resources.register(raw.asSubclass(Resource.class));
        } catch (ClassNotFoundException e) {
            log.error("Preload skipped, class not found: {}", className);
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Preload skipped, {}: {}", className, e.getMessage());
        }
    }

    private static Path realPath(Path dir) {
        try {
            return dir.toRealPath();
        } catch (IOException e) {
            log.warn("Cannot resolve real path of {}: {}", dir, e.getMessage());
            return dir;
        }
    }

    public Path assetsDir() { return assetsDir; }
    public AssetManager assetManager() { return assetManager; }
    public ResourceSystem resources() { return resources; }
    public ResourceDocumentLoader documents() { return documents; }

    @Override
    public void close() {
        resources.close();
        assetManager.clearCache();
        log.info("EngineContext closed");
    }
}
