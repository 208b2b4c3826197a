package org.foxesworld.hoard.engine.asset;

import com.jme3.asset.AssetInfo;
import com.jme3.asset.AssetManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hoard.core.property.Property;
import org.foxesworld.hoard.core.property.PropertyCfg;
import org.foxesworld.hoard.core.reflect.TypeName;
import org.foxesworld.hoard.core.resource.Resource;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Text located through the jME asset pipeline, so it may live in a jar, on the classpath
 * or under any registered locator.
 *
 * <p>Properties: {@code asset} (required asset key), {@code charset} (optional).</p>
 */
@TypeName("AssetText")
public final class AssetText implements Resource {

    private static final Logger log = LogManager.getLogger(AssetText.class);

    public static final String ASSET = "asset";
    public static final String CHARSET = "charset";

    private final AssetManager assets;

    private volatile String assetName;
    private volatile String text;

    public AssetText(AssetManager assets) {
        this.assets = Objects.requireNonNull(assets, "assets");
    }

    @Override
    public synchronized boolean initialize(List<Property> properties) {
        if (text != null) {
            log.warn("AssetText already initialized: {}", assetName);
            return false;
        }

        String name = PropertyCfg.str(properties, ASSET, null);
        if (name == null || name.isBlank()) {
            log.warn("AssetText: missing '{}' property", ASSET);
            return false;
        }

        try {
            Charset cs = Charset.forName(PropertyCfg.str(properties, CHARSET, StandardCharsets.UTF_8.name()));
            AssetInfo info = AssetIO.open(assets, name);
            if (info == null) {
                log.warn("AssetText: asset not found: {}", name);
                return false;
            }
            this.text = AssetIO.readText(info, cs);
            this.assetName = name;
            log.debug("AssetText loaded: {}", AssetIO.describe(info));
            return true;
        } catch (RuntimeException e) {
            log.warn("AssetText: cannot load '{}': {}", name, e.getMessage());
            return false;
        }
    }

    public String getText() {
        return text;
    }

    public String getAssetName() {
        return assetName;
    }
}
