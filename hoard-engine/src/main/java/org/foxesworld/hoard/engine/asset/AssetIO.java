package org.foxesworld.hoard.engine.asset;

import com.jme3.asset.AssetInfo;
import com.jme3.asset.AssetKey;
import com.jme3.asset.AssetManager;
import com.jme3.asset.AssetNotFoundException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Raw bytes/text from jME assets.
 *
 * Rules:
 *  - Never assume File (can be classpath/jar/remote/etc)
 *  - Always read through AssetInfo.openStream()
 */
public final class AssetIO {

    private AssetIO() {}

    /** @return the located asset, or null if no locator has it */
    public static AssetInfo open(AssetManager am, String name) {
        if (am == null) throw new IllegalArgumentException("AssetManager is null");
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Asset name is blank");
        return am.locateAsset(new AssetKey<>(name));
    }

    public static byte[] readBytes(AssetInfo info) {
        if (info == null) throw new IllegalArgumentException("AssetInfo is null");
        try (InputStream in = info.openStream()) {
            if (in == null) throw new AssetNotFoundException("Asset stream is null: " + info.getKey());
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bytes: " + describe(info), e);
        }
    }

    public static String readText(AssetInfo info, Charset cs) {
        return new String(readBytes(info), cs == null ? StandardCharsets.UTF_8 : cs);
    }

    public static String describe(AssetInfo info) {
        if (info == null) return "AssetInfo=null";
        String src = info.getClass().getSimpleName(); // FileAssetInfo / ClasspathAssetInfo / etc
        String key = (info.getKey() != null) ? info.getKey().getName() : "null";
        return "key='" + key + "' source=" + src;
    }
}
