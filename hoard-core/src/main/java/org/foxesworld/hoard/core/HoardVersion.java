package org.foxesworld.hoard.core;

public final class HoardVersion {
    public static final String NAME = "Hoard";
    public static final String VERSION = "0.1.0";

    /** Default assets root, relative to the working directory. */
    public static final String ASSETSDIR = "assets";

    /** Default boot document, loaded by the launcher. */
    public static final String BOOT_DOCUMENT = ASSETSDIR + "/tests/sample.json";

    private HoardVersion() {}
}
