package org.foxesworld.hoard.core;

public final class HoardPlatform {
    public static String java() {
        return System.getProperty("java.version");
    }

    public static String os() {
        return System.getProperty("os.name") + " " + System.getProperty("os.version");
    }

    public static String vm() {
        return System.getProperty("java.vm.name") + " (" + System.getProperty("java.vm.vendor") + ")";
    }

    private HoardPlatform() {}
}
