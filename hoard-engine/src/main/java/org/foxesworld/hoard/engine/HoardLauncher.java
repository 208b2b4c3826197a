package org.foxesworld.hoard.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hoard.core.HoardPlatform;
import org.foxesworld.hoard.core.HoardVersion;
import org.foxesworld.hoard.engine.document.DocumentException;
import org.foxesworld.hoard.engine.document.LoadReport;
import org.foxesworld.hoard.engine.util.ReadCsv;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Boot sequence: build the engine context, load the boot document, shut down.
 *
 * <p>System properties: {@code hoard.assets}, {@code hoard.document} (a first program
 * argument overrides it) and {@code hoard.preload} (CSV of resource class names).</p>
 */
public final class HoardLauncher {

    private static final Logger log = LogManager.getLogger(HoardLauncher.class);

    static final String ASSETS_PROP = "hoard.assets";
    static final String DOCUMENT_PROP = "hoard.document";
    static final String PRELOAD_PROP = "hoard.preload";

    private HoardLauncher() {}

    public static void main(String[] args) {
        log.info("{} {}", HoardVersion.NAME, HoardVersion.VERSION);
        log.info("Java: {} / {}", HoardPlatform.java(), HoardPlatform.vm());
        log.info("OS: {}", HoardPlatform.os());

        Path assets = Path.of(System.getProperty(ASSETS_PROP, HoardVersion.ASSETSDIR));
        Path document = (args.length > 0 && !args[0].isBlank())
                ? Path.of(args[0])
                : Path.of(System.getProperty(DOCUMENT_PROP, HoardVersion.BOOT_DOCUMENT));
        Set<String> preload = ReadCsv.readCsvProperty(PRELOAD_PROP, Set.of());

        int status = run(assets, document, preload);
        if (status != 0) System.exit(status);
    }

    static int run(Path assets, Path document, Set<String> preload) {
        try (EngineContext ctx = new EngineContext(assets, preload)) {
            if (!Files.isRegularFile(document)) {
                log.warn("Boot document not found: {}", document.toAbsolutePath());
            } else {
                LoadReport report = ctx.documents().load(document);
                log.info("Boot document {}: created={} failed={}", document, report.created(), report.failed());
            }
            log.info("Resources: {}", ctx.resources().names());
            return 0;
        } catch (DocumentException e) {
            log.error("Boot document rejected: {}", e.getMessage(), e);
            return 1;
        }
    }
}
