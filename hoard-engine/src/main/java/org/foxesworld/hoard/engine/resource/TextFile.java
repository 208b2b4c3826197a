package org.foxesworld.hoard.engine.resource;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hoard.core.io.TextParser;
import org.foxesworld.hoard.core.property.Property;
import org.foxesworld.hoard.core.property.PropertyCfg;
import org.foxesworld.hoard.core.reflect.TypeName;
import org.foxesworld.hoard.core.resource.Resource;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Whole text file held in memory.
 *
 * <p>Properties: {@code filename} (required, relative names resolve against the base
 * directory), {@code charset} (optional, UTF-8 by default).</p>
 */
@TypeName("TextFile")
public class TextFile implements Resource {

    private static final Logger log = LogManager.getLogger(TextFile.class);

    public static final String FILENAME = "filename";
    public static final String CHARSET = "charset";

    private final Path baseDir;

    private Path file;
    private final StringBuilder text = new StringBuilder();
    private boolean initialized;

    public TextFile() {
        this(null);
    }

    /** @param baseDir directory relative file names resolve against; null means the working directory */
    public TextFile(Path baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public synchronized boolean initialize(List<Property> properties) {
        if (initialized) {
            log.warn("TextFile already initialized: {}", file);
            return false;
        }

        String filename = PropertyCfg.str(properties, FILENAME, null);
        if (filename == null || filename.isBlank()) {
            log.warn("TextFile: missing '{}' property", FILENAME);
            return false;
        }

        final Charset cs;
        final Path path;
        try {
            cs = Charset.forName(PropertyCfg.str(properties, CHARSET, StandardCharsets.UTF_8.name()));
            path = resolve(filename);
        } catch (IllegalArgumentException e) { // also InvalidPathException
            log.warn("TextFile: bad properties {}: {}", properties, e.getMessage());
            return false;
        }

        try {
            String content = new TextParser(cs).parse(path);
            text.setLength(0);
            text.append(content);
        } catch (IOException e) {
            log.warn("TextFile: cannot read {}: {}", path, e.getMessage());
            return false;
        }

        this.file = path;
        this.initialized = true;
        log.debug("TextFile loaded: {} ({} chars)", path, text.length());
        return true;
    }

    public synchronized String getText() {
        return text.toString();
    }

    public synchronized void appendText(String more) {
        if (more != null) text.append(more);
    }

    /** @return resolved path, or null before a successful initialize */
    public synchronized Path getFileName() {
        return file;
    }

    private Path resolve(String filename) {
        Path p = Path.of(filename);
        if (p.isAbsolute() || baseDir == null) return p.normalize();
        return baseDir.resolve(p).normalize();
    }
}
