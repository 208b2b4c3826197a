package org.foxesworld.hoard.core.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Abstract base for turning raw bytes into objects of type T.
 * <p>
 * - All external inputs are checked for null.
 * - Inputs above {@link #maxBytes()} are rejected before decoding.
 * - Failures are logged and rethrown; streams are always closed.
 */
public abstract class ByteParser<T> {
    private static final Logger logger = LoggerFactory.getLogger(ByteParser.class);

    public static final int DEFAULT_MAX_BYTES = 64 * 1024 * 1024;

    /**
     * Decode the given bytes.
     * @param data never null
     * @throws IOException on decode error
     */
    protected abstract T parseBytes(byte[] data) throws IOException;

    /** Upper bound on accepted input size. */
    protected int maxBytes() {
        return DEFAULT_MAX_BYTES;
    }

    public T parse(byte[] data) throws IOException {
        Objects.requireNonNull(data, "Data byte array cannot be null");
        checkSize(data.length, "byte array");
        try {
            return parseBytes(data);
        } catch (IOException | RuntimeException ex) {
            logger.error("Failed to parse from byte array ({} bytes): {}", data.length, ex.getMessage(), ex);
            throw ex;
        }
    }

    /**
     * Parse from InputStream. Stream will be closed automatically.
     * At most {@link #maxBytes()} + 1 bytes are buffered before the size check.
     */
    public T parse(InputStream input) throws IOException {
        Objects.requireNonNull(input, "InputStream cannot be null");
        try (InputStream in = input) {
            byte[] data = in.readNBytes((int) Math.min((long) maxBytes() + 1, Integer.MAX_VALUE));
            checkSize(data.length, "stream");
            return parse(data);
        }
    }

    /**
     * Parse from Path. Path must be an existing, readable regular file.
     */
    public T parse(Path path) throws IOException {
        Objects.requireNonNull(path, "Path cannot be null");
        if (!Files.isRegularFile(path)) {
            logger.debug("Path does not exist or is not a file: {}", path);
            throw new FileNotFoundException("Path does not exist: " + path);
        }
        if (!Files.isReadable(path)) {
            logger.debug("Path is not readable: {}", path);
            throw new IOException("Path is not readable: " + path);
        }
        long size = Files.size(path);
        checkSize(size, path.toString());
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in);
        }
    }

    private void checkSize(long size, String what) throws IOException {
        if (size > maxBytes()) {
            throw new IOException("Input too large (" + size + " > " + maxBytes() + " bytes): " + what);
        }
    }
}
