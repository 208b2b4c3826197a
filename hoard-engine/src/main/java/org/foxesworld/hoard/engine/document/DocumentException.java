package org.foxesworld.hoard.engine.document;

/**
 * A resource document that cannot be read as a whole (IO error, invalid JSON, wrong shape).
 * Problems with single entries are reported in {@link LoadReport} instead.
 */
public class DocumentException extends RuntimeException {

    private final String document;

    public DocumentException(String document, String message) {
        super(document + ": " + message);
        this.document = document;
    }

    public DocumentException(String document, String message, Throwable cause) {
        super(document + ": " + message, cause);
        this.document = document;
    }

    public String getDocument() {
        return document;
    }
}
