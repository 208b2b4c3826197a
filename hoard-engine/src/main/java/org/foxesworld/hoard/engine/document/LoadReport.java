package org.foxesworld.hoard.engine.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Outcome of loading one document: names created (or already present) and one
 * {@link Failure} per entry that failed, ordered by entry index.
 */
public final class LoadReport {

    /**
     * @param index position of the entry in the document's {@code resources} array
     * @param name entry name, or null when the entry has none
     */
    public record Failure(int index, String name, String reason) {
        @Override
        public String toString() {
            return "#" + index + (name != null ? " '" + name + "'" : "") + ": " + reason;
        }
    }

    private final String document;
    private final List<String> created = new ArrayList<>();
    private final List<Failure> failed = new ArrayList<>();

    LoadReport(String document) {
        this.document = document;
    }

    void created(String name) {
        created.add(name);
    }

    void failed(int index, String name, String reason) {
        failed.add(new Failure(index, name, reason));
    }

    public String document() { return document; }

    public List<String> created() { return Collections.unmodifiableList(created); }

    public List<Failure> failed() {
        List<Failure> out = new ArrayList<>(failed);
        out.sort(Comparator.comparingInt(Failure::index));
        return Collections.unmodifiableList(out);
    }

    public boolean isClean() { return failed.isEmpty(); }

    @Override
    public String toString() {
        return "LoadReport{" + document + ", created=" + created.size() + ", failed=" + failed.size() + '}';
    }
}
