package org.foxesworld.hoard.engine.document;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hoard.core.io.TextParser;
import org.foxesworld.hoard.core.property.Property;
import org.foxesworld.hoard.core.reflect.Reflection;
import org.foxesworld.hoard.core.resource.Resource;
import org.foxesworld.hoard.engine.resource.ResourceSystem;
import org.foxesworld.hoard.script.ScriptEvaluationException;
import org.foxesworld.hoard.script.ScriptService;
import org.graalvm.polyglot.Value;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Feeds a JSON resource document into a {@link ResourceSystem}.
 *
 * <pre>
 * { "resources": [
 *     { "type": "TextFile", "name": "doc", "order": 0,
 *       "properties": { "filename": "test.txt" } } ] }
 * </pre>
 *
 * Entries are created in {@code order} (stable, default 0) through the runtime-typed path:
 * the type name is resolved to an id first. A bad entry is reported and skipped.
 */
public final class ResourceDocumentLoader {

    private static final Logger log = LogManager.getLogger(ResourceDocumentLoader.class);

    public static final String RESOURCES = "resources";
    public static final String TYPE = "type";
    public static final String NAME = "name";
    public static final String ORDER = "order";
    public static final String PROPERTIES = "properties";

    private final ResourceSystem resources;
    private final ScriptService scripts;

    public ResourceDocumentLoader(ResourceSystem resources, ScriptService scripts) {
        this.resources = Objects.requireNonNull(resources, "resources");
        this.scripts = Objects.requireNonNull(scripts, "scripts");
    }

    public LoadReport load(Path path) {
        Objects.requireNonNull(path, "path");
        final String json;
        try {
            json = new TextParser().parse(path);
        } catch (IOException e) {
            throw new DocumentException(path.toString(), "cannot read document", e);
        }
        return loadText(path.toString(), json);
    }

    public LoadReport loadText(String documentName, String json) {
        Objects.requireNonNull(json, "json");
        String doc = (documentName == null || documentName.isBlank()) ? "<document>" : documentName;
        LoadReport report = new LoadReport(doc);

        final List<EntryDef> defs;
        try {
            defs = scripts.parseJson(doc, json, root -> readEntries(doc, root, report));
        } catch (ScriptEvaluationException e) {
            throw new DocumentException(doc, "invalid JSON", e);
        }

        defs.sort(Comparator.comparingInt(d -> d.order));

        for (EntryDef d : defs) {
            int typeId = resources.typeIdFromName(d.type);
            if (!Reflection.isValid(typeId)) {
                log.warn("{}: '{}' has unknown type '{}'", doc, d.name, d.type);
                report.failed(d.index, d.name, "unknown type '" + d.type + "'");
                continue;
            }
            Resource r = resources.create(typeId, d.name, d.properties);
            if (r == null) {
                report.failed(d.index, d.name, "creation failed");
                continue;
            }
            report.created(d.name);
            log.debug("{}: created '{}' type={} order={}", doc, d.name, d.type, d.order);
        }

        if (report.isClean()) {
            log.info("{}: {} resource(s) loaded", doc, report.created().size());
        } else {
            log.warn("{}: {} resource(s) loaded, {} failed: {}", doc,
                    report.created().size(), report.failed().size(), report.failed());
        }
        return report;
    }

    private static List<EntryDef> readEntries(String doc, Value root, LoadReport report) {
        Value list = ValueProps.member(root, RESOURCES);
        if (list == null || !list.hasArrayElements()) {
            throw new DocumentException(doc, "'" + RESOURCES + "' missing or not an array");
        }

        List<EntryDef> defs = new ArrayList<>();
        long n = list.getArraySize();
        for (long i = 0; i < n; i++) {
            Value e = list.getArrayElement(i);
            String name = ValueProps.str(e, NAME, null);
            String type = ValueProps.str(e, TYPE, null);

            if (name == null || name.isBlank()) {
                report.failed((int) i, null, "missing name");
                continue;
            }
            if (type == null || type.isBlank()) {
                report.failed((int) i, name, "missing type");
                continue;
            }

            int order = ValueProps.i32(e, ORDER, 0);
            defs.add(new EntryDef((int) i, type, name, order, readProperties(doc, name, ValueProps.member(e, PROPERTIES))));
        }
        return defs;
    }

    private static List<Property> readProperties(String doc, String owner, Value props) {
        if (props == null) return List.of();
        if (!props.hasMembers() || props.hasArrayElements()) {
            log.warn("{}: '{}'.properties is not an object, ignored", doc, owner);
            return List.of();
        }

        List<Property> out = new ArrayList<>();
        for (String key : props.getMemberKeys()) {
            if (key.isBlank()) continue;
            Value v = props.getMember(key);
            Property p = ValueProps.toProperty(key, v);
            if (p == null) {
                log.warn("{}: '{}'.{} has unsupported value {}, skipped", doc, owner, key, ValueProps.describe(v));
                continue;
            }
            out.add(p);
        }
        return out;
    }

    private static final class EntryDef {
        final int index;
        final String type;
        final String name;
        final int order;
        final List<Property> properties;

        EntryDef(int index, String type, String name, int order, List<Property> properties) {
            this.index = index;
            this.type = type;
            this.name = name;
            this.order = order;
            this.properties = properties;
        }
    }
}
