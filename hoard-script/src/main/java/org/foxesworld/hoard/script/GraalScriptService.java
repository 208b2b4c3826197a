package org.foxesworld.hoard.script;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * One short-lived, sandboxed context per evaluation. No host class lookup, no IO.
 */
public final class GraalScriptService implements ScriptService {

    private static final Logger log = LogManager.getLogger(GraalScriptService.class);

    private static final String JSON_TEXT_BINDING = "__hoardJsonText";

    @Override
    public <R> R eval(String languageId, String sourceName, String code,
                      Map<String, Object> bindings, Function<Value, R> reader) {
        Objects.requireNonNull(languageId, "languageId");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(reader, "reader");
        String name = (sourceName == null || sourceName.isBlank()) ? "<" + languageId + ">" : sourceName;

        try (Context ctx = newContext(languageId)) {
            if (bindings != null) {
                Value b = ctx.getBindings(languageId);
                for (var e : bindings.entrySet()) {
                    b.putMember(e.getKey(), e.getValue());
                }
            }

            Source src = Source.newBuilder(languageId, code, name).buildLiteral();
            Value result = ctx.eval(src);
            return reader.apply(result);
        } catch (PolyglotException e) {
            log.debug("Evaluation failed: source={} guest={} syntax={}", name, e.isGuestException(), e.isSyntaxError());
            throw new ScriptEvaluationException(name, e.getMessage(), e);
        }
    }

    @Override
    public <R> R parseJson(String sourceName, String json, Function<Value, R> reader) {
        Objects.requireNonNull(json, "json");
        return eval(JS, sourceName, "JSON.parse(" + JSON_TEXT_BINDING + ")",
                Map.of(JSON_TEXT_BINDING, json), reader);
    }

    private static Context newContext(String languageId) {
        return Context.newBuilder(languageId)
                .allowAllAccess(false)
                .allowHostAccess(HostAccess.NONE)
                .allowHostClassLookup(className -> false)
                .option("engine.WarnInterpreterOnly", "false")
                .build();
    }
}
