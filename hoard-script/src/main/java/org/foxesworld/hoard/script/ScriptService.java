package org.foxesworld.hoard.script;

import org.graalvm.polyglot.Value;

import java.util.Map;
import java.util.function.Function;

/**
 * Evaluates source text in a polyglot language.
 *
 * <p>Guest values are only valid while their context is open, so results are handed to a
 * {@code reader} that maps them to host objects before the context closes.</p>
 */
public interface ScriptService {

    String JS = "js";

    <R> R eval(String languageId, String sourceName, String code,
               Map<String, Object> bindings, Function<Value, R> reader);

    default <R> R eval(String languageId, String sourceName, String code, Function<Value, R> reader) {
        return eval(languageId, sourceName, code, Map.of(), reader);
    }

    /** Parse JSON text with the JS engine's {@code JSON.parse}. */
    <R> R parseJson(String sourceName, String json, Function<Value, R> reader);
}
