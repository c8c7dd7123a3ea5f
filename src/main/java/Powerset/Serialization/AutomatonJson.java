package Powerset.Serialization;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

import Powerset.Model.AutomatonDef;
import Powerset.Model.TransitionDef;
import Powerset.TransformationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * Reads and writes automaton definitions and pipeline responses as JSON.
 * <p>
 * A response is {@code {"nfa": .., "dfa": ..}} on success and {@code {"error": ".."}} on failure.
 */
public final class AutomatonJson {
    private static final ObjectMapper MAPPER = createMapper();

    private AutomatonJson() {
    }

    static ObjectMapper createMapper() {
        final SimpleModule module = new SimpleModule("powerset");
        module.addSerializer(TransitionDef.class, new TransitionDefCodec.Serializer());
        module.addDeserializer(TransitionDef.class, new TransitionDefCodec.Deserializer());
        return new ObjectMapper()
            .registerModule(module)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static AutomatonDef readDef(InputStream is) throws IOException {
        return MAPPER.readValue(is, AutomatonDef.class);
    }

    public static AutomatonDef readDef(File file) throws IOException {
        return MAPPER.readValue(file, AutomatonDef.class);
    }

    public static AutomatonDef readDef(String json) throws IOException {
        return MAPPER.readValue(json, AutomatonDef.class);
    }

    public static String writeDef(AutomatonDef def) throws IOException {
        return MAPPER.writeValueAsString(def);
    }

    public static String writeResult(TransformationResult result) throws IOException {
        return MAPPER.writeValueAsString(resultBody(result));
    }

    public static String writeError(String cause) {
        try {
            return MAPPER.writeValueAsString(Map.of("error", cause == null ? "unknown error" : cause));
        } catch (JsonProcessingException e) {
            // a map of two strings always serializes
            throw new IllegalStateException(e);
        }
    }

    private static Map<String, AutomatonDef> resultBody(TransformationResult result) {
        final Map<String, AutomatonDef> body = new LinkedHashMap<>();
        body.put("nfa", result.nfaDef());
        body.put("dfa", result.dfaDef());
        return body;
    }
}
