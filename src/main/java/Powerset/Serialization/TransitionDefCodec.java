package Powerset.Serialization;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import Powerset.Model.TransitionDef;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

/**
 * JSON form of a transition: the triple {@code [from, symbol, to]}.
 * <p>
 * {@code symbol} is a string or null (epsilon); {@code to} is an int or an array of ints.
 * The object form {@code {"from": .., "symbol": .., "to": ..}} is accepted on input as well.
 */
final class TransitionDefCodec {

    private TransitionDefCodec() {
    }

    static final class Serializer extends JsonSerializer<TransitionDef> {
        @Override
        public void serialize(TransitionDef t, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartArray();
            gen.writeNumber(t.from());
            if (t.symbol() == null) {
                gen.writeNull();
            } else {
                gen.writeString(t.symbol());
            }
            if (t.singleTarget()) {
                gen.writeNumber(t.to().get(0));
            } else {
                gen.writeStartArray();
                for (Integer target : t.to()) {
                    if (target == null) {
                        gen.writeNull();
                    } else {
                        gen.writeNumber(target);
                    }
                }
                gen.writeEndArray();
            }
            gen.writeEndArray();
        }
    }

    static final class Deserializer extends JsonDeserializer<TransitionDef> {
        @Override
        public TransitionDef deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            final JsonNode node = p.readValueAsTree();
            final JsonNode from;
            final JsonNode symbol;
            final JsonNode to;
            if (node.isArray()) {
                if (node.size() != 3) {
                    throw JsonMappingException.from(p, "Transition must be a [from, symbol, to] triple, got: " + node);
                }
                from = node.get(0);
                symbol = node.get(1);
                to = node.get(2);
            } else if (node.isObject()) {
                from = node.get("from");
                symbol = node.get("symbol");
                to = node.get("to");
            } else {
                throw JsonMappingException.from(p, "Transition must be an array or an object, got: " + node);
            }

            if (from == null || !from.isIntegralNumber() || !from.canConvertToInt()) {
                throw JsonMappingException.from(p, "Transition source must be an integer: " + node);
            }
            final String sym;
            if (symbol == null || symbol.isNull()) {
                sym = null;
            } else if (symbol.isTextual()) {
                sym = symbol.asText();
            } else {
                throw JsonMappingException.from(p, "Transition symbol must be a string or null: " + node);
            }

            if (to != null && to.isIntegralNumber()) {
                if (to.canConvertToInt()) {
                    return TransitionDef.of(from.asInt(), sym, to.asInt());
                }
                return new TransitionDef(from.asInt(), sym, Collections.singletonList(null), false);
            }
            if (to == null || !to.isArray()) {
                throw JsonMappingException.from(p, "Transition target must be an integer or an array: " + node);
            }
            final List<Integer> targets = new ArrayList<>(to.size());
            for (JsonNode target : to) {
                if (target.isNull()) {
                    targets.add(null);
                } else if (target.isIntegralNumber()) {
                    // no declared state can match an id outside the int range; validation drops it
                    targets.add(target.canConvertToInt() ? Integer.valueOf(target.asInt()) : null);
                } else {
                    throw JsonMappingException.from(p, "Transition targets must be integers: " + node);
                }
            }
            return new TransitionDef(from.asInt(), sym, targets, false);
        }
    }
}
