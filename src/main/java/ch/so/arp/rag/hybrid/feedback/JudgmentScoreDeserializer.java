package ch.so.arp.rag.hybrid.feedback;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

/**
 * Reads a judgment either as a boolean ({@code true} = 1, {@code false} = 0) or
 * as a number. Range checks happen during feedback validation.
 */
public class JudgmentScoreDeserializer extends StdDeserializer<Double> {

    public JudgmentScoreDeserializer() {
        super(Double.class);
    }

    @Override
    public Double deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_TRUE) {
            return 1.0d;
        }
        if (token == JsonToken.VALUE_FALSE) {
            return 0.0d;
        }
        if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
            return parser.getDoubleValue();
        }
        return (Double) context.handleUnexpectedToken(Double.class, parser);
    }
}
