package io.reviewmind.core.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import io.reviewmind.core.external.ExternalCallException;

final class Vectors {

    private Vectors() {
    }

    static float[] fromJson(JsonNode node, String source) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            throw new ExternalCallException(source + ": response contained no embedding");
        }
        float[] vector = new float[node.size()];
        for (int i = 0; i < vector.length; i++) {
            JsonNode value = node.get(i);
            if (!value.isNumber()) {
                throw new ExternalCallException(source + ": non-numeric embedding value at " + i);
            }
            vector[i] = (float) value.asDouble();
        }
        return vector;
    }
}
