package io.reviewmind.core.provider;

import io.reviewmind.core.model.ChatMessage;
import java.util.List;

public interface LlmProvider {
    String name();

    /**
     * @throws io.reviewmind.core.external.ExternalCallException when the provider cannot answer
     */
    LlmResponse chat(String model, List<ChatMessage> messages, GenerationOptions options);
}
