package io.reviewmind.core.provider;

import io.reviewmind.core.external.ExternalCallException;
import io.reviewmind.core.model.ChatMessage;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FallbackLlmProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackLlmProvider.class);
    private final String name;
    private final List<LlmProvider> chain;

    public FallbackLlmProvider(String name, List<LlmProvider> chain) {
        this.name = name;
        this.chain = List.copyOf(chain);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, GenerationOptions options) {
        ExternalCallException last = new ExternalCallException("no providers in fallback chain " + name);
        for (LlmProvider provider : chain) {
            try {
                LlmResponse response = provider.chat(model, messages, options);
                LOG.debug("Provider {} served request for chain {}", provider.name(), name);
                return response;
            } catch (ExternalCallException e) {
                LOG.warn("Provider {} failed in chain {}: {}", provider.name(), name, e.getMessage());
                last = e;
            }
        }
        throw last;
    }
}
