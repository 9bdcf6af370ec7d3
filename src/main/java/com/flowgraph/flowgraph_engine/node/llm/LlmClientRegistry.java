package com.flowgraph.flowgraph_engine.node.llm;

import com.flowgraph.flowgraph_engine.exception.NotFoundException;
import com.flowgraph.flowgraph_engine.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class LlmClientRegistry {

    private final Map<String, LlmClient> clientMap = new ConcurrentHashMap<>();

    public LlmClientRegistry() {}

    @Autowired
    public LlmClientRegistry(ObjectProvider<LlmClient> clients) {
        clients.orderedStream().forEach(this::register);
    }

    public LlmClientRegistry register(LlmClient client) {
        if (client == null || client.getProvider() == null || client.getProvider().isBlank()) {
            throw new ValidationException("LLM client must declare a provider name");
        }
        LlmClient previous = clientMap.put(key(client.getProvider()), client);
        if (previous != null && previous != client) {
            log.warn("LLM client for provider '{}' replaced by {}", client.getProvider(), client.getClass().getSimpleName());
        }
        return this;
    }

    public LlmClient getClient(String provider) {
        LlmClient client = provider != null ? clientMap.get(key(provider)) : null;
        if (client == null) {
            throw new NotFoundException("no LLM client registered for provider: " + provider);
        }
        return client;
    }

    public boolean isRegistered(String provider) {
        return provider != null && clientMap.containsKey(key(provider));
    }

    public List<String> getProviders() {
        List<String> providers = new ArrayList<>(clientMap.keySet());
        providers.sort(null);
        return providers;
    }

    private static String key(String provider) {
        return provider.trim().toLowerCase(Locale.ROOT);
    }
}
