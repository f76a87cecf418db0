package com.autonomous.quota.service;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class JtokkitTokenCounter implements TokenCounter {

    private final EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
    private final Encoding fallback = registry.getEncoding(EncodingType.CL100K_BASE);
    private final Map<String, Encoding> encodingsByModel = new ConcurrentHashMap<>();

    @Override
    public int countTokens(String text, String model) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        // special token markers in user text count as plain text
        return encodingFor(model).countTokensOrdinary(text);
    }

    private Encoding encodingFor(String model) {
        if (model == null || model.isEmpty()) {
            return fallback;
        }
        return encodingsByModel.computeIfAbsent(model,
            name -> registry.getEncodingForModel(name).orElse(fallback));
    }
}
