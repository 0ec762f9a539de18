package com.crave.search.ondemand;

import com.crave.search.collection.CollectionArea;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class OnDemandRequestService {
    private static final Logger logger = LoggerFactory.getLogger(OnDemandRequestService.class);

    private final OnDemandRequestRepository requestRepository;
    private final ObjectMapper objectMapper;

    public OnDemandRequestService(OnDemandRequestRepository requestRepository, ObjectMapper objectMapper) {
        this.requestRepository = requestRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Upserts one row per distinct key and returns the sanitized inputs that were recorded.
     * The {@code context} map is merged into each row's {@code metadata.context}.
     */
    @Transactional
    public List<OnDemandRequestInput> recordRequests(List<OnDemandRequestInput> inputs, Map<String, Object> context) {
        List<OnDemandRequestInput> deduped = deduplicate(inputs);
        if (deduped.isEmpty()) {
            return deduped;
        }
        Map<String, Object> safeContext = context == null ? Map.of() : context;
        int restaurantCount = integer(safeContext.get("restaurantCount"));
        int foodCount = integer(safeContext.get("foodCount"));
        Instant seenAt = Instant.now();
        for (OnDemandRequestInput input : deduped) {
            requestRepository.upsert(
                input,
                buildMetadata(input.getMetadata(), safeContext),
                restaurantCount,
                foodCount,
                seenAt
            );
        }
        logger.debug("recorded on-demand requests count={} keys={}", deduped.size(), deduped);
        return deduped;
    }

    static List<OnDemandRequestInput> deduplicate(List<OnDemandRequestInput> inputs) {
        List<OnDemandRequestInput> result = new ArrayList<>();
        if (inputs == null) {
            return result;
        }
        Set<String> seen = new HashSet<>();
        for (OnDemandRequestInput input : inputs) {
            if (input == null || input.getEntityType() == null || input.getReason() == null) {
                continue;
            }
            String term = sanitizeTerm(input.getTerm());
            if (term.isEmpty()) {
                continue;
            }
            String locationKey = CollectionArea.normalizeKey(input.getLocationKey());
            String key = input.getReason().value() + ":" + input.getEntityType().value() + ":"
                + term.toLowerCase(Locale.ROOT) + ":" + locationKey;
            if (!seen.add(key)) {
                continue;
            }
            result.add(new OnDemandRequestInput(
                term,
                input.getEntityType(),
                input.getReason(),
                input.getEntityId(),
                locationKey,
                input.getMetadata()
            ));
        }
        return result;
    }

    static String sanitizeTerm(String term) {
        if (term == null) {
            return "";
        }
        return term.trim().replaceAll("\\s+", " ");
    }

    private String buildMetadata(Map<String, Object> metadata, Map<String, Object> context) {
        ObjectNode base = objectMapper.createObjectNode();
        if (metadata != null && !metadata.isEmpty()) {
            base.setAll((ObjectNode) objectMapper.valueToTree(metadata));
        }
        if (!context.isEmpty()) {
            JsonNode existing = base.get(OnDemandMetadata.CONTEXT);
            ObjectNode merged = existing instanceof ObjectNode objectNode
                ? objectNode.deepCopy()
                : objectMapper.createObjectNode();
            merged.setAll((ObjectNode) objectMapper.valueToTree(context));
            base.set(OnDemandMetadata.CONTEXT, merged);
        }
        return OnDemandMetadata.from(base).toJson(objectMapper);
    }

    private static int integer(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return (int) Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }
}
