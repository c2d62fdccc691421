package com.tenacy.aiops.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenacy.aiops.config.DetectorProperties;
import com.tenacy.aiops.domain.LogLine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Loki query_range API 조회.
 */
@Slf4j
@Component
public class LokiLogSource implements LogSource {

    private static final String QUERY_RANGE_PATH = "/loki/api/v1/query_range";
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final DetectorProperties.Loki loki;

    public LokiLogSource(@Qualifier("lokiRestTemplate") RestTemplate restTemplate,
                         ObjectMapper objectMapper,
                         DetectorProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.loki = properties.getLoki();
    }

    @Override
    public List<LogLine> fetchRecent(Duration range) {
        Instant end = Instant.now();
        Instant start = end.minus(range);

        URI uri = UriComponentsBuilder.fromHttpUrl(loki.getUrl())
                .path(QUERY_RANGE_PATH)
                .queryParam("query", "{query}")
                .queryParam("limit", loki.getLimit())
                .queryParam("start", toEpochNanos(start))
                .queryParam("end", toEpochNanos(end))
                .encode()
                .buildAndExpand(loki.getQuery())
                .toUri();

        try {
            String body = restTemplate.getForObject(uri, String.class);
            List<LogLine> lines = parse(body);
            log.debug("Loki returned {} lines for {}", lines.size(), loki.getQuery());
            return lines;
        } catch (Exception e) {
            log.error("Error querying Loki: {}", e.getMessage(), e);
            return Collections.emptyList();
        }
    }

    List<LogLine> parse(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return Collections.emptyList();
        }

        JsonNode root = objectMapper.readTree(body);
        List<LogLine> lines = new ArrayList<>();

        for (JsonNode stream : root.path("data").path("result")) {
            for (JsonNode value : stream.path("values")) {
                // [ "<epoch ns>", "<line>" ]
                long nanos = Long.parseLong(value.get(0).asText());
                String text = value.get(1).asText();
                lines.add(LogLine.of(fromEpochNanos(nanos), text));
            }
        }

        // 여러 스트림을 합쳤으므로 타임스탬프 순으로 재정렬 (stable)
        lines.sort(Comparator.comparing(LogLine::getTimestamp));
        return lines;
    }

    private static long toEpochNanos(Instant instant) {
        return instant.getEpochSecond() * NANOS_PER_SECOND + instant.getNano();
    }

    private static Instant fromEpochNanos(long nanos) {
        return Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
    }
}
