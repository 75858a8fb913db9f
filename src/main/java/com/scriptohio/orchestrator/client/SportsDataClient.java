package com.scriptohio.orchestrator.client;

import com.scriptohio.orchestrator.config.OrchestratorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class SportsDataClient {

    private static final ParameterizedTypeReference<List<Map<String, Object>>> ROWS =
        new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String apiKey;
    private final long minDelayNanos;

    private final Object slotLock = new Object();
    private long nextSlotNanos = System.nanoTime();

    @Autowired
    public SportsDataClient(RestTemplateBuilder builder, OrchestratorProperties properties) {
        this(builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(30))
                .build(),
            properties.getSportsData().getBaseUrl(),
            properties.getSportsData().getApiKey(),
            properties.getSportsData().getMinDelay());
    }

    public SportsDataClient(RestTemplate restTemplate, String baseUrl, String apiKey, Duration minDelay) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.minDelayNanos = minDelay.toNanos();
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public List<Map<String, Object>> fetchGames(int season, Integer week, String team) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
            .path("/games")
            .queryParam("year", season);
        if (week != null) {
            uri.queryParam("week", week);
        }
        if (team != null && !team.isBlank()) {
            uri.queryParam("team", team);
        }
        return get(uri.build().toUriString());
    }

    public List<Map<String, Object>> fetchRatings(int season) {
        String uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
            .path("/ratings/sp")
            .queryParam("year", season)
            .build()
            .toUriString();
        return get(uri);
    }

    private List<Map<String, Object>> get(String uri) {
        awaitSlot();
        HttpHeaders headers = new HttpHeaders();
        if (isConfigured()) {
            headers.setBearerAuth(apiKey);
        }
        try {
            List<Map<String, Object>> body = restTemplate
                .exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), ROWS)
                .getBody();
            return body == null ? List.of() : body;
        } catch (HttpStatusCodeException e) {
            throw translate(e.getStatusCode(), uri, e);
        } catch (RestClientException e) {
            throw new DataSourceException(DataSourceException.Kind.TRANSPORT,
                "Sports data request failed: " + e.getMessage(), e);
        }
    }

    private DataSourceException translate(HttpStatusCode status, String uri, HttpStatusCodeException cause) {
        DataSourceException.Kind kind = switch (status.value()) {
            case 429 -> DataSourceException.Kind.RATE_LIMITED;
            case 401 -> DataSourceException.Kind.UNAUTHORIZED;
            case 404 -> DataSourceException.Kind.NOT_FOUND;
            default -> DataSourceException.Kind.TRANSPORT;
        };
        log.warn("Sports data call {} failed with HTTP {} ({})", uri, status.value(), kind);
        return new DataSourceException(kind, String.format("HTTP %d from %s", status.value(), uri), cause);
    }

    private void awaitSlot() {
        long waitNanos;
        synchronized (slotLock) {
            long now = System.nanoTime();
            long slot = Math.max(now, nextSlotNanos);
            nextSlotNanos = slot + minDelayNanos;
            waitNanos = slot - now;
        }
        if (waitNanos > 0) {
            try {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DataSourceException(DataSourceException.Kind.TRANSPORT,
                    "Interrupted while waiting for rate limit slot", e);
            }
        }
    }
}
