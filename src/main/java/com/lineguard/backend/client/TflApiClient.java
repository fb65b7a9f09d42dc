package com.lineguard.backend.client;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

@Component
public class TflApiClient implements TflApi {

        private static final ParameterizedTypeReference<List<Map<String, Object>>> JSON_ARRAY =
                        new ParameterizedTypeReference<>() {
                        };
        private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
                        new ParameterizedTypeReference<>() {
                        };

        private final WebClient webClient;
        private final TflRateLimiter rateLimiter;

        @Value("${tfl.app.key:}")
        private String appKey;

        @Value("${tfl.api.timeout:10}")
        private int apiTimeout;

        public TflApiClient(WebClient.Builder webClientBuilder, TflRateLimiter rateLimiter,
                        @Value("${tfl.api.base-url:https://api.tfl.gov.uk}") String baseUrl) {
                this.rateLimiter = rateLimiter;
                this.webClient = webClientBuilder
                                .baseUrl(baseUrl)
                                .codecs(configurer -> configurer
                                                .defaultCodecs()
                                                .maxInMemorySize(8 * 1024 * 1024)) // route sequences are large
                                .build();
        }

        @Override
        public List<Map<String, Object>> getLinesByMode(String mode) {
                return getArray(b -> b.path("/Line/Mode/{mode}")
                                .queryParam("app_key", appKey)
                                .build(mode));
        }

        @Override
        public Map<String, Object> getRouteSequence(String lineId, String direction) {
                return getObject(b -> b.path("/Line/{lineId}/Route/Sequence/{direction}")
                                .queryParam("app_key", appKey)
                                .queryParam("excludeCrowding", true)
                                .build(lineId, direction));
        }

        @Override
        public List<Map<String, Object>> getStopPointsByLine(String lineId) {
                return getArray(b -> b.path("/Line/{lineId}/StopPoints")
                                .queryParam("app_key", appKey)
                                .build(lineId));
        }

        @Override
        public List<Map<String, Object>> getLineStatuses(String modes) {
                return getArray(b -> b.path("/Line/Mode/{modes}/Status")
                                .queryParam("app_key", appKey)
                                .queryParam("detail", true)
                                .build(modes));
        }

        private List<Map<String, Object>> getArray(Function<UriBuilder, URI> uri) {
                rateLimiter.acquire();
                return webClient.get()
                                .uri(uri)
                                .retrieve()
                                .bodyToMono(JSON_ARRAY)
                                .timeout(Duration.ofSeconds(apiTimeout))
                                .block();
        }

        private Map<String, Object> getObject(Function<UriBuilder, URI> uri) {
                rateLimiter.acquire();
                return webClient.get()
                                .uri(uri)
                                .retrieve()
                                .bodyToMono(JSON_OBJECT)
                                .timeout(Duration.ofSeconds(apiTimeout))
                                .block();
        }
}
