package com.tablecast.hub.pos;

import com.fasterxml.jackson.databind.JsonNode;
import com.tablecast.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Client-credentials token for the POS API, cached until shortly before it expires.
 * <p>
 * Concurrent callers that find no valid token share one in-flight request.
 * </p>
 */
public class PosTokenProvider {
    private static final Logger log = LoggerFactory.getLogger(PosTokenProvider.class);

    static final String TOKEN_PATH = "/oauth/token";
    private static final Duration EXPIRY_MARGIN = Duration.ofSeconds(30);
    private static final long DEFAULT_EXPIRES_IN_SEC = 300;

    private final HttpClient httpClient;
    private final String clientId;
    private final String clientSecret;
    private final Clock clock;

    private final AtomicReference<CachedToken> cached = new AtomicReference<>();
    private final AtomicReference<Mono<CachedToken>> inFlight = new AtomicReference<>();

    public PosTokenProvider(HttpClient httpClient, String clientId, String clientSecret) {
        this(httpClient, clientId, clientSecret, Clock.systemUTC());
    }

    PosTokenProvider(HttpClient httpClient, String clientId, String clientSecret, Clock clock) {
        this.httpClient = httpClient;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.clock = clock;
    }

    /**
     * Returns a valid access token, requesting a new one if needed.
     *
     * @return Mono of the bearer token; errors with {@link PosApiException}
     */
    public Mono<String> token() {
        return Mono.defer(() -> {
            CachedToken current = cached.get();
            if (current != null && current.isValid(clock.instant())) {
                return Mono.just(current.value());
            }
            Mono<CachedToken> request = inFlight.updateAndGet(existing -> existing != null
                ? existing
                : requestToken().doFinally(signal -> inFlight.set(null)).cache());
            return request.map(CachedToken::value);
        });
    }

    /**
     * Drops the cached token, e.g. after the POS answered 401.
     */
    public void invalidate() {
        cached.set(null);
    }

    private Mono<CachedToken> requestToken() {
        String body = JsonUtils.writeValueAsString(Map.of(
            "grant_type", "client_credentials",
            "client_id", clientId,
            "client_secret", clientSecret
        ));

        return httpClient
            .headers(h -> h.set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON))
            .post()
            .uri(TOKEN_PATH)
            .send(ByteBufFlux.fromString(Mono.just(body)))
            .responseSingle((response, content) -> {
                int status = response.status().code();
                if (status < 200 || status >= 300) {
                    return Mono.<String>error(new PosApiException("POS token request rejected", status));
                }
                return content.asString();
            })
            .map(this::parseToken)
            .doOnNext(token -> {
                cached.set(token);
                log.debug("POS token refreshed, valid until {}", token.expiresAt());
            })
            .doOnError(err -> log.warn("POS token request failed: {}", err.toString()));
    }

    private CachedToken parseToken(String json) {
        JsonNode node = JsonUtils.readTree(json);
        String accessToken = JsonUtils.textField(node, "access_token");
        if (accessToken == null) {
            throw new PosApiException("POS token response has no access_token", 200);
        }
        long expiresIn = node.path("expires_in").asLong(DEFAULT_EXPIRES_IN_SEC);
        Instant expiresAt = clock.instant().plusSeconds(expiresIn).minus(EXPIRY_MARGIN);
        return new CachedToken(accessToken, expiresAt);
    }

    private record CachedToken(String value, Instant expiresAt) {
        boolean isValid(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
