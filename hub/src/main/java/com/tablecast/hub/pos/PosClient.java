package com.tablecast.hub.pos;

import com.tablecast.core.model.MesaRef;
import com.tablecast.core.model.VentaState;
import com.tablecast.core.util.JsonUtils;
import com.tablecast.hub.config.HubConfig;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * POS API client using reactor-netty HttpClient.
 * <p>
 * Sale lookup: {@code GET /api/v1/locales/{slug}/mesas/{mesaId}/venta} with a bearer
 * token from {@link PosTokenProvider}. 404 means the table has no open sale.
 * </p>
 */
public class PosClient implements IPosClient {
    private static final Logger log = LoggerFactory.getLogger(PosClient.class);

    private final HttpClient httpClient;
    private final PosTokenProvider tokenProvider;

    public PosClient(HubConfig config) {
        this(config.getPosBaseUrl(), config.getPosClientId(), config.getPosClientSecret(), config.getPosTimeout());
    }

    public PosClient(String baseUrl, String clientId, String clientSecret, Duration responseTimeout) {
        this.httpClient = HttpClient.create()
            .baseUrl(baseUrl)
            .headers(h -> h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
            .responseTimeout(responseTimeout);
        this.tokenProvider = new PosTokenProvider(httpClient, clientId, clientSecret);

        log.info("PosClient initialized with {}", baseUrl);
    }

    @Override
    public Mono<VentaState> fetchVenta(MesaRef mesa) {
        String uri = "/api/v1/locales/" + encode(mesa.slug()) + "/mesas/" + encode(mesa.mesaId()) + "/venta";

        return tokenProvider.token()
            .flatMap(token -> httpClient
                .headers(h -> h.set(HttpHeaderNames.AUTHORIZATION, "Bearer " + token))
                .get()
                .uri(uri)
                .responseSingle((response, content) -> {
                    int status = response.status().code();
                    if (status == HttpResponseStatus.NOT_FOUND.code()) {
                        return Mono.<String>empty();
                    }
                    if (status == HttpResponseStatus.UNAUTHORIZED.code()) {
                        tokenProvider.invalidate();
                    }
                    if (status < 200 || status >= 300) {
                        return Mono.<String>error(new PosApiException("POS answered " + status + " for mesa " + mesa, status));
                    }
                    return content.asString();
                }))
            .map(json -> parseVenta(json, mesa))
            .doOnNext(venta -> log.debug("Mesa {} sale {} updatedAt={}", mesa, venta.getId(), venta.getUpdatedAt()));
    }

    private static VentaState parseVenta(String json, MesaRef mesa) {
        try {
            return JsonUtils.readValue(json, VentaState.class);
        } catch (IllegalArgumentException e) {
            throw new PosApiException("Unreadable sale for mesa " + mesa, e);
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
