package com.regimeplatform.forecast.filter;

import com.regimeplatform.forecast.config.ForecastProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Boundary guard in front of every handler:
 * <ul>
 *   <li>optional shared API key, accepted as {@code X-API-Key} or {@code Authorization: Bearer}; 401 otherwise</li>
 *   <li>token-bucket rate limit per client on predict and truth; 429 when empty</li>
 *   <li>{@code X-Service-MS} and {@code Server-Timing} on every response</li>
 * </ul>
 * The health endpoint is never authenticated.
 */
@Component
public class ServiceGuardFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(ServiceGuardFilter.class);

    static final String API_KEY_HEADER = "X-API-Key";
    static final String SERVICE_MS_HEADER = "X-Service-MS";
    static final String SERVER_TIMING_HEADER = "Server-Timing";
    private static final String HEALTH_PATH = "/api/v1/health";
    private static final int MAX_TRACKED_CLIENTS = 10_000;

    private final byte[] apiKey;
    private final double ratePerSecond;
    private final double burst;
    private final LongSupplier nanoClock;
    private final Map<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    @Autowired
    public ServiceGuardFilter(ForecastProperties properties) {
        this(properties.getService(), System::nanoTime);
    }

    ServiceGuardFilter(ForecastProperties.Service settings, LongSupplier nanoClock) {
        String key = settings.getApiKey();
        this.apiKey        = key == null || key.isBlank() ? null : key.getBytes(StandardCharsets.UTF_8);
        this.ratePerSecond = settings.getRateLimitRps();
        this.burst         = Math.max(1, settings.getRateLimitBurst());
        this.nanoClock     = nanoClock;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        long start = nanoClock.getAsLong();
        ServerHttpResponse response = exchange.getResponse();
        response.beforeCommit(() -> {
            double ms = (nanoClock.getAsLong() - start) / 1_000_000.0;
            HttpHeaders headers = response.getHeaders();
            headers.set(SERVICE_MS_HEADER, String.format(Locale.ROOT, "%.3f", ms));
            headers.set(SERVER_TIMING_HEADER, String.format(Locale.ROOT, "app;dur=%.3f", ms));
            return Mono.empty();
        });

        ServerHttpRequest request = exchange.getRequest();
        String path = request.getPath().value();
        if (HEALTH_PATH.equals(path)) {
            return chain.filter(exchange);
        }
        String presented = presentedKey(request);
        if (apiKey != null && (presented == null
                || !MessageDigest.isEqual(apiKey, presented.getBytes(StandardCharsets.UTF_8)))) {
            log.debug("[ServiceGuard] unauthorized path={}", path);
            return reject(response, HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Missing or invalid API key");
        }
        if (ratePerSecond > 0 && isRateLimited(path)) {
            // a presented key only identifies the client once it has been verified
            String client = apiKey != null ? "key:" + presented : "ip:" + clientAddress(request);
            if (!bucketFor(client).tryAcquire(nanoClock.getAsLong())) {
                log.debug("[ServiceGuard] rate limited path={}", path);
                return reject(response, HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED", "Too many requests");
            }
        }
        return chain.filter(exchange);
    }

    private TokenBucket bucketFor(String client) {
        if (buckets.size() > MAX_TRACKED_CLIENTS) {
            buckets.clear();
        }
        return buckets.computeIfAbsent(client, c -> new TokenBucket(ratePerSecond, burst, nanoClock.getAsLong()));
    }

    private static boolean isRateLimited(String path) {
        return path.endsWith("/predict") || path.endsWith("/truth");
    }

    private static String presentedKey(ServerHttpRequest request) {
        String header = request.getHeaders().getFirst(API_KEY_HEADER);
        if (header != null && !header.isBlank()) {
            return header.trim();
        }
        String auth = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (auth != null && auth.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return auth.substring(7).trim();
        }
        return null;
    }

    private static String clientAddress(ServerHttpRequest request) {
        InetSocketAddress remote = request.getRemoteAddress();
        return remote == null ? "unknown" : remote.getHostString();
    }

    private static Mono<Void> reject(ServerHttpResponse response, HttpStatus status, String error, String message) {
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        String body = String.format("{\"error\":\"%s\",\"message\":\"%s\"}", error, message);
        return response.writeWith(Mono.just(response.bufferFactory().wrap(body.getBytes(StandardCharsets.UTF_8))));
    }

    /** Refills continuously at {@code rate} tokens per second up to {@code capacity}. */
    static final class TokenBucket {
        private final double rate;
        private final double capacity;
        private double tokens;
        private long lastRefill;

        TokenBucket(double rate, double capacity, long now) {
            this.rate = rate;
            this.capacity = capacity;
            this.tokens = capacity;
            this.lastRefill = now;
        }

        synchronized boolean tryAcquire(long now) {
            double elapsed = Math.max(0, now - lastRefill) / 1e9;
            tokens = Math.min(capacity, tokens + elapsed * rate);
            lastRefill = now;
            if (tokens >= 1.0) {
                tokens -= 1.0;
                return true;
            }
            return false;
        }
    }
}
