package io.marketstream.gateway.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.marketstream.normalizer.model.MarketType;
import org.agrona.concurrent.EpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Fetches KuCoin WebSocket tokens via {@code POST /api/v1/bullet-public}, or
 * {@code bullet-private} when credentials are configured.
 *
 * <p>A token is reused until it is within {@link ConnectionAuth#EXPIRY_MARGIN_MS}
 * of expiry; every call gets a fresh {@code connectId}.
 */
public class KucoinTokenProvider implements HandshakeProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(KucoinTokenProvider.class);

    public static final String SPOT_REST_URL = "https://api.kucoin.com";
    public static final String FUTURES_REST_URL = "https://api-futures.kucoin.com";

    static final String PUBLIC_PATH = "/api/v1/bullet-public";
    static final String PRIVATE_PATH = "/api/v1/bullet-private";
    static final String SUCCESS_CODE = "200000";
    static final long TOKEN_LIFETIME_MS = 24L * 60 * 60 * 1000;

    private static final String HMAC_SHA256 = "HmacSHA256";

    private final String restBaseUrl;
    private final Credentials credentials;
    private final EpochClock clock;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private ConnectionAuth cached;

    public KucoinTokenProvider(MarketType marketType, Credentials credentials, EpochClock clock) {
        this(marketType == MarketType.FUTURES ? FUTURES_REST_URL : SPOT_REST_URL, credentials, clock);
    }

    /**
     * @param restBaseUrl REST base URL without trailing slash
     * @param credentials credentials for the private bullet endpoint, or null
     * @param clock       time source for signing and expiry
     */
    public KucoinTokenProvider(String restBaseUrl, Credentials credentials, EpochClock clock) {
        this.restBaseUrl = restBaseUrl;
        this.credentials = credentials;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public synchronized ConnectionAuth acquire() throws HandshakeException {
        long now = clock.time();
        if (cached != null && !cached.isExpired(now, ConnectionAuth.EXPIRY_MARGIN_MS)) {
            return withFreshConnectId(cached);
        }

        String path = credentials != null ? PRIVATE_PATH : PUBLIC_PATH;
        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(URI.create(restBaseUrl + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.noBody())
            .timeout(Duration.ofSeconds(10));
        if (credentials != null) {
            signedHeaders("POST", path, now).forEach(request::header);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new HandshakeException("KuCoin token request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HandshakeException("KuCoin token request interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new HandshakeException("KuCoin token request failed: status=" + response.statusCode()
                + ", body=" + response.body());
        }

        cached = parseBulletResponse(response.body(), now);
        LOGGER.info("Acquired KuCoin {} token, endpoint={}, pingInterval={} ms",
            credentials != null ? "private" : "public", cached.endpoint(), cached.pingIntervalMs());
        return cached;
    }

    @Override
    public boolean tokenGated() {
        return true;
    }

    /**
     * Parses a bullet response:
     * <pre>
     * {"code":"200000","data":{"token":"...","instanceServers":[{"endpoint":"wss://...","pingInterval":18000,...}]}}
     * </pre>
     */
    ConnectionAuth parseBulletResponse(String body, long issuedAt) throws HandshakeException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new HandshakeException("Malformed KuCoin token response", e);
        }

        String code = root.path("code").asText();
        if (!SUCCESS_CODE.equals(code)) {
            throw new HandshakeException("KuCoin token request rejected: code=" + code
                + ", msg=" + root.path("msg").asText());
        }

        JsonNode data = root.path("data");
        String token = data.path("token").asText(null);
        JsonNode servers = data.path("instanceServers");
        if (token == null || token.isEmpty() || !servers.isArray() || servers.isEmpty()) {
            throw new HandshakeException("KuCoin token response missing token or instance servers");
        }

        JsonNode server = servers.get(0);
        String endpoint = server.path("endpoint").asText(null);
        if (endpoint == null || endpoint.isEmpty()) {
            throw new HandshakeException("KuCoin instance server has no endpoint");
        }
        long pingInterval = server.path("pingInterval").asLong(0L);

        return new ConnectionAuth(
            URI.create(endpoint),
            token,
            UUID.randomUUID().toString(),
            issuedAt + TOKEN_LIFETIME_MS,
            Math.max(0L, pingInterval)
        );
    }

    /**
     * Builds KuCoin API v2 authentication headers.
     */
    Map<String, String> signedHeaders(String method, String path, long timestamp) throws HandshakeException {
        String ts = Long.toString(timestamp);
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("KC-API-KEY", credentials.apiKey());
        headers.put("KC-API-SIGN", sign(ts + method + path, credentials.secretKey()));
        headers.put("KC-API-TIMESTAMP", ts);
        headers.put("KC-API-PASSPHRASE", sign(credentials.passphrase(), credentials.secretKey()));
        headers.put("KC-API-KEY-VERSION", "2");
        return headers;
    }

    private static String sign(String data, String secret) throws HandshakeException {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return Base64.getEncoder().encodeToString(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new HandshakeException("Request signing failed", e);
        }
    }

    private static ConnectionAuth withFreshConnectId(ConnectionAuth auth) {
        return new ConnectionAuth(auth.endpoint(), auth.token(), UUID.randomUUID().toString(),
            auth.expiresAt(), auth.pingIntervalMs());
    }
}
