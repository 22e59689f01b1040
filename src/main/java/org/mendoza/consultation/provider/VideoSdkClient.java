package org.mendoza.consultation.provider;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * VideoSDK REST client. Every request carries a freshly signed HS256 token.
 */
@ApplicationScoped
public class VideoSdkClient implements VideoProvider {

    private static final Logger LOG = Logger.getLogger(VideoSdkClient.class);

    private static final Duration TOKEN_TTL = Duration.ofMinutes(10);
    private static final String[] PERMISSIONS = {"allow_join", "allow_mod"};

    private final WebClient webClient;
    private final Optional<String> apiKey;
    private final Optional<String> secret;
    private final String baseUrl;
    private final Clock clock;

    @Inject
    public VideoSdkClient(Vertx vertx,
                          @ConfigProperty(name = "consultation.provider.api-key") Optional<String> apiKey,
                          @ConfigProperty(name = "consultation.provider.secret") Optional<String> secret,
                          @ConfigProperty(name = "consultation.provider.base-url", defaultValue = "https://api.videosdk.live") String baseUrl,
                          Clock clock) {
        this.webClient = WebClient.create(vertx);
        this.apiKey = apiKey.filter(value -> !value.isBlank());
        this.secret = secret.filter(value -> !value.isBlank());
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.clock = clock;
    }

    @Override
    public Uni<String> createMeeting() {
        return post("/v2/rooms", new JsonObject())
            .onItem().transform(body -> {
                String roomId = body.getString("roomId");
                if (roomId == null || roomId.isBlank()) {
                    throw new ProviderException("VideoSDK did not return a roomId: " + body.encode());
                }
                LOG.infof("Created VideoSDK room %s", roomId);
                return roomId;
            });
    }

    @Override
    public Uni<Void> startRecording(String meetingRef) {
        return post("/v2/recordings/start", new JsonObject().put("roomId", meetingRef)).replaceWithVoid();
    }

    @Override
    public Uni<Void> stopRecording(String meetingRef) {
        return post("/v2/recordings/end", new JsonObject().put("roomId", meetingRef)).replaceWithVoid();
    }

    @Override
    public Uni<Void> endMeeting(String meetingRef) {
        return post("/v2/rooms/deactivate", new JsonObject().put("roomId", meetingRef)).replaceWithVoid();
    }

    private Uni<JsonObject> post(String path, JsonObject body) {
        return Uni.createFrom().deferred(() -> webClient.postAbs(baseUrl + path)
                .putHeader("Authorization", apiToken())
                .putHeader("Content-Type", "application/json")
                .sendJsonObject(body))
            .onItem().transform(response -> readBody(path, response))
            .onFailure(failure -> !(failure instanceof ProviderException) && !(failure instanceof ProviderConfigurationException))
            .transform(failure -> new ProviderException("VideoSDK call " + path + " failed: " + failure.getMessage(), failure));
    }

    private static JsonObject readBody(String path, HttpResponse<Buffer> response) {
        String text = response.bodyAsString();
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new ProviderException("VideoSDK call " + path + " returned HTTP " + response.statusCode() + ": " + text);
        }
        return text == null || text.isBlank() ? new JsonObject() : new JsonObject(text);
    }

    /**
     * Signed API token; fails with {@link ProviderConfigurationException} when credentials are missing.
     */
    String apiToken() {
        if (apiKey.isEmpty() || secret.isEmpty()) {
            throw new ProviderConfigurationException(
                "VideoSDK credentials missing: set consultation.provider.api-key and consultation.provider.secret");
        }
        Instant now = clock.instant();
        return JWT.create()
            .withClaim("apikey", apiKey.get())
            .withArrayClaim("permissions", PERMISSIONS)
            .withClaim("version", 2)
            .withIssuedAt(Date.from(now))
            .withExpiresAt(Date.from(now.plus(TOKEN_TTL)))
            .sign(Algorithm.HMAC256(secret.get()));
    }

    @PreDestroy
    void close() {
        webClient.close();
    }
}
