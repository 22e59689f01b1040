package org.mendoza.consultation.provider;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.mendoza.consultation.model.ParticipantRole;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Turns VideoSDK webhook bodies into {@link ProviderEvent}s.
 *
 * Expected shape:
 * <pre>
 * {"webhookType": "participant-joined",
 *  "data": {"meetingId": "...", "participantId": "...", "timestamp": "...",
 *           "metaData": {"userId": "...", "role": "doctor"}}}
 * </pre>
 */
@ApplicationScoped
public class ProviderWebhookParser {

    private static final Logger LOG = Logger.getLogger(ProviderWebhookParser.class);

    private final Clock clock;

    @Inject
    public ProviderWebhookParser(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return the event, or null for webhook types that are not consumed
     * @throws IllegalArgumentException when the body is not valid JSON or lacks required ids
     */
    public ProviderEvent parse(String body) {
        JsonObject json;
        try {
            json = new JsonObject(body == null ? "" : body);
        } catch (DecodeException e) {
            throw new IllegalArgumentException("Webhook body is not a JSON object", e);
        }
        try {
            return read(json);
        } catch (ClassCastException e) {
            throw new IllegalArgumentException("Webhook field has the wrong type: " + e.getMessage(), e);
        }
    }

    private ProviderEvent read(JsonObject json) {
        String webhookType = json.getString("webhookType");
        ProviderEventType type = ProviderEventType.fromWebhookType(webhookType);
        if (type == null) {
            LOG.debugf("Ignoring webhook type %s", webhookType);
            return null;
        }

        JsonObject data = json.getJsonObject("data", new JsonObject());
        String meetingRef = data.getString("meetingId", data.getString("roomId"));
        if (meetingRef == null || meetingRef.isBlank()) {
            throw new IllegalArgumentException("Webhook " + webhookType + " has no meetingId");
        }
        Instant at = timestamp(data);

        if (!type.isParticipantEvent()) {
            return new ProviderEvent(type, meetingRef, null, null, at);
        }

        JsonObject metaData = data.getJsonObject("metaData", new JsonObject());
        String userId = metaData.getString("userId", data.getString("participantId"));
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("Webhook " + webhookType + " has no participant id");
        }
        ParticipantRole role = type == ProviderEventType.JOINED
            ? ParticipantRole.fromDb(metaData.getString("role"))
            : null;
        return new ProviderEvent(type, meetingRef, userId, role, at);
    }

    private Instant timestamp(JsonObject data) {
        Object value = data.getValue("timestamp");
        if (value instanceof Number) {
            return Instant.ofEpochMilli(((Number) value).longValue());
        }
        if (value instanceof String) {
            try {
                return Instant.parse((String) value);
            } catch (DateTimeParseException e) {
                LOG.debugf("Unparseable webhook timestamp %s, using receive time", value);
            }
        }
        return clock.instant();
    }
}
