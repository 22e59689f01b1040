package org.mendoza.consultation;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;
import org.mendoza.consultation.session.VideoCallSessionManager;

/**
 * Management interface for staff tooling: create, inspect and end calls, toggle recording.
 */
@Path("/calls")
@ApplicationScoped
public class CallResource {

    private static final Logger LOG = Logger.getLogger(CallResource.class);

    private static final int MAX_LIMIT = 500;

    @Inject
    VideoCallSessionManager sessionManager;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<String> create(String body) {
        JsonObject request = parseBody(body);
        String appointmentId = text(request, "appointmentId");
        if (appointmentId == null || appointmentId.isBlank()) {
            throw new IllegalArgumentException("appointmentId is required");
        }
        String doctorId = text(request, "doctorId");
        String patientId = text(request, "patientId");
        boolean enableRecording;
        try {
            enableRecording = request.getBoolean("enableRecording", false);
        } catch (ClassCastException e) {
            throw new IllegalArgumentException("enableRecording must be a boolean", e);
        }
        LOG.debugf("Create call requested for appointment %s", appointmentId);
        return sessionManager.createSession(appointmentId, doctorId, patientId, enableRecording)
            .onItem().transform(session -> SessionJson.session(session).encode());
    }

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<String> recent(@QueryParam("limit") @DefaultValue("50") int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        return sessionManager.listRecent(bounded)
            .onItem().transform(snapshots -> {
                JsonArray calls = new JsonArray();
                snapshots.forEach(snapshot -> calls.add(SessionJson.summary(snapshot)));
                return new JsonObject().put("calls", calls).put("count", calls.size()).encode();
            });
    }

    @GET
    @Path("/stats")
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<String> stats() {
        return sessionManager.countByStatus()
            .onItem().transform(counts -> SessionJson.stats(counts).encode());
    }

    @GET
    @Path("/{id}")
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<String> detail(@PathParam("id") Long id) {
        return sessionManager.snapshot(id)
            .onItem().transform(snapshot -> SessionJson.detail(snapshot).encode());
    }

    @POST
    @Path("/{id}/end")
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<String> end(@PathParam("id") Long id) {
        return withOutcome(id, sessionManager.forceEnd(id));
    }

    @POST
    @Path("/{id}/recording/start")
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<String> startRecording(@PathParam("id") Long id) {
        return withOutcome(id, sessionManager.startRecording(id));
    }

    @POST
    @Path("/{id}/recording/stop")
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<String> stopRecording(@PathParam("id") Long id) {
        return withOutcome(id, sessionManager.stopRecording(id));
    }

    private Uni<String> withOutcome(Long id, Uni<Boolean> command) {
        return command.chain(changed -> sessionManager.snapshot(id)
            .onItem().transform(snapshot -> SessionJson.summary(snapshot).put("changed", changed).encode()));
    }

    private static String text(JsonObject request, String field) {
        Object value = request.getValue(field);
        if (value != null && !(value instanceof String)) {
            throw new IllegalArgumentException(field + " must be a string");
        }
        return (String) value;
    }

    private static JsonObject parseBody(String body) {
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("Request body is required");
        }
        try {
            return new JsonObject(body);
        } catch (DecodeException e) {
            throw new IllegalArgumentException("Request body is not a JSON object", e);
        }
    }
}
