package org.mendoza.consultation;

import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.pgclient.PgPool;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;
import org.mendoza.consultation.session.VideoCallSessionManager;
import org.mendoza.consultation.sync.RealtimeSyncBridge;

@Path("/")
@ApplicationScoped
public class Main {

    private static final Logger LOG = Logger.getLogger(Main.class);

    @Inject
    PgPool client;

    @Inject
    VideoCallSessionManager sessionManager;

    @Inject
    RealtimeSyncBridge syncBridge;

    void onStart(@Observes StartupEvent ev) {
        LOG.info("Consultation session service starting up...");

        client.query("SELECT version()").execute()
            .subscribe().with(
                pgRowSet -> pgRowSet.forEach(row -> {
                    LOG.info("✅ Database connected successfully!");
                    LOG.info("PostgreSQL version: " + row.getString(0));
                }),
                failure -> LOG.error("❌ Failed to connect to database: " + failure.getMessage())
            );
    }

    @GET
    @Path("/health")
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<String> health() {
        return client.query("SELECT current_timestamp, current_database()").execute()
            .onItem().transform(pgRowSet -> {
                var row = pgRowSet.iterator().next();
                return new JsonObject()
                    .put("status", "ok")
                    .put("database", String.valueOf(row.getValue(1)))
                    .put("timestamp", String.valueOf(row.getValue(0)))
                    .put("changeFeedConnected", syncBridge.isConnected())
                    .encode();
            })
            .onFailure().recoverWithItem(failure -> new JsonObject()
                .put("status", "error")
                .put("message", failure.getMessage())
                .put("changeFeedConnected", syncBridge.isConnected())
                .encode());
    }

    @GET
    @Path("/sync/stats")
    @Produces(MediaType.APPLICATION_JSON)
    public String syncStats() {
        return new JsonObject()
            .put("sync", new JsonObject(syncBridge.getStats()))
            .put("sessions", new JsonObject(sessionManager.getStats()))
            .encode();
    }
}
