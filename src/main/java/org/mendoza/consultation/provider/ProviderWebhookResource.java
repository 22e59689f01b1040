package org.mendoza.consultation.provider;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;
import org.mendoza.consultation.session.VideoCallSessionManager;

@Path("/webhooks/videosdk")
@ApplicationScoped
public class ProviderWebhookResource {

    private static final Logger LOG = Logger.getLogger(ProviderWebhookResource.class);

    @Inject
    ProviderWebhookParser parser;

    @Inject
    VideoCallSessionManager sessionManager;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<String> receive(String body) {
        ProviderEvent event = parser.parse(body);
        if (event == null) {
            return Uni.createFrom().item(status("ignored"));
        }
        LOG.debugf("Webhook received: %s", event);
        return sessionManager.handleProviderEvent(event)
            .onItem().transform(applied -> status(applied ? "accepted" : "discarded"));
    }

    private static String status(String value) {
        return new JsonObject().put("status", value).encode();
    }
}
