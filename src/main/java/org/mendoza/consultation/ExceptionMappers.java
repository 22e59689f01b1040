package org.mendoza.consultation;

import io.vertx.core.json.JsonObject;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;
import org.mendoza.consultation.provider.ProviderConfigurationException;
import org.mendoza.consultation.provider.ProviderException;
import org.mendoza.consultation.session.SessionNotFoundException;

public class ExceptionMappers {

    private static final Logger LOG = Logger.getLogger(ExceptionMappers.class);

    @ServerExceptionMapper
    public Response configurationError(ProviderConfigurationException e) {
        LOG.error("Video provider is not configured: " + e.getMessage());
        return error(Response.Status.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ServerExceptionMapper
    public Response providerError(ProviderException e) {
        LOG.errorf(e, "Video provider call failed");
        return error(Response.Status.BAD_GATEWAY, e.getMessage());
    }

    @ServerExceptionMapper
    public Response notFound(SessionNotFoundException e) {
        return error(Response.Status.NOT_FOUND, e.getMessage());
    }

    @ServerExceptionMapper
    public Response badRequest(IllegalArgumentException e) {
        return error(Response.Status.BAD_REQUEST, e.getMessage());
    }

    private static Response error(Response.Status status, String message) {
        String body = new JsonObject().put("status", "error").put("message", message).encode();
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(body).build();
    }
}
