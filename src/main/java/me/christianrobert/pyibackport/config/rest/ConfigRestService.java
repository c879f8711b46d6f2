package me.christianrobert.pyibackport.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.pyibackport.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigRestService {

    private static final Logger log = LoggerFactory.getLogger(ConfigRestService.class);

    @Inject
    ConfigService configService;

    @GET
    public Response getConfiguration() {
        log.info("Getting configuration");
        return Response.ok(configService.getAllConfiguration()).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        if (config == null) {
            return badRequest("Request body must be a configuration map");
        }
        log.info("Saving configuration with {} entries", config.size());

        try {
            configService.updateConfiguration(config);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected configuration: {}", e.getMessage());
            return badRequest(e.getMessage());
        }
        return Response.ok(status("success", "Configuration saved successfully")).build();
    }

    @GET
    @Path("/{key}")
    public Response getConfigValue(@PathParam("key") String key) {
        log.debug("Getting config value for key: {}", key);

        Object value = configService.getConfigValue(key);
        if (value == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "Configuration key not found: " + key))
                    .build();
        }

        return Response.ok(Map.of("key", key, "value", value)).build();
    }

    @PUT
    @Path("/{key}")
    public Response setConfigValue(@PathParam("key") String key, Map<String, Object> body) {
        log.debug("Setting config value for key: {}", key);

        if (body == null || body.get("value") == null) {
            return badRequest("Request body must contain 'value' field");
        }

        Object value;
        try {
            value = configService.setConfigValue(key, body.get("value"));
        } catch (IllegalArgumentException e) {
            log.warn("Rejected value for {}: {}", key, e.getMessage());
            return badRequest(e.getMessage());
        }

        Map<String, Object> response = new HashMap<>(status("success", "Configuration value updated successfully"));
        response.put("key", key);
        response.put("value", value);
        return Response.ok(response).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        log.info("Resetting configuration to defaults");
        configService.resetToDefaults();
        return Response.ok(status("success", "Configuration reset to defaults successfully")).build();
    }

    private static Response badRequest(String message) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(Map.of("error", message))
                .build();
    }

    private static Map<String, String> status(String status, String message) {
        Map<String, String> response = new HashMap<>();
        response.put("status", status);
        response.put("message", message);
        return response;
    }
}
