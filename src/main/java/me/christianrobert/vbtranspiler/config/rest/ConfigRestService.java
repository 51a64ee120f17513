package me.christianrobert.vbtranspiler.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.vbtranspiler.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigRestService {

    private static final Logger log = LoggerFactory.getLogger(ConfigRestService.class);

    /** Shown in place of a configured secret; never written back. */
    static final String MASKED_SECRET = "****";

    @Inject
    ConfigService configService;

    @GET
    public Response getConfiguration() {
        log.info("Getting configuration");

        Map<String, Object> config = configService.getAllConfiguration();
        if (config.containsKey(ConfigService.AI_API_KEY)) {
            config.put(ConfigService.AI_API_KEY, mask(ConfigService.AI_API_KEY, config.get(ConfigService.AI_API_KEY)));
        }
        return Response.ok(config).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        if (config == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Request body must be a JSON object"))
                    .build();
        }
        log.info("Saving configuration with {} entries", config.size());

        try {
            configService.updateConfiguration(withoutMaskedSecrets(config));

            Map<String, String> response = new HashMap<>();
            response.put("status", "success");
            response.put("message", "Configuration saved successfully");

            return Response.ok(response).build();
        } catch (Exception e) {
            log.error("Error saving configuration", e);

            Map<String, String> errorResponse = new HashMap<>();
            errorResponse.put("status", "error");
            errorResponse.put("message", "Failed to save configuration: " + e.getMessage());

            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(errorResponse)
                    .build();
        }
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

        return Response.ok(Map.of("key", key, "value", mask(key, value))).build();
    }

    @PUT
    @Path("/{key}")
    public Response setConfigValue(@PathParam("key") String key, Map<String, Object> body) {
        log.debug("Setting config value for key: {}", key);

        if (body == null || body.get("value") == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Request body must contain 'value' field"))
                    .build();
        }

        Object value = body.get("value");
        if (isMaskedSecret(key, value)) {
            log.debug("Ignoring masked placeholder for key: {}", key);
        } else {
            configService.setConfigValue(key, value);
        }

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Configuration value updated successfully");
        response.put("key", key);

        return Response.ok(response).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        log.info("Resetting configuration to defaults");

        try {
            configService.resetToDefaults();

            Map<String, String> response = new HashMap<>();
            response.put("status", "success");
            response.put("message", "Configuration reset to defaults successfully");

            return Response.ok(response).build();
        } catch (Exception e) {
            log.error("Error resetting configuration", e);

            Map<String, String> errorResponse = new HashMap<>();
            errorResponse.put("status", "error");
            errorResponse.put("message", "Failed to reset configuration: " + e.getMessage());

            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(errorResponse)
                    .build();
        }
    }

    static Object mask(String key, Object value) {
        if (ConfigService.AI_API_KEY.equals(key) && value != null && !String.valueOf(value).isEmpty()) {
            return MASKED_SECRET;
        }
        return value;
    }

    static boolean isMaskedSecret(String key, Object value) {
        return ConfigService.AI_API_KEY.equals(key) && MASKED_SECRET.equals(value);
    }

    /**
     * Copy of a posted configuration without secrets that still carry the masked placeholder, so
     * saving the form returned by GET keeps the stored key.
     */
    static Map<String, Object> withoutMaskedSecrets(Map<String, Object> config) {
        Map<String, Object> result = new HashMap<>(config);
        result.entrySet().removeIf(entry -> isMaskedSecret(entry.getKey(), entry.getValue()));
        return result;
    }
}
