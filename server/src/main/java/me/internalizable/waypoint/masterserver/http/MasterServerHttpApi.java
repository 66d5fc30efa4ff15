package me.internalizable.waypoint.masterserver.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import me.internalizable.waypoint.api.masterserver.ListingValidationException;
import me.internalizable.waypoint.api.masterserver.MasterServerAPI;
import me.internalizable.waypoint.api.masterserver.ModInfo;
import me.internalizable.waypoint.api.masterserver.VerificationTimeoutException;
import me.internalizable.waypoint.masterserver.registration.ListingPolicy;
import me.internalizable.waypoint.masterserver.registration.ListingValidator;
import me.internalizable.waypoint.masterserver.registry.EndpointKey;
import me.internalizable.waypoint.masterserver.registry.Listing;
import me.internalizable.waypoint.masterserver.registry.ListingCodec;
import me.internalizable.waypoint.masterserver.registry.ListingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * HTTP front end of the master server.
 *
 * <h2>Routes</h2>
 * <pre>
 * POST /api/servers/add             register or refresh a listing
 * POST /api/servers                 list servers
 * POST /api/server/byToken          find a hidden listing by its token
 * POST /api/servers/verifyPassword  check a join password
 * </pre>
 *
 * <p>Request bodies are JSON. Numeric and boolean fields are accepted both
 * as JSON values and as strings.</p>
 */
public class MasterServerHttpApi {

    private static final Logger LOGGER = LoggerFactory.getLogger(MasterServerHttpApi.class);

    static final String INTERNAL_ERROR = "An internal server error occurred.";
    static final String PLAYER_COUNT_ERROR = "Player count must be a whole number.";

    private static final List<String> CLIENT_IP_HEADERS = List.of("Cf-Pseudo-IPv4", "cf-connecting-ip", "x-forwarded-for");
    private static final String REGION_HEADER = "cf-ipcountry";
    private static final String PLACEHOLDER_IP = "::1";

    private static final TypeReference<Map<String, Object>> MOD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper = new ObjectMapper();
    private final MasterServerAPI api;
    private final ListingStore store;
    private final ListingPolicy policy;
    private final String apiKey;

    private Javalin app;

    /**
     * Create the HTTP API.
     *
     * @param api master server API
     * @param store listing store, read for the public listing form
     * @param policy version policy
     * @param apiKey admin key unlocking hidden listings, empty to disable
     */
    public MasterServerHttpApi(
            @Nonnull MasterServerAPI api,
            @Nonnull ListingStore store,
            @Nonnull ListingPolicy policy,
            @Nonnull String apiKey) {
        this.api = Objects.requireNonNull(api, "api");
        this.store = Objects.requireNonNull(store, "store");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
    }

    // ==================== Lifecycle ====================

    /**
     * Start listening.
     *
     * @param host bind address
     * @param port bind port, 0 for any free port
     */
    public synchronized void start(@Nonnull String host, int port) {
        if (app != null) {
            throw new IllegalStateException("HTTP API already started");
        }

        app = Javalin.create(config -> config.showJavalinBanner = false);
        app.post("/api/servers/add", this::handleAdd);
        app.post("/api/servers", this::handleList);
        app.post("/api/server/byToken", this::handleByToken);
        app.post("/api/servers/verifyPassword", this::handleVerifyPassword);
        app.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled error on {}", ctx.path(), e);
            ctx.status(HttpStatus.INTERNAL_SERVER_ERROR).json(error(INTERNAL_ERROR));
        });

        app.start(host, port);
        LOGGER.info("HTTP API listening on {}:{}", host, app.port());
    }

    /**
     * Stop listening.
     */
    public synchronized void stop() {
        if (app != null) {
            app.stop();
            app = null;
            LOGGER.info("HTTP API stopped");
        }
    }

    /**
     * Get the bound port.
     *
     * @return port, or -1 if not started
     */
    public synchronized int getPort() {
        return app != null ? app.port() : -1;
    }

    // ==================== Handlers ====================

    private void handleAdd(Context ctx) {
        JsonNode body = readBody(ctx);
        if (body == null) {
            return;
        }

        MasterServerAPI.Registration registration;
        try {
            registration = MasterServerAPI.Registration.builder()
                    .name(text(body, "name"))
                    .description(text(body, "description"))
                    .map(text(body, "map"))
                    .version(text(body, "version"))
                    .playlist(text(body, "playlist"))
                    .key(text(body, "key"))
                    .ip(clientIp(ctx))
                    .port(intField(body, "port", ListingCodec.DEFAULT_PORT, 0, 65535,
                            "Port must be in the range 0-65535"))
                    .playerCount(intField(body, "numPlayers",
                            intField(body, "playerCount", 0, Integer.MIN_VALUE, Integer.MAX_VALUE, PLAYER_COUNT_ERROR),
                            Integer.MIN_VALUE, Integer.MAX_VALUE, PLAYER_COUNT_ERROR))
                    .maxPlayers(intField(body, "maxPlayers", 0, ListingValidator.MIN_PLAYERS,
                            ListingValidator.MAX_PLAYERS, "Max players must be between 1 and 128 players."))
                    .checksum(number(body, "checksum", 0))
                    .hidden(bool(body, "hidden"))
                    .password(text(body, "password"))
                    .region(ctx.header(REGION_HEADER))
                    .requiredMods(requiredMods(body.get("requiredMods")))
                    .enabledMods(enabledMods(body.get("enabledMods")))
                    .build();
        } catch (ListingValidationException e) {
            ctx.status(HttpStatus.BAD_REQUEST).json(error(e.getMessage()));
            return;
        }

        ctx.future(() -> api.registerServer(registration).handle((outcome, error) -> {
            if (error == null) {
                Map<String, Object> response = new LinkedHashMap<>();
                response.put("success", true);
                response.put("token", outcome.getToken());
                response.put("ip", outcome.getIp());
                response.put("port", outcome.getPort());
                ctx.json(response);
                return null;
            }

            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (cause instanceof VerificationTimeoutException) {
                Map<String, Object> response = error(cause.getMessage());
                response.put("timeout", true);
                ctx.status(HttpStatus.BAD_REQUEST).json(response);
            } else if (cause instanceof ListingValidationException) {
                ctx.status(HttpStatus.BAD_REQUEST).json(error(cause.getMessage()));
            } else {
                LOGGER.error("Registration from {} failed", registration.getIp(), cause);
                ctx.status(HttpStatus.INTERNAL_SERVER_ERROR).json(error(INTERNAL_ERROR));
            }
            return null;
        }));
    }

    private void handleList(Context ctx) {
        JsonNode body = readBody(ctx);
        if (body == null) {
            return;
        }

        String version = text(body, "version");
        boolean typed = policy.usesRealTypes(version);
        if (version != null && !version.isEmpty() && !policy.isVersionSupported(version)) {
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("servers", updateRequiredListings(typed));
            ctx.json(response);
            return;
        }

        boolean admin = !apiKey.isEmpty() && apiKey.equals(text(body, "password"));

        List<Map<String, Object>> servers = store.getAll().stream()
                .filter(listing -> admin || !listing.hidden())
                .filter(listing -> admin || version == null || version.equals(listing.version()))
                .sorted(Comparator.comparingInt(Listing::playerCount).reversed())
                .map(listing -> {
                    Map<String, Object> view = ListingCodec.toView(listing, typed);
                    if (!admin) {
                        view.remove("version");
                    }
                    return view;
                })
                .collect(Collectors.toList());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("servers", servers);
        ctx.json(response);
    }

    /**
     * Placeholder entries shown in place of real listings to clients whose
     * version is no longer supported.
     */
    private List<Map<String, Object>> updateRequiredListings(boolean typed) {
        String updateUrl = policy.getUpdateUrl();
        return List.of(
                placeholder("--- UPDATE REQUIRED ---",
                        "Your version is no longer supported. Please update to continue playing.",
                        "Visit: " + updateUrl, typed),
                placeholder("Get the New Version Here",
                        "^A100FF00The download link is at " + updateUrl + ".",
                        updateUrl, typed));
    }

    private static Map<String, Object> placeholder(String name, String description, String playlist, boolean typed) {
        Listing listing = new Listing(new EndpointKey(PLACEHOLDER_IP, 0), name, description, "", playlist, 0, 0, "",
                List.of(), List.of(), "", 0, null, false, null);
        Map<String, Object> view = ListingCodec.toView(listing, typed);
        view.remove("version");
        return view;
    }

    private void handleByToken(Context ctx) {
        JsonNode body = readBody(ctx);
        if (body == null) {
            return;
        }

        String token = text(body, "token");
        if (token == null || token.isEmpty()) {
            ctx.status(HttpStatus.BAD_REQUEST).json(error("Missing token."));
            return;
        }

        Listing listing = store.getByToken(token);
        if (listing == null) {
            ctx.json(error("Server not found."));
            return;
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("server", ListingCodec.toView(listing, policy.usesRealTypes(text(body, "version"))));
        ctx.json(response);
    }

    private void handleVerifyPassword(Context ctx) {
        JsonNode body = readBody(ctx);
        if (body == null) {
            return;
        }

        String ip = text(body, "ip");
        long port = number(body, "port", 0);
        String password = text(body, "password");
        if (ip == null || ip.isEmpty() || port <= 0 || port > 65535 || password == null || password.isEmpty()) {
            ctx.status(HttpStatus.BAD_REQUEST).json(error("Missing required fields."));
            return;
        }

        switch (api.verifyPassword(ip, (int) port, password)) {
            case ACCEPTED -> ctx.json(Map.of("success", true));
            case NOT_FOUND -> ctx.status(HttpStatus.NOT_FOUND).json(error("Server not found."));
            case NOT_PROTECTED -> ctx.status(HttpStatus.BAD_REQUEST).json(error("Server is not password protected."));
            case INCORRECT -> ctx.status(HttpStatus.UNAUTHORIZED).json(error("Incorrect password."));
        }
    }

    // ==================== Request Helpers ====================

    /**
     * Resolve the caller's public address, preferring proxy headers.
     *
     * @param ctx request context
     * @return caller address
     */
    @Nonnull
    static String clientIp(@Nonnull Context ctx) {
        for (String header : CLIENT_IP_HEADERS) {
            String value = ctx.header(header);
            if (value != null && !value.isBlank()) {
                return value.split(",")[0].trim();
            }
        }
        return ctx.ip();
    }

    @Nullable
    private JsonNode readBody(Context ctx) {
        try {
            JsonNode body = mapper.readTree(ctx.body());
            if (body == null || !body.isObject()) {
                ctx.status(HttpStatus.BAD_REQUEST).json(error("Invalid request body."));
                return null;
            }
            return body;
        } catch (JsonProcessingException e) {
            ctx.status(HttpStatus.BAD_REQUEST).json(error("Invalid request body."));
            return null;
        }
    }

    @Nullable
    static String text(@Nonnull JsonNode body, @Nonnull String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    static long number(@Nonnull JsonNode body, @Nonnull String field, long fallback) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isNumber()) {
            return node.isIntegralNumber() && node.canConvertToLong() ? node.asLong() : fallback;
        }
        try {
            return Long.parseLong(node.asText().trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    /**
     * Read an integer field that must fall within a range.
     *
     * <p>Absent or null fields give the fallback. Values outside the range,
     * fractional numbers and unparseable strings are rejected rather than
     * narrowed.</p>
     *
     * @throws ListingValidationException with the given message if the value is not acceptable
     */
    static int intField(@Nonnull JsonNode body, @Nonnull String field, int fallback, int min, int max,
                        @Nonnull String message) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }

        long value;
        if (node.isNumber()) {
            if (!node.isIntegralNumber() || !node.canConvertToLong()) {
                throw new ListingValidationException(message);
            }
            value = node.asLong();
        } else {
            try {
                value = Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new ListingValidationException(message);
            }
        }

        if (value < min || value > max) {
            throw new ListingValidationException(message);
        }
        return (int) value;
    }

    static boolean bool(@Nonnull JsonNode body, @Nonnull String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return false;
        }
        return node.isBoolean() ? node.asBoolean() : "true".equalsIgnoreCase(node.asText());
    }

    private List<String> requiredMods(@Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isTextual()) {
            return ListingCodec.readRequiredMods(node.asText());
        }
        List<String> ids = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.isTextual()) {
                    ids.add(element.asText());
                }
            }
        }
        return ids;
    }

    private List<ModInfo> enabledMods(@Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isTextual()) {
            return ListingCodec.readEnabledMods(node.asText());
        }
        List<ModInfo> mods = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.isObject()) {
                    mods.add(ListingCodec.modFromMap(mapper.convertValue(element, MOD_TYPE)));
                }
            }
        }
        return mods;
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", false);
        response.put("error", message);
        return response;
    }
}
