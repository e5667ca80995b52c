package warden.core.model.authz;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Request metadata accompanying a decision.
 *
 * <p>Contextual and environmental conditions read their values from here, and
 * the flat {@link #toMap()} projection is recorded on the audit entry.
 *
 * @param requestTime    when the request was made, null to use the engine clock
 * @param clientIp       caller IP address
 * @param userAgent      caller user agent
 * @param deviceId       caller device identifier
 * @param location       caller location
 * @param sessionId      caller session identifier
 * @param additionalData free-form additional attributes
 */
public record PermissionContext(
        Instant requestTime,
        String clientIp,
        String userAgent,
        String deviceId,
        String location,
        String sessionId,
        Map<String, String> additionalData) {

    public static final String REQUEST_TIME = "requestTime";
    public static final String CLIENT_IP = "clientIp";
    public static final String USER_AGENT = "userAgent";
    public static final String DEVICE_ID = "deviceId";
    public static final String LOCATION = "location";
    public static final String SESSION_ID = "sessionId";

    public PermissionContext {
        additionalData = additionalData == null ? Map.of() : Map.copyOf(additionalData);
    }

    public static PermissionContext empty() {
        return new PermissionContext(null, null, null, null, null, null, Map.of());
    }

    /**
     * Look up a context attribute by name. Named fields take precedence over
     * additional data.
     */
    public Optional<String> attribute(String name) {
        final var value = toMap().get(name);
        return Optional.ofNullable(value);
    }

    public Map<String, String> toMap() {
        final var map = new LinkedHashMap<String, String>(additionalData);
        putIfPresent(map, REQUEST_TIME, requestTime != null ? requestTime.toString() : null);
        putIfPresent(map, CLIENT_IP, clientIp);
        putIfPresent(map, USER_AGENT, userAgent);
        putIfPresent(map, DEVICE_ID, deviceId);
        putIfPresent(map, LOCATION, location);
        putIfPresent(map, SESSION_ID, sessionId);
        return map;
    }

    private static void putIfPresent(Map<String, String> map, String key, String value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
