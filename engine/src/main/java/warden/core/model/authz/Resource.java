package warden.core.model.authz;

import java.util.Map;
import java.util.Optional;

/**
 * A concrete resource an authorization decision targets.
 *
 * @param id         resource identifier, unique within the host application
 * @param type       kind of resource
 * @param attributes resource attributes used by conditions (e.g. {@code owner})
 */
public record Resource(String id, ResourceType type, Map<String, String> attributes) {

    public Resource {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Resource ID cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Resource type cannot be null");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static Resource of(String id, ResourceType type) {
        return new Resource(id, type, Map.of());
    }

    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }
}
