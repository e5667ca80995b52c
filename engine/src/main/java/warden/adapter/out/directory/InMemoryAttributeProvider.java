package warden.adapter.out.directory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.port.out.AttributeProvider;
import warden.spi.StorageAdapterConfig;

/**
 * Attribute registry for principals and resources.
 *
 * <p>The host application registers attributes at runtime. Static attributes can also be
 * declared in configuration:
 * <pre>{@code
 * warden.directory.principal.alice.role=admin
 * warden.directory.resource.doc-1.owner=bob
 * }</pre>
 *
 * <p>The attribute name is the last dot-separated segment of the key, so ids may contain dots.
 */
@ApplicationScoped
public class InMemoryAttributeProvider implements AttributeProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryAttributeProvider.class);

    static final String PRINCIPAL_PREFIX = "warden.directory.principal.";
    static final String RESOURCE_PREFIX = "warden.directory.resource.";

    private final Map<String, Map<String, String>> principals = new ConcurrentHashMap<>();
    private final Map<String, Map<String, String>> resources = new ConcurrentHashMap<>();

    public InMemoryAttributeProvider() {}

    @Inject
    public InMemoryAttributeProvider(StorageAdapterConfig config) {
        load(config.getWithPrefix(PRINCIPAL_PREFIX), PRINCIPAL_PREFIX, principals);
        load(config.getWithPrefix(RESOURCE_PREFIX), RESOURCE_PREFIX, resources);
        LOG.debugf(
                "Loaded directory attributes for %d principal(s) and %d resource(s)",
                principals.size(), resources.size());
    }

    public void registerPrincipalAttribute(String principalId, String attribute, String value) {
        principals.computeIfAbsent(principalId, k -> new ConcurrentHashMap<>()).put(attribute, value);
    }

    public void registerResourceAttribute(String resourceId, String attribute, String value) {
        resources.computeIfAbsent(resourceId, k -> new ConcurrentHashMap<>()).put(attribute, value);
    }

    public void clearPrincipal(String principalId) {
        principals.remove(principalId);
    }

    @Override
    public Optional<String> principalAttribute(String principalId, String attribute) {
        return lookup(principals, principalId, attribute);
    }

    @Override
    public Optional<String> resourceAttribute(String resourceId, String attribute) {
        return lookup(resources, resourceId, attribute);
    }

    private static Optional<String> lookup(Map<String, Map<String, String>> registry, String id, String attribute) {
        if (id == null || attribute == null) {
            return Optional.empty();
        }
        final var attributes = registry.get(id);
        return attributes == null ? Optional.empty() : Optional.ofNullable(attributes.get(attribute));
    }

    private static void load(Map<String, String> properties, String prefix, Map<String, Map<String, String>> target) {
        properties.forEach((key, value) -> {
            final var remainder = key.substring(prefix.length());
            final int split = remainder.lastIndexOf('.');
            if (split <= 0 || split == remainder.length() - 1) {
                LOG.warnf("Ignoring malformed directory attribute key: %s", key);
                return;
            }
            target.computeIfAbsent(remainder.substring(0, split), k -> new ConcurrentHashMap<>())
                    .put(remainder.substring(split + 1), value);
        });
    }
}
