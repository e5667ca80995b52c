package warden.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import warden.core.port.out.AccessControlListRepository;
import warden.core.port.out.AuditLogRepository;
import warden.core.port.out.DirectGrantRepository;
import warden.core.port.out.PolicyRepository;
import warden.core.port.out.ResourcePermissionsRepository;
import warden.core.port.out.RoleAssignmentRepository;
import warden.core.port.out.RoleRepository;
import warden.spi.AuthorizationStorageProvider;
import warden.spi.StorageAdapterConfig;
import warden.spi.StorageProviderException;

/**
 * Discovers authorization storage providers via ServiceLoader and produces their repositories.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If warden.storage.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 *
 * <p>Thread-safety: Uses synchronized methods for lazy provider initialization
 * to ensure thread-safe access from CDI producer methods.
 */
@ApplicationScoped
public class AuthorizationStorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(AuthorizationStorageProviderLoader.class);

    private final Optional<String> configuredProvider;
    private final StorageAdapterConfig config;

    private AuthorizationStorageProvider storageProvider;

    @Inject
    public AuthorizationStorageProviderLoader(
            @ConfigProperty(name = "warden.storage.provider") Optional<String> configuredProvider,
            StorageAdapterConfig config) {
        this.configuredProvider = configuredProvider;
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public RoleRepository roleRepository() {
        return getStorageProvider().createRoleRepository(config);
    }

    @Produces
    @ApplicationScoped
    public RoleAssignmentRepository roleAssignmentRepository() {
        return getStorageProvider().createRoleAssignmentRepository(config);
    }

    @Produces
    @ApplicationScoped
    public PolicyRepository policyRepository() {
        return getStorageProvider().createPolicyRepository(config);
    }

    @Produces
    @ApplicationScoped
    public ResourcePermissionsRepository resourcePermissionsRepository() {
        return getStorageProvider().createResourcePermissionsRepository(config);
    }

    @Produces
    @ApplicationScoped
    public AccessControlListRepository accessControlListRepository() {
        return getStorageProvider().createAccessControlListRepository(config);
    }

    @Produces
    @ApplicationScoped
    public DirectGrantRepository directGrantRepository() {
        return getStorageProvider().createDirectGrantRepository(config);
    }

    @Produces
    @ApplicationScoped
    public AuditLogRepository auditLogRepository() {
        return getStorageProvider().createAuditLogRepository(config);
    }

    synchronized AuthorizationStorageProvider getStorageProvider() {
        if (storageProvider != null) {
            return storageProvider;
        }

        final List<AuthorizationStorageProvider> providers = new ArrayList<>();
        ServiceLoader.load(AuthorizationStorageProvider.class).forEach(providers::add);

        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No authorization storage providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d authorization storage provider(s): %s",
                providers.size(),
                providers.stream().map(AuthorizationStorageProvider::name).toList());

        storageProvider = selectProvider(providers, configuredProvider.orElse(null));
        LOG.infof("Using authorization storage provider: %s (%s)", storageProvider.name(), storageProvider.description());

        return storageProvider;
    }

    static AuthorizationStorageProvider selectProvider(List<AuthorizationStorageProvider> providers, String configured) {
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured storage provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(AuthorizationStorageProvider::name).toList()));
        }

        return providers.stream()
                .filter(AuthorizationStorageProvider::isAvailable)
                .max(Comparator.comparingInt(AuthorizationStorageProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available authorization storage providers"));
    }
}
