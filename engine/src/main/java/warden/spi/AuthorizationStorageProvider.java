package warden.spi;

import warden.core.port.out.AccessControlListRepository;
import warden.core.port.out.AuditLogRepository;
import warden.core.port.out.DirectGrantRepository;
import warden.core.port.out.PolicyRepository;
import warden.core.port.out.ResourcePermissionsRepository;
import warden.core.port.out.RoleAssignmentRepository;
import warden.core.port.out.RoleRepository;

/**
 * Service Provider Interface for durable authorization storage.
 *
 * <p>A provider supplies every repository the engine persists to. Providers are
 * discovered via {@link java.util.ServiceLoader} at startup.
 *
 * <h2>How to Create a Custom Provider</h2>
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>Create META-INF/services/warden.spi.AuthorizationStorageProvider</li>
 *   <li>Add your fully qualified class name to the file</li>
 *   <li>Configure: warden.storage.provider=your-provider-name</li>
 * </ol>
 *
 * <p>Each {@code create*} method is called once; repositories are application-scoped.
 */
public interface AuthorizationStorageProvider {

    /**
     * Unique name identifying this provider.
     *
     * <p>Used in configuration: warden.storage.provider={name}
     *
     * @return The provider name
     */
    String name();

    /**
     * Human-readable description of this provider.
     *
     * @return Description for logging and diagnostics
     */
    default String description() {
        return name() + " storage provider";
    }

    /**
     * Priority for auto-selection when no explicit provider is configured.
     * Higher values are preferred. The built-in memory provider uses 0.
     *
     * @return The provider priority
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this provider can be used (dependencies present, etc.).
     *
     * @return true if available
     */
    default boolean isAvailable() {
        return true;
    }

    RoleRepository createRoleRepository(StorageAdapterConfig config);

    RoleAssignmentRepository createRoleAssignmentRepository(StorageAdapterConfig config);

    PolicyRepository createPolicyRepository(StorageAdapterConfig config);

    ResourcePermissionsRepository createResourcePermissionsRepository(StorageAdapterConfig config);

    AccessControlListRepository createAccessControlListRepository(StorageAdapterConfig config);

    DirectGrantRepository createDirectGrantRepository(StorageAdapterConfig config);

    AuditLogRepository createAuditLogRepository(StorageAdapterConfig config);
}
