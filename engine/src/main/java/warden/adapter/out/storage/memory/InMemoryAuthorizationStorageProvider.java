package warden.adapter.out.storage.memory;

import warden.core.port.out.AccessControlListRepository;
import warden.core.port.out.AuditLogRepository;
import warden.core.port.out.DirectGrantRepository;
import warden.core.port.out.PolicyRepository;
import warden.core.port.out.ResourcePermissionsRepository;
import warden.core.port.out.RoleAssignmentRepository;
import warden.core.port.out.RoleRepository;
import warden.spi.AuthorizationStorageProvider;
import warden.spi.StorageAdapterConfig;

/**
 * In-memory authorization storage provider.
 *
 * <p>Lowest priority (0). Used as the default when no persistent provider is
 * configured. Data is lost on restart.
 */
public class InMemoryAuthorizationStorageProvider implements AuthorizationStorageProvider {

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory authorization storage (non-persistent, for dev/testing)";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public RoleRepository createRoleRepository(StorageAdapterConfig config) {
        return new InMemoryRoleRepository();
    }

    @Override
    public RoleAssignmentRepository createRoleAssignmentRepository(StorageAdapterConfig config) {
        return new InMemoryRoleAssignmentRepository();
    }

    @Override
    public PolicyRepository createPolicyRepository(StorageAdapterConfig config) {
        return new InMemoryPolicyRepository();
    }

    @Override
    public ResourcePermissionsRepository createResourcePermissionsRepository(StorageAdapterConfig config) {
        return new InMemoryResourcePermissionsRepository();
    }

    @Override
    public AccessControlListRepository createAccessControlListRepository(StorageAdapterConfig config) {
        return new InMemoryAccessControlListRepository();
    }

    @Override
    public DirectGrantRepository createDirectGrantRepository(StorageAdapterConfig config) {
        return new InMemoryDirectGrantRepository();
    }

    @Override
    public AuditLogRepository createAuditLogRepository(StorageAdapterConfig config) {
        return new InMemoryAuditLogRepository();
    }
}
