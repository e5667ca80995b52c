package warden.adapter.in.dto;

import java.util.List;

import warden.core.model.authz.Permission;

/**
 * DTO for role update requests.
 *
 * <p>All fields are optional. Only non-null fields are updated.
 *
 * @param name        new name (null to keep current)
 * @param description new description (null to keep current)
 * @param permissions new permission list (null to keep current)
 */
public record UpdateRoleRequest(String name, String description, List<Permission> permissions) {}
