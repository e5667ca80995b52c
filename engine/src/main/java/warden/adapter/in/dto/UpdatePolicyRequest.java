package warden.adapter.in.dto;

import java.util.List;

import warden.core.model.authz.PermissionRule;

/**
 * DTO for policy update requests.
 *
 * <p>All fields are optional. Only non-null fields are updated.
 */
public record UpdatePolicyRequest(String name, String description, List<PermissionRule> rules, Boolean active) {}
