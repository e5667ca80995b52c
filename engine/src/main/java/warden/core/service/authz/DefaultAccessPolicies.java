package warden.core.service.authz;

import static warden.core.model.authz.PermissionAction.APPROVE;
import static warden.core.model.authz.PermissionAction.CREATE;
import static warden.core.model.authz.PermissionAction.DELETE;
import static warden.core.model.authz.PermissionAction.MANAGE;
import static warden.core.model.authz.PermissionAction.READ;
import static warden.core.model.authz.PermissionAction.UPDATE;

import java.time.Instant;
import java.util.List;

import warden.core.model.authz.ConditionOperator;
import warden.core.model.authz.ConditionType;
import warden.core.model.authz.Permission;
import warden.core.model.authz.PermissionCondition;
import warden.core.model.authz.PermissionPolicy;
import warden.core.model.authz.PermissionResourceType;
import warden.core.model.authz.PermissionRule;
import warden.core.model.authz.PermissionScope;
import warden.core.model.authz.PolicyPriority;
import warden.core.model.authz.Role;
import warden.core.model.authz.RuleEffect;

/**
 * Built-in roles and policies seeded into every policy store.
 */
public final class DefaultAccessPolicies {

    public static final String ADMIN_ROLE = "admin";
    public static final String MANAGER_ROLE = "manager";
    public static final String USER_ROLE = "user";
    public static final String VIEWER_ROLE = "viewer";
    public static final String SECURITY_POLICY = "security-policy";
    public static final String SYSTEM_ACTOR = "system";

    private DefaultAccessPolicies() {
        // Utility class - prevent instantiation
    }

    public static List<Role> systemRoles(Instant at) {
        return List.of(
                systemRole(
                        ADMIN_ROLE,
                        "Administrator",
                        "Full system access",
                        at,
                        Permission.allow(CREATE, PermissionResourceType.ANY),
                        Permission.allow(READ, PermissionResourceType.ANY),
                        Permission.allow(UPDATE, PermissionResourceType.ANY),
                        Permission.allow(DELETE, PermissionResourceType.ANY),
                        Permission.allow(MANAGE, PermissionResourceType.ANY)),
                systemRole(
                        MANAGER_ROLE,
                        "Manager",
                        "Team management access",
                        at,
                        Permission.allow(CREATE, PermissionResourceType.DOCUMENT),
                        Permission.allow(READ, PermissionResourceType.DOCUMENT),
                        Permission.allow(UPDATE, PermissionResourceType.DOCUMENT),
                        Permission.allow(APPROVE, PermissionResourceType.DOCUMENT),
                        Permission.allow(MANAGE, PermissionResourceType.TEAM)),
                systemRole(
                        USER_ROLE,
                        "User",
                        "Standard user access",
                        at,
                        Permission.allow(CREATE, PermissionResourceType.DOCUMENT),
                        Permission.allow(READ, PermissionResourceType.DOCUMENT),
                        Permission.allow(UPDATE, PermissionResourceType.OWN_DOCUMENT)),
                systemRole(
                        VIEWER_ROLE,
                        "Viewer",
                        "Read-only access",
                        at,
                        Permission.allow(READ, PermissionResourceType.DOCUMENT)));
    }

    /**
     * Global policy granting everything to principals whose {@code role} attribute is
     * {@code admin}, and to the owner of a resource.
     */
    public static PermissionPolicy securityPolicy(Instant at) {
        return PermissionPolicy.builder(SECURITY_POLICY, "Security Policy")
                .description("Default security policy for the organization")
                .rules(List.of(
                        new PermissionRule(
                                "admin-full-access",
                                List.of(PermissionCondition.of(
                                        ConditionType.USER_ATTRIBUTE, "role", ConditionOperator.EQUALS, "admin")),
                                RuleEffect.ALLOW),
                        new PermissionRule(
                                "owner-access",
                                List.of(PermissionCondition.of(
                                        ConditionType.RESOURCE_ATTRIBUTE,
                                        "owner",
                                        ConditionOperator.EQUALS,
                                        PermissionCondition.PRINCIPAL_PLACEHOLDER)),
                                RuleEffect.ALLOW)))
                .scope(PermissionScope.GLOBAL, null)
                .priority(PolicyPriority.HIGH)
                .createdBy(SYSTEM_ACTOR)
                .createdAt(at)
                .build();
    }

    private static Role systemRole(String id, String name, String description, Instant at, Permission... permissions) {
        return Role.builder(id)
                .name(name)
                .description(description)
                .permissions(List.of(permissions))
                .systemRole(true)
                .createdAt(at)
                .build();
    }
}
