package warden.adapter.in.dto;

import java.util.List;

import jakarta.validation.constraints.NotNull;

import warden.core.model.authz.AclEntry;

/**
 * DTO replacing the entries of an access control list.
 */
public record UpdateAclRequest(@NotNull(message = "entries are required") List<AclEntry> entries) {}
