package warden.adapter.in.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * DTO for copying a parent's resource grants onto a child resource.
 */
public record InheritPermissionsRequest(
        @NotBlank(message = "parentResourceId is required") String parentResourceId) {}
