package warden.core.port.out;

import java.util.Optional;

/**
 * Port interface resolving principal and resource attributes for condition evaluation.
 *
 * <p>Lookups are synchronous because they run inside a decision. Implementations
 * backed by remote directories should cache aggressively. A lookup that throws
 * makes the decision fail closed.
 */
public interface AttributeProvider {

    /**
     * Resolve an attribute of a principal (e.g. {@code role}, {@code department}).
     *
     * @param principalId the principal
     * @param attribute   attribute name
     * @return the value, or empty if the principal has no such attribute
     */
    Optional<String> principalAttribute(String principalId, String attribute);

    /**
     * Resolve an attribute of a resource not carried on the request.
     *
     * @param resourceId the resource
     * @param attribute  attribute name
     * @return the value, or empty if unknown
     */
    Optional<String> resourceAttribute(String resourceId, String attribute);
}
