package warden.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.audit.AuditEntry;
import warden.core.model.audit.AuditQuery;

/**
 * Port interface for durable audit trail storage.
 *
 * <p>The store is append-only. Implementations must preserve append order.
 */
public interface AuditLogRepository {

    /**
     * Append an entry.
     *
     * @param entry the entry
     * @return Uni completing when stored
     */
    Uni<Void> append(AuditEntry entry);

    /**
     * Retrieve entries matching a query in sequence order.
     *
     * @param query the filter
     * @return Uni with matching entries
     */
    Uni<List<AuditEntry>> find(AuditQuery query);

    /**
     * Highest sequence number stored, so a restarted trail can continue numbering.
     *
     * @return Uni with the highest sequence, or 0 when empty
     */
    Uni<Long> highestSequence();
}
