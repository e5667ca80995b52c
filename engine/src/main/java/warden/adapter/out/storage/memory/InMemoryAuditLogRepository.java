package warden.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.audit.AuditEntry;
import warden.core.model.audit.AuditQuery;
import warden.core.port.out.AuditLogRepository;

/**
 * In-memory append-only audit log.
 *
 * <p>Entries are kept in append order. Queries return matches oldest first,
 * truncated to the query limit when one is set.
 */
public class InMemoryAuditLogRepository implements AuditLogRepository {

    private final List<AuditEntry> entries = new ArrayList<>();

    @Override
    public Uni<Void> append(AuditEntry entry) {
        return Uni.createFrom().item(() -> {
            synchronized (entries) {
                entries.add(entry);
            }
            return null;
        });
    }

    @Override
    public Uni<List<AuditEntry>> find(AuditQuery query) {
        return Uni.createFrom().item(() -> {
            synchronized (entries) {
                var matches = entries.stream().filter(query::matches);
                if (query.limit() > 0) {
                    matches = matches.limit(query.limit());
                }
                return matches.toList();
            }
        });
    }

    @Override
    public Uni<Long> highestSequence() {
        return Uni.createFrom().item(() -> {
            synchronized (entries) {
                return entries.stream().mapToLong(AuditEntry::sequence).max().orElse(0L);
            }
        });
    }
}
