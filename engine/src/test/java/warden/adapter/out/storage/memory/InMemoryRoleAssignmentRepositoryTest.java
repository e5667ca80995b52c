package warden.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.authz.RoleAssignment;

@DisplayName("InMemoryRoleAssignmentRepository")
class InMemoryRoleAssignmentRepositoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Test
    @DisplayName("should replace an assignment saved again under the same id")
    void shouldReplaceById() {
        final var repository = new InMemoryRoleAssignmentRepository();
        final var assignment = RoleAssignment.create("as-1", "ann", "viewer", null, "admin-1", NOW, null);
        repository.save(assignment).await().atMost(TIMEOUT);
        repository.save(RoleAssignment.create("as-2", "bob", "user", null, "admin-1", NOW, null))
                .await().atMost(TIMEOUT);

        repository.save(assignment.revoke("admin-1", "left team", NOW)).await().atMost(TIMEOUT);

        final var stored = repository.findByPrincipal("ann").await().atMost(TIMEOUT);
        assertEquals(1, stored.size());
        assertFalse(stored.get(0).active());
        assertEquals("left team", stored.get(0).revocationReason());
        assertEquals(2, repository.findAll().await().atMost(TIMEOUT).size());
    }
}
