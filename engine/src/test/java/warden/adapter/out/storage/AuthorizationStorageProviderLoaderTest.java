package warden.adapter.out.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.storage.memory.InMemoryAuthorizationStorageProvider;
import warden.spi.AuthorizationStorageProvider;
import warden.spi.StorageProviderException;

@DisplayName("AuthorizationStorageProviderLoader")
class AuthorizationStorageProviderLoaderTest {

    private static AuthorizationStorageProvider provider(String name, int priority, boolean available) {
        final var provider = mock(AuthorizationStorageProvider.class);
        when(provider.name()).thenReturn(name);
        when(provider.priority()).thenReturn(priority);
        when(provider.isAvailable()).thenReturn(available);
        return provider;
    }

    @Nested
    @DisplayName("selectProvider")
    class SelectProvider {

        @Test
        @DisplayName("should pick the configured provider by name")
        void shouldPickConfiguredProvider() {
            final var memory = provider("memory", 0, true);
            final var jdbc = provider("jdbc", 10, true);

            assertSame(memory, AuthorizationStorageProviderLoader.selectProvider(List.of(memory, jdbc), "memory"));
        }

        @Test
        @DisplayName("should fail when the configured provider is unknown")
        void shouldFailForUnknownProvider() {
            final var memory = provider("memory", 0, true);

            final var error = assertThrows(
                    StorageProviderException.class,
                    () -> AuthorizationStorageProviderLoader.selectProvider(List.of(memory), "cassandra"));

            assertTrue(error.getMessage().startsWith("Configured storage provider not found: cassandra"));
        }

        @Test
        @DisplayName("should pick the highest priority available provider when none is configured")
        void shouldPickHighestPriorityAvailable() {
            final var memory = provider("memory", 0, true);
            final var offline = provider("offline", 50, false);
            final var jdbc = provider("jdbc", 10, true);

            assertSame(jdbc, AuthorizationStorageProviderLoader.selectProvider(List.of(memory, offline, jdbc), " "));
        }

        @Test
        @DisplayName("should fail when no provider is available")
        void shouldFailWhenNoneAvailable() {
            assertThrows(
                    StorageProviderException.class,
                    () -> AuthorizationStorageProviderLoader.selectProvider(List.of(), null));
        }
    }

    @Test
    @DisplayName("in-memory provider is always available at the lowest priority")
    void inMemoryProviderDefaults() {
        final var memory = new InMemoryAuthorizationStorageProvider();

        assertEquals("memory", memory.name());
        assertEquals(0, memory.priority());
        assertTrue(memory.isAvailable());
    }
}
