package com.bulletin.lifecycle.auth;

import com.bulletin.lifecycle.admin.AdministratorRecord;
import com.bulletin.lifecycle.admin.AdministratorRegistry;
import com.bulletin.lifecycle.chain.ChainRecordCodec;
import com.bulletin.lifecycle.chain.InMemoryRevisionChainStore;
import com.bulletin.lifecycle.metrics.MetricsService;
import com.bulletin.lifecycle.status.StatusStateMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthorizationGuard Tests")
class AuthorizationGuardTest {

    private AdministratorRegistry registry;
    private InMemoryAgentDirectory directory;
    @Mock
    private MetricsService metrics;
    private AuthorizationGuard guard;

    @BeforeEach
    void setUp() {
        registry = new AdministratorRegistry(
                new InMemoryRevisionChainStore<>(new ChainRecordCodec<>(AdministratorRecord.class)),
                new StatusStateMachine());
        directory = new InMemoryAgentDirectory();
        guard = new AuthorizationGuard(registry, directory, metrics, "progenitor-key");
    }

    @Test
    @DisplayName("Should let the progenitor register the first administrator only")
    void bootstrap() {
        assertTrue(guard.requireCanRegisterAdministrator("progenitor-key"));

        registry.register("progenitor-key", "alice", List.of("alice-key"));

        assertThrows(UnauthorizedException.class, () -> guard.requireCanRegisterAdministrator("progenitor-key"));
        assertFalse(guard.requireCanRegisterAdministrator("alice-key"));
    }

    @Test
    @DisplayName("Should refuse bootstrap to anyone but the progenitor")
    void bootstrapOnlyForProgenitor() {
        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> guard.requireCanRegisterAdministrator("stranger"));

        assertEquals("stranger", e.getAgentKey());
        verify(metrics).incrementUnauthorized();
    }

    @Test
    @DisplayName("Should disable bootstrap when no progenitor is configured")
    void noProgenitor() {
        AuthorizationGuard closed = new AuthorizationGuard(registry, directory, metrics, null);

        assertFalse(closed.isProgenitor(null));
        assertThrows(UnauthorizedException.class, () -> closed.requireCanRegisterAdministrator("anyone"));
    }

    @Test
    @DisplayName("Should refuse mutations by non-administrators")
    void nonAdministrator() {
        registry.register("progenitor-key", "alice", List.of("alice-key"));

        assertThrows(UnauthorizedException.class, () -> guard.requireCanMutate("mallory-key", "bob"));
        assertThrows(UnauthorizedException.class, () -> guard.requireCanMutate(null, "bob"));
        verify(metrics, times(2)).incrementUnauthorized();
    }

    @Test
    @DisplayName("Should refuse an administrator acting on its own entity")
    void noSelfMutation() {
        registry.register("progenitor-key", "alice-admin", List.of("alice-key"));
        directory.link("alice-key", "alice-user");

        assertThrows(UnauthorizedException.class, () -> guard.requireCanMutate("alice-key", "alice-user"));
        assertThrows(UnauthorizedException.class, () -> guard.requireCanMutate("alice-key", "alice-admin"));
        assertDoesNotThrow(() -> guard.requireCanMutate("alice-key", "bob-user"));
    }
}
