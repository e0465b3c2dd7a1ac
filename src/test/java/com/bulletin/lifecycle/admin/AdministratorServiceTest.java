package com.bulletin.lifecycle.admin;

import com.bulletin.lifecycle.audit.AuditAction;
import com.bulletin.lifecycle.audit.AuditEntry;
import com.bulletin.lifecycle.audit.AuditService;
import com.bulletin.lifecycle.auth.AuthorizationGuard;
import com.bulletin.lifecycle.auth.InMemoryAgentDirectory;
import com.bulletin.lifecycle.auth.UnauthorizedException;
import com.bulletin.lifecycle.chain.ChainRecordCodec;
import com.bulletin.lifecycle.chain.InMemoryRevisionChainStore;
import com.bulletin.lifecycle.metrics.MetricsService;
import com.bulletin.lifecycle.status.StatusStateMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("AdministratorService Tests")
class AdministratorServiceTest {

    private MetricsService metrics;
    private AuditService auditService;
    private AdministratorService service;

    @BeforeEach
    void setUp() {
        AdministratorRegistry registry = new AdministratorRegistry(
                new InMemoryRevisionChainStore<>(new ChainRecordCodec<>(AdministratorRecord.class)),
                new StatusStateMachine());
        InMemoryAgentDirectory directory = new InMemoryAgentDirectory();
        directory.link("alice-key", "alice");
        metrics = mock(MetricsService.class);
        auditService = new AuditService();
        service = new AdministratorService(registry,
                new AuthorizationGuard(registry, directory, metrics, "progenitor"), auditService, metrics);
    }

    @Test
    @DisplayName("Should bootstrap the first administrator through the progenitor")
    void bootstrap() {
        service.registerAdministrator("progenitor", "alice", List.of("alice-key"));

        assertTrue(service.isAgentAdministrator("alice-key"));
        assertTrue(service.isEntityAdministrator("alice"));
        AuditEntry entry = auditService.getEntriesByAction(AuditAction.ADMINISTRATOR_REGISTERED).get(0);
        assertEquals(true, entry.details().get("bootstrap"));
        assertEquals("progenitor", entry.actorId());
        verify(metrics).incrementAdministratorChange("register");
    }

    @Test
    @DisplayName("Should only let administrators add further administrators")
    void onlyAdministratorsAdd() {
        service.registerAdministrator("progenitor", "alice", List.of("alice-key"));

        assertThrows(UnauthorizedException.class,
                () -> service.registerAdministrator("progenitor", "bob", List.of("bob-key")));
        assertThrows(UnauthorizedException.class,
                () -> service.registerAdministrator("bob-key", "bob", List.of("bob-key")));

        service.registerAdministrator("alice-key", "bob", List.of("bob-key"));
        assertEquals(List.of("alice", "bob"), service.getAllAdministrators());
    }

    @Test
    @DisplayName("Should refuse a non-administrator removing an administrator")
    void nonAdministratorCannotRemove() {
        service.registerAdministrator("progenitor", "alice", List.of("alice-key"));
        service.registerAdministrator("alice-key", "bob", List.of("bob-key"));

        assertThrows(UnauthorizedException.class,
                () -> service.removeAdministrator("mallory-key", "bob", List.of("bob-key")));
        assertTrue(service.isEntityAdministrator("bob"));
    }

    @Test
    @DisplayName("Should refuse an administrator removing itself")
    void noSelfRemoval() {
        service.registerAdministrator("progenitor", "alice", List.of("alice-key"));
        service.registerAdministrator("alice-key", "bob", List.of("bob-key"));

        assertThrows(UnauthorizedException.class,
                () -> service.removeAdministrator("bob-key", "bob", List.of("bob-key")));
    }

    @Test
    @DisplayName("Should remove another administrator and keep its history")
    void removesOther() {
        service.registerAdministrator("progenitor", "alice", List.of("alice-key"));
        service.registerAdministrator("alice-key", "bob", List.of("bob-key", "bob-phone"));

        service.removeAdministrator("alice-key", "bob", List.of("bob-key"));

        assertFalse(service.isAgentAdministrator("bob-key"));
        assertFalse(service.isAgentAdministrator("bob-phone"));
        assertEquals(List.of("alice"), service.getAllAdministrators());
        assertEquals(2, service.getAdministratorHistory("bob").size());
        assertEquals(1, auditService.getEntriesByAction(AuditAction.ADMINISTRATOR_REMOVED).size());
        verify(metrics).incrementAdministratorChange("remove");
    }

    @Test
    @DisplayName("Should refuse to register an active administrator twice")
    void alreadyAdministrator() {
        service.registerAdministrator("progenitor", "alice", List.of("alice-key"));

        assertThrows(AlreadyAdministratorException.class,
                () -> service.registerAdministrator("alice-key", "alice", List.of("alice-key")));
    }
}
