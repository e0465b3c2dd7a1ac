package com.bulletin.lifecycle.admin;

import com.bulletin.lifecycle.audit.AuditAction;
import com.bulletin.lifecycle.audit.AuditService;
import com.bulletin.lifecycle.auth.AuthorizationGuard;
import com.bulletin.lifecycle.chain.ChainRecord;
import com.bulletin.lifecycle.logging.LogContext;
import com.bulletin.lifecycle.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Guarded administrator management on top of {@link AdministratorRegistry}.
 * Every change is authorized, audited and counted.
 */
public class AdministratorService {
    private static final Logger log = LoggerFactory.getLogger(AdministratorService.class);

    private final AdministratorRegistry registry;
    private final AuthorizationGuard guard;
    private final AuditService auditService;
    private final MetricsService metricsService;

    public AdministratorService(AdministratorRegistry registry, AuthorizationGuard guard,
                                AuditService auditService, MetricsService metricsService) {
        this.registry = registry;
        this.guard = guard;
        this.auditService = auditService;
        this.metricsService = metricsService;
    }

    /**
     * Registers an administrator on behalf of {@code callerAgentKey}.
     *
     * @throws com.bulletin.lifecycle.auth.UnauthorizedException if the caller may not add administrators
     * @throws AlreadyAdministratorException if the entity is already active
     */
    public ChainRecord<AdministratorRecord> registerAdministrator(String callerAgentKey, String entityHash,
                                                                  List<String> agentKeys) {
        try (LogContext ctx = LogContext.forAdministration(LogContext.generateCorrelationId(), entityHash, "register")) {
            boolean bootstrap = guard.requireCanRegisterAdministrator(callerAgentKey);
            ChainRecord<AdministratorRecord> record = registry.register(callerAgentKey, entityHash, agentKeys);

            auditService.record(AuditAction.ADMINISTRATOR_REGISTERED, entityHash, callerAgentKey, Map.of(
                    "agentKeys", List.copyOf(agentKeys),
                    "bootstrap", bootstrap,
                    "recordHash", record.hash()
            ));
            metricsService.incrementAdministratorChange("register");
            log.info("administration.registered entity={} by={} bootstrap={}", entityHash, callerAgentKey, bootstrap);
            return record;
        }
    }

    /**
     * Removes an administrator on behalf of {@code callerAgentKey}.
     * An administrator cannot remove itself.
     *
     * @throws com.bulletin.lifecycle.auth.UnauthorizedException if the caller is not an administrator or targets itself
     * @throws LastAdministratorException if the entity is the only administrator left
     * @throws com.bulletin.lifecycle.core.NotFoundException if the entity is not an administrator
     */
    public ChainRecord<AdministratorRecord> removeAdministrator(String callerAgentKey, String entityHash,
                                                                List<String> agentKeys) {
        try (LogContext ctx = LogContext.forAdministration(LogContext.generateCorrelationId(), entityHash, "remove")) {
            guard.requireCanMutate(callerAgentKey, entityHash);
            ChainRecord<AdministratorRecord> record = registry.remove(callerAgentKey, entityHash, agentKeys);

            auditService.record(AuditAction.ADMINISTRATOR_REMOVED, entityHash, callerAgentKey, Map.of(
                    "agentKeys", record.payload().agentKeys(),
                    "recordHash", record.hash()
            ));
            metricsService.incrementAdministratorChange("remove");
            log.info("administration.removed entity={} by={}", entityHash, callerAgentKey);
            return record;
        }
    }

    public boolean isAgentAdministrator(String agentKey) {
        return registry.isAgentAdministrator(agentKey);
    }

    public boolean isEntityAdministrator(String entityHash) {
        return registry.isEntityAdministrator(entityHash);
    }

    public List<String> getAllAdministrators() {
        return registry.getAllAdministrators();
    }

    public List<ChainRecord<AdministratorRecord>> getAdministratorHistory(String entityHash) {
        return registry.getHistory(entityHash);
    }
}
