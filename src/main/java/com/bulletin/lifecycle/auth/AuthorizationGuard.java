package com.bulletin.lifecycle.auth;

import com.bulletin.lifecycle.admin.AdministratorRegistry;
import com.bulletin.lifecycle.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Gate in front of every status-mutating operation.
 *
 * <p>A caller may mutate an entity's lifecycle only if its agent key is a
 * registered administrator and the target is not the caller's own entity.
 * The only exception is network bootstrap: while no administrator exists, the
 * configured progenitor agent may register the first one.</p>
 */
public class AuthorizationGuard {
    private static final Logger log = LoggerFactory.getLogger(AuthorizationGuard.class);

    private final AdministratorRegistry registry;
    private final AgentDirectory agentDirectory;
    private final MetricsService metricsService;
    private final String progenitorAgentKey;

    public AuthorizationGuard(AdministratorRegistry registry, AgentDirectory agentDirectory,
                              MetricsService metricsService, String progenitorAgentKey) {
        this.registry = registry;
        this.agentDirectory = agentDirectory;
        this.metricsService = metricsService;
        this.progenitorAgentKey = progenitorAgentKey;
    }

    /**
     * @throws UnauthorizedException if the caller is not an administrator
     */
    public void requireAdministrator(String agentKey) {
        if (agentKey == null || !registry.isAgentAdministrator(agentKey)) {
            deny(agentKey, "Agent is not an administrator: " + agentKey);
        }
    }

    /**
     * @throws UnauthorizedException if the caller is not an administrator or targets its own entity
     */
    public void requireCanMutate(String agentKey, String targetEntityHash) {
        requireAdministrator(agentKey);
        if (isOwnEntity(agentKey, targetEntityHash)) {
            deny(agentKey, "Administrators cannot change their own status: " + targetEntityHash);
        }
    }

    /**
     * Guard for adding an administrator. Administrators may add others; the
     * progenitor may add the first one while the registry is empty.
     *
     * @return true if the call is a bootstrap registration
     * @throws UnauthorizedException otherwise
     */
    public boolean requireCanRegisterAdministrator(String agentKey) {
        if (!registry.hasAdministrators() && isProgenitor(agentKey)) {
            log.info("auth.bootstrap progenitor={}", agentKey);
            return true;
        }
        requireAdministrator(agentKey);
        return false;
    }

    public boolean isProgenitor(String agentKey) {
        return progenitorAgentKey != null && !progenitorAgentKey.isBlank() && progenitorAgentKey.equals(agentKey);
    }

    private boolean isOwnEntity(String agentKey, String targetEntityHash) {
        Optional<String> userEntity = agentDirectory.findEntity(agentKey);
        if (userEntity.isPresent() && userEntity.get().equals(targetEntityHash)) {
            return true;
        }
        return registry.findAdministratorEntity(agentKey)
                .map(targetEntityHash::equals)
                .orElse(false);
    }

    private void deny(String agentKey, String message) {
        metricsService.incrementUnauthorized();
        log.warn("auth.denied agent={} reason={}", agentKey, message);
        throw new UnauthorizedException(agentKey, message);
    }
}
