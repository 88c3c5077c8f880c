package com.workshopos.tasks;

import com.workshopos.domain.SessionState;
import com.workshopos.repository.WorkshopSessionRepository;
import com.workshopos.service.SessionDeployer;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Re-schedules deployment of sessions stuck in STARTING. Covers a crash
 * between commit and task execution, and tasks that failed against the
 * cluster.
 */
@Singleton
@Requires(property = "sessions.deployment-sweep.enabled", notEquals = "false")
public class SessionDeploymentSweeper {

    private static final Logger log = LoggerFactory.getLogger(SessionDeploymentSweeper.class);

    @Inject WorkshopSessionRepository sessionRepository;
    @Inject SessionDeployer deployer;
    @Inject BackgroundTaskRunner taskRunner;
    @Inject Clock clock;

    @Value("${sessions.deployment-sweep.grace-period:2m}")
    Duration gracePeriod;

    @Scheduled(fixedDelay = "${sessions.deployment-sweep.interval:60s}", initialDelay = "30s")
    public void sweep() {
        try {
            OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(gracePeriod);
            List<String> stuck = sessionRepository.findNamesInStateCreatedBefore(SessionState.STARTING, cutoff);
            for (String name : stuck) {
                log.info("Session {} still starting after {}, re-scheduling deployment", name, gracePeriod);
                taskRunner.schedule("deploy-session:" + name, () -> deployer.deploySession(name));
            }
        } catch (Exception e) {
            log.warn("Error sweeping undeployed sessions: {}", e.getMessage());
        }
    }
}
