package com.autonomous.content.service;

import com.autonomous.content.exception.InvalidRequestException;
import com.autonomous.content.model.AgentConfig;
import com.autonomous.content.model.AgentKind;
import com.autonomous.content.storage.JsonDocumentStore;
import com.autonomous.content.storage.JsonMappers;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-organization agent configuration, one row per agent kind.
 */
@Service
public class AgentRegistryService {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistryService.class);

    @Value("${pipeline.data.path:data}")
    private String dataPath;

    @Value("${agents.defaults.timeout-seconds:300}")
    private int defaultTimeoutSeconds = 300;

    @Value("${agents.defaults.max-retries:3}")
    private int defaultMaxRetries = 3;

    @Value("${agents.defaults.max-cost:1.00}")
    private BigDecimal defaultMaxCost = new BigDecimal("1.00");

    @Value("${agents.defaults.article-model:claude-3-5-sonnet-20241022}")
    private String articleModel = "claude-3-5-sonnet-20241022";

    @Value("${agents.defaults.model:gpt-4-turbo-preview}")
    private String defaultModel = "gpt-4-turbo-preview";

    @Value("${agents.defaults.runs-per-hour:100}")
    private int defaultRunsPerHour = 100;

    @Value("${agents.defaults.runs-per-day:1000}")
    private int defaultRunsPerDay = 1000;

    private final Clock clock;
    private final OrganizationService organizations;
    private final AuditLogService auditLog;
    private final Map<String, AgentConfig> configs = new ConcurrentHashMap<>();
    private JsonDocumentStore<AgentConfig> documents = JsonDocumentStore.inMemory(AgentConfig.class);

    public AgentRegistryService(Clock clock, OrganizationService organizations, AuditLogService auditLog) {
        this.clock = clock;
        this.organizations = organizations;
        this.auditLog = auditLog;
    }

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    @PostConstruct
    public void init() {
        if (dataPath == null || dataPath.isBlank()) {
            return;
        }
        documents = new JsonDocumentStore<>(Paths.get(dataPath, "agent-configs"), AgentConfig.class, JsonMappers.json());
        try {
            documents.loadAll().forEach(config -> configs.put(key(config.getOrganizationId(), config.getAgentKind()), config));
            log.info("Loaded {} agent configurations", configs.size());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load agent configurations from " + dataPath, e);
        }
    }

    @EventListener
    public void onOrganizationCreated(OrganizationCreatedEvent event) {
        seedDefaults(event.organizationId());
    }

    /**
     * Inserts the default row for every agent kind that has none. Safe to call repeatedly.
     */
    public List<AgentConfig> seedDefaults(String organizationId) {
        List<AgentConfig> seeded = new ArrayList<>();
        for (AgentKind kind : AgentKind.values()) {
            AgentConfig defaults = AgentConfig.builder()
                .organizationId(organizationId)
                .agentKind(kind)
                .enabled(true)
                .timeoutSeconds(defaultTimeoutSeconds)
                .maxRetries(defaultMaxRetries)
                .maxCost(defaultMaxCost)
                .model(kind == AgentKind.ARTICLE_GENERATION ? articleModel : defaultModel)
                .runsPerHour(defaultRunsPerHour)
                .runsPerDay(defaultRunsPerDay)
                .updatedAt(clock.instant())
                .build();
            if (configs.putIfAbsent(key(organizationId, kind), defaults) == null) {
                save(defaults);
                seeded.add(defaults);
            }
        }
        if (!seeded.isEmpty()) {
            log.info("Seeded {} agent configurations for organization {}", seeded.size(), organizationId);
        }
        return seeded;
    }

    public AgentConfig get(String organizationId, AgentKind kind) {
        AgentConfig config = configs.get(key(organizationId, kind));
        if (config == null) {
            throw new IllegalStateException("No " + kind.getWireName() + " configuration for organization " + organizationId);
        }
        return config.toBuilder().build();
    }

    public List<AgentConfig> list(String organizationId) {
        organizations.get(organizationId);
        List<AgentConfig> result = new ArrayList<>();
        for (AgentKind kind : AgentKind.values()) {
            AgentConfig config = configs.get(key(organizationId, kind));
            if (config != null) {
                result.add(config.toBuilder().build());
            }
        }
        return result;
    }

    public AgentConfig update(String organizationId, AgentKind kind, AgentConfigUpdate changes, String actorId) {
        organizations.requireAdmin(organizationId, actorId);
        String key = key(organizationId, kind);
        AgentConfig[] before = new AgentConfig[1];
        AgentConfig updated = configs.compute(key, (k, current) -> {
            if (current == null) {
                throw new IllegalStateException("No " + kind.getWireName() + " configuration for organization " + organizationId);
            }
            before[0] = current;
            AgentConfig next = apply(current, changes);
            validate(next);
            next.setUpdatedAt(clock.instant());
            return next;
        });
        save(updated);
        auditLog.recordChange(organizationId, actorId, "agent_config.updated", "agent_config", key, before[0], updated);
        log.info("Updated {} configuration for organization {}", kind.getWireName(), organizationId);
        return updated.toBuilder().build();
    }

    /**
     * Upper bound for one pipeline run: the cost ceilings of every enabled agent.
     */
    public BigDecimal estimateCost(String organizationId) {
        BigDecimal total = BigDecimal.ZERO;
        for (AgentKind kind : AgentKind.values()) {
            AgentConfig config = configs.get(key(organizationId, kind));
            if (config != null && config.isEnabled() && config.getMaxCost() != null) {
                total = total.add(config.getMaxCost());
            }
        }
        return total;
    }

    private static AgentConfig apply(AgentConfig current, AgentConfigUpdate changes) {
        AgentConfig.AgentConfigBuilder next = current.toBuilder();
        if (changes.enabled() != null) {
            next.enabled(changes.enabled());
        }
        if (changes.timeoutSeconds() != null) {
            next.timeoutSeconds(changes.timeoutSeconds());
        }
        if (changes.maxRetries() != null) {
            next.maxRetries(changes.maxRetries());
        }
        if (changes.maxCost() != null) {
            next.maxCost(changes.maxCost());
        }
        if (changes.model() != null) {
            next.model(changes.model());
        }
        if (changes.runsPerHour() != null) {
            next.runsPerHour(changes.runsPerHour());
        }
        if (changes.runsPerDay() != null) {
            next.runsPerDay(changes.runsPerDay());
        }
        return next.build();
    }

    private static void validate(AgentConfig config) {
        if (config.getTimeoutSeconds() <= 0) {
            throw new InvalidRequestException("Timeout must be positive");
        }
        if (config.getMaxRetries() < 0) {
            throw new InvalidRequestException("Max retries must not be negative");
        }
        if (config.getMaxCost() != null && config.getMaxCost().signum() < 0) {
            throw new InvalidRequestException("Max cost must not be negative");
        }
        if (config.getRunsPerHour() <= 0 || config.getRunsPerDay() <= 0) {
            throw new InvalidRequestException("Run limits must be positive");
        }
    }

    private void save(AgentConfig config) {
        try {
            documents.save(key(config.getOrganizationId(), config.getAgentKind()), config);
        } catch (IOException e) {
            log.error("Failed to persist {} configuration for organization {}",
                config.getAgentKind().getWireName(), config.getOrganizationId(), e);
        }
    }

    private static String key(String organizationId, AgentKind kind) {
        return organizationId + "_" + kind.getWireName();
    }
}
