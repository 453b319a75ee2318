package com.autonomous.content.service;

import com.autonomous.content.model.Organization;
import com.autonomous.content.storage.JsonMappers;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Creates the organizations described by YAML files in {@code organizations.seed.path}. Files
 * for organizations that already exist are skipped, so restarts are harmless.
 */
@Service
public class OrganizationSeedLoader {

    private static final Logger log = LoggerFactory.getLogger(OrganizationSeedLoader.class);

    @Value("${organizations.seed.path:config/organizations}")
    private String seedPath;

    private final OrganizationService organizations;
    private final ObjectMapper yamlMapper = JsonMappers.yaml();

    public OrganizationSeedLoader(OrganizationService organizations) {
        this.organizations = organizations;
    }

    public void setSeedPath(String path) {
        this.seedPath = path;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        loadSeeds();
    }

    public List<Organization> loadSeeds() {
        List<Organization> created = new ArrayList<>();
        File seedDir = new File(seedPath);
        if (!seedDir.isDirectory()) {
            log.debug("Organization seed directory not found: {}", seedPath);
            return created;
        }

        File[] yamlFiles = seedDir.listFiles((dir, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
        if (yamlFiles == null) {
            return created;
        }
        Arrays.sort(yamlFiles, Comparator.comparing(File::getName));

        for (File file : yamlFiles) {
            try {
                Organization seed = yamlMapper.readValue(file, Organization.class);
                if (seed.getId() == null || seed.getId().isBlank()) {
                    log.warn("Skipping organization seed {}: no id", file.getName());
                    continue;
                }
                if (organizations.exists(seed.getId())) {
                    continue;
                }
                created.add(organizations.create(seed, null));
                log.info("Seeded organization {} from {}", seed.getId(), file.getName());
            } catch (IOException e) {
                log.error("Failed to load organization seed {}", file.getName(), e);
            }
        }
        return created;
    }
}
