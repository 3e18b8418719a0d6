package com.tandem.core.store;

import com.tandem.core.model.Project;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Ensures the configured projects exist. Project management itself lives outside this
 * service; this only makes a fresh deployment addressable by agents.
 */
@Component
public class ProjectBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ProjectBootstrap.class);

    private final ProjectStore projectStore;
    private final ProjectSeedProperties seedProperties;

    public ProjectBootstrap(ProjectStore projectStore, ProjectSeedProperties seedProperties) {
        this.projectStore = projectStore;
        this.seedProperties = seedProperties;
    }

    @PostConstruct
    void seed() {
        for (ProjectSeedProperties.Seed seed : seedProperties.getProjects()) {
            if (seed.getName() == null || seed.getName().isBlank()) {
                throw new IllegalStateException("tandem.projects entries need a name");
            }
            Project project = projectStore.createIfAbsent(seed.getName().trim(), seed.getOwnerId());
            if (project.ownerId() != seed.getOwnerId()) {
                log.warn("Project '{}' already exists with owner {}; configured owner {} ignored",
                        project.name(), project.ownerId(), seed.getOwnerId());
            } else {
                log.info("Project '{}' (id {}) available for owner {}", project.name(), project.id(), project.ownerId());
            }
        }
    }
}
