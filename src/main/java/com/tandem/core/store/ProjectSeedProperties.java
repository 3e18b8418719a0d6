package com.tandem.core.store;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects created at startup when absent. Binds {@code tandem.projects[*]}.
 */
@Component
@ConfigurationProperties(prefix = "tandem")
public class ProjectSeedProperties {

    private List<Seed> projects = new ArrayList<>();

    public List<Seed> getProjects() {
        return projects;
    }

    public void setProjects(List<Seed> projects) {
        this.projects = projects;
    }

    public static class Seed {
        private String name;
        private long ownerId;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public long getOwnerId() {
            return ownerId;
        }

        public void setOwnerId(long ownerId) {
            this.ownerId = ownerId;
        }
    }
}
