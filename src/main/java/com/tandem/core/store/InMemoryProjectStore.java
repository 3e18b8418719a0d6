package com.tandem.core.store;

import com.tandem.core.model.Project;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link ProjectStore}, used when no DataSource is configured.
 */
public class InMemoryProjectStore implements ProjectStore {

    private final ConcurrentHashMap<Long, Project> projects = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Optional<Project> findById(long projectId) {
        return Optional.ofNullable(projects.get(projectId));
    }

    @Override
    public Optional<Project> findByName(String name) {
        return projects.values().stream()
                .filter(p -> p.name().equals(name))
                .findFirst();
    }

    @Override
    public List<Project> findByOwner(long ownerId) {
        return projects.values().stream()
                .filter(p -> p.ownerId() == ownerId)
                .sorted(Comparator.comparingLong(Project::id))
                .toList();
    }

    @Override
    public synchronized Project createIfAbsent(String name, long ownerId) {
        Optional<Project> existing = findByName(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        Project project = new Project(sequence.incrementAndGet(), name, ownerId, null);
        projects.put(project.id(), project);
        return project;
    }

    void touchActivity(long projectId, Instant at) {
        projects.computeIfPresent(projectId,
                (id, p) -> new Project(p.id(), p.name(), p.ownerId(), at));
    }
}
