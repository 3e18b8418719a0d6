package com.tandem.core.store;

import com.tandem.core.model.Project;

import java.util.List;
import java.util.Optional;

/**
 * Lookup of projects. Last-activity timestamps are written by {@link TaskStore#commit}.
 */
public interface ProjectStore {

    Optional<Project> findById(long projectId);

    Optional<Project> findByName(String name);

    List<Project> findByOwner(long ownerId);

    /** Creates the project if no project with that name exists; returns the stored project. */
    Project createIfAbsent(String name, long ownerId);
}
