package com.agentbridge.state;

import com.agentbridge.model.Project;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the persisted project/instance registry.
 */
public interface StateStore {

    Optional<Project> getProject(String projectName);

    List<Project> listProjects();

    /**
     * Stamps the project as active now. Unknown projects are ignored.
     */
    void updateLastActive(String projectName);

    /**
     * Re-reads the backing store, replacing every cached project.
     */
    void reload();
}
