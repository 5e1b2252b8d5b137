package com.lorastudio.event;

import org.springframework.context.ApplicationEvent;

/**
 * Captions under a project root changed on disk; cached views of that project
 * are stale.
 */
public class CaptionsInvalidatedEvent extends ApplicationEvent {

    private final String projectRoot;
    private final int updatedCount;

    public CaptionsInvalidatedEvent(Object source, String projectRoot, int updatedCount) {
        super(source);
        this.projectRoot = projectRoot;
        this.updatedCount = updatedCount;
    }

    public String getProjectRoot() {
        return projectRoot;
    }

    public int getUpdatedCount() {
        return updatedCount;
    }
}
