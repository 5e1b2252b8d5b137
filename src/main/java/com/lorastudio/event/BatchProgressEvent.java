package com.lorastudio.event;

import com.lorastudio.dto.BatchProgress;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every chunk and when a run ends.
 */
public class BatchProgressEvent extends ApplicationEvent {

    private final BatchProgress progress;

    public BatchProgressEvent(Object source, BatchProgress progress) {
        super(source);
        this.progress = progress;
    }

    public BatchProgress getProgress() {
        return progress;
    }
}
