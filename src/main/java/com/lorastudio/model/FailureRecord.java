package com.lorastudio.model;

/**
 * One image that did not end up with a new caption during a run.
 */
public final class FailureRecord {

    public enum Kind {
        /** The backend could not produce a caption */
        GENERATION,
        /** A caption was produced but could not be written */
        PERSISTENCE
    }

    private final String path;
    private final String error;
    private final Kind kind;

    public FailureRecord(String path, String error, Kind kind) {
        this.path = path;
        this.error = error;
        this.kind = kind;
    }

    public String getPath() {
        return path;
    }

    public String getError() {
        return error;
    }

    public Kind getKind() {
        return kind;
    }
}
