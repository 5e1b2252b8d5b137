package com.lorastudio.dto;

import java.util.List;

/**
 * Result of probing an OpenAI-compatible server for its model list.
 */
public class ConnectionStatus {

    private final boolean connected;
    private final List<String> models;
    private final String error;

    private ConnectionStatus(boolean connected, List<String> models, String error) {
        this.connected = connected;
        this.models = models != null ? List.copyOf(models) : List.of();
        this.error = error;
    }

    public static ConnectionStatus connected(List<String> models) {
        return new ConnectionStatus(true, models, null);
    }

    public static ConnectionStatus failed(String error) {
        return new ConnectionStatus(false, List.of(), error);
    }

    public boolean isConnected() {
        return connected;
    }

    public List<String> getModels() {
        return models;
    }

    public String getError() {
        return error;
    }
}
