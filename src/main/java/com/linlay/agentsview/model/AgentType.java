package com.linlay.agentsview.model;

import java.util.Locale;

public enum AgentType {
    CLAUDE("claude"),
    CODEX("codex");

    private final String value;

    AgentType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static AgentType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AgentType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
