package com.linlay.agentsview.model;

import java.util.Locale;

public enum MessageRole {
    USER("user"),
    ASSISTANT("assistant"),
    SYSTEM("system");

    private final String value;

    MessageRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static MessageRole fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (MessageRole role : values()) {
            if (role.value.equals(normalized)) {
                return role;
            }
        }
        return null;
    }
}
