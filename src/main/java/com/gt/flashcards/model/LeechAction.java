package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LeechAction {
    TagOnly("tag_only"),
    Pause("pause");

    private final String configValue;

    LeechAction(String configValue) {
        this.configValue = configValue;
    }

    @JsonValue
    public String getConfigValue() {
        return configValue;
    }

    public static LeechAction fromConfigValue(String configValue) {
        for (LeechAction action : values()) {
            if (action.configValue.equalsIgnoreCase(configValue)) {
                return action;
            }
        }

        throw new IllegalArgumentException("Unknown leech action " + configValue);
    }
}
