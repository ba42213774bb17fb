package com.branchload.reporting.entity.enums;

public enum RunStatus {
    RUNNING("Run is currently in progress"),
    SUCCESS("Run completed successfully"),
    FAILED("Run failed with errors");

    private final String description;

    RunStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public String dbValue() {
        return name().toLowerCase();
    }

    public static RunStatus fromString(String status) {
        if (status == null) {
            return RUNNING;
        }
        try {
            return RunStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return RUNNING;
        }
    }
}
