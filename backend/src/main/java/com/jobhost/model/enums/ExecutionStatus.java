package com.jobhost.model.enums;

public enum ExecutionStatus {
    RUNNING,
    SUCCESS,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
