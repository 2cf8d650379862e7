package com.example.contentops.flowguard.model;

public enum FailureReason {
    DUPLICATE_SESSION,
    ALREADY_INITIALIZED,
    SESSION_NOT_FOUND,
    INVALID_INPUT,
    INTERNAL_ERROR
}
