package com.example.FolioAgent.model;

public enum ValidationState {
    PENDING,
    PASSED,
    RETRY,
    FAILED_SAFE
}
