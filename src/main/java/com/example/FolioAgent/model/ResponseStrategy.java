package com.example.FolioAgent.model;

public enum ResponseStrategy {
    /** Intent-specific persona prompt. */
    PRIMARY,
    /** Stricter, extractive prompt used after a quality failure. */
    ALTERNATE
}
