package com.example.FolioAgent.model;

public enum SearchMethod {
    SEMANTIC,
    LEXICAL
}
