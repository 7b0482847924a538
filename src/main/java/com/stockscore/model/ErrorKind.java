package com.stockscore.model;

public enum ErrorKind {
    NONE,
    MISSING_DATA,
    PROVIDER,
    PARSE,
    TIMEOUT,
    UNEXPECTED
}
