package com.demandengine.engine.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
