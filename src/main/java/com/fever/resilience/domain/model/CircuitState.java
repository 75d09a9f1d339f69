package com.fever.resilience.domain.model;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
