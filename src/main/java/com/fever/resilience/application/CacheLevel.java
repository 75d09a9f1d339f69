package com.fever.resilience.application;

public enum CacheLevel {
    /** Standalone in-memory LRU cache */
    MEMORY,
    /** Memory tier backed by the on-disk tier */
    DISK
}
