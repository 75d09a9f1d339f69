package com.fever.resilience.infrastructure.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Sizing, lifetimes and location of the memory cache and the two-tier cache
 */
@Component
@ConfigurationProperties(prefix = "resilience.cache")
public class CacheProperties {

    // Standalone memory cache
    private int memoryMaxSize = 500;
    private Duration memoryDefaultTtl = Duration.ofMinutes(30);

    // Two-tier cache
    private int tierMemorySize = 100;
    private Duration tierMemoryTtl = Duration.ofMinutes(30);
    private int diskIndexSize = 1000;
    private Duration diskIndexTtl = Duration.ofHours(24);
    private Duration tierDefaultTtl = Duration.ofHours(1);
    private String directory = "cache/performance";

    private double memoryWeight = 0.7;
    private double diskWeight = 0.3;

    // Maintenance
    private long maxMemoryBytes = 50L * 1024 * 1024;
    private Duration staleFileAge = Duration.ofHours(24);

    public int getMemoryMaxSize() {
        return memoryMaxSize;
    }

    public void setMemoryMaxSize(int memoryMaxSize) {
        this.memoryMaxSize = memoryMaxSize;
    }

    public Duration getMemoryDefaultTtl() {
        return memoryDefaultTtl;
    }

    public void setMemoryDefaultTtl(Duration memoryDefaultTtl) {
        this.memoryDefaultTtl = memoryDefaultTtl;
    }

    public int getTierMemorySize() {
        return tierMemorySize;
    }

    public void setTierMemorySize(int tierMemorySize) {
        this.tierMemorySize = tierMemorySize;
    }

    public Duration getTierMemoryTtl() {
        return tierMemoryTtl;
    }

    public void setTierMemoryTtl(Duration tierMemoryTtl) {
        this.tierMemoryTtl = tierMemoryTtl;
    }

    public int getDiskIndexSize() {
        return diskIndexSize;
    }

    public void setDiskIndexSize(int diskIndexSize) {
        this.diskIndexSize = diskIndexSize;
    }

    public Duration getDiskIndexTtl() {
        return diskIndexTtl;
    }

    public void setDiskIndexTtl(Duration diskIndexTtl) {
        this.diskIndexTtl = diskIndexTtl;
    }

    public Duration getTierDefaultTtl() {
        return tierDefaultTtl;
    }

    public void setTierDefaultTtl(Duration tierDefaultTtl) {
        this.tierDefaultTtl = tierDefaultTtl;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public double getMemoryWeight() {
        return memoryWeight;
    }

    public void setMemoryWeight(double memoryWeight) {
        this.memoryWeight = memoryWeight;
    }

    public double getDiskWeight() {
        return diskWeight;
    }

    public void setDiskWeight(double diskWeight) {
        this.diskWeight = diskWeight;
    }

    public long getMaxMemoryBytes() {
        return maxMemoryBytes;
    }

    public void setMaxMemoryBytes(long maxMemoryBytes) {
        this.maxMemoryBytes = maxMemoryBytes;
    }

    public Duration getStaleFileAge() {
        return staleFileAge;
    }

    public void setStaleFileAge(Duration staleFileAge) {
        this.staleFileAge = staleFileAge;
    }
}
