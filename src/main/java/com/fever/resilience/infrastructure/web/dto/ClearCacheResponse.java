package com.fever.resilience.infrastructure.web.dto;

public record ClearCacheResponse(
        boolean cleared,
        String error
) {
    public static ClearCacheResponse success() {
        return new ClearCacheResponse(true, null);
    }

    public static ClearCacheResponse failed(String error) {
        return new ClearCacheResponse(false, error);
    }
}
