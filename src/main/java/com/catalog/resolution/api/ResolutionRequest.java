package com.catalog.resolution.api;

/**
 * A query paired with optional per-request options, used for batch resolution.
 *
 * @param query   the raw query text
 * @param options options for this request, or null to use the resolver's defaults
 */
public record ResolutionRequest(String query, ResolutionOptions options) {

    public static ResolutionRequest of(String query) {
        return new ResolutionRequest(query, null);
    }
}
