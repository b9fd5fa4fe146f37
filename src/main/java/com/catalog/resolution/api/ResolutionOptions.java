package com.catalog.resolution.api;

/**
 * Options for a resolution call.
 * Configures the alias locale, the result bound, the score floor and execution details.
 */
public class ResolutionOptions {

    public static final String DEFAULT_LOCALE = "en";
    public static final int DEFAULT_MAX_RESULTS = 25;
    public static final double DEFAULT_MIN_SCORE = 0.0;
    public static final long DEFAULT_ASYNC_TIMEOUT_MS = 30_000;

    private final String locale;
    private final int maxResults;
    private final double minScore;
    private final boolean parallelScoring;
    private final boolean useCache;
    private final long asyncTimeoutMs;

    private ResolutionOptions(Builder builder) {
        this.locale = builder.locale;
        this.maxResults = builder.maxResults;
        this.minScore = builder.minScore;
        this.parallelScoring = builder.parallelScoring;
        this.useCache = builder.useCache;
        this.asyncTimeoutMs = builder.asyncTimeoutMs;
    }

    public String getLocale() {
        return locale;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public double getMinScore() {
        return minScore;
    }

    public boolean isParallelScoring() {
        return parallelScoring;
    }

    public boolean isUseCache() {
        return useCache;
    }

    public long getAsyncTimeoutMs() {
        return asyncTimeoutMs;
    }

    /**
     * Creates default options: locale "en", 25 results, no score floor.
     */
    public static ResolutionOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options for a locale, result bound and score floor, keeping other defaults.
     */
    public static ResolutionOptions of(String locale, int maxResults, double minScore) {
        return builder()
                .locale(locale)
                .maxResults(maxResults)
                .minScore(minScore)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(ResolutionOptions options) {
        return new Builder()
                .locale(options.locale)
                .maxResults(options.maxResults)
                .minScore(options.minScore)
                .parallelScoring(options.parallelScoring)
                .useCache(options.useCache)
                .asyncTimeoutMs(options.asyncTimeoutMs);
    }

    public static class Builder {
        private String locale = DEFAULT_LOCALE;
        private int maxResults = DEFAULT_MAX_RESULTS;
        private double minScore = DEFAULT_MIN_SCORE;
        private boolean parallelScoring = false;
        private boolean useCache = true;
        private long asyncTimeoutMs = DEFAULT_ASYNC_TIMEOUT_MS;

        public Builder locale(String locale) {
            this.locale = locale;
            return this;
        }

        public Builder maxResults(int maxResults) {
            this.maxResults = maxResults;
            return this;
        }

        public Builder minScore(double minScore) {
            this.minScore = minScore;
            return this;
        }

        /**
         * Scores candidates on a parallel stream. The output is identical either way.
         */
        public Builder parallelScoring(boolean parallelScoring) {
            this.parallelScoring = parallelScoring;
            return this;
        }

        public Builder useCache(boolean useCache) {
            this.useCache = useCache;
            return this;
        }

        public Builder asyncTimeoutMs(long asyncTimeoutMs) {
            this.asyncTimeoutMs = asyncTimeoutMs;
            return this;
        }

        public ResolutionOptions build() {
            if (locale == null || locale.isBlank()) {
                throw new InvalidArgumentException("locale must not be blank");
            }
            if (maxResults <= 0) {
                throw new InvalidArgumentException("maxResults must be positive, got " + maxResults);
            }
            // NaN fails both comparisons, so test the accepted range instead
            if (!(minScore >= 0.0 && minScore <= 1.0)) {
                throw new InvalidArgumentException("minScore must be between 0.0 and 1.0, got " + minScore);
            }
            if (asyncTimeoutMs <= 0) {
                throw new InvalidArgumentException("asyncTimeoutMs must be positive");
            }
            return new ResolutionOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ResolutionOptions{" +
                "locale='" + locale + '\'' +
                ", maxResults=" + maxResults +
                ", minScore=" + minScore +
                ", parallelScoring=" + parallelScoring +
                ", useCache=" + useCache +
                ", asyncTimeoutMs=" + asyncTimeoutMs +
                '}';
    }
}
