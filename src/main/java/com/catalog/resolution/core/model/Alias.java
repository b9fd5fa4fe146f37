package com.catalog.resolution.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * An alternate text that resolves to exactly one catalog entity.
 * The pair of owning entity, normalized text and locale is unique within a store.
 */
public final class Alias {
    public static final String DEFAULT_LOCALE = "en";

    private final String id;
    private final String entityId;
    private final String value;
    private final String normalizedValue;
    private final String locale;
    private final String brand;
    private final String model;
    private final AliasSource source;
    private final Double confidence;
    private final boolean active;
    private final Instant createdAt;

    private Alias(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.entityId = builder.entityId;
        this.value = builder.value;
        this.normalizedValue = builder.normalizedValue;
        this.locale = builder.locale;
        this.brand = builder.brand;
        this.model = builder.model;
        this.source = builder.source;
        this.confidence = builder.confidence;
        this.active = builder.active;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getValue() {
        return value;
    }

    public String getNormalizedValue() {
        return normalizedValue;
    }

    public String getLocale() {
        return locale;
    }

    public String getBrand() {
        return brand;
    }

    public String getModel() {
        return model;
    }

    public AliasSource getSource() {
        return source;
    }

    /**
     * Mapping confidence in [0,1], or null when the source did not provide one.
     */
    public Double getConfidence() {
        return confidence;
    }

    public boolean isActive() {
        return active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Alias alias = (Alias) o;
        return Objects.equals(id, alias.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Alias{" +
                "id='" + id + '\'' +
                ", entityId='" + entityId + '\'' +
                ", value='" + value + '\'' +
                ", normalizedValue='" + normalizedValue + '\'' +
                ", locale='" + locale + '\'' +
                ", brand='" + brand + '\'' +
                ", source=" + source +
                ", active=" + active +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Alias alias) {
        return new Builder()
                .id(alias.id)
                .entityId(alias.entityId)
                .value(alias.value)
                .normalizedValue(alias.normalizedValue)
                .locale(alias.locale)
                .brand(alias.brand)
                .model(alias.model)
                .source(alias.source)
                .confidence(alias.confidence)
                .active(alias.active)
                .createdAt(alias.createdAt);
    }

    public static class Builder {
        private String id;
        private String entityId;
        private String value;
        private String normalizedValue;
        private String locale = DEFAULT_LOCALE;
        private String brand;
        private String model;
        private AliasSource source = AliasSource.USER;
        private Double confidence;
        private boolean active = true;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder value(String value) {
            this.value = value;
            return this;
        }

        public Builder normalizedValue(String normalizedValue) {
            this.normalizedValue = normalizedValue;
            return this;
        }

        public Builder locale(String locale) {
            this.locale = locale;
            return this;
        }

        public Builder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder source(AliasSource source) {
            this.source = source;
            return this;
        }

        public Builder confidence(Double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Alias build() {
            Objects.requireNonNull(entityId, "entityId is required");
            Objects.requireNonNull(value, "value is required");
            Objects.requireNonNull(locale, "locale is required");
            Objects.requireNonNull(source, "source is required");
            if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
                throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
            }
            return new Alias(this);
        }
    }
}
