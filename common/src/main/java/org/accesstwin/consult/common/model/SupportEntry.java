package org.accesstwin.consult.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A support (accommodation) recorded for a student.
 *
 * <p>The UDL and POUR mappings are kept in the raw shape the caller stored them in:
 * a map of principle to checkpoints, a flat list, a JSON string of either, or a plain
 * comma-separated string.
 */
public final class SupportEntry {

    private final String category;
    private final String subcategory;
    private final String description;
    private final Object udlMapping;
    private final Object pourMapping;
    private final String status;
    private final Double effectivenessRating;

    private SupportEntry(Builder builder) {
        this(builder.category, builder.subcategory, builder.description, builder.udlMapping,
                builder.pourMapping, builder.status, builder.effectivenessRating);
    }

    @JsonCreator
    public SupportEntry(
            @JsonProperty("category") String category,
            @JsonProperty("subcategory") String subcategory,
            @JsonProperty("description") String description,
            @JsonProperty("udlMapping") Object udlMapping,
            @JsonProperty("pourMapping") Object pourMapping,
            @JsonProperty("status") String status,
            @JsonProperty("effectivenessRating") Double effectivenessRating) {
        this.category = category;
        this.subcategory = subcategory;
        this.description = description;
        this.udlMapping = udlMapping;
        this.pourMapping = pourMapping;
        this.status = status != null ? status : "active";
        this.effectivenessRating = effectivenessRating;
    }

    public String getCategory() {
        return category;
    }

    public String getSubcategory() {
        return subcategory;
    }

    public String getDescription() {
        return description;
    }

    public Object getUdlMapping() {
        return udlMapping;
    }

    public Object getPourMapping() {
        return pourMapping;
    }

    public String getStatus() {
        return status;
    }

    /**
     * Teacher-assessed effectiveness on a 1-5 scale, or null when not yet rated.
     */
    public Double getEffectivenessRating() {
        return effectivenessRating;
    }

    public boolean hasRating() {
        return effectivenessRating != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "SupportEntry{" +
                "category='" + category + '\'' +
                ", status='" + status + '\'' +
                ", effectivenessRating=" + effectivenessRating +
                '}';
    }

    public static class Builder {
        private String category;
        private String subcategory;
        private String description;
        private Object udlMapping;
        private Object pourMapping;
        private String status;
        private Double effectivenessRating;

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder subcategory(String subcategory) {
            this.subcategory = subcategory;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder udlMapping(Object udlMapping) {
            this.udlMapping = udlMapping;
            return this;
        }

        public Builder pourMapping(Object pourMapping) {
            this.pourMapping = pourMapping;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder effectivenessRating(Double effectivenessRating) {
            this.effectivenessRating = effectivenessRating;
            return this;
        }

        public SupportEntry build() {
            return new SupportEntry(this);
        }
    }
}
