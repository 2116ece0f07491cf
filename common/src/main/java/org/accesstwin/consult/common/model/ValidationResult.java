package org.accesstwin.consult.common.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of validating a gateway or provider configuration.
 * Contains validation errors, warnings, and informational messages.
 */
public final class ValidationResult {

    private final boolean valid;
    private final List<ValidationError> errors;
    private final List<String> warnings;
    private final List<String> infos;

    private ValidationResult(List<ValidationError> errors, List<String> warnings, List<String> infos) {
        this.valid = errors.isEmpty();
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.infos = Collections.unmodifiableList(new ArrayList<>(infos));
    }

    public boolean isValid() {
        return valid;
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public List<String> getInfos() {
        return infos;
    }

    /**
     * Joins all error messages into a single line, for surfacing to the caller.
     */
    public String describeErrors() {
        StringBuilder sb = new StringBuilder();
        for (ValidationError error : errors) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(error);
        }
        return sb.toString();
    }

    /**
     * Creates a valid result with no errors.
     */
    public static ValidationResult valid() {
        return new ValidationResult(Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<ValidationError> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<String> infos = new ArrayList<>();

        public Builder addError(String field, String message) {
            errors.add(new ValidationError(field, message));
            return this;
        }

        public Builder addWarning(String field, String message) {
            warnings.add(field + ": " + message);
            return this;
        }

        public Builder addInfo(String field, String message) {
            infos.add(field + ": " + message);
            return this;
        }

        /**
         * Copies errors, warnings and infos of another result into this one.
         */
        public Builder merge(ValidationResult other) {
            errors.addAll(other.errors);
            warnings.addAll(other.warnings);
            infos.addAll(other.infos);
            return this;
        }

        public ValidationResult build() {
            return new ValidationResult(errors, warnings, infos);
        }
    }

    /**
     * Represents a single validation error.
     */
    public static class ValidationError {
        private final String field;
        private final String message;

        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }

        public String getField() {
            return field;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
