package org.accesstwin.consult.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * An implementation/outcome note logged against a student by a teacher or the student.
 */
public final class ActivityLog {

    private final String role;
    private final String implementationNote;
    private final String outcomeNote;
    private final Instant timestamp;

    @JsonCreator
    public ActivityLog(
            @JsonProperty("role") String role,
            @JsonProperty("implementationNote") String implementationNote,
            @JsonProperty("outcomeNote") String outcomeNote,
            @JsonProperty("timestamp") Instant timestamp) {
        this.role = role;
        this.implementationNote = implementationNote;
        this.outcomeNote = outcomeNote;
        this.timestamp = timestamp;
    }

    public String getRole() {
        return role;
    }

    public String getImplementationNote() {
        return implementationNote;
    }

    public String getOutcomeNote() {
        return outcomeNote;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "ActivityLog{role='" + role + "', timestamp=" + timestamp + '}';
    }
}
