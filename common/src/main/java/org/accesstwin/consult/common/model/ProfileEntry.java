package org.accesstwin.consult.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A free-text profile item (strength, goal, history or stakeholder entry) with its priority.
 * Accepts either an object form or a bare string when read from JSON.
 */
public final class ProfileEntry {

    private final String text;
    private final Integer priority;

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public ProfileEntry(
            @JsonProperty("text") String text,
            @JsonProperty("priority") Integer priority) {
        this.text = text != null ? text : "";
        this.priority = priority;
    }

    /**
     * Creates an entry without a priority, used for bare-string JSON items.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ProfileEntry of(String text) {
        return new ProfileEntry(text, null);
    }

    public String getText() {
        return text;
    }

    public Integer getPriority() {
        return priority;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProfileEntry that = (ProfileEntry) o;
        return text.equals(that.text) && Objects.equals(priority, that.priority);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, priority);
    }

    @Override
    public String toString() {
        return "ProfileEntry{priority=" + priority + ", length=" + text.length() + '}';
    }
}
