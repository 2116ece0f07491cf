package org.accesstwin.consult.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything the case-management tool knows about one student.
 * Owned by the caller; the gateway only reads it.
 */
public final class StudentRecord {

    private final String displayName;
    private final List<ProfileEntry> strengths;
    private final List<ProfileEntry> goals;
    private final List<ProfileEntry> history;
    private final List<ProfileEntry> stakeholders;
    private final List<SupportEntry> supports;
    private final List<ActivityLog> activityLogs;

    @JsonCreator
    public StudentRecord(
            @JsonProperty("displayName") String displayName,
            @JsonProperty("strengths") List<ProfileEntry> strengths,
            @JsonProperty("goals") List<ProfileEntry> goals,
            @JsonProperty("history") List<ProfileEntry> history,
            @JsonProperty("stakeholders") List<ProfileEntry> stakeholders,
            @JsonProperty("supports") List<SupportEntry> supports,
            @JsonProperty("activityLogs") List<ActivityLog> activityLogs) {
        this.displayName = displayName;
        this.strengths = copyOf(strengths);
        this.goals = copyOf(goals);
        this.history = copyOf(history);
        this.stakeholders = copyOf(stakeholders);
        this.supports = copyOf(supports);
        this.activityLogs = copyOf(activityLogs);
    }

    private StudentRecord(Builder builder) {
        this(builder.displayName, builder.strengths, builder.goals, builder.history,
                builder.stakeholders, builder.supports, builder.activityLogs);
    }

    // Null lists and null elements are dropped
    private static <T> List<T> copyOf(List<T> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyList();
        }
        List<T> copy = new ArrayList<>(source.size());
        for (T item : source) {
            if (item != null) {
                copy.add(item);
            }
        }
        return Collections.unmodifiableList(copy);
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<ProfileEntry> getStrengths() {
        return strengths;
    }

    public List<ProfileEntry> getGoals() {
        return goals;
    }

    public List<ProfileEntry> getHistory() {
        return history;
    }

    public List<ProfileEntry> getStakeholders() {
        return stakeholders;
    }

    public List<SupportEntry> getSupports() {
        return supports;
    }

    public List<ActivityLog> getActivityLogs() {
        return activityLogs;
    }

    /**
     * Returns a copy of this record with the given supports and activity logs,
     * for callers that load those separately from the profile.
     */
    public StudentRecord withSupports(List<SupportEntry> supports, List<ActivityLog> activityLogs) {
        return new StudentRecord(displayName, strengths, goals, history, stakeholders,
                supports, activityLogs);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        // Deliberately omits all free text
        return "StudentRecord{" +
                "strengths=" + strengths.size() +
                ", goals=" + goals.size() +
                ", supports=" + supports.size() +
                ", activityLogs=" + activityLogs.size() +
                '}';
    }

    public static class Builder {
        private String displayName;
        private final List<ProfileEntry> strengths = new ArrayList<>();
        private final List<ProfileEntry> goals = new ArrayList<>();
        private final List<ProfileEntry> history = new ArrayList<>();
        private final List<ProfileEntry> stakeholders = new ArrayList<>();
        private final List<SupportEntry> supports = new ArrayList<>();
        private final List<ActivityLog> activityLogs = new ArrayList<>();

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder addStrength(String text) {
            strengths.add(ProfileEntry.of(text));
            return this;
        }

        public Builder addGoal(String text) {
            goals.add(ProfileEntry.of(text));
            return this;
        }

        public Builder addHistory(String text) {
            history.add(ProfileEntry.of(text));
            return this;
        }

        public Builder addStakeholder(String text) {
            stakeholders.add(ProfileEntry.of(text));
            return this;
        }

        public Builder addSupport(SupportEntry support) {
            supports.add(support);
            return this;
        }

        public Builder addActivityLog(ActivityLog log) {
            activityLogs.add(log);
            return this;
        }

        public StudentRecord build() {
            return new StudentRecord(this);
        }
    }
}
