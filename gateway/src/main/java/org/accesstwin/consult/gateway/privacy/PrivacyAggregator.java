package org.accesstwin.consult.gateway.privacy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.accesstwin.consult.common.ConsultConstants;
import org.accesstwin.consult.common.model.ActivityLog;
import org.accesstwin.consult.common.model.ProfileEntry;
import org.accesstwin.consult.common.model.StudentRecord;
import org.accesstwin.consult.common.model.SupportEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Splits a student record into a {@link SafeView} for staff and a {@link FullView}
 * for the model.
 *
 * <p>Aggregation is pure and deterministic: the same record always yields identical
 * views. Malformed content never fails aggregation; it is left out instead.
 */
public class PrivacyAggregator {

    private static final Logger logger = LoggerFactory.getLogger(PrivacyAggregator.class);

    private static final DateTimeFormatter LOG_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private static final Comparator<ActivityLog> MOST_RECENT_FIRST = Comparator.comparing(
            ActivityLog::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()));

    private final ObjectMapper objectMapper;
    private final TagFolder tagFolder;
    private final ThemeGeneralizer strengthThemes;
    private final ThemeGeneralizer goalThemes;

    public PrivacyAggregator() {
        this(new ObjectMapper());
    }

    public PrivacyAggregator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.tagFolder = new TagFolder(objectMapper);
        this.strengthThemes = ThemeGeneralizer.strengths();
        this.goalThemes = ThemeGeneralizer.goals();
    }

    /**
     * Aggregates a record using the supports and activity logs it carries.
     */
    public AggregationResult aggregate(StudentRecord record) {
        return aggregate(record, record.getSupports(), record.getActivityLogs());
    }

    /**
     * Aggregates a profile with separately loaded supports and activity logs.
     * Null lists are treated as empty.
     */
    public AggregationResult aggregate(StudentRecord record, List<SupportEntry> supports,
                                       List<ActivityLog> activityLogs) {
        List<SupportEntry> supportList = nonNull(supports);
        List<ActivityLog> logList = nonNull(activityLogs);

        SafeView safeView = buildSafeView(record, supportList);
        FullView fullView = buildFullView(record, supportList, logList);

        logger.debug("Aggregated record: {} supports, {} activity logs, {} strength themes",
                supportList.size(), logList.size(), safeView.getStrengthThemes().size());

        return new AggregationResult(safeView, fullView);
    }

    private SafeView buildSafeView(StudentRecord record, List<SupportEntry> supports) {
        SortedMap<String, Integer> categoryCounts = new TreeMap<>();
        Map<String, double[]> ratingTotals = new TreeMap<>();
        TreeSet<String> udl = new TreeSet<>();
        TreeSet<String> pour = new TreeSet<>();
        int activeCount = 0;

        for (SupportEntry support : supports) {
            String category = categoryOf(support);
            categoryCounts.merge(category, 1, Integer::sum);

            if (isUsableRating(support.getEffectivenessRating())) {
                double[] totals = ratingTotals.computeIfAbsent(category, k -> new double[2]);
                totals[0] += support.getEffectivenessRating();
                totals[1]++;
            }

            udl.addAll(tagFolder.foldUdl(support.getUdlMapping()));
            pour.addAll(tagFolder.foldPour(support.getPourMapping()));

            if (support.getStatus() != null
                    && ConsultConstants.STATUS_ACTIVE.equalsIgnoreCase(support.getStatus().trim())) {
                activeCount++;
            }
        }

        SortedMap<String, Double> effectiveness = new TreeMap<>();
        for (Map.Entry<String, double[]> entry : ratingTotals.entrySet()) {
            double average = entry.getValue()[0] / entry.getValue()[1];
            effectiveness.put(entry.getKey(),
                    BigDecimal.valueOf(average).setScale(1, RoundingMode.HALF_UP).doubleValue());
        }

        return new SafeView(
                firstNameOf(record.getDisplayName()),
                new ArrayList<>(categoryCounts.keySet()),
                categoryCounts,
                strengthThemes.themesOf(record.getStrengths()),
                goalThemes.themesOf(record.getGoals()),
                activeCount,
                new ArrayList<>(udl),
                new ArrayList<>(pour),
                effectiveness);
    }

    private FullView buildFullView(StudentRecord record, List<SupportEntry> supports, List<ActivityLog> logs) {
        List<String> lines = new ArrayList<>();
        lines.add(ConsultConstants.CONFIDENTIAL_BEGIN);
        lines.add("Student full name: " + (record.getDisplayName() != null ? record.getDisplayName() : ""));

        lines.add("\n-- Strengths --");
        addEntries(lines, record.getStrengths());

        lines.add("\n-- Support Entries --");
        for (SupportEntry support : supports) {
            lines.add(supportLine(support, isUsableRating(support.getEffectivenessRating())
                    ? " (effectiveness: " + formatRating(support.getEffectivenessRating()) + "/5)" : ""));
            addTagDumps(lines, support);
        }

        lines.add("\n-- History --");
        addEntries(lines, record.getHistory());

        lines.add("\n-- Goals / Hopes --");
        addEntries(lines, record.getGoals());

        lines.add("\n-- Stakeholders --");
        addEntries(lines, record.getStakeholders());

        if (!logs.isEmpty()) {
            lines.add("\n-- Recent Tracking Logs --");
            for (ActivityLog log : recentLogs(logs)) {
                lines.add("  [" + nullToEmpty(log.getRole()) + "] impl: "
                        + truncate(log.getImplementationNote(), ConsultConstants.FULL_VIEW_NOTE_LIMIT)
                        + "  outcome: " + truncate(log.getOutcomeNote(), ConsultConstants.FULL_VIEW_NOTE_LIMIT));
            }
        }

        lines.add("\n" + ConsultConstants.CONFIDENTIAL_END);
        return new FullView(String.join("\n", lines));
    }

    /**
     * Renders a student's own supports and tracking logs for the student-facing insights
     * prompt. Only the first name is included; history and stakeholders are left out.
     * Only active supports are listed.
     */
    public String studentSupportData(StudentRecord record) {
        List<SupportEntry> active = new ArrayList<>();
        for (SupportEntry support : nonNull(record.getSupports())) {
            if (support.getStatus() != null
                    && ConsultConstants.STATUS_ACTIVE.equalsIgnoreCase(support.getStatus().trim())) {
                active.add(support);
            }
        }
        List<ActivityLog> logs = nonNull(record.getActivityLogs());

        List<String> lines = new ArrayList<>();
        lines.add("Student first name: " + firstNameOf(record.getDisplayName()));
        lines.add("");
        lines.add("Active supports: " + active.size());
        lines.add("");

        if (!active.isEmpty()) {
            lines.add("-- Support Entries --");
            for (SupportEntry support : active) {
                lines.add(supportLine(support, isUsableRating(support.getEffectivenessRating())
                        ? " (effectiveness: " + formatRating(support.getEffectivenessRating()) + "/5)"
                        : " (no rating yet)"));
                addTagDumps(lines, support);
            }
            lines.add("");
        }

        if (!logs.isEmpty()) {
            lines.add("-- Tracking Logs (" + logs.size() + " entries) --");
            List<ActivityLog> sorted = new ArrayList<>(logs);
            sorted.sort(MOST_RECENT_FIRST);
            for (ActivityLog log : sorted) {
                lines.add("  " + (log.getTimestamp() != null ? LOG_TIME.format(log.getTimestamp()) : "unknown"));
                if (!isBlank(log.getImplementationNote())) {
                    lines.add("    Implementation: "
                            + truncate(log.getImplementationNote(), ConsultConstants.STUDENT_VIEW_NOTE_LIMIT));
                }
                if (!isBlank(log.getOutcomeNote())) {
                    lines.add("    Outcome: "
                            + truncate(log.getOutcomeNote(), ConsultConstants.STUDENT_VIEW_NOTE_LIMIT));
                }
            }
            lines.add("");
        }

        double total = 0;
        int rated = 0;
        int workingWell = 0;
        int needsAttention = 0;
        for (SupportEntry support : active) {
            Double rating = support.getEffectivenessRating();
            if (!isUsableRating(rating)) {
                continue;
            }
            total += rating;
            rated++;
            if (rating >= ConsultConstants.WORKING_WELL_RATING) {
                workingWell++;
            } else if (rating < ConsultConstants.NEEDS_ATTENTION_RATING) {
                needsAttention++;
            }
        }
        if (rated > 0) {
            lines.add("Overall average effectiveness: "
                    + BigDecimal.valueOf(total / rated).setScale(1, RoundingMode.HALF_UP).toPlainString() + "/5");
            lines.add("Supports rated 3.5+: " + workingWell);
            lines.add("Supports rated below 3.0: " + needsAttention);
        }

        return String.join("\n", lines);
    }

    /**
     * The most recent logs first, at most the full-view limit. Logs without a
     * timestamp sort last; ties keep their input order.
     */
    static List<ActivityLog> recentLogs(List<ActivityLog> logs) {
        List<ActivityLog> sorted = new ArrayList<>(logs);
        sorted.sort(MOST_RECENT_FIRST);
        return sorted.subList(0, Math.min(ConsultConstants.FULL_VIEW_LOG_LIMIT, sorted.size()));
    }

    static String firstNameOf(String displayName) {
        if (displayName == null || displayName.isBlank()) {
            return ConsultConstants.DEFAULT_FIRST_NAME;
        }
        List<String> words = ThemeGeneralizer.words(displayName);
        return words.isEmpty() ? ConsultConstants.DEFAULT_FIRST_NAME : words.get(0);
    }

    private static String supportLine(SupportEntry support, String ratingSuffix) {
        String subcategory = isBlank(support.getSubcategory())
                ? ConsultConstants.DEFAULT_SUBCATEGORY : support.getSubcategory();
        return "  [" + categoryOf(support) + "/" + subcategory + "] "
                + nullToEmpty(support.getDescription()) + ratingSuffix;
    }

    private void addTagDumps(List<String> lines, SupportEntry support) {
        String udlDump = dump(tagFolder.parse(support.getUdlMapping()));
        if (udlDump != null) {
            lines.add("    UDL: " + udlDump);
        }
        String pourDump = dump(tagFolder.parse(support.getPourMapping()));
        if (pourDump != null) {
            lines.add("    POUR: " + pourDump);
        }
    }

    private String dump(JsonNode node) {
        if (node.isMissingNode() || node.isNull() || (node.isContainerNode() && node.isEmpty())) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            logger.debug("Could not serialize tag mapping: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static void addEntries(List<String> lines, List<ProfileEntry> entries) {
        for (ProfileEntry entry : entries) {
            lines.add("  - " + entry.getText());
        }
    }

    private static boolean isUsableRating(Double rating) {
        return rating != null
                && rating >= ConsultConstants.MIN_EFFECTIVENESS
                && rating <= ConsultConstants.MAX_EFFECTIVENESS;
    }

    private static String formatRating(Double rating) {
        return BigDecimal.valueOf(rating).stripTrailingZeros().toPlainString();
    }

    private static String categoryOf(SupportEntry support) {
        return isBlank(support.getCategory()) ? ConsultConstants.UNCATEGORIZED : support.getCategory().trim();
    }

    private static String truncate(String note, int limit) {
        String text = nullToEmpty(note);
        return text.length() <= limit ? text : text.substring(0, limit);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static <T> List<T> nonNull(List<T> list) {
        if (list == null) {
            return Collections.emptyList();
        }
        List<T> copy = new ArrayList<>(list.size());
        for (T item : list) {
            if (item != null) {
                copy.add(item);
            }
        }
        return copy;
    }
}
