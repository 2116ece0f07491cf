package org.accesstwin.consult.gateway.privacy;

import org.accesstwin.consult.common.model.ActivityLog;
import org.accesstwin.consult.common.model.StudentRecord;
import org.accesstwin.consult.common.model.SupportEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PrivacyAggregator.
 */
class PrivacyAggregatorTest {

    private PrivacyAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new PrivacyAggregator();
    }

    private static StudentRecord sampleRecord() {
        Map<String, Object> udl = new HashMap<>();
        udl.put("engagement", Arrays.asList("7.1", "8.3"));
        udl.put("representation", "1.1");

        return StudentRecord.builder()
                .displayName("Jordan Alexis Reyes")
                .addStrength("Remembers every dinosaur species by name")
                .addStrength("Loves drawing comics in the margins")
                .addGoal("Wants to study palaeontology at university")
                .addHistory("Diagnosed with sensory processing disorder in grade two")
                .addStakeholder("Mother, Ms. Reyes, prefers email contact")
                .addSupport(SupportEntry.builder()
                        .category("sensory")
                        .subcategory("noise")
                        .description("Noise-cancelling headphones during assemblies")
                        .udlMapping(udl)
                        .pourMapping("{\"perceivable\":[\"captions\"]}")
                        .status("active")
                        .effectivenessRating(4.0)
                        .build())
                .addSupport(SupportEntry.builder()
                        .category("sensory")
                        .description("Quiet corner with weighted blanket")
                        .pourMapping("operable, robust")
                        .status(" Active ")
                        .effectivenessRating(5.0)
                        .build())
                .addSupport(SupportEntry.builder()
                        .category("motor")
                        .description("Pencil grip for handwriting")
                        .status("paused")
                        .build())
                .build();
    }

    @Nested
    @DisplayName("Safe view")
    class SafeViewTests {

        @Test
        @DisplayName("should count categories and average ratings per category")
        void shouldAggregateSupports() {
            SafeView view = aggregator.aggregate(sampleRecord()).getSafeView();

            assertEquals(Arrays.asList("motor", "sensory"), view.getSupportCategories());
            assertEquals(Integer.valueOf(2), view.getCategoryCounts().get("sensory"));
            assertEquals(Integer.valueOf(1), view.getCategoryCounts().get("motor"));
            assertEquals(1, view.getEffectivenessByCategory().size());
            assertEquals(4.5, view.getEffectivenessByCategory().get("sensory"));
            assertEquals(2, view.getActiveSupportCount());
        }

        @Test
        @DisplayName("should reduce the name to its first token")
        void shouldUseFirstName() {
            assertEquals("Jordan", aggregator.aggregate(sampleRecord()).getSafeView().getFirstNameOnly());
        }

        @Test
        @DisplayName("should cut the name at non-ASCII whitespace")
        void shouldCutAtUnicodeWhitespace() {
            StudentRecord record = StudentRecord.builder().displayName("Yamada\u3000Taro").build();

            assertEquals("Yamada", aggregator.aggregate(record).getSafeView().getFirstNameOnly());
        }

        @Test
        @DisplayName("should fall back to a neutral name when the name is blank")
        void shouldFallBackForBlankName() {
            StudentRecord record = StudentRecord.builder().displayName("   ").build();

            assertEquals("Student", aggregator.aggregate(record).getSafeView().getFirstNameOnly());
        }

        @Test
        @DisplayName("should generalize strengths and goals into themes")
        void shouldGeneralizeThemes() {
            SafeView view = aggregator.aggregate(sampleRecord()).getSafeView();

            assertEquals(Arrays.asList("Creative expression", "Strong memory skills"), view.getStrengthThemes());
            assertEquals(Collections.singletonList("Post-secondary education"), view.getGoalThemes());
        }

        @Test
        @DisplayName("should fold UDL and POUR mappings of every shape")
        void shouldFoldTags() {
            SafeView view = aggregator.aggregate(sampleRecord()).getSafeView();

            assertEquals(Arrays.asList("1.1", "7.1", "8.3"), view.getUdlPrinciples());
            assertEquals(Arrays.asList("captions", "operable", "perceivable", "robust"), view.getPourPrinciples());
        }

        @Test
        @DisplayName("should not leak any free text from the record")
        void shouldNotLeakFreeText() {
            String rendered = aggregator.aggregate(sampleRecord()).getSafeView().toString();

            for (String secret : Arrays.asList("Alexis", "Reyes", "dinosaur", "palaeontology", "Diagnosed",
                    "grade two", "email", "headphones", "weighted blanket", "Pencil grip")) {
                assertFalse(rendered.contains(secret), "safe view leaked: " + secret);
            }
        }

        @Test
        @DisplayName("should group blank categories and ignore out-of-range ratings")
        void shouldHandleEdgeValues() {
            StudentRecord record = StudentRecord.builder()
                    .addSupport(SupportEntry.builder().category("  ").effectivenessRating(0.0).build())
                    .addSupport(SupportEntry.builder().effectivenessRating(7.0).build())
                    .addSupport(SupportEntry.builder().category("sensory").effectivenessRating(3.0).build())
                    .build();

            SafeView view = aggregator.aggregate(record).getSafeView();

            assertEquals(Integer.valueOf(2), view.getCategoryCounts().get("uncategorized"));
            assertFalse(view.getEffectivenessByCategory().containsKey("uncategorized"));
            assertEquals(3.0, view.getEffectivenessByCategory().get("sensory"));
        }

        @Test
        @DisplayName("should round averages half up to one decimal")
        void shouldRoundAverages() {
            StudentRecord record = StudentRecord.builder()
                    .addSupport(SupportEntry.builder().category("motor").effectivenessRating(4.0).build())
                    .addSupport(SupportEntry.builder().category("motor").effectivenessRating(4.0).build())
                    .addSupport(SupportEntry.builder().category("motor").effectivenessRating(5.0).build())
                    .build();

            assertEquals(4.3, aggregator.aggregate(record).getSafeView().getEffectivenessByCategory().get("motor"));
        }

        @Test
        @DisplayName("should produce an empty view for an empty record")
        void shouldHandleEmptyRecord() {
            SafeView view = aggregator.aggregate(StudentRecord.builder().build(), null, null).getSafeView();

            assertTrue(view.getSupportCategories().isEmpty());
            assertTrue(view.getStrengthThemes().isEmpty());
            assertEquals(0, view.getActiveSupportCount());
        }
    }

    @Nested
    @DisplayName("Full view")
    class FullViewTests {

        @Test
        @DisplayName("should wrap the confidential text in banners")
        void shouldWrapInBanners() {
            String text = aggregator.aggregate(sampleRecord()).getFullView().getConfidentialText();

            assertTrue(text.startsWith("=== CONFIDENTIAL STUDENT CONTEXT (DO NOT REVEAL TO TEACHER) ==="));
            assertTrue(text.endsWith("=== END CONFIDENTIAL ==="));
            assertTrue(text.contains("Student full name: Jordan Alexis Reyes"));
        }

        @Test
        @DisplayName("should render supports with ratings and tag dumps")
        void shouldRenderSupports() {
            String text = aggregator.aggregate(sampleRecord()).getFullView().getConfidentialText();

            assertTrue(text.contains("  [sensory/noise] Noise-cancelling headphones during assemblies (effectiveness: 4/5)"));
            assertTrue(text.contains("  [sensory/general] Quiet corner with weighted blanket (effectiveness: 5/5)"));
            assertTrue(text.contains("  [motor/general] Pencil grip for handwriting\n"));
            assertTrue(text.contains("    POUR: {\"perceivable\":[\"captions\"]}"));
            assertTrue(text.contains("    POUR: \"operable, robust\""));
            assertTrue(text.contains("    UDL: "));
        }

        @Test
        @DisplayName("should keep every free-text section")
        void shouldKeepFreeText() {
            String text = aggregator.aggregate(sampleRecord()).getFullView().getConfidentialText();

            assertTrue(text.contains("\n-- Strengths --\n  - Remembers every dinosaur species by name"));
            assertTrue(text.contains("-- History --\n  - Diagnosed with sensory processing disorder in grade two"));
            assertTrue(text.contains("-- Goals / Hopes --"));
            assertTrue(text.contains("  - Mother, Ms. Reyes, prefers email contact"));
            assertFalse(text.contains("-- Recent Tracking Logs --"));
        }

        @Test
        @DisplayName("should include only the ten most recent logs, truncated")
        void shouldLimitLogs() {
            List<ActivityLog> logs = new ArrayList<>();
            Instant base = Instant.parse("2025-03-01T09:00:00Z");
            for (int i = 0; i < 12; i++) {
                logs.add(new ActivityLog("teacher", String.format("impl-%02d", i), "ok",
                        base.plusSeconds(3600L * i)));
            }
            logs.add(new ActivityLog("aide", "x".repeat(250), "y", null));

            String text = aggregator.aggregate(StudentRecord.builder().build(), null, logs)
                    .getFullView().getConfidentialText();

            assertTrue(text.contains("-- Recent Tracking Logs --"));
            assertTrue(text.contains("impl: impl-11  outcome: ok"));
            assertTrue(text.contains("impl: impl-02"));
            assertFalse(text.contains("impl-01"));
            assertFalse(text.contains("impl-00"));
            assertFalse(text.contains("[aide]"));
            assertTrue(text.indexOf("impl-11") < text.indexOf("impl-10"));
        }

        @Test
        @DisplayName("should truncate long notes")
        void shouldTruncateNotes() {
            ActivityLog log = new ActivityLog("aide", "x".repeat(250), "done", Instant.now());

            String text = aggregator.aggregate(StudentRecord.builder().build(), null, Collections.singletonList(log))
                    .getFullView().getConfidentialText();

            assertTrue(text.contains("impl: " + "x".repeat(200) + "  outcome: done"));
            assertFalse(text.contains("x".repeat(201)));
        }

        @Test
        @DisplayName("should not print the text from toString")
        void shouldHideTextFromToString() {
            FullView view = aggregator.aggregate(sampleRecord()).getFullView();

            assertFalse(view.toString().contains("Reyes"));
        }
    }

    @Test
    void testAggregationIsDeterministic() {
        StudentRecord record = sampleRecord();

        assertEquals(aggregator.aggregate(record), aggregator.aggregate(record));
        assertEquals(aggregator.aggregate(record), new PrivacyAggregator().aggregate(record));
    }

    @Test
    void testRecentLogsSortsMissingTimestampsLast() {
        ActivityLog undated = new ActivityLog("aide", "a", "b", null);
        ActivityLog older = new ActivityLog("teacher", "c", "d", Instant.parse("2025-01-01T00:00:00Z"));
        ActivityLog newer = new ActivityLog("teacher", "e", "f", Instant.parse("2025-02-01T00:00:00Z"));

        assertEquals(Arrays.asList(newer, older, undated),
                PrivacyAggregator.recentLogs(Arrays.asList(undated, older, newer)));
    }

    @Test
    void testFirstNameOf() {
        assertEquals("Sam", PrivacyAggregator.firstNameOf("  Sam   Lee "));
        assertEquals("Student", PrivacyAggregator.firstNameOf(null));
        assertEquals("Amara", PrivacyAggregator.firstNameOf("\u2003Amara\u2003Okafor"));
        assertEquals("Lin", PrivacyAggregator.firstNameOf("Lin\u00a0Wei"));
        assertEquals("Student", PrivacyAggregator.firstNameOf("\u3000\u2003"));
        assertEquals("Student", PrivacyAggregator.firstNameOf("\u00a0"));
    }
    @Nested
    @DisplayName("Student support data")
    class StudentSupportData {

        @Test
        @DisplayName("should list active supports under the first name only")
        void shouldListActiveSupports() {
            String data = aggregator.studentSupportData(sampleRecord());

            assertTrue(data.startsWith("Student first name: Jordan\n\nActive supports: 2\n"));
            assertTrue(data.contains("  [sensory/noise] Noise-cancelling headphones during assemblies (effectiveness: 4/5)"));
            assertTrue(data.contains("  [sensory/general] Quiet corner with weighted blanket (effectiveness: 5/5)"));
            assertTrue(data.endsWith("Overall average effectiveness: 4.5/5\n"
                    + "Supports rated 3.5+: 2\n"
                    + "Supports rated below 3.0: 0"));
        }

        @Test
        @DisplayName("should leave out the surname, history, stakeholders and inactive supports")
        void shouldLeaveOutConfidentialFields() {
            String data = aggregator.studentSupportData(sampleRecord());

            assertFalse(data.contains("Reyes"));
            assertFalse(data.contains("Diagnosed"));
            assertFalse(data.contains("Mother"));
            assertFalse(data.contains("Pencil grip"));
        }

        @Test
        @DisplayName("should list every tracking log, newest first, with long notes cut")
        void shouldListTrackingLogs() {
            StringBuilder longNote = new StringBuilder();
            for (int i = 0; i < 40; i++) {
                longNote.append("0123456789");
            }
            StudentRecord record = StudentRecord.builder()
                    .displayName("Sam")
                    .addSupport(SupportEntry.builder()
                            .category("cognitive")
                            .description("Visual timetable")
                            .status("active")
                            .effectivenessRating(2.0)
                            .build())
                    .addSupport(SupportEntry.builder()
                            .category("technology")
                            .description("Text-to-speech")
                            .status("active")
                            .build())
                    .addActivityLog(new ActivityLog("student", "Used it in maths", null, null))
                    .addActivityLog(new ActivityLog("student", longNote.toString(), "Calmer start",
                            Instant.parse("2025-03-04T09:15:00Z")))
                    .build();

            String data = aggregator.studentSupportData(record);

            assertTrue(data.contains("  [technology/general] Text-to-speech (no rating yet)"));
            assertTrue(data.contains("-- Tracking Logs (2 entries) --\n  2025-03-04 09:15\n"
                    + "    Implementation: " + longNote.substring(0, 300) + "\n"
                    + "    Outcome: Calmer start\n"
                    + "  unknown\n"
                    + "    Implementation: Used it in maths\n"));
            assertTrue(data.endsWith("Overall average effectiveness: 2.0/5\n"
                    + "Supports rated 3.5+: 0\n"
                    + "Supports rated below 3.0: 1"));
        }

        @Test
        @DisplayName("should omit averages when nothing is rated")
        void shouldOmitAveragesWithoutRatings() {
            String data = aggregator.studentSupportData(StudentRecord.builder().displayName("Ana").build());

            assertEquals("Student first name: Ana\n\nActive supports: 0\n", data);
        }
    }
}
