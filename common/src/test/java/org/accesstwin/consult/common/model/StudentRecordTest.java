package org.accesstwin.consult.common.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StudentRecord and its entry types.
 */
class StudentRecordTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    // ========== Builder Tests ==========

    @Test
    void testBuilder_collectsEntriesInOrder() {
        StudentRecord record = StudentRecord.builder()
                .displayName("Maya Lopez")
                .addStrength("Great memory")
                .addStrength("Loves drawing")
                .addGoal("Go to college")
                .build();

        assertEquals("Maya Lopez", record.getDisplayName());
        assertEquals(2, record.getStrengths().size());
        assertEquals("Great memory", record.getStrengths().get(0).getText());
        assertEquals("Loves drawing", record.getStrengths().get(1).getText());
        assertEquals(1, record.getGoals().size());
        assertTrue(record.getHistory().isEmpty());
        assertTrue(record.getSupports().isEmpty());
    }

    @Test
    void testConstructor_nullListsBecomeEmpty() {
        StudentRecord record = new StudentRecord(null, null, null, null, null, null, null);

        assertNull(record.getDisplayName());
        assertTrue(record.getStrengths().isEmpty());
        assertTrue(record.getStakeholders().isEmpty());
        assertTrue(record.getActivityLogs().isEmpty());
    }

    @Test
    void testConstructor_dropsNullElements() {
        StudentRecord record = new StudentRecord("A", Arrays.asList(ProfileEntry.of("x"), null),
                null, null, null, null, null);

        assertEquals(1, record.getStrengths().size());
    }

    @Test
    void testLists_areUnmodifiable() {
        StudentRecord record = StudentRecord.builder().addStrength("x").build();

        assertThrows(UnsupportedOperationException.class,
                () -> record.getStrengths().add(ProfileEntry.of("y")));
    }

    @Test
    void testWithSupports_keepsProfileFields() {
        StudentRecord record = StudentRecord.builder()
                .displayName("Sam")
                .addStrength("Curious")
                .build();

        StudentRecord merged = record.withSupports(
                List.of(SupportEntry.builder().category("sensory").build()), null);

        assertEquals("Sam", merged.getDisplayName());
        assertEquals(1, merged.getStrengths().size());
        assertEquals(1, merged.getSupports().size());
        assertTrue(merged.getActivityLogs().isEmpty());
    }

    @Test
    void testToString_doesNotContainFreeText() {
        StudentRecord record = StudentRecord.builder()
                .displayName("Maya Lopez")
                .addHistory("Diagnosed in 2019")
                .build();

        String text = record.toString();
        assertFalse(text.contains("Maya"));
        assertFalse(text.contains("2019"));
    }

    // ========== Support Entry Tests ==========

    @Test
    void testSupportEntry_defaultsToActive() {
        SupportEntry entry = SupportEntry.builder().category("motor").build();
        assertEquals("active", entry.getStatus());
        assertFalse(entry.hasRating());
    }

    // ========== JSON Tests ==========

    @Test
    void testJson_acceptsBareStringsAndObjects() throws Exception {
        String json = "{"
                + "\"displayName\": \"Jordan Lee\","
                + "\"strengths\": [\"Strong listener\", {\"text\": \"Good at math\", \"priority\": 1}],"
                + "\"supports\": [{"
                + "   \"category\": \"sensory\","
                + "   \"description\": \"Noise-cancelling headphones\","
                + "   \"udlMapping\": {\"Engagement\": [\"7.3\"]},"
                + "   \"pourMapping\": \"[\\\"Perceivable\\\"]\","
                + "   \"effectivenessRating\": 4"
                + "}],"
                + "\"activityLogs\": [{\"role\": \"teacher\", \"outcomeNote\": \"calmer\","
                + "   \"timestamp\": \"2025-03-01T10:15:30Z\"}]"
                + "}";

        StudentRecord record = objectMapper.readValue(json, StudentRecord.class);

        assertEquals("Jordan Lee", record.getDisplayName());
        assertEquals(2, record.getStrengths().size());
        assertEquals("Strong listener", record.getStrengths().get(0).getText());
        assertNull(record.getStrengths().get(0).getPriority());
        assertEquals(Integer.valueOf(1), record.getStrengths().get(1).getPriority());

        SupportEntry support = record.getSupports().get(0);
        assertEquals(4.0, support.getEffectivenessRating());
        assertTrue(support.getUdlMapping() instanceof Map);
        assertTrue(support.getPourMapping() instanceof String);
        assertEquals("active", support.getStatus());

        ActivityLog log = record.getActivityLogs().get(0);
        assertEquals(Instant.parse("2025-03-01T10:15:30Z"), log.getTimestamp());
        assertNull(log.getImplementationNote());
    }
}
