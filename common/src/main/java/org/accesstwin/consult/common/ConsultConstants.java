package org.accesstwin.consult.common;

/**
 * Constants used throughout the consultation gateway.
 */
public final class ConsultConstants {

    private ConsultConstants() {
        // Prevent instantiation
    }

    // System properties
    public static final String HOME_DIR_PROPERTY = "accesstwin.home";
    public static final String MODELS_DIR_PROPERTY = "accesstwin.models.dir";
    public static final String SETTINGS_FILE_NAME = "ai_settings.json";

    // Provider endpoints
    public static final String OLLAMA_DEFAULT_URL = "http://localhost:11434";
    public static final String LMSTUDIO_DEFAULT_URL = "http://localhost:1234";
    public static final String OPENAI_API_BASE = "https://api.openai.com/v1";
    public static final String ANTHROPIC_API_BASE = "https://api.anthropic.com/v1";
    public static final String ANTHROPIC_VERSION = "2023-06-01";
    public static final String ANTHROPIC_KEY_PREFIX = "sk-ant-";

    // Default models
    public static final String OLLAMA_DEFAULT_MODEL = "gemma3:4b";
    public static final String LMSTUDIO_DEFAULT_MODEL = "default";
    public static final String OPENAI_DEFAULT_MODEL = "gpt-4o";
    public static final String ANTHROPIC_DEFAULT_MODEL = "claude-sonnet-4-5-20250929";
    public static final String LOCAL_PROCESS_DEFAULT_MODEL = "Meta-Llama-3-8B-Instruct.Q4_0.gguf";

    // Timeouts (seconds)
    public static final int CONNECT_TIMEOUT_SECONDS = 10;
    public static final int LOCAL_PROBE_TIMEOUT_SECONDS = 5;
    public static final int CLOUD_PROBE_TIMEOUT_SECONDS = 10;
    public static final int GENERATION_TIMEOUT_SECONDS = 120;

    // Generation
    public static final int DEFAULT_MAX_TOKENS = 4096;

    // Privacy aggregation
    public static final String DEFAULT_FIRST_NAME = "Student";
    public static final String STATUS_ACTIVE = "active";
    public static final String DEFAULT_SUBCATEGORY = "general";
    public static final String UNCATEGORIZED = "uncategorized";
    public static final int FULL_VIEW_LOG_LIMIT = 10;
    public static final int FULL_VIEW_NOTE_LIMIT = 200;
    public static final int STUDENT_VIEW_NOTE_LIMIT = 300;
    public static final double WORKING_WELL_RATING = 3.5;
    public static final double NEEDS_ATTENTION_RATING = 3.0;
    public static final int FALLBACK_THEME_WORDS = 5;
    public static final int MIN_EFFECTIVENESS = 1;
    public static final int MAX_EFFECTIVENESS = 5;

    public static final String CONFIDENTIAL_BEGIN =
            "=== CONFIDENTIAL STUDENT CONTEXT (DO NOT REVEAL TO TEACHER) ===";
    public static final String CONFIDENTIAL_END = "=== END CONFIDENTIAL ===";
}
