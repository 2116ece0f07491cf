package org.accesstwin.consult.gateway.privacy;

import org.accesstwin.consult.common.ConsultConstants;
import org.accesstwin.consult.common.model.ProfileEntry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Maps free text onto a broad theme using an ordered rule table. The first matching
 * rule wins. Text no rule matches falls back to its first few words.
 */
public final class ThemeGeneralizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final List<ThemeRule> STRENGTH_RULES = Arrays.asList(
            new ThemeRule("memory|recall|remember", "Strong memory skills"),
            new ThemeRule("audit(ory)?|listen|hear", "Strong auditory processing"),
            new ThemeRule("visual|see|observ|notic", "Visual awareness"),
            new ThemeRule("creative|art|music|draw|paint|design", "Creative expression"),
            new ThemeRule("social|friend|peer|communicat|collaborat", "Social engagement"),
            new ThemeRule("technolog|comput|digital|software|device", "Technology proficiency"),
            new ThemeRule("read|liter|writ|story|book|narrat", "Literacy strengths"),
            new ThemeRule("math|number|calculat|logic|quantit", "Mathematical thinking"),
            new ThemeRule("organiz|plan|schedul|manag", "Organisational skills"),
            new ThemeRule("persist|determin|resilient|motivat|driven", "Persistence and motivation"),
            new ThemeRule("advocate|self-advocate|voice|speak up", "Self-advocacy"),
            new ThemeRule("problem.?solv|analyt|critical", "Analytical thinking"),
            new ThemeRule("curio|question|explor|investigat", "Intellectual curiosity"),
            new ThemeRule("empathy|caring|kind|compassion", "Empathy and compassion"),
            new ThemeRule("leader|mentor|initiative", "Leadership"),
            new ThemeRule("adapt|flexible|adjust", "Adaptability"),
            new ThemeRule("focus|concentrat|attent", "Focused attention"),
            new ThemeRule("kinesthet|movement|physical|motor|sport|athlet", "Physical/kinaesthetic strengths"),
            new ThemeRule("humor|funny|joke", "Sense of humour"),
            new ThemeRule("science|biology|chemistry|physics|lab", "Science aptitude")
    );

    private static final List<ThemeRule> GOAL_RULES = Arrays.asList(
            new ThemeRule("post.?secondary|college|university|higher.?ed", "Post-secondary education"),
            new ThemeRule("career|job|employ|work|profession", "Career aspirations"),
            new ThemeRule("independen|self.?suffic|autonomy", "Independence"),
            new ThemeRule("communit|belong|inclus|social", "Community participation"),
            new ThemeRule("technolog|comput|STEM|engineer", "Technology/STEM interests"),
            new ThemeRule("art|music|creativ|perform|theater|theatre", "Creative pursuits"),
            new ThemeRule("advocate|rights|justice|activis", "Advocacy and rights"),
            new ThemeRule("travel|explore|abroad", "Exploration and travel"),
            new ThemeRule("health|wellbeing|fitness", "Health and wellbeing"),
            new ThemeRule("mentor|teach|help others", "Mentoring others")
    );

    private static final ThemeGeneralizer STRENGTHS = new ThemeGeneralizer(STRENGTH_RULES);
    private static final ThemeGeneralizer GOALS = new ThemeGeneralizer(GOAL_RULES);

    private final List<ThemeRule> rules;

    public ThemeGeneralizer(List<ThemeRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public static ThemeGeneralizer strengths() {
        return STRENGTHS;
    }

    public static ThemeGeneralizer goals() {
        return GOALS;
    }

    public List<ThemeRule> getRules() {
        return rules;
    }

    /**
     * Returns the theme for {@code text}, or the empty string for blank text.
     */
    public String generalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        for (ThemeRule rule : rules) {
            if (rule.matches(text)) {
                return rule.getTheme();
            }
        }
        return fallback(text);
    }

    /**
     * Themes of all entries, deduplicated and sorted. Empty themes are dropped.
     */
    public List<String> themesOf(List<ProfileEntry> entries) {
        TreeSet<String> themes = new TreeSet<>();
        for (ProfileEntry entry : entries) {
            String theme = generalize(entry.getText());
            if (!theme.isEmpty()) {
                themes.add(theme);
            }
        }
        return new ArrayList<>(themes);
    }

    /**
     * Non-empty words of {@code text}, split on any Unicode whitespace.
     */
    static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        for (String word : WHITESPACE.split(text)) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    private static String fallback(String text) {
        List<String> words = words(text);
        int limit = ConsultConstants.FALLBACK_THEME_WORDS;
        if (words.size() <= limit) {
            return String.join(" ", words);
        }
        return String.join(" ", words.subList(0, limit)) + "...";
    }
}
