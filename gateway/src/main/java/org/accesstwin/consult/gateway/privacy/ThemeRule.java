package org.accesstwin.consult.gateway.privacy;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One row of a theme table: text matching {@code pattern} anywhere maps to {@code theme}.
 */
public final class ThemeRule {

    private final Pattern pattern;
    private final String theme;

    public ThemeRule(String regex, String theme) {
        this.pattern = Pattern.compile(Objects.requireNonNull(regex, "regex cannot be null"),
                Pattern.CASE_INSENSITIVE);
        this.theme = Objects.requireNonNull(theme, "theme cannot be null");
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }

    public Pattern getPattern() {
        return pattern;
    }

    public String getTheme() {
        return theme;
    }

    @Override
    public String toString() {
        return "ThemeRule{" + pattern.pattern() + " -> " + theme + '}';
    }
}
