package io.parlance.cli.ui;

/// ANSI text styling for terminal output.
///
/// Every method returns the styled string; printing is the caller's concern. With color
/// disabled the text is returned unchanged, which keeps output stable for scripts and tests.
///
/// ```java
/// AnsiStyles styles = AnsiStyles.of(true);
/// out.println(styles.checkmark() + " " + styles.verb("GET") + " TEXT");
/// ```
///
/// @implNote **Thread-safe**. Instances are immutable.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String DIM = "\033[38;5;241m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String MAGENTA = "\033[38;5;170m";
    private static final String RESET = "\033[0m";

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// Creates styles with the given color preference.
    ///
    /// @param useColor true to emit ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    public boolean isColorEnabled() {
        return useColor;
    }

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    public String bold(String text) {
        return style(text, BOLD);
    }

    /// Secondary text: hints, previews, separators.
    public String dim(String text) {
        return style(text, DIM);
    }

    public String success(String text) {
        return style(text, GREEN);
    }

    public String error(String text) {
        return style(text, RED);
    }

    public String warn(String text) {
        return style(text, YELLOW);
    }

    /// Verb names and families.
    public String verb(String text) {
        return style(text, BOLD + BLUE);
    }

    /// Prepositions and other keywords.
    public String keyword(String text) {
        return style(text, BLUE);
    }

    /// Variable names, rendered in brackets.
    public String variable(String name) {
        return style("[" + name + "]", MAGENTA);
    }

    /// Green on success, red on failure.
    public String outcome(String text, boolean isSuccess) {
        return style(text, isSuccess ? GREEN : RED);
    }

    public String checkmark() {
        return style("✓", GREEN);
    }

    public String crossmark() {
        return style("✗", RED);
    }

    public String bullet() {
        return style("•", DIM);
    }

    /// Arrow between a step and the next one in a chain.
    public String arrow() {
        return style("→", BLUE);
    }

    /// Horizontal rule of the given width.
    public String rule(int width) {
        return style("─".repeat(Math.max(0, width)), DIM);
    }

    /// Shortens text to at most `max` characters, appending `...` when cut.
    ///
    /// @param text the text, not null
    /// @param max maximum length including the ellipsis, at least 4
    /// @return text unchanged if short enough, else a shortened copy
    public static String preview(String text, int max) {
        String flat = text.replace("\r", "").replace('\n', ' ');
        if (flat.length() <= max) {
            return flat;
        }
        return flat.substring(0, Math.max(0, max - 3)) + "...";
    }
}
