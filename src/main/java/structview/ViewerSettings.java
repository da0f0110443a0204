package structview;

/**
 * Viewer options: tree depth limit, editor font size and theme. Held in memory only.
 */
public final class ViewerSettings {

    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final int DEFAULT_FONT_SIZE = 13;
    public static final String DEFAULT_THEME = "Light";

    private int maxDepth = DEFAULT_MAX_DEPTH;
    private int fontSize = DEFAULT_FONT_SIZE;
    private String themeName = DEFAULT_THEME;

    public int maxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        checkMaxDepth(maxDepth);
        this.maxDepth = maxDepth;
    }

    public int fontSize() {
        return fontSize;
    }

    public void setFontSize(int fontSize) {
        if (fontSize < 6 || fontSize > 72) {
            throw new IllegalArgumentException("Font size must be between 6 and 72: " + fontSize);
        }
        this.fontSize = fontSize;
    }

    public String themeName() {
        return themeName;
    }

    public void setThemeName(String themeName) {
        this.themeName = themeName == null || themeName.isBlank() ? DEFAULT_THEME : themeName;
    }

    static void checkMaxDepth(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("Max depth must be zero or more: " + maxDepth);
        }
    }
}
