package structview;

import javax.swing.*;
import java.awt.*;

/**
 * Centralizes theme + font handling for the source pane and the tree.
 */
public class ThemeManager {

    public static final String LIGHT = "Light";
    public static final String SOFT_DARK = "Soft Dark";

    public record ThemePalette(Color editorBg, Color editorFg,
                               Color gutterBg, Color gutterFg,
                               Color panelBg, Color focus,
                               Color typeFg, Color markerFg) {}

    private final ViewerSettings settings;

    public ThemeManager(ViewerSettings settings) {
        this.settings = settings;
    }

    public ThemePalette palette() {
        return paletteForName(settings.themeName());
    }

    public void apply(EditorPane editor, JTree tree, Container root) {
        applyFontSize(editor, tree);
        applyTheme(editor, tree, root);
    }

    public void applyFontSize(EditorPane editor, JTree tree) {
        Font main = new Font(Font.MONOSPACED, Font.PLAIN, settings.fontSize());
        editor.applyFont(main);
        if (tree != null) {
            Font treeFont = tree.getFont() != null ? tree.getFont() : main;
            tree.setFont(treeFont.deriveFont((float) Math.max(10, settings.fontSize() - 1)));
            tree.setRowHeight(0);
        }
    }

    public void applyTheme(EditorPane editor, JTree tree, Container root) {
        ThemePalette palette = palette();

        editor.applyColors(palette.editorBg(), palette.editorFg(), palette.gutterBg(), palette.gutterFg(),
                palette.panelBg(), palette.focus());
        if (tree != null) {
            tree.setBackground(palette.editorBg());
            tree.setForeground(palette.editorFg());
            if (tree.getCellRenderer() instanceof NodeCellRenderer renderer) {
                renderer.setPalette(palette);
            }
            tree.repaint();
        }
        if (root != null) {
            root.setBackground(palette.panelBg());
        }
    }

    public ThemePalette paletteForName(String theme) {
        boolean dark = SOFT_DARK.equalsIgnoreCase(theme);
        Color bgEditor = dark ? new Color(28, 32, 38) : new Color(250, 251, 254);
        Color fgEditor = dark ? new Color(230, 232, 236) : Color.BLACK;
        Color gutterBg = dark ? new Color(38, 43, 50) : new Color(245, 245, 245);
        Color gutterFg = dark ? new Color(190, 195, 205) : new Color(120, 120, 120);
        Color panelBg = dark ? new Color(32, 36, 44) : new Color(245, 247, 252);
        Color focus = dark ? new Color(90, 130, 220) : new Color(120, 160, 255);
        Color typeFg = dark ? new Color(140, 170, 210) : new Color(100, 110, 140);
        Color markerFg = dark ? new Color(240, 130, 120) : new Color(200, 60, 50);
        return new ThemePalette(bgEditor, fgEditor, gutterBg, gutterFg, panelBg, focus, typeFg, markerFg);
    }
}
