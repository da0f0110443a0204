package structview;

import org.junit.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class EditorPaneTest {

    @Test
    public void setTextDoesNotReportCaretMoves() {
        EditorPane pane = new EditorPane("Source");
        List<Integer> lines = new ArrayList<>();
        pane.onCaretLine(lines::add);

        pane.setText("one\ntwo\nthree");
        assertTrue(lines.isEmpty());
        assertFalse(pane.area().isEditable());

        pane.area().setCaretPosition(5);
        assertEquals(List.of(2), lines);
    }

    @Test
    public void selectRangeSelectsAndMarksLines() {
        EditorPane pane = new EditorPane("Source");
        pane.setText("one\ntwo\nthree");

        pane.selectRange(4, 11);
        assertEquals(4, pane.area().getSelectionStart());
        assertEquals(11, pane.area().getSelectionEnd());
        assertEquals(Set.of(1, 2), pane.gutter().focusLines());

        pane.clearFocus();
        assertTrue(pane.gutter().focusLines().isEmpty());
    }

    @Test
    public void outOfRangeSelectionIsClamped() {
        EditorPane pane = new EditorPane("Source");
        pane.setText("abc");
        pane.selectRange(-4, 99);
        assertEquals(0, pane.area().getSelectionStart());
        assertEquals(3, pane.area().getSelectionEnd());
    }

    @Test
    public void headerShowsFileAndFormat() {
        EditorPane pane = new EditorPane("Source");
        assertEquals("  Source", pane.headerText());
        pane.setSource(Path.of("dir", "data.yaml"), DocumentFormat.YAML);
        assertEquals("  data.yaml  (YAML)", pane.headerText());
    }

    @Test
    public void themeAppliesToPane() {
        ViewerSettings settings = new ViewerSettings();
        settings.setThemeName(ThemeManager.SOFT_DARK);
        ThemeManager themes = new ThemeManager(settings);
        EditorPane pane = new EditorPane("Source");

        themes.apply(pane, null, null);
        assertEquals(themes.palette().editorBg(), pane.area().getBackground());
        assertEquals(settings.fontSize(), pane.area().getFont().getSize());
        assertFalse(themes.paletteForName(ThemeManager.LIGHT).editorBg().equals(pane.area().getBackground()));
    }
}
