package structview;

import javax.swing.*;
import javax.swing.border.EmptyBorder;
import javax.swing.event.CaretEvent;
import javax.swing.text.BadLocationException;
import javax.swing.text.DefaultHighlighter;
import javax.swing.text.Highlighter;
import java.awt.*;
import java.awt.geom.Rectangle2D;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Read-only source pane: header, line numbers and the text the tree was built from.
 * Tree selections arrive through {@link #selectRange}; caret moves are reported as 1-based lines.
 */
public final class EditorPane implements TextView {

    private final String fallbackTitle;

    private Path path;
    private DocumentFormat format = DocumentFormat.AUTO;

    private final JTextArea area;
    private final JScrollPane scroll;
    private final LineNumberGutter gutter;
    private final JLabel header;
    private final JPanel view;

    private final Highlighter highlighter;
    private Highlighter.HighlightPainter focusPainter =
            new DefaultHighlighter.DefaultHighlightPainter(new Color(120, 160, 255, 60));
    private Object focusTag;

    private IntConsumer caretLineListener = line -> {};
    private boolean suppressCaretEvents = false;

    public EditorPane(String fallbackTitle) {
        this.fallbackTitle = fallbackTitle;

        this.area = createEditor();
        this.highlighter = area.getHighlighter();

        this.gutter = new LineNumberGutter(area);

        this.scroll = new JScrollPane(area);
        this.scroll.setBorder(new EmptyBorder(4, 4, 4, 4));
        this.scroll.getViewport().setBackground(area.getBackground());
        this.scroll.setRowHeaderView(gutter);

        this.header = createHeaderLabel(fallbackTitle);

        this.view = new JPanel(new BorderLayout());
        this.view.setBorder(BorderFactory.createCompoundBorder(
                new EmptyBorder(6, 6, 6, 6),
                BorderFactory.createLineBorder(new Color(230, 232, 238), 1, true)
        ));
        this.view.setBackground(new Color(245, 247, 252));
        this.view.add(header, BorderLayout.NORTH);
        this.view.add(scroll, BorderLayout.CENTER);

        area.addCaretListener(this::caretMoved);
        refreshHeader();
    }

    // ---- Public API ----

    public JComponent view() {
        return view;
    }

    public JTextArea area() {
        return area;
    }

    public JScrollPane scroll() {
        return scroll;
    }

    public LineNumberGutter gutter() {
        return gutter;
    }

    public Path path() {
        return path;
    }

    public void setSource(Path path, DocumentFormat format) {
        this.path = path;
        this.format = format == null ? DocumentFormat.AUTO : format;
        refreshHeader();
    }

    public String text() {
        return area.getText();
    }

    /** Replaces the text without reporting the caret jump it causes. */
    public void setText(String text) {
        suppressCaretEvents = true;
        try {
            clearFocus();
            area.setText(text == null ? "" : text);
            area.setCaretPosition(0);
        } finally {
            suppressCaretEvents = false;
        }
    }

    public void onCaretLine(IntConsumer listener) {
        this.caretLineListener = listener == null ? line -> {} : listener;
    }

    @Override
    public void selectRange(int start, int end) {
        int len = area.getDocument().getLength();
        int s = clamp(start, 0, len);
        int e = clamp(end, s, len);

        area.setCaretPosition(s);
        area.moveCaretPosition(e);
        focusLines(s, e);
        scrollToOffset(s);
    }

    public void clearFocus() {
        if (focusTag != null) {
            highlighter.removeHighlight(focusTag);
            focusTag = null;
        }
        gutter.setFocusLines(List.of());
    }

    /** Marks every line touched by [start, end) in the gutter and with a background highlight. */
    void focusLines(int start, int end) {
        clearFocus();
        try {
            int firstLine = area.getLineOfOffset(start);
            int lastLine = area.getLineOfOffset(Math.max(start, end - 1));
            int from = area.getLineStartOffset(firstLine);
            int to = area.getLineEndOffset(lastLine);
            focusTag = highlighter.addHighlight(from, to, focusPainter);

            List<Integer> lines = new ArrayList<>();
            int line = firstLine;
            while (line <= lastLine) {
                lines.add(line);
                line = line + 1;
            }
            gutter.setFocusLines(lines);
        } catch (BadLocationException ex) {
            DebugLog.log("focusLines out of range", ex);
        }
    }

    public void applyFont(Font font) {
        if (font == null) return;
        area.setFont(font);
        gutter.setFont(font);
    }

    public void applyColors(Color editorBg, Color editorFg, Color gutterBg, Color gutterFg,
                            Color panelBg, Color focusColor) {
        if (editorBg != null) {
            area.setBackground(editorBg);
            scroll.getViewport().setBackground(editorBg);
        }
        if (editorFg != null) {
            area.setForeground(editorFg);
            area.setCaretColor(editorFg);
        }
        if (gutterBg != null) gutter.setBackground(gutterBg);
        if (gutterFg != null) gutter.setForeground(gutterFg);
        if (panelBg != null) view.setBackground(panelBg);
        if (focusColor != null) {
            gutter.setFocusColor(focusColor);
            focusPainter = new DefaultHighlighter.DefaultHighlightPainter(
                    new Color(focusColor.getRed(), focusColor.getGreen(), focusColor.getBlue(), 60));
        }
    }

    // ---- Header ----

    public void refreshHeader() {
        String name = path != null ? path.getFileName().toString() : fallbackTitle;
        String suffix = format != DocumentFormat.AUTO ? "  (" + format.label() + ")" : "";
        header.setText("  " + name + suffix);
        header.setToolTipText(path != null ? path.toString() : null);
        header.setIcon(Icons.forFormat(format));
    }

    String headerText() {
        return header.getText();
    }

    // ---- Internals ----

    private void caretMoved(CaretEvent e) {
        if (suppressCaretEvents) return;
        try {
            caretLineListener.accept(area.getLineOfOffset(e.getDot()) + 1);
        } catch (BadLocationException ex) {
            DebugLog.log("caret outside document", ex);
        }
    }

    private void scrollToOffset(int offset) {
        try {
            Rectangle2D r = area.modelToView2D(offset);
            if (r != null) {
                area.scrollRectToVisible(r.getBounds());
            }
        } catch (BadLocationException ex) {
            DebugLog.log("scroll target out of range", ex);
        }
    }

    private static JLabel createHeaderLabel(String fallbackTitle) {
        JLabel header = new JLabel("  " + fallbackTitle);
        header.setFont(header.getFont().deriveFont(Font.BOLD, 12f));
        header.setForeground(new Color(90, 95, 115));
        header.setBorder(new EmptyBorder(6, 4, 4, 4));
        header.setHorizontalAlignment(SwingConstants.LEFT);
        return header;
    }

    private static JTextArea createEditor() {
        JTextArea area = new JTextArea();
        area.setEditable(false);
        area.setTabSize(4);
        area.setLineWrap(false);
        area.setMargin(new Insets(8, 10, 8, 10));
        area.setBackground(new Color(250, 251, 254));
        area.setBorder(BorderFactory.createEmptyBorder());
        area.getCaret().setVisible(true);
        return area;
    }

    private static int clamp(int v, int lo, int hi) {
        if (v < lo) return lo;
        if (v > hi) return hi;
        return v;
    }
}
