package structview;

import javax.swing.*;
import javax.swing.event.DocumentEvent;
import javax.swing.event.DocumentListener;
import javax.swing.text.BadLocationException;
import java.awt.*;
import java.awt.geom.Rectangle2D;
import java.beans.PropertyChangeEvent;
import java.beans.PropertyChangeListener;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Line numbers for the source pane; lines of the selected node get a marker bar. */
public class LineNumberGutter extends JComponent implements DocumentListener, PropertyChangeListener {
    private final JTextArea textArea;
    private Font mono = new Font(Font.MONOSPACED, Font.PLAIN, 12);
    private int lineCountCache = 1;
    private Set<Integer> focusLines = Set.of();
    private Color focusColor = new Color(120, 160, 255);

    public LineNumberGutter(JTextArea textArea) {
        this.textArea = textArea;
        setFont(mono);
        setForeground(new Color(120, 120, 120));
        setBackground(new Color(245, 245, 245));
        setOpaque(true);
        textArea.getDocument().addDocumentListener(this);
        textArea.addPropertyChangeListener(this);
        setPreferredWidth();
    }

    /** Zero-based line indexes to mark. */
    public void setFocusLines(List<Integer> lines) {
        focusLines = lines == null ? Set.of() : new HashSet<>(lines);
        repaint();
    }

    Set<Integer> focusLines() {
        return focusLines;
    }

    public void setFocusColor(Color color) {
        if (color != null) focusColor = color;
        repaint();
    }

    @Override public void setFont(Font font) {
        super.setFont(font);
        if (font != null && textArea != null) {
            mono = font.deriveFont(Math.max(10f, font.getSize2D() - 1f));
            setPreferredWidth();
        }
    }

    private void setPreferredWidth() {
        int lines = Math.max(1, textArea.getLineCount());
        int digits = String.valueOf(lines).length();
        int width = 14 + getFontMetrics(mono).charWidth('0') * digits + 10;
        setPreferredSize(new Dimension(width, Integer.MAX_VALUE));
        revalidate();
    }

    @Override public void paintComponent(Graphics g) {
        super.paintComponent(g);
        Rectangle clip = g.getClipBounds();
        g.setColor(getBackground());
        g.fillRect(clip.x, clip.y, clip.width, clip.height);

        g.setFont(mono);
        FontMetrics fm = getFontMetrics(mono);

        int first = Math.max(0, textArea.viewToModel2D(new Point(0, clip.y)));
        int last = Math.max(first, textArea.viewToModel2D(new Point(0, clip.y + clip.height)));

        try {
            int line = textArea.getLineOfOffset(first);
            int lastLine = textArea.getLineOfOffset(Math.min(last, textArea.getDocument().getLength()));
            while (line <= lastLine) {
                Rectangle2D view = textArea.modelToView2D(textArea.getLineStartOffset(line));
                if (view == null) break;
                Rectangle r = view.getBounds();
                if (focusLines.contains(line)) {
                    g.setColor(focusColor);
                    g.fillRect(0, r.y, 4, r.height);
                }
                String label = String.valueOf(line + 1);
                g.setColor(getForeground());
                g.drawString(label, getWidth() - 10 - fm.stringWidth(label), r.y + fm.getAscent());
                line = line + 1;
            }
        } catch (BadLocationException ex) {
            DebugLog.log("gutter paint outside document", ex);
        }
    }

    // document listener
    @Override public void insertUpdate(DocumentEvent e) { maybeUpdate(); }
    @Override public void removeUpdate(DocumentEvent e) { maybeUpdate(); }
    @Override public void changedUpdate(DocumentEvent e) { maybeUpdate(); }
    private void maybeUpdate() {
        int lc = textArea.getLineCount();
        if (lc != lineCountCache) {
            lineCountCache = lc;
            setPreferredWidth();
            repaint();
        }
    }

    @Override public void propertyChange(PropertyChangeEvent evt) {
        if ("font".equals(evt.getPropertyName())) {
            setPreferredWidth();
            repaint();
        }
    }
}
