package structview;

import javax.swing.*;
import javax.swing.tree.DefaultTreeCellRenderer;
import java.awt.*;

/** Renders a {@link TreeNode} as "name: value (type)" with a kind badge. */
class NodeCellRenderer extends DefaultTreeCellRenderer {

    private ThemeManager.ThemePalette palette;

    NodeCellRenderer(ThemeManager.ThemePalette palette) {
        this.palette = palette;
    }

    void setPalette(ThemeManager.ThemePalette palette) {
        this.palette = palette;
        setBackgroundNonSelectionColor(palette.editorBg());
        setTextNonSelectionColor(palette.editorFg());
    }

    @Override
    public Component getTreeCellRendererComponent(JTree tree, Object value, boolean selected, boolean expanded,
                                                  boolean leaf, int row, boolean hasFocus) {
        super.getTreeCellRendererComponent(tree, value, selected, expanded, leaf, row, hasFocus);
        if (!(value instanceof TreeNode node)) {
            return this;
        }
        setText(label(node, selected));
        setIcon(Icons.forKind(node.kind()));
        setToolTipText(node.hasSourceSpan() ? "Lines " + node.sourceSpan().startLine() + "-" + node.sourceSpan().endLine() : null);
        return this;
    }

    private String label(TreeNode node, boolean selected) {
        StringBuilder sb = new StringBuilder("<html>");
        String name = node.name() == null ? "root" : node.name();
        sb.append("<b>").append(html(name)).append("</b>");

        if (!node.displayValue().isEmpty()) {
            boolean marker = node.kind().isMarker();
            sb.append(": ");
            if (marker && !selected) {
                sb.append("<i><font color='").append(hex(palette.markerFg())).append("'>")
                        .append(html(node.displayValue())).append("</font></i>");
            } else {
                sb.append(html(node.displayValue()));
            }
        }
        if (!node.typeLabel().isEmpty()) {
            sb.append(" ");
            if (!selected) sb.append("<font color='").append(hex(palette.typeFg())).append("'>");
            sb.append("(").append(html(node.typeLabel())).append(")");
            if (!selected) sb.append("</font>");
        }
        return sb.append("</html>").toString();
    }

    private static String hex(Color c) {
        return String.format("#%02x%02x%02x", c.getRed(), c.getGreen(), c.getBlue());
    }

    static String html(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        int i = 0;
        int n = s.length();
        while (i < n) {
            char c = s.charAt(i);
            if (c == '<') sb.append("&lt;");
            else if (c == '>') sb.append("&gt;");
            else if (c == '&') sb.append("&amp;");
            else sb.append(c);
            i = i + 1;
        }
        return sb.toString();
    }
}
