package structview;

import javax.swing.*;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.util.EnumMap;
import java.util.Map;

/** Small letter badges for file headers and tree rows. */
final class Icons {

    private static final Map<NodeKind, Icon> KIND_ICONS = new EnumMap<>(NodeKind.class);

    private Icons() {}

    static Icon forFormat(DocumentFormat format) {
        if (format == null) format = DocumentFormat.AUTO;
        switch (format) {
            case EXCEL:
                return letterIcon('X', new Color(56, 142, 60), Color.WHITE);
            case XML:
                return letterIcon('<', new Color(230, 120, 40), Color.WHITE);
            case JSON:
                return letterIcon('J', new Color(33, 150, 243), Color.WHITE);
            case YAML:
                return letterIcon('Y', new Color(156, 39, 176), Color.WHITE);
            case CSV:
                return letterIcon('C', new Color(0, 137, 123), Color.WHITE);
            default:
                Icon sys = UIManager.getIcon("FileView.fileIcon");
                return sys != null ? sys : letterIcon('F', new Color(90, 95, 115), Color.WHITE);
        }
    }

    static synchronized Icon forKind(NodeKind kind) {
        return KIND_ICONS.computeIfAbsent(kind, Icons::createKindIcon);
    }

    private static Icon createKindIcon(NodeKind kind) {
        switch (kind) {
            case COLLECTION:
                return letterIcon('[', new Color(63, 81, 181), Color.WHITE);
            case DICTIONARY:
                return letterIcon('D', new Color(0, 150, 136), Color.WHITE);
            case OBJECT:
                return letterIcon('{', new Color(96, 125, 139), Color.WHITE);
            case STRING:
                return letterIcon('S', new Color(76, 175, 80), Color.WHITE);
            case PRIMITIVE:
                return letterIcon('#', new Color(255, 152, 0), Color.WHITE);
            case ENUM:
                return letterIcon('E', new Color(121, 85, 72), Color.WHITE);
            case DATE_TIME:
            case TIME_SPAN:
                return letterIcon('T', new Color(3, 169, 244), Color.WHITE);
            case GUID:
                return letterIcon('G', new Color(158, 158, 158), Color.WHITE);
            case CIRCULAR_REFERENCE:
                return letterIcon('@', new Color(229, 57, 53), Color.WHITE);
            case MAX_DEPTH_REACHED:
                return letterIcon('+', new Color(189, 189, 189), Color.BLACK);
            default:
                return letterIcon('-', new Color(224, 224, 224), Color.DARK_GRAY);
        }
    }

    static Icon letterIcon(char letter, Color bg, Color fg) {
        int size = 16;
        BufferedImage img = new BufferedImage(size, size, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(bg);
            g.fillRoundRect(0, 0, size - 1, size - 1, 4, 4);
            g.setColor(new Color(0, 0, 0, 40));
            g.drawRoundRect(0, 0, size - 1, size - 1, 4, 4);

            g.setColor(fg);
            g.setFont(new Font("SansSerif", Font.BOLD, 11));
            FontMetrics fm = g.getFontMetrics();

            String s = String.valueOf(Character.toUpperCase(letter));
            int x = (size - fm.stringWidth(s)) / 2;
            int y = (size + fm.getAscent() - fm.getDescent()) / 2;
            g.drawString(s, x, y);
        } finally {
            g.dispose();
        }
        return new ImageIcon(img);
    }
}
