package structview;

import javax.swing.*;
import javax.swing.tree.TreePath;
import java.awt.Toolkit;
import java.awt.event.ActionEvent;
import java.awt.event.KeyEvent;

/**
 * Centralizes action wiring for menus and shortcuts.
 */
public class AppActions {

    private final StructViewApp app;
    private final JTree tree;

    public AppActions(StructViewApp app, JTree tree) {
        this.app = app;
        this.tree = tree;
    }

    public void wireMenu(JMenuItem open, JMenuItem reload, JMenuItem exit,
                         JMenuItem expandChildren, JMenuItem collapseAll,
                         JMenuItem prefsItem) {
        open.addActionListener(e -> app.openWithChooser());
        reload.addActionListener(e -> app.reload());
        exit.addActionListener(e -> app.dispose());
        expandChildren.addActionListener(e -> expandSelectedChildren());
        collapseAll.addActionListener(e -> collapseAll());
        prefsItem.addActionListener(e -> app.openPreferences());
    }

    public void installOpenShortcut(JComponent c) {
        int mask = Toolkit.getDefaultToolkit().getMenuShortcutKeyMaskEx();
        KeyStroke openStroke = KeyStroke.getKeyStroke(KeyEvent.VK_O, mask);
        c.getInputMap(JComponent.WHEN_IN_FOCUSED_WINDOW).put(openStroke, "open-file");
        c.getActionMap().put("open-file", new AbstractAction() {
            @Override public void actionPerformed(ActionEvent e) {
                app.openWithChooser();
            }
        });
    }

    /** Expands the selected row and its direct children, one level at a time so the tree stays lazy. */
    void expandSelectedChildren() {
        TreePath selected = tree.getSelectionPath();
        if (selected == null) {
            if (tree.getRowCount() == 0) return;
            selected = tree.getPathForRow(0);
        }
        tree.expandPath(selected);
        TreeNode node = (TreeNode) selected.getLastPathComponent();
        for (TreeNode child : node.children()) {
            if (child.hasChildren()) {
                tree.expandPath(selected.pathByAddingChild(child));
            }
        }
    }

    void collapseAll() {
        int row = tree.getRowCount() - 1;
        while (row > 0) {
            tree.collapseRow(row);
            row = row - 1;
        }
    }
}
