package structview;

import javax.swing.*;
import javax.swing.border.EmptyBorder;
import javax.swing.event.TreeExpansionEvent;
import javax.swing.event.TreeExpansionListener;
import javax.swing.tree.TreePath;
import javax.swing.tree.TreeSelectionModel;
import java.awt.*;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Main window: the document tree on the left, the source text on the right.
 * Selecting a node highlights its text; moving the caret selects the node under it.
 */
public class StructViewApp extends JFrame implements TreeView {

    static final String SAMPLE = "{\n"
            + "  \"name\": \"StructView\",\n"
            + "  \"version\": 1,\n"
            + "  \"categories\": [\n"
            + "    { \"title\": \"Formats\", \"tags\": [\"xml\", \"yaml\", \"json\", \"csv\"] },\n"
            + "    { \"title\": \"Excel\", \"tags\": [\"xlsx\"] }\n"
            + "  ],\n"
            + "  \"settings\": { \"maxDepth\": 10, \"theme\": \"Light\" }\n"
            + "}\n";

    private final ViewerSettings settings;
    private final DocumentSession session = new DocumentSession();
    private final EditorPane editor = new EditorPane("Source");
    private final DocumentTreeModel treeModel = new DocumentTreeModel(null);
    private final JTree tree = new JTree(treeModel);
    private final ThemeManager themes;
    private final SyncCoordinator sync;

    private final JLabel status = new JLabel("Ready.");
    private final JSpinner depthSpinner;
    private final JComboBox<DocumentFormat> formatBox = new JComboBox<>(DocumentFormat.values());

    private Path currentPath;

    public static void launch(ViewerSettings settings, ParsedDocument initial, Path path) {
        SwingUtilities.invokeLater(() -> {
            setSystemLookAndFeel();
            StructViewApp app = new StructViewApp(settings);
            if (initial != null) {
                app.showDocument(initial, path);
            } else {
                app.loadSampleDefaults();
            }
            app.setVisible(true);
        });
    }

    public StructViewApp(ViewerSettings settings) {
        super("StructView");
        this.settings = settings;
        this.themes = new ThemeManager(settings);
        this.sync = new SyncCoordinator(session, editor, this);
        this.depthSpinner = new JSpinner(new SpinnerNumberModel(settings.maxDepth(), 0, 100, 1));
        session.setMaxDepth(settings.maxDepth());

        setDefaultCloseOperation(EXIT_ON_CLOSE);
        setMinimumSize(new Dimension(1000, 650));
        getContentPane().setBackground(new Color(242, 244, 248));

        setJMenuBar(createMenuBar());

        tree.setRootVisible(true);
        tree.setShowsRootHandles(true);
        tree.setCellRenderer(new NodeCellRenderer(themes.palette()));
        tree.getSelectionModel().setSelectionMode(TreeSelectionModel.SINGLE_TREE_SELECTION);
        ToolTipManager.sharedInstance().registerComponent(tree);

        JScrollPane treeScroll = new JScrollPane(tree);
        treeScroll.setBorder(new EmptyBorder(4, 4, 4, 4));
        JPanel treePanel = new JPanel(new BorderLayout());
        treePanel.setBorder(new EmptyBorder(6, 6, 6, 6));
        treePanel.add(treeScroll, BorderLayout.CENTER);

        JSplitPane split = new JSplitPane(JSplitPane.HORIZONTAL_SPLIT, treePanel, editor.view());
        split.setResizeWeight(0.45);
        split.setDividerSize(8);

        JToolBar tools = new JToolBar();
        tools.setFloatable(false);
        tools.setBorder(new EmptyBorder(8, 12, 8, 12));
        tools.setBackground(new Color(245, 247, 252));
        tools.add(new JLabel("Format: "));
        tools.add(formatBox);
        JButton reloadBtn = new JButton("Reload");
        tools.add(reloadBtn);
        tools.addSeparator();
        tools.add(new JLabel("Max depth: "));
        tools.add(depthSpinner);

        JPanel statusBar = new JPanel(new BorderLayout());
        status.setBorder(new EmptyBorder(4, 8, 4, 8));
        statusBar.setBorder(BorderFactory.createMatteBorder(1, 0, 0, 0, new Color(230, 232, 238)));
        statusBar.setBackground(new Color(248, 248, 251));
        statusBar.add(status, BorderLayout.CENTER);

        getContentPane().setLayout(new BorderLayout());
        getContentPane().add(tools, BorderLayout.NORTH);
        getContentPane().add(split, BorderLayout.CENTER);
        getContentPane().add(statusBar, BorderLayout.SOUTH);

        reloadBtn.addActionListener(e -> reload());
        depthSpinner.addChangeListener(e -> applyMaxDepth((int) depthSpinner.getValue()));
        addTreeListeners();
        editor.onCaretLine(sync::onCaretLineChanged);

        FileDropHandler dropHandler = new FileDropHandler(this);
        getRootPane().setTransferHandler(dropHandler);
        tree.setTransferHandler(dropHandler);
        editor.area().setTransferHandler(dropHandler);
        editor.scroll().getViewport().setTransferHandler(dropHandler);

        themes.apply(editor, tree, getContentPane());

        pack();
        setSize(1200, 760);
        setLocationRelativeTo(null);
    }

    private static void setSystemLookAndFeel() {
        try {
            UIManager.setLookAndFeel(UIManager.getSystemLookAndFeelClassName());
        } catch (Exception ex) {
            DebugLog.log("System look and feel unavailable", ex);
        }
    }

    private JMenuBar createMenuBar() {
        JMenuBar mb = new JMenuBar();
        JMenu file = new JMenu("File");
        JMenuItem open = new JMenuItem("Open…");
        JMenuItem reload = new JMenuItem("Reload");
        JMenuItem prefs = new JMenuItem("Preferences…");
        JMenuItem exit = new JMenuItem("Exit");
        file.add(open);
        file.add(reload);
        file.addSeparator();
        file.add(prefs);
        file.addSeparator();
        file.add(exit);

        JMenu view = new JMenu("View");
        JMenuItem expandChildren = new JMenuItem("Expand Children");
        JMenuItem collapseAll = new JMenuItem("Collapse All");
        view.add(expandChildren);
        view.add(collapseAll);

        AppActions actions = new AppActions(this, tree);
        actions.wireMenu(open, reload, exit, expandChildren, collapseAll, prefs);
        actions.installOpenShortcut(getRootPane());

        mb.add(file);
        mb.add(view);
        return mb;
    }

    private void addTreeListeners() {
        tree.addTreeSelectionListener(e -> {
            TreePath p = e.getNewLeadSelectionPath();
            TreeNode node = p == null ? null : (TreeNode) p.getLastPathComponent();
            sync.onTreeSelectionChanged(node);
            if (node != null && !sync.latch().isActive(SyncLatch.Direction.FROM_EDITOR)) {
                describeSelection(node);
            }
        });
        tree.addTreeExpansionListener(new TreeExpansionListener() {
            @Override public void treeExpanded(TreeExpansionEvent event) {
                ((TreeNode) event.getPath().getLastPathComponent()).setExpanded(true);
            }
            @Override public void treeCollapsed(TreeExpansionEvent event) {
                ((TreeNode) event.getPath().getLastPathComponent()).setExpanded(false);
            }
        });
    }

    // === document lifecycle ===

    void openWithChooser() {
        JFileChooser fc = new JFileChooser(currentPath != null ? currentPath.toFile().getParentFile() : null);
        if (fc.showOpenDialog(this) == JFileChooser.APPROVE_OPTION) {
            open(fc.getSelectedFile().toPath());
        }
    }

    boolean open(Path p) {
        DocumentFormat forced = (DocumentFormat) formatBox.getSelectedItem();
        try {
            showDocument(DocumentLoader.load(p, forced), p);
            return true;
        } catch (IOException ex) {
            DebugLog.log("Open failed for " + p, ex);
            error("Failed to read " + p + ": " + ex.getMessage());
            return false;
        }
    }

    void reload() {
        if (currentPath != null) {
            open(currentPath);
            return;
        }
        DocumentFormat forced = (DocumentFormat) formatBox.getSelectedItem();
        if (forced == null || forced == DocumentFormat.AUTO || forced == DocumentFormat.EXCEL) {
            forced = DocumentFormat.detect(editor.text(), null);
        }
        try {
            showDocument(DocumentLoader.parse(editor.text(), forced), null);
        } catch (DocumentReadException ex) {
            error(ex.getMessage());
        }
    }

    void showDocument(ParsedDocument doc, Path path) {
        currentPath = path;
        session.load(doc);
        editor.setSource(path, doc.format());
        editor.setText(doc.sourceText());
        refreshTree();

        String name = path != null ? path.getFileName().toString() : "untitled";
        setTitle("StructView - " + name);
        setStatus("Opened " + name + " as " + doc.format().label() + ".");
    }

    void loadSampleDefaults() {
        try {
            showDocument(DocumentLoader.parse(SAMPLE, DocumentFormat.JSON), null);
            setStatus("Ready. Open a file or drop one here.");
        } catch (DocumentReadException ex) {
            error(ex.getMessage());
        }
    }

    private void applyMaxDepth(int depth) {
        if (depth == session.maxDepth()) return;
        settings.setMaxDepth(depth);
        session.setMaxDepth(depth);
        refreshTree();
        setStatus("Max depth set to " + depth + ".");
    }

    private void refreshTree() {
        treeModel.setRoot(session.root());
        editor.clearFocus();
        if (session.root() != null) {
            tree.expandRow(0);
        }
    }

    void openPreferences() {
        PreferencesDialog.Result r = PreferencesDialog.show(this, settings);
        if (r == null) return;
        settings.setFontSize(r.fontSize());
        settings.setThemeName(r.themeName());
        DebugLog.setEnabled(r.debugLogging());
        themes.apply(editor, tree, getContentPane());
        depthSpinner.setValue(r.maxDepth());
    }

    // === TreeView ===

    @Override
    public void reveal(List<TreeNode> path) {
        if (path.isEmpty()) return;
        TreePath treePath = DocumentTreeModel.pathOf(path);
        TreePath parent = treePath.getParentPath();
        if (parent != null) {
            tree.expandPath(parent);
        }
        tree.setSelectionPath(treePath);
        tree.scrollPathToVisible(treePath);
        describeSelection(path.get(path.size() - 1));
    }

    private void describeSelection(TreeNode node) {
        SourceRange r = session.selectedRange();
        if (r == null) {
            setStatus(node + " (no source location)");
        } else {
            setStatus(node + " at line " + r.startLine() + ", column " + r.startColumn());
        }
    }

    // === APIs used by FileDropHandler ===

    void handleDropError(String msg) {
        error(msg);
    }

    private void setStatus(String s) {
        status.setText(s);
    }

    private void error(String s) {
        JOptionPane.showMessageDialog(this, s, "Error", JOptionPane.ERROR_MESSAGE);
        setStatus("Error: " + s);
    }
}
