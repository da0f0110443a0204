package structview;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the tree selection and the text caret in step.
 * <p>
 * Tree → editor: a selected node's span is resolved to offsets and selected in the text.
 * Editor → tree: the deepest node whose span contains the caret line is revealed and selected.
 * Each direction holds the {@link SyncLatch} while it drives the other view, so the
 * resulting selection/caret events are ignored instead of bouncing back.
 */
public class SyncCoordinator {

    private final DocumentSession session;
    private final TextView textView;
    private final TreeView treeView;
    private final SyncLatch latch = new SyncLatch();

    public SyncCoordinator(DocumentSession session, TextView textView, TreeView treeView) {
        this.session = session;
        this.textView = textView;
        this.treeView = treeView;
    }

    public SyncLatch latch() {
        return latch;
    }

    public void onTreeSelectionChanged(TreeNode node) {
        if (latch.isActive(SyncLatch.Direction.FROM_EDITOR)) return;

        String text = session.sourceText();
        if (node == null || !node.hasSourceSpan() || text.isEmpty()) {
            session.select(node, null);
            return;
        }

        SourceRange range = SourceLocator.locate(text, node.sourceSpan());
        session.select(node, range);

        if (!latch.tryEnter(SyncLatch.Direction.FROM_TREE)) return;
        try {
            DebugLog.log("tree -> editor: %s [%d, %d)", node.name(), range.startOffset(), range.endOffset());
            textView.selectRange(range.startOffset(), range.endOffset());
        } finally {
            latch.exit();
        }
    }

    /** {@code line} is 1-based. */
    public void onCaretLineChanged(int line) {
        if (latch.isActive(SyncLatch.Direction.FROM_TREE)) return;
        TreeNode root = session.root();
        if (root == null) return;

        if (!latch.tryEnter(SyncLatch.Direction.FROM_EDITOR)) return;
        try {
            Deque<TreeNode> path = new ArrayDeque<>();
            if (!findDeepest(root, line, path)) return;

            List<TreeNode> ordered = new ArrayList<>(path);
            TreeNode target = ordered.get(ordered.size() - 1);
            int i = 0;
            int n = ordered.size() - 1;
            while (i < n) {
                ordered.get(i).setExpanded(true);
                i = i + 1;
            }

            session.select(target, SourceLocator.locate(session.sourceText(), target.sourceSpan()));
            DebugLog.log("editor -> tree: line %d -> %s", line, target.name());
            treeView.reveal(ordered);
        } finally {
            latch.exit();
        }
    }

    /**
     * Finds the most specific node containing {@code line}, searching children before the node itself.
     * On success {@code path} holds root..target.
     */
    static boolean findDeepest(TreeNode node, int line, Deque<TreeNode> path) {
        path.addLast(node);
        SourceSpan span = node.sourceSpan();
        boolean inside = span != null && span.containsLine(line);

        // nodes without a span are never targets, but their children may be
        if (span == null || inside) {
            for (TreeNode child : node.children()) {
                if (findDeepest(child, line, path)) {
                    return true;
                }
            }
        }
        if (inside) {
            return true;
        }
        path.removeLast();
        return false;
    }

    /** The deepest node containing {@code line}, or null. */
    public static TreeNode findNodeAtLine(TreeNode root, int line) {
        if (root == null) return null;
        Deque<TreeNode> path = new ArrayDeque<>();
        return findDeepest(root, line, path) ? path.getLast() : null;
    }
}
