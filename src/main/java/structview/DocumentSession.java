package structview;

/**
 * Holds the loaded document, the tree built from it and the current selection (no Swing).
 * The tree is rebuilt whenever the document or the max depth changes.
 */
public class DocumentSession {

    private ParsedDocument document = ParsedDocument.empty();
    private int maxDepth = ViewerSettings.DEFAULT_MAX_DEPTH;
    private TreeNode root;
    private TreeNode selectedNode;
    private SourceRange selectedRange;

    public ParsedDocument document() { return document; }
    public String sourceText() { return document.sourceText(); }
    public int maxDepth() { return maxDepth; }
    public TreeNode root() { return root; }
    public TreeNode selectedNode() { return selectedNode; }
    public SourceRange selectedRange() { return selectedRange; }

    public void load(ParsedDocument document) {
        this.document = document == null ? ParsedDocument.empty() : document;
        rebuild();
    }

    public void setMaxDepth(int maxDepth) {
        ViewerSettings.checkMaxDepth(maxDepth);
        if (this.maxDepth == maxDepth) return;
        this.maxDepth = maxDepth;
        rebuild();
    }

    void select(TreeNode node, SourceRange range) {
        this.selectedNode = node;
        this.selectedRange = range;
    }

    private void rebuild() {
        selectedNode = null;
        selectedRange = null;
        if (document.root() == null) {
            root = null;
            return;
        }
        root = new TreeBuilder(document.spans()).buildRoot(document.root(), maxDepth);
        DebugLog.log("Rebuilt tree: format=%s maxDepth=%d root=%s", document.format(), maxDepth, root);
    }
}
