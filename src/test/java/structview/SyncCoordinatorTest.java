package structview;

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class SyncCoordinatorTest {

    private static final String JSON = "{\n"
            + "  \"a\": 1,\n"
            + "  \"b\": {\n"
            + "    \"c\": \"x\"\n"
            + "  }\n"
            + "}\n";

    private static class StubTextView implements TextView {
        final List<int[]> selections = new ArrayList<>();
        Runnable onSelect = () -> {};
        @Override public void selectRange(int start, int end) {
            selections.add(new int[]{start, end});
            onSelect.run();
        }
    }

    private static class StubTreeView implements TreeView {
        final List<List<TreeNode>> reveals = new ArrayList<>();
        Runnable onReveal = () -> {};
        @Override public void reveal(List<TreeNode> path) {
            reveals.add(path);
            onReveal.run();
        }
    }

    private DocumentSession session;
    private StubTextView text;
    private StubTreeView tree;
    private SyncCoordinator sync;

    @Before
    public void setUp() throws Exception {
        session = new DocumentSession();
        session.load(JacksonDocumentReader.readJson(JSON));
        text = new StubTextView();
        tree = new StubTreeView();
        sync = new SyncCoordinator(session, text, tree);
    }

    private TreeNode child(TreeNode parent, String name) {
        for (TreeNode c : parent.children()) {
            if (name.equals(c.name())) return c;
        }
        throw new AssertionError("no child " + name);
    }

    @Test
    public void treeSelectionSelectsSourceText() {
        TreeNode c = child(child(session.root(), "b"), "c");
        sync.onTreeSelectionChanged(c);

        assertEquals(1, text.selections.size());
        SourceRange range = session.selectedRange();
        assertEquals(4, range.startLine());
        assertTrue(range.text(JSON), range.text(JSON).startsWith("\"c\""));
        assertEquals(range.startOffset(), text.selections.get(0)[0]);
        assertSame(c, session.selectedNode());
        assertTrue(sync.latch().isIdle());
    }

    @Test
    public void caretSelectsDeepestNodeOnLine() {
        sync.onCaretLineChanged(4);

        assertEquals(1, tree.reveals.size());
        List<TreeNode> path = tree.reveals.get(0);
        assertEquals(3, path.size());
        assertSame(session.root(), path.get(0));
        assertEquals("b", path.get(1).name());
        assertEquals("c", path.get(2).name());
        assertTrue(path.get(1).isExpanded());
        assertEquals("c", session.selectedNode().name());
        assertTrue(sync.latch().isIdle());
    }

    @Test
    public void caretOnContainerLineSelectsContainer() {
        sync.onCaretLineChanged(5);
        List<TreeNode> path = tree.reveals.get(0);
        assertEquals("b", path.get(path.size() - 1).name());
    }

    @Test
    public void caretOutsideEverySpanDoesNothing() {
        sync.onCaretLineChanged(40);
        assertTrue(tree.reveals.isEmpty());
        assertNull(session.selectedNode());
    }

    @Test
    public void editorEchoOfTreeSelectionIsIgnored() {
        text.onSelect = () -> sync.onCaretLineChanged(2);
        sync.onTreeSelectionChanged(child(session.root(), "b"));

        assertEquals(1, text.selections.size());
        assertTrue(tree.reveals.isEmpty());
        assertEquals("b", session.selectedNode().name());
    }

    @Test
    public void treeEchoOfCaretMoveIsIgnored() {
        tree.onReveal = () -> sync.onTreeSelectionChanged(child(session.root(), "a"));
        sync.onCaretLineChanged(4);

        assertEquals(1, tree.reveals.size());
        assertTrue(text.selections.isEmpty());
        assertEquals("c", session.selectedNode().name());
    }

    @Test
    public void nodeWithoutSpanClearsRange() {
        DocumentSession objects = new DocumentSession();
        objects.load(ParsedDocument.ofObject(List.of("x")));
        SyncCoordinator objectSync = new SyncCoordinator(objects, text, tree);

        objectSync.onTreeSelectionChanged(objects.root().children().get(0));
        assertNull(objects.selectedRange());
        assertEquals("[0]", objects.selectedNode().name());
        assertTrue(text.selections.isEmpty());
    }

    @Test
    public void findNodeAtLine() {
        assertEquals("a", SyncCoordinator.findNodeAtLine(session.root(), 2).name());
        assertSame(session.root(), SyncCoordinator.findNodeAtLine(session.root(), 1));
        assertNull(SyncCoordinator.findNodeAtLine(null, 1));
    }
}
