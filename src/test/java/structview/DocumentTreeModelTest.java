package structview;

import org.junit.Test;

import javax.swing.event.TreeModelEvent;
import javax.swing.event.TreeModelListener;
import javax.swing.tree.TreePath;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class DocumentTreeModelTest {

    private static TreeNode tree() {
        DocumentSession session = new DocumentSession();
        session.load(ParsedDocument.ofObject(Map.of("list", List.of("a", "b"), "n", 1)));
        return session.root();
    }

    @Test
    public void childrenAreBuiltOnDemand() {
        TreeNode root = tree();
        DocumentTreeModel model = new DocumentTreeModel(root);

        assertSame(root, model.getRoot());
        assertFalse(model.isLeaf(root));
        assertFalse(root.isMaterialized());

        assertEquals(2, model.getChildCount(root));
        assertTrue(root.isMaterialized());

        TreeNode list = (TreeNode) model.getChild(root, 0);
        assertEquals("list", list.name());
        assertFalse(list.isMaterialized());
        assertTrue(model.isLeaf(model.getChild(root, 1)));
        assertEquals(1, model.getIndexOfChild(root, model.getChild(root, 1)));
        assertEquals(-1, model.getIndexOfChild(root, root));
    }

    @Test
    public void replacingRootNotifiesListeners() {
        DocumentTreeModel model = new DocumentTreeModel(null);
        List<TreeModelEvent> events = new ArrayList<>();
        model.addTreeModelListener(new TreeModelListener() {
            @Override public void treeNodesChanged(TreeModelEvent e) {}
            @Override public void treeNodesInserted(TreeModelEvent e) {}
            @Override public void treeNodesRemoved(TreeModelEvent e) {}
            @Override public void treeStructureChanged(TreeModelEvent e) { events.add(e); }
        });

        TreeNode root = tree();
        model.setRoot(root);
        assertEquals(1, events.size());
        assertSame(root, events.get(0).getTreePath().getLastPathComponent());
    }

    @Test
    public void pathOfMirrorsNodeList() {
        TreeNode root = tree();
        TreeNode list = root.children().get(0);
        TreePath path = DocumentTreeModel.pathOf(List.of(root, list));
        assertEquals(2, path.getPathCount());
        assertSame(list, path.getLastPathComponent());
    }
}
