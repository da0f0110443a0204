package structview;

import javax.swing.event.EventListenerList;
import javax.swing.event.TreeModelEvent;
import javax.swing.event.TreeModelListener;
import javax.swing.tree.TreeModel;
import javax.swing.tree.TreePath;
import java.util.List;

/**
 * Exposes a {@link TreeNode} tree to {@link javax.swing.JTree}. Children are only built when
 * the tree asks for them, i.e. when a row is expanded.
 */
class DocumentTreeModel implements TreeModel {

    private final EventListenerList listeners = new EventListenerList();
    private TreeNode root;

    DocumentTreeModel(TreeNode root) {
        this.root = root;
    }

    void setRoot(TreeNode root) {
        this.root = root;
        TreeModelEvent event = new TreeModelEvent(this, root == null ? (Object[]) null : new Object[]{root});
        for (TreeModelListener l : listeners.getListeners(TreeModelListener.class)) {
            l.treeStructureChanged(event);
        }
    }

    static TreePath pathOf(List<TreeNode> nodes) {
        return new TreePath(nodes.toArray());
    }

    @Override
    public Object getRoot() {
        return root;
    }

    @Override
    public Object getChild(Object parent, int index) {
        List<TreeNode> children = ((TreeNode) parent).children();
        return index >= 0 && index < children.size() ? children.get(index) : null;
    }

    @Override
    public int getChildCount(Object parent) {
        return ((TreeNode) parent).children().size();
    }

    @Override
    public boolean isLeaf(Object node) {
        return !((TreeNode) node).hasChildren();
    }

    @Override
    public void valueForPathChanged(TreePath path, Object newValue) {
        throw new UnsupportedOperationException("The document tree is read-only");
    }

    @Override
    public int getIndexOfChild(Object parent, Object child) {
        if (parent == null || child == null) return -1;
        List<TreeNode> children = ((TreeNode) parent).children();
        int i = 0;
        int n = children.size();
        while (i < n) {
            if (children.get(i) == child) return i;
            i = i + 1;
        }
        return -1;
    }

    @Override
    public void addTreeModelListener(TreeModelListener l) {
        listeners.add(TreeModelListener.class, l);
    }

    @Override
    public void removeTreeModelListener(TreeModelListener l) {
        listeners.remove(TreeModelListener.class, l);
    }
}
