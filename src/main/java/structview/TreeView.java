package structview;

import java.util.List;

/**
 * The tree side of the viewer, as seen by {@link SyncCoordinator}.
 */
public interface TreeView {

    /** Expand every node on {@code path} but the last, then select the last one. */
    void reveal(List<TreeNode> path);
}
