package structview;

import javax.swing.*;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.Transferable;
import java.io.File;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Drag &amp; drop of files onto the window. Only the first dropped file is opened.
 * Accepts file lists and plain text holding paths or file:// URIs.
 */
class FileDropHandler extends TransferHandler {

    private final StructViewApp app;

    FileDropHandler(StructViewApp app) {
        this.app = app;
    }

    @Override
    public int getSourceActions(JComponent c) {
        return COPY;
    }

    @Override
    public boolean canImport(TransferSupport support) {
        if (!support.isDrop()) return false;
        support.setDropAction(COPY);
        return support.isDataFlavorSupported(DataFlavor.javaFileListFlavor)
                || support.isDataFlavorSupported(DataFlavor.stringFlavor);
    }

    @Override
    public boolean importData(TransferSupport support) {
        if (!canImport(support)) return false;
        try {
            List<Path> paths = extractPaths(support.getTransferable());
            if (paths.isEmpty()) return false;
            if (paths.size() > 1) {
                DebugLog.log("Dropped %d files, opening the first", paths.size());
            }
            return app.open(paths.get(0));
        } catch (Exception ex) {
            app.handleDropError("Drop failed: " + ex.getMessage());
            return false;
        }
    }

    static List<Path> extractPaths(Transferable transferable) throws Exception {
        List<Path> paths = new ArrayList<>();
        if (transferable.isDataFlavorSupported(DataFlavor.javaFileListFlavor)) {
            @SuppressWarnings("unchecked")
            List<File> files = (List<File>) transferable.getTransferData(DataFlavor.javaFileListFlavor);
            int i = 0;
            int n = files.size();
            while (i < n) {
                paths.add(files.get(i).toPath());
                i = i + 1;
            }
        } else if (transferable.isDataFlavorSupported(DataFlavor.stringFlavor)) {
            String data = (String) transferable.getTransferData(DataFlavor.stringFlavor);
            String[] lines = data.split("\\r?\\n");
            int i = 0;
            int n = lines.length;
            while (i < n) {
                String s = lines[i].trim();
                if (!s.isEmpty()) {
                    paths.add(s.startsWith("file://") ? Path.of(new URI(s)) : Path.of(s));
                }
                i = i + 1;
            }
        }
        return paths;
    }
}
