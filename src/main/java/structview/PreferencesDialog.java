package structview;

import javax.swing.*;
import java.awt.*;

public final class PreferencesDialog {

    public record Result(int fontSize, String themeName, int maxDepth, boolean debugLogging) {}

    private PreferencesDialog() {}

    public static Result show(Component parent, ViewerSettings current) {
        JDialog dialog = new JDialog(SwingUtilities.getWindowAncestor(parent), "Preferences", Dialog.ModalityType.APPLICATION_MODAL);
        dialog.setLayout(new GridBagLayout());
        GridBagConstraints gc = new GridBagConstraints();
        gc.insets = new Insets(6, 8, 6, 8);
        gc.anchor = GridBagConstraints.WEST;

        JSpinner fontSpinner = new JSpinner(new SpinnerNumberModel(current.fontSize(), 10, 32, 1));

        JComboBox<String> themeBox = new JComboBox<>(new String[]{ThemeManager.LIGHT, ThemeManager.SOFT_DARK});
        themeBox.setSelectedItem(current.themeName());

        JSpinner depthSpinner = new JSpinner(new SpinnerNumberModel(current.maxDepth(), 0, 100, 1));
        JCheckBox debugBox = new JCheckBox("Write debug log to stdout", DebugLog.isEnabled());

        addRow(dialog, gc, 0, "Editor font size:", fontSpinner);
        addRow(dialog, gc, 1, "Theme:", themeBox);
        addRow(dialog, gc, 2, "Max tree depth:", depthSpinner);
        gc.gridx = 1; gc.gridy = 3;
        dialog.add(debugBox, gc);

        JPanel buttons = new JPanel(new FlowLayout(FlowLayout.RIGHT));
        JButton ok = new JButton("OK");
        JButton cancel = new JButton("Cancel");
        buttons.add(cancel);
        buttons.add(ok);
        gc.gridx = 0; gc.gridy = 4; gc.gridwidth = 2;
        gc.anchor = GridBagConstraints.EAST;
        dialog.add(buttons, gc);
        dialog.getRootPane().setDefaultButton(ok);

        final Result[] result = new Result[1];

        ok.addActionListener(e -> {
            result[0] = new Result((int) fontSpinner.getValue(), (String) themeBox.getSelectedItem(),
                    (int) depthSpinner.getValue(), debugBox.isSelected());
            dialog.dispose();
        });
        cancel.addActionListener(e -> {
            result[0] = null;
            dialog.dispose();
        });

        dialog.pack();
        dialog.setLocationRelativeTo(parent);
        dialog.setVisible(true);

        return result[0];
    }

    private static void addRow(JDialog dialog, GridBagConstraints gc, int row, String label, JComponent field) {
        gc.gridx = 0; gc.gridy = row;
        dialog.add(new JLabel(label), gc);
        gc.gridx = 1;
        dialog.add(field, gc);
    }
}
