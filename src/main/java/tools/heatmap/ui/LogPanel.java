package tools.heatmap.ui;

import javax.swing.*;
import javax.swing.border.TitledBorder;
import java.awt.*;

/**
 * 操作日志面板：显示方块点击、翻周、主题切换等记录，支持自动滚动与清空。
 */
public class LogPanel extends JPanel {
    private final JTextArea area = new JTextArea();
    private final JCheckBox autoScroll = new JCheckBox("自动滚动", true);

    public LogPanel() {
        super(new BorderLayout(6, 6));
        setBorder(new TitledBorder("操作日志"));
        area.setEditable(false);
        area.setLineWrap(true);
        area.setRows(6);
        area.setFont(new Font(Font.MONOSPACED, Font.PLAIN, 12));

        JScrollPane scroll = new JScrollPane(area);
        scroll.setVerticalScrollBarPolicy(ScrollPaneConstants.VERTICAL_SCROLLBAR_AS_NEEDED);
        add(scroll, BorderLayout.CENTER);

        JPanel actions = new JPanel(new FlowLayout(FlowLayout.LEFT, 4, 4));
        JButton clear = new JButton("清空");
        clear.addActionListener(e -> area.setText(""));
        actions.add(clear);
        actions.add(autoScroll);
        add(actions, BorderLayout.NORTH);
    }

    public void appendLine(String line) {
        if (line == null) return;
        area.append(line);
        area.append("\n");
        if (autoScroll.isSelected()) {
            area.setCaretPosition(area.getDocument().getLength());
        }
    }

    String getText() {
        return area.getText();
    }
}
