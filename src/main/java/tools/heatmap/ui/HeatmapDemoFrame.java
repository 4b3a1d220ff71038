package tools.heatmap.ui;

import com.formdev.flatlaf.util.UIScale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.heatmap.model.HeatmapStyle;
import tools.heatmap.model.RowData;
import tools.heatmap.sample.ActivityDetail;
import tools.heatmap.sample.ActivityEntry;
import tools.heatmap.sample.RandomActivities;
import tools.heatmap.sample.SampleDataRepository;
import tools.heatmap.sample.WeekWindow;
import tools.heatmap.util.Config;
import tools.heatmap.util.OperationLog;

import javax.swing.*;
import java.awt.*;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.IntFunction;

/**
 * 演示窗口：月度打卡、本周训练、成员步数三张热力图，可翻周、切换主题，点击方块写入操作日志。
 */
public class HeatmapDemoFrame extends JFrame {
    private static final Logger log = LoggerFactory.getLogger(HeatmapDemoFrame.class);
    private static final List<String> WEEKDAY_LABELS = List.of("Mon", "Tue", "Wed", "Thu", "Fri", "Sat", "Sun");
    private static final List<String> MONTH_HEADERS = List.of(
            "Jan", "Feb", "Mar", "Apr", "May", "Jun", "Jul", "Aug", "Sep", "Oct", "Nov", "Dec");
    private static final List<String> TRAINING_LABELS = List.of("Pulse", "Track", "Lift", "Strength");
    private static final List<String> WEEKDAY_HEADERS = List.of("M", "T", "W", "T", "F", "S", "S");

    private final ThemeManager themeManager = new ThemeManager();
    private final LogPanel logPanel = new LogPanel();
    private final HeatmapGridPanel<Boolean> monthlyHeatmap;
    private final HeatmapGridPanel<Boolean> weeklyHeatmap;
    private final HeatmapGridPanel<ActivityDetail> memberHeatmap;
    private final List<HeatmapGridPanel<?>> heatmaps = new ArrayList<>();
    private final int seed = Config.getRandomSeed();

    public HeatmapDemoFrame() {
        super("活动热力图");
        setDefaultCloseOperation(WindowConstants.EXIT_ON_CLOSE);
        OperationLog.setAppender(logPanel::appendLine);

        float scale = UIScale.getUserScaleFactor();
        monthlyHeatmap = createHeatmap(Config.heatmapStyle("heatmap.monthly").scaled(scale));
        weeklyHeatmap = createHeatmap(Config.heatmapStyle("heatmap.weekly").scaled(scale));
        memberHeatmap = createHeatmap(Config.heatmapStyle("heatmap.members").scaled(scale));

        JPanel content = new JPanel();
        content.setLayout(new BoxLayout(content, BoxLayout.Y_AXIS));
        content.setBorder(UiStyle.panelPadding());
        content.add(weekSection("月度打卡", monthlyHeatmap, MONTH_HEADERS, WeekWindow.SHORT_FORMAT, this::refreshMonthly));
        content.add(Box.createVerticalStrut(16));
        content.add(weekSection("本周训练", weeklyHeatmap, WEEKDAY_HEADERS, WeekWindow.DOTTED_FORMAT, this::refreshWeekly));
        content.add(Box.createVerticalStrut(16));
        content.add(memberSection());

        JScrollPane scroll = new JScrollPane(content);
        scroll.setBorder(BorderFactory.createEmptyBorder());
        scroll.getVerticalScrollBar().setUnitIncrement(16);

        JPanel root = new JPanel(new BorderLayout());
        root.add(buildToolbar(), BorderLayout.NORTH);
        root.add(scroll, BorderLayout.CENTER);
        root.add(logPanel, BorderLayout.SOUTH);
        setContentPane(root);

        bindMembers();
        setSize(760, 860);
        setLocationRelativeTo(null);
    }

    private <D> HeatmapGridPanel<D> createHeatmap(HeatmapStyle style) {
        HeatmapGridPanel<D> panel = new HeatmapGridPanel<>(style);
        panel.setBorder(UiStyle.heatmapPadding());
        panel.setAlignmentX(Component.LEFT_ALIGNMENT);
        heatmaps.add(panel);
        return panel;
    }

    private JComponent buildToolbar() {
        JPanel toolbar = new JPanel(new FlowLayout(FlowLayout.LEFT, 8, 6));
        toolbar.setBorder(UiStyle.sectionLine());
        JComboBox<ThemeOption> themeBox = new JComboBox<>(themeManager.getOptions().toArray(new ThemeOption[0]));
        ThemeOption initial = themeManager.findByIdOrDefault(Config.getThemeId());
        themeBox.setSelectedItem(initial);
        applyPalette(initial);
        themeBox.addActionListener(e -> {
            ThemeOption option = (ThemeOption) themeBox.getSelectedItem();
            themeManager.applyThemeAsync(option, () -> applyPalette(option));
        });
        toolbar.add(new JLabel("主题"));
        toolbar.add(themeBox);
        return toolbar;
    }

    private void applyPalette(ThemeOption option) {
        if (option == null) {
            return;
        }
        for (HeatmapGridPanel<?> heatmap : heatmaps) {
            heatmap.setHeatmapStyle(option.applyPalette(heatmap.getHeatmapStyle()));
        }
    }

    /**
     * 带“上一周 / 下一周”按钮和日期范围的分区，refresher 接收周偏移并返回新的行数据。
     */
    private JComponent weekSection(String title, HeatmapGridPanel<Boolean> heatmap, List<String> headers,
                                   DateTimeFormatter formatter, IntFunction<List<RowData<Boolean>>> refresher) {
        JLabel rangeLabel = UiStyle.caption("");
        int[] weekOffset = {0};
        Runnable update = () -> {
            WeekWindow window = WeekWindow.of(LocalDate.now(), weekOffset[0]);
            rangeLabel.setText(window.format(formatter));
            heatmap.setData(refresher.apply(weekOffset[0]), headers);
        };
        JButton prev = new JButton("上一周");
        prev.addActionListener(e -> {
            weekOffset[0]--;
            update.run();
            OperationLog.log(title + " 切换到: " + rangeLabel.getText());
        });
        JButton next = new JButton("下一周");
        next.addActionListener(e -> {
            weekOffset[0]++;
            update.run();
            OperationLog.log(title + " 切换到: " + rangeLabel.getText());
        });
        update.run();

        JPanel header = new JPanel(new FlowLayout(FlowLayout.LEFT, 8, 0));
        header.add(UiStyle.sectionTitle(title));
        header.add(rangeLabel);
        header.add(prev);
        header.add(next);
        return section(header, heatmap);
    }

    private JComponent memberSection() {
        JPanel header = new JPanel(new FlowLayout(FlowLayout.LEFT, 8, 0));
        header.add(UiStyle.sectionTitle("成员步数"));
        header.add(UiStyle.caption("点击方块查看明细"));

        memberHeatmap.setColorAdapter(StepColors::colorFor);
        memberHeatmap.setCellAdapter(StepColors::drawCount);
        memberHeatmap.setCellClickListener((row, column, detail) -> {
            String member = memberHeatmap.getRows().get(row).getLabel();
            String day = memberHeatmap.getColumnHeaders().get(column);
            OperationLog.log(detail == null
                    ? member + " / " + day + ": 无记录"
                    : member + " / " + day + ": " + detail.getCount() + " 步");
        });
        return section(header, memberHeatmap);
    }

    private JComponent section(JComponent header, JComponent body) {
        JPanel panel = new JPanel(new BorderLayout(0, 6));
        panel.setAlignmentX(Component.LEFT_ALIGNMENT);
        header.setBorder(UiStyle.sectionLine());
        panel.add(header, BorderLayout.NORTH);
        panel.add(body, BorderLayout.CENTER);
        return panel;
    }

    private List<RowData<Boolean>> refreshMonthly(int weekOffset) {
        // 列号取 0..12，第 13 列只保存不绘制
        return RandomActivities.generate(WEEKDAY_LABELS, 12, 12, new Random(seed + weekOffset * 31L));
    }

    private List<RowData<Boolean>> refreshWeekly(int weekOffset) {
        return RandomActivities.generate(TRAINING_LABELS, 7, 7, new Random(seed + 7 + weekOffset * 31L));
    }

    private void bindMembers() {
        SampleDataRepository repository = new SampleDataRepository();
        List<ActivityEntry> entries = repository.loadFromClasspath(Config.getSampleResource());
        memberHeatmap.bindData(entries, ActivityEntry::getLabel, ActivityEntry::getDetails,
                detail -> detail.getDay() - 1, WEEKDAY_LABELS);
        log.debug("成员步数热力图: {} 位成员", entries.size());
    }
}
