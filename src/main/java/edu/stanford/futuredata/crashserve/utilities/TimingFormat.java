package edu.stanford.futuredata.crashserve.utilities;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The plain-text timing block carried in {@code timing_data}:
 * <pre>
 *   [Process A]
 *     Total_Processing    : 0.012000 seconds
 * </pre>
 * A {@code [Process X]} line opens a section; operation lines attach to the most recent section.
 */
public class TimingFormat {

    private static final Pattern SECTION = Pattern.compile("^\\s*\\[Process\\s+([^\\]]+?)\\s*\\]\\s*$");
    private static final Pattern OPERATION =
            Pattern.compile("^\\s*(\\S.*?)\\s*:\\s*([-+]?[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?)\\s+seconds\\s*$");

    private TimingFormat() {}

    public static String encode(TimingReport report) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Map<String, Double>> worker : report.asMap().entrySet()) {
            sb.append("  [Process ").append(worker.getKey()).append("]\n");
            for (Map.Entry<String, Double> op : worker.getValue().entrySet()) {
                sb.append(String.format(Locale.ROOT, "    %-20s: %.6f seconds\n", op.getKey(), op.getValue()));
            }
        }
        return sb.toString();
    }

    /** Lines outside any section and lines that are not operation lines are skipped. */
    public static TimingReport decode(String timingData) {
        TimingReport report = new TimingReport();
        String currentWorker = null;
        for (String line : timingData.split("\\R")) {
            Matcher section = SECTION.matcher(line);
            if (section.matches()) {
                currentWorker = section.group(1);
                continue;
            }
            if (currentWorker == null) {
                continue;
            }
            Matcher op = OPERATION.matcher(line);
            if (op.matches()) {
                report.record(currentWorker, op.group(1), Double.parseDouble(op.group(2)));
            }
        }
        return report;
    }
}
