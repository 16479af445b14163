package edu.stanford.futuredata.crashserve.utilities;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

public class TimingFormatTests {

    // Section header as line-oriented timing consumers parse it: one process letter, A through E.
    private static final Pattern PROCESS_SECTION = Pattern.compile("^\\s*\\[Process ([A-E])\\]\\s*$");

    @Test
    public void testEncode() {
        TimingReport report = new TimingReport();
        report.record("A", TimingReport.TOTAL_PROCESSING, 0.012);
        report.record("B", TimingReport.SCAN, 0.0005);
        assertEquals("  [Process A]\n"
                        + "    Total_Processing    : 0.012000 seconds\n"
                        + "  [Process B]\n"
                        + "    Scan                : 0.000500 seconds\n",
                TimingFormat.encode(report));
        assertEquals("", TimingFormat.encode(new TimingReport()));
    }

    @Test
    public void testDecodeLegacyText() {
        String text = "Timing report\n"
                + "Orphan: 1.0 seconds\n"
                + "[Process A]\n"
                + "Downstream_Queries: 0.25 seconds\n"
                + "   Total_Processing   :   0.5 seconds\n"
                + "not a timing line\n"
                + "[Process C]\n"
                + "Scan: 1e-3 seconds\n";
        TimingReport report = TimingFormat.decode(text);
        assertEquals(List.of("A", "C"), List.copyOf(report.asMap().keySet()));
        assertEquals(Optional.of(0.25), report.get("A", "Downstream_Queries"));
        assertEquals(Optional.of(0.5), report.get("A", "Total_Processing"));
        assertEquals(Optional.of(0.001), report.get("C", "Scan"));
        assertEquals(Optional.empty(), report.get("A", "Orphan"));
    }

    @Test
    public void testEncodedTextDecodes() {
        TimingReport report = new TimingReport();
        report.record("A", TimingReport.QUERY_TO_PREFIX + "B", 0.125);
        report.record("B", TimingReport.FILTER, 2.5);
        TimingReport decoded = TimingFormat.decode(TimingFormat.encode(report));
        assertEquals(report.asMap(), decoded.asMap());
    }

    @Test
    public void testDefaultLayoutSectionsUseProcessLetters() {
        ServiceConfig config = ServiceConfig.load(Optional.empty());
        TimingReport report = new TimingReport();
        report.record(config.coordinatorID, TimingReport.TOTAL_PROCESSING, 0.1);
        for (WorkerDescription w : config.workers) {
            report.record(config.coordinatorID, TimingReport.QUERY_TO_PREFIX + w.workerID, 0.05);
            report.record(w.workerID, TimingReport.SCAN, 0.01);
        }
        List<String> sections = new ArrayList<>();
        for (String line : TimingFormat.encode(report).split("\n")) {
            if (line.contains("[Process")) {
                Matcher m = PROCESS_SECTION.matcher(line);
                assertTrue(m.matches(), line);
                sections.add(m.group(1));
            }
        }
        // Each process reported once, so no section's lines are credited to another.
        assertEquals(List.of("A", "B", "C", "D", "E"), sections);
    }
}
