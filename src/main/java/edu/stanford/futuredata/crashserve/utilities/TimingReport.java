package edu.stanford.futuredata.crashserve.utilities;

import edu.stanford.futuredata.crashserve.WorkerTiming;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Elapsed seconds per operation per worker for one query.  Built fresh for each request and merged on a single
 * thread once every dispatched call has returned, so it is not synchronized.
 */
public class TimingReport {

    // Operation names shared by coordinator and workers.
    public static final String SCAN = "Scan";
    public static final String FILTER = "Filter";
    public static final String MERGE = "Merge";
    public static final String DOWNSTREAM_QUERIES = "Downstream_Queries";
    public static final String TOTAL_PROCESSING = "Total_Processing";
    public static final String QUERY_TO_PREFIX = "Query_To_";

    private final Map<String, Map<String, Double>> timings = new LinkedHashMap<>();

    public void record(String workerID, String operation, double seconds) {
        timings.computeIfAbsent(workerID, k -> new LinkedHashMap<>()).put(operation, seconds);
    }

    public void recordNanos(String workerID, String operation, long nanos) {
        record(workerID, operation, Utilities.nanosToSeconds(nanos));
    }

    public void merge(WorkerTiming workerTiming) {
        workerTiming.getOperationsMap().forEach((op, seconds) -> record(workerTiming.getWorkerId(), op, seconds));
    }

    public Optional<Double> get(String workerID, String operation) {
        Map<String, Double> ops = timings.get(workerID);
        return ops == null ? Optional.empty() : Optional.ofNullable(ops.get(operation));
    }

    public Map<String, Map<String, Double>> asMap() {
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        timings.forEach((id, ops) -> copy.put(id, Collections.unmodifiableMap(new LinkedHashMap<>(ops))));
        return Collections.unmodifiableMap(copy);
    }

    public boolean isEmpty() {
        return timings.isEmpty();
    }

    public WorkerTiming toMessage(String workerID) {
        return WorkerTiming.newBuilder().setWorkerId(workerID)
                .putAllOperations(timings.getOrDefault(workerID, Collections.emptyMap())).build();
    }

    public List<WorkerTiming> toMessages() {
        List<WorkerTiming> messages = new ArrayList<>();
        for (String workerID : timings.keySet()) {
            messages.add(toMessage(workerID));
        }
        return messages;
    }

    public static TimingReport fromMessages(List<WorkerTiming> messages) {
        TimingReport report = new TimingReport();
        messages.forEach(report::merge);
        return report;
    }
}
