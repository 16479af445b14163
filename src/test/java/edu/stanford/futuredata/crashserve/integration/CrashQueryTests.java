package edu.stanford.futuredata.crashserve.integration;

import com.google.protobuf.ByteString;
import edu.stanford.futuredata.crashserve.*;
import edu.stanford.futuredata.crashserve.client.CrashQueryClient;
import edu.stanford.futuredata.crashserve.client.TransportException;
import edu.stanford.futuredata.crashserve.crash.Borough;
import edu.stanford.futuredata.crashserve.utilities.TimingFormat;
import edu.stanford.futuredata.crashserve.utilities.TimingReport;
import edu.stanford.futuredata.crashserve.utilities.TypedValues;
import edu.stanford.futuredata.crashserve.worker.Worker;
import io.grpc.Status;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class CrashQueryTests {

    private static final Logger logger = LoggerFactory.getLogger(CrashQueryTests.class);

    private static final List<String> ALL_KEYS = List.of("BROOKLYN-2", "BROOKLYN-3", "QUEENS-2", "BRONX-2",
            "STATEN_ISLAND-2", "OTHER-2", "OTHER-3");

    @TempDir
    Path shardDir;

    private CrashServeCluster cluster;
    private CrashQueryClient client;

    @BeforeEach
    public void startCluster() throws Exception {
        CrashServeCluster.partitionSample(shardDir);
        cluster = CrashServeCluster.startAll(shardDir, 2000, 3);
        client = cluster.client();
    }

    @AfterEach
    public void stopCluster() {
        cluster.close();
    }

    private static List<String> keys(QueryResponse r) {
        return r.getResultsList().stream().map(ResultEntry::getKey).collect(Collectors.toList());
    }

    @Test
    public void testGetAll() throws TransportException {
        logger.info("testGetAll");
        QueryRequest request = CrashQueryClient.request("get_all", Collections.emptyList());
        QueryResponse r = client.query(request);
        assertTrue(r.getSuccess(), r.getMessage());
        assertEquals(request.getQueryId(), r.getQueryId());
        assertEquals(ALL_KEYS, keys(r));
        assertTrue(r.getMessage().contains("7 total entries"), r.getMessage());
    }

    @Test
    public void testGetByBorough() throws TransportException {
        logger.info("testGetByBorough");
        QueryResponse r = client.query("get_by_borough", List.of("BROOKLYN"));
        assertTrue(r.getSuccess());
        assertEquals(2, r.getResultsCount());
        for (ResultEntry e : r.getResultsList()) {
            assertEquals("BROOKLYN", e.getRecord().getBorough());
        }
        r = client.query("get_by_borough", List.of("staten island"));
        assertTrue(r.getSuccess());
        assertEquals(List.of("STATEN_ISLAND-2"), keys(r));
        // Only the owning shard is contacted.
        assertEquals(0, cluster.workers.get(Borough.QUEENS).executeTimes.size());
    }

    @Test
    public void testUnknownBorough() throws TransportException {
        logger.info("testUnknownBorough");
        QueryResponse r = client.query("get_by_borough", List.of("MANHATTAN"));
        assertTrue(r.getSuccess());
        assertEquals(0, r.getResultsCount());
    }

    @Test
    public void testDateRange() throws TransportException {
        logger.info("testDateRange");
        QueryResponse r = client.query("get_by_date_range", List.of("12/14/2021", "12/14/2021"));
        assertTrue(r.getSuccess());
        assertEquals(List.of("BROOKLYN-3", "QUEENS-2", "BRONX-2"), keys(r));
        r = client.query("get_by_date_range", List.of("12/01/2021", "12/31/2021"));
        assertEquals(4, r.getResultsCount());
        r = client.query("get_by_date_range", List.of("12/31/2021", "01/01/2021"));
        assertTrue(r.getSuccess());
        assertEquals(0, r.getResultsCount());
    }

    @Test
    public void testStreetAndTime() throws TransportException {
        logger.info("testStreetAndTime");
        QueryResponse r = client.query("get_by_street", List.of("avenue"));
        assertTrue(r.getSuccess());
        assertEquals(List.of("BROOKLYN-2", "BROOKLYN-3", "BRONX-2", "STATEN_ISLAND-2", "OTHER-2"), keys(r));
        r = client.query("get_by_time", List.of("8:17"));
        assertEquals(List.of("BRONX-2"), keys(r));
        r = client.query("get_by_time", List.of("8:1"));
        assertEquals(0, r.getResultsCount());
    }

    @Test
    public void testInjuriesMonotonic() throws TransportException {
        logger.info("testInjuriesMonotonic");
        List<String> previous = keys(client.query("get_crashes_with_injuries", List.of("0")));
        assertEquals(ALL_KEYS, previous);
        for (int n = 1; n <= 3; n++) {
            List<String> current = keys(client.query("get_crashes_with_injuries", List.of(Integer.toString(n))));
            assertTrue(previous.containsAll(current), "threshold " + n);
            previous = current;
        }
        assertEquals(List.of("BRONX-2", "OTHER-2"), keys(client.query("get_crashes_with_injuries", List.of("2"))));
        QueryResponse r = client.query("get_crashes_with_fatalities", List.of("1"));
        assertTrue(r.getSuccess());
        assertEquals(0, r.getResultsCount());
    }

    @Test
    public void testDeterministicOrdering() throws TransportException {
        logger.info("testDeterministicOrdering");
        for (int i = 0; i < 20; i++) {
            assertEquals(ALL_KEYS, keys(client.query("get_all", Collections.emptyList())));
        }
    }

    @Test
    public void testResultEntry() throws TransportException {
        logger.info("testResultEntry");
        ResultEntry e = client.query("get_by_borough", List.of("BROOKLYN")).getResults(0);
        assertEquals(TypedValue.ValueCase.STRING_VALUE, e.getValue().getValueCase());
        assertEquals("Date: 09/11/2021, Time: 9:35, Borough: BROOKLYN, Killed: 0", TypedValues.render(e.getValue()));
        assertEquals("1211 LORING AVENUE", e.getRecord().getOffStreetName());
        assertTrue(e.getRecord().getHasLocation());
        assertEquals(40.667202, e.getRecord().getLatitude(), 1e-9);
        assertEquals("11208", e.getRecord().getZipCode());
    }

    @Test
    public void testTimingReport() throws TransportException {
        logger.info("testTimingReport");
        QueryResponse r = client.query("get_all", Collections.emptyList());
        TimingReport timing = TimingReport.fromMessages(r.getTimingsList());
        for (String op : List.of(TimingReport.DOWNSTREAM_QUERIES, TimingReport.MERGE, TimingReport.TOTAL_PROCESSING)) {
            assertTrue(timing.get(CrashServeCluster.COORDINATOR_ID, op).isPresent(), op);
        }
        for (Borough b : Borough.values()) {
            String id = CrashServeCluster.workerID(b);
            assertTrue(timing.get(CrashServeCluster.COORDINATOR_ID, TimingReport.QUERY_TO_PREFIX + id).isPresent());
            assertTrue(timing.get(id, TimingReport.SCAN).isPresent());
            assertTrue(timing.get(id, TimingReport.TOTAL_PROCESSING).isPresent());
        }
        TimingReport decoded = TimingFormat.decode(r.getTimingData());
        assertEquals(timing.asMap().keySet(), decoded.asMap().keySet());
        assertTrue(r.getTimingData().contains("[Process A]"));
        // Staten Island and the overflow shard are both served by E, so one call and one section each.
        assertEquals(Set.of("A", "B", "C", "D", "E"), decoded.asMap().keySet());
    }

    @Test
    public void testStreamChunks() throws TransportException {
        logger.info("testStreamChunks");
        QueryRequest request = CrashQueryClient.request("get_all", Collections.emptyList());
        List<DataChunk> chunks = client.streamChunks(request);
        assertEquals(3, chunks.size());
        for (int i = 0; i < chunks.size() - 1; i++) {
            assertFalse(chunks.get(i).getIsLast());
            assertFalse(chunks.get(i).hasSummary());
        }
        DataChunk last = chunks.get(2);
        assertTrue(last.getIsLast());
        assertTrue(last.getSummary().getSuccess());
        assertEquals(request.getQueryId(), last.getSummary().getQueryId());
        assertEquals(0, last.getSummary().getResultsCount());

        QueryResponse streamed = client.stream(CrashQueryClient.request("get_all", Collections.emptyList()));
        assertEquals(ALL_KEYS, keys(streamed));
    }

    @Test
    public void testStreamEmptyResult() throws TransportException {
        logger.info("testStreamEmptyResult");
        List<DataChunk> chunks = client.streamChunks(
                CrashQueryClient.request("get_by_borough", List.of("MANHATTAN")));
        assertEquals(1, chunks.size());
        assertTrue(chunks.get(0).getIsLast());
        assertTrue(chunks.get(0).getSummary().getSuccess());

        chunks = client.streamChunks(CrashQueryClient.request("get_everything", Collections.emptyList()));
        assertEquals(1, chunks.size());
        assertFalse(chunks.get(0).getSummary().getSuccess());
    }

    @Test
    public void testSendData() throws Exception {
        logger.info("testSendData");
        byte[] payload = "hello".getBytes(StandardCharsets.UTF_8);
        client.send("client", CrashServeCluster.COORDINATOR_ID, payload);
        assertEquals(1, cluster.coordinator.getNumReceivedMessages());
        assertEquals(ByteString.copyFrom(payload), cluster.coordinator.getLastReceivedMessage().get().getData());
        // Only a count and the latest payload are kept.
        for (int i = 0; i < 3; i++) {
            client.send("client", CrashServeCluster.COORDINATOR_ID, ("more-" + i).getBytes(StandardCharsets.UTF_8));
        }
        assertEquals(4, cluster.coordinator.getNumReceivedMessages());
        assertEquals("more-2", cluster.coordinator.getLastReceivedMessage().get().getData().toStringUtf8());

        String queensID = CrashServeCluster.workerID(Borough.QUEENS);
        client.send("client", queensID, payload);
        Worker queens = cluster.workers.get(Borough.QUEENS);
        assertEquals(1, queens.getNumReceivedMessages());
        DataMessage forwarded = queens.getLastReceivedMessage().get();
        assertEquals(queensID, forwarded.getDestination());
        assertEquals("client", forwarded.getSource());
        assertEquals(ByteString.copyFrom(payload), forwarded.getData());
        for (Borough b : Set.of(Borough.BROOKLYN, Borough.BRONX, Borough.OTHER)) {
            assertEquals(0, cluster.workers.get(b).getNumReceivedMessages());
            assertTrue(cluster.workers.get(b).getLastReceivedMessage().isEmpty());
        }
        assertEquals(4, cluster.coordinator.getNumReceivedMessages());

        TransportException e = assertThrows(TransportException.class, () -> client.send("client", "Z", payload));
        assertEquals(Status.Code.NOT_FOUND, e.getCode());
    }
}
