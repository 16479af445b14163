package edu.stanford.futuredata.crashserve.client;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import edu.stanford.futuredata.crashserve.*;
import edu.stanford.futuredata.crashserve.utilities.Utilities;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/** Blocking client of the coordinator's query service. */
public class CrashQueryClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CrashQueryClient.class);

    private final ManagedChannel channel;
    private final ClientCoordinatorGrpc.ClientCoordinatorBlockingStub blockingStub;
    // Per-call deadline in milliseconds, 0 for none.
    private final long deadlineMillis;

    public CrashQueryClient(String host, int port) {
        this(host, port, 0);
    }

    public CrashQueryClient(String host, int port, long deadlineMillis) {
        this.channel = ManagedChannelBuilder.forAddress(host, port).usePlaintext()
                .maxInboundMessageSize(Utilities.MAX_INBOUND_MESSAGE_BYTES).build();
        this.blockingStub = ClientCoordinatorGrpc.newBlockingStub(channel);
        this.deadlineMillis = deadlineMillis;
    }

    public static QueryRequest request(String queryString, List<String> parameters) {
        return QueryRequest.newBuilder()
                .setQueryId(UUID.randomUUID().toString())
                .setQueryString(queryString)
                .addAllParameters(parameters)
                .build();
    }

    private ClientCoordinatorGrpc.ClientCoordinatorBlockingStub stub() {
        if (deadlineMillis > 0) {
            return blockingStub.withDeadlineAfter(deadlineMillis, TimeUnit.MILLISECONDS);
        }
        return blockingStub;
    }

    public QueryResponse query(String queryString, List<String> parameters) throws TransportException {
        return query(request(queryString, parameters));
    }

    public QueryResponse query(QueryRequest request) throws TransportException {
        try {
            return stub().queryData(request);
        } catch (StatusRuntimeException e) {
            logger.warn("Query {} failed: {}", request.getQueryId(), e.getStatus());
            throw new TransportException(e);
        }
    }

    /** The raw chunk sequence of a streamed query, in order. */
    public List<DataChunk> streamChunks(QueryRequest request) throws TransportException {
        List<DataChunk> chunks = new ArrayList<>();
        try {
            Iterator<DataChunk> it = stub().streamData(request);
            while (it.hasNext()) {
                chunks.add(it.next());
            }
        } catch (StatusRuntimeException e) {
            logger.warn("Stream {} failed after {} chunks: {}", request.getQueryId(), chunks.size(), e.getStatus());
            throw new TransportException(e);
        }
        return chunks;
    }

    /** Run a query through the streaming call and reassemble the pages into one response. */
    public QueryResponse stream(QueryRequest request) throws TransportException {
        List<DataChunk> chunks = streamChunks(request);
        if (chunks.isEmpty() || !chunks.get(chunks.size() - 1).getIsLast()) {
            throw new TransportException(String.format("Stream %s ended without a final chunk", request.getQueryId()));
        }
        QueryResponse.Builder response = chunks.get(chunks.size() - 1).getSummary().toBuilder();
        for (DataChunk chunk : chunks) {
            try {
                response.addAllResults(ResultPage.parseFrom(chunk.getData()).getEntriesList());
            } catch (InvalidProtocolBufferException e) {
                throw new TransportException("Malformed chunk " + chunk.getChunkId(), e);
            }
        }
        return response.build();
    }

    public void send(String source, String destination, byte[] data) throws TransportException {
        DataMessage m = DataMessage.newBuilder()
                .setMessageId(UUID.randomUUID().toString())
                .setSource(source)
                .setDestination(destination)
                .setData(ByteString.copyFrom(data))
                .build();
        try {
            stub().sendData(m);
        } catch (StatusRuntimeException e) {
            throw new TransportException(e);
        }
    }

    @Override
    public void close() {
        channel.shutdown();
        try {
            if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
