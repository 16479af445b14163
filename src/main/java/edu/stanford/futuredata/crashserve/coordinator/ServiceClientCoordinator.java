package edu.stanford.futuredata.crashserve.coordinator;

import edu.stanford.futuredata.crashserve.*;
import io.grpc.Status;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class ServiceClientCoordinator extends ClientCoordinatorGrpc.ClientCoordinatorImplBase {

    private static final Logger logger = LoggerFactory.getLogger(ServiceClientCoordinator.class);

    private final Coordinator coordinator;

    ServiceClientCoordinator(Coordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void queryData(QueryRequest request, StreamObserver<QueryResponse> responseObserver) {
        QueryResponse response = queryDataHandler(request);
        if (((ServerCallStreamObserver<QueryResponse>) responseObserver).isCancelled()) {
            logger.info("Query {} cancelled by client, dropping {} partial results", request.getQueryId(),
                    response.getResultsCount());
            return;
        }
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    // Query failures are reported in the response body, never as an RPC error.
    private QueryResponse queryDataHandler(QueryRequest request) {
        try {
            return coordinator.queryData(request);
        } catch (RuntimeException e) {
            logger.error("Coordinator failed query {}", request.getQueryId(), e);
            return QueryResponse.newBuilder().setQueryId(request.getQueryId()).setSuccess(false)
                    .setMessage("Coordinator internal error: " + e).build();
        }
    }

    @Override
    public void streamData(QueryRequest request, StreamObserver<DataChunk> responseObserver) {
        ServerCallStreamObserver<DataChunk> serverObserver = (ServerCallStreamObserver<DataChunk>) responseObserver;
        for (DataChunk chunk : coordinator.toChunks(queryDataHandler(request))) {
            if (serverObserver.isCancelled()) {
                logger.info("Stream for query {} cancelled by client", request.getQueryId());
                return;
            }
            responseObserver.onNext(chunk);
        }
        responseObserver.onCompleted();
    }

    @Override
    public void sendData(DataMessage request, StreamObserver<Empty> responseObserver) {
        Status status = coordinator.sendData(request);
        if (status.isOk()) {
            responseObserver.onNext(Empty.newBuilder().build());
            responseObserver.onCompleted();
        } else {
            responseObserver.onError(status.asRuntimeException());
        }
    }
}
