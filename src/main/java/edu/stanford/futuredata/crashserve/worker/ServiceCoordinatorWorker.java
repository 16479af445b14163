package edu.stanford.futuredata.crashserve.worker;

import edu.stanford.futuredata.crashserve.*;
import io.grpc.Status;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

class ServiceCoordinatorWorker extends CoordinatorWorkerGrpc.CoordinatorWorkerImplBase {

    private static final Logger logger = LoggerFactory.getLogger(ServiceCoordinatorWorker.class);

    private final Worker worker;

    ServiceCoordinatorWorker(Worker worker) {
        this.worker = worker;
    }

    @Override
    public void executeQuery(ShardQueryMessage request, StreamObserver<ShardQueryResponse> responseObserver) {
        ServerCallStreamObserver<ShardQueryResponse> serverObserver =
                (ServerCallStreamObserver<ShardQueryResponse>) responseObserver;
        for (ShardQueryResponse page : executeQueryHandler(request)) {
            if (serverObserver.isCancelled()) {
                logger.info("Worker {} query {} cancelled by coordinator", worker.workerID, request.getQueryId());
                return;
            }
            responseObserver.onNext(page);
        }
        responseObserver.onCompleted();
    }

    private List<ShardQueryResponse> executeQueryHandler(ShardQueryMessage m) {
        try {
            return worker.executeQuery(m);
        } catch (RuntimeException e) {
            // Isolated to this worker; the coordinator reports it and keeps the other shards' results.
            logger.error("Worker {} failed query {}", worker.workerID, m.getQueryId(), e);
            return Collections.singletonList(ShardQueryResponse.newBuilder().setQueryId(m.getQueryId())
                    .setSuccess(false).setIsLast(true)
                    .setMessage(String.format("Worker %s internal error: %s", worker.workerID, e)).build());
        }
    }

    @Override
    public void sendData(DataMessage request, StreamObserver<Empty> responseObserver) {
        if (!request.getDestination().equals(worker.workerID)) {
            responseObserver.onError(Status.NOT_FOUND
                    .withDescription(String.format("Worker %s cannot accept data for %s",
                            worker.workerID, request.getDestination()))
                    .asRuntimeException());
            return;
        }
        worker.receiveData(request);
        responseObserver.onNext(Empty.newBuilder().build());
        responseObserver.onCompleted();
    }
}
