package edu.stanford.futuredata.crashserve;

import edu.stanford.futuredata.crashserve.coordinator.Coordinator;
import edu.stanford.futuredata.crashserve.crash.Borough;
import edu.stanford.futuredata.crashserve.crash.CrashShardFactory;
import edu.stanford.futuredata.crashserve.ingest.CrashDataPartitioner;
import edu.stanford.futuredata.crashserve.ingest.IngestionException;
import edu.stanford.futuredata.crashserve.utilities.ServiceConfig;
import edu.stanford.futuredata.crashserve.utilities.WorkerDescription;
import edu.stanford.futuredata.crashserve.worker.Worker;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

public class CrashServeExecutable {

    private static final Logger logger = LoggerFactory.getLogger(CrashServeExecutable.class);

    public static void main(String[] args) throws Exception {
        Options options = new Options();
        options.addOption("coordinator", false, "Start Coordinator?");
        options.addOption("worker", false, "Start Worker?");
        options.addOption("ingest", false, "Partition a raw crash file into shard files?");

        options.addOption("id", true, "Worker ID");
        options.addOption("input", true, "Raw crash CSV");
        options.addOption("output", true, "Shard file directory");
        options.addOption("conf", true, "Configuration file");

        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse(options, args);

        if (cmd.hasOption("ingest")) {
            logger.info("Partitioning {}", cmd.getOptionValue("input"));
            runIngest(Path.of(cmd.getOptionValue("input")), Path.of(cmd.getOptionValue("output", "data")));
            return;
        }
        ServiceConfig config = ServiceConfig.load(Optional.ofNullable(cmd.getOptionValue("conf")).map(Path::of));
        if (cmd.hasOption("coordinator")) {
            logger.info("Starting coordinator!");
            runCoordinator(config);
        }
        if (cmd.hasOption("worker")) {
            logger.info("Starting worker!");
            runWorker(config, cmd.getOptionValue("id"));
        }
    }

    private static void runIngest(Path input, Path outputDir) throws IngestionException {
        Map<Borough, Integer> counts = CrashDataPartitioner.partition(input, outputDir);
        int total = counts.values().stream().mapToInt(i -> i).sum();
        logger.info("Partitioned {} rows into {}", total, outputDir);
    }

    private static void runCoordinator(ServiceConfig config) throws InterruptedException {
        Coordinator coordinator = new Coordinator(config);
        if (coordinator.startServing() != 0) {
            System.exit(1);
        }
        Runtime.getRuntime().addShutdownHook(new Thread(coordinator::stopServing));
        Thread.sleep(Long.MAX_VALUE);
    }

    private static void runWorker(ServiceConfig config, String workerID) throws InterruptedException {
        Optional<WorkerDescription> description = config.getWorker(workerID);
        if (description.isEmpty()) {
            logger.error("No worker {} in configuration", workerID);
            System.exit(1);
        }
        Worker worker = new Worker(description.get(), new CrashShardFactory());
        if (!worker.startServing()) {
            System.exit(1);
        }
        Runtime.getRuntime().addShutdownHook(new Thread(worker::shutDown));
        Thread.sleep(Long.MAX_VALUE);
    }
}
