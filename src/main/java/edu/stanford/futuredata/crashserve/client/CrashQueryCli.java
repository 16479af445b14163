package edu.stanford.futuredata.crashserve.client;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import edu.stanford.futuredata.crashserve.QueryRequest;
import edu.stanford.futuredata.crashserve.QueryResponse;
import edu.stanford.futuredata.crashserve.ResultEntry;
import edu.stanford.futuredata.crashserve.query.Verb;
import edu.stanford.futuredata.crashserve.utilities.TypedValues;
import edu.stanford.futuredata.crashserve.utilities.Utilities;
import org.apache.commons.cli.*;
import org.javatuples.Pair;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Command-line front end: maps query flags to a request, runs it, and prints the response. */
public class CrashQueryCli {

    private static final String DEFAULT_HOST = "localhost";
    private static final int DEFAULT_PORT = 50051;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static Options options() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("all").desc("All crashes").build());
        options.addOption(Option.builder().longOpt("borough").hasArg().argName("B").desc("Crashes in borough B").build());
        options.addOption(Option.builder().longOpt("street").hasArg().argName("S").desc("Crashes on a street containing S").build());
        options.addOption(Option.builder().longOpt("dates").numberOfArgs(2).argName("START END")
                .desc("Crashes between two MM/DD/YYYY dates, inclusive").build());
        options.addOption(Option.builder().longOpt("injuries").hasArg().argName("N").desc("Crashes with at least N injured").build());
        options.addOption(Option.builder().longOpt("fatalities").hasArg().argName("N").desc("Crashes with at least N killed").build());
        options.addOption(Option.builder().longOpt("time").hasArg().argName("T").desc("Crashes at time of day T").build());
        options.addOption(Option.builder().longOpt("stream").desc("Fetch results through the streaming call").build());
        options.addOption(Option.builder().longOpt("json").desc("Print the response as JSON").build());
        options.addOption(Option.builder().longOpt("timing").desc("Print client and server timing").build());
        options.addOption(Option.builder().longOpt("host").hasArg().desc("Coordinator host").build());
        options.addOption(Option.builder().longOpt("port").hasArg().desc("Coordinator port").build());
        options.addOption(Option.builder().longOpt("server").hasArg().argName("HOST:PORT").desc("Coordinator address").build());
        options.addOption(Option.builder().longOpt("deadline").hasArg().argName("MILLIS").desc("Call deadline").build());
        return options;
    }

    /** The request selected by the query flags.  Exactly one query flag must be present. */
    static QueryRequest toRequest(CommandLine cmd) throws ParseException {
        List<Pair<Verb, List<String>>> selected = new ArrayList<>();
        if (cmd.hasOption("all")) {
            selected.add(new Pair<>(Verb.GET_ALL, Collections.emptyList()));
        }
        if (cmd.hasOption("borough")) {
            selected.add(new Pair<>(Verb.GET_BY_BOROUGH, List.of(cmd.getOptionValue("borough"))));
        }
        if (cmd.hasOption("street")) {
            selected.add(new Pair<>(Verb.GET_BY_STREET, List.of(cmd.getOptionValue("street"))));
        }
        if (cmd.hasOption("dates")) {
            selected.add(new Pair<>(Verb.GET_BY_DATE_RANGE, Arrays.asList(cmd.getOptionValues("dates"))));
        }
        if (cmd.hasOption("injuries")) {
            selected.add(new Pair<>(Verb.GET_CRASHES_WITH_INJURIES, List.of(cmd.getOptionValue("injuries"))));
        }
        if (cmd.hasOption("fatalities")) {
            selected.add(new Pair<>(Verb.GET_CRASHES_WITH_FATALITIES, List.of(cmd.getOptionValue("fatalities"))));
        }
        if (cmd.hasOption("time")) {
            selected.add(new Pair<>(Verb.GET_BY_TIME, List.of(cmd.getOptionValue("time"))));
        }
        if (selected.size() != 1) {
            throw new ParseException("Specify exactly one of --all, --borough, --street, --dates, --injuries, "
                    + "--fatalities, --time");
        }
        Pair<Verb, List<String>> query = selected.get(0);
        return CrashQueryClient.request(query.getValue0().getQueryString(), query.getValue1());
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Options options = options();
        CommandLine cmd;
        QueryRequest request;
        String host = DEFAULT_HOST;
        int port = DEFAULT_PORT;
        long deadlineMillis = 0;
        try {
            cmd = new DefaultParser().parse(options, args);
            request = toRequest(cmd);
            if (cmd.hasOption("server")) {
                Pair<String, Integer> hostPort = Utilities.parseConnectString(cmd.getOptionValue("server"));
                host = hostPort.getValue0();
                port = hostPort.getValue1();
            }
            host = cmd.getOptionValue("host", host);
            if (cmd.hasOption("port")) {
                port = Integer.parseInt(cmd.getOptionValue("port"));
            }
            if (cmd.hasOption("deadline")) {
                deadlineMillis = Long.parseLong(cmd.getOptionValue("deadline"));
            }
        } catch (ParseException | IllegalArgumentException e) {
            err.println(e.getMessage());
            new HelpFormatter().printHelp(new PrintWriter(err, true), HelpFormatter.DEFAULT_WIDTH,
                    "crash-query", null, options, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD,
                    null, true);
            return 2;
        }

        try (CrashQueryClient client = new CrashQueryClient(host, port, deadlineMillis)) {
            long t0 = System.nanoTime();
            QueryResponse response = cmd.hasOption("stream") ? client.stream(request) : client.query(request);
            long roundTripNanos = System.nanoTime() - t0;
            if (cmd.hasOption("json")) {
                out.println(JsonFormat.printer().print(response));
            } else {
                printResponse(response, out);
            }
            if (cmd.hasOption("timing")) {
                out.printf("Client round trip: %.6f seconds%n", Utilities.nanosToSeconds(roundTripNanos));
                out.print(response.getTimingData());
            }
            return response.getSuccess() ? 0 : 1;
        } catch (TransportException e) {
            err.printf("RPC error: %s%n", e.getMessage());
            return 3;
        } catch (InvalidProtocolBufferException e) {
            err.printf("Cannot render response: %s%n", e.getMessage());
            return 3;
        }
    }

    static void printResponse(QueryResponse response, PrintStream out) {
        out.printf("Query %s: %s%n", response.getQueryId(), response.getSuccess() ? "success" : "FAILED");
        out.println(response.getMessage());
        out.printf("%d result(s)%n", response.getResultsCount());
        for (ResultEntry entry : response.getResultsList()) {
            out.printf("  %s  %s%n", entry.getKey(), TypedValues.render(entry.getValue()));
        }
    }
}
