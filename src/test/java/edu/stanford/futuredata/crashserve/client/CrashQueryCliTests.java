package edu.stanford.futuredata.crashserve.client;

import edu.stanford.futuredata.crashserve.QueryRequest;
import edu.stanford.futuredata.crashserve.QueryResponse;
import edu.stanford.futuredata.crashserve.utilities.TypedValues;
import edu.stanford.futuredata.crashserve.ResultEntry;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CrashQueryCliTests {

    private static QueryRequest parse(String... args) throws ParseException {
        return CrashQueryCli.toRequest(new DefaultParser().parse(CrashQueryCli.options(), args));
    }

    @Test
    public void testFlagToVerb() throws ParseException {
        assertEquals("get_all", parse("--all").getQueryString());
        assertEquals(0, parse("--all").getParametersCount());

        QueryRequest r = parse("--borough", "STATEN ISLAND");
        assertEquals("get_by_borough", r.getQueryString());
        assertEquals(List.of("STATEN ISLAND"), r.getParametersList());

        assertEquals("get_by_street", parse("--street", "AVENUE").getQueryString());

        r = parse("--dates", "01/01/2021", "12/31/2021");
        assertEquals("get_by_date_range", r.getQueryString());
        assertEquals(List.of("01/01/2021", "12/31/2021"), r.getParametersList());

        r = parse("--injuries", "2", "--host", "example");
        assertEquals("get_crashes_with_injuries", r.getQueryString());
        assertEquals(List.of("2"), r.getParametersList());

        assertEquals("get_crashes_with_fatalities", parse("--fatalities", "1").getQueryString());
        assertEquals(List.of("8:17"), parse("--time", "8:17", "--json").getParametersList());
        assertFalse(parse("--all").getQueryId().isEmpty());
        assertNotEquals(parse("--all").getQueryId(), parse("--all").getQueryId());
    }

    @Test
    public void testExactlyOneQueryFlag() {
        assertThrows(ParseException.class, () -> parse("--json"));
        assertThrows(ParseException.class, () -> parse("--all", "--borough", "BRONX"));
        assertThrows(ParseException.class, () -> parse("--dates", "01/01/2021"));
    }

    @Test
    public void testUsageErrorExitCode() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code = CrashQueryCli.run(new String[]{"--stream"}, new PrintStream(out), new PrintStream(err));
        assertEquals(2, code);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Specify exactly one"));
        assertEquals(2, CrashQueryCli.run(new String[]{"--all", "--port", "x"}, new PrintStream(out), new PrintStream(err)));
    }

    @Test
    public void testPrintResponse() {
        QueryResponse response = QueryResponse.newBuilder().setQueryId("q1").setSuccess(true).setMessage("done")
                .addResults(ResultEntry.newBuilder().setKey("BRONX-2").setValue(TypedValues.of("Date: x")))
                .build();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        CrashQueryCli.printResponse(response, new PrintStream(out, true, StandardCharsets.UTF_8));
        String text = out.toString(StandardCharsets.UTF_8);
        assertTrue(text.startsWith("Query q1: success"), text);
        assertTrue(text.contains("1 result(s)"), text);
        assertTrue(text.contains("BRONX-2  Date: x"), text);
    }
}
