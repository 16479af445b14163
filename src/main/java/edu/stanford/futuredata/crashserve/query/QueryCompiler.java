package edu.stanford.futuredata.crashserve.query;

import edu.stanford.futuredata.crashserve.crash.Borough;
import edu.stanford.futuredata.crashserve.crash.CrashRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/** Translates a query string and its positional parameters into a test over crash records. */
public class QueryCompiler {

    private QueryCompiler() {}

    public static CompiledQuery compile(String queryString, List<String> parameters) throws QueryException {
        Optional<Verb> verbOpt = Verb.fromQueryString(queryString);
        if (verbOpt.isEmpty()) {
            throw new UnknownVerbException(queryString);
        }
        Verb verb = verbOpt.get();
        if (parameters.size() != verb.getArity()) {
            throw new ArityException(verb, parameters.size());
        }
        switch (verb) {
            case GET_ALL:
                return new CompiledQuery(verb, r -> true, null, false);
            case GET_BY_BOROUGH: {
                Optional<Borough> borough = Borough.fromName(parameters.get(0));
                if (borough.isEmpty()) {
                    return new CompiledQuery(verb, r -> false, null, true);
                }
                Borough b = borough.get();
                return new CompiledQuery(verb, r -> r.getBorough() == b, b, false);
            }
            case GET_BY_STREET: {
                String street = parameters.get(0).trim().toUpperCase(Locale.ROOT);
                Predicate<CrashRecord> p = r -> containsIgnoreCase(r.getOnStreetName(), street)
                        || containsIgnoreCase(r.getCrossStreetName(), street)
                        || containsIgnoreCase(r.getOffStreetName(), street);
                return new CompiledQuery(verb, p, null, false);
            }
            case GET_BY_DATE_RANGE: {
                LocalDate start = parseDate(parameters.get(0));
                LocalDate end = parseDate(parameters.get(1));
                if (start.isAfter(end)) {
                    return new CompiledQuery(verb, r -> false, null, true);
                }
                Predicate<CrashRecord> p = r -> r.getDate() != null
                        && !r.getDate().isBefore(start) && !r.getDate().isAfter(end);
                return new CompiledQuery(verb, p, null, false);
            }
            case GET_CRASHES_WITH_INJURIES: {
                int threshold = parseThreshold(parameters.get(0));
                return new CompiledQuery(verb, r -> r.getPersonsInjured() >= threshold, null, false);
            }
            case GET_CRASHES_WITH_FATALITIES: {
                int threshold = parseThreshold(parameters.get(0));
                return new CompiledQuery(verb, r -> r.getPersonsKilled() >= threshold, null, false);
            }
            case GET_BY_TIME: {
                String time = parameters.get(0).trim();
                return new CompiledQuery(verb, r -> r.getCrashTime().equals(time), null, false);
            }
            default:
                throw new UnknownVerbException(queryString);
        }
    }

    private static boolean containsIgnoreCase(String field, String upperNeedle) {
        return field.toUpperCase(Locale.ROOT).contains(upperNeedle);
    }

    private static LocalDate parseDate(String value) throws InvalidParameterException {
        LocalDate date = CrashRecord.parseDateOrNull(value);
        if (date == null) {
            throw new InvalidParameterException(String.format("'%s' is not a MM/DD/YYYY date", value));
        }
        return date;
    }

    private static int parseThreshold(String value) throws InvalidParameterException {
        try {
            int threshold = Integer.parseInt(value.trim());
            if (threshold < 0) {
                throw new InvalidParameterException(String.format("Threshold must be non-negative, got %d", threshold));
            }
            return threshold;
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(String.format("'%s' is not a non-negative integer", value), e);
        }
    }
}
