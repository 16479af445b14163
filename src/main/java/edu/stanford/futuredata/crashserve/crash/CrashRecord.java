package edu.stanford.futuredata.crashserve.crash;

import edu.stanford.futuredata.crashserve.CrashRecordMessage;
import edu.stanford.futuredata.crashserve.ResultEntry;
import edu.stanford.futuredata.crashserve.ingest.IngestionException;
import edu.stanford.futuredata.crashserve.interfaces.Row;
import edu.stanford.futuredata.crashserve.utilities.TypedValues;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** One crash incident.  Immutable once loaded. */
public class CrashRecord implements Row {

    public static final String CRASH_DATE = "CRASH_DATE";
    public static final String CRASH_TIME = "CRASH_TIME";
    public static final String BOROUGH = "BOROUGH";
    public static final String ZIP_CODE = "ZIP_CODE";
    public static final String LATITUDE = "LATITUDE";
    public static final String LONGITUDE = "LONGITUDE";
    public static final String LOCATION = "LOCATION";
    public static final String ON_STREET_NAME = "ON_STREET_NAME";
    public static final String CROSS_STREET_NAME = "CROSS_STREET_NAME";
    public static final String OFF_STREET_NAME = "OFF_STREET_NAME";
    public static final String PERSONS_INJURED = "NUMBER_OF_PERSONS_INJURED";
    public static final String PERSONS_KILLED = "NUMBER_OF_PERSONS_KILLED";
    public static final String PEDESTRIANS = "NUMBER_OF_PEDESTRIANS";

    // Column set of a shard file, in file order.
    public static final String[] COLUMNS = {
            CRASH_DATE, CRASH_TIME, BOROUGH, ZIP_CODE, LATITUDE, LONGITUDE, LOCATION,
            ON_STREET_NAME, CROSS_STREET_NAME, OFF_STREET_NAME,
            PERSONS_INJURED, PERSONS_KILLED, PEDESTRIANS
    };

    public static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT);

    // Line of the record in its source file.  Unique within a shard.
    private final int recordNum;
    private final String crashDate;
    private final LocalDate date;
    private final String crashTime;
    private final String rawBorough;
    private final Borough borough;
    private final String zipCode;
    private final Double latitude;
    private final Double longitude;
    private final String onStreetName;
    private final String crossStreetName;
    private final String offStreetName;
    private final int personsInjured;
    private final int personsKilled;
    private final int pedestrians;

    public CrashRecord(int recordNum, String crashDate, String crashTime, String rawBorough, String zipCode,
                       Double latitude, Double longitude, String onStreetName, String crossStreetName,
                       String offStreetName, int personsInjured, int personsKilled, int pedestrians) {
        this.recordNum = recordNum;
        this.crashDate = Objects.requireNonNull(crashDate);
        this.date = parseDateOrNull(crashDate);
        this.crashTime = Objects.requireNonNull(crashTime);
        this.rawBorough = rawBorough == null ? "" : rawBorough.trim().toUpperCase(Locale.ROOT);
        this.borough = Borough.forRecord(this.rawBorough);
        this.zipCode = zipCode == null ? "" : zipCode;
        this.latitude = latitude;
        this.longitude = longitude;
        this.onStreetName = onStreetName == null ? "" : onStreetName;
        this.crossStreetName = crossStreetName == null ? "" : crossStreetName;
        this.offStreetName = offStreetName == null ? "" : offStreetName;
        this.personsInjured = personsInjured;
        this.personsKilled = personsKilled;
        this.pedestrians = pedestrians;
    }

    @Override
    public int getPartitionKey() {
        return borough.getShardNum();
    }

    public int getRecordNum() {
        return recordNum;
    }

    /** Result key, e.g. "BROOKLYN-3". */
    public String getRecordKey() {
        return borough.name() + "-" + recordNum;
    }

    public String getCrashDate() {
        return crashDate;
    }

    /** Parsed crash date, null when the column was blank. */
    public LocalDate getDate() {
        return date;
    }

    public String getCrashTime() {
        return crashTime;
    }

    public String getRawBorough() {
        return rawBorough;
    }

    public Borough getBorough() {
        return borough;
    }

    public String getZipCode() {
        return zipCode;
    }

    public Double getLatitude() {
        return latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public String getOnStreetName() {
        return onStreetName;
    }

    public String getCrossStreetName() {
        return crossStreetName;
    }

    public String getOffStreetName() {
        return offStreetName;
    }

    public int getPersonsInjured() {
        return personsInjured;
    }

    public int getPersonsKilled() {
        return personsKilled;
    }

    public int getPedestrians() {
        return pedestrians;
    }

    /** Legacy free-text rendering carried as the string value of a result entry. */
    public String toDisplayString() {
        return String.format("Date: %s, Time: %s, Borough: %s, Killed: %d",
                crashDate, crashTime, rawBorough, personsKilled);
    }

    public CrashRecordMessage toMessage() {
        CrashRecordMessage.Builder b = CrashRecordMessage.newBuilder()
                .setCrashDate(crashDate)
                .setCrashTime(crashTime)
                .setBorough(rawBorough)
                .setZipCode(zipCode)
                .setOnStreetName(onStreetName)
                .setCrossStreetName(crossStreetName)
                .setOffStreetName(offStreetName)
                .setPersonsInjured(personsInjured)
                .setPersonsKilled(personsKilled)
                .setPedestrians(pedestrians);
        if (latitude != null && longitude != null) {
            b.setHasLocation(true).setLatitude(latitude).setLongitude(longitude);
        }
        return b.build();
    }

    public ResultEntry toResultEntry() {
        return ResultEntry.newBuilder()
                .setKey(getRecordKey())
                .setValue(TypedValues.of(toDisplayString()))
                .setRecord(toMessage())
                .build();
    }

    /** Build a record from a CSV row given the column positions produced by {@link #indexHeader}. */
    public static CrashRecord fromCsvRow(String[] row, Map<String, Integer> columnIndex, int lineNum)
            throws IngestionException {
        String crashDate = column(row, columnIndex, CRASH_DATE);
        if (!crashDate.isEmpty() && parseDateOrNull(crashDate) == null) {
            throw new IngestionException(String.format("Line %d: malformed crash date '%s'", lineNum, crashDate));
        }
        return new CrashRecord(
                lineNum,
                crashDate,
                column(row, columnIndex, CRASH_TIME),
                column(row, columnIndex, BOROUGH),
                column(row, columnIndex, ZIP_CODE),
                parseDouble(column(row, columnIndex, LATITUDE), LATITUDE, lineNum),
                parseDouble(column(row, columnIndex, LONGITUDE), LONGITUDE, lineNum),
                column(row, columnIndex, ON_STREET_NAME),
                column(row, columnIndex, CROSS_STREET_NAME),
                column(row, columnIndex, OFF_STREET_NAME),
                parseCount(column(row, columnIndex, PERSONS_INJURED), PERSONS_INJURED, lineNum),
                parseCount(column(row, columnIndex, PERSONS_KILLED), PERSONS_KILLED, lineNum),
                parseCount(column(row, columnIndex, PEDESTRIANS), PEDESTRIANS, lineNum));
    }

    /** Map normalized header names to their positions. */
    public static Map<String, Integer> indexHeader(String[] header) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            index.putIfAbsent(normalizeHeader(header[i]), i);
        }
        return index;
    }

    // "CRASH DATE", "crash_date" and a BOM-prefixed "CRASH_DATE" all map to CRASH_DATE.
    public static String normalizeHeader(String name) {
        String n = name.replace("\uFEFF", "").trim().toUpperCase(Locale.ROOT);
        return n.replaceAll("\\s+", "_");
    }

    public static LocalDate parseDateOrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim(), DATE_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String column(String[] row, Map<String, Integer> columnIndex, String name) {
        Integer i = columnIndex.get(name);
        if (i == null || i >= row.length || row[i] == null) {
            return "";
        }
        return row[i].trim();
    }

    private static int parseCount(String value, String name, int lineNum) throws IngestionException {
        if (value.isEmpty()) {
            return 0;
        }
        try {
            int count = Integer.parseInt(value);
            if (count < 0) {
                throw new IngestionException(String.format("Line %d: negative %s %d", lineNum, name, count));
            }
            return count;
        } catch (NumberFormatException e) {
            throw new IngestionException(String.format("Line %d: malformed %s '%s'", lineNum, name, value), e);
        }
    }

    private static Double parseDouble(String value, String name, int lineNum) throws IngestionException {
        if (value.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IngestionException(String.format("Line %d: malformed %s '%s'", lineNum, name, value), e);
        }
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
