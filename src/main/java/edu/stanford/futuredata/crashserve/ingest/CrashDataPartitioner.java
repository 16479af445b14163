package edu.stanford.futuredata.crashserve.ingest;

import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;
import edu.stanford.futuredata.crashserve.crash.Borough;
import edu.stanford.futuredata.crashserve.crash.CrashRecord;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.Map;

/**
 * Splits a raw crash CSV into one shard file per borough.  Each output file carries the fixed shard column header;
 * columns missing from the input are written blank.  Rows with a blank or unrecognized borough go to OTHER.
 */
public class CrashDataPartitioner {

    private static final Logger logger = LoggerFactory.getLogger(CrashDataPartitioner.class);

    private static final String[] REQUIRED_COLUMNS = {
            CrashRecord.CRASH_DATE, CrashRecord.CRASH_TIME, CrashRecord.BOROUGH
    };

    // Suffix of shard files still being written.  They replace the shard files only once the input is fully read.
    static final String PARTIAL_SUFFIX = ".partial";

    /**
     * Partition input into outputDir.  Returns the number of rows written per borough.  On failure the shard files
     * already in outputDir are left as they were.
     */
    public static Map<Borough, Integer> partition(Path input, Path outputDir) throws IngestionException {
        try {
            FileUtils.forceMkdir(outputDir.toFile());
        } catch (IOException e) {
            throw new IngestionException("Cannot create output directory " + outputDir, e);
        }
        Map<Borough, CSVWriter> writers = new EnumMap<>(Borough.class);
        Map<Borough, Path> partialFiles = new EnumMap<>(Borough.class);
        Map<Borough, Integer> counts = new EnumMap<>(Borough.class);
        boolean complete = false;
        try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8);
             CSVReader csvReader = new CSVReader(reader)) {
            String[] header = csvReader.readNext();
            if (header == null) {
                throw new IngestionException(String.format("Input file %s is empty", input));
            }
            Map<String, Integer> columnIndex = CrashRecord.indexHeader(header);
            for (String column : REQUIRED_COLUMNS) {
                if (!columnIndex.containsKey(column)) {
                    throw new IngestionException(String.format("Input file %s is missing column %s", input, column));
                }
            }
            for (Borough b : Borough.values()) {
                Path partial = outputDir.resolve(b.getShardFileName() + PARTIAL_SUFFIX);
                partialFiles.put(b, partial);
                CSVWriter writer = new CSVWriter(
                        Files.newBufferedWriter(partial, StandardCharsets.UTF_8),
                        CSVWriter.DEFAULT_SEPARATOR,
                        CSVWriter.DEFAULT_QUOTE_CHARACTER,
                        CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                        CSVWriter.DEFAULT_LINE_END);
                writers.put(b, writer);
                writer.writeNext(CrashRecord.COLUMNS, false);
                counts.put(b, 0);
            }
            String[] line;
            int lineNum = 1;
            while ((line = csvReader.readNext()) != null) {
                lineNum++;
                if (line.length == 1 && line[0].isBlank()) {
                    continue;
                }
                // Reject rows the workers would refuse to load.
                CrashRecord record = CrashRecord.fromCsvRow(line, columnIndex, lineNum);
                writers.get(record.getBorough()).writeNext(project(line, columnIndex, record), false);
                counts.merge(record.getBorough(), 1, Integer::sum);
            }
            for (CSVWriter writer : writers.values()) {
                writer.close();
            }
            writers.clear();
            for (Map.Entry<Borough, Path> e : partialFiles.entrySet()) {
                Files.move(e.getValue(), outputDir.resolve(e.getKey().getShardFileName()),
                        StandardCopyOption.REPLACE_EXISTING);
            }
            complete = true;
        } catch (IOException | CsvValidationException e) {
            throw new IngestionException(String.format("Failed to partition %s: %s", input, e.getMessage()), e);
        } finally {
            for (CSVWriter writer : writers.values()) {
                try {
                    writer.close();
                } catch (IOException e) {
                    logger.warn("Failed to close shard file writer: {}", e.getMessage());
                }
            }
            if (!complete) {
                for (Path partial : partialFiles.values()) {
                    FileUtils.deleteQuietly(partial.toFile());
                }
            }
        }
        counts.forEach((b, n) -> logger.info("Wrote {} rows to {}", n, outputDir.resolve(b.getShardFileName())));
        return counts;
    }

    // Input values in shard column order, with the borough normalized.
    private static String[] project(String[] line, Map<String, Integer> columnIndex, CrashRecord record) {
        String[] out = new String[CrashRecord.COLUMNS.length];
        for (int i = 0; i < CrashRecord.COLUMNS.length; i++) {
            Integer j = columnIndex.get(CrashRecord.COLUMNS[i]);
            if (CrashRecord.COLUMNS[i].equals(CrashRecord.BOROUGH)) {
                out[i] = record.getRawBorough();
            } else {
                out[i] = (j == null || j >= line.length || line[j] == null) ? "" : line[j].trim();
            }
        }
        return out;
    }
}
