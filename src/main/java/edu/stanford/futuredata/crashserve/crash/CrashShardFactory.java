package edu.stanford.futuredata.crashserve.crash;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import edu.stanford.futuredata.crashserve.ingest.IngestionException;
import edu.stanford.futuredata.crashserve.interfaces.ShardFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class CrashShardFactory implements ShardFactory<CrashRecord, CrashShard> {

    private static final Logger logger = LoggerFactory.getLogger(CrashShardFactory.class);

    @Override
    public CrashShard createShardFromFile(Path shardPath, int shardNum) throws IngestionException {
        Borough borough;
        try {
            borough = Borough.fromShardNum(shardNum);
        } catch (IllegalArgumentException e) {
            throw new IngestionException(e.getMessage(), e);
        }
        if (!Files.isRegularFile(shardPath)) {
            throw new IngestionException(String.format("Shard file %s for %s does not exist", shardPath, borough));
        }
        List<CrashRecord> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(shardPath, StandardCharsets.UTF_8);
             CSVReader csvReader = new CSVReader(reader)) {
            String[] header = csvReader.readNext();
            if (header == null) {
                throw new IngestionException(String.format("Shard file %s is empty", shardPath));
            }
            Map<String, Integer> columnIndex = CrashRecord.indexHeader(header);
            for (String column : CrashRecord.COLUMNS) {
                if (!columnIndex.containsKey(column)) {
                    throw new IngestionException(String.format("Shard file %s is missing column %s", shardPath, column));
                }
            }
            String[] line;
            int lineNum = 1;
            while ((line = csvReader.readNext()) != null) {
                lineNum++;
                if (line.length == 1 && line[0].isBlank()) {
                    continue;
                }
                CrashRecord record = CrashRecord.fromCsvRow(line, columnIndex, lineNum);
                if (record.getBorough() != borough) {
                    throw new IngestionException(String.format("%s line %d: borough '%s' does not belong to shard %s",
                            shardPath, lineNum, record.getRawBorough(), borough));
                }
                rows.add(record);
            }
        } catch (IOException | CsvValidationException e) {
            throw new IngestionException(String.format("Failed to read shard file %s: %s", shardPath, e.getMessage()), e);
        }
        logger.info("Loaded shard {} from {}: {} records", borough, shardPath, rows.size());
        return new CrashShard(borough, rows);
    }
}
