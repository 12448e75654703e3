package com.groundtruth.core.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.groundtruth.core.EntityClass;
import com.groundtruth.core.EvidenceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads record files written by {@link RecordWriter}, or by older tooling that used
 * capitalized field names ({@code EntityType}, {@code RowID}, ...).
 */
public class RecordReader {
    private static final Logger logger = LoggerFactory.getLogger(RecordReader.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final CsvMapper csvMapper = new CsvMapper();

    public List<EvidenceRecord> read(Path file) throws IOException {
        List<Map<String, Object>> rows = switch (RecordFormat.fromPath(file)) {
            case JSON -> mapper.readValue(file.toFile(), new TypeReference<List<Map<String, Object>>>() {});
            case CSV -> readCsv(file);
        };

        List<EvidenceRecord> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            String entityType = field(row, "entity_type", "EntityType");
            EntityClass entityClass;
            try {
                entityClass = EntityClass.parse(entityType);
            } catch (IllegalArgumentException e) {
                logger.debug("Ignoring row with entity type '{}' in {}", entityType, file);
                continue;
            }
            records.add(new EvidenceRecord(
                    entityClass,
                    field(row, "subtype", "Subtype"),
                    field(row, "value", "Value"),
                    field(row, "table", "Table"),
                    field(row, "rowid", "RowID", "row_id", "pk"),
                    field(row, "column", "Column"),
                    blankToNull(field(row, "raw"))
            ));
        }
        return records;
    }

    private List<Map<String, Object>> readCsv(Path file) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        if (Files.size(file) == 0) {
            return rows;
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, Object>> it = csvMapper
                .readerFor(new TypeReference<Map<String, Object>>() {})
                .with(schema)
                .readValues(file.toFile())) {
            while (it.hasNext()) {
                rows.add(it.next());
            }
        }
        return rows;
    }

    private static String field(Map<String, Object> row, String... names) {
        for (String name : names) {
            Object value = row.get(name);
            if (value == null) {
                continue;
            }
            String text = value.toString().trim();
            if (!text.isEmpty()) {
                return text;
            }
        }
        return "";
    }

    private static String blankToNull(String text) {
        return text.isEmpty() ? null : text;
    }
}
