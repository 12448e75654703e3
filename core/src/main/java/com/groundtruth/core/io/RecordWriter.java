package com.groundtruth.core.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.groundtruth.core.EvidenceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Serializes evidence records as a pretty-printed JSON array, or as CSV whose header is the
 * sorted union of every field name that appears in the records.
 */
public class RecordWriter {
    private static final Logger logger = LoggerFactory.getLogger(RecordWriter.class);
    private static final TypeReference<LinkedHashMap<String, String>> ROW = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final CsvMapper csvMapper;

    public RecordWriter() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.csvMapper = new CsvMapper();
    }

    public void write(List<EvidenceRecord> records, Path out) throws IOException {
        write(records, out, RecordFormat.fromPath(out));
    }

    public void write(List<EvidenceRecord> records, Path out, RecordFormat format) throws IOException {
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        switch (format) {
            case JSON -> mapper.writeValue(out.toFile(), records);
            case CSV -> writeCsv(records, out);
        }
        logger.debug("Wrote {} records to {} as {}", records.size(), out, format);
    }

    public String toJson(List<EvidenceRecord> records) throws IOException {
        return mapper.writeValueAsString(records);
    }

    private void writeCsv(List<EvidenceRecord> records, Path out) throws IOException {
        if (records.isEmpty()) {
            Files.writeString(out, "", StandardCharsets.UTF_8);
            return;
        }

        List<Map<String, String>> rows = new ArrayList<>(records.size());
        SortedSet<String> fields = new TreeSet<>();
        for (EvidenceRecord record : records) {
            Map<String, String> row = mapper.convertValue(record, ROW);
            fields.addAll(row.keySet());
            rows.add(row);
        }

        CsvSchema.Builder schema = CsvSchema.builder();
        fields.forEach(schema::addColumn);

        try (Writer writer = Files.newBufferedWriter(out, StandardCharsets.UTF_8);
             SequenceWriter sequence = csvMapper.writer(schema.build().withHeader()).writeValues(writer)) {
            for (Map<String, String> row : rows) {
                Map<String, String> aligned = new LinkedHashMap<>();
                for (String field : fields) {
                    aligned.put(field, row.getOrDefault(field, ""));
                }
                sequence.write(aligned);
            }
        }
    }
}
