package com.groundtruth.extractor.detect;

import com.groundtruth.core.EntityClass;
import com.groundtruth.core.EvidenceRecord;
import com.groundtruth.extractor.config.DetectionConfig;
import com.groundtruth.extractor.introspect.ColumnInfo;
import com.groundtruth.extractor.introspect.TypeClass;
import com.groundtruth.extractor.scan.Cell;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Reports text cells containing an ISO-8601 date or date-time. The cell is reported as
 * stored, not reformatted.
 */
public class Iso8601Detector implements Detector {
    private final Pattern pattern;

    public Iso8601Detector(DetectionConfig config) {
        this.pattern = config.iso8601();
    }

    @Override
    public String subtype() {
        return "ISO8601";
    }

    @Override
    public EntityClass entityClass() {
        return EntityClass.TEMPORAL;
    }

    @Override
    public boolean appliesTo(ColumnInfo column) {
        return column.typeClass() == TypeClass.TEXT || column.hints().time();
    }

    @Override
    public List<EvidenceRecord> detect(String table, ColumnInfo column, Cell cell) {
        String text = cell.text();
        if (!pattern.matcher(text).find()) {
            return List.of();
        }
        return List.of(EvidenceRecord.temporal(subtype(), text, null, table, column.columnName(), cell.rowId()));
    }
}
