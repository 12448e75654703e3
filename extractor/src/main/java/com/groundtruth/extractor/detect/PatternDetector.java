package com.groundtruth.extractor.detect;

import com.groundtruth.core.EntityClass;
import com.groundtruth.core.EvidenceRecord;
import com.groundtruth.extractor.introspect.ColumnInfo;
import com.groundtruth.extractor.introspect.TypeClass;
import com.groundtruth.extractor.scan.Cell;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reports every match of a regular expression in the cell text as an identifier.
 */
public abstract class PatternDetector implements Detector {
    private final String subtype;
    private final Pattern pattern;

    protected PatternDetector(String subtype, Pattern pattern) {
        this.subtype = subtype;
        this.pattern = pattern;
    }

    @Override
    public String subtype() {
        return subtype;
    }

    @Override
    public EntityClass entityClass() {
        return EntityClass.IDENTIFIER;
    }

    @Override
    public boolean appliesTo(ColumnInfo column) {
        return column.typeClass() == TypeClass.TEXT;
    }

    @Override
    public List<EvidenceRecord> detect(String table, ColumnInfo column, Cell cell) {
        List<EvidenceRecord> records = new ArrayList<>();
        Matcher m = pattern.matcher(cell.text());
        while (m.find()) {
            records.add(EvidenceRecord.identifier(subtype, normalize(m.group()), table, column.columnName(), cell.rowId()));
        }
        return records;
    }

    protected String normalize(String match) {
        return match;
    }
}
