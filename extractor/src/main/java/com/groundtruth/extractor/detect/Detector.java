package com.groundtruth.extractor.detect;

import com.groundtruth.core.EntityClass;
import com.groundtruth.core.EvidenceRecord;
import com.groundtruth.extractor.introspect.ColumnInfo;
import com.groundtruth.extractor.scan.Cell;

import java.util.List;

/**
 * A cell-level evidence detector. Detectors hold no state between calls; the same
 * instance is applied to every cell of every column it {@linkplain #appliesTo applies to}.
 */
public interface Detector {

    /** Subtype written on every record this detector produces. */
    String subtype();

    EntityClass entityClass();

    boolean appliesTo(ColumnInfo column);

    /**
     * Returns zero or more records for the cell. Values that fail normalization produce
     * nothing; they are never an error.
     */
    List<EvidenceRecord> detect(String table, ColumnInfo column, Cell cell);
}
