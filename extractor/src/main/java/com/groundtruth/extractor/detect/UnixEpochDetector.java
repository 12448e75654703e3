package com.groundtruth.extractor.detect;

import com.groundtruth.core.EntityClass;
import com.groundtruth.core.EvidenceRecord;
import com.groundtruth.extractor.config.DetectionConfig;
import com.groundtruth.extractor.introspect.ColumnInfo;
import com.groundtruth.extractor.introspect.TypeClass;
import com.groundtruth.extractor.scan.Cell;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reads integers as Unix epoch instants. Magnitudes above the millisecond threshold are
 * taken as milliseconds; the resulting instant must fall strictly inside the configured
 * window or the value is dropped, whatever the column is called.
 */
public class UnixEpochDetector implements Detector {
    private final long millisThreshold;
    private final long lowerBound;
    private final long upperBound;

    public UnixEpochDetector(DetectionConfig config) {
        this.millisThreshold = config.epochMillisThreshold();
        this.lowerBound = config.epochLowerBound();
        this.upperBound = config.epochUpperBound();
    }

    @Override
    public String subtype() {
        return "UnixEpoch";
    }

    @Override
    public EntityClass entityClass() {
        return EntityClass.TEMPORAL;
    }

    @Override
    public boolean appliesTo(ColumnInfo column) {
        return column.typeClass() == TypeClass.INTEGER
                || column.typeClass() == TypeClass.REAL
                || column.hints().time();
    }

    @Override
    public List<EvidenceRecord> detect(String table, ColumnInfo column, Cell cell) {
        return toInstant(cell.value())
                .map(instant -> List.of(EvidenceRecord.temporal(
                        subtype(), instant.toString(), cell.text(), table, column.columnName(), cell.rowId())))
                .orElse(List.of());
    }

    public Optional<Instant> toInstant(Object value) {
        return asLong(value).flatMap(this::fromEpoch);
    }

    /**
     * Instant for an epoch count in seconds, or in milliseconds above the threshold.
     */
    public Optional<Instant> fromEpoch(long value) {
        if (value > millisThreshold || value < -millisThreshold) {
            double seconds = value / 1000.0;
            if (seconds > lowerBound && seconds < upperBound) {
                return Optional.of(Instant.ofEpochMilli(value));
            }
            return Optional.empty();
        }
        if (value > lowerBound && value < upperBound) {
            return Optional.of(Instant.ofEpochSecond(value));
        }
        return Optional.empty();
    }

    private static Optional<Long> asLong(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? Optional.of((long) d) : Optional.empty();
        }
        if (value instanceof Number n) {
            return Optional.of(n.longValue());
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Long.parseLong(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
