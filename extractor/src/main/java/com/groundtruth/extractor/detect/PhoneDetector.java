package com.groundtruth.extractor.detect;

import com.groundtruth.core.EntityClass;
import com.groundtruth.core.EvidenceRecord;
import com.groundtruth.extractor.config.DetectionConfig;
import com.groundtruth.extractor.introspect.ColumnInfo;
import com.groundtruth.extractor.introspect.TypeClass;
import com.groundtruth.extractor.scan.Cell;

import java.util.List;
import java.util.Optional;

/**
 * Treats the whole cell as one candidate number: the cell is reduced to its digits and kept
 * when the digit count is in range, so cells without digits never match.
 *
 * This is a wide net. Long numeric identifiers and formatted dates inside text also pass.
 */
public class PhoneDetector implements Detector {
    private final int minDigits;
    private final int maxDigits;

    public PhoneDetector(DetectionConfig config) {
        this.minDigits = config.minPhoneDigits();
        this.maxDigits = config.maxPhoneDigits();
    }

    @Override
    public String subtype() {
        return "Phone";
    }

    @Override
    public EntityClass entityClass() {
        return EntityClass.IDENTIFIER;
    }

    @Override
    public boolean appliesTo(ColumnInfo column) {
        return column.typeClass() == TypeClass.TEXT || column.hints().phone();
    }

    @Override
    public List<EvidenceRecord> detect(String table, ColumnInfo column, Cell cell) {
        return normalize(cell.text())
                .map(phone -> List.of(EvidenceRecord.identifier(subtype(), phone, table, column.columnName(), cell.rowId())))
                .orElse(List.of());
    }

    /**
     * {@code "+"} followed by the digits of {@code text}, or empty when the digit count is
     * outside the configured range.
     */
    public Optional<String> normalize(String text) {
        if (text == null) {
            return Optional.empty();
        }
        StringBuilder digits = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        if (digits.length() < minDigits || digits.length() > maxDigits) {
            return Optional.empty();
        }
        return Optional.of("+" + digits);
    }
}
