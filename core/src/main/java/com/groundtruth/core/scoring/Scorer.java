package com.groundtruth.core.scoring;

import com.groundtruth.core.EntityClass;
import com.groundtruth.core.EvidenceRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Scores agent findings against extracted gold records by set intersection on
 * (value, table, rowid). Findings with a blank coordinate are ignored on both sides.
 */
public final class Scorer {
    private Scorer() {}

    public static Set<ProvenanceTriple> goldTriples(List<EvidenceRecord> records, EntityClass entityClass) {
        Set<ProvenanceTriple> gold = new HashSet<>();
        for (EvidenceRecord record : records) {
            if (record.entityType() != entityClass) {
                continue;
            }
            ProvenanceTriple triple = ProvenanceTriple.of(record.value(), record.table(), record.rowId());
            if (triple.isComplete()) {
                gold.add(triple);
            }
        }
        return gold;
    }

    public static Score score(Collection<ProvenanceTriple> findings, Set<ProvenanceTriple> gold) {
        Set<ProvenanceTriple> predicted = new HashSet<>();
        for (ProvenanceTriple finding : findings) {
            if (finding.isComplete()) {
                predicted.add(finding);
            }
        }

        int tp = (int) predicted.stream().filter(gold::contains).count();
        int fp = predicted.size() - tp;
        int fn = (int) gold.stream().filter(g -> !predicted.contains(g)).count();

        return new Score(
                tp, fp, fn,
                predicted.size(), gold.size(),
                ratio(tp, tp + fp),
                ratio(tp, tp + fn),
                ratio(fp, predicted.size()),
                ratio(tp, predicted.size())
        );
    }

    private static double ratio(int numerator, int denominator) {
        if (denominator <= 0) {
            return 0.0;
        }
        return BigDecimal.valueOf((double) numerator / denominator)
                .setScale(4, RoundingMode.HALF_EVEN)
                .doubleValue();
    }
}
