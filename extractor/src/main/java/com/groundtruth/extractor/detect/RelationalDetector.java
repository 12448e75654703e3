package com.groundtruth.extractor.detect;

import com.groundtruth.core.EvidenceRecord;
import com.groundtruth.extractor.config.DetectionConfig;
import com.groundtruth.extractor.introspect.ColumnInfo;
import com.groundtruth.extractor.introspect.TableInfo;
import com.groundtruth.extractor.scan.RowStreamer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Finds sender/recipient style links inside a single table by column naming alone.
 * Declared foreign keys are never consulted.
 *
 * Every ordered pair of link-named columns is scored by how strongly its first column
 * reads as a source and its second as a target. Pairs with no vocabulary support in
 * either position are dropped, and only the best {@code maxRelationalPairs} are scanned.
 */
public class RelationalDetector {
    private static final Logger logger = LoggerFactory.getLogger(RelationalDetector.class);

    private final List<String> sourceRanks;
    private final List<String> targetRanks;
    private final int maxPairs;

    public RelationalDetector(DetectionConfig config) {
        this.sourceRanks = config.linkSourceRanks();
        this.targetRanks = config.linkTargetRanks();
        this.maxPairs = config.maxRelationalPairs();
    }

    public List<LinkPair> selectPairs(List<ColumnInfo> columns) {
        List<String> linkColumns = columns.stream()
                .filter(c -> c.hints().link())
                .map(ColumnInfo::columnName)
                .toList();
        if (linkColumns.size() < 2) {
            return List.of();
        }

        List<LinkPair> pairs = new ArrayList<>();
        for (String source : linkColumns) {
            for (String target : linkColumns) {
                if (source.equals(target)) {
                    continue;
                }
                int score = rank(source, sourceRanks) + rank(target, targetRanks);
                if (score > 0) {
                    pairs.add(new LinkPair(source, target, score));
                }
            }
        }
        // List.sort is stable, so equal scores keep column order
        pairs.sort(Comparator.comparingInt(LinkPair::score).reversed());
        return pairs.size() > maxPairs ? List.copyOf(pairs.subList(0, maxPairs)) : pairs;
    }

    public List<EvidenceRecord> detect(TableInfo table, RowStreamer streamer, Integer limit) {
        List<EvidenceRecord> records = new ArrayList<>();
        for (LinkPair pair : selectPairs(table.columns())) {
            logger.debug("Scanning {} for links {} (score {})", table.name(), pair.subtype(), pair.score());
            streamer.forEachPair(table, pair.source(), pair.target(), limit, row ->
                    records.add(EvidenceRecord.relational(
                            pair.subtype(),
                            row.firstText() + "->" + row.secondText(),
                            table.name(),
                            pair.columns(),
                            row.rowId())));
        }
        return records;
    }

    /**
     * {@code size - index} of the first keyword contained in the name, 0 when none is.
     */
    static int rank(String column, List<String> keywords) {
        String name = column.toLowerCase(Locale.ROOT);
        for (int i = 0; i < keywords.size(); i++) {
            if (name.contains(keywords.get(i))) {
                return keywords.size() - i;
            }
        }
        return 0;
    }
}
