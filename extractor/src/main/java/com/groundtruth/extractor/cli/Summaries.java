package com.groundtruth.extractor.cli;

import com.groundtruth.core.EntityClass;
import com.groundtruth.extractor.ExtractionResult;
import com.groundtruth.extractor.SkippedTable;

import java.io.PrintWriter;
import java.util.Map;

final class Summaries {
    private Summaries() {}

    static void print(PrintWriter out, ExtractionResult result) {
        StringBuilder line = new StringBuilder("  ");
        for (Map.Entry<EntityClass, Integer> entry : result.counts().entrySet()) {
            line.append(entry.getKey().label()).append('=').append(entry.getValue()).append(' ');
        }
        out.println(line.toString().stripTrailing());
        for (SkippedTable skipped : result.skippedTables()) {
            out.println("  skipped table " + skipped.table() + ": " + skipped.reason());
        }
    }
}
