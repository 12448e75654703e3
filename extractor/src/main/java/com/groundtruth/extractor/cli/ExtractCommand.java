package com.groundtruth.extractor.cli;

import com.groundtruth.core.io.RecordWriter;
import com.groundtruth.extractor.DatabaseOpenException;
import com.groundtruth.extractor.EvidenceExtractor;
import com.groundtruth.extractor.ExtractionResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
        name = "extract",
        description = "Extract ground truth (value + table + rowid) from one SQLite database",
        mixinStandardHelpOptions = true
)
public class ExtractCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Path to the SQLite database")
    private File database;

    @Option(names = {"--out", "-o"}, defaultValue = "ground_truth.json",
            description = "Output file; .csv writes CSV, anything else JSON (default: ground_truth.json)")
    private File out;

    @Mixin
    private EngineOptions engine;

    @Override
    public Integer call() {
        PrintWriter stdout = spec.commandLine().getOut();
        PrintWriter stderr = spec.commandLine().getErr();
        try {
            EvidenceExtractor extractor = new EvidenceExtractor(engine.detectionConfig());
            ExtractionResult result = extractor.extract(database.toPath(), engine.request());
            new RecordWriter().write(result.records(), out.toPath());

            stdout.println("Wrote " + result.records().size() + " records to " + out.getPath());
            Summaries.print(stdout, result);
            return 0;
        } catch (IllegalArgumentException e) {
            stderr.println("Error: " + e.getMessage());
            return 2;
        } catch (DatabaseOpenException | IOException e) {
            stderr.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
