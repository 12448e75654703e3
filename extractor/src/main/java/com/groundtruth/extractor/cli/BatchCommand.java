package com.groundtruth.extractor.cli;

import com.groundtruth.core.io.RecordFormat;
import com.groundtruth.core.io.RecordWriter;
import com.groundtruth.extractor.BatchExtractor;
import com.groundtruth.extractor.BatchResult;
import com.groundtruth.extractor.DatabaseFinder;
import com.groundtruth.extractor.DatabaseOutcome;
import com.groundtruth.extractor.EvidenceExtractor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "batch",
        description = "Extract ground truth from every SQLite database under a file or directory",
        mixinStandardHelpOptions = true
)
public class BatchCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "A database file or a directory containing databases")
    private File input;

    @Option(names = {"--outdir"}, defaultValue = "gt_out", description = "Directory to write outputs (default: gt_out)")
    private File outdir;

    @Option(names = {"--fmt"}, defaultValue = "json", description = "Output format per database: json or csv")
    private String format;

    @Mixin
    private EngineOptions engine;

    @Override
    public Integer call() {
        PrintWriter stdout = spec.commandLine().getOut();
        PrintWriter stderr = spec.commandLine().getErr();
        try {
            RecordFormat recordFormat = RecordFormat.parse(format);
            Path root = input.toPath().toAbsolutePath().normalize();
            Path outputDir = outdir.toPath().toAbsolutePath().normalize();

            List<Path> databases = DatabaseFinder.find(root);
            if (databases.isEmpty()) {
                stderr.println("No SQLite databases found.");
                return 2;
            }
            stdout.println("Found " + databases.size() + " database(s). Writing outputs to " + outputDir);

            BatchExtractor batch = new BatchExtractor(new EvidenceExtractor(engine.detectionConfig()), new RecordWriter());
            BatchResult result = batch.run(root, databases, outputDir, recordFormat, engine.request());

            for (DatabaseOutcome outcome : result.outcomes()) {
                if (outcome.succeeded()) {
                    stdout.println("[OK] " + outcome.database() + " -> " + outcome.output()
                            + " (" + outcome.result().records().size() + " records)");
                    Summaries.print(stdout, outcome.result());
                } else {
                    stderr.println("[ERROR] " + outcome.database() + ": " + outcome.error());
                }
            }
            stdout.println("Done. Success: " + result.successes() + ", Failures: " + result.failures()
                    + ", Out dir: " + outputDir);
            return result.failures() > 0 ? 1 : 0;
        } catch (IllegalArgumentException e) {
            stderr.println("Error: " + e.getMessage());
            return 2;
        } catch (IOException e) {
            stderr.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
