package com.groundtruth.extractor;

import com.groundtruth.extractor.cli.BatchCommand;
import com.groundtruth.extractor.cli.ExtractCommand;
import com.groundtruth.extractor.cli.IntrospectCommand;
import com.groundtruth.extractor.cli.ScoreCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "groundtruth",
        description = "Extract provenance-tagged forensic evidence from SQLite databases",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                ExtractCommand.class,
                BatchCommand.class,
                IntrospectCommand.class,
                ScoreCommand.class
        }
)
public class GroundTruthCli implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GroundTruthCli()).execute(args);
        System.exit(exitCode);
    }
}
