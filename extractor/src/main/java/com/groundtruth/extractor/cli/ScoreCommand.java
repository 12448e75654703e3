package com.groundtruth.extractor.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.groundtruth.core.EntityClass;
import com.groundtruth.core.io.RecordReader;
import com.groundtruth.core.scoring.FindingsReader;
import com.groundtruth.core.scoring.ProvenanceTriple;
import com.groundtruth.core.scoring.Score;
import com.groundtruth.core.scoring.Scorer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(
        name = "score",
        description = "Score agent findings against a ground truth file by (value, table, rowid)",
        mixinStandardHelpOptions = true
)
public class ScoreCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"--gold", "-g"}, required = true, description = "Ground truth file (.json or .csv)")
    private File gold;

    @Option(names = {"--findings", "-f"}, required = true, description = "Agent findings JSON")
    private File findings;

    @Option(names = {"--entity"}, required = true, description = "identifier, temporal or relational")
    private String entity;

    @Override
    public Integer call() {
        try {
            EntityClass entityClass = EntityClass.parse(entity);
            Set<ProvenanceTriple> goldSet = Scorer.goldTriples(new RecordReader().read(gold.toPath()), entityClass);
            List<ProvenanceTriple> predicted = new FindingsReader().read(findings.toPath());
            Score score = Scorer.score(predicted, goldSet);

            ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
            spec.commandLine().getOut().println(mapper.writeValueAsString(score));
            return 0;
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 2;
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
