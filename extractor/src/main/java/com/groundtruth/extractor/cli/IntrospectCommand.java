package com.groundtruth.extractor.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.groundtruth.extractor.DatabaseOpenException;
import com.groundtruth.extractor.SqliteDatabases;
import com.groundtruth.extractor.config.DetectionConfig;
import com.groundtruth.extractor.introspect.SchemaIntrospector;
import com.groundtruth.extractor.introspect.SchemaSnapshot;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

@Command(
        name = "introspect",
        description = "Report tables, column classes, name hints and row identity of a SQLite database",
        mixinStandardHelpOptions = true
)
public class IntrospectCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Path to the SQLite database")
    private File database;

    @Option(names = {"--output", "-o"}, description = "Output file (default: stdout)")
    private File output;

    @Override
    public Integer call() {
        try (Connection conn = SqliteDatabases.openReadOnly(database.toPath())) {
            SchemaSnapshot snapshot = new SchemaIntrospector(DetectionConfig.defaults()).introspect(conn);

            ObjectMapper mapper = new ObjectMapper();
            mapper.enable(SerializationFeature.INDENT_OUTPUT);

            if (output != null) {
                mapper.writeValue(output, snapshot);
                spec.commandLine().getOut().println("Introspection written to " + output.getAbsolutePath());
            } else {
                spec.commandLine().getOut().println(mapper.writeValueAsString(snapshot));
            }
            return 0;
        } catch (DatabaseOpenException | SQLException | IOException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
