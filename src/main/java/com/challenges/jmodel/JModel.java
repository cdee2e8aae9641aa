package com.challenges.jmodel;

import com.challenges.jmodel.convert.JsonConverter;
import com.challenges.jmodel.json.JsonNode;
import com.challenges.jmodel.json.JsonValidator;
import com.challenges.jmodel.output.JsonStringifier;
import com.challenges.jmodel.sample.Samples;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "jmodel", mixinStandardHelpOptions = true, version = "1.0",
         description = "Convert a sample value to a JSON document and print it")
public class JModel implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(JModel.class);

    static final int INVALID_DOCUMENT = 3;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-s", "--sample"}, defaultValue = "COURSE",
            description = "Sample to print: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Samples sample;

    @Option(names = {"-x", "--exclude"}, description = "Drop this top-level member (repeatable)")
    private List<String> excludedKeys = new ArrayList<>();

    @Option(names = "--validate", description = "Refuse to print documents that fail validation")
    private boolean validate = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JModel()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            JsonNode document = sample.document(new JsonConverter());

            if (!excludedKeys.isEmpty() && document instanceof JsonNode.JsonObject object) {
                MutableSet<String> excluded = Sets.mutable.withAll(excludedKeys);
                document = object.filter((key, value) -> !excluded.contains(key));
            }

            if (validate && !new JsonValidator().validate(document)) {
                spec.commandLine().getErr().println("Error: " + sample + " document failed validation");
                return INVALID_DOCUMENT;
            }

            spec.commandLine().getOut().println(new JsonStringifier().stringify(document));
            return 0;
        } catch (RuntimeException e) {
            LOGGER.debug("Printing {} failed", sample, e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
