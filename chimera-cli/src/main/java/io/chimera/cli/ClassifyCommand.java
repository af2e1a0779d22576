package io.chimera.cli;

import io.chimera.core.extract.Classification;
import io.chimera.core.extract.ExtractionCandidate;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "classify", description = "Show how a message would be classified for memory capture")
public final class ClassifyCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Message text")
    String text;

    public ClassifyCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Classification classification = context.engine().classify(text);
            System.out.println("Importance: " + classification.importance().label());
            System.out.println(String.format(Locale.ROOT, "Score: %.2f", classification.score()));
            System.out.println("Persist: " + classification.shouldPersist());
            System.out.println("Tags: " + String.join(", ", classification.tags()));
            for (ExtractionCandidate candidate : classification.candidates()) {
                System.out.println("Fact [" + candidate.provenance().extractionType() + ", "
                    + candidate.confidence().name().toLowerCase(Locale.ROOT) + "]: " + candidate.text());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Classify command failed: " + e.getMessage());
            return 1;
        }
    }
}
