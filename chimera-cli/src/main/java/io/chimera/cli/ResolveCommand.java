package io.chimera.cli;

import io.chimera.core.provider.ProviderModel;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "resolve", description = "Resolve a model identifier to its provider")
public final class ResolveCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Model identifier, e.g. model-gpt-4o or GPT-4")
    String modelIdentifier;

    public ResolveCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ProviderModel model = context.engine().resolveProvider(modelIdentifier);
            System.out.println("Provider: " + model.provider());
            System.out.println("Model: " + model.canonicalModel());
            System.out.println("Display name: " + model.displayName());
            return 0;
        } catch (Exception e) {
            System.err.println("Resolve command failed: " + e.getMessage());
            return 1;
        }
    }
}
