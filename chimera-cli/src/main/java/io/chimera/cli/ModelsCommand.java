package io.chimera.cli;

import io.chimera.core.provider.ProviderModel;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "models", description = "List the models the router knows about")
public final class ModelsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-p", "--provider"}, description = "Only list this provider's models")
    String provider;

    public ModelsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<ProviderModel> models = provider == null ? context.engine().models() : context.engine().models(provider);
            for (ProviderModel model : models) {
                System.out.println(String.format("%-28s %-22s %s", model.publicId(), model.displayName(), model.provider()));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Models command failed: " + e.getMessage());
            return 1;
        }
    }
}
