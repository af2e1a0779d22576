package io.chimera.cli;

import io.chimera.core.config.ConfigPaths;
import io.chimera.core.config.model.ChimeraConfig;
import io.chimera.core.config.model.ProviderConfig;
import java.nio.file.Files;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ChimeraConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Workspace: " + ConfigPaths.resolveWorkspace(config.engine().workspace()));
            System.out.println("Default model: " + config.engine().defaultModel());
            for (Map.Entry<String, ProviderConfig> entry : config.providers().byTag().entrySet()) {
                String name = entry.getKey().substring(0, 1).toUpperCase(Locale.ROOT) + entry.getKey().substring(1);
                System.out.println(name + " configured: " + entry.getValue().configured());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
