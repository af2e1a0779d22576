package io.chimera.app;

import io.chimera.cli.ChimeraCliCommand;
import io.chimera.cli.CliContext;
import io.chimera.core.config.ConfigPaths;
import io.chimera.core.config.ConfigService;
import io.chimera.core.config.model.ChimeraConfig;
import io.chimera.core.credential.ConfigCredentialStore;
import io.chimera.core.engine.ChimeraEngine;
import io.chimera.core.memory.FileMemoryStore;
import io.chimera.core.provider.ProviderFactory;
import io.chimera.core.provider.ProviderRegistry;
import io.chimera.core.session.FileConversationStore;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ChimeraApplication {
    private static final Logger LOG = LoggerFactory.getLogger(ChimeraApplication.class);

    private ChimeraApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        ChimeraConfig config = loadConfig(configService, configPath);

        Path workspacePath = ConfigPaths.resolveWorkspace(config.engine().workspace());
        FileMemoryStore memoryStore = new FileMemoryStore(ConfigPaths.memoriesFile(workspacePath));
        FileConversationStore conversationStore = new FileConversationStore(
            ConfigPaths.conversationsFile(workspacePath),
            memoryStore
        );
        ProviderRegistry providerRegistry = ProviderFactory.fromConfig(config.providers());

        ChimeraEngine engine = ChimeraEngine.create(
            config,
            memoryStore,
            conversationStore,
            providerRegistry,
            new ConfigCredentialStore(config.providers())
        );

        CliContext context = new CliContext(engine, conversationStore, configService, configPath);
        int exitCode = ChimeraCliCommand.commandLine(context).execute(args);
        System.exit(exitCode);
    }

    private static ChimeraConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return ChimeraConfig.defaults();
        }
    }
}
