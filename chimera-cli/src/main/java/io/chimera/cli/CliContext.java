package io.chimera.cli;

import io.chimera.core.config.ConfigService;
import io.chimera.core.engine.ChimeraEngine;
import io.chimera.core.session.ConversationStore;
import java.nio.file.Path;

public record CliContext(
    ChimeraEngine engine,
    ConversationStore conversationStore,
    ConfigService configService,
    Path configPath
) {
}
