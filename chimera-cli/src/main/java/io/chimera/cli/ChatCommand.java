package io.chimera.cli;

import io.chimera.core.config.model.ChimeraConfig;
import io.chimera.core.provider.DispatchResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "chat", description = "Send a message through the full memory and provider pipeline")
public final class ChatCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Message to send")
    String message;

    @Option(names = {"-m", "--model"}, description = "Model identifier override")
    String model;

    @Option(names = {"-c", "--conversation"}, defaultValue = "default", description = "Conversation id")
    String conversationId;

    @Option(names = {"-w", "--workspace"}, defaultValue = "default", description = "Workspace that captured memories belong to")
    String workspace;

    @Option(names = {"-a", "--account"}, defaultValue = "local", description = "Account whose credentials are used")
    String account;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ChimeraConfig config = context.configService().load(context.configPath());
            String modelIdentifier = model != null ? model : config.engine().defaultModel();
            DispatchResult result = context.engine().respond(account, workspace, conversationId, modelIdentifier, message);
            if (!result.succeeded()) {
                System.err.println("Chat failed (" + result.errorKind() + "): " + result.diagnostic());
                return 1;
            }
            System.out.println(result.reply());
            System.out.println();
            System.out.println("[" + result.provider() + " / " + result.canonicalModel() + ", tokens: " + result.tokenUsage() + "]");
            return 0;
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }
}
