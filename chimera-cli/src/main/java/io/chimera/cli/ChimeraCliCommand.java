package io.chimera.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(name = "chimera", mixinStandardHelpOptions = true, description = "Chimera memory and model routing engine")
public final class ChimeraCliCommand implements Runnable {

    public static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new ChimeraCliCommand());
        commandLine.addSubcommand("search", new SearchCommand(context));
        commandLine.addSubcommand("classify", new ClassifyCommand(context));
        commandLine.addSubcommand("resolve", new ResolveCommand(context));
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.addSubcommand("inject", new InjectCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("models", new ModelsCommand(context));
        commandLine.addSubcommand("verify", new VerifyCommand(context));
        return commandLine;
    }

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
