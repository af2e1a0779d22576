package io.chimera.cli;

import io.chimera.core.session.InjectedMemoryLink;
import java.util.concurrent.Callable;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "inject", description = "Attach a memory to a conversation, or toggle and remove an attachment")
public final class InjectCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Conversation id")
    String conversationId;

    @Parameters(index = "1", arity = "1", description = "Memory id")
    String memoryId;

    @ArgGroup(exclusive = true)
    Action action;

    static final class Action {
        @Option(names = "--deactivate", description = "Keep the link but stop injecting the memory")
        boolean deactivate;

        @Option(names = "--remove", description = "Delete the link")
        boolean remove;
    }

    public InjectCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (action != null && action.remove) {
                boolean removed = context.conversationStore().remove(conversationId, memoryId);
                System.out.println(removed ? "Removed " + memoryId : "No link for " + memoryId);
                return removed ? 0 : 1;
            }
            if (action != null && action.deactivate) {
                boolean updated = context.conversationStore().setActive(conversationId, memoryId, false);
                System.out.println(updated ? "Deactivated " + memoryId : "No link for " + memoryId);
                return updated ? 0 : 1;
            }
            InjectedMemoryLink link = context.conversationStore().inject(conversationId, memoryId);
            System.out.println("Injected " + link.memoryId() + " into " + link.conversationId());
            return 0;
        } catch (Exception e) {
            System.err.println("Inject command failed: " + e.getMessage());
            return 1;
        }
    }
}
