package io.chimera.cli;

import io.chimera.core.provider.ConnectionCheck;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "verify", description = "Check provider credentials against the provider APIs")
public final class VerifyCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(arity = "0..*", description = "Provider tags to check; all registered providers when omitted")
    List<String> providers;

    @Option(names = {"-a", "--account"}, defaultValue = "local", description = "Account whose credentials are checked")
    String account;

    public VerifyCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<String> targets = providers == null || providers.isEmpty() ? context.engine().providers() : providers;
            boolean allConnected = true;
            for (String provider : targets) {
                ConnectionCheck check = context.engine().verifyProvider(account, provider);
                if (check.connected()) {
                    System.out.println(check.provider() + ": connected");
                } else {
                    allConnected = false;
                    System.out.println(check.provider() + ": " + check.message() + " (" + check.errorKind() + ")");
                }
            }
            return allConnected ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Verify command failed: " + e.getMessage());
            return 1;
        }
    }
}
