package io.chimera.cli;

import io.chimera.core.memory.MemoryScope;
import io.chimera.core.search.ScoredResult;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "search", description = "Rank stored memories against a query")
public final class SearchCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Query text")
    String query;

    @Option(names = {"-k", "--top-k"}, description = "Maximum number of results")
    Integer topK;

    @Option(names = {"-w", "--workspace"}, description = "Only search this workspace")
    String workspace;

    public SearchCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MemoryScope scope = workspace == null ? MemoryScope.all() : MemoryScope.workspace(workspace);
            List<ScoredResult> results = topK == null
                ? context.engine().search(query, scope)
                : context.engine().search(query, scope, topK);
            if (results.isEmpty()) {
                System.out.println("No matching memories");
                return 0;
            }
            for (ScoredResult result : results) {
                System.out.println(String.format(
                    Locale.ROOT,
                    "%.3f  %s  %s",
                    result.score(),
                    result.memory().id(),
                    result.memory().title()
                ));
                System.out.println("       " + result.memory().snippet());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Search command failed: " + e.getMessage());
            return 1;
        }
    }
}
