package com.depintel.cli;

import com.depintel.core.analyzer.Analyzer;
import picocli.CommandLine.Command;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list installed analyzers.
 *
 * <p>Discovers analyzers via Java Service Provider Interface (SPI).
 */
@Command(
    name = "list",
    description = "List installed analyzers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Available Analyzers:");
        System.out.println();

        List<Analyzer> analyzers = ServiceLoader.load(Analyzer.class).stream()
            .map(ServiceLoader.Provider::get)
            .sorted(Comparator.comparing(Analyzer::getType))
            .toList();

        for (Analyzer analyzer : analyzers) {
            System.out.printf("  • %s (ID: %s)%n", analyzer.getDisplayName(), analyzer.getId());
            System.out.printf("    Analysis type: %s%n", analyzer.getType().id());
            System.out.println();
        }

        if (analyzers.isEmpty()) {
            System.out.println("  No analyzers found on the classpath.");
            return 1;
        }
        return 0;
    }
}
