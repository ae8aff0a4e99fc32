package com.strategist.dispatch.cli;

import com.strategist.core.config.PhaseTemplateRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: strategist templates
 * <p>
 * Shows which phase template each domain maps to and the phases of every template.
 */
@Command(name = "templates", mixinStandardHelpOptions = true, description = "List domain to phase template mapping")
@Component
public class TemplatesCommand implements Runnable {

    private final PhaseTemplateRegistry registry;

    public TemplatesCommand(PhaseTemplateRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.heading("DOMAINS");
        registry.domainMapping().forEach((domain, template) ->
                System.out.printf("  %-14s -> %s%n", domain, template));
        System.out.printf("  %-14s -> %s%n", "(other)", PhaseTemplateRegistry.DEFAULT_TEMPLATE);

        ConsoleOutput.heading("TEMPLATES");
        registry.templates().forEach((name, template) -> {
            System.out.printf("  %-14s %s%n", name, template.description() == null ? "" : template.description());
            template.phases().forEach(p -> System.out.printf("    - %-16s %s%n", p.id(), p.name()));
        });
    }
}
