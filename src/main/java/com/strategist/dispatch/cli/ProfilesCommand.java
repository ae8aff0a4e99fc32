package com.strategist.dispatch.cli;

import com.strategist.core.config.ResourceProfileRegistry;
import com.strategist.core.model.ResourceProfile;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: strategist profiles
 * <p>
 * Lists the configured resource profiles in declaration order, which is also
 * the order that breaks assignment ties.
 */
@Command(name = "profiles", mixinStandardHelpOptions = true, description = "List resource profiles")
@Component
public class ProfilesCommand implements Runnable {

    private final ResourceProfileRegistry profiles;

    public ProfilesCommand(ResourceProfileRegistry profiles) {
        this.profiles = profiles;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (profiles.isEmpty()) {
            ConsoleOutput.error("No resource profiles configured");
            return;
        }
        System.out.printf("  %-22s %-8s %-9s %-6s %s%n", "PROFILE", "RANGE", "CAPACITY", "TESTS", "SPECIALIZATIONS");
        for (ResourceProfile p : profiles.profiles()) {
            System.out.printf("  %-22s %-8s %-9d %-6s %s%n", p.name(),
                    p.complexityLow() + "-" + p.complexityHigh(), p.maxConcurrentTasks(),
                    p.verificationExpertise() ? "yes" : "no", String.join(", ", p.specializations()));
        }
        System.out.println(ConsoleOutput.RULE);
        ConsoleOutput.info(profiles.size() + " profiles");
    }
}
