package com.strategist.dispatch.cli;

import com.strategist.core.model.ResourceConflict;
import com.strategist.core.model.ResourceUtilization;
import picocli.CommandLine;

import java.util.List;
import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Strategist CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) STRATEGIST v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [STRATEGIST]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void heading(String title) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + title + "|@"));
    }

    public static void path(String label, List<String> ids) {
        System.out.println("  " + label + ": " + (ids.isEmpty() ? "(none)" : String.join(" -> ", ids)));
    }

    public static void utilization(ResourceUtilization u) {
        String color = switch (u.efficiency()) {
            case OPTIMAL, GOOD -> "fg(green)";
            case UNDER_UTILIZED -> "fg(yellow)";
            case OVER_UTILIZED -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                String.format(Locale.ROOT, "  %-22s @|%s %s|@", u.profile(), color, u.summary())));
    }

    public static void conflict(ResourceConflict c) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red),bold [CONFLICT]|@ " + c.description()));
    }

    public static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.0f%%", ratio * 100);
    }
}
