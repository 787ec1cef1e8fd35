package com.spotladder.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed command line: one command, shared flags, and any positional arguments after the command.
 *
 * <pre>
 *   [command] [--symbol S] [--amount N] [--order-file PATH] [--dry-run] [--profile P] [args...]
 * </pre>
 */
public final class CliOptions {

    static final Set<String> COMMANDS = Set.of("menu", "auto", "sync", "cancel", "orders", "validate-config", "help");

    private final String command;
    private final String symbol;
    private final String amount;
    private final String orderFile;
    private final boolean dryRun;
    private final String profile;
    private final List<String> positional;

    private CliOptions(String command, String symbol, String amount, String orderFile,
                       boolean dryRun, String profile, List<String> positional) {
        this.command = command;
        this.symbol = symbol;
        this.amount = amount;
        this.orderFile = orderFile;
        this.dryRun = dryRun;
        this.profile = profile;
        this.positional = List.copyOf(positional);
    }

    /**
     * @throws IllegalArgumentException on an unknown command or flag, or a flag missing its value
     */
    public static CliOptions parse(String[] args) {
        String command = null;
        String symbol = null;
        String amount = null;
        String orderFile = null;
        boolean dryRun = false;
        String profile = null;
        List<String> positional = new ArrayList<>();

        int i = 0;
        while (i < args.length) {
            String t = args[i] == null ? "" : args[i].trim();
            if (t.isEmpty()) {
                i++;
                continue;
            }

            switch (t.toLowerCase(Locale.ROOT)) {
                case "--symbol" -> {
                    symbol = value(args, i, t);
                    i += 2;
                }
                case "--amount" -> {
                    amount = value(args, i, t);
                    i += 2;
                }
                case "--order-file" -> {
                    orderFile = value(args, i, t);
                    i += 2;
                }
                case "--profile" -> {
                    profile = value(args, i, t);
                    i += 2;
                }
                case "--dry-run" -> {
                    dryRun = true;
                    i++;
                }
                case "--auto" -> {
                    command = setCommand(command, "auto");
                    i++;
                }
                case "--help", "-h" -> {
                    command = setCommand(command, "help");
                    i++;
                }
                default -> {
                    if (t.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + t);
                    }
                    if (command == null) {
                        String c = t.toLowerCase(Locale.ROOT);
                        if (!COMMANDS.contains(c)) throw new IllegalArgumentException("Unknown command: " + t);
                        command = c;
                    } else {
                        positional.add(t);
                    }
                    i++;
                }
            }
        }
        return new CliOptions(command == null ? "menu" : command, symbol, amount, orderFile, dryRun, profile, positional);
    }

    private static String value(String[] args, int i, String flag) {
        if (i + 1 >= args.length || args[i + 1] == null || args[i + 1].isBlank() || args[i + 1].startsWith("--")) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[i + 1].trim();
    }

    private static String setCommand(String current, String next) {
        if (current != null && !current.equals(next)) {
            throw new IllegalArgumentException("Conflicting commands: " + current + " and " + next);
        }
        return next;
    }

    public String command() { return command; }
    public String symbol() { return symbol; }
    public String amount() { return amount; }
    public String orderFile() { return orderFile; }
    public boolean dryRun() { return dryRun; }
    public String profile() { return profile; }
    public List<String> positional() { return positional; }
}
