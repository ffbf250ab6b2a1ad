package com.rally.leaguesync.cli;

import com.rally.leaguesync.model.RunState;
import com.rally.leaguesync.model.RunType;
import com.rally.leaguesync.service.LeagueImportOrchestrator;
import com.rally.leaguesync.service.RunInProgressException;
import com.rally.leaguesync.service.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One-shot import entry point:
 * {@code <players|schedules|matches|stats|full|validate> --league=<KEY>[,<KEY>...] [--env=<profile>] [--no-repair]}.
 * Without a subcommand the application keeps running as a service and this runner does nothing.
 */
@Component
@Order(10)
public class ImportCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(ImportCommandLineRunner.class);

    public static final int EXIT_CLEAN = 0;
    public static final int EXIT_NEEDS_REPAIR = 1;
    public static final int EXIT_FAILED = 2;
    public static final int EXIT_USAGE = 64;

    static final String USAGE = "usage: <players|schedules|matches|stats|full|validate> --league=<KEY>[,<KEY>...] [--env=<profile>] [--no-repair]";

    private static final Map<String, RunType> SUBCOMMANDS = Map.of(
            "players", RunType.PLAYERS,
            "schedules", RunType.SCHEDULES,
            "matches", RunType.MATCHES,
            "stats", RunType.STATS,
            "full", RunType.FULL,
            "validate", RunType.VALIDATE);

    private final LeagueImportOrchestrator orchestrator;
    private int exitCode = EXIT_CLEAN;

    public ImportCommandLineRunner(LeagueImportOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /** True when the arguments name a subcommand, i.e. this is a one-shot run rather than the service. */
    public static boolean isCommandInvocation(String[] args) {
        return subcommand(args) != null;
    }

    /** Value of {@code --env=}, or null. */
    public static String envOption(String[] args) {
        return option(args, "env");
    }

    @Override
    public void run(String... args) {
        String command = subcommand(args);
        if (command == null) return;

        RunType type = SUBCOMMANDS.get(command.toLowerCase(Locale.ROOT));
        String leagues = option(args, "league");
        List<String> keys = leagues == null ? List.of()
                : Arrays.stream(leagues.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
        if (type == null || keys.isEmpty()) {
            log.error("[CLI] {}", type == null ? "Unknown subcommand '" + command + "'" : "--league is required");
            log.error("[CLI] {}", USAGE);
            exitCode = EXIT_USAGE;
            return;
        }
        boolean repair = Arrays.stream(args).noneMatch("--no-repair"::equals);

        List<RunReport> reports;
        try {
            reports = keys.size() == 1
                    ? List.of(orchestrator.run(keys.get(0), type, repair, "cli"))
                    : orchestrator.runAll(keys, type, repair, "cli");
        } catch (RunInProgressException e) {
            log.error("[CLI] {}", e.getMessage());
            exitCode = EXIT_FAILED;
            return;
        }
        for (RunReport r : reports) {
            log.info("[CLI] {} {} -> {}{}", r.getLeagueKey(), type, r.getState(),
                    r.getFailureReason() != null ? " (" + r.getFailureReason() + ")" : "");
        }
        exitCode = exitCodeFor(reports.stream().map(RunReport::getState).toList());
    }

    static int exitCodeFor(List<RunState> states) {
        if (states.isEmpty()) return EXIT_USAGE;
        if (states.stream().anyMatch(s -> s != RunState.CLEAN && s != RunState.NEEDS_REPAIR)) return EXIT_FAILED;
        if (states.contains(RunState.NEEDS_REPAIR)) return EXIT_NEEDS_REPAIR;
        return EXIT_CLEAN;
    }

    @Override
    public int getExitCode() { return exitCode; }

    private static String subcommand(String[] args) {
        if (args == null) return null;
        for (String a : args) {
            if (a != null && !a.isBlank() && !a.startsWith("-")) return a.trim();
        }
        return null;
    }

    private static String option(String[] args, String name) {
        if (args == null) return null;
        String prefix = "--" + name + "=";
        for (String a : args) {
            if (a != null && a.startsWith(prefix)) return a.substring(prefix.length()).trim();
        }
        return null;
    }
}
