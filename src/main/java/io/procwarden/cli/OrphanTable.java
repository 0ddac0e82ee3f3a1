package io.procwarden.cli;

import io.procwarden.detect.Classification;
import io.procwarden.detect.OrphanCandidate;
import io.procwarden.security.SensitiveDataMasker;
import io.procwarden.terminate.KillOutcome;
import io.procwarden.terminate.ReclaimReport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class OrphanTable {
    private static final int COMMAND_WIDTH = 39;

    private OrphanTable() {
    }

    static String formatAge(long ageMs) {
        long seconds = ageMs / 1000L;
        long minutes = seconds / 60L;
        long hours = minutes / 60L;
        if (hours > 0L) {
            return hours + "h " + (minutes % 60L) + "m";
        }
        if (minutes > 0L) {
            return minutes + "m";
        }
        return seconds + "s";
    }

    static String action(ReclaimReport report, long pid) {
        KillOutcome outcome = report.outcome();
        if (outcome.killed().contains(pid)) {
            return outcome.dryRun() ? "would kill" : "killed";
        }
        if (outcome.skipped().contains(pid)) {
            return "skipped";
        }
        return "failed";
    }

    static String render(ReclaimReport report, boolean force) {
        StringBuilder sb = new StringBuilder();
        sb.append("┌───────┬─────────────────────────────────────────┬────────┬────────────┬────────────┐\n");
        sb.append("│  PID  │ Command                                 │  Age   │   Status   │ Action     │\n");
        sb.append("├───────┼─────────────────────────────────────────┼────────┼────────────┼────────────┤\n");
        for (OrphanCandidate candidate : report.candidates()) {
            String command = SensitiveDataMasker.maskCommandLine(candidate.command());
            if (command.length() > COMMAND_WIDTH) {
                command = command.substring(0, COMMAND_WIDTH);
            }
            sb.append(String.format("│ %-5d │ %-39s │ %-6s │ %-10s │ %-10s │%n",
                    candidate.pid(),
                    command,
                    formatAge(candidate.ageMs()),
                    candidate.classification().wireName(),
                    action(report, candidate.pid())));
        }
        sb.append("└───────┴─────────────────────────────────────────┴────────┴────────────┴────────────┘\n");

        KillOutcome outcome = report.outcome();
        sb.append("Summary: ")
                .append(outcome.dryRun() ? "Would kill " : "Killed ")
                .append(outcome.killed().size())
                .append(" orphan(s)");
        if (!outcome.skipped().isEmpty()) {
            sb.append(", skipped ").append(outcome.skipped().size());
        }
        if (!outcome.failed().isEmpty()) {
            sb.append(", failed ").append(outcome.failed().size());
        }
        sb.append('\n');
        for (KillOutcome.KillFailure failure : outcome.failed()) {
            sb.append("  pid ").append(failure.pid()).append(": ").append(failure.error()).append('\n');
        }
        long suspected = report.candidates().stream()
                .filter(c -> c.classification() == Classification.SUSPECTED)
                .count();
        if (suspected > 0 && !force && !outcome.dryRun()) {
            sb.append("Tip: use --force to also kill ").append(suspected).append(" suspected orphan(s)\n");
        }
        return sb.toString();
    }

    static Map<String, Object> toJson(ReclaimReport report) {
        List<Map<String, Object>> orphans = new ArrayList<>();
        for (OrphanCandidate candidate : report.candidates()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("pid", candidate.pid());
            row.put("command", SensitiveDataMasker.maskCommandLine(candidate.command()));
            row.put("age", formatAge(candidate.ageMs()));
            row.put("ageMs", candidate.ageMs());
            row.put("classification", candidate.classification().wireName());
            row.put("reason", candidate.reason());
            row.put("cwd", candidate.workingDir());
            row.put("action", action(report, candidate.pid()));
            orphans.add(row);
        }
        KillOutcome outcome = report.outcome();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("killed", outcome.killed().size());
        summary.put("skipped", outcome.skipped().size());
        summary.put("failed", outcome.failed().size());
        summary.put("dryRun", outcome.dryRun());

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("orphans", orphans);
        out.put("summary", summary);
        out.put("failures", outcome.failed());
        return out;
    }
}
