package com.example.hostguard.scan;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Collects host facts through a {@link RemoteExecutor}. Every command is
 * read-only; the set run depends on the scan category.
 */
@Slf4j
public class HostInspector {

    static final Set<Integer> COMMON_PORTS = Set.of(22, 80, 443, 3306, 5432, 6379, 8080, 9000, 27017);

    record InspectionCommand(String key, String command, Function<String, Object> parser) {
    }

    private static final List<InspectionCommand> SYSTEM_COMMANDS = List.of(
            new InspectionCommand("os",
                    "(grep PRETTY_NAME /etc/os-release 2>/dev/null | cut -d= -f2 | tr -d '\"') || uname -s",
                    String::trim),
            new InspectionCommand("kernel", "uname -r", String::trim),
            new InspectionCommand("uptime", "uptime -p 2>/dev/null || uptime", String::trim),
            new InspectionCommand("cpu_count", "nproc 2>/dev/null || getconf _NPROCESSORS_ONLN",
                    out -> Integer.parseInt(out.trim())),
            new InspectionCommand("memory_mb", "free -m | awk '/^Mem:/{print $2}'",
                    out -> Long.parseLong(out.trim())),
            new InspectionCommand("hostname_full", "hostname -f 2>/dev/null || hostname", String::trim));

    private static final List<InspectionCommand> SERVICE_COMMANDS = List.of(
            new InspectionCommand("services",
                    "systemctl list-units --type=service --state=running --no-pager --no-legend 2>/dev/null | head -20",
                    HostInspector::parseServices),
            new InspectionCommand("open_ports",
                    "ss -tlnH 2>/dev/null | awk '{print $4}' | grep -oE '[0-9]+$' || true",
                    HostInspector::parseOpenPorts));

    private static final List<InspectionCommand> METRIC_COMMANDS = List.of(
            new InspectionCommand("load_avg", "cut -d' ' -f1-3 /proc/loadavg", String::trim),
            new InspectionCommand("memory_used_percent",
                    "free -m | awk '/^Mem:/{printf \"%.1f\", $3/$2*100}'",
                    out -> Double.parseDouble(out.trim())),
            new InspectionCommand("disk_usage_root", "df -h / | tail -1 | awk '{print $5}'", String::trim));

    private static final List<InspectionCommand> FULL_ONLY_COMMANDS = List.of(
            new InspectionCommand("process_count", "ps aux | wc -l",
                    out -> Integer.parseInt(out.trim())));

    private static final Map<ScanCategory, List<InspectionCommand>> COMMANDS = new EnumMap<>(ScanCategory.class);

    static {
        COMMANDS.put(ScanCategory.BASIC, List.of());
        COMMANDS.put(ScanCategory.SYSTEM, SYSTEM_COMMANDS);
        COMMANDS.put(ScanCategory.SERVICES, SERVICE_COMMANDS);
        COMMANDS.put(ScanCategory.METRICS, METRIC_COMMANDS);
        List<InspectionCommand> full = new ArrayList<>();
        full.addAll(SYSTEM_COMMANDS);
        full.addAll(SERVICE_COMMANDS);
        full.addAll(METRIC_COMMANDS);
        full.addAll(FULL_ONLY_COMMANDS);
        COMMANDS.put(ScanCategory.FULL, List.copyOf(full));
    }

    private final RemoteExecutor executor;
    private final Duration commandTimeout;

    public HostInspector(RemoteExecutor executor, Duration commandTimeout) {
        if (commandTimeout.isZero() || commandTimeout.isNegative()) {
            throw new IllegalArgumentException("commandTimeout must be positive, got " + commandTimeout);
        }
        this.executor = executor;
        this.commandTimeout = commandTimeout;
    }

    /**
     * Run the category's commands against the address.
     *
     * @throws ScanStepException INSPECTION_FAILED on the first command that
     *                           fails, times out or prints unparseable output
     */
    public Map<String, Object> inspect(String address, ScanCategory category) throws ScanStepException {
        Map<String, Object> facts = new LinkedHashMap<>();
        for (InspectionCommand command : commandsFor(category)) {
            CommandResult result;
            try {
                result = executor.execute(address, command.command(), commandTimeout);
            } catch (RemoteExecutionException e) {
                throw new ScanStepException(ScanFailure.INSPECTION_FAILED, e.getMessage(), e);
            }
            if (!result.isSuccess()) {
                String detail = result.stderr() == null || result.stderr().isBlank() ? "" : ": " + result.stderr();
                throw new ScanStepException(ScanFailure.INSPECTION_FAILED, String.format(
                        "Command for %s exited with %d%s", command.key(), result.exitStatus(), detail));
            }
            try {
                facts.put(command.key(), command.parser().apply(result.stdout()));
            } catch (RuntimeException e) {
                throw new ScanStepException(ScanFailure.INSPECTION_FAILED,
                        "Unexpected output for " + command.key() + ": '" + result.stdout() + "'", e);
            }
        }
        log.debug("Inspected {} ({}): {} facts", address, category.getTag(), facts.size());
        return facts;
    }

    static List<InspectionCommand> commandsFor(ScanCategory category) {
        return COMMANDS.get(category);
    }

    static List<String> parseServices(String output) {
        List<String> services = new ArrayList<>();
        for (String line : output.split("\n")) {
            String[] parts = line.trim().split("\\s+");
            if (parts.length == 0 || parts[0].isEmpty()) continue;
            // systemctl may prefix failed units with a bullet
            String unit = parts[0].equals("●") && parts.length > 1 ? parts[1] : parts[0];
            services.add(unit.endsWith(".service") ? unit.substring(0, unit.length() - ".service".length()) : unit);
        }
        return Collections.unmodifiableList(services);
    }

    static List<Integer> parseOpenPorts(String output) {
        Set<Integer> ports = new TreeSet<>();
        Arrays.stream(output.split("\n"))
                .map(String::trim)
                .filter(line -> !line.isEmpty() && line.chars().allMatch(Character::isDigit))
                .map(Integer::parseInt)
                .filter(COMMON_PORTS::contains)
                .forEach(ports::add);
        return List.copyOf(ports);
    }
}
