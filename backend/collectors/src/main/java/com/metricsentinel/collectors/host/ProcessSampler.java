package com.metricsentinel.collectors.host;

import com.metricsentinel.core.model.ProcessStats;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Ranks processes by CPU share since the previous sample. On the first sample a process's lifetime average is used.
 * Memory share is resident set size over physical memory, read from {@code <procRoot>/<pid>/status}; it is 0 where
 * that file is missing or unreadable.
 */
final class ProcessSampler {
    private static final Logger LOGGER = Logger.getLogger(ProcessSampler.class.getName());
    private static final String RESIDENT_PREFIX = "VmRSS:";

    private final int processors;
    private final int limit;
    private final long totalMemoryBytes;
    private final Path procRoot;
    private Map<Long, Duration> previousCpu = Map.of();
    private Instant previousSampleAt;

    ProcessSampler(int processors, int limit, long totalMemoryBytes, Path procRoot) {
        this.processors = Math.max(1, processors);
        this.limit = limit;
        this.totalMemoryBytes = totalMemoryBytes;
        this.procRoot = procRoot;
    }

    synchronized List<ProcessStats> top(Instant now) {
        Map<Long, Duration> currentCpu = new HashMap<>();
        List<Ranked> ranked = new ArrayList<>();
        try (Stream<ProcessHandle> processes = ProcessHandle.allProcesses()) {
            processes.forEach(handle -> {
                ProcessHandle.Info info = handle.info();
                Optional<Duration> cpu = info.totalCpuDuration();
                if (cpu.isEmpty()) {
                    return;
                }
                currentCpu.put(handle.pid(), cpu.get());
                double percent = cpuPercent(handle.pid(), cpu.get(), info.startInstant().orElse(null), now);
                ranked.add(new Ranked(handle.pid(), commandName(info), percent));
            });
        }
        previousCpu = currentCpu;
        previousSampleAt = now;
        // memory is only read for the rows that are reported
        return ranked.stream()
                .sorted(Comparator.comparingDouble(Ranked::cpuPercent).reversed())
                .limit(limit)
                .map(row -> new ProcessStats(row.pid(), row.name(), row.cpuPercent(), memoryPercent(row.pid())))
                .toList();
    }

    double memoryPercent(long pid) {
        if (totalMemoryBytes <= 0) {
            return 0.0;
        }
        try {
            OptionalLong residentKb = parseResidentKilobytes(
                    Files.readAllLines(procRoot.resolve(Long.toString(pid)).resolve("status"), StandardCharsets.UTF_8));
            return residentKb.isPresent() ? residentKb.getAsLong() * 1024 * 100.0 / totalMemoryBytes : 0.0;
        } catch (IOException e) {
            LOGGER.fine(() -> "No resident size for pid " + pid + ": " + e.getMessage());
            return 0.0;
        }
    }

    static OptionalLong parseResidentKilobytes(List<String> statusLines) {
        for (String line : statusLines) {
            if (!line.startsWith(RESIDENT_PREFIX)) {
                continue;
            }
            String[] fields = line.substring(RESIDENT_PREFIX.length()).trim().split("\\s+");
            try {
                return OptionalLong.of(Long.parseLong(fields[0]));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    private double cpuPercent(long pid, Duration cpu, Instant startedAt, Instant now) {
        Duration previous = previousCpu.get(pid);
        Duration used;
        Duration window;
        if (previous != null && previousSampleAt != null) {
            used = cpu.minus(previous);
            window = Duration.between(previousSampleAt, now);
        } else if (startedAt != null) {
            used = cpu;
            window = Duration.between(startedAt, now);
        } else {
            return 0.0;
        }
        if (window.isZero() || window.isNegative() || used.isNegative()) {
            return 0.0;
        }
        return used.toNanos() * 100.0 / ((double) window.toNanos() * processors);
    }

    private static String commandName(ProcessHandle.Info info) {
        return info.command()
                .map(command -> {
                    Path fileName = Path.of(command).getFileName();
                    return fileName == null ? command : fileName.toString();
                })
                .orElse("unknown");
    }

    private record Ranked(long pid, String name, double cpuPercent) {
    }
}
