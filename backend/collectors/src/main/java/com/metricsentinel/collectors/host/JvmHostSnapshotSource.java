package com.metricsentinel.collectors.host;

import com.metricsentinel.collectors.api.SnapshotException;
import com.metricsentinel.collectors.api.SnapshotScope;
import com.metricsentinel.collectors.api.SnapshotSource;
import com.metricsentinel.core.model.CpuStats;
import com.metricsentinel.core.model.DiskUsage;
import com.metricsentinel.core.model.MemoryStats;
import com.metricsentinel.core.model.MetricSnapshot;
import com.metricsentinel.core.model.NetworkCounters;
import com.metricsentinel.core.model.ProcessStats;
import com.metricsentinel.core.model.SwapStats;
import com.sun.management.OperatingSystemMXBean;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.FileStore;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads host counters through the JVM's platform MXBean and NIO file stores, plus {@code /proc} (network counters,
 * process resident size) where the platform has it.
 */
public class JvmHostSnapshotSource implements SnapshotSource {
    private static final Logger LOGGER = Logger.getLogger(JvmHostSnapshotSource.class.getName());
    private static final int TOP_PROCESS_LIMIT = 5;

    private final OperatingSystemMXBean os;
    private final String hostname;
    private final ProcNetDevReader networkReader;
    private final ProcessSampler processSampler;

    public JvmHostSnapshotSource(String hostname) {
        this(hostname, Path.of("/proc"));
    }

    JvmHostSnapshotSource(String hostname, Path procRoot) {
        this.os = (OperatingSystemMXBean) ManagementFactory.getOperatingSystemMXBean();
        this.hostname = hostname;
        this.networkReader = new ProcNetDevReader(procRoot.resolve("net").resolve("dev"));
        this.processSampler = new ProcessSampler(
                os.getAvailableProcessors(), TOP_PROCESS_LIMIT, os.getTotalMemorySize(), procRoot);
    }

    @Override
    public String name() {
        return "jvmHost";
    }

    @Override
    public MetricSnapshot sample(Instant at, SnapshotScope scope) throws SnapshotException {
        return new MetricSnapshot(
                at,
                hostname,
                cpu(),
                MemoryStats.fromTotals(os.getTotalMemorySize(), os.getFreeMemorySize()),
                SwapStats.fromTotals(os.getTotalSwapSpaceSize(), os.getFreeSwapSpaceSize()),
                disks(scope.diskUsageOnly()),
                scope.includeNetwork() ? network() : null,
                scope.includeProcesses() ? processes(at) : null
        );
    }

    private CpuStats cpu() {
        double load = os.getCpuLoad();
        if (load < 0) {
            // the ingest body always carries a cpu section
            LOGGER.fine("CPU load not available yet; reporting 0");
            load = 0.0;
        }
        int processors = os.getAvailableProcessors();
        double loadAverage = os.getSystemLoadAverage();
        return new CpuStats(load * 100.0, processors, processors, loadAverage < 0 ? null : List.of(loadAverage));
    }

    private List<DiskUsage> disks(boolean rootOnly) throws SnapshotException {
        List<DiskUsage> disks = new ArrayList<>();
        try {
            if (rootOnly) {
                for (Path root : FileSystems.getDefault().getRootDirectories()) {
                    FileStore store = Files.getFileStore(root);
                    disks.add(DiskUsage.fromTotals(store.name(), root.toString(), store.type(),
                            store.getTotalSpace(), store.getUsableSpace()));
                    break;
                }
                return disks;
            }
            for (FileStore store : FileSystems.getDefault().getFileStores()) {
                long total = store.getTotalSpace();
                if (total <= 0) {
                    continue;
                }
                disks.add(DiskUsage.fromTotals(store.name(), mountpointOf(store), store.type(),
                        total, store.getUsableSpace()));
            }
            return disks;
        } catch (IOException e) {
            throw new SnapshotException("Failed reading disk usage", e);
        }
    }

    private NetworkCounters network() {
        try {
            return networkReader.read().orElse(null);
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Network counters unavailable", e);
            return null;
        }
    }

    private List<ProcessStats> processes(Instant at) {
        return processSampler.top(at);
    }

    static String mountpointOf(FileStore store) {
        // FileStore#toString is "<mountpoint> (<device>)" on the default providers
        String text = store.toString();
        int paren = text.lastIndexOf(" (");
        return paren > 0 ? text.substring(0, paren) : text;
    }
}
