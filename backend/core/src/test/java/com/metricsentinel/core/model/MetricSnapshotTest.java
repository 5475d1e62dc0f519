package com.metricsentinel.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.metricsentinel.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricSnapshotTest {
    private static final Instant NOW = Instant.parse("2026-02-01T00:00:00Z");

    @Test
    void readingsFollowSectionOrderAndReportFullestDisk() {
        MetricSnapshot snapshot = new MetricSnapshot(
                NOW,
                "host-a",
                new CpuStats(42.5, 4, 8, List.of(0.5, 0.4, 0.3)),
                MemoryStats.fromTotals(1000, 250),
                SwapStats.fromTotals(0, 0),
                List.of(
                        DiskUsage.fromTotals("/dev/sda1", "/", "ext4", 100, 40),
                        DiskUsage.fromTotals("/dev/sdb1", "/data", "xfs", 100, 5)
                ),
                null,
                null
        );

        Map<String, Double> readings = snapshot.readings();

        assertEquals(
                List.of("cpu_percent", "memory_percent", "disk_percent", "disk_percent:/", "disk_percent:/data", "swap_percent"),
                List.copyOf(readings.keySet())
        );
        assertEquals(42.5, readings.get("cpu_percent"));
        assertEquals(75.0, readings.get("memory_percent"));
        assertEquals(95.0, readings.get("disk_percent"));
        assertEquals(0.0, readings.get("swap_percent"));
    }

    @Test
    void missingSectionsProduceNoReadings() {
        MetricSnapshot snapshot = new MetricSnapshot(NOW, "host-a", CpuStats.ofPercent(150.0), null, null, null, null, null);

        assertEquals(Map.of("cpu_percent", 150.0), snapshot.readings());
        assertTrue(snapshot.disks().isEmpty());
    }

    @Test
    void serializesWithIngestionFieldNames() {
        MetricSnapshot snapshot = new MetricSnapshot(
                NOW,
                "host-a",
                new CpuStats(10.0, 2, 4, null),
                null,
                null,
                List.of(DiskUsage.fromTotals("/dev/sda1", "/", "ext4", 200, 50)),
                new NetworkCounters(1, 2, 3, 4, 0, 0, 0, 0),
                List.of(new ProcessStats(42, "java", 12.5, 3.25))
        );

        JsonNode tree = JsonUtils.objectMapper().valueToTree(snapshot);

        assertEquals("2026-02-01T00:00:00Z", tree.get("timestamp").asText());
        assertEquals(4, tree.get("cpu").get("count_logical").asInt());
        assertFalse(tree.get("cpu").has("load_avg"));
        assertEquals(75.0, tree.get("disk").get(0).get("percent").asDouble());
        assertEquals(2, tree.get("network").get("bytes_recv").asLong());
        JsonNode process = tree.get("top_processes").get(0);
        assertEquals("java", process.get("name").asText());
        assertEquals(12.5, process.get("cpu_percent").asDouble());
        assertEquals(3.25, process.get("memory_percent").asDouble());
        assertFalse(tree.has("memory"));
        assertFalse(tree.has("readings"));
    }

    @Test
    void thresholdConfigKeepsDeclarationOrderAndRejectsNulls() {
        Map<String, Double> declared = new LinkedHashMap<>();
        declared.put("swap", 50.0);
        declared.put("cpu", 80.0);
        declared.put("disk", 90.0);

        ThresholdConfig config = ThresholdConfig.of(declared);
        declared.put("memory", 85.0);

        assertEquals(List.of("swap", "cpu", "disk"), List.copyOf(config.bounds().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> config.bounds().put("x", 1.0));

        Map<String, Double> withNull = new LinkedHashMap<>();
        withNull.put("cpu", null);
        assertThrows(NullPointerException.class, () -> ThresholdConfig.of(withNull));
    }

    @Test
    void alertCandidateDescribesBreach() {
        AlertCandidate candidate = new AlertCandidate("cpu", 95.0, 80.0, NOW);

        assertEquals("cpu at 95.0% exceeds threshold 80.0%", candidate.describe());
    }
}
