package com.metricsentinel.collectors.host;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ProcessSamplerTest {
    @Test
    void readsResidentSizeFromStatusFile() {
        List<String> status = List.of(
                "Name:\tjava",
                "VmPeak:\t 4096000 kB",
                "VmRSS:\t  204800 kB",
                "Threads:\t42"
        );

        assertEquals(OptionalLong.of(204800), ProcessSampler.parseResidentKilobytes(status));
        assertEquals(OptionalLong.empty(), ProcessSampler.parseResidentKilobytes(List.of("Name:\tkthreadd")));
    }

    @Test
    void memoryShareIsResidentOverPhysicalMemory(@TempDir Path procRoot) throws Exception {
        Path pidDir = Files.createDirectories(procRoot.resolve("4242"));
        Files.writeString(pidDir.resolve("status"), "Name:\tworker\nVmRSS:\t  102400 kB\n");
        ProcessSampler sampler = new ProcessSampler(4, 5, 1024L * 1024 * 1024, procRoot);

        // 100 MiB of 1 GiB
        assertEquals(9.765625, sampler.memoryPercent(4242), 1e-9);
        assertEquals(0.0, sampler.memoryPercent(999_999));
    }
}
