package com.metricsentinel.collectors.host;

import com.metricsentinel.core.model.NetworkCounters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Sums interface counters from a Linux {@code /proc/net/dev} table, loopback excluded.
 */
final class ProcNetDevReader {
    private static final Logger LOGGER = Logger.getLogger(ProcNetDevReader.class.getName());
    private static final int RECEIVE_BYTES = 0;
    private static final int RECEIVE_PACKETS = 1;
    private static final int RECEIVE_ERRORS = 2;
    private static final int RECEIVE_DROPS = 3;
    private static final int TRANSMIT_BYTES = 8;
    private static final int TRANSMIT_PACKETS = 9;
    private static final int TRANSMIT_ERRORS = 10;
    private static final int TRANSMIT_DROPS = 11;

    private final Path file;

    ProcNetDevReader(Path file) {
        this.file = file;
    }

    Optional<NetworkCounters> read() throws IOException {
        if (!Files.isReadable(file)) {
            return Optional.empty();
        }
        return Optional.of(parse(Files.readAllLines(file, StandardCharsets.UTF_8)));
    }

    static NetworkCounters parse(List<String> lines) {
        NetworkCounters total = NetworkCounters.zero();
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String iface = line.substring(0, colon).trim();
            if (iface.isEmpty() || iface.equals("lo")) {
                continue;
            }
            String[] fields = line.substring(colon + 1).trim().split("\\s+");
            if (fields.length <= TRANSMIT_DROPS) {
                continue;
            }
            try {
                total = total.plus(new NetworkCounters(
                        Long.parseLong(fields[TRANSMIT_BYTES]),
                        Long.parseLong(fields[RECEIVE_BYTES]),
                        Long.parseLong(fields[TRANSMIT_PACKETS]),
                        Long.parseLong(fields[RECEIVE_PACKETS]),
                        Long.parseLong(fields[RECEIVE_ERRORS]),
                        Long.parseLong(fields[TRANSMIT_ERRORS]),
                        Long.parseLong(fields[RECEIVE_DROPS]),
                        Long.parseLong(fields[TRANSMIT_DROPS])
                ));
            } catch (NumberFormatException e) {
                LOGGER.fine(() -> "Skipping unparseable interface row for " + iface + ": " + e.getMessage());
            }
        }
        return total;
    }
}
