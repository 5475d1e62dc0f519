package com.metricsentinel.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.metricsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class ConfigLoader {
    private static final ObjectMapper YAML_MAPPER = JsonUtils.configure(new ObjectMapper(new YAMLFactory()));

    private ConfigLoader() {
    }

    /**
     * Reads and validates the agent configuration. Nothing is returned unless every rule passes.
     *
     * @throws ConfigException naming the file and every problem found
     */
    public static AgentConfig load(Path path) {
        AgentConfig config = read(path);
        List<String> problems = ConfigValidator.problems(config);
        if (!problems.isEmpty()) {
            throw new ConfigException("Invalid config " + path + ": " + String.join("; ", problems), problems);
        }
        return config;
    }

    public static List<String> warnings(AgentConfig config) {
        return ConfigValidator.warnings(config);
    }

    private static AgentConfig read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            AgentConfig config = YAML_MAPPER.readValue(in, AgentConfig.class);
            if (config == null) {
                throw new ConfigException("Config file is empty: " + path, List.of("file is empty"));
            }
            return config;
        } catch (IOException e) {
            throw new ConfigException("Failed loading config from " + path + ": " + e.getMessage(), e);
        }
    }
}
