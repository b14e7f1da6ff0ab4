package io.machinecontroller.config;

import io.machinecontroller.util.EnvironmentUtils;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import static io.machinecontroller.config.Constants.*;

/**
 * Configuration for the machine controller.
 * Loads application.yml (external file first, classpath second) with fallbacks to constants.
 */
@Slf4j
@Getter
public class MachineControllerConfig {

    private final String[] etcdEndpoints;
    private final String clusterName;
    private final long syncRetryDelaySeconds;

    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable naming an external config file
    static final String EXTERNAL_CONFIG_ENV_VAR = "CONTROLLER_CONFIG_FILE";

    public MachineControllerConfig() {
        this(loadYamlConfig());
    }

    MachineControllerConfig(ConfigModel config) {
        this.etcdEndpoints = parseEndpoints(config);
        this.clusterName = parseClusterName(config);
        this.syncRetryDelaySeconds = parseSyncRetryDelaySeconds(config);

        log.info("Loaded machine controller config - etcd endpoints: {}, cluster: {}, sync retry delay: {}s",
            String.join(", ", etcdEndpoints), clusterName, syncRetryDelaySeconds);
    }

    private static ConfigModel loadYamlConfig() {
        InputStream inputStream = null;
        String loadedFrom = "";

        String externalConfigPath = EnvironmentUtils.getEnv(EXTERNAL_CONFIG_ENV_VAR, null);
        if (externalConfigPath != null) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException | SecurityException e) {
                log.warn("Cannot open external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            }
        }

        if (inputStream == null) {
            inputStream = MachineControllerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        try (InputStream in = inputStream) {
            ConfigModel config = parse(in);
            log.info("Loaded configuration from {}", loadedFrom);
            return config;
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        }
    }

    /**
     * Parse a YAML document into the config model; an empty document gives an empty model.
     */
    static ConfigModel parse(InputStream inputStream) {
        Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
        ConfigModel config = yaml.load(inputStream);
        return config != null ? config : new ConfigModel();
    }

    private String[] parseEndpoints(ConfigModel config) {
        if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null
            && !config.getEtcd().getEndpoints().isEmpty()) {
            return config.getEtcd().getEndpoints().toArray(new String[0]);
        }
        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private String parseClusterName(ConfigModel config) {
        if (config.getCluster() != null && config.getCluster().getName() != null
            && !config.getCluster().getName().isBlank()) {
            return config.getCluster().getName();
        }
        return DEFAULT_CLUSTER_NAME;
    }

    private long parseSyncRetryDelaySeconds(ConfigModel config) {
        if (config.getSync() != null && config.getSync().getRetry_delay_seconds() != null) {
            long value = config.getSync().getRetry_delay_seconds();
            if (value > 0) {
                return value;
            }
            log.warn("Ignoring non-positive sync.retry_delay_seconds {}, using default {}",
                value, DEFAULT_SYNC_RETRY_DELAY_SECONDS);
        }
        return DEFAULT_SYNC_RETRY_DELAY_SECONDS;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Etcd etcd;
        private Cluster cluster;
        private Sync sync;
        private Controller controller; // read by Spring @Value
        private Server server;         // read by Spring Boot
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
    }

    @Data
    public static class Cluster {
        private String name;
    }

    @Data
    public static class Sync {
        private Long retry_delay_seconds;
    }

    @Data
    public static class Controller {
        private String id;
    }

    @Data
    public static class Server {
        private Integer port;
    }
}
