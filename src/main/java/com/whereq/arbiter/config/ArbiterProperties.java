package com.whereq.arbiter.config;

import com.whereq.arbiter.model.BanditAlgorithm;
import com.whereq.arbiter.model.ExecutorClass;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for WhereQ Arbiter.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "arbiter")
@Data
public class ArbiterProperties {

    private FleetConfig fleet = new FleetConfig();

    private BanditConfig bandit = new BanditConfig();

    private StateConfig state = new StateConfig();

    private AvailabilityConfig availability = new AvailabilityConfig();

    private LifecycleConfig lifecycle = new LifecycleConfig();

    @Data
    public static class FleetConfig {
        /**
         * Runners registered in the ontology at startup.
         */
        private List<RunnerConfig> runners = new ArrayList<>();

        /**
         * Extra implication rules (capability -> implied capabilities), merged over the defaults.
         */
        private Map<String, List<String>> implications = new LinkedHashMap<>();

        /**
         * Extra job tag -> required capability mappings, merged over the defaults.
         */
        private Map<String, List<String>> tagMappings = new LinkedHashMap<>();
    }

    @Data
    public static class RunnerConfig {
        private String key;
        private String name;
        private List<String> tags = new ArrayList<>();
        private List<String> capabilities = new ArrayList<>();
        private double costPerMinute = 0.0;
        private ExecutorClass executorClass = ExecutorClass.CONTAINER;
        private Long gitlabRunnerId;
        private boolean onDemand = false;
    }

    @Data
    public static class BanditConfig {
        /**
         * Arm selection algorithm.
         * UCB1: deterministic, explores untried runners first (default)
         * THOMPSON: samples success probability per runner
         * EPSILON_GREEDY: random runner with probability epsilon
         */
        private BanditAlgorithm algorithm = BanditAlgorithm.UCB1;

        /**
         * UCB1 exploration constant c.
         */
        private double explorationConstant = 2.0;

        /**
         * Exploration probability for EPSILON_GREEDY.
         */
        private double epsilon = 0.1;

        /**
         * Optional random seed for the randomized algorithms.
         */
        private Long seed;
    }

    @Data
    public static class StateConfig {
        /**
         * Where bandit statistics are persisted: memory, file or redis.
         */
        private String backend = "memory";

        /**
         * JSON document path for the file backend.
         */
        private String filePath = "data/bandit-state.json";

        /**
         * Key holding the JSON document for the redis backend.
         */
        private String redisKey = "arbiter:bandit:state";

        /**
         * Timeout for a single load or save.
         */
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class AvailabilityConfig {
        /**
         * Base URL of the GitLab API.
         */
        private String gitlabUrl = "https://gitlab.com/api/v4";

        /**
         * Private token for the runner status API. Without it the fleet status is unknown.
         */
        private String gitlabToken;

        /**
         * Timeout for each status call.
         */
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class LifecycleConfig {
        /**
         * Whether the controller may start and stop on-demand capacity.
         */
        private boolean enabled = false;

        /**
         * Stop auto-started capacity after this long without activity.
         */
        private Duration idleShutdown = Duration.ofMinutes(5);

        /**
         * Timeout for a single start or stop command.
         */
        private Duration timeout = Duration.ofSeconds(30);

        private GceConfig gce = new GceConfig();
    }

    @Data
    public static class GceConfig {
        private String baseUrl = "https://compute.googleapis.com/compute/v1";
        private String project;
        private String zone;
        private String instance;

        /**
         * OAuth2 access token for the Compute Engine API.
         */
        private String accessToken;
    }
}
