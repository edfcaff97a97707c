package com.planner.config;

import com.planner.exception.ConfigurationException;
import com.planner.strategy.StrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads planner configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static PlannerConfig load(String path) {
        log.info("Loading planner configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parse(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    /**
     * Parse configuration from a YAML stream.
     */
    @SuppressWarnings("unchecked")
    public static PlannerConfig parse(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The planner section could be at root or under 'planner' key
        Map<String, Object> plannerConfig = root.containsKey("planner")
                ? (Map<String, Object>) root.get("planner")
                : root;
        if (plannerConfig == null) {
            throw new ConfigurationException("Configuration section 'planner' is empty");
        }

        String name = getString(plannerConfig, "name", "default-planner");
        GridConfig grid = parseGridConfig((Map<String, Object>) plannerConfig.get("grid"));
        AllocationConfig allocation = parseAllocationConfig((Map<String, Object>) plannerConfig.get("allocation"));

        grid.validate();

        PlannerConfig config = new PlannerConfig(name, grid, allocation);
        log.info("Loaded planner configuration: {} with working hours {}-{}, break {}/{} min, pipeline {}",
                name, formatMinute(grid.workingHoursStart()), formatMinute(grid.workingHoursEnd()),
                grid.breakDuration(), grid.breakInterval(), allocation.strategies());
        return config;
    }

    private static GridConfig parseGridConfig(Map<String, Object> map) {
        GridConfig defaults = GridConfig.defaults();
        if (map == null) {
            log.debug("No grid section configured, using defaults");
            return defaults;
        }
        return new GridConfig(
                getMinuteOfDay(map, "working-hours-start", defaults.workingHoursStart()),
                getMinuteOfDay(map, "working-hours-end", defaults.workingHoursEnd()),
                getInt(map, "break-interval", defaults.breakInterval()),
                getInt(map, "break-duration", defaults.breakDuration()),
                getBoolean(map, "reserve-periodic-breaks", defaults.reservePeriodicBreaks())
        );
    }

    @SuppressWarnings("unchecked")
    private static AllocationConfig parseAllocationConfig(Map<String, Object> map) {
        if (map == null) {
            return AllocationConfig.defaults();
        }

        List<StrategyType> strategies = new ArrayList<>();
        Object strategiesObj = map.get("strategies");
        if (strategiesObj instanceof List<?> list) {
            for (Object item : list) {
                strategies.add(parseStrategyType(String.valueOf(item)));
            }
        } else if (strategiesObj != null) {
            strategies.add(parseStrategyType(strategiesObj.toString()));
        }

        AllocationConfig.BacktrackingConfig backtracking = AllocationConfig.BacktrackingConfig.defaults();
        Map<String, Object> backtrackingMap = (Map<String, Object>) map.get("backtracking");
        if (backtrackingMap != null) {
            int maxSteps = getInt(backtrackingMap, "max-steps", backtracking.maxSteps());
            if (maxSteps <= 0) {
                throw new ConfigurationException("allocation.backtracking.max-steps must be positive: " + maxSteps);
            }
            backtracking = new AllocationConfig.BacktrackingConfig(maxSteps);
        }

        return new AllocationConfig(strategies, backtracking);
    }

    private static StrategyType parseStrategyType(String value) {
        try {
            return StrategyType.valueOf(value.trim().toUpperCase().replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown allocation strategy: " + value, e);
        }
    }

    /**
     * Minute of day from either an integer or an "HH:mm" string; "24:00" means end of day.
     */
    private static int getMinuteOfDay(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        String text = value.toString().trim();
        if ("24:00".equals(text)) {
            return GridConfig.MINUTES_PER_DAY;
        }
        try {
            LocalTime time = LocalTime.parse(text);
            return time.getHour() * 60 + time.getMinute();
        } catch (DateTimeParseException e) {
            try {
                return Integer.parseInt(text);
            } catch (NumberFormatException ignored) {
                throw new ConfigurationException("Invalid time for '" + key + "': " + text, e);
            }
        }
    }

    private static String formatMinute(int minuteOfDay) {
        return String.format("%02d:%02d", minuteOfDay / 60, minuteOfDay % 60);
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for '" + key + "': " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
