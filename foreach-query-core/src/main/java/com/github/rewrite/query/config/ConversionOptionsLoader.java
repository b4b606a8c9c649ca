package com.github.rewrite.query.config;

import com.github.rewrite.query.analysis.StrategyKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads ConversionOptions from query-conversion.yaml or returns defaults.
 * <p>
 * The loader uses a static cache to avoid repeated file reads.
 * This is safe because query-conversion.yaml doesn't change during a run.
 * <p>
 * Usage:
 * <pre>
 * ConversionOptions options = ConversionOptionsLoader.load(projectRoot);
 * ForEachToQueryConverter converter = new ForEachToQueryConverter(options);
 * </pre>
 */
public class ConversionOptionsLoader {

    private static final Logger logger = LogManager.getLogger(ConversionOptionsLoader.class);

    public static final String CONFIG_FILE = "query-conversion.yaml";

    private static final Map<Path, ConversionOptions> CACHE = new ConcurrentHashMap<>();

    // Test injection map - lets unit tests control options without filesystem access
    private static final Map<Path, ConversionOptions> TEST_INJECTIONS = new ConcurrentHashMap<>();

    private ConversionOptionsLoader() {
    }

    /**
     * Loads the options for the given project root.
     * <p>
     * If query-conversion.yaml exists, it is parsed. Otherwise defaults are returned.
     * Results are cached per normalized root.
     *
     * @param projectRoot the project root directory, may be null
     * @return the options
     * @throws ConfigurationException if the file names an unknown strategy or a blank namespace
     */
    public static ConversionOptions load(Path projectRoot) {
        if (projectRoot == null) {
            return ConversionOptions.defaults();
        }

        Path normalizedRoot = projectRoot.toAbsolutePath().normalize();

        ConversionOptions injected = TEST_INJECTIONS.get(normalizedRoot);
        if (injected != null) {
            return injected;
        }

        return CACHE.computeIfAbsent(normalizedRoot, ConversionOptionsLoader::loadFromDisk);
    }

    /**
     * Clears the cache. Call this between test runs if needed.
     */
    public static void clearCache() {
        CACHE.clear();
    }

    /**
     * Injects options for testing purposes.
     *
     * @param projectRoot the project root path
     * @param options the options to return for that root
     */
    public static void injectForTest(Path projectRoot, ConversionOptions options) {
        TEST_INJECTIONS.put(projectRoot.toAbsolutePath().normalize(), options);
    }

    /**
     * Clears all test injections. Call this in @AfterEach to clean up test state.
     */
    public static void clearTestInjections() {
        TEST_INJECTIONS.clear();
    }

    private static ConversionOptions loadFromDisk(Path projectRoot) {
        Path yamlPath = projectRoot.resolve(CONFIG_FILE);
        if (!Files.exists(yamlPath)) {
            logger.debug("No {} found in {}, using defaults", CONFIG_FILE, projectRoot);
            return ConversionOptions.defaults();
        }
        return parseYaml(yamlPath);
    }

    /**
     * Parses query-conversion.yaml using SnakeYAML.
     */
    @SuppressWarnings("unchecked")
    static ConversionOptions parseYaml(Path yamlPath) {
        Map<String, Object> root;
        try {
            String content = Files.readString(yamlPath);
            Object loaded = new Yaml().load(content);
            if (loaded != null && !(loaded instanceof Map)) {
                logger.warn("Ignoring {}: expected a mapping at the top level", yamlPath);
                return ConversionOptions.defaults();
            }
            root = (Map<String, Object>) loaded;
        } catch (Exception e) {
            logger.warn("Failed to parse {}: {}. Using defaults.", yamlPath, e.getMessage());
            return ConversionOptions.defaults();
        }

        if (root == null) {
            return ConversionOptions.defaults();
        }

        Object conversionObj = root.get("conversion");
        if (!(conversionObj instanceof Map)) {
            return ConversionOptions.defaults();
        }
        Map<String, Object> conversion = (Map<String, Object>) conversionObj;

        String queryNamespace = null;
        Object namespaceObj = conversion.get("queryNamespace");
        if (namespaceObj != null) {
            queryNamespace = namespaceObj.toString();
        }

        Boolean convertLocalDeclarations = null;
        Object localsObj = conversion.get("convertLocalDeclarations");
        if (localsObj != null) {
            convertLocalDeclarations = Boolean.parseBoolean(localsObj.toString().trim());
        }

        String listAddMethod = null;
        Object addMethodObj = conversion.get("listAddMethod");
        if (addMethodObj != null) {
            listAddMethod = addMethodObj.toString();
        }

        List<StrategyKind> strategies = parseStrategies(conversion.get("strategies"), yamlPath);

        return new ConversionOptions(queryNamespace, convertLocalDeclarations, listAddMethod, strategies);
    }

    private static List<StrategyKind> parseStrategies(Object value, Path yamlPath) {
        if (value == null) {
            return null;
        }
        List<Object> names = new ArrayList<>();
        if (value instanceof List) {
            names.addAll((List<?>) value);
        } else {
            // Allow "strategies: count, toList"
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    names.add(part);
                }
            }
        }
        List<StrategyKind> strategies = new ArrayList<>();
        for (Object name : names) {
            StrategyKind kind = StrategyKind.fromString(name == null ? null : name.toString());
            if (kind == null) {
                throw new ConfigurationException("Unknown strategy '" + name + "' in " + yamlPath +
                        ". Valid values: default, count, toList, yieldReturn");
            }
            strategies.add(kind);
        }
        return strategies;
    }
}
