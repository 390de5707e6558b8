package com.umitunal.hybridq.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Optional JSON configuration file. Values given on the command line take precedence.
 *
 * <pre>
 * {
 *   "port": 1337,
 *   "ca": ["/etc/hybridq/ca.pem"],
 *   "cert": "/etc/hybridq/server.p12",
 *   "allow_notify": false,
 *   "appkeys": { "anneal": "/opt/hybrid/bin/anneal" }
 * }
 * </pre>
 */
public class ConfigFile {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObjectNode root;

    private ConfigFile(ObjectNode root) {
        this.root = root;
    }

    public static ConfigFile empty() {
        return new ConfigFile(MAPPER.createObjectNode());
    }

    /**
     * @throws HybridQueueException CONFIG_CONFLICT if the file is unreadable or not a JSON object
     */
    public static ConfigFile load(Path path) throws HybridQueueException {
        JsonNode tree;
        try {
            tree = MAPPER.readTree(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new HybridQueueException(ErrorKind.CONFIG_CONFLICT,
                    "Cannot read configuration file " + path + ": " + e.getMessage(), e);
        }
        if (!(tree instanceof ObjectNode)) {
            throw new HybridQueueException(ErrorKind.CONFIG_CONFLICT,
                    "Configuration file " + path + " must hold a JSON object");
        }
        return new ConfigFile((ObjectNode) tree);
    }

    public Optional<String> getString(String key) {
        JsonNode node = root.get(key);
        return node == null || node.isNull() ? Optional.empty() : Optional.of(node.asText());
    }

    public Optional<Integer> getInt(String key) throws HybridQueueException {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (!node.canConvertToInt()) {
            throw invalid(key, "an integer");
        }
        return Optional.of(node.asInt());
    }

    public boolean getBoolean(String key) throws HybridQueueException {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return false;
        }
        if (!node.isBoolean()) {
            throw invalid(key, "true or false");
        }
        return node.asBoolean();
    }

    public Optional<Path> getPath(String key) {
        return getString(key).map(Paths::get);
    }

    /**
     * Read a key holding either one path or an array of paths.
     */
    public List<Path> getPaths(String key) {
        JsonNode node = root.get(key);
        List<Path> paths = new ArrayList<>();
        if (node == null || node.isNull()) {
            return paths;
        }
        if (node.isArray()) {
            node.forEach(element -> paths.add(Paths.get(element.asText())));
        } else {
            paths.add(Paths.get(node.asText()));
        }
        return paths;
    }

    public Map<String, Path> getPathMap(String key) throws HybridQueueException {
        JsonNode node = root.get(key);
        Map<String, Path> map = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return map;
        }
        if (!node.isObject()) {
            throw invalid(key, "an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            map.put(field.getKey(), Paths.get(field.getValue().asText()));
        }
        return map;
    }

    private static HybridQueueException invalid(String key, String expected) {
        return new HybridQueueException(ErrorKind.CONFIG_CONFLICT,
                "Configuration key '" + key + "' must be " + expected);
    }
}
