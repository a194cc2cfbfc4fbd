package com.cybershieldx.agent.store;

import com.cybershieldx.agent.util.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Config store persisted as a single JSON document, rewritten atomically on every change
 */
public class JsonFileConfigStore implements ConfigStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileConfigStore.class);

    private final Path file;
    private final ObjectNode defaults;
    private final ObjectNode values;

    public JsonFileConfigStore(Path file) {
        this(file, Map.of());
    }

    public JsonFileConfigStore(Path file, Map<String, ?> defaults) {
        this.file = file;
        this.defaults = Jsons.mapper().valueToTree(defaults);
        this.values = load(file);
    }

    private static ObjectNode load(Path file) {
        if (!Files.exists(file)) {
            return Jsons.object();
        }
        try {
            JsonNode tree = Jsons.mapper().readTree(file.toFile());
            if (tree instanceof ObjectNode) {
                return (ObjectNode) tree;
            }
            log.warn("Config file {} does not contain a JSON object, starting empty", file);
        } catch (IOException e) {
            log.warn("Config file {} is unreadable, starting empty: {}", file, e.getMessage());
        }
        quarantine(file);
        return Jsons.object();
    }

    private static void quarantine(Path file) {
        Path corrupt = file.resolveSibling(file.getFileName() + ".corrupt");
        try {
            Files.move(file, corrupt, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Moved unreadable config file to {}", corrupt);
        } catch (IOException e) {
            log.warn("Could not move unreadable config file {}: {}", file, e.getMessage());
        }
    }

    @Override
    public synchronized JsonNode get(String key) {
        JsonNode value = values.get(key);
        if (value == null) {
            value = defaults.get(key);
        }
        return value == null ? null : value.deepCopy();
    }

    @Override
    public synchronized boolean contains(String key) {
        return values.has(key);
    }

    @Override
    public synchronized void set(String key, Object value) {
        if (value == null) {
            delete(key);
            return;
        }
        ObjectNode next = values.deepCopy();
        next.set(key, Jsons.mapper().valueToTree(value));
        commit(next);
    }

    @Override
    public synchronized void delete(String key) {
        if (!values.has(key)) {
            return;
        }
        ObjectNode next = values.deepCopy();
        next.remove(key);
        commit(next);
    }

    @Override
    public synchronized void apply(Map<String, ?> changes) {
        if (changes.isEmpty()) {
            return;
        }
        ObjectNode next = values.deepCopy();
        for (Map.Entry<String, ?> change : changes.entrySet()) {
            if (change.getValue() == null) {
                next.remove(change.getKey());
            } else {
                next.set(change.getKey(), Jsons.mapper().valueToTree(change.getValue()));
            }
        }
        commit(next);
    }

    @Override
    public synchronized Map<String, JsonNode> snapshot() {
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = values.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            copy.put(field.getKey(), field.getValue().deepCopy());
        }
        return copy;
    }

    public Path getFile() {
        return file;
    }

    // In-memory state only changes once the file write has succeeded
    private void commit(ObjectNode next) {
        try {
            Jsons.writeAtomically(file, next);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist configuration to " + file, e);
        }
        values.removeAll();
        values.setAll(next);
    }
}
