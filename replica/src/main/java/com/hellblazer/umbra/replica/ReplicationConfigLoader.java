/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Umbra.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.umbra.replica;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.umbra.replica.entity.EntityType;
import com.hellblazer.umbra.replica.entity.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads {@link ReplicationConfig} from JSON.
 * <p>
 * Every field is optional and falls back to the default:
 * <pre>
 * {
 *   "chunkSize": 960,
 *   "worldWidth": 4800,
 *   "worldHeight": 4800,
 *   "viewWidth": 960,
 *   "viewHeight": 720,
 *   "prefetchMargin": 96,
 *   "debounceMillis": 100,
 *   "movementThresholdSquared": 2304,
 *   "positionEpsilon": 0.01,
 *   "discardStrayInserts": true,
 *   "scopes": { "campfire": "spatial" }
 * }
 * </pre>
 * Scope keys are table names or entity type names, case insensitive.
 *
 * @author hal.hildebrand
 */
public class ReplicationConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ReplicationConfigLoader.class);

    private final ObjectMapper objectMapper;

    public ReplicationConfigLoader() {
        this(new ObjectMapper());
    }

    public ReplicationConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parse a configuration document.
     *
     * @throws IOException              if the stream cannot be read or is not JSON
     * @throws IllegalArgumentException if a value is out of range or a scope entry is unknown
     */
    public ReplicationConfig load(InputStream in) throws IOException {
        var root = objectMapper.readTree(in);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Replication config must be a JSON object");
        }
        return parse(root);
    }

    /**
     * Load a configuration from the class path.
     *
     * @param resource absolute resource name
     * @return the configuration, or empty if the resource does not exist
     * @throws IOException if the resource exists but cannot be parsed
     */
    public Optional<ReplicationConfig> loadResource(String resource) throws IOException {
        try (InputStream is = getClass().getResourceAsStream(resource)) {
            if (is == null) {
                log.debug("Config resource not found: {}", resource);
                return Optional.empty();
            }
            var config = load(is);
            log.info("Loaded replication config from {}: {}", resource, config);
            return Optional.of(config);
        }
    }

    /**
     * Load a configuration from the class path, using the defaults if it is missing or invalid.
     */
    public ReplicationConfig loadOrDefault(String resource) {
        try {
            return loadResource(resource).orElseGet(ReplicationConfig::defaultConfig);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to load replication config {}, using defaults: {}", resource, e.getMessage());
            return ReplicationConfig.defaultConfig();
        }
    }

    private ReplicationConfig parse(JsonNode root) {
        var builder = ReplicationConfig.builder();
        var defaults = ReplicationConfig.defaultConfig();

        if (root.has("chunkSize")) {
            builder.withChunkSize(floatValue(root, "chunkSize"));
        }
        if (root.has("worldWidth") || root.has("worldHeight")) {
            builder.withWorldSize(floatValue(root, "worldWidth", defaults.getWorldWidth()),
                                  floatValue(root, "worldHeight", defaults.getWorldHeight()));
        }
        if (root.has("viewWidth") || root.has("viewHeight")) {
            builder.withViewSize(floatValue(root, "viewWidth", defaults.getViewWidth()),
                                 floatValue(root, "viewHeight", defaults.getViewHeight()));
        }
        if (root.has("prefetchMargin")) {
            builder.withPrefetchMargin(floatValue(root, "prefetchMargin"));
        }
        if (root.has("debounceMillis")) {
            builder.withDebounceMillis(numeric(root, "debounceMillis").asLong());
        }
        if (root.has("movementThresholdSquared")) {
            builder.withMovementThresholdSquared(floatValue(root, "movementThresholdSquared"));
        }
        if (root.has("positionEpsilon")) {
            builder.withPositionEpsilon(floatValue(root, "positionEpsilon"));
        }
        if (root.has("discardStrayInserts")) {
            var node = root.get("discardStrayInserts");
            if (!node.isBoolean()) {
                throw new IllegalArgumentException("discardStrayInserts must be a boolean");
            }
            builder.withDiscardStrayInserts(node.asBoolean());
        }

        var scopes = root.get("scopes");
        if (scopes != null) {
            if (!scopes.isObject()) {
                throw new IllegalArgumentException("scopes must be an object");
            }
            var fields = scopes.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                var type = entityType(entry.getKey());
                var scope = scope(entry.getKey(), entry.getValue());
                builder.withScope(type, scope);
                log.debug("Scope override: {} -> {}", type, scope);
            }
        }
        return builder.build();
    }

    private static float floatValue(JsonNode root, String field) {
        return (float) numeric(root, field).asDouble();
    }

    private static float floatValue(JsonNode root, String field, float defaultValue) {
        return root.has(field) ? floatValue(root, field) : defaultValue;
    }

    private static JsonNode numeric(JsonNode root, String field) {
        var node = root.get(field);
        if (!node.isNumber()) {
            throw new IllegalArgumentException(field + " must be a number: " + node);
        }
        return node;
    }

    private static EntityType entityType(String key) {
        for (var type : EntityType.values()) {
            if (type.tableName().equalsIgnoreCase(key) || type.name().equalsIgnoreCase(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown entity type in scopes: " + key);
    }

    private static Scope scope(String key, JsonNode value) {
        if (!value.isTextual()) {
            throw new IllegalArgumentException("Scope of " + key + " must be a string");
        }
        try {
            return Scope.valueOf(value.asText().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown scope for " + key + ": " + value.asText(), e);
        }
    }
}
