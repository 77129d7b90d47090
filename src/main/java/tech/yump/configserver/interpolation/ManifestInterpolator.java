package tech.yump.configserver.interpolation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import tech.yump.configserver.exceptions.ConfigServerMissingNamesException;
import tech.yump.configserver.exceptions.ConfigServerUnknownErrorException;
import tech.yump.configserver.gateway.ConfigServerGateway;
import tech.yump.configserver.gateway.FetchResult;
import tech.yump.configserver.mapping.PlaceholderMappingRecorder;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Replaces placeholders in a manifest with values from the config server.
 * <p>
 * Works in two phases. The walk copies the manifest, skipping ignored subtrees, and collects every
 * placeholder with the slot it occupies in the copy. Then every distinct name is fetched; only when
 * all of them were found are the slots filled, so a failure reports every missing name at once and
 * the caller never sees a partially interpolated manifest. The input is never modified.
 */
@Slf4j
@RequiredArgsConstructor
public class ManifestInterpolator {

    private final PlaceholderNameResolver nameResolver;
    private final ConfigServerGateway gateway;
    private final PlaceholderMappingRecorder mappingRecorder;

    public JsonNode interpolate(JsonNode manifest, @Nullable String deploymentName, InterpolationOptions options) {
        if (manifest == null) {
            throw new IllegalArgumentException("Manifest cannot be null.");
        }

        Walk walk = new Walk(deploymentName, options);
        JsonNode[] root = new JsonNode[1];
        root[0] = walk.copy(manifest, new ArrayList<>(), value -> root[0] = value);

        if (walk.slots.isEmpty()) {
            log.debug("No placeholders found in manifest for deployment '{}'", deploymentName);
            return root[0];
        }

        Map<String, FetchResult.Found> values = fetchAll(walk.slots.keySet());

        walk.slots.forEach((name, slots) -> {
            JsonNode value = values.get(name).value();
            slots.forEach(slot -> slot.accept(value.deepCopy()));
        });

        values.values().forEach(found -> mappingRecorder.record(found.name(), found.id(), deploymentName));
        log.info("Interpolated {} placeholder name(s) for deployment '{}'", values.size(), deploymentName);
        return root[0];
    }

    private Map<String, FetchResult.Found> fetchAll(Iterable<String> names) {
        Map<String, FetchResult.Found> values = new LinkedHashMap<>();
        List<String> missingNames = new ArrayList<>();

        for (String name : names) {
            FetchResult result = gateway.fetch(name);
            if (result instanceof FetchResult.Found found) {
                values.put(name, found);
            } else if (result instanceof FetchResult.NotFound) {
                missingNames.add(name);
            } else if (result instanceof FetchResult.Error error) {
                log.error("Config server returned an error for name '{}': {}", name, error.detail());
                throw new ConfigServerUnknownErrorException(String.format(
                        "Failed to fetch placeholder '%s' from the config server: %s", name, error.detail()));
            }
        }

        if (!missingNames.isEmpty()) {
            log.warn("Placeholder names missing from config server: {}", missingNames);
            throw new ConfigServerMissingNamesException(missingNames);
        }
        return values;
    }

    /**
     * State of one traversal: the options in force and, per resolved name, the slots waiting for its value.
     */
    @RequiredArgsConstructor
    private final class Walk {

        private final String deploymentName;
        private final InterpolationOptions options;
        private final Map<String, List<Consumer<JsonNode>>> slots = new LinkedHashMap<>();

        JsonNode copy(JsonNode node, List<PathSegment> path, Consumer<JsonNode> slot) {
            if (!path.isEmpty() && SubtreeMatcher.isIgnored(path, options.subtreesToIgnore())) {
                return node.deepCopy();
            }

            if (node.isObject()) {
                ObjectNode result = ((ObjectNode) node).objectNode();
                Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    String key = field.getKey();
                    result.set(key, copy(field.getValue(), append(path, PathSegment.key(key)), value -> result.set(key, value)));
                }
                return result;
            }

            if (node.isArray()) {
                ArrayNode result = ((ArrayNode) node).arrayNode(node.size());
                for (int i = 0; i < node.size(); i++) {
                    int index = i;
                    result.add(copy(node.get(i), append(path, PathSegment.index(i)), value -> result.set(index, value)));
                }
                return result;
            }

            PlaceholderGrammar.extract(node).ifPresent(placeholder -> {
                String name = nameResolver.resolve(placeholder.name(), deploymentName, options.mustBeAbsoluteName());
                slots.computeIfAbsent(name, ignored -> new ArrayList<>()).add(slot);
            });
            return node.deepCopy();
        }

        private List<PathSegment> append(List<PathSegment> path, PathSegment segment) {
            List<PathSegment> child = new ArrayList<>(path.size() + 1);
            child.addAll(path);
            child.add(segment);
            return child;
        }
    }
}
