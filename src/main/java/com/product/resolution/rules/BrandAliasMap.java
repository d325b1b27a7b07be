package com.product.resolution.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup from a lowercased brand alias to its canonical display name.
 *
 * <p>Loadable from JSON in either of two shapes:</p>
 * <pre>
 * {"royalcanin": "Royal Canin", "hill's": "Hills"}
 *
 * [{"alias": "royalcanin", "canonical_brand": "Royal Canin"}]
 * </pre>
 *
 * <p>Every canonical name is also registered as an alias of itself.</p>
 */
public final class BrandAliasMap {
    private static final Logger log = LoggerFactory.getLogger(BrandAliasMap.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final BrandAliasMap EMPTY = new BrandAliasMap(Map.of());

    private final Map<String, String> aliases;

    private BrandAliasMap(Map<String, String> aliases) {
        this.aliases = Map.copyOf(aliases);
    }

    public static BrandAliasMap empty() {
        return EMPTY;
    }

    /**
     * Creates a map from alias → canonical pairs. Keys are lowercased and trimmed.
     */
    public static BrandAliasMap of(Map<String, String> aliasToCanonical) {
        Map<String, String> normalized = new HashMap<>();
        aliasToCanonical.forEach((alias, canonical) -> register(normalized, alias, canonical));
        return new BrandAliasMap(normalized);
    }

    /**
     * Reads aliases from a JSON stream.
     *
     * @throws UncheckedIOException if the stream cannot be read or parsed
     */
    public static BrandAliasMap fromJson(InputStream input) {
        try {
            JsonNode root = MAPPER.readTree(input);
            Map<String, String> normalized = new HashMap<>();
            if (root == null || root.isNull()) {
                return EMPTY;
            }
            if (root.isArray()) {
                List<AliasRow> rows = MAPPER.convertValue(root,
                        MAPPER.getTypeFactory().constructCollectionType(List.class, AliasRow.class));
                for (AliasRow row : rows) {
                    register(normalized, row.alias(), row.canonicalBrand());
                }
            } else if (root.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    register(normalized, field.getKey(), field.getValue().asText());
                }
            } else {
                throw new IllegalArgumentException("Brand aliases must be a JSON object or array");
            }
            log.info("brandAliases.loaded count={}", normalized.size());
            return new BrandAliasMap(normalized);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read brand aliases", e);
        }
    }

    /**
     * Reads aliases from a classpath resource.
     *
     * @throws IllegalArgumentException if the resource does not exist
     */
    public static BrandAliasMap fromResource(String resource) {
        InputStream in = BrandAliasMap.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Brand alias resource not found: " + resource);
        }
        try (in) {
            return fromJson(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close brand alias resource " + resource, e);
        }
    }

    /**
     * Looks up the canonical brand for an alias. Matching is case-insensitive and ignores
     * surrounding and repeated whitespace.
     */
    public Optional<String> lookup(String alias) {
        if (alias == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(aliases.get(key(alias)));
    }

    public int size() {
        return aliases.size();
    }

    public boolean isEmpty() {
        return aliases.isEmpty();
    }

    /**
     * Returns a new map containing both sets of aliases; entries of {@code other} win.
     */
    public BrandAliasMap merge(BrandAliasMap other) {
        Map<String, String> merged = new HashMap<>(aliases);
        merged.putAll(other.aliases);
        return new BrandAliasMap(merged);
    }

    private static void register(Map<String, String> target, String alias, String canonical) {
        if (alias == null || alias.isBlank() || canonical == null || canonical.isBlank()) {
            log.warn("brandAliases.skipped alias='{}' canonical='{}'", alias, canonical);
            return;
        }
        String display = canonical.trim();
        target.put(key(alias), display);
        target.putIfAbsent(key(display), display);
    }

    private static String key(String alias) {
        return alias.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record AliasRow(
            String alias,
            @JsonProperty("canonical_brand") String canonicalBrand
    ) {}
}
