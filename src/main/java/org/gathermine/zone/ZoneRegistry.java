package org.gathermine.zone;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import org.gathermine.model.Zone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the zone ids used by the observation feed to the addon's zones.
 * <p>
 * Configuration structure:
 * <pre>
 * zones {
 *   map {
 *     "331" { id = "63", name = "Ashenvale" }
 *   }
 *   suppressed = [ "718" ]
 * }
 * </pre>
 * Several feed ids may point at the same canonical id; they all resolve to the first
 * {@link Zone} built for it.
 */
public class ZoneRegistry {

    private static final Logger log = LoggerFactory.getLogger(ZoneRegistry.class);

    private final Map<String, Zone> byExternalId;
    private final Set<String> suppressed;

    /**
     * @param zones the zones by feed id
     * @param suppressed feed ids that are skipped without a warning
     */
    public ZoneRegistry(Map<String, Zone> zones, Set<String> suppressed) {
        Map<String, Zone> byCanonicalId = new HashMap<>();
        Map<String, Zone> resolved = new LinkedHashMap<>();
        zones.forEach((externalId, zone) -> {
            if (!Zone.isNumeric(zone.canonicalId())) {
                throw new IllegalArgumentException("Zone '" + zone.displayName() + "' (feed id " + externalId
                        + ") has a non-numeric id: " + zone.canonicalId());
            }
            if (zone.canonicalId().length() > 1 && zone.canonicalId().charAt(0) == '0') {
                throw new IllegalArgumentException("Zone '" + zone.displayName() + "' (feed id " + externalId
                        + ") has an id with a leading zero: " + zone.canonicalId());
            }
            resolved.put(externalId, byCanonicalId.computeIfAbsent(zone.canonicalId(), id -> zone));
        });
        this.byExternalId = Collections.unmodifiableMap(resolved);
        this.suppressed = Set.copyOf(suppressed);
    }

    /**
     * Builds a registry from a {@code zones} configuration block.
     *
     * @param zonesConfig the block holding {@code map} and optionally {@code suppressed}
     * @return the registry
     * @throws IllegalArgumentException if an entry is incomplete, or has a non-numeric id or one with a leading zero
     */
    public static ZoneRegistry fromConfig(Config zonesConfig) {
        Map<String, Zone> zones = new LinkedHashMap<>();
        if (zonesConfig.hasPath("map")) {
            Config map = zonesConfig.getConfig("map");
            for (Map.Entry<String, ConfigValue> entry : zonesConfig.getObject("map").entrySet()) {
                String externalId = entry.getKey();
                try {
                    Config zone = map.getConfig(ConfigUtil.joinPath(externalId));
                    zones.put(externalId, new Zone(externalId, zone.getString("id"), zone.getString("name")));
                } catch (ConfigException e) {
                    throw new IllegalArgumentException("Invalid zone entry for feed id " + externalId + ": " + e.getMessage(), e);
                }
            }
        }
        List<String> suppressed = zonesConfig.hasPath("suppressed") ? zonesConfig.getStringList("suppressed") : List.of();
        ZoneRegistry registry = new ZoneRegistry(zones, new HashSet<>(suppressed));
        log.debug("Loaded {} zones, {} suppressed feed ids", registry.size(), registry.suppressed.size());
        return registry;
    }

    /**
     * @param externalId the feed zone id
     * @return the zone, if the id is mapped
     */
    public Optional<Zone> resolve(String externalId) {
        return Optional.ofNullable(byExternalId.get(externalId));
    }

    /**
     * @param externalId the feed zone id
     * @return {@code true} if observations in this zone are dropped silently
     */
    public boolean isSuppressed(String externalId) {
        return suppressed.contains(externalId);
    }

    /**
     * @return the number of mapped feed ids
     */
    public int size() {
        return byExternalId.size();
    }
}
