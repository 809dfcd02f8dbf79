package com.caprouter.capabilities;

import com.caprouter.AppLogger;
import com.caprouter.models.CapabilityDefinition;
import com.caprouter.models.CapabilityRegistryFile;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Versioned catalog of capability definitions loaded from a YAML document.
 * <p>
 * Every read path is filtered through the attached {@link ProductScope}, if any: an id
 * that exists but is out of scope looks exactly like an id that does not exist.
 * Each {@link #reload()} swaps in a complete new snapshot; a missing or invalid document
 * produces an empty one.
 */
public class CapabilityRegistry {

    private final Path registryPath;
    private final ProductScope productScope;
    private final ObjectMapper yamlMapper;
    private final AppLogger logger;
    private volatile RegistrySnapshot snapshot = RegistrySnapshot.empty();

    public CapabilityRegistry(Path registryPath, ProductScope productScope) {
        this(registryPath, productScope, new ObjectMapper(new YAMLFactory()));
    }

    public CapabilityRegistry(Path registryPath, ProductScope productScope, ObjectMapper yamlMapper) {
        if (registryPath == null) {
            throw new IllegalArgumentException("Capability registry path is required");
        }
        this.registryPath = registryPath;
        this.productScope = productScope;
        this.yamlMapper = yamlMapper != null ? yamlMapper : new ObjectMapper(new YAMLFactory());
        this.logger = AppLogger.get();
        reload();
    }

    public void reload() {
        if (!Files.exists(registryPath)) {
            if (logger != null) {
                logger.warn("Capability registry not found: " + registryPath);
            }
            snapshot = RegistrySnapshot.empty();
            return;
        }

        CapabilityRegistryFile file;
        try {
            file = yamlMapper.readValue(registryPath.toFile(), CapabilityRegistryFile.class);
        } catch (IOException e) {
            if (logger != null) {
                logger.error("Invalid capability registry " + registryPath + ": " + e.getMessage());
            }
            snapshot = RegistrySnapshot.empty();
            return;
        }

        String error = validate(file);
        if (error != null) {
            if (logger != null) {
                logger.error("Invalid capability registry " + registryPath + ": " + error);
            }
            snapshot = RegistrySnapshot.empty();
            return;
        }

        Map<String, CapabilityDefinition> capabilities = new LinkedHashMap<>();
        for (CapabilityDefinition capability : file.getCapabilities()) {
            if (capabilities.containsKey(capability.getId())) {
                if (logger != null) {
                    logger.warn("Duplicate capability ignored: " + capability.getId());
                }
                continue;
            }
            capabilities.put(capability.getId(), capability);
        }

        snapshot = new RegistrySnapshot(file.getVersion(), file.getUpdatedAt(), capabilities);
        if (logger != null) {
            logger.info("Capability registry loaded with " + capabilities.size() + " capabilities (version "
                + file.getVersion() + ").");
        }
    }

    static String validate(CapabilityRegistryFile file) {
        if (file == null) {
            return "empty-document";
        }
        if (file.getVersion() == null) {
            return "missing-required:version";
        }
        if (file.getUpdatedAt() == null) {
            return "missing-required:updated_at";
        }
        if (file.getCapabilities() == null) {
            return "missing-required:capabilities";
        }
        int index = 0;
        for (CapabilityDefinition capability : file.getCapabilities()) {
            String prefix = "capabilities[" + index + "].";
            if (capability == null) {
                return "invalid-entry:capabilities[" + index + "]";
            }
            if (capability.getId() == null || capability.getId().isBlank()) {
                return "missing-required:" + prefix + "id";
            }
            if (capability.getPhase() == null) {
                return "missing-required:" + prefix + "phase";
            }
            if (capability.getPhase() < 1) {
                return "out-of-range:" + prefix + "phase";
            }
            if (capability.getProvider() == null) {
                return "missing-required:" + prefix + "provider";
            }
            if (capability.getSummary() == null) {
                return "missing-required:" + prefix + "summary";
            }
            if (capability.getInputSchema() == null) {
                return "missing-required:" + prefix + "input_schema";
            }
            if (capability.getOutputSchema() == null) {
                return "missing-required:" + prefix + "output_schema";
            }
            index++;
        }
        return null;
    }

    /**
     * Returns a copy of the definition, or null when the id is unknown or denied by scope.
     */
    public CapabilityDefinition get(String capabilityId) {
        CapabilityDefinition capability = lookup(capabilityId);
        return capability != null ? capability.copy() : null;
    }

    private CapabilityDefinition lookup(String capabilityId) {
        if (capabilityId == null) {
            return null;
        }
        CapabilityDefinition capability = snapshot.capabilities.get(capabilityId);
        if (capability == null) {
            return null;
        }
        if (productScope != null && !productScope.isAllowed(capabilityId)) {
            return null;
        }
        return capability;
    }

    public boolean has(String capabilityId) {
        return lookup(capabilityId) != null;
    }

    public List<String> allIds() {
        List<String> ids = new ArrayList<>();
        for (String id : snapshot.capabilities.keySet()) {
            if (productScope == null || productScope.isAllowed(id)) {
                ids.add(id);
            }
        }
        return ids;
    }

    /**
     * Primary capability followed by its resolvable fallbacks, deduplicated in first-seen order.
     * Returns an empty list when the primary itself does not resolve.
     */
    public List<String> resolveChain(String primaryCapability) {
        List<String> chain = new ArrayList<>();
        CapabilityDefinition first = lookup(primaryCapability);
        if (first == null) {
            return chain;
        }
        chain.add(primaryCapability);
        Set<String> seen = new HashSet<>();
        seen.add(primaryCapability);
        for (String fallbackId : first.getFallbackTo()) {
            if (fallbackId == null || seen.contains(fallbackId)) {
                continue;
            }
            if (lookup(fallbackId) != null) {
                chain.add(fallbackId);
                seen.add(fallbackId);
            }
        }
        return chain;
    }

    /**
     * Startup audit: scope ids with no definition, and definitions outside the scope.
     */
    public ScopeConsistency ensureScopeConsistency() {
        if (productScope == null) {
            return new ScopeConsistency(Collections.emptySet(), Collections.emptySet());
        }
        Set<String> registryIds = snapshot.capabilities.keySet();
        Set<String> scopeIds = productScope.getCapabilities();

        Set<String> missingInRegistry = new TreeSet<>(scopeIds);
        missingInRegistry.removeAll(registryIds);
        Set<String> missingInScope = new TreeSet<>(registryIds);
        missingInScope.removeAll(scopeIds);
        return new ScopeConsistency(missingInRegistry, missingInScope);
    }

    public int getVersion() {
        return snapshot.version;
    }

    public String getUpdatedAt() {
        return snapshot.updatedAt;
    }

    public int size() {
        return snapshot.capabilities.size();
    }

    private static final class RegistrySnapshot {
        private final int version;
        private final String updatedAt;
        private final Map<String, CapabilityDefinition> capabilities;

        private RegistrySnapshot(int version, String updatedAt, Map<String, CapabilityDefinition> capabilities) {
            this.version = version;
            this.updatedAt = updatedAt != null ? updatedAt : "";
            this.capabilities = Collections.unmodifiableMap(new LinkedHashMap<>(capabilities));
        }

        private static RegistrySnapshot empty() {
            return new RegistrySnapshot(0, "", Collections.emptyMap());
        }
    }
}
