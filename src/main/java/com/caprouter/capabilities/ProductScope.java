package com.caprouter.capabilities;

import com.caprouter.AppLogger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Allow-list of capability ids a product configuration permits.
 * <p>
 * Ids are harvested lexically from a scope document: every inline-code token such as
 * {@code `web_search_general`} becomes an allowed id. A missing or unreadable document
 * yields an empty scope, which denies everything.
 */
public class ProductScope {

    private static final Pattern CAPABILITY_TOKEN = Pattern.compile("`([a-z0-9_]+)`");

    private final Path scopePath;
    private final AppLogger logger;
    private volatile Set<String> capabilities = Collections.emptySet();

    public ProductScope(Path scopePath) {
        if (scopePath == null) {
            throw new IllegalArgumentException("Scope document path is required");
        }
        this.scopePath = scopePath;
        this.logger = AppLogger.get();
        reload();
    }

    /**
     * Builds a scope from an explicit id set without reading any document.
     */
    public static ProductScope of(Collection<String> ids) {
        return new ProductScope(ids);
    }

    private ProductScope(Collection<String> ids) {
        this.scopePath = null;
        this.logger = AppLogger.get();
        Set<String> set = new HashSet<>();
        if (ids != null) {
            for (String id : ids) {
                if (id != null && !id.isBlank()) {
                    set.add(id.trim());
                }
            }
        }
        this.capabilities = Collections.unmodifiableSet(set);
    }

    public void reload() {
        if (scopePath == null) {
            return;
        }
        if (!Files.exists(scopePath)) {
            if (logger != null) {
                logger.warn("Product scope document not found: " + scopePath);
            }
            capabilities = Collections.emptySet();
            return;
        }
        String text;
        try {
            text = Files.readString(scopePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            if (logger != null) {
                logger.error("Failed to read product scope document " + scopePath + ": " + e.getMessage());
            }
            capabilities = Collections.emptySet();
            return;
        }
        capabilities = Collections.unmodifiableSet(extractCapabilityIds(text));
        if (logger != null) {
            logger.info("Product scope loaded with " + capabilities.size() + " capabilities.");
        }
    }

    static Set<String> extractCapabilityIds(String text) {
        Set<String> found = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return found;
        }
        Matcher matcher = CAPABILITY_TOKEN.matcher(text);
        while (matcher.find()) {
            String id = matcher.group(1).trim();
            if (!id.isEmpty()) {
                found.add(id);
            }
        }
        return found;
    }

    public boolean isAllowed(String capabilityId) {
        return capabilityId != null && capabilities.contains(capabilityId);
    }

    /**
     * Drops duplicates (first occurrence wins) and ids outside the scope, preserving order.
     */
    public List<String> filterAllowed(List<String> capabilityIds) {
        List<String> filtered = new ArrayList<>();
        if (capabilityIds == null) {
            return filtered;
        }
        Set<String> allowed = capabilities;
        Set<String> seen = new HashSet<>();
        for (String id : capabilityIds) {
            if (id == null || !seen.add(id)) {
                continue;
            }
            if (allowed.contains(id)) {
                filtered.add(id);
            }
        }
        return filtered;
    }

    public Set<String> getCapabilities() {
        return capabilities;
    }

}
