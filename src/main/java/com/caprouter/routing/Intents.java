package com.caprouter.routing;

import com.caprouter.capabilities.CapabilityIds;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed intent vocabulary, accepted synonyms, and the capability each intent should lead with.
 */
public final class Intents {
    public static final String GENERAL_CHAT = "general_chat";
    public static final String WEB_SEARCH = "web_search";
    public static final String TIME_SENSITIVE_ANSWER = "time_sensitive_answer";
    public static final String REMINDER_MANAGEMENT = "reminder_management";
    public static final String MEMORY_STORE = "memory_store";
    public static final String MEMORY_RECALL = "memory_recall";
    public static final String MEMORY_UPDATE = "memory_update";
    public static final String MEMORY_DELETE = "memory_delete";
    public static final String MEMORY_PURGE = "memory_purge";

    public static final List<String> ALL = List.of(
        GENERAL_CHAT,
        WEB_SEARCH,
        TIME_SENSITIVE_ANSWER,
        REMINDER_MANAGEMENT,
        MEMORY_STORE,
        MEMORY_RECALL,
        MEMORY_UPDATE,
        MEMORY_DELETE,
        MEMORY_PURGE
    );

    private static final Map<String, String> ALIASES = Map.of(
        "memory_edit", MEMORY_UPDATE,
        "memory_forget", MEMORY_DELETE,
        "memory_wipe", MEMORY_PURGE,
        "memory_reset", MEMORY_PURGE
    );

    private static final Map<String, String> PRIMARY_TOOLS = Map.of(
        WEB_SEARCH, CapabilityIds.WEB_SEARCH_GENERAL,
        MEMORY_STORE, CapabilityIds.MEMORY_STORE_USER_FACT,
        MEMORY_RECALL, CapabilityIds.MEMORY_RECALL_PROFILE,
        MEMORY_UPDATE, CapabilityIds.MEMORY_UPDATE_USER_FACT,
        MEMORY_DELETE, CapabilityIds.MEMORY_DELETE_USER_FACT,
        MEMORY_PURGE, CapabilityIds.MEMORY_PURGE_ALL
    );

    private Intents() {
    }

    public static boolean isKnown(String intent) {
        return intent != null && ALL.contains(intent);
    }

    /**
     * Maps synonyms onto the vocabulary. Anything still unrecognised becomes general_chat.
     */
    public static String canonicalize(String intent) {
        if (intent == null || intent.isBlank()) {
            return GENERAL_CHAT;
        }
        String key = intent.trim().toLowerCase(Locale.ROOT);
        String canonical = ALIASES.getOrDefault(key, key);
        return isKnown(canonical) ? canonical : GENERAL_CHAT;
    }

    /**
     * Capability that should lead the candidate list for this intent, or null.
     */
    public static String primaryTool(String intent) {
        return intent != null ? PRIMARY_TOOLS.get(intent) : null;
    }
}
