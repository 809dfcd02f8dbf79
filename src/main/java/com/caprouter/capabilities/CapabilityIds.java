package com.caprouter.capabilities;

/**
 * Capability ids the router refers to by name.
 */
public final class CapabilityIds {
    public static final String CHAT_GENERAL = "chat_general";
    public static final String GET_CURRENT_DATETIME = "get_current_datetime";
    public static final String WEB_SEARCH_GENERAL = "web_search_general";
    public static final String WEB_SEARCH_NEWS = "web_search_news";
    public static final String REMINDER_CREATE = "reminder_create";
    public static final String REMINDER_LIST = "reminder_list";
    public static final String REMINDER_DELETE = "reminder_delete";
    public static final String MEMORY_STORE_USER_FACT = "memory_store_user_fact";
    public static final String MEMORY_STORE_SUMMARY = "memory_store_summary";
    public static final String MEMORY_RECALL_PROFILE = "memory_recall_profile";
    public static final String MEMORY_RETRIEVAL = "memory_retrieval";
    public static final String MEMORY_UPDATE_USER_FACT = "memory_update_user_fact";
    public static final String MEMORY_DELETE_USER_FACT = "memory_delete_user_fact";
    public static final String MEMORY_PURGE_ALL = "memory_purge_all";

    private CapabilityIds() {
    }
}
