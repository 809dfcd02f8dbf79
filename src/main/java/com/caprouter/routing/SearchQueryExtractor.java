package com.caprouter.routing;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a web-search query out of a Spanish user message.
 */
public final class SearchQueryExtractor {

    private static final List<Pattern> SEARCH_PATTERNS = List.of(
        RoutingPatterns.compile(
            "(?:puedes\\s+|podrias\\s+|podrías\\s+|me\\s+)?"
                + "(?:buscar|busca|buscame|búscame|investiga|consulta|averigua)"
                + "(?:\\s+en\\s+(?:la\\s+)?(?:web|internet|google))?"
                + "(?:\\s+sobre)?\\s+(.+)"),
        RoutingPatterns.compile("(?:que\\s*noticias|noticias\\s*(?:sobre|de)|ultimas\\s*noticias)\\s+(.+)"),
        RoutingPatterns.compile("(?:que\\s*(?:es|son|significa)|quien\\s*es|donde\\s*(?:queda|esta))\\s+(.+)"),
        RoutingPatterns.compile("(?:cuanto\\s*(?:cuesta|vale))\\s+(.+)"),
        RoutingPatterns.compile("(?:precio|cotizaci[oó]n|cotizacion|valor)(?:\\s+actual)?(?:\\s+(?:de|del))?\\s+(.+)"),
        RoutingPatterns.compile("(.+?)\\s+(?:precio|cotizaci[oó]n|cotizacion|valor)(?:\\s+actual)?\\b")
    );

    private static final Set<String> INVALID_QUERIES = Set.of("actual", "hoy", "ahora", "de", "del");

    private static final Pattern POLITE_PREFIX =
        RoutingPatterns.compile("^(puedes|podrias|podr[ií]as|me\\s+puedes|me\\s+podr[ií]as)\\s+");
    private static final Pattern SEARCH_VERB_PREFIX =
        RoutingPatterns.compile("^(buscar|busca|investiga|consulta|averigua|googlea)\\s+");

    private SearchQueryExtractor() {
    }

    /**
     * Returns the lower-cased query the message asks to look up, or null when it does not
     * read as a search request.
     */
    public static String extract(String text) {
        if (text == null) {
            return null;
        }
        String lowered = RoutingPatterns.trimEdges(text.toLowerCase(Locale.ROOT).trim());
        for (Pattern pattern : SEARCH_PATTERNS) {
            Matcher matcher = pattern.matcher(lowered);
            if (matcher.find()) {
                String query = RoutingPatterns.trimEdges(matcher.group(1).trim());
                if (!query.isEmpty() && !INVALID_QUERIES.contains(query)) {
                    return query;
                }
            }
        }
        return null;
    }

    /**
     * Fallback query: the message minus polite openers and leading search verbs.
     */
    public static String normalize(String message) {
        String cleaned = message == null ? "" : message.trim();
        cleaned = POLITE_PREFIX.matcher(cleaned).replaceFirst("");
        cleaned = SEARCH_VERB_PREFIX.matcher(cleaned).replaceFirst("");
        return RoutingPatterns.trimEdges(cleaned.trim());
    }
}
