package com.caprouter.routing;

import java.util.regex.Pattern;

/**
 * Detects relative time expressions ("hoy", "mañana", "este mes", "17:30") in Spanish user text.
 */
public final class TemporalReferences {

    private static final Pattern TEMPORAL_REFERENCE = Pattern.compile(
        "\\b("
            + "hoy|manana|mañana|pasado\\s+manana|pasado\\s+mañana|ayer|"
            + "actual|actualmente|ahora|esta\\s+semana|este\\s+mes|este\\s+ano|este\\s+año|"
            + "lunes|martes|miercoles|miércoles|jueves|viernes|sabado|sábado|domingo|"
            + "\\d{1,2}:\\d{2}|\\d{1,2}\\s*(?:am|pm)"
            + ")\\b",
        RoutingPatterns.FLAGS);

    private TemporalReferences() {
    }

    public static boolean hasTemporalReference(String text) {
        return text != null && TEMPORAL_REFERENCE.matcher(text).find();
    }
}
