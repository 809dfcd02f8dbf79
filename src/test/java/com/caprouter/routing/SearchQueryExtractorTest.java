package com.caprouter.routing;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SearchQueryExtractorTest {

    @Test
    void extractsAfterSearchVerb() {
        assertEquals("vuelos baratos a lima", SearchQueryExtractor.extract("¿Puedes buscar vuelos baratos a Lima?"));
        assertEquals("recetas de paella", SearchQueryExtractor.extract("Busca en internet sobre recetas de paella"));
    }

    @Test
    void extractsDefinitionAndPriceQuestions() {
        assertEquals("la fotosíntesis", SearchQueryExtractor.extract("que es la fotosíntesis"));
        assertEquals("un iphone 15", SearchQueryExtractor.extract("¿Cuanto cuesta un iPhone 15?"));
        assertEquals("bitcoin", SearchQueryExtractor.extract("precio actual del bitcoin"));
        assertEquals("el dólar", SearchQueryExtractor.extract("el dólar cotización"));
    }

    @Test
    void rejectsBareTimeWords() {
        assertNull(SearchQueryExtractor.extract("precio de hoy"));
        assertNull(SearchQueryExtractor.extract("Hola, ¿cómo estás?"));
        assertNull(SearchQueryExtractor.extract(null));
    }

    @Test
    void normalizeStripsPoliteOpenersAndVerbs() {
        assertEquals("el tiempo en Madrid", SearchQueryExtractor.normalize("Puedes busca el tiempo en Madrid?"));
        assertEquals("", SearchQueryExtractor.normalize(null));
    }
}
