package com.xksgroup.downloadtracker.service.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.downloadtracker.config.TrackerProperties;
import com.xksgroup.downloadtracker.model.library.LibraryType;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LibraryRouter Tests")
class LibraryRouterTest {

    @Test
    @DisplayName("Should route each category to its configured instance")
    void testRoute() {
        TrackerProperties properties = new TrackerProperties();
        properties.getLibraries().add(library("radarr-main", LibraryType.RADARR, "movies"));
        properties.getLibraries().add(library("sonarr-main", LibraryType.SONARR, "tv"));

        LibraryRouter router = newRouter(properties);

        assertEquals("radarr-main", router.route("movies").orElseThrow().getName());
        assertEquals("sonarr-main", router.route(" tv ").orElseThrow().getName());
        assertTrue(router.route("music").isEmpty());
        assertTrue(router.route(null).isEmpty());
        assertEquals(2, router.getRoutes().size());
    }

    @Test
    @DisplayName("Should refuse two instances for the same category")
    void testDuplicateCategory() {
        TrackerProperties properties = new TrackerProperties();
        properties.getLibraries().add(library("sonarr-main", LibraryType.SONARR, "tv"));
        properties.getLibraries().add(library("sonarr-4k", LibraryType.SONARR, "tv"));

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> newRouter(properties));
        assertTrue(ex.getMessage().contains("sonarr-4k"));
    }

    @Test
    @DisplayName("Should ignore instances without a category")
    void testMissingCategory() {
        TrackerProperties properties = new TrackerProperties();
        properties.getLibraries().add(library("radarr-main", LibraryType.RADARR, " "));

        assertTrue(newRouter(properties).getRoutes().isEmpty());
    }

    private static LibraryRouter newRouter(TrackerProperties properties) {
        return new LibraryRouter(new OkHttpClient(), new ObjectMapper(), properties, 1, 0);
    }

    private static TrackerProperties.Library library(String name, LibraryType type, String category) {
        TrackerProperties.Library library = new TrackerProperties.Library();
        library.setName(name);
        library.setUrl("http://localhost:7878");
        library.setApiKey("key");
        library.setType(type);
        library.setCategory(category);
        return library;
    }
}
