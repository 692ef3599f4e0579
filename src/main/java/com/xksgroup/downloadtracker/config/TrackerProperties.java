package com.xksgroup.downloadtracker.config;

import com.xksgroup.downloadtracker.model.library.LibraryType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Connection details for the download controller and the library instances.
 * Timing knobs are read with {@code @Value} where they are used.
 */
@Data
@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {

    private Sabnzbd sabnzbd = new Sabnzbd();
    private List<Library> libraries = new ArrayList<>();

    @Data
    public static class Sabnzbd {
        private String url = "http://localhost:8080";
        private String apiKey = "";
        private int historyLimit = 100;

        public String normalizedUrl() {
            return trimTrailingSlash(url);
        }
    }

    @Data
    public static class Library {
        private String name;
        private String url;
        private String apiKey;
        private LibraryType type = LibraryType.RADARR;
        // Download category routed to this instance
        private String category;

        public String normalizedUrl() {
            return trimTrailingSlash(url);
        }
    }

    static String trimTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
