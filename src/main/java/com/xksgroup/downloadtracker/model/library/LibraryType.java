package com.xksgroup.downloadtracker.model.library;

import com.xksgroup.downloadtracker.model.download.MediaType;

public enum LibraryType {
    RADARR("movie", MediaType.MOVIE),
    SONARR("series", MediaType.TV);

    private final String endpoint;
    private final MediaType mediaType;

    LibraryType(String endpoint, MediaType mediaType) {
        this.endpoint = endpoint;
        this.mediaType = mediaType;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public MediaType getMediaType() {
        return mediaType;
    }
}
