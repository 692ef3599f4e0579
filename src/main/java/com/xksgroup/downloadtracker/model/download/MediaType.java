package com.xksgroup.downloadtracker.model.download;

public enum MediaType {
    MOVIE,
    TV
}
