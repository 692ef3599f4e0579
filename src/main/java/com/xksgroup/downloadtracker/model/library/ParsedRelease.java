package com.xksgroup.downloadtracker.model.library;

/**
 * Release name after parsing and normalisation. Season and episode are single
 * optional integers from this point on.
 */
public record ParsedRelease(String title, Integer year, Integer season, Integer episode) {

    public boolean hasEpisode() {
        return episode != null;
    }
}
