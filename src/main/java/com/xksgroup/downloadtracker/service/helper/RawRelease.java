package com.xksgroup.downloadtracker.service.helper;

import java.util.List;

/**
 * Parser output before normalisation. A multi-episode file yields several
 * episodes, a season pack yields none.
 */
public record RawRelease(String title, Integer year, List<Integer> seasons, List<Integer> episodes) {

    public RawRelease {
        seasons = seasons == null ? List.of() : List.copyOf(seasons);
        episodes = episodes == null ? List.of() : List.copyOf(episodes);
    }
}
