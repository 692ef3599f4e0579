package com.xksgroup.downloadtracker.model.download;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Library metadata attached to a download. Written only by the media matcher.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaMatch {
    private String mediaTitle;
    private MediaType mediaType;
    private Integer year;

    // Single values, never lists
    private Integer season;
    private Integer episode;

    private String posterUrl;
    private String sourceInstance;
    private int matchScore;
}
