package com.xksgroup.downloadtracker.model.library;

import com.xksgroup.downloadtracker.model.download.MediaType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LibraryCandidate {
    String title;
    Integer year;
    MediaType type;
    String posterUrl;
}
