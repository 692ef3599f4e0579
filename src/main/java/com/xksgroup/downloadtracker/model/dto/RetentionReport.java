package com.xksgroup.downloadtracker.model.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RetentionReport {
    int removed;
    int kept;
    long retentionHours;

    // One line per removed record, for the log
    @Singular
    List<String> removedItems;
}
