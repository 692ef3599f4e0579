package com.xksgroup.downloadtracker.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatsDto {
    private long downloading;
    private long queued;
    private long completed;
    private long failed;
    // MB/s across downloading records, two decimals
    private double totalSpeed;
}
