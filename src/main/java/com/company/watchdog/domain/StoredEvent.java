package com.company.watchdog.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredEvent {
    private String checker;
    private String uniqueId;
    private Long timestamp;
}
