package com.company.watchdog.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Checker {
    private String name;
    private QueryDetails queryDetails;
    private List<Requirement> requirements;
    private Map<String, Object> extraConfig;
}
