package com.flagship.savings_circle.scheduling.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.scheduling.ScanTask;
import lombok.Value;

import java.time.LocalDate;
import java.util.Set;

/**
 * Both fields optional: {@code as_of} defaults to today (UTC), {@code tasks} to all of them.
 */
@Value
public class ScanRequest {

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("tasks")
    Set<ScanTask> tasks;
}
