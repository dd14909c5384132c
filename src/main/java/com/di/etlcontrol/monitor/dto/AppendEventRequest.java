package com.di.etlcontrol.monitor.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of POST /api/events. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppendEventRequest {

    @NotBlank
    private String target;

    @NotBlank
    private String step;

    @NotBlank
    private String event;
}
