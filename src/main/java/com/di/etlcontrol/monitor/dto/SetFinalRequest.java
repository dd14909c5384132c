package com.di.etlcontrol.monitor.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of PUT /api/indices/{name}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SetFinalRequest {

    @NotNull
    @PositiveOrZero
    @JsonProperty("final")
    private Long finalIndex;
}
