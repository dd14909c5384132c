package com.di.etlcontrol.monitor.dto;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of POST /api/indices/{name}/advance; the body may be omitted to advance by one. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AdvanceRequest {

    @PositiveOrZero
    private Long delta = 1L;
}
