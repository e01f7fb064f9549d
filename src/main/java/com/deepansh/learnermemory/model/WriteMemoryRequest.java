package com.deepansh.learnermemory.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.Map;

@Data
public class WriteMemoryRequest {

    /** ephemeral | hypothesis | stable */
    @NotBlank(message = "layer must not be blank")
    private String layer;

    @NotBlank(message = "key must not be blank")
    private String key;

    @NotNull(message = "content is required")
    private Map<String, Object> content;

    /** low | medium | high; defaults to low */
    private String confidence;

    /** Only used for ephemeral memories. Defaults to memory.default-ttl-days. */
    @Positive(message = "ttlDays must be positive")
    private Integer ttlDays;

    /** Bring a resolved or expired memory back to life with this observation. */
    private boolean reactivate;
}
