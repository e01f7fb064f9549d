package com.deepansh.learnermemory.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ValidateHypothesisRequest {

    /** validated | rejected */
    @NotBlank(message = "outcome must not be blank")
    private String outcome;
}
