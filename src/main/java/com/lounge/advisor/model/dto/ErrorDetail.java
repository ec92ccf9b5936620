package com.lounge.advisor.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lounge.advisor.exception.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorDetail {
    private ErrorKind kind;
    private String message;

    // HTTP status reported by the flight data provider, when there was one
    private Integer providerStatus;
}
