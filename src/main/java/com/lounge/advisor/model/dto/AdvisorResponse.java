package com.lounge.advisor.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lounge.advisor.exception.ErrorKind;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Uniform envelope returned by every public advisor operation.
 * <p>
 * {@code status} is one of {@code success}, {@code not_found} or {@code error}.
 * Data is present only on success; error details only on failure.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AdvisorResponse<T> {

    public static final String SUCCESS = "success";
    public static final String NOT_FOUND = "not_found";
    public static final String ERROR = "error";

    private String status;
    private T data;
    private ErrorDetail error;
    private Instant timestamp = Instant.now();

    public static <T> AdvisorResponse<T> success(T data) {
        AdvisorResponse<T> response = new AdvisorResponse<>();
        response.setStatus(SUCCESS);
        response.setData(data);
        return response;
    }

    public static <T> AdvisorResponse<T> notFound(String message) {
        AdvisorResponse<T> response = new AdvisorResponse<>();
        response.setStatus(NOT_FOUND);
        response.setError(new ErrorDetail(ErrorKind.NOT_FOUND, message, null));
        return response;
    }

    public static <T> AdvisorResponse<T> error(ErrorKind kind, String message, Integer providerStatus) {
        AdvisorResponse<T> response = new AdvisorResponse<>();
        response.setStatus(ERROR);
        response.setError(new ErrorDetail(kind, message, providerStatus));
        return response;
    }
}
