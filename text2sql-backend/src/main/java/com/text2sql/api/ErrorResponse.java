package com.text2sql.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;
import org.slf4j.MDC;

/**
 * Body of non-200 responses: malformed or invalid requests and unexpected server errors.
 *
 * <p>Pipeline failures are not reported this way; they travel inside {@link PipelineResult}.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ErrorResponse {

    static final String MDC_TRACE_ID = "trace_id";

    private String code;
    private String message;
    private String details;
    private String traceId;

    /**
     * Error body stamped with the trace id of the current request.
     *
     * @param code machine-readable code
     * @param message human-readable message
     * @param details optional details
     * @return error body
     */
    public static ErrorResponse of(String code, String message, String details) {
        return ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .traceId(MDC.get(MDC_TRACE_ID))
                .build();
    }
}
