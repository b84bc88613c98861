package com.text2sql.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryRequest {

    @NotBlank
    private String question;

    /**
     * Optional customer scope; the {@code X-Customer-Id} header is used when absent.
     */
    private String customerId;
}
