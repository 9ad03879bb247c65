package com.deepansh.recall.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * Ad-hoc retrieval. Null tuning fields fall back to memory.retrieval.* defaults.
 */
@Data
public class RetrieveRequest {

    @NotBlank(message = "query must not be blank")
    private String query;

    @Positive
    private Integer topKEpisodes;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private Double minFactImportance;

    @DecimalMin(value = "0.0", inclusive = false) @DecimalMax("2.0")
    private Double maxDistance;
}
