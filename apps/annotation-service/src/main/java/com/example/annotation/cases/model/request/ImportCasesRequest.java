package com.example.annotation.cases.model.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Batch import. Cases without a label are named {@code Case_<n>} by position, starting at 1.
 */
public record ImportCasesRequest(
        @NotBlank @Size(max = 128) String batchId,
        @NotEmpty @Size(max = 500) List<@Valid CaseRequest> cases
) {}
