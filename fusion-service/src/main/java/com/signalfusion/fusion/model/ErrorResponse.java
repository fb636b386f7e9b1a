package com.signalfusion.fusion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param field request field at fault; omitted when the error is not tied to one field
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("component") String component,
    @JsonProperty("field") String field
) {}
