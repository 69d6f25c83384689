/*
 * Where: Directory API
 * What: common error body {"code": ..., "message": ...}
 */
package com.phonebook.directory.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ApiErrorResponse(ApiErrorCode code, String message) {}
