package com.poolradar.domain;

/**
 * Optional body of a non-2xx API response.
 */
public record ApiErrorBody(String error, String message) {
}
