package com.scholary.codeindex.api;

/** Error body returned by the indexing API. */
public record ErrorResponse(String error, String message) {}
