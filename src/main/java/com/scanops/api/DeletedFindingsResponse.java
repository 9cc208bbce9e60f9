package com.scanops.api;

public record DeletedFindingsResponse(String tool, int deleted) {
}
