package com.fareradar.client.http;

public record BackendResponse(int statusCode, String body) {}
