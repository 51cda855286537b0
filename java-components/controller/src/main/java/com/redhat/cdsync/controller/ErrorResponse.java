package com.redhat.cdsync.controller;

public record ErrorResponse(String kind, String message) {
}
