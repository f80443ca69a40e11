package com.starscape.tasktrack.features.deletetask.api.dto;

public record DeleteTaskResponse(String detail) {}
