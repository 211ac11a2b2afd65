package org.neuralchilli.planner.api;

public record ErrorView(int status, String error, String message) {
}
