package io.chainrelay.runtime;

public record PlanStep(int sequence, String name, String detail) {
}
