package io.chainrelay.policy;

public record PolicyViolation(String code, String field, String detail) {
}
