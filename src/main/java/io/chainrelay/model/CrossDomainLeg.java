package io.chainrelay.model;

/**
 * Source and destination settlement domains of an intent that moves value between them,
 * together with the provider the caller asked for.
 */
public record CrossDomainLeg(String source, String destination, String provider) {
}
