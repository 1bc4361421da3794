package org.carball.profiler.model.profile;

public record SuspiciousReason(ReasonCode code, String message) {
}
