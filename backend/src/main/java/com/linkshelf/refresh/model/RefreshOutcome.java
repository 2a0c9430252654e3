package com.linkshelf.refresh.model;

public record RefreshOutcome(
    Kind kind,
    MetadataDelta delta,
    FailureSource source,
    String reason
) {
    public enum Kind {
        SUCCESS,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE
    }

    public static RefreshOutcome success(MetadataDelta delta) {
        return new RefreshOutcome(Kind.SUCCESS, delta == null ? MetadataDelta.empty() : delta, null, null);
    }

    public static RefreshOutcome transientFailure(FailureSource source, String reason) {
        return new RefreshOutcome(Kind.TRANSIENT_FAILURE, MetadataDelta.empty(), source, reason);
    }

    public static RefreshOutcome permanentFailure(FailureSource source, String reason) {
        return new RefreshOutcome(Kind.PERMANENT_FAILURE, MetadataDelta.empty(), source, reason);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }
}
