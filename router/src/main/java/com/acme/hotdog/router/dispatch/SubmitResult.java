package com.acme.hotdog.router.dispatch;

public sealed interface SubmitResult permits SubmitResult.Accepted, SubmitResult.Rejected {
    record Accepted(long seq, int depth) implements SubmitResult {}
    record Rejected(RejectReason reason) implements SubmitResult {}
}
