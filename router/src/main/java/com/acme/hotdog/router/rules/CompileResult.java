package com.acme.hotdog.router.rules;

public sealed interface CompileResult permits CompileResult.Success, CompileResult.Failure {
    record Success(QueryPath path) implements CompileResult {}
    record Failure(String code, String message, int position) implements CompileResult {}
}
