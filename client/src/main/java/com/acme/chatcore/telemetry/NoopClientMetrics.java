package com.acme.chatcore.telemetry;

public final class NoopClientMetrics implements ClientMetrics {
    public static final NoopClientMetrics INSTANCE = new NoopClientMetrics();

    private NoopClientMetrics() {
    }

    @Override
    public void incRequests(long n) {
    }

    @Override
    public void incResponses(long n, int status) {
    }

    @Override
    public void incRateLimited(boolean global) {
    }

    @Override
    public void observeGateWaitNanos(long nanos) {
    }

    @Override
    public void incIdentifies(int shardId) {
    }

    @Override
    public void incResumes(int shardId) {
    }

    @Override
    public void incReconnects(int shardId) {
    }

    @Override
    public void incFatalDisconnects(int closeCode) {
    }
}
