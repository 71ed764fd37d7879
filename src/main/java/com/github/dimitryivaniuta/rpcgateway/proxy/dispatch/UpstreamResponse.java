package com.github.dimitryivaniuta.rpcgateway.proxy.dispatch;

/**
 * Answer of one upstream call, or the synthesized 502 when the call did not complete.
 */
public record UpstreamResponse(int status, String contentType, byte[] body, boolean transportFailure) {

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    /** Only complete 2xx answers may populate the cache. */
    public boolean cacheable() {
        return !transportFailure && isSuccessful();
    }
}
