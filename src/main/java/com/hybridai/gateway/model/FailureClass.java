package com.hybridai.gateway.model;

/**
 * Why a provider attempt did not produce a usable response.
 */
public enum FailureClass {

    /** Provider never initialised: missing credential, disabled, or client construction failed. */
    UNAVAILABLE,

    /** Vendor rejected the request for quota or throttling reasons (HTTP 429 or a rate-limit marker). */
    RATE_LIMITED,

    /** Anything else: auth error, malformed request, network fault, timeout, empty response. */
    OTHER
}
