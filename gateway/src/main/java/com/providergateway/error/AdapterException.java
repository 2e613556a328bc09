package com.providergateway.error;

/**
 * Failure raised inside an adapter, before the dispatcher attaches request context.
 */
public class AdapterException extends GatewayException {

    public AdapterException(ErrorKind kind, String detail) {
        super(kind, detail);
    }

    public AdapterException(ErrorKind kind, String detail, Throwable cause) {
        super(kind, detail, cause);
    }

    public static AdapterException timeout(String detail) {
        return new AdapterException(ErrorKind.TIMEOUT, detail);
    }

    public static AdapterException upstream(String detail) {
        return new AdapterException(ErrorKind.UPSTREAM_ERROR, detail);
    }

    public static AdapterException malformed(String detail, Throwable cause) {
        return new AdapterException(ErrorKind.MALFORMED_UPSTREAM_RESPONSE, detail, cause);
    }
}
