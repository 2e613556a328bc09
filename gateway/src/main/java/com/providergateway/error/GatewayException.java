package com.providergateway.error;

import lombok.Getter;

/**
 * A classified gateway failure. The message is operator detail and may contain
 * provider output; clients only ever see {@link #getPublicMessage()}.
 */
@Getter
public class GatewayException extends RuntimeException {

    private final ErrorKind kind;
    private final String providerId;
    private final String requestId;
    private final String publicMessage;

    public GatewayException(ErrorKind kind, String detail) {
        this(kind, detail, null, null, null, null);
    }

    public GatewayException(ErrorKind kind, String detail, Throwable cause) {
        this(kind, detail, null, null, null, cause);
    }

    public GatewayException(ErrorKind kind, String detail, String publicMessage,
                            String providerId, String requestId, Throwable cause) {
        super(detail, cause);
        this.kind = kind;
        this.publicMessage = publicMessage != null ? publicMessage : kind.getPublicMessage();
        this.providerId = providerId;
        this.requestId = requestId;
    }

    /**
     * Copy of this failure with provider and request context attached.
     */
    public GatewayException withContext(String providerId, String requestId) {
        return new GatewayException(kind, getMessage(), publicMessage,
                providerId != null ? providerId : this.providerId,
                requestId != null ? requestId : this.requestId,
                getCause() != null ? getCause() : this);
    }
}
