package com.providergateway.adapter.process;

import com.providergateway.error.AdapterException;
import com.providergateway.error.ErrorKind;

/**
 * The execution environment could not be set up: working directory, container
 * runtime, image, or the process launch itself.
 */
public class SandboxException extends AdapterException {

    public SandboxException(String detail) {
        super(ErrorKind.SANDBOX_FAILURE, detail);
    }

    public SandboxException(String detail, Throwable cause) {
        super(ErrorKind.SANDBOX_FAILURE, detail, cause);
    }
}
