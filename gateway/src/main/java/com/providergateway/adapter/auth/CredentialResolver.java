package com.providergateway.adapter.auth;

import com.providergateway.model.Provider;

/**
 * Looks up credential material when an adapter is built.
 */
public interface CredentialResolver {

    ProviderCredentials resolve(Provider provider);
}
