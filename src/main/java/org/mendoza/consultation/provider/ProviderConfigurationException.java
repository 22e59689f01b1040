package org.mendoza.consultation.provider;

/**
 * The video provider cannot be called at all, e.g. credentials are missing.
 * Unlike {@link ProviderException} this is never retried.
 */
public class ProviderConfigurationException extends RuntimeException {

    public ProviderConfigurationException(String message) {
        super(message);
    }
}
