package com.bageldb.client.error;

/**
 * Thrown when the backend breaks its pagination contract, e.g. page 1 comes
 * back without a usable {@code item-count} header.
 */
public class ProtocolContractException extends CollectionClientException {

    public ProtocolContractException(String message) {
        super(message);
    }

    public ProtocolContractException(String message, Throwable cause) {
        super(message, cause);
    }
}
