package com.mimecast.mailbuilder.codec;

import java.io.IOException;

/**
 * Invalid base64 or quoted-printable payload.
 */
public class TransferDecodeException extends IOException {

    /**
     * Constructs a new TransferDecodeException.
     *
     * @param message Error message.
     */
    public TransferDecodeException(String message) {
        super(message);
    }

    /**
     * Constructs a new TransferDecodeException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public TransferDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
