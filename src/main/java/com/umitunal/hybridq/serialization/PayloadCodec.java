package com.umitunal.hybridq.serialization;

import com.umitunal.hybridq.core.HybridQueueException;

/**
 * Interface for encoding and decoding wire documents.
 *
 * @param <T> the type of document
 */
public interface PayloadCodec<T> {

    /**
     * Encode a document to bytes.
     */
    byte[] encode(T payload);

    /**
     * Decode bytes to a document.
     *
     * @throws HybridQueueException PROTOCOL_ERROR if the bytes are not a valid document
     */
    T decode(byte[] bytes) throws HybridQueueException;
}
