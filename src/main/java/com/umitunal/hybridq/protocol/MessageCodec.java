package com.umitunal.hybridq.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;
import com.umitunal.hybridq.serialization.JsonCodec;

import java.io.IOException;

/**
 * Maps requests, responses and notify payloads to JSON documents.
 *
 * Request decoding distinguishes two failures: a document whose kind cannot be identified is a
 * PROTOCOL_ERROR and ends the connection, while a document of a known kind with bad fields is an
 * INVALID_REQUEST that the daemon answers with an error response.
 */
public class MessageCodec {
    private final ObjectMapper mapper;
    private final JsonCodec<Request> requests;
    private final JsonCodec<Response> responses;
    private final JsonCodec<NotifyPayload> notifications;

    public MessageCodec() {
        this(JsonCodec.createDefaultMapper());
    }

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
        this.requests = new JsonCodec<>(Request.class, mapper);
        this.responses = new JsonCodec<>(Response.class, mapper);
        this.notifications = new JsonCodec<>(NotifyPayload.class, mapper);
    }

    public byte[] encodeRequest(Request request) {
        return requests.encode(request);
    }

    public Request decodeRequest(byte[] bytes) throws HybridQueueException {
        JsonNode tree;
        try {
            tree = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new HybridQueueException(ErrorKind.PROTOCOL_ERROR, "Malformed request document", e);
        }
        if (tree == null || !tree.isObject()) {
            throw new HybridQueueException(ErrorKind.PROTOCOL_ERROR, "Request document is not a JSON object");
        }

        JsonNode type = tree.get("type");
        if (type == null || !type.isTextual() || !Request.TYPE_NAMES.contains(type.asText())) {
            throw new HybridQueueException(ErrorKind.PROTOCOL_ERROR, "Unknown request type: " + type);
        }

        try {
            return mapper.treeToValue(tree, Request.class);
        } catch (JsonProcessingException e) {
            throw new HybridQueueException(ErrorKind.INVALID_REQUEST,
                    "Invalid " + type.asText() + " request: " + e.getOriginalMessage(), e);
        }
    }

    public byte[] encodeResponse(Response response) {
        return responses.encode(response);
    }

    public Response decodeResponse(byte[] bytes) throws HybridQueueException {
        return responses.decode(bytes);
    }

    public byte[] encodeNotify(NotifyPayload payload) {
        return notifications.encode(payload);
    }

    public NotifyPayload decodeNotify(byte[] bytes) throws HybridQueueException {
        return notifications.decode(bytes);
    }
}
