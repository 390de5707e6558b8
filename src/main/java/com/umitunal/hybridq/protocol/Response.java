package com.umitunal.hybridq.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A daemon response. Every request is answered by exactly one response.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SubmitResponse.class, name = "submit"),
        @JsonSubTypes.Type(value = QueueStatusResponse.class, name = "queue_status"),
        @JsonSubTypes.Type(value = JobResponse.class, name = "job"),
        @JsonSubTypes.Type(value = AckResponse.class, name = "ack"),
        @JsonSubTypes.Type(value = QueueStateResponse.class, name = "queue_state"),
        @JsonSubTypes.Type(value = ErrorResponse.class, name = "error")
})
public abstract class Response {
}
