package com.umitunal.hybridq.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A client request. The {@code type} property names the concrete kind on the wire.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SubmitRequest.class, name = "submit"),
        @JsonSubTypes.Type(value = QueueStatusRequest.class, name = "queue_status"),
        @JsonSubTypes.Type(value = RemoveRequest.class, name = "remove"),
        @JsonSubTypes.Type(value = KillRequest.class, name = "kill"),
        @JsonSubTypes.Type(value = QueueStateRequest.class, name = "queue_state"),
        @JsonSubTypes.Type(value = SetQueueStateRequest.class, name = "set_queue_state")
})
public abstract class Request {

    /**
     * Type names accepted in the {@code type} property.
     */
    public static final Set<String> TYPE_NAMES = Arrays.stream(Request.class.getAnnotation(JsonSubTypes.class).value())
            .map(JsonSubTypes.Type::name)
            .collect(Collectors.toUnmodifiableSet());
}
