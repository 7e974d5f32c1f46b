package com.admissioncontrol.client;

import com.admissioncontrol.queue.CallOutcome;
import com.admissioncontrol.queue.QueueEntry;
import com.admissioncontrol.queue.RequestHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Runs queued {@link OutboundRequest} payloads through {@link GovernedHttpClient#send}.
 * The queue has already checked the circuit and taken the permit.
 */
public class OutboundRequestHandler implements RequestHandler {

    private final GovernedHttpClient client;
    private final ObjectMapper objectMapper;

    public OutboundRequestHandler(GovernedHttpClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public CallOutcome handle(QueueEntry entry) {
        OutboundRequest request;
        try {
            request = objectMapper.treeToValue(entry.getPayload(), OutboundRequest.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return CallOutcome.fatal("Payload is not an outbound request: " + e.getMessage());
        }
        if (request == null || request.getUrl() == null) {
            return CallOutcome.fatal("Payload has no url");
        }
        return client.send(request);
    }
}
