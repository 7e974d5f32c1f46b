package com.admissioncontrol.web;

import com.admissioncontrol.client.OutboundRequest;
import com.admissioncontrol.queue.QueueStatus;
import com.admissioncontrol.queue.RequestQueue;
import com.admissioncontrol.queue.RequestResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@RestController
@RequestMapping("/api/queue")
public class QueueController {

    private final RequestQueue requestQueue;

    public QueueController(RequestQueue requestQueue) {
        this.requestQueue = requestQueue;
    }

    /**
     * Queue an API call; poll {@code /requests/{id}} for the outcome.
     */
    @PostMapping("/requests")
    public ResponseEntity<Map<String, String>> enqueue(@RequestBody OutboundRequest request) {
        if (request.getUrl() == null || request.getUrl().isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        if (request.getMethod() == null || request.getMethod().isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        String id = requestQueue.submit(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("id", id));
    }

    @GetMapping("/requests/{id}")
    public RequestResult result(@PathVariable String id) {
        return requestQueue.findResult(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No result for request " + id));
    }

    @GetMapping("/status")
    public QueueStatus status() {
        return requestQueue.status();
    }
}
