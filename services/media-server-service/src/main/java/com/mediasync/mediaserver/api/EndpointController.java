package com.mediasync.mediaserver.api;

import com.mediasync.common.refresh.queue.CoalescingRefreshQueue;
import com.mediasync.common.refresh.queue.DrainResult;
import com.mediasync.mediaserver.api.dto.EndpointResponse;
import com.mediasync.mediaserver.api.dto.ErrorResponse;
import com.mediasync.mediaserver.api.dto.TestResponse;
import com.mediasync.mediaserver.application.LibraryRefreshScheduler;
import com.mediasync.mediaserver.application.LibraryUpdateService;
import com.mediasync.mediaserver.application.ValidationFailure;
import com.mediasync.mediaserver.client.MediaServerException;
import com.mediasync.mediaserver.domain.Series;
import com.mediasync.mediaserver.endpoint.EndpointRegistry;
import com.mediasync.mediaserver.endpoint.MediaServerEndpoint;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/endpoints")
public class EndpointController {

    private final EndpointRegistry endpoints;
    private final CoalescingRefreshQueue<MediaServerEndpoint, Series> queue;
    private final LibraryRefreshScheduler scheduler;
    private final LibraryUpdateService libraryUpdateService;

    public EndpointController(EndpointRegistry endpoints,
                              CoalescingRefreshQueue<MediaServerEndpoint, Series> queue,
                              LibraryRefreshScheduler scheduler,
                              LibraryUpdateService libraryUpdateService) {
        this.endpoints = endpoints;
        this.queue = queue;
        this.scheduler = scheduler;
        this.libraryUpdateService = libraryUpdateService;
    }

    @GetMapping
    public ResponseEntity<List<EndpointResponse>> list() {
        return ResponseEntity.ok(endpoints.all().stream().map(this::toResponse).toList());
    }

    @PostMapping("/{name}/test")
    public ResponseEntity<TestResponse> test(@PathVariable("name") String name) {
        Optional<MediaServerEndpoint> endpoint = endpoints.find(name);
        if (endpoint.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        List<ValidationFailure> failures = libraryUpdateService.test(endpoint.get());
        return ResponseEntity.ok(new TestResponse(failures.isEmpty(), failures));
    }

    @PostMapping("/{name}/refresh")
    public ResponseEntity<?> refresh(@PathVariable("name") String name) {
        Optional<MediaServerEndpoint> endpoint = endpoints.find(name);
        if (endpoint.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        try {
            DrainResult result = scheduler.processQueue(endpoint.get());
            return ResponseEntity.ok(result);
        } catch (MediaServerException e) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(new ErrorResponse("media_server_error", e.getMessage()));
        }
    }

    private EndpointResponse toResponse(MediaServerEndpoint endpoint) {
        return new EndpointResponse(
                endpoint.name(),
                endpoint.key(),
                endpoint.baseUrl(),
                endpoint.updateLibrary(),
                queue.pendingCount(endpoint),
                queue.isDraining(endpoint)
        );
    }
}
