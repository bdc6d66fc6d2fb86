package com.mediasync.mediaserver.api;

import com.mediasync.mediaserver.api.dto.SeriesChangedRequest;
import com.mediasync.mediaserver.application.MediaServerNotifier;
import com.mediasync.mediaserver.domain.Series;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/notifications")
public class InternalNotificationController {

    private final MediaServerNotifier notifier;

    public InternalNotificationController(MediaServerNotifier notifier) {
        this.notifier = notifier;
    }

    @PostMapping("/download")
    public ResponseEntity<Void> onDownload(@Valid @RequestBody SeriesChangedRequest request) {
        notifier.onDownload(toSeries(request));
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/rename")
    public ResponseEntity<Void> onRename(@Valid @RequestBody SeriesChangedRequest request) {
        notifier.onRename(toSeries(request));
        return ResponseEntity.accepted().build();
    }

    private Series toSeries(SeriesChangedRequest request) {
        return new Series(request.seriesId(), request.tvdbId(), request.title(), request.path());
    }
}
