package com.mediasync.mediaserver.api;

import com.mediasync.mediaserver.api.dto.ErrorResponse;
import com.mediasync.mediaserver.application.ActionResult;
import com.mediasync.mediaserver.application.NotifierActionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/actions")
public class ActionController {

    private final NotifierActionService actionService;

    public ActionController(NotifierActionService actionService) {
        this.actionService = actionService;
    }

    @RequestMapping(value = "/{action}", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<?> requestAction(@PathVariable("action") String action,
                                           @RequestParam Map<String, String> query) {
        ActionResult result = actionService.requestAction(action, query);
        return switch (result.status()) {
            case OK -> ResponseEntity.ok(result.body());
            case INVALID_REQUEST -> ResponseEntity.badRequest()
                    .body(new ErrorResponse("invalid_request", result.message()));
            case CONFIGURATION_ERROR -> ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(new ErrorResponse("configuration_error", result.message()));
            case UPSTREAM_ERROR -> ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(new ErrorResponse("upstream_error", result.message()));
        };
    }
}
