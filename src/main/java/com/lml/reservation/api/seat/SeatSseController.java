package com.lml.reservation.api.seat;

import com.lml.reservation.infra.sse.SeatSseHub;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/shows/{showId}/seats")
public class SeatSseController {

    private final SeatSseHub hub;

    public SeatSseController(SeatSseHub hub) {
        this.hub = hub;
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable Long showId) {
        return hub.subscribe(showId);
    }
}
