package com.lml.reservation.infra.outbox;

import com.lml.reservation.application.notify.SeatStatusChanged;

import java.util.List;

// 토픽 메시지 본문. key 는 showId
public record SeatStatusMessage(
        String eventId,
        Long showId,
        List<SeatStatusChanged> changes
) {}
