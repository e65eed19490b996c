package com.lml.reservation.infra.sse;

import com.lml.reservation.application.notify.SeatStatusChanged;
import com.lml.reservation.application.notify.SeatStatusNotifier;
import com.lml.reservation.common.tx.AfterCommit;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 단일 인스턴스용. 커밋된 변경만 이 인스턴스 구독자에게 보낸다.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ticketing.notifier.mode", havingValue = "local", matchIfMissing = true)
public class LocalSeatStatusNotifier implements SeatStatusNotifier {

    private final SeatSseHub hub;

    @Override
    public void publish(Long showId, List<SeatStatusChanged> changes) {
        if (changes.isEmpty()) return;
        List<SeatStatusChanged> snapshot = List.copyOf(changes);
        AfterCommit.run(() -> hub.publish(showId, snapshot));
    }
}
