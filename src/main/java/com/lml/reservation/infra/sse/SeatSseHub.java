package com.lml.reservation.infra.sse;

import com.lml.reservation.application.notify.SeatStatusChanged;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * showId 별 SSE 연결 보관 + hello/seat/ping 브로드캐스트.
 *
 * 클라이언트가 끊기는 건 정상 상황이라 send 실패한 emitter 는 조용히 정리한다.
 * 이 허브는 인스턴스 로컬이다. 여러 인스턴스면 kafka 모드로 모든 인스턴스에 이벤트를 뿌린다.
 */
@Slf4j
@Component
public class SeatSseHub {

    // showId -> emitters
    private final Map<Long, CopyOnWriteArrayList<SseEmitter>> room = new ConcurrentHashMap<>();

    public SseEmitter subscribe(Long showId) {
        // timeout 0 = 무제한
        SseEmitter emitter = new SseEmitter(0L);

        room.computeIfAbsent(showId, k -> new CopyOnWriteArrayList<>()).add(emitter);

        Runnable cleanup = () -> remove(showId, emitter);
        emitter.onCompletion(cleanup);
        emitter.onTimeout(cleanup);
        emitter.onError(ex -> cleanup.run());

        try {
            emitter.send(SseEmitter.event()
                    .name("hello")
                    .data(Map.of("ok", true, "showId", showId)));
        } catch (IOException | IllegalStateException e) {
            cleanup.run();
        }

        return emitter;
    }

    /** event: seat, data: 같은 트랜잭션에서 바뀐 좌석 목록 */
    public void publish(Long showId, List<SeatStatusChanged> changes) {
        broadcast(showId, "seat", changes);
    }

    public void ping(Long showId) {
        broadcast(showId, "ping", Map.of("at", LocalDateTime.now().toString()));
    }

    /** 구독자가 하나라도 있는 공연들 */
    public Set<Long> showIds() {
        return Set.copyOf(room.keySet());
    }

    public int subscriberCount(Long showId) {
        List<SseEmitter> emitters = room.get(showId);
        return emitters == null ? 0 : emitters.size();
    }

    public int totalSubscribers() {
        return room.values().stream().mapToInt(List::size).sum();
    }

    private void broadcast(Long showId, String eventName, Object payload) {
        List<SseEmitter> emitters = room.get(showId);
        if (emitters == null || emitters.isEmpty()) return;

        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event()
                        .name(eventName)
                        .data(payload));
            } catch (IOException | IllegalStateException e) {
                // 끊긴 연결 정리 (정상 상황)
                remove(showId, emitter);
            }
        }
    }

    private void remove(Long showId, SseEmitter emitter) {
        room.computeIfPresent(showId, (k, list) -> {
            list.remove(emitter);
            return list.isEmpty() ? null : list;
        });
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.debug("emitter already completed. showId={}", showId);
        }
    }
}
