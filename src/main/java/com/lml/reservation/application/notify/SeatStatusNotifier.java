package com.lml.reservation.application.notify;

import java.util.List;

/**
 * 좌석 상태 전이를 공연 구독자들에게 fan-out.
 * HoldManager 트랜잭션 안에서 호출되며, 롤백된 변경은 내보내지 않아야 한다.
 * 권위 있는 상태가 아니다 -> 놓친 클라이언트는 전체 좌석 조회로 맞춘다.
 */
public interface SeatStatusNotifier {

    void publish(Long showId, List<SeatStatusChanged> changes);
}
