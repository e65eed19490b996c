package com.lml.reservation.domain.hold;

public enum HoldState {
    ACTIVE,     // 결제 대기 중 (TTL 카운트다운)
    PROMOTED,   // 결제 성공 -> 예매 확정 (종료)
    RELEASED,   // 사용자 해제 / 결제 실패 (종료)
    EXPIRED;    // TTL 만료 회수 (종료)

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
