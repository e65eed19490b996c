package com.lml.reservation.application.rules;

/**
 * 좌석 선택 규칙 하나. 낮은 @Order 부터 실행되고, 처음 나온 거절이 결과가 된다.
 * 좌석 상태를 바꾸지 않는다.
 */
public interface SelectionRule {

    RuleVerdict check(SelectionContext context);
}
