package com.lml.reservation.application.seat;

import com.lml.reservation.common.exception.BusinessException;
import com.lml.reservation.common.exception.ErrorCode;
import com.lml.reservation.domain.seat.SeatAlias;
import com.lml.reservation.infra.seat.SeatAliasJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 레이아웃 좌석 코드(ORCH-A-12 등) -> seatId.
 * 매핑 없는 코드가 하나라도 있으면 요청 전체를 거절한다. 다른 좌석으로 대체하지 않는다.
 */
@Component
@RequiredArgsConstructor
public class SeatAliasResolver {

    private final SeatAliasJpaRepository aliasRepository;

    @Transactional(readOnly = true)
    public Set<Long> resolve(Long showId, Collection<String> rawCodes) {
        if (rawCodes == null || rawCodes.isEmpty()) {
            return Set.of();
        }

        Set<String> codes = rawCodes.stream()
                .filter(c -> c != null && !c.isBlank())
                .map(SeatAlias::normalize)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (codes.size() != rawCodes.size()) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "빈 좌석 코드 또는 중복 코드가 있습니다.");
        }

        List<SeatAlias> aliases = aliasRepository.findByShowIdAndCodeIn(showId, codes);
        Map<String, Long> byCode = aliases.stream()
                .collect(Collectors.toMap(SeatAlias::getCode, SeatAlias::getSeatId));

        Set<String> unmapped = codes.stream()
                .filter(c -> !byCode.containsKey(c))
                .collect(Collectors.toCollection(TreeSet::new));
        if (!unmapped.isEmpty()) {
            throw new BusinessException(ErrorCode.UNMAPPED_SEAT_CODE, "codes=" + unmapped);
        }

        return codes.stream().map(byCode::get).collect(Collectors.toCollection(TreeSet::new));
    }
}
