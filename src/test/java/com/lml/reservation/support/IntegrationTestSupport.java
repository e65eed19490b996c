package com.lml.reservation.support;

import com.lml.reservation.domain.seat.Seat;
import com.lml.reservation.infra.seat.SeatJpaRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * MySQL 컨테이너 하나를 모든 통합 테스트가 같이 쓴다.
 * 테스트끼리 데이터가 섞이지 않게 테스트마다 새 showId 를 쓴다.
 */
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
@ActiveProfiles("test")
public abstract class IntegrationTestSupport {

    @ServiceConnection
    static final MySQLContainer<?> mysql =
            new MySQLContainer<>("mysql:8.4")
                    .withDatabaseName("reservation")
                    .withUsername("test")
                    .withPassword("test");

    static {
        mysql.start();
    }

    private static final AtomicLong SHOW_IDS = new AtomicLong(1_000);

    @Autowired
    protected SeatJpaRepository seatRepository;

    protected static long newShowId() {
        return SHOW_IDS.incrementAndGet();
    }

    /** 한 구역 한 열에 1번부터 count 개 좌석. */
    protected List<Long> seedRow(long showId, String sectionId, String row, int count, int pricePence) {
        List<Long> ids = new ArrayList<>();
        for (int n = 1; n <= count; n++) {
            ids.add(seatRepository.save(Seat.create(showId, sectionId, row, n, pricePence, false)).getId());
        }
        return ids;
    }
}
