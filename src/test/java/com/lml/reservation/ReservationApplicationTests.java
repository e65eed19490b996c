package com.lml.reservation;

import com.lml.reservation.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;

class ReservationApplicationTests extends IntegrationTestSupport {

    @Test
    void contextLoads() {
    }
}
