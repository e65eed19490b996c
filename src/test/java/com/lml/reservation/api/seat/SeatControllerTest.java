package com.lml.reservation.api.seat;

import com.lml.reservation.application.hold.SeatHoldService;
import com.lml.reservation.application.rules.BusinessRulesValidator;
import com.lml.reservation.application.rules.RejectReason;
import com.lml.reservation.application.rules.SelectionConstraints;
import com.lml.reservation.application.rules.ValidationResult;
import com.lml.reservation.application.seat.SeatInventoryService;
import com.lml.reservation.application.seat.SeatSnapshot;
import com.lml.reservation.domain.seat.SeatStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SeatController.class)
class SeatControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    SeatInventoryService inventoryService;

    @MockBean
    SeatHoldService seatHoldService;

    @MockBean
    BusinessRulesValidator validator;

    private static SeatSnapshot seat(long id, int number, SeatStatus status) {
        return new SeatSnapshot(id, 1L, "STALLS", "A", number, 4500, false, status);
    }

    @Test
    @DisplayName("seats: 유효 상태로 좌석 목록을 돌려준다")
    void seats() throws Exception {
        given(inventoryService.getSeatsForShow(1L)).willReturn(List.of(
                seat(10, 1, SeatStatus.AVAILABLE),
                seat(11, 2, SeatStatus.HELD)));

        mockMvc.perform(get("/api/shows/1/seats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].status").value("AVAILABLE"))
                .andExpect(jsonPath("$[1].status").value("HELD"))
                .andExpect(jsonPath("$[1].pricePence").value(4500));
    }

    @Test
    @DisplayName("validate: 검증만 하고 결과를 200 으로")
    void validate() throws Exception {
        given(seatHoldService.validate(eq(1L), eq(List.of(10L, 11L)), isNull(), any(SelectionConstraints.class)))
                .willReturn(ValidationResult.rejected(RejectReason.TOO_MANY_SEATS, "한 번에 최대 8석까지 선택할 수 있습니다."));

        mockMvc.perform(post("/api/shows/1/seats/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"seatIds": [10, 11]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.reason").value("TOO_MANY_SEATS"));
    }

    @Test
    @DisplayName("recommendations: 좌석 묶음과 합계 금액")
    void recommendations() throws Exception {
        given(validator.recommend(eq(1L), eq(2), eq(5000), isNull(), eq(false), any(SelectionConstraints.class)))
                .willReturn(List.of(List.of(seat(10, 1, SeatStatus.AVAILABLE), seat(11, 2, SeatStatus.AVAILABLE))));

        mockMvc.perform(get("/api/shows/1/seats/recommendations")
                        .param("count", "2")
                        .param("maxPricePence", "5000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].seatIds[1]").value(11))
                .andExpect(jsonPath("$[0].row").value("A"))
                .andExpect(jsonPath("$[0].totalPricePence").value(9000));
    }

    @Test
    @DisplayName("recommendations: 숫자가 아닌 count 는 400")
    void recommendations_badCount() throws Exception {
        mockMvc.perform(get("/api/shows/1/seats/recommendations").param("count", "two"))
                .andExpect(status().isBadRequest());
    }
}
