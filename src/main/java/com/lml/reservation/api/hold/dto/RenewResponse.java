package com.lml.reservation.api.hold.dto;

import java.time.LocalDateTime;

public record RenewResponse(Long holdId, LocalDateTime expiresAt) {}
