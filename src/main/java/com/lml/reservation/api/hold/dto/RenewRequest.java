package com.lml.reservation.api.hold.dto;

import jakarta.validation.constraints.NotBlank;

public record RenewRequest(@NotBlank String sessionToken) {}
