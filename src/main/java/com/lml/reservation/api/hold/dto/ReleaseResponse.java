package com.lml.reservation.api.hold.dto;

public record ReleaseResponse(Long holdId, boolean released) {}
