package com.loan.crm.dto;

import com.loan.crm.entity.AppointmentStatus;

import java.time.Instant;

public record AppointmentSnapshot(Long id, AppointmentStatus status, Instant start) {
}
