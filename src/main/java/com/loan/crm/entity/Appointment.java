package com.loan.crm.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "appointments", indexes = {
    @Index(name = "appointment_lead_id_idx", columnList = "lead_id"),
    @Index(name = "appointment_status_idx", columnList = "status"),
    @Index(name = "appointment_start_idx", columnList = "start_datetime")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Appointment implements TrackedAppointment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "lead_id", nullable = false)
    private Lead lead;

    @Column(name = "agent_id", nullable = false, length = 256)
    private String agentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private AppointmentStatus status = AppointmentStatus.UPCOMING;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "timeslot_id")
    private Timeslot timeslot;

    /** UTC. */
    @Column(name = "start_datetime", nullable = false)
    private Instant startDatetime;

    @Column(name = "end_datetime", nullable = false)
    private Instant endDatetime;

    @Enumerated(EnumType.STRING)
    @Column(name = "loan_status", length = 10)
    private LoanCode loanStatus;

    @Column(name = "loan_notes", columnDefinition = "TEXT")
    private String loanNotes;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "lead_source", length = 100)
    private String leadSource;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "created_by", length = 256)
    private String createdBy;

    @Column(name = "updated_by", length = 256)
    private String updatedBy;

    @Version
    private Long version;

    @Override
    public void applyStatus(AppointmentStatus next) {
        this.status = next;
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
