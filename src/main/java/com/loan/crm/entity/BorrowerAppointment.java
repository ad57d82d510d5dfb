package com.loan.crm.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "borrower_appointments", indexes = {
    @Index(name = "borrower_appointment_borrower_id_idx", columnList = "borrower_id"),
    @Index(name = "borrower_appointment_status_idx", columnList = "status"),
    @Index(name = "borrower_appointment_datetime_idx", columnList = "start_datetime")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BorrowerAppointment implements TrackedAppointment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "borrower_id", nullable = false)
    private Borrower borrower;

    @Column(name = "agent_id", nullable = false, length = 256)
    private String agentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private AppointmentStatus status = AppointmentStatus.UPCOMING;

    @Column(name = "appointment_type", length = 50)
    @Builder.Default
    private String appointmentType = "reloan_consultation";

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "timeslot_id")
    private Timeslot timeslot;

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

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

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
