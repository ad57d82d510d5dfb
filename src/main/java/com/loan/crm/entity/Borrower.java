package com.loan.crm.entity;

import com.loan.crm.utils.PhoneNormalizer;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A returning customer with at least one completed loan. Reloan rows are reconciled
 * against borrowers before leads.
 */
@Entity
@Table(name = "borrowers", indexes = {
    @Index(name = "borrower_phone_idx", columnList = "phone_number"),
    @Index(name = "borrower_phone_key_idx", columnList = "phone_key")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Borrower implements TrackedParty {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "full_name", nullable = false)
    private String fullName;

    @Column(name = "phone_number", nullable = false, length = 20)
    private String phoneNumber;

    @Column(name = "phone_number_2", length = 20)
    private String phoneNumber2;

    @Column(name = "phone_number_3", length = 20)
    private String phoneNumber3;

    /** 8-digit keys of the three phone columns, kept in step on every write. */
    @Column(name = "phone_key", length = 8)
    @Setter(AccessLevel.NONE)
    private String phoneKey;

    @Column(name = "phone_key_2", length = 8)
    @Setter(AccessLevel.NONE)
    private String phoneKey2;

    @Column(name = "phone_key_3", length = 8)
    @Setter(AccessLevel.NONE)
    private String phoneKey3;

    @Convert(converter = LeadStatusConverter.class)
    @Column(nullable = false, length = 50)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private LeadStatus status = LeadStatus.NEW;

    @Enumerated(EnumType.STRING)
    @Column(name = "loan_status", length = 10)
    private LoanCode loanStatus;

    @Column(name = "loan_notes", columnDefinition = "TEXT")
    private String loanNotes;

    @Column(name = "assigned_to", length = 256)
    private String assignedTo;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "updated_by", length = 256)
    private String updatedBy;

    @Version
    private Long version;

    @Override
    public void applyEngineStatus(EngineLeadStatus engineStatus) {
        this.status = engineStatus.toLeadStatus();
    }

    @Override
    public PartyType partyType() {
        return PartyType.BORROWER;
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
        refreshPhoneKeys();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
        refreshPhoneKeys();
    }

    public void refreshPhoneKeys() {
        phoneKey = PhoneNormalizer.keyOrNull(phoneNumber);
        phoneKey2 = PhoneNormalizer.keyOrNull(phoneNumber2);
        phoneKey3 = PhoneNormalizer.keyOrNull(phoneNumber3);
    }
}
