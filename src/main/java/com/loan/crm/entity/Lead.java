package com.loan.crm.entity;

import com.loan.crm.utils.PhoneNormalizer;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "leads", indexes = {
    @Index(name = "lead_phone_idx", columnList = "phone_number"),
    @Index(name = "lead_phone_key_idx", columnList = "phone_key"),
    @Index(name = "lead_status_idx", columnList = "status"),
    @Index(name = "lead_assigned_to_idx", columnList = "assigned_to")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Lead implements TrackedParty {

    public static final String ELIGIBLE = "eligible";
    public static final String INELIGIBLE = "ineligible";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

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

    @Column(name = "full_name")
    private String fullName;

    private String email;

    @Convert(converter = LeadStatusConverter.class)
    @Column(nullable = false, length = 50)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private LeadStatus status = LeadStatus.NEW;

    @Column(length = 100)
    @Builder.Default
    private String source = "SEO";

    @Enumerated(EnumType.STRING)
    @Column(name = "lead_type", length = 20)
    @Builder.Default
    private LoanType leadType = LoanType.NEW;

    @Column(name = "assigned_to", length = 256)
    private String assignedTo;

    @Column(name = "follow_up_date")
    private Instant followUpDate;

    @Column(name = "eligibility_checked", nullable = false)
    private boolean eligibilityChecked;

    @Column(name = "eligibility_status", length = 50)
    private String eligibilityStatus;

    @Column(name = "eligibility_notes", columnDefinition = "TEXT")
    private String eligibilityNotes;

    @Enumerated(EnumType.STRING)
    @Column(name = "loan_status", length = 10)
    private LoanCode loanStatus;

    @Column(name = "loan_notes", columnDefinition = "TEXT")
    private String loanNotes;

    @Column(length = 50)
    private String amount;

    @Column(name = "employment_status", length = 50)
    private String employmentStatus;

    @Column(name = "loan_purpose", length = 100)
    private String loanPurpose;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

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
    public void applyEngineStatus(EngineLeadStatus engineStatus) {
        this.status = engineStatus.toLeadStatus();
    }

    public boolean isIneligible() {
        return eligibilityChecked && INELIGIBLE.equals(eligibilityStatus);
    }

    @Override
    public PartyType partyType() {
        return PartyType.LEAD;
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
