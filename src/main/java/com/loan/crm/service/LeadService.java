package com.loan.crm.service;

import com.loan.crm.dto.CallOutcome;
import com.loan.crm.dto.EligibilityResult;
import com.loan.crm.entity.Lead;
import com.loan.crm.entity.LeadStatus;
import com.loan.crm.repository.LeadRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class LeadService {

    private static final Logger log = LoggerFactory.getLogger(LeadService.class);

    private final LeadRepository leadRepository;
    private final String agentId;
    private final String defaultSource;

    public LeadService(LeadRepository leadRepository,
                       @Value("${crm.reconciliation.agent-id:system-update}") String agentId,
                       @Value("${crm.reconciliation.default-source:SEO}") String defaultSource) {
        this.leadRepository = leadRepository;
        this.agentId = agentId;
        this.defaultSource = defaultSource;
    }

    @Transactional
    public Lead createFromOutcome(CallOutcome outcome) {
        Lead lead = Lead.builder()
                .phoneNumber(outcome.storedPhone())
                .fullName(outcome.fullName())
                .email(outcome.email())
                .source(StringUtils.defaultIfBlank(outcome.source(), defaultSource))
                .leadType(outcome.loanType())
                .amount(outcome.loanAmount())
                .employmentStatus(outcome.employmentType())
                .loanPurpose(outcome.loanPurpose())
                .status(LeadStatus.NEW)
                .createdBy(agentId)
                .updatedBy(agentId)
                .build();
        lead = leadRepository.save(lead);
        log.info("Created lead {} for phone {} from row {}", lead.getId(), lead.getPhoneNumber(), outcome.rowNumber());
        return lead;
    }

    @Transactional
    public Lead recordEligibility(Long leadId, EligibilityResult result) {
        Lead lead = leadRepository.findById(leadId)
                .orElseThrow(() -> new IllegalArgumentException("Lead " + leadId + " not found"));
        lead.setEligibilityChecked(true);
        lead.setEligibilityStatus(result.eligible() ? Lead.ELIGIBLE : Lead.INELIGIBLE);
        lead.setEligibilityNotes(result.notes());
        lead.setUpdatedBy(agentId);
        return leadRepository.save(lead);
    }
}
