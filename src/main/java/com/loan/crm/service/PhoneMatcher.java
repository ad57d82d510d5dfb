package com.loan.crm.service;

import com.loan.crm.entity.Borrower;
import com.loan.crm.entity.Lead;
import com.loan.crm.repository.BorrowerRepository;
import com.loan.crm.repository.LeadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Resolves a normalized phone key to a lead or borrower. Matching runs on the key columns the
 * entities derive from their stored phones, so every stored format of a number matches.
 */
@Service
public class PhoneMatcher {

    private static final Logger log = LoggerFactory.getLogger(PhoneMatcher.class);

    private final LeadRepository leadRepository;
    private final BorrowerRepository borrowerRepository;

    public PhoneMatcher(LeadRepository leadRepository, BorrowerRepository borrowerRepository) {
        this.leadRepository = leadRepository;
        this.borrowerRepository = borrowerRepository;
    }

    @Transactional(readOnly = true)
    public Optional<Lead> findLead(String phoneKey) {
        return leadRepository.findByAnyPhoneKey(phoneKey).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<Borrower> findBorrower(String phoneKey) {
        return borrowerRepository.findByAnyPhoneKey(phoneKey).stream().findFirst();
    }

    /**
     * Fills the key columns of rows stored before they existed.
     *
     * @return number of leads and borrowers that received a key
     */
    @Transactional
    public int backfillPhoneKeys() {
        int filled = 0;
        List<Lead> leads = leadRepository.findWithoutPhoneKey();
        for (Lead lead : leads) {
            lead.refreshPhoneKeys();
            if (lead.getPhoneKey() != null) {
                filled++;
            }
        }
        List<Borrower> borrowers = borrowerRepository.findWithoutPhoneKey();
        for (Borrower borrower : borrowers) {
            borrower.refreshPhoneKeys();
            if (borrower.getPhoneKey() != null) {
                filled++;
            }
        }
        if (filled > 0) {
            log.info("Backfilled phone keys on {} of {} rows", filled, leads.size() + borrowers.size());
        }
        return filled;
    }
}
