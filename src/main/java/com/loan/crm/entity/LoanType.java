package com.loan.crm.entity;

public enum LoanType {
    NEW,
    RELOAN
}
