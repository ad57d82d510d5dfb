package com.loan.crm.dto;

import java.util.List;

public record GenerationResult(boolean success, int created, List<String> errors) {
}
