package com.loan.crm.controller;

import com.loan.crm.dto.GenerationResult;
import com.loan.crm.dto.TimeslotGenerationRequest;
import com.loan.crm.service.TimeslotGenerator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/timeslots")
public class TimeslotController {

    private final TimeslotGenerator generator;

    public TimeslotController(TimeslotGenerator generator) {
        this.generator = generator;
    }

    @PostMapping("/generate")
    public ResponseEntity<GenerationResult> generate(@RequestBody(required = false) TimeslotGenerationRequest request) {
        TimeslotGenerationRequest body = request != null ? request : new TimeslotGenerationRequest();
        GenerationResult result = generator.generate(body.getDaysAhead(), body.getCalendarSettingId());
        if (!result.success() && result.created() == 0) {
            return ResponseEntity.badRequest().body(result);
        }
        return ResponseEntity.ok(result);
    }
}
