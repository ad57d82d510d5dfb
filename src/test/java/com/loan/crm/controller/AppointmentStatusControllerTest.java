package com.loan.crm.controller;

import com.loan.crm.dto.ActionKind;
import com.loan.crm.dto.ReconciliationAction;
import com.loan.crm.dto.RunMode;
import com.loan.crm.dto.RunSummary;
import com.loan.crm.entity.AppointmentStatus;
import com.loan.crm.entity.LeadStatus;
import com.loan.crm.service.BatchRunner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AppointmentStatusController.class)
class AppointmentStatusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BatchRunner batchRunner;

    private static RunSummary summary(RunMode mode, double threshold, ReconciliationAction... actions) {
        return new RunSummary(mode, 1, 1, 0, 0, List.of(actions), LocalDate.of(2025, 3, 21), threshold);
    }

    @Test
    @DisplayName("POST runs the rows and reports per-kind counts")
    void postRunsRows() throws Exception {
        ReconciliationAction created = ReconciliationAction.builder()
                .action(ActionKind.CREATE_APPOINTMENT)
                .success(true)
                .rowNumber(1)
                .appointmentId(5L)
                .newStatus(AppointmentStatus.DONE)
                .newLeadStatus(LeadStatus.MISSED_RS)
                .appointmentTime("2025-03-21 12:00")
                .build();
        when(batchRunner.run(anyList(), eq(RunMode.LIVE), eq(3.0))).thenReturn(summary(RunMode.LIVE, 3.0, created));

        mockMvc.perform(post("/appointments/status-update")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"mode":"realtime","thresholdHours":3,"spreadsheet_id":"abc",
                                 "rows":[{"col_Mobile Number":"91234567","col_Code":"RS"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.mode").value("live"))
                .andExpect(jsonPath("$.todaySingapore").value("2025-03-21"))
                .andExpect(jsonPath("$.thresholdHours").value(3.0))
                .andExpect(jsonPath("$.results[0].action").value("create_appointment"))
                .andExpect(jsonPath("$.results[0].newStatus").value("done"))
                .andExpect(jsonPath("$.results[0].newLeadStatus").value("missed/RS"))
                .andExpect(jsonPath("$.results[0].errorKind").doesNotExist())
                .andExpect(jsonPath("$.summary.totalActions").value(1))
                .andExpect(jsonPath("$.summary.actionTypes.appointments_created").value(1))
                .andExpect(jsonPath("$.summary.actionTypes.leads_created").value(0));
    }

    @Test
    void getRunsTimeSweep() throws Exception {
        when(batchRunner.run(eq(List.of()), eq(RunMode.LIVE), isNull())).thenReturn(summary(RunMode.LIVE, 2.5));

        mockMvc.perform(get("/appointments/status-update"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.thresholdHours").value(2.5))
                .andExpect(jsonPath("$.summary.actionTypes.timeout_updates").value(0));
    }

    @Test
    void getEndOfDay() throws Exception {
        when(batchRunner.run(any(), eq(RunMode.END_OF_DAY), isNull())).thenReturn(summary(RunMode.END_OF_DAY, 3.0));

        mockMvc.perform(get("/appointments/status-update").param("mode", "end_of_day"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("end_of_day"));
    }

    @Test
    void unknownModeIsBadRequest() throws Exception {
        mockMvc.perform(post("/appointments/status-update")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mode\":\"weekly\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
        verifyNoInteractions(batchRunner);
    }

    @Test
    void storageOutageIsServerError() throws Exception {
        when(batchRunner.run(any(), any(), any())).thenThrow(new DataAccessResourceFailureException("connection refused"));

        mockMvc.perform(post("/appointments/status-update")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mode\":\"live\",\"rows\":[{\"Phone\":\"91234567\"}]}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.details").value("connection refused"));
    }
}
