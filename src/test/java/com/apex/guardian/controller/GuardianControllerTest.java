package com.apex.guardian.controller;

import com.apex.guardian.service.execution.GuardianAction;
import com.apex.guardian.service.execution.GuardianCommand;
import com.apex.guardian.service.execution.GuardianDispatchResult;
import com.apex.guardian.service.execution.GuardianDispatchService;
import com.apex.guardian.service.guardian.GuardianActionResult;
import com.apex.guardian.service.guardian.GuardianResultCode;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GuardianController.class)
class GuardianControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GuardianDispatchService guardianDispatchService;

    @Test
    void adjustmentIsDispatchedWithLevelMetadata() throws Exception {
        when(guardianDispatchService.dispatch(any())).thenReturn(GuardianDispatchResult.of("BTCUSDT",
                GuardianAction.ADJUST, List.of(new GuardianDispatchResult.AccountResult("A",
                        GuardianActionResult.success(GuardianResultCode.APPLIED, "Stop moved to 44500", null)))));

        mockMvc.perform(post("/api/guardian/actions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"BTCUSDT\",\"action\":\"adjust\",\"new_stop\":44500,"
                                + "\"account_id\":\"A\",\"level_metadata\":{\"level\":\"L1\",\"threshold_pct\":1.5}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.succeeded").value(1))
                .andExpect(jsonPath("$.results[0].result.code").value("APPLIED"));

        ArgumentCaptor<GuardianCommand> captor = ArgumentCaptor.forClass(GuardianCommand.class);
        verify(guardianDispatchService).dispatch(captor.capture());
        GuardianCommand command = captor.getValue();
        assertThat(command.action()).isEqualTo(GuardianAction.ADJUST);
        assertThat(command.accountId()).isEqualTo("A");
        assertThat(command.stop()).isEqualByComparingTo("44500");
        assertThat(command.level().level()).isEqualTo("L1");
        assertThat(command.level().thresholdPct()).isEqualTo(1.5);
    }

    @Test
    void adjustWithoutStopIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/guardian/actions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"BTCUSDT\",\"action\":\"ADJUST\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("ADJUST requires stop"));

        verify(guardianDispatchService, never()).dispatch(any());
    }

    @Test
    void unknownActionIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/guardian/actions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"BTCUSDT\",\"action\":\"TELEPORT\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void negativeStopFailsValidation() throws Exception {
        mockMvc.perform(post("/api/guardian/actions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"BTCUSDT\",\"action\":\"ADJUST\",\"stop\":-1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].field").value("stop"));
    }
}
