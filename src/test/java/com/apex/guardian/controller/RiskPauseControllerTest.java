package com.apex.guardian.controller;

import com.apex.guardian.service.risk.TradePauseService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RiskPauseController.class)
class RiskPauseControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TradePauseService tradePauseService;

    @Test
    void clearsPause() throws Exception {
        when(tradePauseService.clearPause("A", "default")).thenReturn(true);

        mockMvc.perform(delete("/api/risk/pauses/A/default"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accountId").value("A"))
                .andExpect(jsonPath("$.cleared").value(true));
    }

    @Test
    void reportsWhenNothingWasPaused() throws Exception {
        mockMvc.perform(delete("/api/risk/pauses/B/default"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cleared").value(false));
    }
}
