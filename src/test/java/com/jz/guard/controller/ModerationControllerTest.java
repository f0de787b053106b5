package com.jz.guard.controller;

import com.jz.guard.domain.dto.ConfigPatchDTO;
import com.jz.guard.service.BlockLedger;
import com.jz.guard.support.GuardIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class ModerationControllerTest extends GuardIntegrationTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    BlockLedger blockLedger;

    private ResultActions check(String ip, String body) throws Exception {
        return mvc.perform(post("/api/moderation/check")
                .header("X-Forwarded-For", ip)
                .header("User-Agent", "mockmvc")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }

    @Test
    void approvedMessageReturns200WithSessionInfo() throws Exception {
        check("198.51.100.1", "{\"message\":\"hello world\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(true))
                .andExpect(jsonPath("$.reason").value("approved"))
                .andExpect(jsonPath("$.session_info.identity").value("198.51.100.1"))
                .andExpect(jsonPath("$.session_info.messages_sent").value(1))
                .andExpect(jsonPath("$.session_info.is_blocked").value(false))
                .andExpect(jsonPath("$.retry_after").doesNotExist());
    }

    @Test
    void flaggedMessageReturns403WithTagsOnly() throws Exception {
        check("198.51.100.2", "{\"message\":\"you idiot\"}")
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.allowed").value(false))
                .andExpect(jsonPath("$.reason").value("content_flagged"))
                .andExpect(jsonPath("$.flags", contains("inappropriate_language")));
    }

    @Test
    void rateLimitedReturns429WithRetryAfter() throws Exception {
        configStore.update(ConfigPatchDTO.builder().maxMessagesPerWindow(1).build());
        check("198.51.100.3", "{\"message\":\"one\"}").andExpect(status().isOk());

        check("198.51.100.3", "{\"message\":\"two\"}")
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.reason").value("rate_limited"))
                .andExpect(jsonPath("$.retry_after").value(3600));
    }

    @Test
    void blockedIdentityReturns403() throws Exception {
        blockLedger.block("198.51.100.4", "spamming", 24, "admin");

        check("198.51.100.4", "{\"message\":\"hello\"}")
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason").value("user_blocked"))
                .andExpect(jsonPath("$.message", containsString("spamming")));
    }

    @Test
    void emptyMessageReturns400() throws Exception {
        check("198.51.100.5", "{\"message\":\"   \"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("invalid_input"));
        mvc.perform(post("/api/moderation/check").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest());
    }
}
