package com.jz.guard.controller;

import com.jz.guard.support.GuardIntegrationTest;
import com.jz.guard.utils.IdentityResolver;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 开启 identity 摘要时，管理端传原始地址或摘要都能定位到同一个会话。
 */
@AutoConfigureMockMvc
@TestPropertySource(properties = "guard.identity.hash-identities=true")
class HashedIdentityAdminTest extends GuardIntegrationTest {

    private static final String ADDRESS = "203.0.113.50";

    @Autowired
    MockMvc mvc;

    @Autowired
    IdentityResolver identityResolver;

    private void check(String message) throws Exception {
        mvc.perform(post("/api/moderation/check").header("X-Forwarded-For", ADDRESS)
                .contentType(MediaType.APPLICATION_JSON).content("{\"message\":\"" + message + "\"}"));
    }

    @Test
    void adminLookupByRawAddressFindsHashedSession() throws Exception {
        String key = identityResolver.storageKey(ADDRESS);
        assertThat(key).hasSize(16).isNotEqualTo(ADDRESS);

        check("hello");

        mvc.perform(get("/api/admin/user/" + ADDRESS))
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.identity").value(key))
                .andExpect(jsonPath("$.data.total_messages").value(1));
        mvc.perform(get("/api/admin/user/" + key))
                .andExpect(jsonPath("$.data.identity").value(key));
        assertThat(countRows("guard_session", ADDRESS)).isZero();
    }

    @Test
    void adminBlockByRawAddressStopsThatClient() throws Exception {
        mvc.perform(post("/api/admin/block").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ip\":\"" + ADDRESS + "\",\"reason\":\"abuse\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.identity").value(identityResolver.storageKey(ADDRESS)));

        mvc.perform(post("/api/moderation/check").header("X-Forwarded-For", ADDRESS)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"message\":\"hello\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason").value("user_blocked"));

        mvc.perform(post("/api/admin/unblock").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identity\":\"" + identityResolver.storageKey(ADDRESS) + "\"}"))
                .andExpect(status().isOk());
        mvc.perform(post("/api/moderation/check").header("X-Forwarded-For", ADDRESS)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"message\":\"hello\"}"))
                .andExpect(status().isOk());
    }
}
