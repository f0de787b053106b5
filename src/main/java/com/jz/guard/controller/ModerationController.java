package com.jz.guard.controller;

import com.jz.guard.domain.dto.ModerationCheckDTO;
import com.jz.guard.guard.Decision;
import com.jz.guard.guard.IdentityContext;
import com.jz.guard.guard.ModerationGate;
import com.jz.guard.utils.IdentityResolver;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 聊天入口在调用检索/生成之前先走这里；放行才继续。
 */
@RestController
@RequestMapping("api/moderation")
@RequiredArgsConstructor
public class ModerationController {

    private final ModerationGate gate;
    private final IdentityResolver identityResolver;

    @PostMapping("/check")
    public ResponseEntity<Decision> check(@RequestBody(required = false) ModerationCheckDTO dto,
                                          HttpServletRequest request) {
        IdentityContext ctx = identityResolver.resolve(request);
        Decision decision = gate.moderate(ctx, dto == null ? null : dto.getMessage());
        return ResponseEntity.status(statusOf(decision)).body(decision);
    }

    static HttpStatus statusOf(Decision d) {
        return switch (d.getReason()) {
            case APPROVED -> HttpStatus.OK;
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case USER_BLOCKED, CONTENT_FLAGGED -> HttpStatus.FORBIDDEN;
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
