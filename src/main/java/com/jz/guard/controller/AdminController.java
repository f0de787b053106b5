package com.jz.guard.controller;

import com.jz.guard.common.Result;
import com.jz.guard.domain.dto.BadWordsDTO;
import com.jz.guard.domain.dto.BlockRequestDTO;
import com.jz.guard.domain.dto.ConfigPatchDTO;
import com.jz.guard.domain.dto.UnblockRequestDTO;
import com.jz.guard.domain.vo.ActivityVO;
import com.jz.guard.domain.vo.IdentityStatsVO;
import com.jz.guard.domain.vo.ModerationActionVO;
import com.jz.guard.domain.vo.OverviewVO;
import com.jz.guard.guard.ModerationConfig;
import com.jz.guard.service.ModerationAdminService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("api/admin")
@RequiredArgsConstructor
public class AdminController {

    private static final int OVERVIEW_HOURS = 24;
    private static final int OVERVIEW_LIMIT = 50;

    private final ModerationAdminService adminService;

    /**
     * 总览：整体统计 + 最近 24 小时的 50 条消息
     */
    @GetMapping("/stats")
    public Result<OverviewVO> stats() {
        return Result.success(new OverviewVO(
                adminService.overallStats(),
                adminService.recentActivity(OVERVIEW_HOURS, OVERVIEW_LIMIT)));
    }

    @GetMapping("/activity")
    public Result<List<ActivityVO>> activity(@RequestParam(defaultValue = "24") int hours,
                              @RequestParam(defaultValue = "100") int limit) {
        return Result.success(adminService.recentActivity(hours, limit));
    }

    @GetMapping("/user/{identity}")
    public Result<IdentityStatsVO> user(@PathVariable String identity) {
        IdentityStatsVO stats = adminService.identityStats(identity);
        if (stats == null) {
            return Result.notFound("unknown identity: " + identity);
        }
        return Result.success(stats);
    }

    @PostMapping("/block")
    public Result<ModerationActionVO> block(@RequestBody BlockRequestDTO dto) {
        return Result.success(adminService.block(dto));
    }

    @PostMapping("/unblock")
    public Result<ModerationActionVO> unblock(@RequestBody UnblockRequestDTO dto) {
        return Result.success(adminService.unblock(dto.getIdentity(), dto.getAdminId()));
    }

    @GetMapping("/actions")
    public Result<List<ModerationActionVO>> actions(@RequestParam String identity) {
        return Result.success(adminService.actions(identity));
    }

    @GetMapping("/config")
    public Result<ModerationConfig> config() {
        return Result.success(adminService.config());
    }

    @PostMapping("/config")
    public Result<ModerationConfig> updateConfig(@RequestBody ConfigPatchDTO patch) {
        return Result.success(adminService.updateConfig(patch));
    }

    @GetMapping("/bad-words")
    public Result<BadWordsDTO> badWords() {
        return Result.success(adminService.rules());
    }

    @PostMapping("/bad-words")
    public Result<BadWordsDTO> updateBadWords(@RequestBody BadWordsDTO dto) {
        return Result.success(adminService.updateRules(dto));
    }
}
