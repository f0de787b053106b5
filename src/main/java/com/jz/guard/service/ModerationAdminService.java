package com.jz.guard.service;

import com.jz.guard.domain.dto.BadWordsDTO;
import com.jz.guard.domain.dto.BlockRequestDTO;
import com.jz.guard.domain.dto.ConfigPatchDTO;
import com.jz.guard.domain.vo.ActivityVO;
import com.jz.guard.domain.vo.IdentityStatsVO;
import com.jz.guard.domain.vo.ModerationActionVO;
import com.jz.guard.domain.vo.OverallStatsVO;
import com.jz.guard.guard.ModerationConfig;

import java.util.List;

/**
 * 管理后台操作。参数非法统一抛 IllegalArgumentException。
 */
public interface ModerationAdminService {

    ModerationActionVO block(BlockRequestDTO req);

    ModerationActionVO unblock(String identity, String adminId);

    OverallStatsVO overallStats();

    /** 未出现过的 identity 返回 null */
    IdentityStatsVO identityStats(String identity);

    /** 最近 hours 小时内的日志，新到旧，最多 limit 条 */
    List<ActivityVO> recentActivity(int hours, int limit);

    List<ModerationActionVO> actions(String identity);

    ModerationConfig config();

    ModerationConfig updateConfig(ConfigPatchDTO patch);

    BadWordsDTO rules();

    BadWordsDTO updateRules(BadWordsDTO req);
}
