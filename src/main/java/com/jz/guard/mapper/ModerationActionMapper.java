package com.jz.guard.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.guard.domain.entity.ModerationAction;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface ModerationActionMapper extends BaseMapper<ModerationAction> {
}
