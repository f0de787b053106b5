package com.jz.guard.domain.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BlockRequestDTO {
    @JsonAlias("ip")
    private String identity;
    private String reason;          // 为空时用 "Manual block by admin"
    private Integer durationHours;  // 为空时 24；0 表示无限期
    private String adminId;         // 为空时 "admin"
}
