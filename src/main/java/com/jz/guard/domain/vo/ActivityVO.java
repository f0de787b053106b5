package com.jz.guard.domain.vo;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ActivityVO {
    private String identity;
    private LocalDateTime timestamp;
    /** 预览：超过 100 字截断并加 ... */
    private String message;
    private Boolean isFlagged;
    private List<String> flagReasons;
}
