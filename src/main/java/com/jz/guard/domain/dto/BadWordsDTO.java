package com.jz.guard.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** bad_words.json 的文件格式，同时也是管理接口的请求/响应体；字段为 null 表示不修改 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BadWordsDTO {
    private List<String> words;
    private List<String> patterns;
}
