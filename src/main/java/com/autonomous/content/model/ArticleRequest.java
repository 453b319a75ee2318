package com.autonomous.content.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArticleRequest {
    private String topic;
    private List<String> keywords;
    private Integer targetWordCount;
    private Integer priority;
    private String notes;
}
