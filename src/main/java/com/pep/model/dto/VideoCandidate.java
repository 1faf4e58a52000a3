package com.pep.model.dto;

import lombok.Value;

/**
 * 视频候选（仅在补全过程中存在，不单独持久化）
 */
@Value
public class VideoCandidate {

    /**
     * 规范化后的视频地址
     */
    String url;

    String thumbnailUrl;

    /**
     * 命中该候选的检索词
     */
    String sourceQuery;
}
