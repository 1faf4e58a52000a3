package com.pep.model.dto;

import lombok.Value;

/**
 * 视频检索接口返回的单条结果
 */
@Value
public class VideoSearchResult {

    String link;

    /**
     * 检索结果自带的缩略图，可能为空
     */
    String thumbnail;
}
