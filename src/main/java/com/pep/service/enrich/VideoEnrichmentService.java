package com.pep.service.enrich;

import com.pep.exception.EnrichmentException;
import com.pep.model.dto.ExerciseProposal;
import com.pep.model.dto.VideoCandidate;
import com.pep.model.dto.VideoSearchResult;
import com.pep.util.VideoSearchClient;
import com.pep.util.YouTubeProbeClient;
import com.pep.util.YouTubeUrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * 视频补全：为每个训练动作检索并校验一个演示视频
 * 首次检索失败后只做一次更具体的备用检索；仍失败则视频字段置空，流程继续
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VideoEnrichmentService {

    static final String PRIMARY_QUALIFIER = " physical therapy exercise";
    static final String FALLBACK_QUALIFIER = " rehabilitation exercise demonstration";

    private final VideoSearchClient videoSearchClient;
    private final YouTubeProbeClient youTubeProbeClient;

    /**
     * 原地写入 proposal 的 videoUrl / videoThumbnail，不会抛出异常
     */
    public void enrich(ExerciseProposal proposal) {
        String name = StringUtils.trimToEmpty(proposal.getName());
        Optional<VideoCandidate> candidate = attempt(name + PRIMARY_QUALIFIER);
        if (candidate.isEmpty()) {
            candidate = attempt(name + FALLBACK_QUALIFIER);
        }

        if (candidate.isPresent()) {
            VideoCandidate video = candidate.get();
            proposal.setVideoUrl(video.getUrl());
            proposal.setVideoThumbnail(video.getThumbnailUrl());
            log.info("视频补全成功，exercise={}, url={}, query={}", name, video.getUrl(), video.getSourceQuery());
        } else {
            proposal.setVideoUrl("");
            proposal.setVideoThumbnail("");
            log.warn("视频补全失败，exercise={}，视频字段置空", name);
        }
    }

    public void enrichAll(List<ExerciseProposal> proposals) {
        for (ExerciseProposal proposal : proposals) {
            enrich(proposal);
        }
    }

    /**
     * 单次检索 + 校验，任何失败都只影响本次尝试
     */
    private Optional<VideoCandidate> attempt(String query) {
        try {
            VideoCandidate candidate = search(query);
            String videoId = YouTubeUrlUtils.extractVideoId(candidate.getUrl())
                    .orElseThrow(() -> new EnrichmentException("无法识别视频ID: " + candidate.getUrl()));
            if (!youTubeProbeClient.exists(videoId)) {
                throw new EnrichmentException("视频不可用: " + candidate.getUrl());
            }
            return Optional.of(candidate);
        } catch (RuntimeException e) {
            log.warn("视频检索未通过，query={}: {}", query, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 取第一个符合视频站点格式的结果；不符合的结果直接丢弃
     */
    VideoCandidate search(String query) {
        List<VideoSearchResult> results = videoSearchClient.search(query);
        for (VideoSearchResult result : results) {
            Optional<String> videoId = YouTubeUrlUtils.extractVideoId(result.getLink());
            if (videoId.isEmpty()) {
                log.debug("丢弃非视频站点链接: {}", result.getLink());
                continue;
            }
            String thumbnail = StringUtils.isNotBlank(result.getThumbnail())
                    ? result.getThumbnail().trim()
                    : YouTubeUrlUtils.thumbnailUrl(videoId.get());
            return new VideoCandidate(YouTubeUrlUtils.watchUrl(videoId.get()), thumbnail, query);
        }
        throw new EnrichmentException("检索结果中没有可识别的视频链接");
    }
}
