package com.pep.util;

import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * YouTube 链接识别工具
 * 仅识别 watch / youtu.be / embed / shorts 四种形态，其余链接一律视为非视频站点
 */
public final class YouTubeUrlUtils {

    private static final String VIDEO_ID = "([A-Za-z0-9_-]{11})";

    private static final List<Pattern> VIDEO_PATTERNS = List.of(
            Pattern.compile("^https?://(?:www\\.|m\\.)?youtube\\.com/watch\\?(?:[^#]*&)?v=" + VIDEO_ID + "(?:[&#].*)?$"),
            Pattern.compile("^https?://youtu\\.be/" + VIDEO_ID + "(?:[?#].*)?$"),
            Pattern.compile("^https?://(?:www\\.)?youtube(?:-nocookie)?\\.com/embed/" + VIDEO_ID + "(?:[?#].*)?$"),
            Pattern.compile("^https?://(?:www\\.|m\\.)?youtube\\.com/shorts/" + VIDEO_ID + "(?:[?#].*)?$")
    );

    private static final String WATCH_URL = "https://www.youtube.com/watch?v=%s";
    private static final String THUMBNAIL_URL = "https://img.youtube.com/vi/%s/hqdefault.jpg";

    private YouTubeUrlUtils() {
    }

    /**
     * 提取视频ID，无法识别时返回 empty
     */
    public static Optional<String> extractVideoId(String url) {
        if (StringUtils.isBlank(url)) {
            return Optional.empty();
        }
        String trimmed = url.trim();
        for (Pattern pattern : VIDEO_PATTERNS) {
            Matcher matcher = pattern.matcher(trimmed);
            if (matcher.matches()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }

    public static String watchUrl(String videoId) {
        return String.format(WATCH_URL, videoId);
    }

    public static String thumbnailUrl(String videoId) {
        return String.format(THUMBNAIL_URL, videoId);
    }
}
