package com.pep.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class YouTubeUrlUtilsTest {

    @Test
    void extractsIdFromWatchUrl() {
        assertThat(YouTubeUrlUtils.extractVideoId("https://www.youtube.com/watch?v=dQw4w9WgXcQ"))
                .contains("dQw4w9WgXcQ");
    }

    @Test
    void extractsIdFromWatchUrlWithExtraParams() {
        assertThat(YouTubeUrlUtils.extractVideoId("https://m.youtube.com/watch?feature=share&v=dQw4w9WgXcQ&t=30s"))
                .contains("dQw4w9WgXcQ");
    }

    @Test
    void extractsIdFromShortLinkEmbedAndShorts() {
        assertThat(YouTubeUrlUtils.extractVideoId("https://youtu.be/abcDEF12345?t=5")).contains("abcDEF12345");
        assertThat(YouTubeUrlUtils.extractVideoId("https://www.youtube.com/embed/abcDEF12345")).contains("abcDEF12345");
        assertThat(YouTubeUrlUtils.extractVideoId("https://www.youtube.com/shorts/abc-EF_2345")).contains("abc-EF_2345");
    }

    @Test
    void rejectsNonVideoLinks() {
        assertThat(YouTubeUrlUtils.extractVideoId("https://example.com/video.mp4")).isEmpty();
        assertThat(YouTubeUrlUtils.extractVideoId("https://www.youtube.com/channel/UC123")).isEmpty();
        assertThat(YouTubeUrlUtils.extractVideoId("https://www.youtube.com/watch?v=short")).isEmpty();
        assertThat(YouTubeUrlUtils.extractVideoId("https://notyoutube.com/watch?v=dQw4w9WgXcQ")).isEmpty();
        assertThat(YouTubeUrlUtils.extractVideoId(null)).isEmpty();
    }

    @Test
    void derivesWatchAndThumbnailUrls() {
        assertThat(YouTubeUrlUtils.watchUrl("dQw4w9WgXcQ")).isEqualTo("https://www.youtube.com/watch?v=dQw4w9WgXcQ");
        assertThat(YouTubeUrlUtils.thumbnailUrl("dQw4w9WgXcQ")).isEqualTo("https://img.youtube.com/vi/dQw4w9WgXcQ/hqdefault.jpg");
    }
}
