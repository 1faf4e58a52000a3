package com.pep.service.enrich;

import com.pep.exception.EnrichmentException;
import com.pep.model.dto.ExerciseProposal;
import com.pep.model.dto.VideoSearchResult;
import com.pep.util.VideoSearchClient;
import com.pep.util.YouTubeProbeClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VideoEnrichmentServiceTest {

    private static final String PRIMARY = "Heel Slides physical therapy exercise";
    private static final String FALLBACK = "Heel Slides rehabilitation exercise demonstration";

    private VideoSearchClient searchClient;
    private YouTubeProbeClient probeClient;
    private VideoEnrichmentService service;
    private ExerciseProposal proposal;

    @BeforeEach
    void setUp() {
        searchClient = mock(VideoSearchClient.class);
        probeClient = mock(YouTubeProbeClient.class);
        service = new VideoEnrichmentService(searchClient, probeClient);
        proposal = ExerciseProposal.builder().name("Heel Slides").description("d").build();
    }

    @Test
    void usesFirstRecognizedResultAndEmbeddedThumbnail() {
        when(searchClient.search(PRIMARY)).thenReturn(List.of(
                new VideoSearchResult("https://example.com/heel-slides.mp4", "https://example.com/t.jpg"),
                new VideoSearchResult("https://youtu.be/AAAAAAAAAAA", "https://i.ytimg.com/vi/AAAAAAAAAAA/hq720.jpg")));
        when(probeClient.exists("AAAAAAAAAAA")).thenReturn(true);

        service.enrich(proposal);

        assertThat(proposal.getVideoUrl()).isEqualTo("https://www.youtube.com/watch?v=AAAAAAAAAAA");
        assertThat(proposal.getVideoThumbnail()).isEqualTo("https://i.ytimg.com/vi/AAAAAAAAAAA/hq720.jpg");
        verify(searchClient, never()).search(FALLBACK);
    }

    @Test
    void derivesThumbnailWhenResultHasNone() {
        when(searchClient.search(PRIMARY)).thenReturn(List.of(
                new VideoSearchResult("https://www.youtube.com/watch?v=BBBBBBBBBBB", null)));
        when(probeClient.exists("BBBBBBBBBBB")).thenReturn(true);

        service.enrich(proposal);

        assertThat(proposal.getVideoThumbnail()).isEqualTo("https://img.youtube.com/vi/BBBBBBBBBBB/hqdefault.jpg");
    }

    @Test
    void nonVideoLinksAreNeverUsed() {
        when(searchClient.search(anyString())).thenReturn(List.of(
                new VideoSearchResult("https://example.com/heel-slides.mp4", "https://example.com/t.jpg")));

        service.enrich(proposal);

        assertThat(proposal.getVideoUrl()).isEmpty();
        assertThat(proposal.getVideoThumbnail()).isEmpty();
        verify(probeClient, never()).exists(anyString());
    }

    @Test
    void invalidFirstCandidateTriggersExactlyOneFallbackQuery() {
        when(searchClient.search(PRIMARY)).thenReturn(List.of(
                new VideoSearchResult("https://www.youtube.com/watch?v=CCCCCCCCCCC", null)));
        when(searchClient.search(FALLBACK)).thenReturn(List.of(
                new VideoSearchResult("https://www.youtube.com/watch?v=DDDDDDDDDDD", null)));
        when(probeClient.exists("CCCCCCCCCCC")).thenReturn(false);
        when(probeClient.exists("DDDDDDDDDDD")).thenReturn(true);

        service.enrich(proposal);

        assertThat(proposal.getVideoUrl()).isEqualTo("https://www.youtube.com/watch?v=DDDDDDDDDDD");
        verify(searchClient, times(1)).search(PRIMARY);
        verify(searchClient, times(1)).search(FALLBACK);
    }

    @Test
    void secondFailureLeavesMediaEmptyWithoutThirdQuery() {
        when(searchClient.search(anyString())).thenReturn(List.of(
                new VideoSearchResult("https://www.youtube.com/watch?v=EEEEEEEEEEE", null)));
        when(probeClient.exists(anyString())).thenReturn(false);

        service.enrich(proposal);

        assertThat(proposal.getVideoUrl()).isEmpty();
        assertThat(proposal.getVideoThumbnail()).isEmpty();
        verify(searchClient, times(2)).search(anyString());
    }

    @Test
    void searchFailureIsAbsorbed() {
        when(searchClient.search(anyString())).thenThrow(new EnrichmentException("视频检索失败，HTTP 503"));

        service.enrich(proposal);

        assertThat(proposal.getVideoUrl()).isEmpty();
        verify(searchClient, times(2)).search(anyString());
    }

    @Test
    void enrichAllProcessesEveryProposal() {
        ExerciseProposal other = ExerciseProposal.builder().name("Quad Sets").build();
        when(searchClient.search(anyString())).thenReturn(List.of());

        service.enrichAll(List.of(proposal, other));

        assertThat(proposal.getVideoUrl()).isEmpty();
        assertThat(other.getVideoUrl()).isEmpty();
        verify(searchClient, times(4)).search(anyString());
    }
}
