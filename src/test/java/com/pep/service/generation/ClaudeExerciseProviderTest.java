package com.pep.service.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pep.common.SecretStore;
import com.pep.exception.GenerationException;
import com.pep.exception.GenerationParseException;
import com.pep.model.dto.ExerciseProposal;
import com.pep.model.dto.PatientProfile;
import com.pep.model.enums.LlmProvider;
import com.pep.service.manager.PromptTemplateManager;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.SocketTimeoutException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ClaudeExerciseProviderTest {

    private static final String EXERCISES = "```json\\n["
            + "{\\\"name\\\":\\\"Quad Sets\\\",\\\"description\\\":\\\"d\\\",\\\"target_joints\\\":\\\"knee\\\",\\\"instructions\\\":\\\"Tighten;Hold\\\"},"
            + "{\\\"name\\\":\\\"Heel Slides\\\",\\\"description\\\":\\\"d\\\",\\\"target_joints\\\":[\\\"knee\\\"],\\\"instructions\\\":[\\\"Slide\\\"]},"
            + "{\\\"name\\\":\\\"Wall Sits\\\",\\\"description\\\":\\\"d\\\",\\\"target_joints\\\":[\\\"knee\\\"],\\\"instructions\\\":[\\\"Sit\\\"]}"
            + "]\\n```";

    private OkHttpClient httpClient;
    private Call call;
    private Request lastRequest;
    private SecretStore secretStore;
    private ClaudeExerciseProvider provider;

    private final PatientProfile profile = PatientProfile.builder()
            .patientId("P1")
            .name("Alex")
            .age(52)
            .exerciseFrequency("daily")
            .painPoint(new PatientProfile.Pain("Pain climbing stairs", 6))
            .build();

    @BeforeEach
    void setUp() {
        httpClient = mock(OkHttpClient.class);
        call = mock(Call.class);
        secretStore = mock(SecretStore.class);
        when(httpClient.newCall(any())).thenAnswer(inv -> {
            lastRequest = inv.getArgument(0);
            return call;
        });
        when(secretStore.get("anthropic-api-key")).thenReturn("sk-test");

        LlmClientSettings settings = LlmClientSettings.builder()
                .baseUrl("https://llm.example/v1/messages")
                .model("claude-test")
                .secretId("anthropic-api-key")
                .maxTokens(2000)
                .temperature(0.3)
                .maxAttempts(1)
                .build();
        ObjectMapper objectMapper = new ObjectMapper();
        provider = new ClaudeExerciseProvider(settings, httpClient, secretStore, objectMapper,
                new PromptTemplateManager(), new ExerciseProposalParser(objectMapper));
    }

    private static Response response(Request request, int code, String body) {
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(code)
                .message(code == 200 ? "OK" : "Error")
                .body(ResponseBody.create(body, MediaType.get("application/json")))
                .build();
    }

    private void respond(int code, String body) throws Exception {
        when(call.execute()).thenAnswer(inv -> response(lastRequest, code, body));
    }

    @Test
    void generatesProposalsFromFencedTextBlock() throws Exception {
        respond(200, "{\"content\":[{\"type\":\"text\",\"text\":\"" + EXERCISES + "\"}]}");

        List<ExerciseProposal> proposals = provider.generate(profile);

        assertThat(provider.provider()).isEqualTo(LlmProvider.CLAUDE);
        assertThat(proposals).extracting(ExerciseProposal::getName)
                .containsExactly("Quad Sets", "Heel Slides", "Wall Sits");
        assertThat(proposals.get(0).getInstructions()).containsExactly("Tighten", "Hold");
    }

    @Test
    void sendsAnthropicHeadersAndFreshKey() throws Exception {
        respond(200, "{\"content\":[{\"type\":\"text\",\"text\":\"" + EXERCISES + "\"}]}");

        provider.generate(profile);
        provider.generate(profile);

        ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
        verify(httpClient, times(2)).newCall(captor.capture());
        Request sent = captor.getValue();
        assertThat(sent.header("x-api-key")).isEqualTo("sk-test");
        assertThat(sent.header("anthropic-version")).isEqualTo("2023-06-01");
        assertThat(sent.url().toString()).isEqualTo("https://llm.example/v1/messages");
        verify(secretStore, times(2)).get("anthropic-api-key");
    }

    @Test
    void nonSuccessStatusIsGenerationError() throws Exception {
        respond(529, "{\"error\":{\"message\":\"overloaded\"}}");

        assertThatThrownBy(() -> provider.generate(profile))
                .isInstanceOf(GenerationException.class)
                .isNotInstanceOf(GenerationParseException.class)
                .hasMessageContaining("529");
    }

    @Test
    void errorObjectInBodyIsGenerationError() throws Exception {
        respond(200, "{\"error\":{\"message\":\"invalid x-api-key\"}}");

        assertThatThrownBy(() -> provider.generate(profile))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("invalid x-api-key");
    }

    @Test
    void emptyContentIsGenerationError() throws Exception {
        respond(200, "{\"content\":[]}");

        assertThatThrownBy(() -> provider.generate(profile))
                .isInstanceOf(GenerationException.class);
    }

    @Test
    void unparseableTextIsParseError() throws Exception {
        respond(200, "{\"content\":[{\"type\":\"text\",\"text\":\"Sorry, I can't do that.\"}]}");

        assertThatThrownBy(() -> provider.generate(profile))
                .isInstanceOf(GenerationParseException.class);
    }

    @Test
    void timeoutIsGenerationError() throws Exception {
        when(call.execute()).thenThrow(new SocketTimeoutException("timeout"));

        assertThatThrownBy(() -> provider.generate(profile))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("超时");
    }
}
