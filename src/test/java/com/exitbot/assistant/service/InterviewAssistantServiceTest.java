package com.exitbot.assistant.service;

import com.exitbot.assistant.config.LlmProperties;
import com.exitbot.assistant.exception.ErrorKind;
import com.exitbot.assistant.exception.LlmException;
import com.exitbot.assistant.llm.LlmClient;
import com.exitbot.assistant.llm.LlmClientFactory;
import com.exitbot.assistant.model.InterviewAnalysis;
import com.exitbot.assistant.model.LlmRequest;
import com.exitbot.assistant.model.LlmResponse;
import com.exitbot.assistant.model.Message;
import com.exitbot.assistant.model.ReplyOptions;
import com.exitbot.assistant.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InterviewAssistantServiceTest {

    private LlmClient llmClient;
    private LlmClientFactory clientFactory;
    private LlmProperties props;
    private MutableClock clock;
    private InterviewAssistantService service;

    @BeforeEach
    void setUp() {
        llmClient = mock(LlmClient.class);
        clientFactory = mock(LlmClientFactory.class);
        props = new LlmProperties();
        when(llmClient.getProviderName()).thenReturn("groq");
        clock = new MutableClock();
        service = new InterviewAssistantService(llmClient, clientFactory, props, clock);
    }

    private static LlmResponse reply(String content) {
        return LlmResponse.builder().content(content).provider("groq").build();
    }

    @Test
    void generateReply_prependsSystemPromptWhenMissing() {
        when(llmClient.chat(any())).thenReturn(reply("Why are you leaving?"));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);

        String result = service.generateReply(List.of(Message.user("Hi")), null);

        assertThat(result).isEqualTo("Why are you leaving?");
        verify(llmClient).chat(captor.capture());
        List<Message> sent = captor.getValue().getMessages();
        assertThat(sent).hasSize(2);
        assertThat(sent.get(0).getRole()).isEqualTo(Message.Role.system);
        assertThat(sent.get(0).getContent()).isEqualTo(props.getInterview().getSystemPrompt());
        assertThat(sent.get(1)).isEqualTo(Message.user("Hi"));
    }

    @Test
    void generateReply_keepsCallerSystemPromptAndOptions() {
        when(llmClient.chat(any())).thenReturn(reply("ok"));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        List<Message> history = List.of(
                Message.system("Custom prompt"),
                Message.user("Hello"),
                Message.assistant("Welcome"),
                Message.user("My manager was great"));

        service.generateReply(history, ReplyOptions.builder().model("gpt-4o").temperature(0.2).maxTokens(64).build());

        verify(llmClient).chat(captor.capture());
        LlmRequest sent = captor.getValue();
        assertThat(sent.getMessages()).containsExactlyElementsOf(history);
        assertThat(sent.getModel()).isEqualTo("gpt-4o");
        assertThat(sent.getTemperature()).isEqualTo(0.2);
        assertThat(sent.getMaxTokens()).isEqualTo(64);
    }

    @Test
    void generateReply_propagatesFailure() {
        when(llmClient.chat(any())).thenThrow(LlmException.circuitOpen("groq"));

        assertThatThrownBy(() -> service.generateReply(List.of(Message.user("Hi")), null))
                .isInstanceOf(LlmException.class)
                .extracting("kind").isEqualTo(ErrorKind.CIRCUIT_OPEN);
    }

    @Test
    void generateReplyOrFallback_success() {
        when(llmClient.chat(any())).thenReturn(reply("Thanks for sharing."));

        LlmResponse response = service.generateReplyOrFallback(List.of(Message.user("Hi")), null);

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getContent()).isEqualTo("Thanks for sharing.");
    }

    @Test
    void generateReplyOrFallback_failure_returnsFallbackReply() {
        when(llmClient.chat(any())).thenThrow(new LlmException(ErrorKind.TRANSIENT, "groq", "timeout"));

        LlmResponse response = service.generateReplyOrFallback(List.of(Message.user("Hi")), null);

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getErrorKind()).isEqualTo(ErrorKind.TRANSIENT);
        assertThat(response.getContent()).isEqualTo(props.getInterview().getFallbackReply());
        assertThat(response.getProvider()).isEqualTo("groq");
    }

    @Test
    void analyzeSentiment_sendsDeterministicPromptAndParsesScore() {
        when(llmClient.chat(any())).thenReturn(reply("0.75"));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);

        double score = service.analyzeSentiment("I loved my team");

        assertThat(score).isEqualTo(0.75);
        verify(llmClient).chat(captor.capture());
        assertThat(captor.getValue().getTemperature()).isEqualTo(0.0);
        assertThat(captor.getValue().lastUserMessage().getContent()).contains("Text: I loved my team");
    }

    @Test
    void analyzeSentiment_failure_isNeutral() {
        when(llmClient.chat(any())).thenThrow(new LlmException(ErrorKind.AUTH_FAILURE, "groq", "bad key"));

        assertThat(service.analyzeSentiment("Awful place")).isZero();
    }

    @Test
    void analyzeSentiment_blankText_skipsModel() {
        assertThat(service.analyzeSentiment(" ")).isZero();
        assertThat(service.analyzeSentiment(null)).isZero();
    }

    @Test
    void analyzeInterview_sendsTranscriptUnderAnalystPrompt() {
        when(llmClient.chat(any())).thenReturn(reply("Executive summary: left for growth."));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        List<Message> history = List.of(
                Message.system("Interviewer prompt"),
                Message.assistant("Why are you leaving?"),
                Message.user("Better growth elsewhere."),
                Message.assistant("What could we improve?"),
                Message.user("Clearer promotion paths."));

        InterviewAnalysis analysis = service.analyzeInterview(history);

        assertThat(analysis.isAvailable()).isTrue();
        assertThat(analysis.getAnalysis()).isEqualTo("Executive summary: left for growth.");
        assertThat(analysis.getInterviewLength()).isEqualTo(4);
        assertThat(analysis.getTimestamp()).isEqualTo(clock.instant());
        assertThat(analysis.getProvider()).isEqualTo("groq");

        verify(llmClient).chat(captor.capture());
        LlmRequest sent = captor.getValue();
        assertThat(sent.getTemperature()).isEqualTo(0.3);
        assertThat(sent.getMessages()).hasSize(5);
        assertThat(sent.getMessages().get(0))
                .isEqualTo(Message.system(props.getInterview().getAnalysisPrompt()));
        assertThat(sent.getMessages()).doesNotContain(Message.system("Interviewer prompt"));
        assertThat(sent.getMessages().subList(1, 5)).containsExactlyElementsOf(history.subList(1, 5));
    }

    @Test
    void analyzeInterview_providerDown_returnsUnavailableNotice() {
        when(llmClient.chat(any())).thenThrow(LlmException.circuitOpen("groq"));

        InterviewAnalysis analysis = service.analyzeInterview(List.of(Message.user("I was underpaid.")));

        assertThat(analysis.isAvailable()).isFalse();
        assertThat(analysis.getErrorKind()).isEqualTo(ErrorKind.CIRCUIT_OPEN);
        assertThat(analysis.getAnalysis()).isEqualTo(props.getInterview().getAnalysisUnavailable());
        assertThat(analysis.getInterviewLength()).isEqualTo(1);
        assertThat(analysis.getTimestamp()).isEqualTo(clock.instant());
    }

    @Test
    void analyzeInterview_emptyTranscript_skipsModel() {
        InterviewAnalysis analysis = service.analyzeInterview(List.of(Message.system("Interviewer prompt")));

        assertThat(analysis.getInterviewLength()).isZero();
        assertThat(analysis.getAnalysis()).isEmpty();
        verify(llmClient, never()).chat(any());
    }

    @ParameterizedTest
    @CsvSource({
            "0.5,                          0.5",
            "'  -0.25 ',                   -0.25",
            "'Sentiment score: 0.8',       0.8",
            "'The answer is -0.4.',        -0.4",
            "3.5,                          1.0",
            "-7,                           -1.0",
            "'no number here',             0.0",
            "NaN,                          0.0"
    })
    void parseSentiment_extractsAndClamps(String raw, double expected) {
        assertThat(InterviewAssistantService.parseSentiment(raw)).isEqualTo(expected);
    }

    @Test
    void clearCache_clearsEveryBuiltClient() {
        LlmClient other = mock(LlmClient.class);
        when(clientFactory.builtClients()).thenReturn(List.of(llmClient, other));

        service.clearCache();

        verify(llmClient).clearCache();
        verify(other).clearCache();
    }

    @Test
    void resetCircuit_delegatesToNamedProvider() {
        LlmClient ollama = mock(LlmClient.class);
        when(clientFactory.getClient("ollama")).thenReturn(ollama);

        service.resetCircuit("ollama");

        verify(ollama).resetCircuit();
    }
}
