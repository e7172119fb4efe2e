package com.exitbot.assistant.llm.provider;

import com.exitbot.assistant.config.LlmProperties;
import com.exitbot.assistant.exception.ErrorKind;
import com.exitbot.assistant.exception.LlmException;
import com.exitbot.assistant.model.LlmRequest;
import com.exitbot.assistant.model.LlmResponse;
import com.exitbot.assistant.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OllamaProviderTest {

    private static final LlmRequest REQUEST = LlmRequest.builder()
            .message(Message.user("How satisfied were you with your role?"))
            .maxTokens(128)
            .build();

    private MockRestServiceServer server;
    private OllamaProvider provider;

    @BeforeEach
    void setUp() {
        LlmProperties.Provider props = new LlmProperties.Provider();
        props.setBaseUrl("localhost:11434/");
        props.setModel("llama3");
        props.setTemperature(0.7);
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new OllamaProvider("ollama", props, builder);
    }

    @ParameterizedTest
    @CsvSource({
            "localhost:11434,          http://localhost:11434",
            "http://gpu-box:11434/,    http://gpu-box:11434",
            "https://ollama.internal//, https://ollama.internal",
            "'',                       http://localhost:11434"
    })
    void normalizeHost_addsSchemeAndStripsTrailingSlash(String input, String expected) {
        assertThat(OllamaProvider.normalizeHost(input)).isEqualTo(expected);
    }

    @Test
    void normalizeHost_null_usesDefault() {
        assertThat(OllamaProvider.normalizeHost(null)).isEqualTo(OllamaProvider.DEFAULT_HOST);
    }

    @Test
    void invoke_success_sendsNonStreamingChat() {
        server.expect(requestTo("http://localhost:11434/api/chat"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.model").value("llama3"))
                .andExpect(jsonPath("$.stream").value(false))
                .andExpect(jsonPath("$.options.num_predict").value(128))
                .andExpect(jsonPath("$.options.temperature").value(0.7))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andRespond(withSuccess("""
                        {
                          "model": "llama3",
                          "message": {"role": "assistant", "content": "Mostly satisfied."},
                          "done": true,
                          "done_reason": "stop",
                          "prompt_eval_count": 20,
                          "eval_count": 4
                        }
                        """, MediaType.APPLICATION_JSON));

        LlmResponse response = provider.invoke(REQUEST);

        assertThat(response.getContent()).isEqualTo("Mostly satisfied.");
        assertThat(response.getProvider()).isEqualTo("ollama");
        assertThat(response.getFinishReason()).isEqualTo("stop");
        assertThat(response.getPromptTokens()).isEqualTo(20);
        assertThat(response.getCompletionTokens()).isEqualTo(4);
        server.verify();
    }

    @Test
    void invoke_serverError_isTransient() {
        server.expect(requestTo("http://localhost:11434/api/chat"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR).body("model is loading"));

        assertThatThrownBy(() -> provider.invoke(REQUEST))
                .isInstanceOf(LlmException.class)
                .extracting("kind").isEqualTo(ErrorKind.TRANSIENT);
    }

    @Test
    void invoke_modelNotFound_isInvalidRequest() {
        server.expect(requestTo("http://localhost:11434/api/chat"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND).body("model 'llama3' not found"));

        assertThatThrownBy(() -> provider.invoke(REQUEST))
                .isInstanceOf(LlmException.class)
                .extracting("kind").isEqualTo(ErrorKind.INVALID_REQUEST);
    }

    @Test
    void invoke_missingMessage_isUnknown() {
        server.expect(requestTo("http://localhost:11434/api/chat"))
                .andRespond(withSuccess("{\"done\":true}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.invoke(REQUEST))
                .isInstanceOf(LlmException.class)
                .extracting("kind").isEqualTo(ErrorKind.UNKNOWN);
    }
}
