package com.waypoint.core.llm;

import com.waypoint.core.reasoning.LockSummaryResponse;
import com.waypoint.core.reasoning.NextStepResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Mocks the whole {@link ChatClient} chain; no model is called.
 */
class LlmServiceTest {

    private ChatClientRequestSpec requestSpec;
    private CallResponseSpec callResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        ChatClient chatClient = mock(ChatClient.class);
        requestSpec = mock(ChatClientRequestSpec.class);
        callResponse = mock(CallResponseSpec.class);

        when(chatClient.prompt()).thenReturn(requestSpec);
        when(requestSpec.system(anyString())).thenReturn(requestSpec);
        when(requestSpec.user(anyString())).thenReturn(requestSpec);
        when(requestSpec.call()).thenReturn(callResponse);

        ChatClient.Builder builder = mock(ChatClient.Builder.class);
        when(builder.build()).thenReturn(chatClient);

        llmService = new LlmService(builder, "http://test:1234");
    }

    @Test
    @DisplayName("sends the system prompt and appends format instructions to the user prompt")
    void sendsPrompts() {
        when(callResponse.content()).thenReturn("{\"summary\":\"On track\"}");

        llmService.structuredCall("System prompt", "User prompt", LockSummaryResponse.class);

        verify(requestSpec).system("System prompt");
        ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
        verify(requestSpec).user(user.capture());
        assertTrue(user.getValue().startsWith("User prompt\n\n"));
        assertTrue(user.getValue().length() > "User prompt\n\n".length());
    }

    @Test
    @DisplayName("deserializes a well-formed answer")
    void parsesAnswer() {
        when(callResponse.content()).thenReturn("""
                {"title":"Run 5k","guidance":"Easy pace","daysFromNow":4,"isFinalStep":false,"outcome":"Base fitness"}
                """);

        NextStepResponse result = llmService.structuredCall("s", "u", NextStepResponse.class);

        assertEquals("Run 5k", result.title());
        assertEquals(4, result.daysFromNow());
        assertEquals(Boolean.FALSE, result.isFinalStep());
    }

    @Test
    @DisplayName("falls back to lenient parsing for fenced answers with unknown fields")
    void lenientFallback() {
        when(callResponse.content()).thenReturn("""
                ```json
                {"summary":"Worth keeping","confidence":0.9}
                ```
                """);

        LockSummaryResponse result = llmService.structuredCall("s", "u", LockSummaryResponse.class);

        assertEquals("Worth keeping", result.summary());
    }

    @Test
    @DisplayName("blank content raises LlmEmptyResponseException")
    void emptyContent() {
        when(callResponse.content()).thenReturn("  ");

        assertThrows(LlmEmptyResponseException.class,
                () -> llmService.structuredCall("s", "u", LockSummaryResponse.class));
    }

    @Test
    @DisplayName("unparseable content raises LlmParseException")
    void garbage() {
        when(callResponse.content()).thenReturn("I would rather not answer in JSON.");

        assertThrows(LlmParseException.class,
                () -> llmService.structuredCall("s", "u", LockSummaryResponse.class));
    }

    @Test
    @DisplayName("stripFences removes json and plain fences")
    void stripFences() {
        assertEquals("{}", LlmService.stripFences("```json\n{}\n```"));
        assertEquals("{}", LlmService.stripFences("```\n{}\n```"));
        assertEquals("{}", LlmService.stripFences("  {}  "));
    }
}
