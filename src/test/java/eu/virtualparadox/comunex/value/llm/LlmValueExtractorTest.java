package eu.virtualparadox.comunex.value.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.comunex.application.config.LlmConfig;
import eu.virtualparadox.comunex.catalog.entity.ValueCacheEntity;
import eu.virtualparadox.comunex.catalog.service.DocumentCatalogService;
import eu.virtualparadox.comunex.store.WorkspaceLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class LlmValueExtractorTest {

    private static final String TEXT = "Nel 2023 la spesa corrente ammonta a 1.234.567,89 euro.";

    @TempDir
    Path root;

    private LlmConfig config;
    private ChatModel chatModel;
    private DocumentCatalogService catalog;
    private WorkspaceLayout layout;
    private LlmValueExtractor extractor;
    private final Map<String, ValueCacheEntity> cacheIndex = new HashMap<>();

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        config = new LlmConfig();
        config.setEnabled(true);
        config.setModel("test-model");
        chatModel = mock(ChatModel.class);
        final ObjectProvider<ChatModel> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(chatModel);
        when(provider.getObject()).thenReturn(chatModel);

        catalog = mock(DocumentCatalogService.class);
        when(catalog.findValueCache(anyString())).thenAnswer(inv -> Optional.ofNullable(cacheIndex.get(inv.getArgument(0, String.class))));
        doAnswer(inv -> {
            final ValueCacheEntity entry = inv.getArgument(0);
            cacheIndex.put(entry.getCacheKey(), entry);
            return null;
        }).when(catalog).recordValueCache(any());

        layout = new WorkspaceLayout(root, "comune");
        extractor = new LlmValueExtractor(config, provider, catalog, layout, new ObjectMapper());
    }

    private void reply(final String content) {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage(content)))));
    }

    @Test
    @DisplayName("Confident answer for the requested year is returned and cached on disk")
    void confidentAnswer() {
        reply("```json\n{\"value\": 1234567.89, \"unit\": \"EUR\", \"year\": 2023, \"evidence\": \"spesa corrente\", \"confidence\": 0.9}\n```");

        final Optional<LlmValue> value = extractor.extract(TEXT, "spesa corrente", 2023);

        assertTrue(value.isPresent());
        assertEquals(1_234_567.89, value.get().value(), 1e-6);
        assertEquals(1, cacheIndex.size());
        final ValueCacheEntity entry = cacheIndex.values().iterator().next();
        assertEquals(layout.valueCacheDir(2023), entry.getResultPath().getParent());
        assertTrue(Files.exists(entry.getResultPath()));
        assertEquals("test-model", entry.getModel());
    }

    @Test
    @DisplayName("Second call with the same inputs is served from the cache")
    void cacheHit() {
        reply("{\"value\": 10, \"year\": 2023, \"confidence\": 0.8}");

        extractor.extract(TEXT, "spesa corrente", 2023);
        final Optional<LlmValue> again = extractor.extract(TEXT, "spesa corrente", 2023);

        assertTrue(again.isPresent());
        verify(chatModel, times(1)).call(any(Prompt.class));
    }

    @Test
    @DisplayName("Low confidence and wrong year are cached but not used")
    void rejectedAnswersStillCached() {
        reply("{\"value\": 10, \"year\": 2022, \"confidence\": 0.95}");

        assertTrue(extractor.extract(TEXT, "spesa corrente", 2023).isEmpty());
        assertTrue(extractor.extract(TEXT, "spesa corrente", 2023).isEmpty());
        verify(chatModel, times(1)).call(any(Prompt.class));

        assertFalse(LlmValueExtractor.isAcceptable(new LlmValue(10.0, null, 2023, null, 0.5), 2023, 0.7));
        assertFalse(LlmValueExtractor.isAcceptable(new LlmValue(null, null, 2023, null, 0.9), 2023, 0.7));
        assertTrue(LlmValueExtractor.isAcceptable(new LlmValue(10.0, null, 2023, null, 0.7), 2023, 0.7));
    }

    @Test
    @DisplayName("Unparseable replies and model failures yield nothing and are not cached")
    void invalidReplies() {
        reply("I could not find the value.");
        assertTrue(extractor.extract(TEXT, "spesa corrente", 2023).isEmpty());

        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("model offline"));
        assertTrue(extractor.extract(TEXT, "abitanti", 2023).isEmpty());

        assertTrue(cacheIndex.isEmpty());
    }

    @Test
    @DisplayName("Disabled extraction never calls the model")
    void disabled() {
        config.setEnabled(false);

        assertFalse(extractor.isAvailable());
        assertTrue(extractor.extract(TEXT, "spesa corrente", 2023).isEmpty());
        verifyNoInteractions(chatModel);
    }

    @Test
    @DisplayName("Cache key depends on the text prefix, indicator, year and model only")
    void cacheKey() {
        final String base = "a".repeat(1000);
        final String key = LlmValueExtractor.cacheKey(base + "tail one", "spesa", 2023, "m", 1000);

        assertEquals(key, LlmValueExtractor.cacheKey(base + "tail two", "spesa", 2023, "m", 1000));
        assertNotEquals(key, LlmValueExtractor.cacheKey(base, "spesa", 2022, "m", 1000));
        assertNotEquals(key, LlmValueExtractor.cacheKey(base, "spesa", 2023, "other", 1000));
        assertNotEquals(key, LlmValueExtractor.cacheKey(base, "entrate", 2023, "m", 1000));
        assertEquals(64, key.length());
    }
}
