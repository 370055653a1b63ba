package eu.virtualparadox.comunex.value.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.comunex.application.config.LlmConfig;
import eu.virtualparadox.comunex.catalog.entity.ValueCacheEntity;
import eu.virtualparadox.comunex.catalog.service.DocumentCatalogService;
import eu.virtualparadox.comunex.store.WorkspaceLayout;
import eu.virtualparadox.comunex.util.ContentHashes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Asks a chat model for an indicator value in a piece of text.
 * <p>
 * Parsed answers are cached on disk under the year's value cache directory and indexed in the
 * catalog, keyed by a SHA-256 of (text prefix, indicator, year, model), so a repeated run never
 * asks twice. An answer is used only when its confidence reaches the configured threshold and
 * it refers to the requested year. Only active when enabled and a {@link ChatModel} bean exists.
 * </p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LlmValueExtractor {

    private static final String INSTRUCTIONS = String.join("\n",
            "You extract numeric indicators from Italian municipal documents.",
            "Answer with a single JSON object and nothing else, with these fields:",
            "  value: the number as a plain decimal (no thousands separators), or null if absent",
            "  unit: the unit of measure (e.g. EUR, %, abitanti), or null",
            "  year: the year the value refers to, as an integer",
            "  evidence: the sentence or table row the value was read from",
            "  confidence: a number between 0 and 1",
            "Never guess: if the text does not state the value for the requested year, return value null.");

    private final LlmConfig config;
    private final ObjectProvider<ChatModel> chatModelProvider;
    private final DocumentCatalogService catalog;
    private final WorkspaceLayout layout;
    private final ObjectMapper objectMapper;

    public boolean isAvailable() {
        return config.isEnabled() && chatModelProvider.getIfAvailable() != null;
    }

    /**
     * @return the value when the model answered confidently for {@code year}
     */
    public Optional<LlmValue> extract(final String text, final String indicator, final int year) {
        if (!isAvailable() || text == null || text.isBlank()) {
            return Optional.empty();
        }
        final String key = cacheKey(text, indicator, year, config.getModel(), config.getCachePrefixLength());
        final Optional<LlmValue> answer = readCache(key).or(() -> askAndCache(key, text, indicator, year));
        return answer.filter(value -> isAcceptable(value, year, config.getConfidenceThreshold()));
    }

    static boolean isAcceptable(final LlmValue answer, final int year, final double threshold) {
        return answer.value() != null
                && answer.confidence() >= threshold
                && Objects.equals(answer.year(), year);
    }

    static String cacheKey(final String text, final String indicator, final int year, final String model, final int prefixLength) {
        final String prefix = text.length() > prefixLength ? text.substring(0, prefixLength) : text;
        return ContentHashes.sha256(prefix + "|" + indicator + "|" + year + "|" + model);
    }

    private Optional<LlmValue> readCache(final String key) {
        return catalog.findValueCache(key).flatMap(entry -> {
            try {
                return Optional.of(objectMapper.readValue(entry.getResultPath().toFile(), LlmValue.class));
            } catch (IOException e) {
                log.warn("Unreadable value cache {}, asking again", entry.getResultPath(), e);
                return Optional.empty();
            }
        });
    }

    private Optional<LlmValue> askAndCache(final String key, final String text, final String indicator, final int year) {
        final String truncated = text.length() > config.getMaxTextLength() ? text.substring(0, config.getMaxTextLength()) : text;
        final String request = "Indicator: " + indicator + "\nYear: " + year + "\n\nText:\n" + truncated;

        final String reply;
        try {
            reply = chatModelProvider.getObject()
                    .call(new Prompt(new SystemMessage(INSTRUCTIONS), new UserMessage(request)))
                    .getResult()
                    .getOutput()
                    .getText();
        } catch (RuntimeException e) {
            log.warn("Language model call failed for '{}' {}: {}", indicator, year, e.getMessage());
            return Optional.empty();
        }

        final Optional<LlmValue> parsed = parse(reply);
        if (parsed.isEmpty()) {
            log.warn("Language model reply for '{}' {} is not valid JSON", indicator, year);
            return Optional.empty();
        }
        writeCache(key, indicator, year, parsed.get());
        return parsed;
    }

    /**
     * Reads the first JSON object in the reply, tolerating code fences and surrounding prose.
     */
    Optional<LlmValue> parse(final String reply) {
        if (reply == null) {
            return Optional.empty();
        }
        final int start = reply.indexOf('{');
        final int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(reply.substring(start, end + 1), LlmValue.class));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private void writeCache(final String key, final String indicator, final int year, final LlmValue value) {
        final Path file = layout.valueCacheDir(year).resolve(key + ".json");
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writeValue(file.toFile(), value);
            catalog.recordValueCache(ValueCacheEntity.builder()
                    .cacheKey(key)
                    .indicator(indicator)
                    .targetYear(year)
                    .model(config.getModel())
                    .resultPath(file)
                    .createdAt(Instant.now())
                    .build());
        } catch (IOException e) {
            log.warn("Could not cache language model answer {}: {}", key, e.getMessage());
        }
    }
}
