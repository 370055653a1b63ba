package eu.virtualparadox.comunex.store.year;

import eu.virtualparadox.comunex.ingest.extractor.TextExtractor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class YearResolverTest {

    private final TextExtractor textExtractor = mock(TextExtractor.class);
    private final YearResolver resolver = new YearResolver(textExtractor);
    private final Path document = Path.of("doc.pdf");

    @Test
    @DisplayName("URL year wins over file name and content")
    void urlFirst() {
        final Integer year = resolver.resolve("https://comune.it/2022/doc.pdf", "bilancio_2019.pdf", document);

        assertEquals(2022, year);
        verifyNoInteractions(textExtractor);
    }

    @Test
    @DisplayName("File name is used when the URL carries no year")
    void filenameSecond() {
        final Integer year = resolver.resolve("https://comune.it/download?id=7", "bilancio_2019.pdf", document);

        assertEquals(2019, year);
        verifyNoInteractions(textExtractor);
    }

    @Test
    @DisplayName("Content of the first two pages is the last resort")
    void contentLast() {
        when(textExtractor.firstPages(document, 2)).thenReturn("Rendiconto esercizio 2020. Approvato nel 2021 per il 2020.");

        final Integer year = resolver.resolve("https://comune.it/download?id=7", "allegato.pdf", document);

        assertEquals(2020, year);
    }

    @Test
    @DisplayName("No year anywhere resolves to null")
    void unknown() {
        when(textExtractor.firstPages(any(), anyInt())).thenReturn("");

        assertNull(resolver.resolve("https://comune.it/doc", "allegato.pdf", document));
        assertNull(resolver.resolve("https://comune.it/doc", "allegato.pdf", null));
    }

    @Test
    @DisplayName("Content years are read from the first 5000 characters only")
    void contentScanLimit() {
        final String text = "Relazione 2021. " + "testo ".repeat(1_000) + "2023 2023 2023 2023";
        when(textExtractor.firstPages(document, 2)).thenReturn(text);

        assertEquals(2021, resolver.resolve("https://comune.it/download?id=7", "allegato.pdf", document));
    }

    @Test
    @DisplayName("Out-of-range years in URL and file name fall through to the content")
    void outOfRangeFallsThrough() {
        when(textExtractor.firstPages(document, 2)).thenReturn("Bilancio di previsione 2024 - 2026, anno 2024");

        final Integer year = resolver.resolve("https://comune.it/archivio/1850/doc.pdf", "piano_2031.pdf", document);

        assertEquals(2024, year);
    }
}
