package eu.virtualparadox.comunex.store.year;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class YearPatternsTest {

    @Test
    @DisplayName("Latest in-range year wins in URLs and file names")
    void latestYear() {
        assertEquals(Optional.of(2023), YearPatterns.latestIn("https://comune.it/docs/2021/bilancio_2023.pdf"));
        assertEquals(Optional.of(2019), YearPatterns.latestIn("rendiconto-2019-def.pdf"));
        assertEquals(Optional.of(1990), YearPatterns.latestIn("delibera1990"));
    }

    @Test
    @DisplayName("Years embedded in longer digit runs or out of range are ignored")
    void rejectsNonYears() {
        assertEquals(Optional.empty(), YearPatterns.latestIn("protocollo 120231 del 1989"));
        assertEquals(Optional.empty(), YearPatterns.latestIn("piano 2031"));
        assertEquals(Optional.empty(), YearPatterns.latestIn("allegato_A.pdf"));
        assertEquals(Optional.empty(), YearPatterns.latestIn(null));
    }

    @Test
    @DisplayName("Content year is the most frequent one, ties go to the most recent")
    void mostFrequent() {
        assertEquals(Optional.of(2021), YearPatterns.mostFrequentIn("2021 2022 2021 bilancio 2020", 1000));
        assertEquals(Optional.of(2022), YearPatterns.mostFrequentIn("esercizio 2021 e 2022", 1000));
    }

    @Test
    @DisplayName("Only the leading characters are scanned")
    void headOnly() {
        final String text = "esercizio 2020 " + "x".repeat(100) + " 2024 2024 2024";

        assertEquals(Optional.of(2020), YearPatterns.mostFrequentIn(text, 50));
    }

    @Test
    @DisplayName("Year bounds are inclusive: 1990 and 2030 accepted, 1850, 1989 and 2031 rejected")
    void yearBounds() {
        assertEquals(Optional.of(2030), YearPatterns.latestIn("piano_2030.pdf"));
        assertEquals(Optional.of(1990), YearPatterns.latestIn("archivio-1990"));
        assertEquals(Optional.empty(), YearPatterns.latestIn("catasto 1850"));
        assertEquals(Optional.empty(), YearPatterns.latestIn("delibera_1989.pdf"));
        assertEquals(Optional.empty(), YearPatterns.latestIn("programma-2031.pdf"));
        assertEquals(Optional.of(2030), YearPatterns.latestIn("piano 2031 e 2030"));
        assertEquals(Optional.empty(), YearPatterns.mostFrequentIn("2031 2031 1850", 1000));
    }

    @Test
    @DisplayName("Digit runs longer than four digits never yield a year")
    void longDigitRuns() {
        assertEquals(Optional.empty(), YearPatterns.latestIn("protocollo 120234"));
        assertEquals(Optional.empty(), YearPatterns.latestIn("20231"));
        assertEquals(Optional.of(2023), YearPatterns.latestIn("atto_2023_n120234"));
        assertEquals(Optional.empty(), YearPatterns.mostFrequentIn("120234 120234 120234", 1000));
    }

    @Test
    @DisplayName("A frequency tie goes to the more recent year regardless of order")
    void tieGoesToRecentYear() {
        assertEquals(Optional.of(2022), YearPatterns.mostFrequentIn("2022 2019 2019 2022", 1000));
        assertEquals(Optional.of(2022), YearPatterns.mostFrequentIn("2019 2022 2022 2019", 1000));
    }

    @Test
    @DisplayName("A year past the scan limit is not seen")
    void yearPastLimit() {
        assertEquals(Optional.empty(), YearPatterns.mostFrequentIn("x".repeat(5_000) + " 2022", 5_000));
        assertEquals(Optional.of(2022), YearPatterns.mostFrequentIn("x".repeat(4_990) + " 2022", 5_000));
    }
}
