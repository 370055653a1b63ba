package eu.virtualparadox.comunex.catalog.entity;

import eu.virtualparadox.comunex.catalog.converter.PathConverter;
import jakarta.persistence.*;
import lombok.*;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Language-model answers keyed by a digest of (text prefix, indicator, year, model).
 * The parsed result itself is kept as a JSON file under the year's value cache directory.
 */
@Entity
@Table(name = "value_cache")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ValueCacheEntity {

    @Id
    @Column(name = "cache_key", length = 64, nullable = false)
    private String cacheKey;

    @Column(length = 512, nullable = false)
    private String indicator;

    @Column(name = "target_year", nullable = false)
    private int targetYear;

    @Column(length = 128, nullable = false)
    private String model;

    @Column(name = "result_path", length = 1024, nullable = false)
    @Convert(converter = PathConverter.class)
    private Path resultPath;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
