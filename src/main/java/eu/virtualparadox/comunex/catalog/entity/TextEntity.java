package eu.virtualparadox.comunex.catalog.entity;

import eu.virtualparadox.comunex.catalog.converter.PathConverter;
import jakarta.persistence.*;
import lombok.*;

import java.nio.file.Path;
import java.time.Instant;

@Entity
@Table(name = "texts")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TextEntity {

    @Id
    @Column(length = 40, nullable = false)
    private String hash;

    @Column(name = "text_path", length = 1024, nullable = false)
    @Convert(converter = PathConverter.class)
    private Path textPath;

    @Column(name = "extracted_at", nullable = false)
    private Instant extractedAt;

    /** Engine that produced the accepted text. */
    @Column(length = 64, nullable = false)
    private String extractor;

    @Column(nullable = false)
    private int pages;

    @Column(name = "text_len", nullable = false)
    private int textLength;

    @PrePersist
    void prePersist() {
        if (extractedAt == null) {
            extractedAt = Instant.now();
        }
    }
}
