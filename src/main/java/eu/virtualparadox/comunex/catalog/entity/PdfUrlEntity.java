package eu.virtualparadox.comunex.catalog.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Maps every fetched URL to the content hash it served.
 */
@Entity
@Table(name = "pdf_urls", indexes = @Index(name = "idx_pdf_urls_hash", columnList = "hash"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PdfUrlEntity {

    @Id
    @Column(length = 2048, nullable = false)
    private String url;

    @Column(length = 40, nullable = false)
    private String hash;

    @Column(name = "original_name", length = 512)
    private String originalName;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @PrePersist
    void prePersist() {
        if (recordedAt == null) {
            recordedAt = Instant.now();
        }
    }
}
