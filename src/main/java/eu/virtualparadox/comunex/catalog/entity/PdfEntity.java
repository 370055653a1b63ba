package eu.virtualparadox.comunex.catalog.entity;

import eu.virtualparadox.comunex.catalog.converter.PathConverter;
import jakarta.persistence.*;
import lombok.*;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One stored PDF, keyed by the SHA-1 of its bytes. The {@code url} is the first URL the
 * content was fetched from; further URLs serving the same bytes live in {@link PdfUrlEntity}.
 */
@Entity
@Table(name = "pdfs", indexes = {
        @Index(name = "idx_pdfs_url", columnList = "url"),
        @Index(name = "idx_pdfs_year", columnList = "detected_year")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PdfEntity {

    @Id
    @Column(length = 40, nullable = false)
    private String hash;

    @Column(length = 2048, nullable = false)
    private String url;

    @Column(name = "original_name", length = 512, nullable = false)
    private String originalName;

    @Column(name = "local_path", length = 1024, nullable = false)
    @Convert(converter = PathConverter.class)
    private Path localPath;

    @Column(name = "detected_year")
    private Integer detectedYear;

    @Column(name = "downloaded_at", nullable = false)
    private Instant downloadedAt;

    @Column(name = "content_type", length = 255)
    private String contentType;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @PrePersist
    void prePersist() {
        if (hash == null || hash.isBlank()) {
            throw new IllegalStateException("PDF record requires a content hash");
        }
        if (localPath == null) {
            throw new IllegalStateException("PDF record requires a local path: " + hash);
        }
        if (downloadedAt == null) {
            downloadedAt = Instant.now();
        }
    }
}
