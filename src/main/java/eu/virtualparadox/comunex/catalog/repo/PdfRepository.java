package eu.virtualparadox.comunex.catalog.repo;

import eu.virtualparadox.comunex.catalog.entity.PdfEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface PdfRepository extends JpaRepository<PdfEntity, String> {

    /**
     * Plain insert: a second row with the same hash violates the primary key instead of
     * being merged into the existing one, which is what {@code save()} would do.
     */
    @Modifying
    @Query(value = "insert into pdfs (hash, url, original_name, local_path, detected_year, downloaded_at, content_type, size_bytes) "
            + "values (:hash, :url, :originalName, :localPath, :detectedYear, :downloadedAt, :contentType, :sizeBytes)",
            nativeQuery = true)
    int insert(@Param("hash") String hash,
               @Param("url") String url,
               @Param("originalName") String originalName,
               @Param("localPath") String localPath,
               @Param("detectedYear") Integer detectedYear,
               @Param("downloadedAt") Instant downloadedAt,
               @Param("contentType") String contentType,
               @Param("sizeBytes") long sizeBytes);

    List<PdfEntity> findByDetectedYearIn(Collection<Integer> years);

    List<PdfEntity> findByDetectedYearIsNotNull();

    long countByDetectedYearIsNull();
}
