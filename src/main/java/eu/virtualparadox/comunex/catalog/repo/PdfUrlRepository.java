package eu.virtualparadox.comunex.catalog.repo;

import eu.virtualparadox.comunex.catalog.entity.PdfUrlEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PdfUrlRepository extends JpaRepository<PdfUrlEntity, String> {

    List<PdfUrlEntity> findByHashOrderByRecordedAtAsc(String hash);
}
