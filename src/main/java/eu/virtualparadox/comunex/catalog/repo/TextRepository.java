package eu.virtualparadox.comunex.catalog.repo;

import eu.virtualparadox.comunex.catalog.entity.TextEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TextRepository extends JpaRepository<TextEntity, String> {
}
