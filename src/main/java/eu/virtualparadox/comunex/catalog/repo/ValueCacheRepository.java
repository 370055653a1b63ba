package eu.virtualparadox.comunex.catalog.repo;

import eu.virtualparadox.comunex.catalog.entity.ValueCacheEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ValueCacheRepository extends JpaRepository<ValueCacheEntity, String> {
}
