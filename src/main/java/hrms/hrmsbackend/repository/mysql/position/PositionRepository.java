package hrms.hrmsbackend.repository.mysql.position;

import hrms.hrmsbackend.entity.mysql.position.Position;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PositionRepository extends JpaRepository<Position, Long> {

    @Cacheable(value = "positionCache", key = "#id")
    @Query("SELECT p FROM Position p WHERE p.id = :id")
    Optional<Position> findCachedById(@Param("id") Long id);
}
