package hrms.hrmsbackend.repository.mysql;

import hrms.hrmsbackend.entity.mysql.Letter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LetterRepository extends JpaRepository<Letter, Long> {

    List<Letter> findByEmployeeIdOrderByCreatedAtDesc(Long employeeId);

    Optional<Letter> findByIdAndEmployeeId(Long id, Long employeeId);

    long countByEmployeeIdAndReadFalse(Long employeeId);
}
