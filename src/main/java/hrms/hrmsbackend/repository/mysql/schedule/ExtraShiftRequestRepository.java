package hrms.hrmsbackend.repository.mysql.schedule;

import hrms.hrmsbackend.entity.mysql.schedule.ExtraShiftRequest;
import hrms.hrmsbackend.enums.RequestStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ExtraShiftRequestRepository extends JpaRepository<ExtraShiftRequest, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM ExtraShiftRequest r WHERE r.id = :id")
    Optional<ExtraShiftRequest> findWithLockById(@Param("id") Long id);

    boolean existsByEmployeeIdAndRequestDateAndStatus(Long employeeId, LocalDate requestDate, RequestStatus status);

    List<ExtraShiftRequest> findByEmployeeIdOrderByCreatedAtDesc(Long employeeId);

    List<ExtraShiftRequest> findByCompanyIdAndStatusAndApprovalLevelIn(Long companyId, RequestStatus status, Collection<Integer> levels);

    List<ExtraShiftRequest> findByStatusAndRequestDateBefore(RequestStatus status, LocalDate date);
}
