package hrms.hrmsbackend.repository.mysql.leave;

import hrms.hrmsbackend.entity.mysql.leave.LeaveRequest;
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
public interface LeaveRequestRepository extends JpaRepository<LeaveRequest, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM LeaveRequest r WHERE r.id = :id")
    Optional<LeaveRequest> findWithLockById(@Param("id") Long id);

    /**
     * 기간이 하루라도 겹치는 요청 존재 여부
     */
    @Query("SELECT COUNT(r) > 0 FROM LeaveRequest r WHERE r.employeeId = :employeeId AND r.status IN :statuses " +
            "AND r.startDate <= :endDate AND r.endDate >= :startDate")
    boolean existsOverlapping(@Param("employeeId") Long employeeId,
                              @Param("startDate") LocalDate startDate,
                              @Param("endDate") LocalDate endDate,
                              @Param("statuses") Collection<RequestStatus> statuses);

    @Query("SELECT COUNT(r) FROM LeaveRequest r WHERE r.employeeId = :employeeId AND r.leaveTypeId = :leaveTypeId " +
            "AND r.status IN :statuses AND r.startDate BETWEEN :yearStart AND :yearEnd")
    long countOccurrences(@Param("employeeId") Long employeeId,
                          @Param("leaveTypeId") Long leaveTypeId,
                          @Param("statuses") Collection<RequestStatus> statuses,
                          @Param("yearStart") LocalDate yearStart,
                          @Param("yearEnd") LocalDate yearEnd);

    List<LeaveRequest> findByEmployeeIdOrderByStartDateDesc(Long employeeId);

    List<LeaveRequest> findByCompanyIdAndStatusAndApprovalLevelIn(Long companyId, RequestStatus status, Collection<Integer> levels);

    List<LeaveRequest> findByStatusAndEndDateBefore(RequestStatus status, LocalDate date);
}
