package hrms.hrmsbackend.repository.mysql.attendance;

import hrms.hrmsbackend.entity.mysql.attendance.ClockInRecord;
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
public interface ClockInRecordRepository extends JpaRepository<ClockInRecord, Long> {

    Optional<ClockInRecord> findByEmployeeIdAndWorkDate(Long employeeId, LocalDate workDate);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM ClockInRecord c WHERE c.employeeId = :employeeId AND c.workDate = :workDate")
    Optional<ClockInRecord> findForUpdate(@Param("employeeId") Long employeeId, @Param("workDate") LocalDate workDate);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM ClockInRecord c WHERE c.id IN :ids")
    List<ClockInRecord> findAllForUpdate(@Param("ids") Collection<Long> ids);

    List<ClockInRecord> findByEmployeeIdAndWorkDateBetweenOrderByWorkDateDesc(Long employeeId, LocalDate from, LocalDate to);

    /**
     * 승인 대기 OT (플래그 + 미결정 + 최소 분 이상)
     */
    @Query("SELECT c FROM ClockInRecord c WHERE c.companyId = :companyId AND c.otFlagged = true " +
            "AND c.otApproved IS NULL AND c.otMinutes >= :minMinutes ORDER BY c.workDate DESC")
    List<ClockInRecord> findPendingOvertime(@Param("companyId") Long companyId, @Param("minMinutes") int minMinutes);

    @Query("SELECT c FROM ClockInRecord c WHERE c.companyId = :companyId AND c.otFlagged = true " +
            "AND c.otApprovedAt >= :from AND c.otApprovedAt < :to")
    List<ClockInRecord> findOvertimeDecidedBetween(@Param("companyId") Long companyId,
                                                   @Param("from") java.time.LocalDateTime from,
                                                   @Param("to") java.time.LocalDateTime to);
}
