package hrms.hrmsbackend.repository.mysql.schedule;

import hrms.hrmsbackend.entity.mysql.schedule.ShiftSwapRequest;
import hrms.hrmsbackend.enums.SwapStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ShiftSwapRequestRepository extends JpaRepository<ShiftSwapRequest, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ShiftSwapRequest s WHERE s.id = :id")
    Optional<ShiftSwapRequest> findWithLockById(@Param("id") Long id);

    /**
     * 두 근무 중 하나라도 진행 중인 교대 요청에 걸려 있는지
     */
    @Query("SELECT COUNT(s) > 0 FROM ShiftSwapRequest s WHERE s.status IN :statuses AND " +
            "(s.requesterShiftId IN :shiftIds OR s.targetShiftId IN :shiftIds)")
    boolean existsActiveForShifts(@Param("shiftIds") Collection<Long> shiftIds,
                                  @Param("statuses") Collection<SwapStatus> statuses);

    @Query("SELECT s FROM ShiftSwapRequest s WHERE s.requesterId = :employeeId OR s.targetId = :employeeId ORDER BY s.createdAt DESC")
    List<ShiftSwapRequest> findInvolving(@Param("employeeId") Long employeeId);

    List<ShiftSwapRequest> findByCompanyIdAndStatus(Long companyId, SwapStatus status);
}
