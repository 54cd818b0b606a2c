package hrms.hrmsbackend.repository.mysql.leave;

import hrms.hrmsbackend.entity.mysql.leave.LeaveBalance;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LeaveBalanceRepository extends JpaRepository<LeaveBalance, Long> {

    Optional<LeaveBalance> findByEmployeeIdAndLeaveTypeIdAndYear(Long employeeId, Long leaveTypeId, Integer year);

    // 차감/복원 시 행 잠금
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM LeaveBalance b WHERE b.employeeId = :employeeId AND b.leaveTypeId = :leaveTypeId AND b.year = :year")
    Optional<LeaveBalance> findForUpdate(@Param("employeeId") Long employeeId,
                                         @Param("leaveTypeId") Long leaveTypeId,
                                         @Param("year") Integer year);

    List<LeaveBalance> findByEmployeeIdAndYear(Long employeeId, Integer year);
}
