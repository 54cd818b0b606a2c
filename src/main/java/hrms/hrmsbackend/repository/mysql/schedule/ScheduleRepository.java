package hrms.hrmsbackend.repository.mysql.schedule;

import hrms.hrmsbackend.entity.mysql.schedule.Schedule;
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
public interface ScheduleRepository extends JpaRepository<Schedule, Long> {

    Optional<Schedule> findByEmployeeIdAndScheduleDate(Long employeeId, LocalDate scheduleDate);

    boolean existsByEmployeeIdAndScheduleDate(Long employeeId, LocalDate scheduleDate);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Schedule s WHERE s.id = :id")
    Optional<Schedule> findWithLockById(@Param("id") Long id);

    List<Schedule> findByEmployeeIdAndScheduleDateBetweenOrderByScheduleDate(Long employeeId, LocalDate from, LocalDate to);

    List<Schedule> findByEmployeeIdInAndScheduleDateBetween(Collection<Long> employeeIds, LocalDate from, LocalDate to);

    List<Schedule> findByOutletIdAndScheduleDateBetween(Long outletId, LocalDate from, LocalDate to);

    List<Schedule> findByDepartmentIdAndScheduleDateBetween(Long departmentId, LocalDate from, LocalDate to);
}
