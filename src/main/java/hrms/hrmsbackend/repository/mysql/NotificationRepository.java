package hrms.hrmsbackend.repository.mysql;

import hrms.hrmsbackend.entity.mysql.Notification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, Long> {

    List<Notification> findTop50ByEmployeeIdOrderByCreatedAtDesc(Long employeeId);

    List<Notification> findTop50ByEmployeeIdAndReadFalseOrderByCreatedAtDesc(Long employeeId);

    Optional<Notification> findByIdAndEmployeeId(Long id, Long employeeId);

    long countByEmployeeIdAndReadFalse(Long employeeId);

    @Modifying
    @Query("UPDATE Notification n SET n.read = true WHERE n.employeeId = :employeeId AND n.read = false")
    int markAllRead(@Param("employeeId") Long employeeId);
}
