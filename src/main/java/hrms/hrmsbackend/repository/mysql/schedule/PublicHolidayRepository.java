package hrms.hrmsbackend.repository.mysql.schedule;

import hrms.hrmsbackend.entity.mysql.schedule.PublicHoliday;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface PublicHolidayRepository extends JpaRepository<PublicHoliday, Long> {

    @Query("SELECT h FROM PublicHoliday h WHERE (h.companyId = :companyId OR h.companyId IS NULL) " +
            "AND h.date BETWEEN :from AND :to")
    List<PublicHoliday> findApplicable(@Param("companyId") Long companyId,
                                       @Param("from") LocalDate from,
                                       @Param("to") LocalDate to);
}
