package hrms.hrmsbackend.repository.mysql.schedule;

import hrms.hrmsbackend.entity.mysql.schedule.ShiftTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ShiftTemplateRepository extends JpaRepository<ShiftTemplate, Long> {

    List<ShiftTemplate> findByCompanyIdAndActiveTrue(Long companyId);

    // 템플릿 id 가 없는 스케줄의 표시용 매칭
    Optional<ShiftTemplate> findFirstByCompanyIdAndStartTimeAndEndTime(Long companyId, LocalTime startTime, LocalTime endTime);
}
