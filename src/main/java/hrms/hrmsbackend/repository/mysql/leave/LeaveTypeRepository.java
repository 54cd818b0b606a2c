package hrms.hrmsbackend.repository.mysql.leave;

import hrms.hrmsbackend.entity.mysql.leave.LeaveType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LeaveTypeRepository extends JpaRepository<LeaveType, Long> {

    /**
     * 회사 전용 + 공통(company_id null) 휴가 종류
     */
    @Query("SELECT t FROM LeaveType t WHERE (t.companyId = :companyId OR t.companyId IS NULL) AND t.active = true ORDER BY t.code")
    List<LeaveType> findAvailableForCompany(@Param("companyId") Long companyId);
}
