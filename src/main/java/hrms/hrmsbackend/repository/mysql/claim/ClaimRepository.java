package hrms.hrmsbackend.repository.mysql.claim;

import hrms.hrmsbackend.entity.mysql.claim.Claim;
import hrms.hrmsbackend.enums.RequestStatus;
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
public interface ClaimRepository extends JpaRepository<Claim, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Claim c WHERE c.id = :id")
    Optional<Claim> findWithLockById(@Param("id") Long id);

    List<Claim> findByEmployeeIdOrderByCreatedAtDesc(Long employeeId);

    List<Claim> findByCompanyIdAndStatusAndApprovalLevelIn(Long companyId, RequestStatus status, Collection<Integer> levels);
}
