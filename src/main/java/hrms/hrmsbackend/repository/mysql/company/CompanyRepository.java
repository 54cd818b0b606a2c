package hrms.hrmsbackend.repository.mysql.company;

import hrms.hrmsbackend.entity.mysql.company.Company;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CompanyRepository extends JpaRepository<Company, Long> {

    // 회사 설정은 거의 바뀌지 않으므로 캐시 사용
    @Cacheable(value = "companyCache", key = "#id")
    @Query("SELECT c FROM Company c WHERE c.id = :id")
    Optional<Company> findCachedById(@Param("id") Long id);
}
