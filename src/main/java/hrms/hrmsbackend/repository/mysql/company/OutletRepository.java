package hrms.hrmsbackend.repository.mysql.company;

import hrms.hrmsbackend.entity.mysql.company.Outlet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OutletRepository extends JpaRepository<Outlet, Long> {

    List<Outlet> findByCompanyId(Long companyId);
}
