package hrms.hrmsbackend.entity.mysql.schedule;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(name = "public_holiday", indexes = @Index(name = "idx_public_holiday_date", columnList = "holiday_date"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PublicHoliday {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "holiday_date", nullable = false)
    private LocalDate date;

    @Column(name = "name", length = 100)
    private String name;

    @Column(name = "company_id")
    private Long companyId; // null = 전 회사 공통
}
