package hrms.hrmsbackend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JacksonConfig 단위 테스트")
class JacksonConfigTest {

    @Test
    @DisplayName("날짜/시간은 ISO-8601 문자열로 직렬화된다")
    void writesIsoDates() throws Exception {
        Jackson2ObjectMapperBuilder builder = new Jackson2ObjectMapperBuilder();
        new JacksonConfig().jacksonCustomizer(new EssPolicyProperties()).customize(builder);
        ObjectMapper mapper = builder.build();

        String json = mapper.writeValueAsString(Map.of(
                "date", LocalDate.of(2025, 6, 2),
                "at", LocalDateTime.of(2025, 6, 2, 9, 30),
                "shiftStart", LocalTime.of(9, 0)));

        assertThat(json)
                .contains("\"date\":\"2025-06-02\"")
                .contains("\"at\":\"2025-06-02T09:30:00\"")
                .contains("\"shiftStart\":\"09:00:00\"");
        assertThat(mapper.readValue("\"2025-06-14\"", LocalDate.class)).isEqualTo(LocalDate.of(2025, 6, 14));
    }
}
