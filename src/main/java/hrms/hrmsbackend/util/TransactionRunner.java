package hrms.hrmsbackend.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * 상태 전이용 트랜잭션 실행기.
 * SERIALIZABLE 격리 수준으로 실행하고 직렬화 충돌 시 1회만 재시도한다.
 */
@Slf4j
@Component
public class TransactionRunner {

    private static final int MAX_ATTEMPTS = 2;

    private final TransactionTemplate transactionTemplate;

    public TransactionRunner(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_SERIALIZABLE);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
    }

    public <T> T inSerializable(String operation, Supplier<T> work) {
        ConcurrencyFailureException lastFailure = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (ConcurrencyFailureException e) {
                lastFailure = e;
                log.warn("{} 직렬화 충돌 (시도 {}/{}): {}", operation, attempt, MAX_ATTEMPTS, e.getMessage());
            }
        }
        throw lastFailure;
    }

    public void runSerializable(String operation, Runnable work) {
        inSerializable(operation, () -> {
            work.run();
            return null;
        });
    }
}
