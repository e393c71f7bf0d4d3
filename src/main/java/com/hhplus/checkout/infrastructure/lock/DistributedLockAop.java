package com.hhplus.checkout.infrastructure.lock;

import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.SystemException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.core.Ordered;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * 분산락 AOP 처리 (TransactionSynchronization 기반)
 *
 * 실행 순서:
 * 1. Lock 획득 (@Transactional보다 먼저 실행되도록 우선순위를 높게 둠)
 * 2. @Transactional 시작 → 비즈니스 로직 → 커밋/롤백
 * 3. 트랜잭션 완료 후 Lock 해제 (afterCompletion)
 *
 * 트랜잭션이 없는 메서드는 finally 블록에서 바로 해제합니다.
 */
@Aspect
@Component
@Slf4j
@RequiredArgsConstructor
@org.springframework.core.annotation.Order(Ordered.LOWEST_PRECEDENCE - 1000)
public class DistributedLockAop implements Ordered {

    private final RedissonClient redissonClient;
    private final ExpressionParser expressionParser = new SpelExpressionParser();

    @Around("@annotation(distributedLock)")
    public Object around(ProceedingJoinPoint joinPoint, DistributedLock distributedLock) throws Throwable {
        String dynamicKey = generateKey(joinPoint, distributedLock.key());
        RLock rLock = redissonClient.getLock(dynamicKey);

        boolean lockAcquired = false;
        boolean releaseOnCompletion = false;
        try {
            lockAcquired = rLock.tryLock(
                    distributedLock.waitTime(),
                    distributedLock.leaseTime(),
                    distributedLock.timeUnit()
            );

            if (!lockAcquired) {
                log.warn("[DistributedLock] 락 획득 실패 - key={}", dynamicKey);
                throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, "key=" + dynamicKey);
            }

            log.debug("[DistributedLock] 락 획득 - key={}", dynamicKey);

            if (TransactionSynchronizationManager.isSynchronizationActive()) {
                TransactionSynchronizationManager.registerSynchronization(
                        new LockReleaseSynchronization(rLock, dynamicKey)
                );
                releaseOnCompletion = true;
            }

            return joinPoint.proceed();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[DistributedLock] 락 대기 중 스레드 인터럽트 - key={}", dynamicKey, e);
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, e);

        } finally {
            if (lockAcquired && !releaseOnCompletion && rLock.isHeldByCurrentThread()) {
                try {
                    rLock.unlock();
                    log.debug("[DistributedLock] 락 해제 (non-transactional) - key={}", dynamicKey);
                } catch (Exception unlockError) {
                    log.error("[DistributedLock] 락 해제 중 오류 발생 - key={}", dynamicKey, unlockError);
                }
            }
        }
    }

    /**
     * 트랜잭션이 커밋되거나 롤백된 후 Lock을 해제
     */
    private static class LockReleaseSynchronization implements TransactionSynchronization {
        private final RLock rLock;
        private final String lockKey;

        LockReleaseSynchronization(RLock rLock, String lockKey) {
            this.rLock = rLock;
            this.lockKey = lockKey;
        }

        @Override
        public void afterCompletion(int status) {
            try {
                if (rLock.isHeldByCurrentThread()) {
                    rLock.unlock();
                    String statusString = switch (status) {
                        case STATUS_COMMITTED -> "COMMITTED";
                        case STATUS_ROLLED_BACK -> "ROLLED_BACK";
                        default -> "UNKNOWN";
                    };
                    log.debug("[DistributedLock] 락 해제 (status={}) - key={}", statusString, lockKey);
                }
            } catch (Exception e) {
                log.error("[DistributedLock] 락 해제 중 오류 발생 - key={}", lockKey, e);
            }
        }
    }

    /**
     * Spring EL로 동적 키 생성
     *
     * 예: "'cart:' + #p0.lockKey()" → "cart:user:10"
     */
    private String generateKey(ProceedingJoinPoint joinPoint, String keyPattern) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Object[] args = joinPoint.getArgs();

        EvaluationContext context = new StandardEvaluationContext();
        for (int i = 0; i < args.length; i++) {
            context.setVariable("p" + i, args[i]);
        }
        context.setVariable("args", args);

        try {
            return expressionParser.parseExpression(keyPattern).getValue(context, String.class);
        } catch (Exception e) {
            log.error("[DistributedLock] 동적 키 생성 실패 - method={}, pattern={}",
                    signature.getMethod().getName(), keyPattern, e);
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, "잘못된 락 키 패턴: " + keyPattern);
        }
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE - 1000;
    }
}
