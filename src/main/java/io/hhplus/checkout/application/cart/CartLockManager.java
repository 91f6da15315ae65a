package io.hhplus.checkout.application.cart;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 사용자별 로컬 락 매니저.
 * 동일 userId에 대한 장바구니 변경과 주문 생성을 직렬화한다.
 *
 * 락은 트랜잭션 바깥에서 잡아야 한다 (커밋 이후 해제).
 * 호출 측은 @Transactional 메서드를 supplier 안에서 호출한다.
 *
 * 락 항목은 참조 카운트로 관리한다. 대기 중인 스레드까지 포함해 사용자가
 * 0이 되는 순간에만 맵에서 지우므로, 같은 userId에 대해 항상 하나의 락만 존재한다.
 */
@Component
public class CartLockManager {

    private final ConcurrentHashMap<Long, LockEntry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Long userId, Supplier<T> supplier) {
        LockEntry entry = acquireEntry(userId);
        entry.lock.lock();
        try {
            return supplier.get();
        } finally {
            entry.lock.unlock();
            releaseEntry(userId);
        }
    }

    public void withLock(Long userId, Runnable runnable) {
        withLock(userId, () -> {
            runnable.run();
            return null;
        });
    }

    /**
     * 현재 유지 중인 락 항목 수 (실행 중 + 대기 중인 사용자)
     */
    int activeLockCount() {
        return locks.size();
    }

    // compute 계열은 키 단위로 원자적이므로 users 증감은 그 안에서만 한다
    private LockEntry acquireEntry(Long userId) {
        return locks.compute(userId, (id, entry) -> {
            LockEntry target = entry != null ? entry : new LockEntry();
            target.users++;
            return target;
        });
    }

    private void releaseEntry(Long userId) {
        locks.computeIfPresent(userId, (id, entry) -> --entry.users == 0 ? null : entry);
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
