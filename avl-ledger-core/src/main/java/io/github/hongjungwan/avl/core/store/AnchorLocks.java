package io.github.hongjungwan.avl.core.store;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Anchor별 배타 락. 사용 중인 락은 강참조로 유지되고, 아무도 쓰지 않는 락은 GC 대상이 된다.
 * 서로 다른 anchor는 완전히 병렬로 진행된다.
 */
public final class AnchorLocks {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(anchorId -> new ReentrantLock());

    public ReentrantLock lockFor(String anchorId) {
        return locks.get(anchorId);
    }
}
