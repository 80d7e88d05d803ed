package storage;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * 저장소의 한 항목. 값과 절대 만료 시각(ms)을 가집니다.
 * 같은 키라도 새로 쓰일 때마다 새 인스턴스가 만들어지며, 인스턴스 동일성으로 비교합니다.
 */
@Getter(AccessLevel.PACKAGE)
final class StoredEntry {

    static final long NO_EXPIRY = -1L;

    private final StoredValue value;
    private final long expiresAt;

    StoredEntry(StoredValue value, long expiresAt) {
        this.value = value;
        this.expiresAt = expiresAt;
    }

    boolean hasExpiry() {
        return expiresAt != NO_EXPIRY;
    }

    /**
     * lazy 검사와 백그라운드 sweep 이 함께 사용하는 만료 판정
     */
    boolean isExpired(long now) {
        return hasExpiry() && now > expiresAt;
    }
}
