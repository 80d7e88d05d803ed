package command;

/**
 * 명령어 인자 개수 검증기. 인자 개수에는 명령어 이름이 포함되지 않습니다.
 */
@FunctionalInterface
public interface Arity {

    boolean accepts(int argCount);

    static Arity exactly(int count) {
        return argCount -> argCount == count;
    }

    static Arity atLeast(int min) {
        return argCount -> argCount >= min;
    }

    static Arity between(int min, int max) {
        return argCount -> argCount >= min && argCount <= max;
    }

    static Arity any() {
        return argCount -> true;
    }

    /**
     * key 하나 뒤에 (field, value) 쌍이 하나 이상 오는 형태
     */
    static Arity keyAndPairs() {
        return argCount -> argCount >= 3 && argCount % 2 == 1;
    }
}
