package storage;

/**
 * 키에 저장될 수 있는 값의 종류
 */
public enum ValueType {
    STRING("string"),
    HASH("hash"),
    LIST("list");

    private final String typeName;

    ValueType(String typeName) {
        this.typeName = typeName;
    }

    /**
     * TYPE 명령어가 돌려주는 이름
     */
    public String typeName() {
        return typeName;
    }
}
