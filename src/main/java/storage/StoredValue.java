package storage;

import java.util.ArrayDeque;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 키에 저장되는 값. string, hash, list 세 종류로 닫혀 있습니다.
 * 다른 종류로 접근하면 {@link WrongTypeException} 이 발생합니다.
 */
abstract class StoredValue {

    private StoredValue() {
    }

    abstract ValueType type();

    String asString() {
        throw new WrongTypeException();
    }

    ConcurrentHashMap<String, String> asHash() {
        throw new WrongTypeException();
    }

    ArrayDeque<String> asList() {
        throw new WrongTypeException();
    }

    static StoredValue ofString(String content) {
        return new StringValue(content);
    }

    static StoredValue newHash() {
        return new HashValue();
    }

    static StoredValue newList() {
        return new ListValue();
    }

    static final class StringValue extends StoredValue {
        private final String content;

        private StringValue(String content) {
            this.content = content;
        }

        @Override
        ValueType type() {
            return ValueType.STRING;
        }

        @Override
        String asString() {
            return content;
        }
    }

    static final class HashValue extends StoredValue {
        // reads are lock-free, writes happen inside the owning key's compute()
        private final ConcurrentHashMap<String, String> fields = new ConcurrentHashMap<>();

        @Override
        ValueType type() {
            return ValueType.HASH;
        }

        @Override
        ConcurrentHashMap<String, String> asHash() {
            return fields;
        }
    }

    static final class ListValue extends StoredValue {
        // only touched inside the owning key's compute()
        private final ArrayDeque<String> items = new ArrayDeque<>();

        @Override
        ValueType type() {
            return ValueType.LIST;
        }

        @Override
        ArrayDeque<String> asList() {
            return items;
        }
    }
}
