package storage;

import java.util.regex.Pattern;

/**
 * KEYS 명령어에서 사용하는 glob 패턴을 정규식으로 변환합니다.
 * 지원: {@code *}, {@code ?}, {@code [abc]}, {@code [^a]}, {@code [a-z]}, {@code \} 이스케이프
 */
final class GlobPattern {

    private GlobPattern() {
    }

    static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
                case '*':
                    regex.append(".*");
                    break;
                case '?':
                    regex.append('.');
                    break;
                case '\\':
                    if (i + 1 < glob.length()) {
                        i++;
                        regex.append(Pattern.quote(String.valueOf(glob.charAt(i))));
                    } else {
                        regex.append(Pattern.quote("\\"));
                    }
                    break;
                case '[':
                    int close = glob.indexOf(']', i + 1);
                    if (close < 0) {
                        // unterminated class is taken literally
                        regex.append(Pattern.quote("["));
                        break;
                    }
                    regex.append(characterClass(glob.substring(i + 1, close)));
                    i = close;
                    break;
                default:
                    regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static String characterClass(String body) {
        StringBuilder cls = new StringBuilder("[");
        int start = 0;
        if (body.startsWith("^")) {
            cls.append('^');
            start = 1;
        }
        for (int j = start; j < body.length(); j++) {
            char c = body.charAt(j);
            if (c == '-' && j > start && j < body.length() - 1) {
                cls.append('-');
            } else if (Character.isLetterOrDigit(c)) {
                cls.append(c);
            } else {
                cls.append('\\').append(c);
            }
        }
        if (cls.length() == 1 || (cls.length() == 2 && cls.charAt(1) == '^')) {
            // empty class never matches
            return "(?!)";
        }
        return cls.append(']').toString();
    }
}
